/**
 * Package computing and checking the integrity strings stored alongside locked dependencies.
 * Everything in here is stateless and safe to use from any thread.
 *
 * <p>Fetching the archives that are digested is not the task of this package.
 */
package org.stianloader.picolock.integrity;
