package org.stianloader.picolock.internal;

import java.io.IOException;

import org.jetbrains.annotations.NotNull;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Jackson configuration for the lock file format.
 *
 * <p>The output layout is pinned down independently of the platform: two spaces of
 * indentation, '\n' line breaks, {@code "key": value} and {@code {}} for empty objects.
 * Map entries are written in iteration order, so ordering is the responsibility of
 * the serialized value.
 */
public final class LockFileJson {

    static final class LockFilePrettyPrinter extends DefaultPrettyPrinter {
        private static final long serialVersionUID = 1L;

        LockFilePrettyPrinter() {
            this.indentObjectsWith(new DefaultIndenter("  ", "\n"));
            this.indentArraysWith(new DefaultIndenter("  ", "\n"));
        }

        LockFilePrettyPrinter(@NotNull LockFilePrettyPrinter base) {
            super(base);
        }

        @Override
        public LockFilePrettyPrinter createInstance() {
            return new LockFilePrettyPrinter(this);
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
            if (!this._objectIndenter.isInline()) {
                this._nesting--;
            }
            if (nrOfEntries > 0) {
                this._objectIndenter.writeIndentation(g, this._nesting);
            }
            g.writeRaw('}');
        }
    }

    @NotNull
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    @NotNull
    private static final ObjectWriter WRITER = LockFileJson.MAPPER.writer(new LockFilePrettyPrinter());

    private LockFileJson() {
        throw new AssertionError();
    }

    @NotNull
    public static <T> ObjectReader reader(@NotNull Class<T> type) {
        return LockFileJson.MAPPER.readerFor(type);
    }

    @NotNull
    public static ObjectWriter writer() {
        return LockFileJson.WRITER;
    }
}
