package org.stianloader.picolock.test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.picolock.DependencyId;
import org.stianloader.picolock.DependencyLock;
import org.stianloader.picolock.LockFile;
import org.stianloader.picolock.LockFileException;
import org.stianloader.picolock.logging.LoggingAdapter;

public class LockFileTest {

    private static final String REACT_INTEGRITY = "sha1-MmFhZTZjMzVjOTRmY2ZiNDE1ZGJlOTVmNDA4YjljZTkxZWU4NDZlZA==";

    @TempDir
    Path tempDir;

    private static DependencyLock lock(String name, String version) {
        return new DependencyLock(name, version, "https://registry.npmjs.org/" + name + "/-/" + name + "-" + version + ".tgz", LockFileTest.REACT_INTEGRITY);
    }

    private static final class RecordingLogger extends LoggingAdapter {
        private final List<String> records = new ArrayList<>();

        @Override
        public void debug(Class<?> clazz, String message, Object... args) {
            this.records.add("DEBUG " + message);
        }

        @Override
        public void error(Class<?> clazz, String message, Object... args) {
            this.records.add("ERROR " + message);
        }

        @Override
        public void info(Class<?> clazz, String message, Object... args) {
            this.records.add("INFO " + message);
        }

        @Override
        public void warn(Class<?> clazz, String message, Object... args) {
            this.records.add("WARN " + message);
        }
    }

    @Test
    public void testNewDoesNotTouchDisk() {
        Path path = this.tempDir.resolve("volt.lock");
        LockFile lockFile = new LockFile(path);
        assertEquals(0, lockFile.size());
        assertSame(path, lockFile.getPath());
        assertFalse(Files.exists(path));
    }

    @Test
    public void testForProject() {
        LockFile lockFile = LockFile.forProject(this.tempDir);
        assertEquals(this.tempDir.resolve(LockFile.DEFAULT_FILE_NAME), lockFile.getPath());
        assertFalse(Files.exists(lockFile.getPath()));
    }

    @Test
    public void testAddReplaces() {
        LockFile lockFile = new LockFile(this.tempDir.resolve("volt.lock"));
        DependencyId id = new DependencyId("react", "^17.0.0");
        DependencyLock first = lock("react", "17.0.1");
        DependencyLock second = lock("react", "17.0.2");

        assertNull(lockFile.add(id, first));
        assertSame(first, lockFile.add(DependencyId.parse("react@^17.0.0"), second));
        assertEquals(1, lockFile.size());
        assertSame(second, lockFile.get(id));
        assertTrue(lockFile.contains(id));
    }

    @Test
    public void testDependenciesViewIsReadOnly() {
        LockFile lockFile = new LockFile(this.tempDir.resolve("volt.lock"));
        assertThrows(UnsupportedOperationException.class, () -> lockFile.getDependencies().put(new DependencyId("a", "1"), lock("a", "1.0.0")));
    }

    @Test
    public void testSaveFormat() throws LockFileException, IOException {
        LockFile lockFile = new LockFile(this.tempDir.resolve("volt.lock"));
        lockFile.add(new DependencyId("react", "^17.0.0"), lock("react", "17.0.2"));
        lockFile.add(new DependencyId("loose-envify", "^1.1.0"), lock("loose-envify", "1.4.0"));
        lockFile.save();

        String expected = "{\n"
                + "  \"loose-envify@^1.1.0\": {\n"
                + "    \"name\": \"loose-envify\",\n"
                + "    \"version\": \"1.4.0\",\n"
                + "    \"tarball\": \"https://registry.npmjs.org/loose-envify/-/loose-envify-1.4.0.tgz\",\n"
                + "    \"sha1\": \"" + LockFileTest.REACT_INTEGRITY + "\"\n"
                + "  },\n"
                + "  \"react@^17.0.0\": {\n"
                + "    \"name\": \"react\",\n"
                + "    \"version\": \"17.0.2\",\n"
                + "    \"tarball\": \"https://registry.npmjs.org/react/-/react-17.0.2.tgz\",\n"
                + "    \"sha1\": \"" + LockFileTest.REACT_INTEGRITY + "\"\n"
                + "  }\n"
                + "}";
        assertEquals(expected, new String(Files.readAllBytes(lockFile.getPath()), StandardCharsets.UTF_8));
    }

    @Test
    public void testSaveEmpty() throws LockFileException, IOException {
        LockFile lockFile = new LockFile(this.tempDir.resolve("volt.lock"));
        lockFile.save();
        assertEquals("{}", new String(Files.readAllBytes(lockFile.getPath()), StandardCharsets.UTF_8));
        assertEquals(0, LockFile.load(lockFile.getPath()).size());
    }

    @Test
    public void testSaveTruncates() throws LockFileException, IOException {
        Path path = this.tempDir.resolve("volt.lock");
        Files.write(path, new byte[4096]);
        new LockFile(path).save();
        assertEquals(2, Files.size(path));
    }

    @Test
    public void testOrderIndependence() throws LockFileException, IOException {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < 64; i++) {
            names.add("package-" + i);
        }

        LockFile forward = new LockFile(this.tempDir.resolve("forward.lock"));
        for (String name : names) {
            forward.add(new DependencyId(name, "^1.0.0"), lock(name, "1.0.0"));
        }

        Collections.reverse(names);
        LockFile reversed = new LockFile(this.tempDir.resolve("reversed.lock"));
        for (String name : names) {
            reversed.add(new DependencyId(name, "^1.0.0"), lock(name, "1.0.0"));
        }

        Collections.shuffle(names);
        LockFile loaded = new LockFile(this.tempDir.resolve("shuffled.lock"));
        for (String name : names) {
            loaded.add(new DependencyId(name, "^1.0.0"), lock("outdated", "0.0.1"));
            loaded.add(new DependencyId(name, "^1.0.0"), lock(name, "1.0.0"));
        }

        forward.save();
        reversed.save();
        loaded.save();
        byte[] expected = Files.readAllBytes(forward.getPath());
        assertArrayEquals(expected, Files.readAllBytes(reversed.getPath()));
        assertArrayEquals(expected, Files.readAllBytes(loaded.getPath()));
    }

    @Test
    public void testPersistenceRoundTrip() throws LockFileException {
        LockFile lockFile = new LockFile(this.tempDir.resolve("volt.lock"));
        lockFile.add(new DependencyId("@babel/core", "^7.0.0"), lock("@babel/core", "7.20.12"));
        lockFile.add(new DependencyId("alias", "npm:react@^17.0.0"), lock("react", "17.0.2"));
        lockFile.add(new DependencyId("left-pad", "*"), lock("left-pad", "1.3.0"));
        lockFile.save();

        LockFile loaded = LockFile.load(lockFile.getPath());
        assertEquals(lockFile.getDependencies(), loaded.getDependencies());
        assertEquals(lockFile.getPath(), loaded.getPath());
    }

    @Test
    public void testLoadAcceptsUnsortedInput() throws LockFileException, IOException {
        Path path = this.tempDir.resolve("volt.lock");
        Files.write(path, ("{\"z@1\": {\"name\": \"z\", \"version\": \"1.0.0\", \"tarball\": \"t\", \"sha1\": \"\", \"extra\": true},"
                + " \"a@1\": {\"sha1\": \"\", \"tarball\": \"t\", \"version\": \"1.0.0\", \"name\": \"a\"}}").getBytes(StandardCharsets.UTF_8));

        LockFile lockFile = LockFile.load(path);
        assertEquals(2, lockFile.size());
        assertEquals("1.0.0", lockFile.get(DependencyId.parse("z@1")).version());
        assertEquals("a", lockFile.get(DependencyId.parse("a@1")).name());

        lockFile.save();
        String saved = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        assertTrue(saved.indexOf("\"a@1\"") < saved.indexOf("\"z@1\""));
        assertFalse(saved.contains("extra"));
    }

    @Test
    public void testLoadMissingFile() {
        Path path = this.tempDir.resolve("missing.lock");
        LockFileException e = assertThrows(LockFileException.class, () -> LockFile.load(path));
        assertEquals(LockFileException.Kind.IO, e.getKind());
        assertEquals(path, e.getPath());
    }

    @Test
    public void testLoadDirectory() {
        LockFileException e = assertThrows(LockFileException.class, () -> LockFile.load(this.tempDir));
        assertEquals(LockFileException.Kind.IO, e.getKind());
    }

    @Test
    public void testLoadMalformed() throws IOException {
        String[] contents = {
            "",
            "{",
            "not json",
            "null",
            "[]",
            "42",
            "{} {}",
            "{\"react\": {\"name\": \"react\", \"version\": \"1.0.0\", \"tarball\": \"t\", \"sha1\": \"\"}}",
            "{\"react@1\": {\"name\": \"react\", \"version\": \"1.0.0\", \"tarball\": \"t\"}}",
            "{\"react@1\": {\"name\": \"react\", \"version\": \"^1.0.0\", \"tarball\": \"t\", \"sha1\": \"\"}}",
            "{\"react@1\": {\"name\": \"react\", \"version\": null, \"tarball\": \"t\", \"sha1\": \"\"}}",
            "{\"react@1\": null}"
        };

        Path path = this.tempDir.resolve("volt.lock");
        for (String content : contents) {
            Files.write(path, content.getBytes(StandardCharsets.UTF_8));
            LockFileException e = assertThrows(LockFileException.class, () -> LockFile.load(path), content);
            assertEquals(LockFileException.Kind.DECODE, e.getKind(), content);
        }
    }

    @Test
    public void testLoadOrCreate() throws LockFileException, IOException {
        Path path = this.tempDir.resolve("volt.lock");
        LockFile created = LockFile.loadOrCreate(path);
        assertEquals(0, created.size());
        assertFalse(Files.exists(path));

        created.add(new DependencyId("react", "^17.0.0"), lock("react", "17.0.2"));
        created.save();
        assertEquals(1, LockFile.loadOrCreate(path).size());

        Files.write(path, "{".getBytes(StandardCharsets.UTF_8));
        LockFileException e = assertThrows(LockFileException.class, () -> LockFile.loadOrCreate(path));
        assertEquals(LockFileException.Kind.DECODE, e.getKind());
    }

    @Test
    public void testSaveIntoMissingDirectory() {
        LockFile lockFile = new LockFile(this.tempDir.resolve("absent").resolve("volt.lock"));
        LoggingAdapter previous = LoggingAdapter.getDefaultLogger();
        RecordingLogger logger = new RecordingLogger();
        LoggingAdapter.setDefaultLogger(logger);
        try {
            LockFileException e = assertThrows(LockFileException.class, lockFile::save);
            assertEquals(LockFileException.Kind.IO, e.getKind());
        } finally {
            LoggingAdapter.setDefaultLogger(previous);
        }
        assertEquals(1, logger.records.size());
        assertTrue(logger.records.get(0).startsWith("WARN Unable to create lock file"), logger.records.get(0));
    }

    @Test
    public void testSaveKeepsPackagesSharingAPrefixInNameOrder() throws LockFileException, IOException {
        Path path = this.tempDir.resolve("volt.lock");
        String content = "{\n"
                + "  \"react@^17.0.0\": {\n"
                + "    \"name\": \"react\",\n"
                + "    \"version\": \"17.0.2\",\n"
                + "    \"tarball\": \"https://registry.npmjs.org/react/-/react-17.0.2.tgz\",\n"
                + "    \"sha1\": \"" + LockFileTest.REACT_INTEGRITY + "\"\n"
                + "  },\n"
                + "  \"react-dom@^17.0.0\": {\n"
                + "    \"name\": \"react-dom\",\n"
                + "    \"version\": \"17.0.2\",\n"
                + "    \"tarball\": \"https://registry.npmjs.org/react-dom/-/react-dom-17.0.2.tgz\",\n"
                + "    \"sha1\": \"" + LockFileTest.REACT_INTEGRITY + "\"\n"
                + "  }\n"
                + "}";
        Files.write(path, content.getBytes(StandardCharsets.UTF_8));

        LockFile.load(path).save();
        assertEquals(content, new String(Files.readAllBytes(path), StandardCharsets.UTF_8));

        LockFile rebuilt = new LockFile(path);
        rebuilt.add(new DependencyId("react-dom", "^17.0.0"), lock("react-dom", "17.0.2"));
        rebuilt.add(new DependencyId("react", "^17.0.0"), lock("react", "17.0.2"));
        rebuilt.save();
        assertEquals(content, new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }
}
