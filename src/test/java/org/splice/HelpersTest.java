package org.splice;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class HelpersTest {

    @TempDir
    Path tmp;

    @Test
    void sha1IsHexOfTheDigest() {
        assertEquals("a9993e364706816aba3e25717850c26c9cd0d89d",
                Helpers.sha1("abc".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void rustFilesAreKeyedByRelativePath() throws IOException {
        Files.createDirectories(tmp.resolve("a/b"));
        Files.writeString(tmp.resolve("a/b/x.rs"), "");
        Files.writeString(tmp.resolve("y.rs"), "");
        Files.writeString(tmp.resolve("z.txt"), "");

        Map<String, Path> files = Helpers.listRustFiles(tmp);
        assertEquals(List.of("a/b/x.rs", "y.rs"), List.copyOf(files.keySet()));
        assertThrows(IOException.class, () -> Helpers.listRustFiles(tmp.resolve("z.txt")));
    }

    @Test
    void writeSourceCreatesParents() throws IOException {
        Path file = tmp.resolve("deep/dir/f.rs");
        Helpers.writeSource(file, "fn f() {}");
        assertEquals("fn f() {}", Helpers.readSource(file));
    }

    @Test
    void oneLineEscapesLayout() {
        assertEquals("a\\n\\tb\\\\c", Helpers.oneLine("a\n\tb\\c"));
    }
}
