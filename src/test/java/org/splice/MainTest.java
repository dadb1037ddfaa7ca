package org.splice;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class MainTest {

    private static final String OLD = "fn f() {\n    a();\n}\n";
    private static final String NEW = "pub fn f() {\n    a();\n}\n";

    @TempDir
    Path tmp;

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
    private Path oldFile;
    private Path newFile;

    @BeforeEach
    void setUp() throws IOException {
        oldFile = Files.writeString(tmp.resolve("old.rs"), OLD);
        newFile = Files.writeString(tmp.resolve("new.rs"), NEW);
    }

    private int run(String... args) {
        return Main.run(args, new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                new PrintStream(errBytes, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    void printsTheRewrittenText() {
        assertEquals(0, run(oldFile.toString(), newFile.toString()));
        assertEquals(NEW, out());
    }

    @Test
    void writesOutputAndReportFiles() throws IOException {
        Path out = tmp.resolve("result/f.rs");
        Path json = tmp.resolve("f.json");
        assertEquals(0, run(oldFile.toString(), newFile.toString(), "--out", out.toString(),
                "--json", json.toString()));
        assertEquals(NEW, Files.readString(out));
        assertTrue(Files.readString(json).contains("\"status\": \"modified\""));
        assertEquals("", out());
    }

    @Test
    void dumpsBothTrees() {
        assertEquals(0, run(oldFile.toString(), newFile.toString(), "--dump-tree"));
        assertTrue(out().contains(";; old tree"));
        assertTrue(out().contains("(ITEM_FN#"));
    }

    @Test
    void dumpsCompactTrees() {
        assertEquals(0, run(oldFile.toString(), newFile.toString(), "--dump-tree", "--lisp"));
        assertTrue(out().contains("(CRATE#"));
        assertFalse(out().contains("\n  ("));
    }

    @Test
    void optionsAreAccepted() {
        assertEquals(0, run("--no-recovery", "--no-sequence", "--no-layout",
                oldFile.toString(), newFile.toString()));
        assertEquals(NEW, out());
    }

    @Test
    void directoriesProduceAReport() throws IOException {
        Path before = Files.createDirectories(tmp.resolve("before"));
        Path after = Files.createDirectories(tmp.resolve("after"));
        Files.writeString(before.resolve("f.rs"), OLD);
        Files.writeString(after.resolve("f.rs"), NEW);
        Path json = tmp.resolve("report.json");

        assertEquals(0, run(before.toString(), after.toString(), "--json", json.toString()));
        assertTrue(out().startsWith("Splice report written to " + json));
        assertTrue(Files.exists(json));
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertEquals(2, run());
        assertTrue(err().contains("usage"));
        assertEquals(2, run(oldFile.toString(), newFile.toString(), "--bogus"));
        assertEquals(2, run(oldFile.toString(), newFile.toString(), "--out"));
        assertEquals(2, run(oldFile.toString(), tmp.toString()), "file and directory");
    }

    @Test
    void parseErrorExitsWithOne() throws IOException {
        Path broken = Files.writeString(tmp.resolve("broken.rs"), "fn f( {");
        assertEquals(1, run(oldFile.toString(), broken.toString()));
        assertFalse(err().isEmpty());
    }
}
