package cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class CodeflowCliTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outBuffer;
    private ByteArrayOutputStream errBuffer;

    @BeforeEach
    void setUp() {
        outBuffer = new ByteArrayOutputStream();
        errBuffer = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        PrintStream out = new PrintStream(outBuffer, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBuffer, true, StandardCharsets.UTF_8);
        CodeflowCli cli = new CodeflowCli(out, err, new CodeflowConfig(new Properties()));
        return CodeflowCli.commandLine(cli).execute(args);
    }

    private String out() {
        return outBuffer.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBuffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testInlineSourceDefaultsToDataFlow() {
        int exitCode = run("--source", "z = x + 1;");

        assertEquals(0, exitCode);
        assertTrue(out().startsWith("flowchart TD\n    subgraph main"), out());
        assertTrue(out().contains("v1(\"x + 1\")"));
    }

    @Test
    void testControlFlowOfFile() throws IOException {
        Path file = tempDir.resolve("Branch.java");
        Files.writeString(file, "if (x > 0) { y = 1; } else { y = 2; }", StandardCharsets.UTF_8);

        int exitCode = run("--type", "cfg", "--hide-hidden", file.toString());

        assertEquals(0, exitCode);
        assertTrue(err().contains(file.toString()), "File name is echoed to stderr");
        assertTrue(out().contains("p1 -->|True| p3"), out());
        assertFalse(out().contains("p2(\" \")"));
    }

    @Test
    void testExcludeStartStop() {
        int exitCode = run("--type", "CFG", "--exclude-start-stop", "--source", "a = 1;");

        assertEquals(0, exitCode);
        assertFalse(out().contains("start"));
        assertFalse(out().contains("stop"));
    }

    @Test
    void testJsonFormat() {
        int exitCode = run("--format", "json", "--source", "f(a);");

        assertEquals(0, exitCode);
        assertTrue(out().contains("\"kind\": \"dfg\""), out());
    }

    @Test
    void testVerbosePrintsNodeTable() {
        int exitCode = run("--verbose", "--source", "f(a);");

        assertEquals(0, exitCode);
        assertTrue(err().contains("main"));
        assertTrue(err().contains("preds"));
    }

    @Test
    void testPrintAst() {
        int exitCode = run("--print-ast", "--source", "x = 1;");

        assertEquals(0, exitCode);
        assertTrue(err().contains("BlockStmt"));
    }

    @Test
    void testParseErrorFailsButContinues() throws IOException {
        Path bad = tempDir.resolve("Bad.java");
        Path good = tempDir.resolve("Good.java");
        Files.writeString(bad, "int = ;", StandardCharsets.UTF_8);
        Files.writeString(good, "a = 1;", StandardCharsets.UTF_8);

        int exitCode = run(bad.toString(), good.toString());

        assertEquals(1, exitCode);
        assertTrue(err().contains("error: " + bad), err());
        assertTrue(out().contains("v1(\"a\")"), "The good file is still rendered");
    }

    @Test
    void testMissingFileFails() {
        int exitCode = run(tempDir.resolve("missing.java").toString());

        assertEquals(1, exitCode);
        assertTrue(err().contains("cannot read"));
    }

    @Test
    void testInvalidOptionValue() {
        assertEquals(2, run("--type", "ast", "--source", "a = 1;"));
    }
}
