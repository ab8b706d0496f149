package com.shellast.tool;

import com.shellast.ast.CallExpr;
import com.shellast.ast.File;
import com.shellast.ast.Lit;
import com.shellast.ast.Pos;
import com.shellast.ast.Redirect;
import com.shellast.ast.Stmt;
import com.shellast.ast.Token;
import com.shellast.ast.Word;
import com.shellast.jackson.JacksonAstJsonProvider;
import com.shellast.jackson.JacksonLoggingConfig;
import com.shellast.jackson.TreeFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class RenderToolTest extends JacksonLoggingConfig {

    @TempDir
    Path tmp;

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int run(String... args) throws Exception {
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        RenderTool.Config config = RenderTool.Config.parse(args, err);
        assertNotNull(config, errBytes.toString(StandardCharsets.UTF_8));
        RenderTool tool = new RenderTool(config, new JacksonAstJsonProvider(),
            new PrintStream(outBytes, true, StandardCharsets.UTF_8), err);
        return tool.run();
    }

    private Path writeTree(String name) throws Exception {
        Path path = tmp.resolve(name);
        Files.writeString(path, TreeFixtures.tree(name));
        return path;
    }

    @Test
    void testParseDefaults() {
        RenderTool.Config config = RenderTool.Config.parse(new String[]{"a.json"}, System.err);
        assertNotNull(config);
        assertEquals(RenderTool.Mode.RENDER, config.mode());
        assertEquals(List.of("json"), config.extensions());
        assertNull(config.outputDir());
        assertFalse(config.verbose());
        assertEquals(List.of(Path.of("a.json")), config.inputs());
    }

    @Test
    void testParseOptions() {
        RenderTool.Config config = RenderTool.Config.parse(
            new String[]{"--mode=check", "--extensions=json,ast", "-v", "--output-dir=out", "trees"}, System.err);
        assertNotNull(config);
        assertEquals(RenderTool.Mode.CHECK, config.mode());
        assertEquals(List.of("json", "ast"), config.extensions());
        assertEquals(Path.of("out"), config.outputDir());
        assertTrue(config.verbose());
    }

    @Test
    void testParseRejectsBadArguments() {
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        assertNull(RenderTool.Config.parse(new String[]{"--mode=fast", "a.json"}, err));
        assertNull(RenderTool.Config.parse(new String[]{"--bogus", "a.json"}, err));
        assertNull(RenderTool.Config.parse(new String[]{}, err));
        assertNull(RenderTool.Config.parse(new String[]{"--help"}, err));
        String messages = errBytes.toString(StandardCharsets.UTF_8);
        assertTrue(messages.contains("Invalid mode: FAST"));
        assertTrue(messages.contains("Unknown option: --bogus"));
        assertTrue(messages.contains("No input files"));
    }

    @Test
    void testRenderToStdout() throws Exception {
        Path tree = writeTree("loop.json");
        assertEquals(0, run(tree.toString()));
        assertEquals("for f in *.txt; do wc -l \"$f\" 2>&1; done" + System.lineSeparator(),
            outBytes.toString(StandardCharsets.UTF_8));
    }

    @Test
    void testRenderToOutputDir() throws Exception {
        Path tree = writeTree("heredoc.json");
        Path out = tmp.resolve("out");
        assertEquals(0, run("--output-dir=" + out, tree.toString()));

        Path script = out.resolve("greet.sh");
        assertTrue(Files.exists(script));
        assertEquals("cat <<EOF\necho done &\n", Files.readString(script));
    }

    @Test
    void testCheckDirectory() throws Exception {
        writeTree("heredoc.json");
        writeTree("loop.json");
        Files.writeString(tmp.resolve("notes.txt"), "ignored");

        assertEquals(0, run("--mode=check", tmp.toString()));
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("Processed 2 files, 0 failed"));
    }

    @Test
    void testBrokenTreeFails() throws Exception {
        writeTree("loop.json");
        Path broken = writeTree("broken.json");

        assertEquals(1, run("--mode=check", tmp.toString()));
        String err = errBytes.toString(StandardCharsets.UTF_8);
        assertTrue(err.contains("FAIL " + broken), err);
        assertTrue(err.contains("Processed 2 files, 1 failed"), err);
    }

    @Test
    void testInvalidJsonFails() throws Exception {
        Path bad = tmp.resolve("bad.json");
        Files.writeString(bad, "[1, 2");
        assertEquals(1, run(bad.toString()));
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("Failed to deserialize File"));
    }

    @Test
    void testOutputName() {
        assertEquals("greet.sh", RenderTool.outputName(Path.of("x/tree.json"), new File("scripts/greet.sh", List.of())));
        assertEquals("tree.sh", RenderTool.outputName(Path.of("x/tree.json"), new File(List.of())));
    }

    @Test
    void testHelpIsRecognised() {
        assertTrue(RenderTool.Config.wantsHelp(new String[]{"a.json", "--help"}));
        assertTrue(RenderTool.Config.wantsHelp(new String[]{"-h"}));
        assertFalse(RenderTool.Config.wantsHelp(new String[]{"--mode=check", "a.json"}));
    }

    @Test
    void testModeParsingIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            RenderTool.Config config = RenderTool.Config.parse(new String[]{"--mode=check", "a.json"}, System.err);
            assertNotNull(config);
            assertEquals(RenderTool.Mode.CHECK, config.mode());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void testMissingFileDoesNotStopTheRun() throws Exception {
        Path missing = tmp.resolve("missing.json");
        Path tree = writeTree("loop.json");

        assertEquals(1, run("--mode=check", missing.toString(), tree.toString()));
        String err = errBytes.toString(StandardCharsets.UTF_8);
        assertTrue(err.contains("FAIL " + missing), err);
        assertTrue(err.contains("Processed 2 files, 1 failed"), err);
    }

    @Test
    void testUnreadableFileDoesNotStopRendering() throws Exception {
        Path garbled = tmp.resolve("a-garbled.json");
        Files.write(garbled, new byte[]{(byte) 0xC3, (byte) 0x28});
        writeTree("loop.json");

        assertEquals(1, run(tmp.toString()));
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("FAIL " + garbled));
        assertTrue(outBytes.toString(StandardCharsets.UTF_8).startsWith("for f in *.txt; do"));
    }

    @Test
    void testTrailingHeredocGetsSingleNewline() throws Exception {
        File file = new File("tail.sh", List.of(
            new Stmt(Pos.UNKNOWN, new CallExpr(new Word(new Lit("cat"))), false, List.of(),
                List.of(new Redirect(Pos.UNKNOWN, Token.HEREDOC, new Word(new Lit("EOF")))), false)));
        assertEquals("cat <<EOF\n", file.render());

        Path tree = tmp.resolve("tail.json");
        Files.writeString(tree, new JacksonAstJsonProvider().getSerializer().serialize(file));
        Path out = tmp.resolve("out");
        assertEquals(0, run("--output-dir=" + out, tree.toString()));
        assertEquals("cat <<EOF\n", Files.readString(out.resolve("tail.sh")));
    }

    @Test
    void testTerminated() {
        assertEquals("a\n", RenderTool.terminated("a", "\n"));
        assertEquals("a\n", RenderTool.terminated("a\n", "\r\n"));
        assertEquals("a\r\n", RenderTool.terminated("a", "\r\n"));
    }
}
