package org.trypticon.termfst.cli;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class MainTest {
    private Path temp;
    private ByteArrayOutputStream rawOut;
    private ByteArrayOutputStream rawErr;
    private PrintStream out;
    private PrintStream err;
    private int result;

    @Before
    public void setUp() throws Exception {
        temp = Files.createTempFile("corpus", ".txt");
        rawOut = new ByteArrayOutputStream();
        rawErr = new ByteArrayOutputStream();
        out = new PrintStream(rawOut);
        err = new PrintStream(rawErr);
        Files.write(temp, Arrays.asList("apple", "banana", "apply"), StandardCharsets.UTF_8);
    }

    @After
    public void tearDown() throws Exception {
        Files.deleteIfExists(temp);
    }

    @Test
    public void testNoArguments() {
        run();
        assertResult(1);
        assertOutput();
        assertError("usage: termfst <command> <args...>",
                "Available commands:",
                "  help      Prints help for a command",
                "  contains  Tests whether a term is in a corpus",
                "  prefix    Lists the terms starting with a prefix",
                "  fuzzy     Lists the terms within an edit distance of a pattern",
                "  query     Runs a combined query over a corpus",
                "  stats     Shows term and state counts for a corpus",
                "Use termfst help <command> for help on a specific command.");
    }

    @Test
    public void testUnknown() {
        run("pickle");
        assertResult(1);
        assertOutput();
        assertError("Unknown command: pickle",
                "Available commands:",
                "  help      Prints help for a command",
                "  contains  Tests whether a term is in a corpus",
                "  prefix    Lists the terms starting with a prefix",
                "  fuzzy     Lists the terms within an edit distance of a pattern",
                "  query     Runs a combined query over a corpus",
                "  stats     Shows term and state counts for a corpus");
    }

    @Test
    public void testHelp() {
        run("help", "prefix");
        assertResult(0);
        assertOutput();
        assertError("termfst prefix - Lists the terms starting with a prefix",
                "usage: termfst prefix <corpus> <prefix> [limit]",
                "<corpus> is a UTF-8 text file with one term per line. Blank lines are skipped",
                "and each term's value is the line it first appears on.",
                "A limit of 0 lists every match.");
    }

    @Test
    public void testHelp_Query() {
        run("help", "query");
        assertResult(0);
        assertOutput();
        String error = rawErr.toString(StandardCharsets.UTF_8);
        assertTrue(error.startsWith("termfst query - Runs a combined query over a corpus"));
        for (String option : List.of("--prefix=P", "--start=S", "--end=E", "--regex=R",
                "--fuzzy=F", "--distance=D", "--limit=N")) {
            assertTrue(option, error.contains(System.lineSeparator() + "  " + option));
        }
        assertTrue(error.contains("Example: termfst query words.txt --prefix=app --regex=e$ --limit=10"));
    }

    @Test
    public void testHelp_NoCommand() {
        run("help");
        assertResult(0);
        assertOutput();
        assertError("usage: termfst <command> <args...>",
                "Available commands:",
                "  help      Prints help for a command",
                "  contains  Tests whether a term is in a corpus",
                "  prefix    Lists the terms starting with a prefix",
                "  fuzzy     Lists the terms within an edit distance of a pattern",
                "  query     Runs a combined query over a corpus",
                "  stats     Shows term and state counts for a corpus",
                "Use termfst help <command> for help on a specific command.");
    }

    @Test
    public void testHelp_UnknownCommand() {
        run("help", "pickle");
        assertResult(1);
        assertOutput();
        assertTrue(rawErr.toString(StandardCharsets.UTF_8).startsWith("Unknown command: pickle"));
    }

    @Test
    public void testHelpFlag() {
        run("--help", "stats");
        assertResult(0);
        assertOutput();
        assertError("termfst stats - Shows term and state counts for a corpus",
                "usage: termfst stats <corpus> [--verbose]",
                "<corpus> is a UTF-8 text file with one term per line. Blank lines are skipped",
                "and each term's value is the line it first appears on.",
                "  --verbose  log the dictionary build to the error stream");
    }

    @Test
    public void testContains() {
        run("contains", temp.toString(), "apply");
        assertResult(0);
        assertOutput("Found: apply (line 3)");
        assertError();
    }

    @Test
    public void testContains_Missing() {
        run("contains", temp.toString(), "cherry");
        assertResult(1);
        assertOutput("Not found: cherry");
        assertError();
    }

    @Test
    public void testContains_WrongArgumentCount() {
        run("contains", temp.toString());
        assertResult(1);
        assertOutput();
        assertError("usage: termfst contains <corpus> <term>");
    }

    @Test
    public void testContains_InvalidPath() {
        Path invalid = temp.resolveSibling("invalid-" + System.nanoTime());
        run("contains", invalid.toString(), "apple");
        assertResult(1);
        assertOutput();
        assertError("Error loading corpus at: " + invalid,
                "java.nio.file.NoSuchFileException: " + invalid);
    }

    @Test
    public void testPrefix() {
        run("prefix", temp.toString(), "app");
        assertResult(0);
        assertOutput("apple", "apply");
        assertError();
    }

    @Test
    public void testPrefix_Limit() {
        run("prefix", temp.toString(), "app", "1");
        assertResult(0);
        assertOutput("apple");
        assertError();
    }

    @Test
    public void testFuzzy() {
        run("fuzzy", temp.toString(), "appla", "1");
        assertResult(0);
        assertOutput("apple", "apply");
        assertError();
    }

    @Test
    public void testFuzzy_InvalidNumber() {
        run("fuzzy", temp.toString(), "appla", "X");
        assertResult(1);
        assertOutput();
        assertError("Not a number: X");
    }

    @Test
    public void testFuzzy_NegativeNumber() {
        run("fuzzy", temp.toString(), "appla", "-1");
        assertResult(1);
        assertOutput();
        assertError("Must not be negative: -1");
    }

    @Test
    public void testQuery() {
        run("query", temp.toString(), "--prefix=app", "--regex=y$");
        assertResult(0);
        assertOutput("apply");
        assertError();
    }

    @Test
    public void testQuery_RangeAndLimit() {
        run("query", temp.toString(), "--start=applz", "--end=c", "--limit=5");
        assertResult(0);
        assertOutput("banana");
        assertError();
    }

    @Test
    public void testQuery_Fuzzy() {
        run("query", temp.toString(), "--fuzzy=banan", "--distance=1");
        assertResult(0);
        assertOutput("banana");
        assertError();
    }

    @Test
    public void testQuery_InvalidRegex() {
        run("query", temp.toString(), "--regex=[a-");
        assertResult(1);
        assertOutput();
        assertError("Invalid regex: [a-");
    }

    @Test
    public void testQuery_UnknownOption() {
        run("query", temp.toString(), "--bogus=1");
        assertResult(1);
        assertOutput();
        assertError("Unknown option: --bogus=1",
                "usage: termfst query <corpus> [--prefix=P] [--start=S] [--end=E] [--regex=R] [--fuzzy=F] [--distance=D] [--limit=N]");
    }

    @Test
    public void testStats() {
        run("stats", temp.toString());
        assertResult(0);
        assertOutput("Terms: 3",
                "Trie states: 13",
                "Stored states: 11",
                "Space saving: 15.4%");
        assertError();
    }

    @Test
    public void testStats_Verbose() {
        run("stats", temp.toString(), "--verbose");
        assertResult(0);
        assertOutput("Terms: 3",
                "Trie states: 13",
                "Stored states: 11",
                "Space saving: 15.4%");
        String error = rawErr.toString(StandardCharsets.UTF_8);
        assertTrue(error.startsWith("DICT: read 3 lines from " + temp));
        assertTrue(error.contains("FST: start build with cacheCapacity=10000"));
        assertTrue(error.contains("FST: built 3 keys: originalStates=13 minimizedStates=11"));
        assertTrue(error.contains("DICT: indexed 3 distinct terms"));
    }

    private void run(String... args) {
        result = new Main().run(List.of(args), out, err);
    }

    private void assertResult(int expected) {
        assertEquals(expected, result);
    }

    private void assertOutput(String... expectedLines) {
        String expected = String.join(System.lineSeparator(), expectedLines);
        assertEquals(expected, rawOut.toString(StandardCharsets.UTF_8).trim());
    }

    private void assertError(String... expectedLines) {
        String expected = String.join(System.lineSeparator(), expectedLines);
        assertEquals(expected, rawErr.toString(StandardCharsets.UTF_8).trim());
    }
}
