package org.csu.folp.cli;

import org.csu.folp.engine.FormulaProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

public class InteractiveShellTest {

    private ByteArrayOutputStream outBuffer;
    private ByteArrayOutputStream errBuffer;
    private PrintStream out;
    private PrintStream err;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        outBuffer = new ByteArrayOutputStream();
        errBuffer = new ByteArrayOutputStream();
        out = new PrintStream(outBuffer, true, StandardCharsets.UTF_8);
        err = new PrintStream(errBuffer, true, StandardCharsets.UTF_8);
    }

    private String output() {
        return outBuffer.toString(StandardCharsets.UTF_8);
    }

    private static BufferedReader input(String text) {
        return new BufferedReader(new StringReader(text));
    }

    @Test
    void testShellDelegatesEachLineUntilExit() throws IOException {
        FormulaProcessor processor = mock(FormulaProcessor.class);
        when(processor.executeAndGetResult("P(x)")).thenReturn("Result: P(x)\nType: Predicate");

        InteractiveShell shell = new InteractiveShell(processor, out, err, false);
        shell.run(input("P(x)\n\n   \nexit\nQ(y)\n"));

        verify(processor, times(1)).executeAndGetResult("P(x)");
        verify(processor, never()).executeAndGetResult("Q(y)");
        verify(processor, never()).tokenize(anyString());
        assertTrue(output().contains("  Result: P(x)"));
        assertTrue(output().trim().endsWith("Bye!"));
    }

    @Test
    void testTokenEchoToggle() throws IOException {
        FormulaProcessor processor = spy(new FormulaProcessor());
        InteractiveShell shell = new InteractiveShell(processor, out, err, false);

        shell.run(input("tokens on\nR(B, z)\ntokens off\nR(B, z)\n"));

        verify(processor, times(1)).tokenize("R(B, z)");
        verify(processor, times(2)).executeAndGetResult("R(B, z)");
        assertFalse(shell.isEchoTokens());
        assertTrue(output().contains("Tokens: [Token[Type=IDENT_UPPER"));
    }

    @Test
    void testEndOfStreamLeavesShell() throws IOException {
        InteractiveShell shell = new InteractiveShell(new FormulaProcessor(), out, err, false);
        shell.run(input("forall x P(x)"));
        assertTrue(output().contains("Error: Expected '.' but found 'P' at token 2"));
        assertTrue(output().contains("Bye!"));
    }

    @Test
    void testSourceScriptSkipsBlankAndCommentLines() throws IOException {
        Path script = tempDir.resolve("axioms.fol");
        Files.write(script, List.of(
                "# 两条公理",
                "forall x. (MAN(x) -> MORTAL(x))",
                "",
                "MAN(SOCRATES)",
                "P(x"), StandardCharsets.UTF_8);

        InteractiveShell shell = new InteractiveShell(new FormulaProcessor(), out, err, false);
        shell.run(input("source " + script + "\nquit\n"));

        String output = output();
        System.out.println(output);
        assertFalse(output.contains("Parsing: #"));
        assertTrue(output.contains("Type: Forall"));
        assertTrue(output.contains("Type: Predicate"));
        assertTrue(output.contains("Error: Unexpected end of input"));
        assertTrue(output.contains("Finished executing script."));
    }

    @Test
    void testMissingScriptIsReported() {
        InteractiveShell shell = new InteractiveShell(new FormulaProcessor(), out, err, false);
        assertFalse(shell.executeFile(tempDir.resolve("missing.fol").toString()));
        assertTrue(errBuffer.toString(StandardCharsets.UTF_8).contains("File not found"));
    }
    @Test
    void testCommandsAreLocaleIndependent() throws IOException {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            Path script = tempDir.resolve("single.fol");
            Files.write(script, List.of("R(B, z)"), StandardCharsets.UTF_8);

            InteractiveShell shell = new InteractiveShell(new FormulaProcessor(), out, err, false);
            shell.run(input("TOKENS ON\nSOURCE " + script + "\nQUIT\n"));

            assertTrue(shell.isEchoTokens());
            assertTrue(output().contains("Finished executing script."));
            assertTrue(output().contains("Tokens: [Token[Type=IDENT_UPPER"));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
