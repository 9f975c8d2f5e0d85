package org.csu.folp.cli;

import org.csu.folp.compiler.parser.ParseResult;
import org.csu.folp.engine.FormulaProcessor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ShellRunnerTest {

    @TempDir
    Path tempDir;

    @Test
    void testDemoFormulas() {
        FormulaProcessor processor = new FormulaProcessor();
        int last = ShellRunner.DEMO_FORMULAS.size() - 1;
        for (int i = 0; i < last; i++) {
            assertTrue(processor.parse(ShellRunner.DEMO_FORMULAS.get(i)).isSuccess(), ShellRunner.DEMO_FORMULAS.get(i));
        }
        ParseResult failing = processor.parse(ShellRunner.DEMO_FORMULAS.get(last));
        assertEquals(2, ((ParseResult.Failure) failing).error().tokenIndex());
    }

    @Test
    void testRunModes() throws IOException {
        BufferedReader noInput = new BufferedReader(new StringReader(""));
        assertEquals(0, ShellRunner.run(ShellOptions.parse("--demo"), noInput));
        assertEquals(0, ShellRunner.run(ShellOptions.parse(), noInput));
        assertEquals(1, ShellRunner.run(ShellOptions.parse("--file", tempDir.resolve("none.fol").toString()), noInput));
    }
}
