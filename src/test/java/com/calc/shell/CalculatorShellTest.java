package com.calc.shell;

import com.calc.config.CalcConfig;
import com.calc.core.DefaultCalculator;
import com.calc.expression.ExpressionConfig;
import com.calc.format.ResultFormatter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the interactive shell loop.
 */
class CalculatorShellTest {

    private CalcConfig config;
    private CalculatorShell shell;
    private ByteArrayOutputStream buffer;

    @BeforeEach
    void setUp() {
        config = CalcConfig.defaults();
        shell = new CalculatorShell(new DefaultCalculator(), new ResultFormatter(config.precision()), config);
        buffer = new ByteArrayOutputStream();
    }

    private int run(String input) throws Exception {
        try (PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            return shell.run(new BufferedReader(new StringReader(input)), out);
        }
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should print formatted results until exit")
    void shouldEvaluateUntilExit() throws Exception {
        int evaluated = run("1+1\n10/4\nexit\n3+3\n");

        assertEquals(2, evaluated);
        String output = output();
        assertTrue(output.startsWith(config.usage()));
        assertTrue(output.contains(config.prompt() + "2" + System.lineSeparator()));
        assertTrue(output.contains("2.5"));
        assertFalse(output.contains("6"));
    }

    @Test
    @DisplayName("Should skip blank lines and show usage on help")
    void shouldHandleBlankAndHelp() throws Exception {
        int evaluated = run("\nhelp\n?\nq\n");

        assertEquals(0, evaluated);
        String output = output();
        int first = output.indexOf(config.usage());
        int count = 0;
        for (int i = first; i >= 0; i = output.indexOf(config.usage(), i + 1)) {
            count++;
        }
        assertEquals(3, count);
    }

    @Test
    @DisplayName("Should print error messages and keep going")
    void shouldReportErrorsAndContinue() throws Exception {
        int evaluated = run("2@3\n(1+2\n5!\nquit\n");

        assertEquals(3, evaluated);
        String output = output();
        assertTrue(output.contains(ExpressionConfig.ALLOWED_CHARACTERS_MESSAGE));
        assertTrue(output.contains("Unbalanced brackets or parentheses."));
        assertTrue(output.contains("120"));
    }

    @Test
    @DisplayName("Should stop at end of input")
    void shouldStopAtEndOfInput() throws Exception {
        assertEquals(1, run("2(3+4)"));
        assertTrue(output().contains("14"));
    }

    @Test
    @DisplayName("Exit commands are case-insensitive and trimmed")
    void shouldRecognizeExitVariants() throws Exception {
        assertEquals(0, run("  EXIT \n1+1\n"));
    }

    @Test
    @DisplayName("Oversized input prints a message and the session continues")
    void shouldSurviveOversizedInput() throws Exception {
        String deep = "[".repeat(5000) + "1" + "]".repeat(5000);
        String chain = "1" + "+1".repeat(20000);

        int evaluated = run(deep + "\n" + chain + "\n2*3\nexit\n");

        assertEquals(3, evaluated);
        String output = output();
        assertTrue(output.contains("Parentheses are nested more than"));
        assertTrue(output.contains("20001"));
        assertTrue(output.contains(config.prompt() + "6"));
    }

    @Test
    @DisplayName("Overflow prints the configured message")
    void shouldPrintOverflowMessage() {
        assertEquals(config.overflowMessage(), shell.evaluateLine("10^400"));
        assertEquals(config.overflowMessage(), shell.evaluateLine("200!"));
    }

    @Test
    @DisplayName("Domain errors print their own message")
    void shouldPrintDomainErrorMessage() {
        assertEquals("Division by zero.", shell.evaluateLine("1/0"));
        assertEquals("-3", shell.evaluateLine("-(1+2)"));
    }
}
