package com.calc.shell;

import com.calc.config.CalcConfig;
import com.calc.core.Calculator;
import com.calc.exception.CalcException;
import com.calc.exception.ErrorKind;
import com.calc.format.ResultFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

/**
 * Interactive read-evaluate-print loop around a {@link Calculator}.
 * <p>
 * Blank lines are ignored, help commands print the usage text and exit
 * commands or end of input stop the loop. Everything else is evaluated and
 * either the formatted result or the error message is printed.
 */
public class CalculatorShell {

    private static final Logger log = LoggerFactory.getLogger(CalculatorShell.class);

    private final Calculator calculator;
    private final ResultFormatter formatter;
    private final CalcConfig config;

    public CalculatorShell(Calculator calculator, ResultFormatter formatter, CalcConfig config) {
        this.calculator = calculator;
        this.formatter = formatter;
        this.config = config;
    }

    /**
     * Run the loop until an exit command or end of input.
     *
     * @param in  Source of input lines
     * @param out Destination for prompts, results and messages
     * @return Number of expressions evaluated, successfully or not
     * @throws IOException if reading input fails
     */
    public int run(BufferedReader in, PrintStream out) throws IOException {
        out.println(config.usage());
        int evaluated = 0;

        while (true) {
            out.print(config.prompt());
            out.flush();
            String line = in.readLine();
            if (line == null) {
                out.println();
                break;
            }
            if (line.isEmpty()) {
                continue;
            }

            String command = line.strip();
            if (config.isExitCommand(command)) {
                break;
            }
            if (config.isHelpCommand(command)) {
                out.println(config.usage());
                continue;
            }

            out.println(evaluateLine(line));
            evaluated++;
        }

        log.debug("Shell finished after {} expressions", evaluated);
        return evaluated;
    }

    /**
     * Evaluate one expression and render what the shell prints for it.
     *
     * @param line Expression text
     * @return Formatted result or error message
     */
    public String evaluateLine(String line) {
        try {
            return formatter.format(calculator.evaluate(line));
        } catch (CalcException e) {
            log.debug("Rejected '{}': {} ({})", line, e.getMessage(), e.getKind());
            if (e.getKind() == ErrorKind.OVERFLOW) {
                return config.overflowMessage();
            }
            return e.getMessage();
        }
    }
}
