package com.calc.config;

import java.util.List;
import java.util.Locale;

/**
 * Root configuration for the calculator shell.
 *
 * @param name            Display name
 * @param prompt          Prompt printed before each input line
 * @param exitCommands    Inputs that end the session
 * @param helpCommands    Inputs that print the usage text
 * @param usage           Usage text
 * @param overflowMessage Message printed when a result is too large
 * @param precision       Significant digits for non-integral results
 */
public record CalcConfig(
        String name,
        String prompt,
        List<String> exitCommands,
        List<String> helpCommands,
        String usage,
        String overflowMessage,
        int precision
) {

    public static final String DEFAULT_USAGE = """
            Usage: type any arithmetic sequence to calculate its value.
            Use +, -, *, /, !, ^, **, (), or [].
            Parentheses may be arbitrarily nested.
            Whitespace is fine and will be discarded.
            Use Control-C or type "exit" to exit this program.""";

    public static final String DEFAULT_OVERFLOW_MESSAGE =
            "Incalculable! Wow, that's a really big number! You probably can't use "
                    + "a number that large, anyway. Try something more modest.";

    public CalcConfig {
        exitCommands = List.copyOf(exitCommands);
        helpCommands = List.copyOf(helpCommands);
    }

    public boolean isExitCommand(String input) {
        return exitCommands.contains(input.toLowerCase(Locale.ROOT));
    }

    public boolean isHelpCommand(String input) {
        return helpCommands.contains(input.toLowerCase(Locale.ROOT));
    }

    /**
     * Built-in configuration, used for keys missing from the file.
     */
    public static CalcConfig defaults() {
        return new CalcConfig(
                "calc",
                "calc: ",
                List.of("q", "quit", "exit"),
                List.of("h", "help", "?"),
                DEFAULT_USAGE,
                DEFAULT_OVERFLOW_MESSAGE,
                12
        );
    }
}
