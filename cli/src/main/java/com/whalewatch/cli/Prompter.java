package com.whalewatch.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Line-oriented console prompts that keep asking until the answer is valid.
 *
 * <p>
 * Re-prompting is an explicit loop, so any number of bad answers costs no
 * extra stack. End of input raises {@link InputClosedException}.
 * </p>
 */
class Prompter {

    private final BufferedReader in;
    private final PrintStream out;

    Prompter(BufferedReader in, PrintStream out) {
        this.in = Objects.requireNonNull(in, "in must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    /**
     * @return the next line, trimmed
     * @throws InputClosedException at end of input
     */
    String ask(String prompt) {
        out.print(prompt);
        out.flush();
        try {
            String line = in.readLine();
            if (line == null) {
                throw new InputClosedException();
            }
            return line.trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read console input", e);
        }
    }

    /**
     * Ask until {@code parser} accepts the answer.
     *
     * @param retryMessage shown after each rejected answer
     * @param parser       converts the answer, throwing a
     *                     {@link RuntimeException} to reject it
     */
    <T> T askUntilValid(String prompt, String retryMessage, Function<String, T> parser) {
        while (true) {
            String answer = ask(prompt);
            try {
                return parser.apply(answer);
            } catch (InputClosedException e) {
                throw e;
            } catch (RuntimeException e) {
                out.println(retryMessage);
            }
        }
    }

    boolean askYesNo(String prompt) {
        return askUntilValid(prompt, "Please answer Y or N.", answer -> {
            switch (answer.toLowerCase(Locale.ROOT)) {
                case "y", "yes" -> {
                    return true;
                }
                case "n", "no" -> {
                    return false;
                }
                default -> throw new IllegalArgumentException("Not a yes/no answer: " + answer);
            }
        });
    }

    void println(String line) {
        out.println(line);
    }

    /** Signals that the console has no more input. */
    static final class InputClosedException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        InputClosedException() {
            super("Console input closed");
        }
    }
}
