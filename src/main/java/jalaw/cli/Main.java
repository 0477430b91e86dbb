// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.cli;

import java.nio.file.Path;
import jalaw.law.LawParser;
import jalaw.util.condition.ConditionContext;
import jalaw.util.condition.Handler;

final class Main {
    private Main() {
    }

    public static void main(final String[] args) {
        System.exit(mainImpl(args).value);
    }

    private static ExitCode mainImpl(final String[] args) {
        if (args.length == 0) {
            try (final var streams = Streams.acquire()) {
                streams.err().println("Usage: jalaw <law.xml>...");
                return ExitCode.USAGE;
            }
        }

        try (final var handler = new Handler(FallbackHandler.instance())) {
            handler.use();
            final var exitCode = ConditionContext.withRestart("abort-process", restart -> {
                var result = ExitCode.SUCCESS;
                for (final var arg : args) {
                    if (!printLaw(Path.of(arg))) {
                        result = ExitCode.ERROR;
                    }
                }
                return result;
            });
            return (exitCode != null) ? exitCode : ExitCode.ERROR;
        }
    }

    /**
     * Prints the text of one law, one string per line. Returns {@code false} if the file was skipped.
     * <p>
     * Mixed content is resolved before anything is printed, so a skipped file leaves no partial output.
     */
    static boolean printLaw(final Path path) {
        final var printed = ConditionContext.withRestart("skip-file", restart -> {
            final var texts = LawParser.parse(path).texts().toList();
            try (final var streams = Streams.acquire()) {
                final var out = streams.out();
                texts.forEach(out::println);
            }
            return Boolean.TRUE;
        });
        return printed != null;
    }

    private enum ExitCode {
        SUCCESS(0),
        ERROR(1),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        private final int value;
    }
}
