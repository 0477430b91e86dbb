// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import jalaw.util.Trace;
import jalaw.util.condition.Condition;
import jalaw.util.condition.ConditionContext;
import jalaw.util.condition.HandlerProcedure;
import jalaw.util.condition.Restart;
import jalaw.util.condition.SignaledCondition;
import jalaw.util.condition.exception.SAXExceptionCondition;

/**
 * The outermost handler: reports fatal conditions and asks the user which restart to take.
 */
final class FallbackHandler implements HandlerProcedure {
    private FallbackHandler() {
    }

    static FallbackHandler instance() {
        return instance;
    }

    @Override
    public void handle(final SignaledCondition condition) {
        if (!condition.isFatal()) {
            // Parser warnings are the only non-fatal conditions worth showing.
            if (condition.condition() instanceof final SAXExceptionCondition c) {
                try (final var streams = Streams.acquire()) {
                    streams.err().println("Warning: " + c.message());
                }
            }
            return;
        }
        final var restarts = ConditionContext.restarts();
        try (final var streams = Streams.acquire()) {
            showCondition(streams.err(), condition.condition());
            chooseRestart(streams, restarts).unwindTo();
        }
    }

    private static void showCondition(final PrintStream err, final Condition condition) {
        err.println("A fatal condition of type " + condition.getClass().getName() + " has been signaled.");
        err.println("\nDetailed message:");
        err.println(condition.detailedMessage().stripTrailing());
        err.println("\nOperation trace:");
        for (final var traceMessage : Trace.activeTraces()) {
            err.println(" - " + traceMessage);
        }
        err.println();
    }

    private static Restart chooseRestart(final Streams streams, final List<Restart> restarts) {
        if (restarts.isEmpty()) {
            throw new IllegalStateException("No restarts available");
        }

        final var err = streams.err();
        final var last = restarts.get(restarts.size() - 1);
        showRestarts(err, restarts);
        while (true) {
            err.print("Enter restart number > ");
            try {
                final var line = streams.in().readLine();
                if (line == null) {
                    err.println("End of input found, picking " + last.name() + ".");
                    return last;
                }
                final var index = Integer.parseInt(line.strip());
                if (index >= 1 && index <= restarts.size()) {
                    return restarts.get(index - 1);
                }
                err.println("Invalid restart index " + index + ", value out of bounds.");
            } catch (final NumberFormatException e) {
                err.println("Restart index not an integer: " + e);
            } catch (final IOException e) {
                err.println("I/O error occurred: " + e);
                err.println("Picking " + last.name() + ".");
                return last;
            }
        }
    }

    private static void showRestarts(final PrintStream stream, final List<Restart> restarts) {
        stream.println("Available restarts:");
        for (int i = 0; i < restarts.size(); i += 1) {
            stream.println(" " + (i + 1) + ". " + restarts.get(i).name());
        }
        stream.println();
    }

    private static final FallbackHandler instance = new FallbackHandler();
}
