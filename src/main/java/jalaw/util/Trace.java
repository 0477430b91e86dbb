// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.util;

import java.util.ArrayList;
import java.util.List;
import jalaw.util.condition.MessageSupplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A user-readable note about the operation in progress, intended to be used within try-with-resources.
 * <p>
 * Traces form a per-thread chain. Condition handlers read it with {@link #activeTraces()} to tell the user which
 * document, article or element was being bound when something went wrong.
 * <p>
 * Trace objects must be closed by the thread that created them, in reverse order of creation.
 */
public final class Trace implements AutoCloseable {
    /**
     * Establishes a trace whose message is computed only if somebody asks for it, and at most once.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Establishes a trace with a fixed message.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object messageOrSupplier) {
        final var context = chain.get();
        next = context.first;
        this.messageOrSupplier = messageOrSupplier;
        owner = context;
        context.first = this;
    }

    /**
     * Returns the messages of the calling thread's active traces, most recently established first.
     */
    public static List<String> activeTraces() {
        final var messages = new ArrayList<String>();
        for (var trace = chain.get().first; trace != null; trace = trace.next) {
            messages.add(trace.message());
        }
        return messages;
    }

    /**
     * Does nothing. Silences warnings about try-with-resources variables that are never referenced.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        assert owner == chain.get() : "Trace closed by a different thread";
        assert owner.first == this : "Trace chain corrupt";
        owner.first = next;
    }

    private String message() {
        if (messageOrSupplier instanceof final String string) {
            return string;
        }
        final var string = ((MessageSupplier) messageOrSupplier).get();
        messageOrSupplier = string;
        return string;
    }

    @SuppressWarnings("nullness:type.argument")
    private static final ThreadLocal<Chain> chain = ThreadLocal.withInitial(Chain::new);

    private final @Nullable Trace next;
    // Either the message itself or a MessageSupplier that hasn't been asked yet.
    private Object messageOrSupplier;
    private final Chain owner;

    private static final class Chain {
        private @Nullable Trace first = null;
    }
}
