// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.test;

import java.util.ArrayList;
import java.util.List;
import jalaw.law.LawParser;
import jalaw.law.MissingFieldErrorCondition;
import jalaw.util.Trace;
import jalaw.util.condition.Condition;
import jalaw.util.condition.ConditionContext;
import jalaw.util.condition.Handler;
import jalaw.util.condition.Restart;
import static jalaw.test.Fixtures.catchUnhandled;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class ConditionContextTest {
    @Test
    void unhandledErrorCarriesCondition() {
        final var condition = new TestCondition("boom");
        final var error = catchUnhandled(() -> {
            throw ConditionContext.error(condition);
        });
        assertThat(error.condition()).isSameAs(condition);
        assertThat(error).hasMessageContaining("boom");
    }

    @Test
    void unhandledSignalReturns() {
        final var seen = new ArrayList<Condition>();
        try (final var handler = new Handler(signaled -> seen.add(signaled.condition()))) {
            handler.use();
            ConditionContext.signal(new TestCondition("note"));
        }
        ConditionContext.signal(new TestCondition("nobody listens"));
        assertThat(seen).extracting(Condition::message).containsExactly("note");
    }

    @Test
    void handlerUnwindsToRestart() {
        final var traces = new ArrayList<String>();
        final var result = ConditionContext.withRestart("skip", restart -> {
            try (final var handler = new Handler(signaled -> {
                traces.addAll(Trace.activeTraces());
                restart.unwindTo();
            })) {
                handler.use();
                try (final var trace = new Trace("Binding something")) {
                    trace.use();
                    throw ConditionContext.error(new TestCondition("unwound"));
                }
            }
        });
        assertThat(result).isNull();
        assertThat(traces).containsExactly("Binding something");
        assertThat(Trace.activeTraces()).isEmpty();
        assertThat(ConditionContext.restarts()).isEmpty();
    }

    @Test
    void restartReturnsCallbackValue() {
        final var result = ConditionContext.withRestart("unused", restart -> "value");
        assertThat(result).isEqualTo("value");
    }

    @Test
    void restartsListNewestFirst() {
        final var names = new ArrayList<String>();
        ConditionContext.withRestart("outer", outer -> ConditionContext.withRestart("inner", inner -> {
            ConditionContext.restarts().stream().map(Restart::name).forEach(names::add);
            return null;
        }));
        assertThat(names).containsExactly("inner", "outer");
    }

    @Test
    void decliningHandlerPassesToOlder() {
        final var order = new ArrayList<String>();
        final var result = ConditionContext.withRestart("abort", restart -> {
            try (
                final var older = new Handler(signaled -> {
                    order.add("older");
                    restart.unwindTo();
                });
                final var newer = new Handler(signaled -> order.add("newer"))
            ) {
                older.use();
                newer.use();
                throw ConditionContext.error(new TestCondition("passed along"));
            }
        });
        assertThat(result).isNull();
        assertThat(order).containsExactly("newer", "older");
    }

    @Test
    void conditionFromHandlerSkipsItself() {
        final var seen = new ArrayList<String>();
        try (final var older = new Handler(signaled -> seen.add("older:" + signaled.condition().message()))) {
            older.use();
            try (final var newer = new Handler(signaled -> {
                seen.add("newer:" + signaled.condition().message());
                if (signaled.condition().message().equals("first")) {
                    ConditionContext.signal(new TestCondition("second"));
                }
            })) {
                newer.use();
                ConditionContext.signal(new TestCondition("first"));
            }
        }
        assertThat(seen).containsExactly("newer:first", "older:second", "older:first");
    }

    @Test
    void lawErrorsCanBeSkipped() {
        final var documents = List.of(
            "<Law Era=\"Showa\" Year=\"1\" Num=\"1\" LawType=\"Act\" Lang=\"ja\"><LawBody/></Law>",
            "<Law Era=\"Showa\" Year=\"2\" Num=\"1\" LawType=\"Act\" Lang=\"ja\"><LawNum>昭和二年法律第一号</LawNum>"
                + "<LawBody><MainProvision/></LawBody></Law>"
        );
        final var fields = new ArrayList<String>();
        final var bound = new ArrayList<String>();
        for (final var document : documents) {
            ConditionContext.withRestart("skip-document", restart -> {
                try (final var handler = new Handler(signaled -> {
                    if (signaled.condition() instanceof final MissingFieldErrorCondition missing) {
                        fields.add(missing.field());
                        restart.unwindTo();
                    }
                })) {
                    handler.use();
                    bound.add(LawParser.parseFrom(document).lawNum());
                    return null;
                }
            });
        }
        assertThat(fields).containsExactly("LawNum");
        assertThat(bound).containsExactly("昭和二年法律第一号");
    }

    private static final class TestCondition extends Condition {
        private TestCondition(final String message) {
            super(message);
        }
    }
}
