// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;

/**
 * Building blocks of {@link TextSource#texts()} implementations.
 */
final class Texts {
    private Texts() {
    }

    @SafeVarargs
    static Stream<String> concat(final Stream<String>... parts) {
        return Stream.of(parts).flatMap(Function.identity());
    }

    static Stream<String> of(final @Nullable TextSource source) {
        return (source != null) ? source.texts() : Stream.empty();
    }

    static Stream<String> of(final List<? extends TextSource> sources) {
        return sources.stream().flatMap(TextSource::texts);
    }

    static Stream<String> ofSentences(final List<Sentence> sentences) {
        return sentences.stream().map(Sentence::text);
    }
}
