// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.test;

import java.util.random.RandomGenerator;
import java.util.stream.LongStream;
import jalaw.law.Sentence;
import static jalaw.test.Fixtures.xml;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Checks on random documents that a sentence's text is the concatenation of its parts' text, with figures, formulas
 * and readings contributing nothing.
 */
final class SentenceTextTest {
    static LongStream provideSeeds() {
        return LongStream.generate(RandomUtils::generateRandomSeed).limit(32);
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void textIsConcatenationOfContent(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        final var document = new Document();
        document.xml.append("<Sentence>");
        generateContent(random, document, 0, false);
        document.xml.append("</Sentence>");

        final var sentence = new Sentence(xml(document.xml.toString()));
        assertThat(sentence.text()).as("seed %d", seed).isEqualTo(document.text.toString());
        assertThat(sentence.contents()).allSatisfy(content -> assertThat(content.text()).isNotNull());
    }

    // Lines don't nest, so the content of a line never includes another line.
    private static void generateContent(
        final RandomGenerator random,
        final Document document,
        final int depth,
        final boolean inLine
    ) {
        final var count = random.nextInt(0, 6);
        for (int i = 0; i < count; i += 1) {
            final var kind = random.nextInt((depth < maxDepth) ? 8 : 5);
            switch (kind) {
                case 0, 1 -> document.plain(RandomUtils.generateText(random));
                case 2 -> document.wrapped("Sup", RandomUtils.generateText(random));
                case 3 -> document.wrapped("Sub", RandomUtils.generateText(random));
                case 4 -> {
                    final var base = RandomUtils.generateText(random);
                    document.xml.append("<Ruby>").append(escape(base))
                        .append("<Rt>").append(escape(RandomUtils.generateText(random))).append("</Rt></Ruby>");
                    document.text.append(base);
                }
                case 5 -> {
                    if (inLine) {
                        document.plain(RandomUtils.generateText(random));
                    } else {
                        document.xml.append("<Line Style=\"double\">");
                        generateContent(random, document, depth + 1, true);
                        document.xml.append("</Line>");
                    }
                }
                case 6 -> {
                    document.xml.append("<QuoteStruct><Sentence>");
                    generateContent(random, document, depth + 1, false);
                    document.xml.append("</Sentence><Fig src=\"fig.png\"/></QuoteStruct>");
                }
                default -> document.xml.append("<ArithFormula><Fig src=\"formula.png\"/></ArithFormula>");
            }
        }
    }

    private static String escape(final String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }

    private static final int maxDepth = 3;

    private static final class Document {
        private void plain(final String text) {
            xml.append(escape(text));
            this.text.append(text);
        }

        private void wrapped(final String tag, final String text) {
            xml.append('<').append(tag).append('>').append(escape(text)).append("</").append(tag).append('>');
            this.text.append(text);
        }

        private final StringBuilder xml = new StringBuilder();
        private final StringBuilder text = new StringBuilder();
    }
}
