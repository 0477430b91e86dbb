// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * A column of a sentence block, used where a provision is laid out as side-by-side phrases.
 */
public final class Column implements TextSource {
    public Column(final XmlElement element) {
        Elements.expectTag(element, "Column");
        num = Attributes.integer(element, "Num", 1);
        lineBreak = Attributes.bool(element, "LineBreak");
        align = Attributes.enumeration(element, "Align", Align::byXmlName);
        sentences = Elements.list(element, "Sentence", Sentence::new);
    }

    public @Nullable Integer num() {
        return num;
    }

    public @Nullable Boolean lineBreak() {
        return lineBreak;
    }

    public @Nullable Align align() {
        return align;
    }

    public List<Sentence> sentences() {
        return sentences;
    }

    @Override
    public Stream<String> texts() {
        return Texts.ofSentences(sentences);
    }

    private final @Nullable Integer num;
    private final @Nullable Boolean lineBreak;
    private final @Nullable Align align;
    private final List<Sentence> sentences;
}
