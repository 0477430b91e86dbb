// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * Remarks (備考) attached to a table, figure or appendix.
 */
public final class Remarks implements QuoteContent, TextSource {
    public Remarks(final XmlElement element) {
        Elements.expectTag(element, "Remarks");
        label = Elements.optional(element, "RemarksLabel", RemarksLabel::new);
        sentences = Elements.list(element, "Sentence", Sentence::new);
        items = Elements.list(element, "Item", Item::new);
    }

    public @Nullable RemarksLabel label() {
        return label;
    }

    public List<Sentence> sentences() {
        return sentences;
    }

    public List<Item> items() {
        return items;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.of(label), Texts.ofSentences(sentences), Texts.of(items));
    }

    @Override
    public String text() {
        return "";
    }

    private final @Nullable RemarksLabel label;
    private final List<Sentence> sentences;
    private final List<Item> items;
}
