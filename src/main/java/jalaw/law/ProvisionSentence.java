// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * The sentence block of a paragraph, item, sub-item, class, list or amendment provision: sentences, or columns of
 * sentences, and in items an occasional table.
 */
public final class ProvisionSentence implements TextSource {
    public ProvisionSentence(final XmlElement element) {
        Elements.expectTag(element, tags, "a provision sentence block");
        tag = element.tag();
        sentences = Elements.list(element, "Sentence", Sentence::new);
        columns = Elements.list(element, "Column", Column::new);
        table = Elements.optional(element, "Table", Table::new);
    }

    /**
     * Retrieves the tag this block is bound to, like {@code ItemSentence}.
     */
    public String tag() {
        return tag;
    }

    public List<Sentence> sentences() {
        return sentences;
    }

    public List<Column> columns() {
        return columns;
    }

    public @Nullable Table table() {
        return table;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.ofSentences(sentences), Texts.of(columns), Texts.of(table));
    }

    private static final Set<String> tags = buildTags();

    private static Set<String> buildTags() {
        final var result = new HashSet<>(Set.of(
            "ParagraphSentence",
            "ItemSentence",
            "ClassSentence",
            "AmendProvisionSentence",
            "ListSentence"
        ));
        for (int level = 1; level <= Subitem.maxLevel; level += 1) {
            result.add("Subitem" + level + "Sentence");
        }
        for (int level = 1; level <= ListBlock.maxLevel; level += 1) {
            result.add("Sublist" + level + "Sentence");
        }
        return Set.copyOf(result);
    }

    private final String tag;
    private final List<Sentence> sentences;
    private final List<Column> columns;
    private final @Nullable Table table;
}
