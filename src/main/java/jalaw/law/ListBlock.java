// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import jalaw.xml.XmlElement;

/**
 * A list ({@code List}) or one of its nested levels ({@code Sublist1} to {@code Sublist3}).
 */
public final class ListBlock implements QuoteContent, TextSource {
    public ListBlock(final XmlElement element) {
        Elements.expectTag(element, tagSet, "a list");
        level = tags.indexOf(element.tag());
        final var sentenceTag = (level == 0) ? "ListSentence" : "Sublist" + level + "Sentence";
        sentence = Elements.required(element, sentenceTag, ProvisionSentence::new);
        sublists = (level < maxLevel)
            ? Elements.list(element, tags.get(level + 1), ListBlock::new)
            : List.of();
    }

    /**
     * Retrieves the nesting level: 0 for {@code List}, {@code n} for {@code Sublistn}.
     */
    public int level() {
        return level;
    }

    public ProvisionSentence sentence() {
        return sentence;
    }

    /**
     * Retrieves the lists of the next level, which are always empty at the deepest level.
     */
    public List<ListBlock> sublists() {
        return sublists;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(sentence.texts(), Texts.of(sublists));
    }

    @Override
    public String text() {
        return "";
    }

    static final int maxLevel = 3;
    static final List<String> tags = buildTags();
    private static final Set<String> tagSet = Set.copyOf(tags);

    private static List<String> buildTags() {
        final var result = new ArrayList<String>();
        result.add("List");
        for (int level = 1; level <= maxLevel; level += 1) {
            result.add("Sublist" + level);
        }
        return Collections.unmodifiableList(result);
    }

    private final int level;
    private final ProvisionSentence sentence;
    private final List<ListBlock> sublists;
}
