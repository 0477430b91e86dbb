// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * A sub-item, {@code Subitem1} under an item down to {@code Subitem10}.
 */
public final class Subitem implements QuoteContent, TextSource {
    public Subitem(final XmlElement element) {
        Elements.expectTag(element, tagSet, "a sub-item");
        level = tags.indexOf(element.tag()) + 1;
        final var tag = element.tag();
        num = Attributes.requiredString(element, "Num");
        delete = Attributes.bool(element, "Delete");
        hide = Attributes.bool(element, "Hide");
        title = Elements.optional(element, tag + "Title", Label::new);
        sentence = Elements.required(element, tag + "Sentence", ProvisionSentence::new);
        subitems = (level < maxLevel) ? Elements.list(element, tags.get(level), Subitem::new) : List.of();
        tableStructs = Elements.list(element, "TableStruct", TableStruct::new);
        figStructs = Elements.list(element, "FigStruct", FigStruct::new);
        styleStructs = Elements.list(element, "StyleStruct", StyleStruct::new);
        lists = Elements.list(element, "List", ListBlock::new);
    }

    /**
     * Retrieves the depth, 1 for {@code Subitem1} through 10 for {@code Subitem10}.
     */
    public int level() {
        return level;
    }

    /**
     * Retrieves the number. Sub-items are numbered with arbitrary strings, like {@code "1_2"}.
     */
    public String num() {
        return num;
    }

    public @Nullable Boolean delete() {
        return delete;
    }

    public @Nullable Boolean hide() {
        return hide;
    }

    public @Nullable Label title() {
        return title;
    }

    public ProvisionSentence sentence() {
        return sentence;
    }

    /**
     * Retrieves the sub-items of the next level.
     */
    public List<Subitem> subitems() {
        return subitems;
    }

    public List<TableStruct> tableStructs() {
        return tableStructs;
    }

    public List<FigStruct> figStructs() {
        return figStructs;
    }

    public List<StyleStruct> styleStructs() {
        return styleStructs;
    }

    public List<ListBlock> lists() {
        return lists;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(
            Texts.of(title),
            sentence.texts(),
            Texts.of(subitems),
            Texts.of(tableStructs),
            Texts.of(figStructs),
            Texts.of(styleStructs),
            Texts.of(lists)
        );
    }

    @Override
    public String text() {
        return "";
    }

    static final int maxLevel = 10;
    static final List<String> tags = buildTags();
    private static final Set<String> tagSet = Set.copyOf(tags);

    private static List<String> buildTags() {
        final var result = new ArrayList<String>(maxLevel);
        for (int level = 1; level <= maxLevel; level += 1) {
            result.add("Subitem" + level);
        }
        return Collections.unmodifiableList(result);
    }

    private final int level;
    private final String num;
    private final @Nullable Boolean delete;
    private final @Nullable Boolean hide;
    private final @Nullable Label title;
    private final ProvisionSentence sentence;
    private final List<Subitem> subitems;
    private final List<TableStruct> tableStructs;
    private final List<FigStruct> figStructs;
    private final List<StyleStruct> styleStructs;
    private final List<ListBlock> lists;
}
