// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * An item (号) of a paragraph.
 */
public final class Item implements QuoteContent, TextSource {
    public Item(final XmlElement element) {
        Elements.expectTag(element, "Item");
        num = Attributes.requiredString(element, "Num");
        delete = Attributes.bool(element, "Delete");
        hide = Attributes.bool(element, "Hide");
        title = Elements.optional(element, "ItemTitle", Label::new);
        sentence = Elements.required(element, "ItemSentence", ProvisionSentence::new);
        subitems = Elements.list(element, "Subitem1", Subitem::new);
        tableStructs = Elements.list(element, "TableStruct", TableStruct::new);
        figStructs = Elements.list(element, "FigStruct", FigStruct::new);
        styleStructs = Elements.list(element, "StyleStruct", StyleStruct::new);
        lists = Elements.list(element, "List", ListBlock::new);
    }

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
