// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.Trace;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * A paragraph (項) of an article, or a standalone paragraph of a provision without articles.
 */
public final class Paragraph implements QuoteContent, TextSource {
    public Paragraph(final XmlElement element) {
        Elements.expectTag(element, "Paragraph");
        try (final var trace = new Trace(() -> "Binding paragraph " + element)) {
            trace.use();
            num = Attributes.requiredInteger(element, "Num", 0);
            oldStyle = Attributes.bool(element, "OldStyle");
            oldNum = Attributes.bool(element, "OldNum");
            hide = Attributes.bool(element, "Hide");
            caption = Elements.optional(element, "ParagraphCaption", Caption::new);
            paragraphNum = Elements.optional(element, "ParagraphNum", Label::new);
            sentence = Elements.required(element, "ParagraphSentence", ProvisionSentence::new);
            amendProvisions = Elements.list(element, "AmendProvision", AmendProvision::new);
            classes = Elements.list(element, "Class", ItemClass::new);
            tableStructs = Elements.list(element, "TableStruct", TableStruct::new);
            figStructs = Elements.list(element, "FigStruct", FigStruct::new);
            styleStructs = Elements.list(element, "StyleStruct", StyleStruct::new);
            items = Elements.list(element, "Item", Item::new);
            lists = Elements.list(element, "List", ListBlock::new);
        }
    }

    public int num() {
        return num;
    }

    public @Nullable Boolean oldStyle() {
        return oldStyle;
    }

    public @Nullable Boolean oldNum() {
        return oldNum;
    }

    public @Nullable Boolean hide() {
        return hide;
    }

    public @Nullable Caption caption() {
        return caption;
    }

    /**
     * Retrieves the printed paragraph number, often an empty element for the first paragraph.
     */
    public @Nullable Label paragraphNum() {
        return paragraphNum;
    }

    public ProvisionSentence sentence() {
        return sentence;
    }

    public List<AmendProvision> amendProvisions() {
        return amendProvisions;
    }

    public List<ItemClass> classes() {
        return classes;
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

    public List<Item> items() {
        return items;
    }

    public List<ListBlock> lists() {
        return lists;
    }

    /**
     * Yields the caption and the sentence block, then amendments, classes, structs, items and lists. The printed
     * paragraph number is not part of the text.
     */
    @Override
    public Stream<String> texts() {
        return Texts.concat(
            Texts.of(caption),
            sentence.texts(),
            Texts.of(amendProvisions),
            Texts.of(classes),
            Texts.of(tableStructs),
            Texts.of(figStructs),
            Texts.of(styleStructs),
            Texts.of(items),
            Texts.of(lists)
        );
    }

    @Override
    public String text() {
        return "";
    }

    private final int num;
    private final @Nullable Boolean oldStyle;
    private final @Nullable Boolean oldNum;
    private final @Nullable Boolean hide;
    private final @Nullable Caption caption;
    private final @Nullable Label paragraphNum;
    private final ProvisionSentence sentence;
    private final List<AmendProvision> amendProvisions;
    private final List<ItemClass> classes;
    private final List<TableStruct> tableStructs;
    private final List<FigStruct> figStructs;
    private final List<StyleStruct> styleStructs;
    private final List<Item> items;
    private final List<ListBlock> lists;
}
