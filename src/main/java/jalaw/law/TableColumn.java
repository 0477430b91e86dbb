// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * A table cell. Besides sentences, a cell may hold whole provisions, down to sub-items, and figures.
 */
public final class TableColumn implements TextSource {
    public TableColumn(final XmlElement element) {
        Elements.expectTag(element, "TableColumn");
        borderTop = Attributes.enumeration(element, "BorderTop", LineStyle::byXmlName);
        borderBottom = Attributes.enumeration(element, "BorderBottom", LineStyle::byXmlName);
        borderLeft = Attributes.enumeration(element, "BorderLeft", LineStyle::byXmlName);
        borderRight = Attributes.enumeration(element, "BorderRight", LineStyle::byXmlName);
        rowspan = Attributes.integer(element, "rowspan", 1);
        colspan = Attributes.integer(element, "colspan", 1);
        align = Attributes.enumeration(element, "Align", Align::byXmlName);
        valign = Attributes.enumeration(element, "Valign", VerticalAlign::byXmlName);
        parts = Elements.list(element, "Part", Part::new);
        chapters = Elements.list(element, "Chapter", Chapter::new);
        sections = Elements.list(element, "Section", Section::new);
        subsections = Elements.list(element, "Subsection", Subsection::new);
        divisions = Elements.list(element, "Division", Division::new);
        articles = Elements.list(element, "Article", Article::new);
        paragraphs = Elements.list(element, "Paragraph", Paragraph::new);
        items = Elements.list(element, "Item", Item::new);
        subitems = Elements.list(element, Subitem.tags::contains, Subitem::new);
        figStructs = Elements.list(element, "FigStruct", FigStruct::new);
        remarks = Elements.optional(element, "Remarks", Remarks::new);
        sentences = Elements.list(element, "Sentence", Sentence::new);
        columns = Elements.list(element, "Column", Column::new);
    }

    public @Nullable LineStyle borderTop() {
        return borderTop;
    }

    public @Nullable LineStyle borderBottom() {
        return borderBottom;
    }

    public @Nullable LineStyle borderLeft() {
        return borderLeft;
    }

    public @Nullable LineStyle borderRight() {
        return borderRight;
    }

    public @Nullable Integer rowspan() {
        return rowspan;
    }

    public @Nullable Integer colspan() {
        return colspan;
    }

    public @Nullable Align align() {
        return align;
    }

    public @Nullable VerticalAlign valign() {
        return valign;
    }

    public List<Part> parts() {
        return parts;
    }

    public List<Chapter> chapters() {
        return chapters;
    }

    public List<Section> sections() {
        return sections;
    }

    public List<Subsection> subsections() {
        return subsections;
    }

    public List<Division> divisions() {
        return divisions;
    }

    public List<Article> articles() {
        return articles;
    }

    public List<Paragraph> paragraphs() {
        return paragraphs;
    }

    public List<Item> items() {
        return items;
    }

    /**
     * Retrieves the sub-items placed directly in this cell, of any level, in document order.
     */
    public List<Subitem> subitems() {
        return subitems;
    }

    public List<FigStruct> figStructs() {
        return figStructs;
    }

    public @Nullable Remarks remarks() {
        return remarks;
    }

    public List<Sentence> sentences() {
        return sentences;
    }

    public List<Column> columns() {
        return columns;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(
            Texts.ofSentences(sentences),
            Texts.of(columns),
            Texts.of(parts),
            Texts.of(chapters),
            Texts.of(sections),
            Texts.of(subsections),
            Texts.of(divisions),
            Texts.of(articles),
            Texts.of(paragraphs),
            Texts.of(items),
            Texts.of(subitems),
            Texts.of(figStructs),
            Texts.of(remarks)
        );
    }

    private final @Nullable LineStyle borderTop;
    private final @Nullable LineStyle borderBottom;
    private final @Nullable LineStyle borderLeft;
    private final @Nullable LineStyle borderRight;
    private final @Nullable Integer rowspan;
    private final @Nullable Integer colspan;
    private final @Nullable Align align;
    private final @Nullable VerticalAlign valign;
    private final List<Part> parts;
    private final List<Chapter> chapters;
    private final List<Section> sections;
    private final List<Subsection> subsections;
    private final List<Division> divisions;
    private final List<Article> articles;
    private final List<Paragraph> paragraphs;
    private final List<Item> items;
    private final List<Subitem> subitems;
    private final List<FigStruct> figStructs;
    private final @Nullable Remarks remarks;
    private final List<Sentence> sentences;
    private final List<Column> columns;
}
