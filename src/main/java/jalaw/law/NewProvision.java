// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * A provision inserted by an {@link AmendProvision}: anything from a single sentence up to a whole law body.
 * <p>
 * An absent kind is {@code null} or an empty list; usually only one or two kinds are present.
 */
public final class NewProvision implements TextSource {
    public NewProvision(final XmlElement element) {
        Elements.expectTag(element, "NewProvision");
        lawTitle = Elements.optional(element, "LawTitle", LawTitle::new);
        preamble = Elements.optional(element, "Preamble", Preamble::new);
        toc = Elements.optional(element, "TOC", Toc::new);
        partTitle = Elements.optional(element, "PartTitle", Label::new);
        chapterTitle = Elements.optional(element, "ChapterTitle", Label::new);
        sectionTitle = Elements.optional(element, "SectionTitle", Label::new);
        subsectionTitle = Elements.optional(element, "SubsectionTitle", Label::new);
        divisionTitle = Elements.optional(element, "DivisionTitle", Label::new);
        parts = Elements.list(element, "Part", Part::new);
        chapters = Elements.list(element, "Chapter", Chapter::new);
        sections = Elements.list(element, "Section", Section::new);
        subsections = Elements.list(element, "Subsection", Subsection::new);
        divisions = Elements.list(element, "Division", Division::new);
        articles = Elements.list(element, "Article", Article::new);
        supplNotes = Elements.list(element, "SupplNote", Label::new);
        paragraphs = Elements.list(element, "Paragraph", Paragraph::new);
        items = Elements.list(element, "Item", Item::new);
        subitems = Elements.list(element, Subitem.tags::contains, Subitem::new);
        lists = Elements.list(element, "List", ListBlock::new);
        sentences = Elements.list(element, "Sentence", Sentence::new);
        amendProvisions = Elements.list(element, "AmendProvision", AmendProvision::new);
        appdxTables = Elements.list(element, "AppdxTable", AppdxTable::new);
        appdxNotes = Elements.list(element, "AppdxNote", AppdxNote::new);
        appdxStyles = Elements.list(element, "AppdxStyle", AppdxStyle::new);
        appdxes = Elements.list(element, "Appdx", Appdx::new);
        appdxFigs = Elements.list(element, "AppdxFig", AppdxFig::new);
        appdxFormats = Elements.list(element, "AppdxFormat", AppdxFormat::new);
        supplProvisionAppdxStyles = Elements.list(element, "SupplProvisionAppdxStyle", SupplProvisionAppdxStyle::new);
        supplProvisionAppdxTables = Elements.list(element, "SupplProvisionAppdxTable", SupplProvisionAppdxTable::new);
        supplProvisionAppdxes = Elements.list(element, "SupplProvisionAppdx", SupplProvisionAppdx::new);
        tableStructs = Elements.list(element, "TableStruct", TableStruct::new);
        tableRows = Elements.list(element, "TableRow", TableRow::new);
        tableColumns = Elements.list(element, "TableColumn", TableColumn::new);
        figStructs = Elements.list(element, "FigStruct", FigStruct::new);
        noteStructs = Elements.list(element, "NoteStruct", NoteStruct::new);
        styleStructs = Elements.list(element, "StyleStruct", StyleStruct::new);
        formatStructs = Elements.list(element, "FormatStruct", FormatStruct::new);
        remarks = Elements.list(element, "Remarks", Remarks::new);
        lawBody = Elements.optional(element, "LawBody", LawBody::new);
    }

    public @Nullable LawTitle lawTitle() {
        return lawTitle;
    }

    public @Nullable Preamble preamble() {
        return preamble;
    }

    public @Nullable Toc toc() {
        return toc;
    }

    public @Nullable Label partTitle() {
        return partTitle;
    }

    public @Nullable Label chapterTitle() {
        return chapterTitle;
    }

    public @Nullable Label sectionTitle() {
        return sectionTitle;
    }

    public @Nullable Label subsectionTitle() {
        return subsectionTitle;
    }

    public @Nullable Label divisionTitle() {
        return divisionTitle;
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

    public List<Label> supplNotes() {
        return supplNotes;
    }

    public List<Paragraph> paragraphs() {
        return paragraphs;
    }

    public List<Item> items() {
        return items;
    }

    /**
     * Retrieves the inserted sub-items of any level, in document order.
     */
    public List<Subitem> subitems() {
        return subitems;
    }

    public List<ListBlock> lists() {
        return lists;
    }

    public List<Sentence> sentences() {
        return sentences;
    }

    public List<AmendProvision> amendProvisions() {
        return amendProvisions;
    }

    public List<AppdxTable> appdxTables() {
        return appdxTables;
    }

    public List<AppdxNote> appdxNotes() {
        return appdxNotes;
    }

    public List<AppdxStyle> appdxStyles() {
        return appdxStyles;
    }

    public List<Appdx> appdxes() {
        return appdxes;
    }

    public List<AppdxFig> appdxFigs() {
        return appdxFigs;
    }

    public List<AppdxFormat> appdxFormats() {
        return appdxFormats;
    }

    public List<SupplProvisionAppdxStyle> supplProvisionAppdxStyles() {
        return supplProvisionAppdxStyles;
    }

    public List<SupplProvisionAppdxTable> supplProvisionAppdxTables() {
        return supplProvisionAppdxTables;
    }

    public List<SupplProvisionAppdx> supplProvisionAppdxes() {
        return supplProvisionAppdxes;
    }

    public List<TableStruct> tableStructs() {
        return tableStructs;
    }

    public List<TableRow> tableRows() {
        return tableRows;
    }

    public List<TableColumn> tableColumns() {
        return tableColumns;
    }

    public List<FigStruct> figStructs() {
        return figStructs;
    }

    public List<NoteStruct> noteStructs() {
        return noteStructs;
    }

    public List<StyleStruct> styleStructs() {
        return styleStructs;
    }

    public List<FormatStruct> formatStructs() {
        return formatStructs;
    }

    public List<Remarks> remarks() {
        return remarks;
    }

    public @Nullable LawBody lawBody() {
        return lawBody;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(
            Texts.of(lawTitle),
            Texts.of(preamble),
            Texts.of(toc),
            Texts.of(partTitle),
            Texts.of(chapterTitle),
            Texts.of(sectionTitle),
            Texts.of(subsectionTitle),
            Texts.of(divisionTitle),
            Texts.of(parts),
            Texts.of(chapters),
            Texts.of(sections),
            Texts.of(subsections),
            Texts.of(divisions),
            Texts.of(articles),
            Texts.of(supplNotes),
            Texts.of(paragraphs),
            Texts.of(items),
            Texts.of(subitems),
            Texts.of(lists),
            Texts.ofSentences(sentences),
            Texts.of(amendProvisions),
            Texts.of(appdxTables),
            Texts.of(appdxNotes),
            Texts.of(appdxStyles),
            Texts.of(appdxes),
            Texts.of(appdxFigs),
            Texts.of(appdxFormats),
            Texts.of(supplProvisionAppdxStyles),
            Texts.of(supplProvisionAppdxTables),
            Texts.of(supplProvisionAppdxes),
            Texts.of(tableStructs),
            Texts.of(tableRows),
            Texts.of(tableColumns),
            Texts.of(figStructs),
            Texts.of(noteStructs),
            Texts.of(styleStructs),
            Texts.of(formatStructs),
            Texts.of(remarks),
            Texts.of(lawBody)
        );
    }

    private final @Nullable LawTitle lawTitle;
    private final @Nullable Preamble preamble;
    private final @Nullable Toc toc;
    private final @Nullable Label partTitle;
    private final @Nullable Label chapterTitle;
    private final @Nullable Label sectionTitle;
    private final @Nullable Label subsectionTitle;
    private final @Nullable Label divisionTitle;
    private final List<Part> parts;
    private final List<Chapter> chapters;
    private final List<Section> sections;
    private final List<Subsection> subsections;
    private final List<Division> divisions;
    private final List<Article> articles;
    private final List<Label> supplNotes;
    private final List<Paragraph> paragraphs;
    private final List<Item> items;
    private final List<Subitem> subitems;
    private final List<ListBlock> lists;
    private final List<Sentence> sentences;
    private final List<AmendProvision> amendProvisions;
    private final List<AppdxTable> appdxTables;
    private final List<AppdxNote> appdxNotes;
    private final List<AppdxStyle> appdxStyles;
    private final List<Appdx> appdxes;
    private final List<AppdxFig> appdxFigs;
    private final List<AppdxFormat> appdxFormats;
    private final List<SupplProvisionAppdxStyle> supplProvisionAppdxStyles;
    private final List<SupplProvisionAppdxTable> supplProvisionAppdxTables;
    private final List<SupplProvisionAppdx> supplProvisionAppdxes;
    private final List<TableStruct> tableStructs;
    private final List<TableRow> tableRows;
    private final List<TableColumn> tableColumns;
    private final List<FigStruct> figStructs;
    private final List<NoteStruct> noteStructs;
    private final List<StyleStruct> styleStructs;
    private final List<FormatStruct> formatStructs;
    private final List<Remarks> remarks;
    private final @Nullable LawBody lawBody;
}
