// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

/**
 * Content of a quoted structure, {@link QuoteStruct}: text, inline markup, sentences, and any whole provision,
 * table, figure, appendix or table of contents entry.
 * <p>
 * Only text, inline markup and sentences carry inline text. Every other kind contributes the empty string to
 * {@link #text()}; read its text with {@link TextSource#texts()} instead.
 */
public sealed interface QuoteContent extends Content permits
    PlainText, Ruby, Sup, Sub, Line, ArithFormula, QuoteStruct, Sentence, Fig,
    Part, Chapter, Section, Subsection, Division, Article, Paragraph, Item, Subitem, ListBlock,
    Table, TableStruct, FigStruct, NoteStruct, StyleStruct, FormatStruct, Note, Style, Format, Remarks,
    AppdxTable, AppdxNote, AppdxStyle, AppdxFig, AppdxFormat, Appdx,
    Toc, TocPart, TocChapter, TocSection, TocSubsection, TocDivision, TocArticle, TocSupplProvision {
}
