// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * A table: optional header rows followed by body rows.
 */
public final class Table implements QuoteContent, TextSource {
    public Table(final XmlElement element) {
        Elements.expectTag(element, "Table");
        writingMode = Attributes.enumeration(element, "WritingMode", WritingMode::byXmlName);
        headerRows = Elements.list(element, "TableHeaderRow", TableHeaderRow::new);
        rows = Elements.nonEmptyList(element, "TableRow", TableRow::new);
    }

    public @Nullable WritingMode writingMode() {
        return writingMode;
    }

    public List<TableHeaderRow> headerRows() {
        return headerRows;
    }

    public List<TableRow> rows() {
        return rows;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.of(headerRows), Texts.of(rows));
    }

    @Override
    public String text() {
        return "";
    }

    private final @Nullable WritingMode writingMode;
    private final List<TableHeaderRow> headerRows;
    private final List<TableRow> rows;
}
