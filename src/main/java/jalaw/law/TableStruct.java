// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * A titled table with its remarks.
 */
public final class TableStruct implements QuoteContent, TextSource {
    public TableStruct(final XmlElement element) {
        Elements.expectTag(element, "TableStruct");
        title = Elements.optional(element, "TableStructTitle", OrientedLabel::new);
        remarksBefore = Elements.before(element, "Table", "Remarks", Remarks::new);
        table = Elements.required(element, "Table", Table::new);
        remarksAfter = Elements.after(element, "Table", "Remarks", Remarks::new);
    }

    public @Nullable OrientedLabel title() {
        return title;
    }

    /**
     * Retrieves the remarks placed before the table.
     */
    public List<Remarks> remarksBefore() {
        return remarksBefore;
    }

    public Table table() {
        return table;
    }

    /**
     * Retrieves the remarks placed after the table.
     */
    public List<Remarks> remarksAfter() {
        return remarksAfter;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.of(title), Texts.of(remarksBefore), table.texts(), Texts.of(remarksAfter));
    }

    @Override
    public String text() {
        return "";
    }

    private final @Nullable OrientedLabel title;
    private final List<Remarks> remarksBefore;
    private final Table table;
    private final List<Remarks> remarksAfter;
}
