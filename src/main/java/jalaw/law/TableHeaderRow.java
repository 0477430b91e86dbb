// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.xml.XmlElement;

/**
 * A header row of a table.
 */
public final class TableHeaderRow implements TextSource {
    public TableHeaderRow(final XmlElement element) {
        Elements.expectTag(element, "TableHeaderRow");
        columns = Elements.nonEmptyList(element, "TableHeaderColumn", Label::new);
    }

    public List<Label> columns() {
        return columns;
    }

    @Override
    public Stream<String> texts() {
        return Texts.of(columns);
    }

    private final List<Label> columns;
}
