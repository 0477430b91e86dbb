// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.xml.XmlElement;

/**
 * A body row of a table.
 */
public final class TableRow implements TextSource {
    public TableRow(final XmlElement element) {
        Elements.expectTag(element, "TableRow");
        columns = Elements.nonEmptyList(element, "TableColumn", TableColumn::new);
    }

    public List<TableColumn> columns() {
        return columns;
    }

    @Override
    public Stream<String> texts() {
        return Texts.of(columns);
    }

    private final List<TableColumn> columns;
}
