// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * An appended table of the supplementary provisions (附則別表).
 */
public final class SupplProvisionAppdxTable implements TextSource {
    public SupplProvisionAppdxTable(final XmlElement element) {
        Elements.expectTag(element, "SupplProvisionAppdxTable");
        num = Attributes.integer(element, "Num", 0);
        title = Elements.optional(element, "SupplProvisionAppdxTableTitle", Label::new);
        relatedArticleNum = Elements.optional(element, "RelatedArticleNum", Label::new);
        tableStructs = Elements.list(element, "TableStruct", TableStruct::new);
    }

    public @Nullable Integer num() {
        return num;
    }

    public @Nullable Label title() {
        return title;
    }

    /**
     * Retrieves the reference to the articles this appendix belongs to, like {@code （第三条関係）}.
     */
    public @Nullable Label relatedArticleNum() {
        return relatedArticleNum;
    }

    public List<TableStruct> tableStructs() {
        return tableStructs;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.of(title), Texts.of(relatedArticleNum), Texts.of(tableStructs));
    }

    private final @Nullable Integer num;
    private final @Nullable Label title;
    private final @Nullable Label relatedArticleNum;
    private final List<TableStruct> tableStructs;
}
