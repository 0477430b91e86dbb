// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * An appended table (別表).
 */
public final class AppdxTable implements QuoteContent, TextSource {
    public AppdxTable(final XmlElement element) {
        Elements.expectTag(element, "AppdxTable");
        num = Attributes.integer(element, "Num", 0);
        title = Elements.optional(element, "AppdxTableTitle", OrientedLabel::new);
        relatedArticleNum = Elements.optional(element, "RelatedArticleNum", Label::new);
        tableStructs = Elements.list(element, "TableStruct", TableStruct::new);
        items = Elements.list(element, "Item", Item::new);
        remarks = Elements.list(element, "Remarks", Remarks::new);
    }

    public @Nullable Integer num() {
        return num;
    }

    public @Nullable OrientedLabel title() {
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

    public List<Item> items() {
        return items;
    }

    public List<Remarks> remarks() {
        return remarks;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(
            Texts.of(title),
            Texts.of(relatedArticleNum),
            Texts.of(tableStructs),
            Texts.of(items),
            Texts.of(remarks)
        );
    }

    @Override
    public String text() {
        return "";
    }

    private final @Nullable Integer num;
    private final @Nullable OrientedLabel title;
    private final @Nullable Label relatedArticleNum;
    private final List<TableStruct> tableStructs;
    private final List<Item> items;
    private final List<Remarks> remarks;
}
