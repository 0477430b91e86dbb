// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * An appended figure (別図).
 */
public final class AppdxFig implements QuoteContent, TextSource {
    public AppdxFig(final XmlElement element) {
        Elements.expectTag(element, "AppdxFig");
        num = Attributes.integer(element, "Num", 0);
        title = Elements.optional(element, "AppdxFigTitle", OrientedLabel::new);
        relatedArticleNum = Elements.optional(element, "RelatedArticleNum", Label::new);
        figStructs = Elements.list(element, "FigStruct", FigStruct::new);
        tableStructs = Elements.list(element, "TableStruct", TableStruct::new);
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

    public List<FigStruct> figStructs() {
        return figStructs;
    }

    public List<TableStruct> tableStructs() {
        return tableStructs;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(
            Texts.of(title),
            Texts.of(relatedArticleNum),
            Texts.of(figStructs),
            Texts.of(tableStructs)
        );
    }

    @Override
    public String text() {
        return "";
    }

    private final @Nullable Integer num;
    private final @Nullable OrientedLabel title;
    private final @Nullable Label relatedArticleNum;
    private final List<FigStruct> figStructs;
    private final List<TableStruct> tableStructs;
}
