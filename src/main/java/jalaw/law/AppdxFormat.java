// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * An appended format (別記書式).
 */
public final class AppdxFormat implements QuoteContent, TextSource {
    public AppdxFormat(final XmlElement element) {
        Elements.expectTag(element, "AppdxFormat");
        num = Attributes.integer(element, "Num", 0);
        title = Elements.optional(element, "AppdxFormatTitle", OrientedLabel::new);
        relatedArticleNum = Elements.optional(element, "RelatedArticleNum", Label::new);
        formatStructs = Elements.list(element, "FormatStruct", FormatStruct::new);
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

    public List<FormatStruct> formatStructs() {
        return formatStructs;
    }

    public List<Remarks> remarks() {
        return remarks;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(
            Texts.of(title),
            Texts.of(relatedArticleNum),
            Texts.of(formatStructs),
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
    private final List<FormatStruct> formatStructs;
    private final List<Remarks> remarks;
}
