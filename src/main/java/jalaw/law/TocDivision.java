// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * A table of contents entry for a division.
 */
public final class TocDivision implements QuoteContent, TextSource {
    public TocDivision(final XmlElement element) {
        Elements.expectTag(element, "TOCDivision");
        num = Attributes.requiredString(element, "Num");
        delete = Attributes.bool(element, "Delete");
        title = Elements.optional(element, "DivisionTitle", Label::new);
        articleRange = Elements.optional(element, "ArticleRange", Label::new);
    }

    public String num() {
        return num;
    }

    public @Nullable Boolean delete() {
        return delete;
    }

    public @Nullable Label title() {
        return title;
    }

    /**
     * Retrieves the range of articles the entry covers, like {@code （第一条―第十条）}.
     */
    public @Nullable Label articleRange() {
        return articleRange;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.of(title), Texts.of(articleRange));
    }

    @Override
    public String text() {
        return "";
    }

    private final String num;
    private final @Nullable Boolean delete;
    private final @Nullable Label title;
    private final @Nullable Label articleRange;
}
