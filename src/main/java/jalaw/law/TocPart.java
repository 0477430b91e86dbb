// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * A table of contents entry for a part.
 */
public final class TocPart implements QuoteContent, TextSource {
    public TocPart(final XmlElement element) {
        Elements.expectTag(element, "TOCPart");
        num = Attributes.requiredString(element, "Num");
        delete = Attributes.bool(element, "Delete");
        title = Elements.optional(element, "PartTitle", Label::new);
        articleRange = Elements.optional(element, "ArticleRange", Label::new);
        chapters = Elements.list(element, "TOCChapter", TocChapter::new);
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

    public List<TocChapter> chapters() {
        return chapters;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.of(title), Texts.of(articleRange), Texts.of(chapters));
    }

    @Override
    public String text() {
        return "";
    }

    private final String num;
    private final @Nullable Boolean delete;
    private final @Nullable Label title;
    private final @Nullable Label articleRange;
    private final List<TocChapter> chapters;
}
