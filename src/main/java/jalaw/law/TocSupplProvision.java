// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * The table of contents entry for the supplementary provisions.
 */
public final class TocSupplProvision implements QuoteContent, TextSource {
    public TocSupplProvision(final XmlElement element) {
        Elements.expectTag(element, "TOCSupplProvision");
        label = Elements.optional(element, "SupplProvisionLabel", Label::new);
        articleRange = Elements.optional(element, "ArticleRange", Label::new);
        articles = Elements.list(element, "TOCArticle", TocArticle::new);
        chapters = Elements.list(element, "TOCChapter", TocChapter::new);
    }

    public @Nullable Label label() {
        return label;
    }

    public @Nullable Label articleRange() {
        return articleRange;
    }

    public List<TocArticle> articles() {
        return articles;
    }

    public List<TocChapter> chapters() {
        return chapters;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.of(label), Texts.of(articleRange), Texts.of(articles), Texts.of(chapters));
    }

    @Override
    public String text() {
        return "";
    }

    private final @Nullable Label label;
    private final @Nullable Label articleRange;
    private final List<TocArticle> articles;
    private final List<TocChapter> chapters;
}
