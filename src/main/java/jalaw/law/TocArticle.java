// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * A table of contents entry for a single article.
 */
public final class TocArticle implements QuoteContent, TextSource {
    public TocArticle(final XmlElement element) {
        Elements.expectTag(element, "TOCArticle");
        num = Attributes.requiredString(element, "Num");
        delete = Attributes.bool(element, "Delete");
        title = Elements.optional(element, "ArticleTitle", Label::new);
        caption = Elements.optional(element, "ArticleCaption", Caption::new);
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

    public @Nullable Caption caption() {
        return caption;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.of(title), Texts.of(caption));
    }

    @Override
    public String text() {
        return "";
    }

    private final String num;
    private final @Nullable Boolean delete;
    private final @Nullable Label title;
    private final @Nullable Caption caption;
}
