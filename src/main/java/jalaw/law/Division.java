// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * A division (目), the lowest heading level above articles.
 */
public final class Division implements QuoteContent, TextSource {
    public Division(final XmlElement element) {
        Elements.expectTag(element, "Division");
        num = Attributes.requiredString(element, "Num");
        delete = Attributes.bool(element, "Delete");
        hide = Attributes.bool(element, "Hide");
        title = Elements.optional(element, "DivisionTitle", Label::new);
        articles = Elements.list(element, "Article", Article::new);
    }

    public String num() {
        return num;
    }

    public @Nullable Boolean delete() {
        return delete;
    }

    public @Nullable Boolean hide() {
        return hide;
    }

    public @Nullable Label title() {
        return title;
    }

    public List<Article> articles() {
        return articles;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.of(title), Texts.of(articles));
    }

    @Override
    public String text() {
        return "";
    }

    private final String num;
    private final @Nullable Boolean delete;
    private final @Nullable Boolean hide;
    private final @Nullable Label title;
    private final List<Article> articles;
}
