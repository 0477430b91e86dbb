// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * A part (編). It holds articles directly, or chapters.
 */
public final class Part implements QuoteContent, TextSource {
    public Part(final XmlElement element) {
        Elements.expectTag(element, "Part");
        num = Attributes.requiredString(element, "Num");
        delete = Attributes.bool(element, "Delete");
        hide = Attributes.bool(element, "Hide");
        title = Elements.optional(element, "PartTitle", Label::new);
        articles = Elements.list(element, "Article", Article::new);
        chapters = Elements.list(element, "Chapter", Chapter::new);
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

    public List<Chapter> chapters() {
        return chapters;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.of(title), Texts.of(articles), Texts.of(chapters));
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
    private final List<Chapter> chapters;
}
