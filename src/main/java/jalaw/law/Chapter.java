// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * A chapter (章). It holds articles directly, or sections.
 */
public final class Chapter implements QuoteContent, TextSource {
    public Chapter(final XmlElement element) {
        Elements.expectTag(element, "Chapter");
        num = Attributes.requiredString(element, "Num");
        delete = Attributes.bool(element, "Delete");
        hide = Attributes.bool(element, "Hide");
        title = Elements.optional(element, "ChapterTitle", Label::new);
        articles = Elements.list(element, "Article", Article::new);
        sections = Elements.list(element, "Section", Section::new);
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

    public List<Section> sections() {
        return sections;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.of(title), Texts.of(articles), Texts.of(sections));
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
    private final List<Section> sections;
}
