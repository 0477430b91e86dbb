// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * The main provision (本則): the body of the law proper, structured by parts, chapters, sections, articles, or just
 * paragraphs for short laws.
 */
public final class MainProvision implements TextSource {
    public MainProvision(final XmlElement element) {
        Elements.expectTag(element, "MainProvision");
        extract = Attributes.bool(element, "Extract");
        parts = Elements.list(element, "Part", Part::new);
        chapters = Elements.list(element, "Chapter", Chapter::new);
        sections = Elements.list(element, "Section", Section::new);
        articles = Elements.list(element, "Article", Article::new);
        paragraphs = Elements.list(element, "Paragraph", Paragraph::new);
    }

    /**
     * Tells whether the document holds only an extract of the provision, or {@code null} if it doesn't say.
     */
    public @Nullable Boolean extract() {
        return extract;
    }

    public List<Part> parts() {
        return parts;
    }

    public List<Chapter> chapters() {
        return chapters;
    }

    public List<Section> sections() {
        return sections;
    }

    public List<Article> articles() {
        return articles;
    }

    public List<Paragraph> paragraphs() {
        return paragraphs;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(
            Texts.of(parts),
            Texts.of(chapters),
            Texts.of(sections),
            Texts.of(articles),
            Texts.of(paragraphs)
        );
    }

    private final @Nullable Boolean extract;
    private final List<Part> parts;
    private final List<Chapter> chapters;
    private final List<Section> sections;
    private final List<Article> articles;
    private final List<Paragraph> paragraphs;
}
