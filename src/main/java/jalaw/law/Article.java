// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.Trace;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * An article (条).
 */
public final class Article implements QuoteContent, TextSource {
    public Article(final XmlElement element) {
        Elements.expectTag(element, "Article");
        try (final var trace = new Trace(() -> "Binding article " + element)) {
            trace.use();
            num = Attributes.requiredString(element, "Num");
            delete = Attributes.bool(element, "Delete");
            hide = Attributes.bool(element, "Hide");
            caption = Elements.optional(element, "ArticleCaption", Caption::new);
            title = Elements.optional(element, "ArticleTitle", Label::new);
            paragraphs = Elements.nonEmptyList(element, "Paragraph", Paragraph::new);
            supplNote = Elements.optional(element, "SupplNote", Label::new);
        }
    }

    /**
     * Retrieves the article number, like {@code "3"} or {@code "3_2"} for an inserted article.
     */
    public String num() {
        return num;
    }

    public @Nullable Boolean delete() {
        return delete;
    }

    public @Nullable Boolean hide() {
        return hide;
    }

    public @Nullable Caption caption() {
        return caption;
    }

    public @Nullable Label title() {
        return title;
    }

    public List<Paragraph> paragraphs() {
        return paragraphs;
    }

    public @Nullable Label supplNote() {
        return supplNote;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.of(caption), Texts.of(title), Texts.of(paragraphs), Texts.of(supplNote));
    }

    @Override
    public String text() {
        return "";
    }

    private final String num;
    private final @Nullable Boolean delete;
    private final @Nullable Boolean hide;
    private final @Nullable Caption caption;
    private final @Nullable Label title;
    private final List<Paragraph> paragraphs;
    private final @Nullable Label supplNote;
}
