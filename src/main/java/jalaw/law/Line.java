// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import jalaw.util.Lazy;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * An underlined span of text.
 */
public final class Line implements SentenceContent, TaggedContent, QuoteContent {
    public Line(final XmlElement element) {
        Elements.expectTag(element, "Line");
        style = Attributes.enumeration(element, "Style", LineStyle::byXmlName);
        contents = Lazy.of(() -> ContentContext.LINE.resolve(element));
        text = Lazy.of(() -> ContentContext.join(contents()));
    }

    /**
     * Retrieves the underline style, or {@code null} if the document doesn't specify one.
     */
    public @Nullable LineStyle style() {
        return style;
    }

    public List<LineContent> contents() {
        return contents.get();
    }

    @Override
    public String text() {
        return text.get();
    }

    private final @Nullable LineStyle style;
    private final Lazy<List<LineContent>> contents;
    private final Lazy<String> text;
}
