// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import jalaw.util.Lazy;
import jalaw.xml.XmlElement;

/**
 * A quoted structure embedded in running text, typically a provision quoted by an amendment.
 *
 * @see QuoteContent
 */
public final class QuoteStruct implements SentenceContent, LineContent, QuoteContent {
    public QuoteStruct(final XmlElement element) {
        Elements.expectTag(element, "QuoteStruct");
        contents = Lazy.of(() -> ContentContext.QUOTE.resolve(element));
        text = Lazy.of(() -> ContentContext.join(contents()));
    }

    public List<QuoteContent> contents() {
        return contents.get();
    }

    @Override
    public String text() {
        return text.get();
    }

    private final Lazy<List<QuoteContent>> contents;
    private final Lazy<String> text;
}
