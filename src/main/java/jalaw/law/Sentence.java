// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import jalaw.util.Lazy;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * A sentence, the unit of running text in every provision.
 * <p>
 * Attributes are decoded when the sentence is bound; the content is resolved on first access.
 */
public final class Sentence implements QuoteContent {
    public Sentence(final XmlElement element) {
        Elements.expectTag(element, "Sentence");
        num = Attributes.integer(element, "Num", 0);
        function = Attributes.enumeration(element, "Function", SentenceFunction::byXmlName);
        indent = Attributes.enumeration(element, "Indent", Indent::byXmlName);
        writingMode = Attributes.enumeration(element, "WritingMode", WritingMode::byXmlName);
        contents = Lazy.of(() -> ContentContext.SENTENCE.resolve(element));
        text = Lazy.of(() -> ContentContext.join(contents()));
    }

    /**
     * Retrieves the position of this sentence within its block, or {@code null} if it isn't numbered.
     */
    public @Nullable Integer num() {
        return num;
    }

    public @Nullable SentenceFunction function() {
        return function;
    }

    public @Nullable Indent indent() {
        return indent;
    }

    public @Nullable WritingMode writingMode() {
        return writingMode;
    }

    /**
     * Retrieves the resolved content in document order.
     */
    public List<SentenceContent> contents() {
        return contents.get();
    }

    /**
     * Retrieves the flattened text, the concatenation of the text of {@link #contents()}.
     */
    @Override
    public String text() {
        return text.get();
    }

    private final @Nullable Integer num;
    private final @Nullable SentenceFunction function;
    private final @Nullable Indent indent;
    private final @Nullable WritingMode writingMode;
    private final Lazy<List<SentenceContent>> contents;
    private final Lazy<String> text;
}
