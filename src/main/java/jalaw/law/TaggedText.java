// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.Lazy;
import jalaw.xml.XmlElement;

/**
 * A title, caption, label or statement: plain text with inline markup (ruby, superscript, subscript, underline).
 * <p>
 * All such elements behave the same and differ only in the tag they are bound to; subclasses add the attributes a few
 * of them carry.
 */
public abstract sealed class TaggedText implements TextSource
    permits Label, LawTitle, Caption, RemarksLabel, OrientedLabel {
    TaggedText(final XmlElement element) {
        tag = element.tag();
        taggedText = Lazy.of(() -> ContentContext.TAGGED_TEXT.resolve(element));
        text = Lazy.of(() -> ContentContext.join(taggedText()));
    }

    /**
     * Retrieves the tag this node is bound to, like {@code ArticleTitle}.
     */
    public final String tag() {
        return tag;
    }

    /**
     * Retrieves the resolved content in document order.
     */
    public final List<TaggedContent> taggedText() {
        return taggedText.get();
    }

    /**
     * Retrieves the flattened text. An empty element yields the empty string.
     */
    public final String text() {
        return text.get();
    }

    @Override
    public final Stream<String> texts() {
        return Stream.of(text());
    }

    @Override
    public String toString() {
        return "<" + tag + ">" + text();
    }

    private final String tag;
    private final Lazy<List<TaggedContent>> taggedText;
    private final Lazy<String> text;
}
