// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.Set;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * An article or paragraph caption, the parenthesized heading like {@code （目的）}.
 */
public final class Caption extends TaggedText {
    public Caption(final XmlElement element) {
        super(element);
        Elements.expectTag(element, tags, "a caption");
        commonCaption = Attributes.bool(element, "CommonCaption");
    }

    /**
     * Tells whether the caption is shared with the following articles, or {@code null} if the document doesn't say.
     */
    public @Nullable Boolean commonCaption() {
        return commonCaption;
    }

    private static final Set<String> tags = Set.of("ArticleCaption", "ParagraphCaption");

    private final @Nullable Boolean commonCaption;
}
