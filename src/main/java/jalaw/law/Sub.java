// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import jalaw.xml.XmlElement;

/**
 * Subscript text.
 */
public final class Sub implements SentenceContent, LineContent, TaggedContent, QuoteContent {
    public Sub(final XmlElement element) {
        Elements.expectTag(element, "Sub");
        text = Elements.leafText(element);
    }

    @Override
    public String text() {
        return text;
    }

    private final String text;
}
