// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import jalaw.xml.XmlElement;

/**
 * Superscript text.
 */
public final class Sup implements SentenceContent, LineContent, TaggedContent, QuoteContent {
    public Sup(final XmlElement element) {
        Elements.expectTag(element, "Sup");
        text = Elements.leafText(element);
    }

    @Override
    public String text() {
        return text;
    }

    private final String text;
}
