// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import jalaw.xml.XmlElement;

/**
 * A reference to an image. Contributes no text.
 */
public final class Fig implements QuoteContent {
    public Fig(final XmlElement element) {
        Elements.expectTag(element, "Fig");
        src = Attributes.requiredString(element, "src");
    }

    /**
     * Retrieves the image location, verbatim.
     */
    public String src() {
        return src;
    }

    @Override
    public String text() {
        return "";
    }

    private final String src;
}
