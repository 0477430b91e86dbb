// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * The label of a remarks block, such as {@code 備考}.
 */
public final class RemarksLabel extends TaggedText {
    public RemarksLabel(final XmlElement element) {
        super(element);
        Elements.expectTag(element, "RemarksLabel");
        lineBreak = Attributes.bool(element, "LineBreak");
    }

    public @Nullable Boolean lineBreak() {
        return lineBreak;
    }

    private final @Nullable Boolean lineBreak;
}
