// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * The title of a law, with its reading and abbreviations.
 */
public final class LawTitle extends TaggedText {
    public LawTitle(final XmlElement element) {
        super(element);
        Elements.expectTag(element, "LawTitle");
        kana = Attributes.string(element, "Kana");
        abbrev = Attributes.string(element, "Abbrev");
        abbrevKana = Attributes.string(element, "AbbrevKana");
    }

    /**
     * Retrieves the reading of the title, or {@code null} if absent.
     */
    public @Nullable String kana() {
        return kana;
    }

    /**
     * Retrieves the abbreviated title, or {@code null} if absent. An attribute present but empty yields {@code ""}.
     */
    public @Nullable String abbrev() {
        return abbrev;
    }

    public @Nullable String abbrevKana() {
        return abbrevKana;
    }

    private final @Nullable String kana;
    private final @Nullable String abbrev;
    private final @Nullable String abbrevKana;
}
