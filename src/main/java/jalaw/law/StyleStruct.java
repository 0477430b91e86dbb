// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * A titled form (様式) with its remarks.
 */
public final class StyleStruct implements QuoteContent, TextSource {
    public StyleStruct(final XmlElement element) {
        Elements.expectTag(element, "StyleStruct");
        title = Elements.optional(element, "StyleStructTitle", Label::new);
        remarksBefore = Elements.before(element, "Style", "Remarks", Remarks::new);
        style = Elements.required(element, "Style", Style::new);
        remarksAfter = Elements.after(element, "Style", "Remarks", Remarks::new);
    }

    public @Nullable Label title() {
        return title;
    }

    /**
     * Retrieves the remarks placed before the style.
     */
    public List<Remarks> remarksBefore() {
        return remarksBefore;
    }

    public Style style() {
        return style;
    }

    /**
     * Retrieves the remarks placed after the style.
     */
    public List<Remarks> remarksAfter() {
        return remarksAfter;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.of(title), Texts.of(remarksBefore), style.texts(), Texts.of(remarksAfter));
    }

    @Override
    public String text() {
        return "";
    }

    private final @Nullable Label title;
    private final List<Remarks> remarksBefore;
    private final Style style;
    private final List<Remarks> remarksAfter;
}
