// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * A titled format (書式) with its remarks.
 */
public final class FormatStruct implements QuoteContent, TextSource {
    public FormatStruct(final XmlElement element) {
        Elements.expectTag(element, "FormatStruct");
        title = Elements.optional(element, "FormatStructTitle", Label::new);
        remarksBefore = Elements.before(element, "Format", "Remarks", Remarks::new);
        format = Elements.required(element, "Format", Format::new);
        remarksAfter = Elements.after(element, "Format", "Remarks", Remarks::new);
    }

    public @Nullable Label title() {
        return title;
    }

    /**
     * Retrieves the remarks placed before the format.
     */
    public List<Remarks> remarksBefore() {
        return remarksBefore;
    }

    public Format format() {
        return format;
    }

    /**
     * Retrieves the remarks placed after the format.
     */
    public List<Remarks> remarksAfter() {
        return remarksAfter;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.of(title), Texts.of(remarksBefore), format.texts(), Texts.of(remarksAfter));
    }

    @Override
    public String text() {
        return "";
    }

    private final @Nullable Label title;
    private final List<Remarks> remarksBefore;
    private final Format format;
    private final List<Remarks> remarksAfter;
}
