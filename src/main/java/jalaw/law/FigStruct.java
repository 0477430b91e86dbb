// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * A titled figure with its remarks.
 */
public final class FigStruct implements QuoteContent, TextSource {
    public FigStruct(final XmlElement element) {
        Elements.expectTag(element, "FigStruct");
        title = Elements.optional(element, "FigStructTitle", Label::new);
        remarksBefore = Elements.before(element, "Fig", "Remarks", Remarks::new);
        fig = Elements.required(element, "Fig", Fig::new);
        remarksAfter = Elements.after(element, "Fig", "Remarks", Remarks::new);
    }

    public @Nullable Label title() {
        return title;
    }

    /**
     * Retrieves the remarks placed before the fig.
     */
    public List<Remarks> remarksBefore() {
        return remarksBefore;
    }

    public Fig fig() {
        return fig;
    }

    /**
     * Retrieves the remarks placed after the fig.
     */
    public List<Remarks> remarksAfter() {
        return remarksAfter;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.of(title), Texts.of(remarksBefore), Texts.of(remarksAfter));
    }

    @Override
    public String text() {
        return "";
    }

    private final @Nullable Label title;
    private final List<Remarks> remarksBefore;
    private final Fig fig;
    private final List<Remarks> remarksAfter;
}
