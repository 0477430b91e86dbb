// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * An arithmetic formula. Formulas are typeset as figures, so they contribute no text.
 */
public final class ArithFormula implements SentenceContent, LineContent, QuoteContent {
    public ArithFormula(final XmlElement element) {
        Elements.expectTag(element, "ArithFormula");
        num = Attributes.integer(element, "Num", 0);
        figs = Elements.list(element, "Fig", Fig::new);
    }

    public @Nullable Integer num() {
        return num;
    }

    public List<Fig> figs() {
        return figs;
    }

    @Override
    public String text() {
        return "";
    }

    private final @Nullable Integer num;
    private final List<Fig> figs;
}
