// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.xml.XmlElement;

/**
 * The body of a form (様式): figures only.
 */
public final class Style implements QuoteContent, TextSource {
    public Style(final XmlElement element) {
        Elements.expectTag(element, "Style");
        figs = Elements.list(element, "Fig", Fig::new);
    }

    public List<Fig> figs() {
        return figs;
    }

    @Override
    public Stream<String> texts() {
        return Stream.empty();
    }

    @Override
    public String text() {
        return "";
    }

    private final List<Fig> figs;
}
