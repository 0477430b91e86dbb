// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.xml.XmlElement;

/**
 * A preamble (前文).
 */
public final class Preamble implements TextSource {
    public Preamble(final XmlElement element) {
        Elements.expectTag(element, "Preamble");
        paragraphs = Elements.nonEmptyList(element, "Paragraph", Paragraph::new);
    }

    public List<Paragraph> paragraphs() {
        return paragraphs;
    }

    @Override
    public Stream<String> texts() {
        return Texts.of(paragraphs);
    }

    private final List<Paragraph> paragraphs;
}
