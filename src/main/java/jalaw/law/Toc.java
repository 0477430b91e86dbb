// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * A table of contents (目次).
 */
public final class Toc implements QuoteContent, TextSource {
    public Toc(final XmlElement element) {
        Elements.expectTag(element, "TOC");
        label = Elements.optional(element, "TOCLabel", Label::new);
        preambleLabel = Elements.optional(element, "TOCPreambleLabel", Label::new);
        parts = Elements.list(element, "TOCPart", TocPart::new);
        chapters = Elements.list(element, "TOCChapter", TocChapter::new);
        sections = Elements.list(element, "TOCSection", TocSection::new);
        articles = Elements.list(element, "TOCArticle", TocArticle::new);
        supplProvision = Elements.optional(element, "TOCSupplProvision", TocSupplProvision::new);
        appdxTableLabels = Elements.list(element, "TOCAppdxTableLabel", Label::new);
    }

    /**
     * Retrieves the heading of the table of contents itself, usually {@code 目次}.
     */
    public @Nullable Label label() {
        return label;
    }

    public @Nullable Label preambleLabel() {
        return preambleLabel;
    }

    public List<TocPart> parts() {
        return parts;
    }

    public List<TocChapter> chapters() {
        return chapters;
    }

    public List<TocSection> sections() {
        return sections;
    }

    public List<TocArticle> articles() {
        return articles;
    }

    public @Nullable TocSupplProvision supplProvision() {
        return supplProvision;
    }

    public List<Label> appdxTableLabels() {
        return appdxTableLabels;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(
            Texts.of(label),
            Texts.of(preambleLabel),
            Texts.of(parts),
            Texts.of(chapters),
            Texts.of(sections),
            Texts.of(articles),
            Texts.of(supplProvision),
            Texts.of(appdxTableLabels)
        );
    }

    @Override
    public String text() {
        return "";
    }

    private final @Nullable Label label;
    private final @Nullable Label preambleLabel;
    private final List<TocPart> parts;
    private final List<TocChapter> chapters;
    private final List<TocSection> sections;
    private final List<TocArticle> articles;
    private final @Nullable TocSupplProvision supplProvision;
    private final List<Label> appdxTableLabels;
}
