// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.Trace;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * Supplementary provisions (附則), either of the original law or of one of its amendments.
 */
public final class SupplProvision implements TextSource {
    public SupplProvision(final XmlElement element) {
        Elements.expectTag(element, "SupplProvision");
        try (final var trace = new Trace(() -> describe(element))) {
            trace.use();
            type = Attributes.enumeration(element, "Type", SupplProvisionType::byXmlName);
            amendLawNum = Attributes.string(element, "AmendLawNum");
            extract = Attributes.bool(element, "Extract");
            label = Elements.optional(element, "SupplProvisionLabel", Label::new);
            chapters = Elements.list(element, "Chapter", Chapter::new);
            articles = Elements.list(element, "Article", Article::new);
            paragraphs = Elements.list(element, "Paragraph", Paragraph::new);
            appdxTables = Elements.list(element, "SupplProvisionAppdxTable", SupplProvisionAppdxTable::new);
            appdxStyles = Elements.list(element, "SupplProvisionAppdxStyle", SupplProvisionAppdxStyle::new);
            appdxes = Elements.list(element, "SupplProvisionAppdx", SupplProvisionAppdx::new);
        }
    }

    public @Nullable SupplProvisionType type() {
        return type;
    }

    /**
     * Retrieves the number of the amending law these provisions belong to, or {@code null} for the original law's.
     */
    public @Nullable String amendLawNum() {
        return amendLawNum;
    }

    public @Nullable Boolean extract() {
        return extract;
    }

    public @Nullable Label label() {
        return label;
    }

    public List<Chapter> chapters() {
        return chapters;
    }

    public List<Article> articles() {
        return articles;
    }

    public List<Paragraph> paragraphs() {
        return paragraphs;
    }

    public List<SupplProvisionAppdxTable> appdxTables() {
        return appdxTables;
    }

    public List<SupplProvisionAppdxStyle> appdxStyles() {
        return appdxStyles;
    }

    public List<SupplProvisionAppdx> appdxes() {
        return appdxes;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(
            Texts.of(label),
            Texts.of(chapters),
            Texts.of(articles),
            Texts.of(paragraphs),
            Texts.of(appdxTables),
            Texts.of(appdxStyles),
            Texts.of(appdxes)
        );
    }

    private static String describe(final XmlElement element) {
        final var amendLawNum = element.attribute("AmendLawNum");
        return (amendLawNum != null)
            ? "Binding supplementary provisions of " + amendLawNum
            : "Binding supplementary provisions";
    }

    private final @Nullable SupplProvisionType type;
    private final @Nullable String amendLawNum;
    private final @Nullable Boolean extract;
    private final @Nullable Label label;
    private final List<Chapter> chapters;
    private final List<Article> articles;
    private final List<Paragraph> paragraphs;
    private final List<SupplProvisionAppdxTable> appdxTables;
    private final List<SupplProvisionAppdxStyle> appdxStyles;
    private final List<SupplProvisionAppdx> appdxes;
}
