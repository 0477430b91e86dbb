// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * The body of a law: title, enact statement, table of contents, preamble, main provision, supplementary provisions
 * and appendices.
 */
public final class LawBody implements TextSource {
    public LawBody(final XmlElement element) {
        Elements.expectTag(element, "LawBody");
        subject = Attributes.string(element, "Subject");
        lawTitle = Elements.optional(element, "LawTitle", LawTitle::new);
        enactStatement = Elements.optional(element, "EnactStatement", Label::new);
        toc = Elements.optional(element, "TOC", Toc::new);
        preamble = Elements.optional(element, "Preamble", Preamble::new);
        mainProvision = Elements.required(element, "MainProvision", MainProvision::new);
        supplProvisions = Elements.list(element, "SupplProvision", SupplProvision::new);
        appdxTables = Elements.list(element, "AppdxTable", AppdxTable::new);
        appdxNotes = Elements.list(element, "AppdxNote", AppdxNote::new);
        appdxStyles = Elements.list(element, "AppdxStyle", AppdxStyle::new);
        appdxes = Elements.list(element, "Appdx", Appdx::new);
        appdxFigs = Elements.list(element, "AppdxFig", AppdxFig::new);
        appdxFormats = Elements.list(element, "AppdxFormat", AppdxFormat::new);
    }

    /**
     * Retrieves the subject (件名) of laws that have one instead of a proper title, or {@code null}.
     */
    public @Nullable String subject() {
        return subject;
    }

    public @Nullable LawTitle lawTitle() {
        return lawTitle;
    }

    public @Nullable Label enactStatement() {
        return enactStatement;
    }

    public @Nullable Toc toc() {
        return toc;
    }

    public @Nullable Preamble preamble() {
        return preamble;
    }

    public MainProvision mainProvision() {
        return mainProvision;
    }

    public List<SupplProvision> supplProvisions() {
        return supplProvisions;
    }

    public List<AppdxTable> appdxTables() {
        return appdxTables;
    }

    public List<AppdxNote> appdxNotes() {
        return appdxNotes;
    }

    public List<AppdxStyle> appdxStyles() {
        return appdxStyles;
    }

    public List<Appdx> appdxes() {
        return appdxes;
    }

    public List<AppdxFig> appdxFigs() {
        return appdxFigs;
    }

    public List<AppdxFormat> appdxFormats() {
        return appdxFormats;
    }

    /**
     * Yields the title, the enact statement, the preamble, the main provision, the supplementary provisions and then
     * the appendices. The table of contents only repeats headings, so it is left out.
     */
    @Override
    public Stream<String> texts() {
        return Texts.concat(
            Texts.of(lawTitle),
            Texts.of(enactStatement),
            Texts.of(preamble),
            mainProvision.texts(),
            Texts.of(supplProvisions),
            Texts.of(appdxTables),
            Texts.of(appdxNotes),
            Texts.of(appdxStyles),
            Texts.of(appdxes),
            Texts.of(appdxFigs),
            Texts.of(appdxFormats)
        );
    }

    private final @Nullable String subject;
    private final @Nullable LawTitle lawTitle;
    private final @Nullable Label enactStatement;
    private final @Nullable Toc toc;
    private final @Nullable Preamble preamble;
    private final MainProvision mainProvision;
    private final List<SupplProvision> supplProvisions;
    private final List<AppdxTable> appdxTables;
    private final List<AppdxNote> appdxNotes;
    private final List<AppdxStyle> appdxStyles;
    private final List<Appdx> appdxes;
    private final List<AppdxFig> appdxFigs;
    private final List<AppdxFormat> appdxFormats;
}
