// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * An appendix (付録), typically formulas.
 */
public final class Appdx implements QuoteContent, TextSource {
    public Appdx(final XmlElement element) {
        Elements.expectTag(element, "Appdx");
        arithFormulaNum = Elements.optional(element, "ArithFormulaNum", Label::new);
        relatedArticleNum = Elements.optional(element, "RelatedArticleNum", Label::new);
        arithFormulas = Elements.list(element, "ArithFormula", ArithFormula::new);
        remarks = Elements.list(element, "Remarks", Remarks::new);
    }

    public @Nullable Label arithFormulaNum() {
        return arithFormulaNum;
    }

    /**
     * Retrieves the reference to the articles this appendix belongs to, like {@code （第三条関係）}.
     */
    public @Nullable Label relatedArticleNum() {
        return relatedArticleNum;
    }

    public List<ArithFormula> arithFormulas() {
        return arithFormulas;
    }

    public List<Remarks> remarks() {
        return remarks;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(
            Texts.of(arithFormulaNum),
            Texts.of(relatedArticleNum),
            Texts.of(remarks)
        );
    }

    @Override
    public String text() {
        return "";
    }

    private final @Nullable Label arithFormulaNum;
    private final @Nullable Label relatedArticleNum;
    private final List<ArithFormula> arithFormulas;
    private final List<Remarks> remarks;
}
