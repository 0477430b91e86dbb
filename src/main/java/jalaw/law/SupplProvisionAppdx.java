// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * An appendix of the supplementary provisions (附則付録).
 */
public final class SupplProvisionAppdx implements TextSource {
    public SupplProvisionAppdx(final XmlElement element) {
        Elements.expectTag(element, "SupplProvisionAppdx");
        num = Attributes.integer(element, "Num", 0);
        arithFormulaNum = Elements.optional(element, "ArithFormulaNum", Label::new);
        relatedArticleNum = Elements.optional(element, "RelatedArticleNum", Label::new);
        arithFormulas = Elements.list(element, "ArithFormula", ArithFormula::new);
    }

    public @Nullable Integer num() {
        return num;
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

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.of(arithFormulaNum), Texts.of(relatedArticleNum));
    }

    private final @Nullable Integer num;
    private final @Nullable Label arithFormulaNum;
    private final @Nullable Label relatedArticleNum;
    private final List<ArithFormula> arithFormulas;
}
