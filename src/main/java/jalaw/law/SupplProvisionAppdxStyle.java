// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * An appended form of the supplementary provisions (附則様式).
 */
public final class SupplProvisionAppdxStyle implements TextSource {
    public SupplProvisionAppdxStyle(final XmlElement element) {
        Elements.expectTag(element, "SupplProvisionAppdxStyle");
        num = Attributes.integer(element, "Num", 0);
        title = Elements.optional(element, "SupplProvisionAppdxStyleTitle", OrientedLabel::new);
        relatedArticleNum = Elements.optional(element, "RelatedArticleNum", Label::new);
        styleStructs = Elements.list(element, "StyleStruct", StyleStruct::new);
    }

    public @Nullable Integer num() {
        return num;
    }

    public @Nullable OrientedLabel title() {
        return title;
    }

    /**
     * Retrieves the reference to the articles this appendix belongs to, like {@code （第三条関係）}.
     */
    public @Nullable Label relatedArticleNum() {
        return relatedArticleNum;
    }

    public List<StyleStruct> styleStructs() {
        return styleStructs;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.of(title), Texts.of(relatedArticleNum), Texts.of(styleStructs));
    }

    private final @Nullable Integer num;
    private final @Nullable OrientedLabel title;
    private final @Nullable Label relatedArticleNum;
    private final List<StyleStruct> styleStructs;
}
