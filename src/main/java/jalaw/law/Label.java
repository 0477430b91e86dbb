// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.HashSet;
import java.util.Set;
import jalaw.xml.XmlElement;

/**
 * A tagged-text element with no attributes of its own: article and item titles, paragraph numbers, enact statements,
 * struct titles and the like.
 */
public final class Label extends TaggedText {
    public Label(final XmlElement element) {
        super(element);
        Elements.expectTag(element, tags, "a label element");
    }

    private static final Set<String> tags = buildTags();

    private static Set<String> buildTags() {
        final var result = new HashSet<>(Set.of(
            "ParagraphNum",
            "ItemTitle",
            "ClassTitle",
            "ArticleTitle",
            "PartTitle",
            "ChapterTitle",
            "SectionTitle",
            "SubsectionTitle",
            "DivisionTitle",
            "EnactStatement",
            "SupplNote",
            "ArticleRange",
            "TableHeaderColumn",
            "FigStructTitle",
            "NoteStructTitle",
            "StyleStructTitle",
            "FormatStructTitle",
            "SupplProvisionLabel",
            "SupplProvisionAppdxTableTitle",
            "RelatedArticleNum",
            "ArithFormulaNum",
            "TOCLabel",
            "TOCPreambleLabel",
            "TOCAppdxTableLabel"
        ));
        for (int level = 1; level <= Subitem.maxLevel; level += 1) {
            result.add("Subitem" + level + "Title");
        }
        return Set.copyOf(result);
    }
}
