// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.Set;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * A table or appendix title that declares its own writing mode.
 */
public final class OrientedLabel extends TaggedText {
    public OrientedLabel(final XmlElement element) {
        super(element);
        Elements.expectTag(element, tags, "a table or appendix title");
        writingMode = Attributes.enumeration(element, "WritingMode", WritingMode::byXmlName);
    }

    public @Nullable WritingMode writingMode() {
        return writingMode;
    }

    private static final Set<String> tags = Set.of(
        "TableStructTitle",
        "SupplProvisionAppdxStyleTitle",
        "AppdxTableTitle",
        "AppdxNoteTitle",
        "AppdxStyleTitle",
        "AppdxFigTitle",
        "AppdxFormatTitle"
    );

    private final @Nullable WritingMode writingMode;
}
