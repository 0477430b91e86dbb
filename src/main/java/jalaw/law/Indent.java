// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import jalaw.util.annotation.Nullable;

/**
 * The provision level a sentence is indented as.
 */
public enum Indent {
    PARAGRAPH("Paragraph"),
    ITEM("Item"),
    SUBITEM1("Subitem1"),
    SUBITEM2("Subitem2"),
    SUBITEM3("Subitem3"),
    SUBITEM4("Subitem4"),
    SUBITEM5("Subitem5"),
    SUBITEM6("Subitem6"),
    SUBITEM7("Subitem7"),
    SUBITEM8("Subitem8"),
    SUBITEM9("Subitem9"),
    SUBITEM10("Subitem10");

    Indent(final String xmlName) {
        this.xmlName = xmlName;
    }

    /**
     * Finds the value written as {@code xmlName} in documents, or returns {@code null} if there is none.
     */
    public static @Nullable Indent byXmlName(final String xmlName) {
        return valuesByXmlName.get(xmlName);
    }

    /**
     * Retrieves the attribute value representing this value in documents.
     */
    public String xmlName() {
        return xmlName;
    }

    private static final Map<String, Indent> valuesByXmlName =
        Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(Indent::xmlName, Function.identity()));

    private final String xmlName;
}
