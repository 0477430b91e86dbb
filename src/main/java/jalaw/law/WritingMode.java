// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import jalaw.util.annotation.Nullable;

/**
 * Text direction of sentences, tables and appendix titles.
 */
public enum WritingMode {
    VERTICAL("vertical"),
    HORIZONTAL("horizontal");

    WritingMode(final String xmlName) {
        this.xmlName = xmlName;
    }

    /**
     * Finds the value written as {@code xmlName} in documents, or returns {@code null} if there is none.
     */
    public static @Nullable WritingMode byXmlName(final String xmlName) {
        return valuesByXmlName.get(xmlName);
    }

    /**
     * Retrieves the attribute value representing this value in documents.
     */
    public String xmlName() {
        return xmlName;
    }

    private static final Map<String, WritingMode> valuesByXmlName =
        Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(WritingMode::xmlName, Function.identity()));

    private final String xmlName;
}
