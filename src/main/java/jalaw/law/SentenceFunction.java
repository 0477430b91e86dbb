// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import jalaw.util.annotation.Nullable;

/**
 * Role of a sentence within its provision: the main clause or a proviso.
 */
public enum SentenceFunction {
    MAIN("main"),
    PROVISO("proviso");

    SentenceFunction(final String xmlName) {
        this.xmlName = xmlName;
    }

    /**
     * Finds the value written as {@code xmlName} in documents, or returns {@code null} if there is none.
     */
    public static @Nullable SentenceFunction byXmlName(final String xmlName) {
        return valuesByXmlName.get(xmlName);
    }

    /**
     * Retrieves the attribute value representing this value in documents.
     */
    public String xmlName() {
        return xmlName;
    }

    private static final Map<String, SentenceFunction> valuesByXmlName =
        Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(SentenceFunction::xmlName, Function.identity()));

    private final String xmlName;
}
