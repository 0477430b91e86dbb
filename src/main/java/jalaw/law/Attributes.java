// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.function.Function;
import jalaw.util.annotation.Nullable;
import jalaw.util.condition.ConditionContext;
import jalaw.util.condition.UnhandledErrorError;
import jalaw.xml.XmlElement;

/**
 * Typed attribute lookup. Every method distinguishes an absent attribute from a present one and never substitutes a
 * default; a present value that doesn't fit the requested type is a fatal {@link InvalidAttributeErrorCondition}.
 */
final class Attributes {
    private Attributes() {
    }

    static @Nullable String string(final XmlElement element, final String name) {
        return element.attribute(name);
    }

    static String requiredString(final XmlElement element, final String name) {
        final var value = element.attribute(name);
        if (value == null) {
            throw missing(element, name);
        }
        return value;
    }

    /**
     * Reads an integer attribute that must not be smaller than {@code minimum}.
     */
    static @Nullable Integer integer(final XmlElement element, final String name, final int minimum) {
        final var value = element.attribute(name);
        return (value != null) ? parseInteger(element, name, value, minimum) : null;
    }

    static int requiredInteger(final XmlElement element, final String name, final int minimum) {
        return parseInteger(element, name, requiredString(element, name), minimum);
    }

    /**
     * Reads an {@code xs:boolean} attribute.
     */
    static @Nullable Boolean bool(final XmlElement element, final String name) {
        final var value = element.attribute(name);
        if (value == null) {
            return null;
        }
        return switch (value) {
            case "true", "1" -> Boolean.TRUE;
            case "false", "0" -> Boolean.FALSE;
            default -> throw ConditionContext.error(new InvalidAttributeErrorCondition(
                name,
                value,
                "Attribute " + name + " of " + element + " is not a boolean: \"" + value + '"'
            ));
        };
    }

    /**
     * Reads an enumerated attribute. {@code lookup} maps the raw value to the enumerated value, or to {@code null} if
     * the raw value isn't one of them.
     */
    @Nullable
    static <E extends Enum<E>> E enumeration(
        final XmlElement element,
        final String name,
        final Function<String, E> lookup
    ) {
        final var value = element.attribute(name);
        if (value == null) {
            return null;
        }
        final var result = lookup.apply(value);
        if (result == null) {
            throw ConditionContext.error(new InvalidAttributeErrorCondition(
                name,
                value,
                "Unrecognized value \"" + value + "\" of attribute " + name + " of " + element
            ));
        }
        return result;
    }

    static <E extends Enum<E>> E requiredEnumeration(
        final XmlElement element,
        final String name,
        final Function<String, E> lookup
    ) {
        final var result = enumeration(element, name, lookup);
        if (result == null) {
            throw missing(element, name);
        }
        return result;
    }

    private static int parseInteger(
        final XmlElement element,
        final String name,
        final String value,
        final int minimum
    ) {
        final int result;
        try {
            result = Integer.parseInt(value);
        } catch (final NumberFormatException e) {
            throw ConditionContext.error(new InvalidAttributeErrorCondition(
                name,
                value,
                "Attribute " + name + " of " + element + " is not an integer: \"" + value + '"'
            ));
        }
        if (result < minimum) {
            throw ConditionContext.error(new InvalidAttributeErrorCondition(
                name,
                value,
                "Attribute " + name + " of " + element + " must be at least " + minimum + ", got " + result
            ));
        }
        return result;
    }

    private static UnhandledErrorError missing(final XmlElement element, final String name) {
        return ConditionContext.error(new MissingFieldErrorCondition(
            name,
            "Required attribute " + name + " is missing from " + element
        ));
    }
}
