// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import jalaw.util.annotation.Nullable;
import jalaw.util.condition.ConditionContext;
import jalaw.util.condition.UnhandledErrorError;
import jalaw.xml.XmlElement;

/**
 * Binding of declared child elements: single required, single optional, and lists in document order.
 */
final class Elements {
    private Elements() {
    }

    static void expectTag(final XmlElement element, final String tag) {
        if (!element.tag().equals(tag)) {
            throw wrongTag(element, tag);
        }
    }

    static void expectTag(final XmlElement element, final Set<String> tags, final String kind) {
        if (!tags.contains(element.tag())) {
            throw wrongTag(element, kind);
        }
    }

    static <T> List<T> list(final XmlElement element, final String tag, final Function<XmlElement, T> binder) {
        final var result = new ArrayList<T>();
        for (final var child : element.children(tag)) {
            result.add(binder.apply(child));
        }
        return Collections.unmodifiableList(result);
    }

    static <T> List<T> list(
        final XmlElement element,
        final Predicate<String> tagFilter,
        final Function<XmlElement, T> binder
    ) {
        final var result = new ArrayList<T>();
        for (final var child : element.children()) {
            if (tagFilter.test(child.tag())) {
                result.add(binder.apply(child));
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Binds a list that must have at least one element.
     */
    static <T> List<T> nonEmptyList(
        final XmlElement element,
        final String tag,
        final Function<XmlElement, T> binder
    ) {
        final var result = list(element, tag, binder);
        if (result.isEmpty()) {
            throw missing(element, tag);
        }
        return result;
    }

    @Nullable
    static <T> T optional(final XmlElement element, final String tag, final Function<XmlElement, T> binder) {
        final var child = element.child(tag);
        return (child != null) ? binder.apply(child) : null;
    }

    static <T> T required(final XmlElement element, final String tag, final Function<XmlElement, T> binder) {
        final var child = element.child(tag);
        if (child == null) {
            throw missing(element, tag);
        }
        return binder.apply(child);
    }

    /**
     * Binds the elements with tag {@code tag} that come before the first {@code pivotTag} child, or all of them if
     * there is no such child.
     */
    static <T> List<T> before(
        final XmlElement element,
        final String pivotTag,
        final String tag,
        final Function<XmlElement, T> binder
    ) {
        final var result = new ArrayList<T>();
        for (final var child : element.children()) {
            if (child.tag().equals(pivotTag)) {
                break;
            }
            if (child.tag().equals(tag)) {
                result.add(binder.apply(child));
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Binds the elements with tag {@code tag} that come after the first {@code pivotTag} child.
     */
    static <T> List<T> after(
        final XmlElement element,
        final String pivotTag,
        final String tag,
        final Function<XmlElement, T> binder
    ) {
        final var result = new ArrayList<T>();
        var seenPivot = false;
        for (final var child : element.children()) {
            if (seenPivot && child.tag().equals(tag)) {
                result.add(binder.apply(child));
            }
            seenPivot = seenPivot || child.tag().equals(pivotTag);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Reads an element holding character data only. An empty element yields the empty string.
     */
    static String leafText(final XmlElement element) {
        if (!element.children().isEmpty()) {
            throw ConditionContext.error(new UnsupportedContentErrorCondition(
                "Unsupported <" + element.children().get(0).tag() + "> in " + element
                    + ", which can only hold character data"
            ));
        }
        final var text = element.text();
        return (text != null) ? text : "";
    }

    static String requiredLeafText(final XmlElement element, final String tag) {
        return leafText(required(element, tag, Function.identity()));
    }

    static UnhandledErrorError missing(final XmlElement element, final String tag) {
        return ConditionContext.error(new MissingFieldErrorCondition(
            tag,
            "Required element <" + tag + "> is missing from " + element
        ));
    }

    private static UnhandledErrorError wrongTag(final XmlElement element, final String expected) {
        return ConditionContext.error(new UnsupportedContentErrorCondition(
            "Expected " + expected + " but got " + element
        ));
    }
}
