// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.xml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import jalaw.util.Lazy;
import jalaw.util.annotation.Nullable;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * An immutable view of one element of a parsed document.
 * <p>
 * Text is split the way mixed content is read: the <dfn>head text</dfn> is the character data before the first child
 * element, and the <dfn>tail text</dfn> of an element is the character data between its end tag and the next sibling
 * element or the parent's end tag. Comments and processing instructions are not part of either, nor are they children.
 * <p>
 * The underlying DOM must not be modified while views of it are in use.
 */
public final class XmlElement {
    private XmlElement(final Element element) {
        this.element = element;
        children = Lazy.of(this::collectChildren);
    }

    static XmlElement of(final Element element) {
        return new XmlElement(element);
    }

    /**
     * Retrieves the tag name, exactly as written in the document.
     */
    public String tag() {
        return element.getTagName();
    }

    /**
     * Retrieves the head text, or {@code null} if the element starts with a child element or is empty.
     */
    public @Nullable String text() {
        return collectText(element.getFirstChild());
    }

    /**
     * Retrieves the tail text, or {@code null} if another element or the parent's end tag follows immediately.
     */
    public @Nullable String tail() {
        return collectText(element.getNextSibling());
    }

    /**
     * Retrieves the child elements in document order.
     */
    public List<XmlElement> children() {
        return children.get();
    }

    /**
     * Retrieves the child elements with the given tag, in document order.
     */
    public List<XmlElement> children(final String tag) {
        final var result = new ArrayList<XmlElement>();
        for (final var child : children()) {
            if (child.tag().equals(tag)) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Retrieves the first child element with the given tag, or {@code null} if there is none.
     */
    public @Nullable XmlElement child(final String tag) {
        for (final var child : children()) {
            if (child.tag().equals(tag)) {
                return child;
            }
        }
        return null;
    }

    /**
     * Retrieves the raw value of the given attribute, or {@code null} if the attribute is not present.
     * <p>
     * An attribute written as {@code Abbrev=""} is present, its value is the empty string.
     */
    public @Nullable String attribute(final String name) {
        final var attribute = element.getAttributeNode(name);
        return (attribute != null) ? attribute.getValue() : null;
    }

    /**
     * Returns a short description of the element for diagnostics, like {@code <Article Num="3">}.
     */
    @Override
    public String toString() {
        final var num = attribute("Num");
        return (num != null) ? "<" + tag() + " Num=\"" + num + "\">" : "<" + tag() + ">";
    }

    private List<XmlElement> collectChildren() {
        final var result = new ArrayList<XmlElement>();
        for (var node = element.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node instanceof final Element child) {
                result.add(new XmlElement(child));
            }
        }
        return Collections.unmodifiableList(result);
    }

    private static @Nullable String collectText(final @Nullable Node start) {
        StringBuilder builder = null;
        for (var node = start; node != null && node.getNodeType() != Node.ELEMENT_NODE; node = node.getNextSibling()) {
            final var type = node.getNodeType();
            if (type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE) {
                if (builder == null) {
                    builder = new StringBuilder();
                }
                builder.append(node.getNodeValue());
            }
        }
        return (builder != null) ? builder.toString() : null;
    }

    private final Element element;
    private final Lazy<List<XmlElement>> children;
}
