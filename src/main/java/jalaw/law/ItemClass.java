// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * A class (類, the {@code Class} element) grouping the items of a paragraph.
 */
public final class ItemClass implements TextSource {
    public ItemClass(final XmlElement element) {
        Elements.expectTag(element, "Class");
        num = Attributes.requiredString(element, "Num");
        title = Elements.optional(element, "ClassTitle", Label::new);
        sentence = Elements.required(element, "ClassSentence", ProvisionSentence::new);
        items = Elements.list(element, "Item", Item::new);
    }

    public String num() {
        return num;
    }

    public @Nullable Label title() {
        return title;
    }

    public ProvisionSentence sentence() {
        return sentence;
    }

    public List<Item> items() {
        return items;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.of(title), sentence.texts(), Texts.of(items));
    }

    private final String num;
    private final @Nullable Label title;
    private final ProvisionSentence sentence;
    private final List<Item> items;
}
