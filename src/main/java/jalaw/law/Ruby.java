// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import jalaw.util.annotation.Nullable;
import jalaw.util.condition.ConditionContext;
import jalaw.xml.XmlElement;

/**
 * Base text annotated with readings, {@code <Ruby>漢字<Rt>かんじ</Rt></Ruby>}.
 * <p>
 * Only the base text takes part in flattened text; readings are available separately. The base text is every run of
 * character data outside the {@code Rt} elements, so {@code <Ruby>東<Rt>ひがし</Rt>西<Rt>にし</Rt></Ruby>} reads
 * {@code 東西}. Taking only the head text would drop {@code 西} from the sentence.
 */
public final class Ruby implements SentenceContent, LineContent, TaggedContent, QuoteContent {
    public Ruby(final XmlElement element) {
        Elements.expectTag(element, "Ruby");
        final var base = new StringBuilder();
        final var readings = new ArrayList<String>();
        appendIfPresent(base, element.text());
        for (final var child : element.children()) {
            if (!child.tag().equals("Rt")) {
                throw ConditionContext.error(new UnsupportedContentErrorCondition(
                    "Unsupported <" + child.tag() + "> in ruby " + element
                ));
            }
            readings.add(Elements.leafText(child));
            appendIfPresent(base, child.tail());
        }
        text = base.toString();
        this.readings = Collections.unmodifiableList(readings);
    }

    /**
     * Retrieves the base text, the characters being annotated.
     */
    @Override
    public String text() {
        return text;
    }

    /**
     * Retrieves the readings ({@code Rt}), in document order.
     */
    public List<String> readings() {
        return readings;
    }

    private static void appendIfPresent(final StringBuilder builder, final @Nullable String text) {
        if (text != null) {
            builder.append(text);
        }
    }

    private final String text;
    private final List<String> readings;
}
