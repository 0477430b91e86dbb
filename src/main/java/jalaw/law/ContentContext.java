// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import jalaw.util.Trace;
import jalaw.util.annotation.Nullable;
import jalaw.util.condition.ConditionContext;
import jalaw.xml.XmlElement;

/**
 * A mixed-content context: the set of child element kinds allowed in a given place, and the resolution of an
 * element's interleaved text and children into a sequence of {@link Content} items.
 */
final class ContentContext<T extends Content> {
    private ContentContext(final Builder<T> builder) {
        readableName = builder.readableName;
        textBinder = Objects.requireNonNull(builder.textBinder, readableName);
        binders = Map.copyOf(builder.binders);
    }

    /**
     * Resolves the content of {@code element}.
     * <p>
     * The head text comes first, then each child element followed by its tail text, all in document order. Text runs
     * are never merged nor dropped, except that empty ones are skipped. A child whose tag this context doesn't allow
     * is a fatal {@link UnsupportedContentErrorCondition}.
     */
    @CheckReturnValue
    List<T> resolve(final XmlElement element) {
        try (final var trace = new Trace(() -> "Resolving " + readableName + " of " + element)) {
            trace.use();
            final var items = new ArrayList<T>();
            addText(items, element.text());
            for (final var child : element.children()) {
                final var binder = binders.get(child.tag());
                if (binder == null) {
                    throw ConditionContext.error(new UnsupportedContentErrorCondition(
                        "Unsupported <" + child.tag() + "> in " + readableName + " of " + element
                    ));
                }
                items.add(binder.apply(child));
                addText(items, child.tail());
            }
            return Collections.unmodifiableList(items);
        }
    }

    /**
     * Concatenates the text of the given items.
     */
    static String join(final List<? extends Content> items) {
        final var builder = new StringBuilder();
        for (final var item : items) {
            builder.append(item.text());
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return readableName;
    }

    private void addText(final List<T> items, final @Nullable String text) {
        if (text != null && !text.isEmpty()) {
            items.add(textBinder.apply(text));
        }
    }

    static final ContentContext<SentenceContent> SENTENCE = new Builder<SentenceContent>("sentence content")
        .text(PlainText::new)
        .add("Line", Line::new)
        .add("QuoteStruct", QuoteStruct::new)
        .add("ArithFormula", ArithFormula::new)
        .add("Ruby", Ruby::new)
        .add("Sup", Sup::new)
        .add("Sub", Sub::new)
        .build();

    static final ContentContext<LineContent> LINE = new Builder<LineContent>("underlined content")
        .text(PlainText::new)
        .add("QuoteStruct", QuoteStruct::new)
        .add("ArithFormula", ArithFormula::new)
        .add("Ruby", Ruby::new)
        .add("Sup", Sup::new)
        .add("Sub", Sub::new)
        .build();

    static final ContentContext<TaggedContent> TAGGED_TEXT = new Builder<TaggedContent>("tagged text")
        .text(PlainText::new)
        .add("Line", Line::new)
        .add("Ruby", Ruby::new)
        .add("Sup", Sup::new)
        .add("Sub", Sub::new)
        .build();

    static final ContentContext<QuoteContent> QUOTE = buildQuoteContext();

    private static ContentContext<QuoteContent> buildQuoteContext() {
        final var builder = new Builder<QuoteContent>("quoted content")
            .text(PlainText::new)
            .add("Ruby", Ruby::new)
            .add("Sup", Sup::new)
            .add("Sub", Sub::new)
            .add("Line", Line::new)
            .add("ArithFormula", ArithFormula::new)
            .add("QuoteStruct", QuoteStruct::new)
            .add("Sentence", Sentence::new)
            .add("Fig", Fig::new)
            .add("Part", Part::new)
            .add("Chapter", Chapter::new)
            .add("Section", Section::new)
            .add("Subsection", Subsection::new)
            .add("Division", Division::new)
            .add("Article", Article::new)
            .add("Paragraph", Paragraph::new)
            .add("Item", Item::new)
            .add("Table", Table::new)
            .add("TableStruct", TableStruct::new)
            .add("FigStruct", FigStruct::new)
            .add("NoteStruct", NoteStruct::new)
            .add("StyleStruct", StyleStruct::new)
            .add("FormatStruct", FormatStruct::new)
            .add("Note", Note::new)
            .add("Style", Style::new)
            .add("Format", Format::new)
            .add("Remarks", Remarks::new)
            .add("AppdxTable", AppdxTable::new)
            .add("AppdxNote", AppdxNote::new)
            .add("AppdxStyle", AppdxStyle::new)
            .add("AppdxFig", AppdxFig::new)
            .add("AppdxFormat", AppdxFormat::new)
            .add("Appdx", Appdx::new)
            .add("TOC", Toc::new)
            .add("TOCPart", TocPart::new)
            .add("TOCChapter", TocChapter::new)
            .add("TOCSection", TocSection::new)
            .add("TOCSubsection", TocSubsection::new)
            .add("TOCDivision", TocDivision::new)
            .add("TOCArticle", TocArticle::new)
            .add("TOCSupplProvision", TocSupplProvision::new);
        for (final var tag : Subitem.tags) {
            builder.add(tag, Subitem::new);
        }
        for (final var tag : ListBlock.tags) {
            builder.add(tag, ListBlock::new);
        }
        return builder.build();
    }

    private final String readableName;
    private final Function<String, ? extends T> textBinder;
    private final Map<String, Function<XmlElement, ? extends T>> binders;

    private static final class Builder<T extends Content> {
        private Builder(final String readableName) {
            this.readableName = readableName;
        }

        private Builder<T> text(final Function<String, ? extends T> binder) {
            textBinder = binder;
            return this;
        }

        private Builder<T> add(final String tag, final Function<XmlElement, ? extends T> binder) {
            final var previous = binders.put(tag, binder);
            assert previous == null : "Duplicate content kind " + tag;
            return this;
        }

        private ContentContext<T> build() {
            return new ContentContext<>(this);
        }

        private final String readableName;
        private @Nullable Function<String, ? extends T> textBinder = null;
        private final Map<String, Function<XmlElement, ? extends T>> binders = new HashMap<>();
    }
}
