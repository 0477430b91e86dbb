// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.xml.XmlElement;

/**
 * The body of a note struct.
 */
public final class Note implements QuoteContent, TextSource {
    public Note(final XmlElement element) {
        Elements.expectTag(element, "Note");
        sentences = Elements.list(element, "Sentence", Sentence::new);
        figs = Elements.list(element, "Fig", Fig::new);
        items = Elements.list(element, "Item", Item::new);
        arithFormulas = Elements.list(element, "ArithFormula", ArithFormula::new);
        lists = Elements.list(element, "List", ListBlock::new);
        tables = Elements.list(element, "Table", Table::new);
    }

    public List<Sentence> sentences() {
        return sentences;
    }

    public List<Fig> figs() {
        return figs;
    }

    public List<Item> items() {
        return items;
    }

    public List<ArithFormula> arithFormulas() {
        return arithFormulas;
    }

    public List<ListBlock> lists() {
        return lists;
    }

    public List<Table> tables() {
        return tables;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.ofSentences(sentences), Texts.of(items), Texts.of(lists), Texts.of(tables));
    }

    @Override
    public String text() {
        return "";
    }

    private final List<Sentence> sentences;
    private final List<Fig> figs;
    private final List<Item> items;
    private final List<ArithFormula> arithFormulas;
    private final List<ListBlock> lists;
    private final List<Table> tables;
}
