// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.test;

import jalaw.law.ArithFormula;
import jalaw.law.Caption;
import jalaw.law.Fig;
import jalaw.law.Indent;
import jalaw.law.InvalidAttributeErrorCondition;
import jalaw.law.Item;
import jalaw.law.Label;
import jalaw.law.LawTitle;
import jalaw.law.Line;
import jalaw.law.LineStyle;
import jalaw.law.PlainText;
import jalaw.law.QuoteStruct;
import jalaw.law.Ruby;
import jalaw.law.Sentence;
import jalaw.law.SentenceFunction;
import jalaw.law.Sub;
import jalaw.law.Sup;
import jalaw.law.UnsupportedContentErrorCondition;
import jalaw.law.WritingMode;
import static jalaw.test.Fixtures.catchUnhandled;
import static jalaw.test.Fixtures.xml;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class ContentTest {
    @Test
    void itemYieldsTitleThenSentence() {
        final var item = new Item(xml(
            "<Item Num=\"1\"><ItemTitle>Item title</ItemTitle>"
                + "<ItemSentence><Sentence Num=\"1\">Item sentence</Sentence></ItemSentence></Item>"
        ));
        assertThat(item.num()).isEqualTo("1");
        assertThat(item.texts()).containsExactly("Item title", "Item sentence");
        assertThat(item.subitems()).isEmpty();
        assertThat(item.delete()).isNull();
    }

    @Test
    void lawTitleDistinguishesEmptyFromAbsentAttributes() {
        final var title = new LawTitle(xml("<LawTitle Kana=\"たいとる\" Abbrev=\"\">タイトル</LawTitle>"));
        assertThat(title.kana()).isEqualTo("たいとる");
        assertThat(title.abbrev()).isEmpty();
        assertThat(title.abbrevKana()).isNull();
        assertThat(title.text()).isEqualTo("タイトル");
        assertThat(title.tag()).isEqualTo("LawTitle");
    }

    @Test
    void nestedQuoteStructsKeepTheirShape() {
        final var sentence = new Sentence(xml(
            "<Sentence><QuoteStruct><Sentence>AAA BBB<QuoteStruct><Fig src=\"url\"/></QuoteStruct></Sentence>"
                + "</QuoteStruct></Sentence>"
        ));
        assertThat(sentence.contents()).hasSize(1);
        final var outer = (QuoteStruct) sentence.contents().get(0);
        assertThat(outer.contents()).hasSize(1);
        final var inner = (Sentence) outer.contents().get(0);
        assertThat(inner.contents()).hasSize(2);
        assertThat(inner.contents().get(0)).isEqualTo(new PlainText("AAA BBB"));
        final var innerQuote = (QuoteStruct) inner.contents().get(1);
        assertThat(innerQuote.contents()).singleElement()
            .isInstanceOfSatisfying(Fig.class, fig -> assertThat(fig.src()).isEqualTo("url"));
        assertThat(sentence.text()).isEqualTo("AAA BBB");
    }

    @Test
    void sentenceAttributesDecode() {
        final var sentence = new Sentence(xml(
            "<Sentence Num=\"1\" Function=\"proviso\" Indent=\"Item\" WritingMode=\"vertical\">ただし</Sentence>"
        ));
        assertThat(sentence.num()).isEqualTo(1);
        assertThat(sentence.function()).isEqualTo(SentenceFunction.PROVISO);
        assertThat(sentence.indent()).isEqualTo(Indent.ITEM);
        assertThat(sentence.writingMode()).isEqualTo(WritingMode.VERTICAL);
        assertThat(sentence.text()).isEqualTo("ただし");
    }

    @Test
    void absentAttributesStayAbsent() {
        final var sentence = new Sentence(xml("<Sentence>本文</Sentence>"));
        assertThat(sentence.num()).isNull();
        assertThat(sentence.function()).isNull();
        assertThat(sentence.indent()).isNull();
        assertThat(sentence.writingMode()).isNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {"Num=\"one\"", "Num=\"-1\"", "Function=\"sideways\"", "Indent=\"Subitem11\"",
        "WritingMode=\"diagonal\""})
    void unrecognizedSentenceAttributeIsAnError(final String attribute) {
        final var element = xml("<Sentence " + attribute + ">本文</Sentence>");
        final var name = attribute.substring(0, attribute.indexOf('='));
        final var error = catchUnhandled(() -> new Sentence(element));
        assertThat(error.condition()).isInstanceOfSatisfying(
            InvalidAttributeErrorCondition.class,
            condition -> assertThat(condition.attribute()).isEqualTo(name)
        );
    }

    @Test
    void mixedContentKeepsDocumentOrder() {
        final var sentence = new Sentence(xml(
            "<Sentence>前<Ruby>漢字<Rt>かんじ</Rt></Ruby>中<Sup>2</Sup><Sub>i</Sub>後</Sentence>"
        ));
        final var contents = sentence.contents();
        assertThat(contents).hasSize(6);
        assertThat(contents.get(0)).isEqualTo(new PlainText("前"));
        assertThat(contents.get(1)).isInstanceOfSatisfying(Ruby.class, ruby -> {
            assertThat(ruby.text()).isEqualTo("漢字");
            assertThat(ruby.readings()).containsExactly("かんじ");
        });
        assertThat(contents.get(2)).isEqualTo(new PlainText("中"));
        assertThat(contents.get(3)).isInstanceOf(Sup.class);
        assertThat(contents.get(4)).isInstanceOf(Sub.class);
        assertThat(contents.get(5)).isEqualTo(new PlainText("後"));
        assertThat(sentence.text()).isEqualTo("前漢字中2i後");
    }

    @Test
    void rubyBaseTextSpansReadings() {
        final var ruby = new Ruby(xml("<Ruby>東<Rt>ひがし</Rt>西<Rt>にし</Rt></Ruby>"));
        assertThat(ruby.text()).isEqualTo("東西");
        assertThat(ruby.readings()).containsExactly("ひがし", "にし");
    }

    @Test
    void whitespaceIsContent() {
        final var sentence = new Sentence(xml("<Sentence> <Sup>a</Sup> </Sentence>"));
        assertThat(sentence.contents()).hasSize(3);
        assertThat(sentence.text()).isEqualTo(" a ");
    }

    @Test
    void emptySentenceHasNoContent() {
        final var sentence = new Sentence(xml("<Sentence/>"));
        assertThat(sentence.contents()).isEmpty();
        assertThat(sentence.text()).isEmpty();
    }

    @Test
    void resolutionIsIdempotent() {
        final var sentence = new Sentence(xml("<Sentence>甲<Line Style=\"dotted\">乙</Line>丙</Sentence>"));
        final var first = sentence.contents();
        assertThat(sentence.contents()).isSameAs(first);
        assertThat(sentence.text()).isEqualTo(sentence.text()).isEqualTo("甲乙丙");
        assertThat(first.get(1)).isInstanceOfSatisfying(
            Line.class,
            line -> assertThat(line.style()).isEqualTo(LineStyle.DOTTED)
        );
    }

    @Test
    void captionFlattensThroughFormulaFigures() {
        final var caption = new Caption(xml(
            "<ArticleCaption>テストの<Line><ArithFormula Num=\"1\"><Fig src=\"./pict/a.jpg\"/></ArithFormula>"
                + "</Line>見出し</ArticleCaption>"
        ));
        assertThat(caption.text()).isEqualTo("テストの見出し");
        assertThat(caption.taggedText()).hasSize(3);
        final var line = (Line) caption.taggedText().get(1);
        assertThat(line.contents()).singleElement().isInstanceOfSatisfying(ArithFormula.class, formula -> {
            assertThat(formula.num()).isEqualTo(1);
            assertThat(formula.figs()).extracting(Fig::src).containsExactly("./pict/a.jpg");
        });
    }

    @Test
    void unsupportedInlineElementIsAnError() {
        final var sentence = new Sentence(xml("<Sentence>本文<Paragraph Num=\"1\"/></Sentence>"));
        final var error = catchUnhandled(sentence::contents);
        assertThat(error.condition()).isInstanceOf(UnsupportedContentErrorCondition.class);
        assertThat(error.condition().message()).contains("<Paragraph>");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "<Line>a<Line>b</Line></Line>",
        "<Line>a<Sentence>b</Sentence></Line>",
        "<Line><Fig src=\"x.png\"/></Line>",
    })
    void lineRejectsWhatOnlySentencesHold(final String source) {
        final var line = new Line(xml(source));
        final var error = catchUnhandled(line::contents);
        assertThat(error.condition()).isInstanceOf(UnsupportedContentErrorCondition.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "<ArticleTitle>a<QuoteStruct>b</QuoteStruct></ArticleTitle>",
        "<ArticleTitle>a<ArithFormula/></ArticleTitle>",
        "<ArticleTitle><Sentence>b</Sentence></ArticleTitle>",
    })
    void taggedTextRejectsQuotesAndFormulas(final String source) {
        final var title = new Label(xml(source));
        final var error = catchUnhandled(title::taggedText);
        assertThat(error.condition()).isInstanceOf(UnsupportedContentErrorCondition.class);
    }

    @Test
    void taggedTextAcceptsItsOwnKinds() {
        final var title = new Label(xml(
            "<ArticleTitle>第<Ruby>一<Rt>いち</Rt></Ruby><Sup>2</Sup><Sub>3</Sub><Line>条</Line></ArticleTitle>"
        ));
        assertThat(title.taggedText()).hasSize(5);
        assertThat(title.text()).isEqualTo("第一23条");
    }

    @Test
    void unrecognizedLineStyleIsAnError() {
        final var error = catchUnhandled(() -> new Line(xml("<Line Style=\"thick\">a</Line>")));
        assertThat(error.condition()).isInstanceOfSatisfying(InvalidAttributeErrorCondition.class, condition -> {
            assertThat(condition.attribute()).isEqualTo("Style");
            assertThat(condition.value()).isEqualTo("thick");
        });
    }

    @Test
    void leafElementRejectsChildren() {
        final var error = catchUnhandled(() -> new Sup(xml("<Sup>a<Sub>b</Sub></Sup>")));
        assertThat(error.condition()).isInstanceOf(UnsupportedContentErrorCondition.class);
    }
}
