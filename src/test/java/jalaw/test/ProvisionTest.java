// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.test;

import jalaw.law.AmendProvision;
import jalaw.law.AppdxNote;
import jalaw.law.Article;
import jalaw.law.Chapter;
import jalaw.law.Item;
import jalaw.law.LineStyle;
import jalaw.law.ListBlock;
import jalaw.law.MissingFieldErrorCondition;
import jalaw.law.Paragraph;
import jalaw.law.Subitem;
import jalaw.law.Table;
import jalaw.law.TableStruct;
import jalaw.law.Toc;
import jalaw.law.UnsupportedContentErrorCondition;
import static jalaw.test.Fixtures.catchUnhandled;
import static jalaw.test.Fixtures.xml;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class ProvisionTest {
    @Test
    void paragraphSkipsItsNumberButKeepsCaption() {
        final var paragraph = new Paragraph(xml(
            "<Paragraph Num=\"2\"><ParagraphCaption>（見出し）</ParagraphCaption><ParagraphNum>２</ParagraphNum>"
                + "<ParagraphSentence><Sentence Num=\"1\">本文。</Sentence>"
                + "<Sentence Num=\"2\" Function=\"proviso\">ただし書。</Sentence></ParagraphSentence>"
                + "<Item Num=\"1\"><ItemTitle>一</ItemTitle><ItemSentence><Sentence>号</Sentence></ItemSentence></Item>"
                + "</Paragraph>"
        ));
        assertThat(paragraph.num()).isEqualTo(2);
        assertThat(paragraph.paragraphNum()).isNotNull();
        assertThat(paragraph.texts()).containsExactly("（見出し）", "本文。", "ただし書。", "一", "号");
    }

    @Test
    void repeatedChildrenKeepDocumentOrderAcrossOtherTags() {
        final var paragraph = new Paragraph(xml(
            "<Paragraph Num=\"1\"><ParagraphSentence><Sentence>柱書</Sentence></ParagraphSentence>"
                + "<Item Num=\"1\"><ItemSentence><Sentence>甲</Sentence></ItemSentence></Item>"
                + "<List><ListSentence><Sentence>一覧</Sentence></ListSentence></List>"
                + "<Item Num=\"2\"><ItemSentence><Sentence>乙</Sentence></ItemSentence></Item>"
                + "</Paragraph>"
        ));
        assertThat(paragraph.items()).extracting(Item::num).containsExactly("1", "2");
        assertThat(paragraph.lists()).hasSize(1);
        assertThat(paragraph.items()).isUnmodifiable();
    }

    @Test
    void paragraphNumberIsOptional() {
        final var paragraph = new Paragraph(xml(
            "<Paragraph Num=\"1\"><ParagraphSentence><Sentence>本文</Sentence></ParagraphSentence></Paragraph>"
        ));
        assertThat(paragraph.paragraphNum()).isNull();
        assertThat(paragraph.caption()).isNull();
        assertThat(paragraph.items()).isEmpty();
    }

    @Test
    void articleRequiresAParagraph() {
        final var error = catchUnhandled(() -> new Article(xml(
            "<Article Num=\"1\"><ArticleTitle>第一条</ArticleTitle></Article>"
        )));
        assertThat(error.condition()).isInstanceOfSatisfying(
            MissingFieldErrorCondition.class,
            condition -> assertThat(condition.field()).isEqualTo("Paragraph")
        );
    }

    @Test
    void paragraphRequiresItsSentence() {
        final var error = catchUnhandled(() -> new Paragraph(xml("<Paragraph Num=\"1\"/>")));
        assertThat(error.condition()).isInstanceOfSatisfying(
            MissingFieldErrorCondition.class,
            condition -> assertThat(condition.field()).isEqualTo("ParagraphSentence")
        );
    }

    @Test
    void wrongElementIsRejected() {
        final var error = catchUnhandled(() -> new Article(xml("<Paragraph Num=\"1\"/>")));
        assertThat(error.condition()).isInstanceOf(UnsupportedContentErrorCondition.class);
    }

    @Test
    void subitemsNestByLevel() {
        final var subitem = new Subitem(xml(
            "<Subitem1 Num=\"1\"><Subitem1Title>イ</Subitem1Title>"
                + "<Subitem1Sentence><Sentence>甲</Sentence></Subitem1Sentence>"
                + "<Subitem2 Num=\"1\"><Subitem2Title>（１）</Subitem2Title>"
                + "<Subitem2Sentence><Sentence>乙</Sentence></Subitem2Sentence></Subitem2>"
                + "</Subitem1>"
        ));
        assertThat(subitem.level()).isEqualTo(1);
        assertThat(subitem.subitems()).singleElement()
            .satisfies(nested -> assertThat(nested.level()).isEqualTo(2));
        assertThat(subitem.texts()).containsExactly("イ", "甲", "（１）", "乙");
    }

    @Test
    void listsNestByLevel() {
        final var list = new ListBlock(xml(
            "<List><ListSentence><Sentence>一覧</Sentence></ListSentence>"
                + "<Sublist1><Sublist1Sentence><Sentence>下位</Sentence></Sublist1Sentence>"
                + "<Sublist2><Sublist2Sentence><Sentence>更に下位</Sentence></Sublist2Sentence></Sublist2>"
                + "</Sublist1></List>"
        ));
        assertThat(list.level()).isZero();
        final var sublist = list.sublists().get(0);
        assertThat(sublist.level()).isEqualTo(1);
        assertThat(sublist.sublists()).singleElement().satisfies(deepest -> {
            assertThat(deepest.level()).isEqualTo(2);
            assertThat(deepest.sentence().tag()).isEqualTo("Sublist2Sentence");
        });
        assertThat(list.texts()).containsExactly("一覧", "下位", "更に下位");
    }

    @Test
    void tableTextsFollowRowsAndColumns() {
        final var table = new Table(xml(
            "<Table><TableHeaderRow><TableHeaderColumn>区分</TableHeaderColumn>"
                + "<TableHeaderColumn>金額</TableHeaderColumn></TableHeaderRow>"
                + "<TableRow><TableColumn BorderTop=\"solid\" rowspan=\"2\"><Sentence>甲</Sentence></TableColumn>"
                + "<TableColumn><Subitem1 Num=\"1\"><Subitem1Title>イ</Subitem1Title>"
                + "<Subitem1Sentence><Sentence>百円</Sentence></Subitem1Sentence></Subitem1></TableColumn></TableRow>"
                + "</Table>"
        ));
        assertThat(table.headerRows()).singleElement()
            .satisfies(row -> assertThat(row.columns()).hasSize(2));
        final var firstColumn = table.rows().get(0).columns().get(0);
        assertThat(firstColumn.borderTop()).isEqualTo(LineStyle.SOLID);
        assertThat(firstColumn.borderBottom()).isNull();
        assertThat(firstColumn.rowspan()).isEqualTo(2);
        assertThat(firstColumn.colspan()).isNull();
        assertThat(table.texts()).containsExactly("区分", "金額", "甲", "イ", "百円");
    }

    @Test
    void remarksAroundTableKeepTheirSide() {
        final var struct = new TableStruct(xml(
            "<TableStruct><TableStructTitle>別表</TableStructTitle>"
                + "<Remarks><Sentence>前の備考</Sentence></Remarks>"
                + "<Table><TableRow><TableColumn><Sentence>中身</Sentence></TableColumn></TableRow></Table>"
                + "<Remarks><Sentence>後の備考</Sentence></Remarks></TableStruct>"
        ));
        assertThat(struct.remarksBefore()).hasSize(1);
        assertThat(struct.remarksAfter()).hasSize(1);
        assertThat(struct.texts()).containsExactly("別表", "前の備考", "中身", "後の備考");
    }

    @Test
    void tableOfContentsCollectsLabels() {
        final var toc = new Toc(xml(
            "<TOC><TOCLabel>目次</TOCLabel>"
                + "<TOCChapter Num=\"1\"><ChapterTitle>第一章　総則</ChapterTitle>"
                + "<ArticleRange>（第一条・第二条）</ArticleRange></TOCChapter>"
                + "<TOCSupplProvision><SupplProvisionLabel>附則</SupplProvisionLabel></TOCSupplProvision>"
                + "</TOC>"
        ));
        assertThat(toc.chapters()).singleElement()
            .satisfies(chapter -> assertThat(chapter.num()).isEqualTo("1"));
        assertThat(toc.supplProvision()).isNotNull();
        assertThat(toc.texts()).containsExactly("目次", "第一章　総則", "（第一条・第二条）", "附則");
    }

    @Test
    void chapterWithoutArticlesHasNoText() {
        final var chapter = new Chapter(xml("<Chapter Num=\"2\" Delete=\"true\"><ChapterTitle/></Chapter>"));
        assertThat(chapter.delete()).isTrue();
        assertThat(chapter.articles()).isEmpty();
        assertThat(chapter.texts()).containsExactly("");
    }

    @Test
    void amendProvisionCarriesNewText() {
        final var amend = new AmendProvision(xml(
            "<AmendProvision><AmendProvisionSentence><Sentence>次の一条を加える。</Sentence>"
                + "</AmendProvisionSentence><NewProvision><Article Num=\"5\"><ArticleTitle>第五条</ArticleTitle>"
                + "<Paragraph Num=\"1\"><ParagraphSentence><Sentence>新しい条文</Sentence></ParagraphSentence>"
                + "</Paragraph></Article></NewProvision></AmendProvision>"
        ));
        assertThat(amend.newProvisions()).singleElement()
            .satisfies(provision -> assertThat(provision.articles()).hasSize(1));
        assertThat(amend.texts()).containsExactly("次の一条を加える。", "第五条", "新しい条文");
    }

    @Test
    void emptyAppendixTitleIsEmptyText() {
        final var note = new AppdxNote(xml(
            "<AppdxNote><AppdxNoteTitle WritingMode=\"horizontal\"/><NoteStruct><Note>"
                + "<Sentence>注記</Sentence></Note></NoteStruct></AppdxNote>"
        ));
        assertThat(note.num()).isNull();
        assertThat(note.title()).isNotNull();
        assertThat(note.texts()).containsExactly("", "注記");
    }
}
