// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import jalaw.util.condition.exception.SAXExceptionCondition;
import jalaw.xml.XmlElement;
import jalaw.xml.XmlReader;
import static jalaw.test.Fixtures.catchUnhandled;
import static jalaw.test.Fixtures.xml;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class XmlElementTest {
    @Test
    void headAndTailText() {
        final var root = xml("<Sentence>head<Sup>x</Sup>middle<Sub>y</Sub></Sentence>");
        assertThat(root.text()).isEqualTo("head");
        assertThat(root.children()).extracting(XmlElement::tag).containsExactly("Sup", "Sub");
        assertThat(root.children().get(0).tail()).isEqualTo("middle");
        assertThat(root.children().get(1).tail()).isNull();
        assertThat(root.tail()).isNull();
    }

    @Test
    void elementStartingWithChildHasNoHeadText() {
        final var root = xml("<Sentence><Sup>x</Sup></Sentence>");
        assertThat(root.text()).isNull();
        assertThat(xml("<Sentence/>").text()).isNull();
    }

    @Test
    void cdataAndEntitiesAreText() {
        final var root = xml("<Sentence>a&amp;b<![CDATA[<c>]]>&#x6CD5;</Sentence>");
        assertThat(root.text()).isEqualTo("a&b<c>法");
    }

    @Test
    void commentsAreNotText() {
        final var root = xml("<Sentence>前<!-- note -->後</Sentence>");
        assertThat(root.text()).isEqualTo("前後");
        assertThat(root.children()).isEmpty();
    }

    @Test
    void attributePresenceIsPreserved() {
        final var root = xml("<LawTitle Kana=\"かな\" Abbrev=\"\"/>");
        assertThat(root.attribute("Kana")).isEqualTo("かな");
        assertThat(root.attribute("Abbrev")).isEmpty();
        assertThat(root.attribute("AbbrevKana")).isNull();
    }

    @Test
    void childLookupByTag() {
        final var root = xml("<Article><Paragraph Num=\"1\"/><SupplNote/><Paragraph Num=\"2\"/></Article>");
        assertThat(root.children("Paragraph")).extracting(child -> child.attribute("Num")).containsExactly("1", "2");
        assertThat(root.child("SupplNote")).isNotNull();
        assertThat(root.child("ArticleTitle")).isNull();
        assertThat(root.children()).isUnmodifiable();
        assertThat(root.children().get(2)).asString().isEqualTo("<Paragraph Num=\"2\">");
    }

    @Test
    void bytesAreDecodedByDeclaration() {
        final var bytes = "<?xml version=\"1.0\" encoding=\"Shift_JIS\"?><LawNum>法律</LawNum>"
            .getBytes(Charset.forName("Shift_JIS"));
        assertThat(XmlReader.parse(bytes).text()).isEqualTo("法律");
        assertThat(XmlReader.parse("<LawNum>法律</LawNum>".getBytes(StandardCharsets.UTF_8)).text())
            .isEqualTo("法律");
    }

    @Test
    void internalEntitiesAreExpanded() {
        final var root = xml("<!DOCTYPE Law [<!ENTITY jo \"条\">]><Law>第一&jo;</Law>");
        assertThat(root.text()).isEqualTo("第一条");
    }

    @Test
    void malformedDocumentIsAnError() {
        final var error = catchUnhandled(() -> xml("<Law><LawNum></Law>"));
        assertThat(error.condition()).isInstanceOf(SAXExceptionCondition.class);
    }
}
