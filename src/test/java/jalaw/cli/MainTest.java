// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.cli;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import jalaw.law.UnsupportedContentErrorCondition;
import jalaw.util.condition.Condition;
import jalaw.util.condition.ConditionContext;
import jalaw.util.condition.Handler;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class MainTest {
    @BeforeEach
    void captureOutput() {
        savedOut = System.out;
        System.setOut(new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(savedOut);
    }

    @Test
    void printsOneTextPerLine(@TempDir final Path directory) throws IOException {
        final var path = writeLaw(directory, "<Sentence>第一文</Sentence>", "<Sentence>第二文</Sentence>");
        assertThat(printWithSkipHandler(path, new ArrayList<>())).isTrue();
        assertThat(output.toString(StandardCharsets.UTF_8).lines()).containsExactly("第一文", "第二文");
    }

    @Test
    void skippedFilePrintsNothing(@TempDir final Path directory) throws IOException {
        // The first sentence resolves fine, the second one fails only once its content is read.
        final var path = writeLaw(
            directory,
            "<Sentence>第一文</Sentence>",
            "<Sentence>第二文<Paragraph Num=\"1\"/></Sentence>"
        );
        final var signaled = new ArrayList<Condition>();
        assertThat(printWithSkipHandler(path, signaled)).isFalse();
        assertThat(signaled).singleElement().isInstanceOf(UnsupportedContentErrorCondition.class);
        assertThat(output.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    private static boolean printWithSkipHandler(final Path path, final ArrayList<Condition> signaled) {
        try (final var handler = new Handler(condition -> {
            if (condition.isFatal()) {
                signaled.add(condition.condition());
                for (final var restart : ConditionContext.restarts()) {
                    if (restart.name().equals("skip-file")) {
                        restart.unwindTo();
                    }
                }
            }
        })) {
            handler.use();
            return Main.printLaw(path);
        }
    }

    private static Path writeLaw(final Path directory, final String first, final String second) throws IOException {
        final var xml = "<Law Era=\"Reiwa\" Year=\"2\" Num=\"5\" LawType=\"Act\" Lang=\"ja\">"
            + "<LawNum>令和二年法律第五号</LawNum><LawBody><MainProvision>"
            + "<Paragraph Num=\"1\"><ParagraphSentence>" + first + "</ParagraphSentence></Paragraph>"
            + "<Paragraph Num=\"2\"><ParagraphSentence>" + second + "</ParagraphSentence></Paragraph>"
            + "</MainProvision></LawBody></Law>";
        final var path = directory.resolve("law.xml");
        Files.writeString(path, xml, StandardCharsets.UTF_8);
        return path;
    }

    private PrintStream savedOut = System.out;
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
}
