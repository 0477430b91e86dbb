// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * A titled note with its remarks.
 */
public final class NoteStruct implements QuoteContent, TextSource {
    public NoteStruct(final XmlElement element) {
        Elements.expectTag(element, "NoteStruct");
        title = Elements.optional(element, "NoteStructTitle", Label::new);
        remarksBefore = Elements.before(element, "Note", "Remarks", Remarks::new);
        note = Elements.required(element, "Note", Note::new);
        remarksAfter = Elements.after(element, "Note", "Remarks", Remarks::new);
    }

    public @Nullable Label title() {
        return title;
    }

    /**
     * Retrieves the remarks placed before the note.
     */
    public List<Remarks> remarksBefore() {
        return remarksBefore;
    }

    public Note note() {
        return note;
    }

    /**
     * Retrieves the remarks placed after the note.
     */
    public List<Remarks> remarksAfter() {
        return remarksAfter;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.of(title), Texts.of(remarksBefore), note.texts(), Texts.of(remarksAfter));
    }

    @Override
    public String text() {
        return "";
    }

    private final @Nullable Label title;
    private final List<Remarks> remarksBefore;
    private final Note note;
    private final List<Remarks> remarksAfter;
}
