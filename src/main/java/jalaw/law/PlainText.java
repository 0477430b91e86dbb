// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

/**
 * A run of character data between elements, kept verbatim, whitespace included.
 *
 * @param text The character data, never empty.
 */
public record PlainText(String text) implements SentenceContent, LineContent, TaggedContent, QuoteContent {
}
