// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

/**
 * One item of resolved mixed content: a run of plain text or a typed child node.
 * <p>
 * Which items may appear depends on the containing node; each context has its own subtype.
 */
public sealed interface Content permits SentenceContent, LineContent, TaggedContent, QuoteContent {
    /**
     * Retrieves the plain text this item contributes to its container's flattened text.
     */
    String text();
}
