// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

/**
 * Content of titles, captions, labels and other {@link TaggedText} nodes.
 */
public sealed interface TaggedContent extends Content permits PlainText, Line, Ruby, Sup, Sub {
}
