// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

/**
 * Content of a {@link Sentence}.
 */
public sealed interface SentenceContent extends Content
    permits PlainText, Line, QuoteStruct, ArithFormula, Ruby, Sup, Sub {
}
