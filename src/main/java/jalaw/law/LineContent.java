// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

/**
 * Content of an underlined span, {@link Line}.
 */
public sealed interface LineContent extends Content permits PlainText, QuoteStruct, ArithFormula, Ruby, Sup, Sub {
}
