// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Command line front end: binds law documents and prints their text, one string per line.
 */
@NonNullByDefault
package jalaw.cli;

import jalaw.util.annotation.NonNullByDefault;
