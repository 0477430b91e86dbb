// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Read-only access to parsed XML: element names, ordered children, head and tail text, attributes.
 */
@NonNullByDefault
package jalaw.xml;

import jalaw.util.annotation.NonNullByDefault;
