// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Conditions wrapping the checked exceptions thrown by the JDK while reading and parsing documents.
 */
@NonNullByDefault
package jalaw.util.condition.exception;

import jalaw.util.annotation.NonNullByDefault;
