// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Condition and restart system used to report binding errors.
 * <p>
 * Code that detects a problem signals a {@link jalaw.util.condition.Condition}; handlers established further up the
 * stack see it before anything unwinds and decide whether to transfer control to one of the active restarts.
 */
@NonNullByDefault
package jalaw.util.condition;

import jalaw.util.annotation.NonNullByDefault;
