// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.stream.Stream;

/**
 * A node whose subtree can be read out as plain text.
 */
public interface TextSource {
    /**
     * Returns the plain-text fragments of this subtree in reading order: headings before body before nested
     * structures.
     * <p>
     * Each call returns a new, lazily evaluated stream over the same fragments.
     */
    Stream<String> texts();
}
