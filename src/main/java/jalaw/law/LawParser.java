// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.nio.file.Path;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import jalaw.util.Trace;
import jalaw.xml.XmlReader;

/**
 * Entry point: turns law XML documents into {@link Law} trees.
 * <p>
 * Failures are signaled as fatal conditions. Without a handler that unwinds, they surface as
 * {@link jalaw.util.condition.UnhandledErrorError}; there are no partially bound results.
 */
public final class LawParser {
    private LawParser() {
    }

    /**
     * Reads and binds the law document at the given path.
     */
    @CheckReturnValue
    public static Law parse(final Path path) {
        try (final var trace = new Trace(() -> "Parsing law document " + path)) {
            trace.use();
            return new Law(XmlReader.parse(path));
        }
    }

    /**
     * Binds a law document from raw bytes.
     */
    @CheckReturnValue
    public static Law parseFrom(final byte[] xml) {
        return new Law(XmlReader.parse(xml));
    }

    /**
     * Binds a law document held in a string.
     */
    @CheckReturnValue
    public static Law parseFrom(final String xml) {
        return new Law(XmlReader.parse(xml));
    }
}
