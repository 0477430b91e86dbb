// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.util.condition.exception;

import java.io.IOException;

/**
 * A document could not be read.
 */
public final class IOExceptionCondition extends ExceptionCondition<IOException> {
    public IOExceptionCondition(final IOException exception) {
        super(exception);
    }
}
