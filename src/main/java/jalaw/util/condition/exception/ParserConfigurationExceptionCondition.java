// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.util.condition.exception;

import javax.xml.parsers.ParserConfigurationException;

/**
 * The JDK's DOM parser rejected the configuration it was asked to use.
 */
public final class ParserConfigurationExceptionCondition extends ExceptionCondition<ParserConfigurationException> {
    public ParserConfigurationExceptionCondition(final ParserConfigurationException exception) {
        super(exception);
    }
}
