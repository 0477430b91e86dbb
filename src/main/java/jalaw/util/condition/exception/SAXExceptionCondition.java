// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.util.condition.exception;

import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * The input is not well-formed XML.
 */
public final class SAXExceptionCondition extends ExceptionCondition<SAXException> {
    public SAXExceptionCondition(final SAXException exception) {
        super(exception);
    }

    @Override
    public String detailedMessage() {
        if (exception() instanceof final SAXParseException parseException) {
            return "Malformed XML at line " + parseException.getLineNumber() + ", column "
                + parseException.getColumnNumber() + ": " + parseException.getMessage();
        }
        return super.detailedMessage();
    }
}
