// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.xml;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import jalaw.util.Trace;
import jalaw.util.condition.ConditionContext;
import jalaw.util.condition.exception.IOExceptionCondition;
import jalaw.util.condition.exception.ParserConfigurationExceptionCondition;
import jalaw.util.condition.exception.SAXExceptionCondition;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Parses whole documents into {@link XmlElement} views of their root elements.
 * <p>
 * CDATA sections are merged into the surrounding text and comments are dropped. External DTDs and entities are never
 * fetched. Failures are signaled as fatal conditions: {@link IOExceptionCondition} when the input cannot be read,
 * {@link SAXExceptionCondition} when it isn't well-formed. Parser warnings are signaled as non-fatal
 * {@link SAXExceptionCondition}s.
 */
public final class XmlReader {
    private XmlReader() {
    }

    /**
     * Reads and parses the file at the given path.
     */
    @CheckReturnValue
    public static XmlElement parse(final Path path) {
        try (final var trace = new Trace(() -> "Reading XML file " + path)) {
            trace.use();
            final byte[] bytes;
            try {
                bytes = Files.readAllBytes(path);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
            return parse(bytes);
        }
    }

    /**
     * Parses a document from raw bytes. The encoding is taken from the XML declaration, UTF-8 if there is none.
     */
    @CheckReturnValue
    public static XmlElement parse(final byte[] bytes) {
        try (final var trace = new Trace("Parsing XML document")) {
            trace.use();
            final var builder = newDocumentBuilder();
            try {
                final var document = builder.parse(new ByteArrayInputStream(bytes));
                return XmlElement.of(document.getDocumentElement());
            } catch (final SAXException e) {
                throw ConditionContext.error(new SAXExceptionCondition(e));
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
        }
    }

    /**
     * Parses a document held in a string.
     */
    @CheckReturnValue
    public static XmlElement parse(final String xml) {
        return parse(xml.getBytes(StandardCharsets.UTF_8));
    }

    private static DocumentBuilder newDocumentBuilder() {
        final var factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setValidating(false);
        factory.setCoalescing(true);
        factory.setIgnoringComments(true);
        factory.setExpandEntityReferences(true);
        factory.setXIncludeAware(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature(externalGeneralEntities, false);
            factory.setFeature(externalParameterEntities, false);
            factory.setFeature(loadExternalDtd, false);
            final var builder = factory.newDocumentBuilder();
            builder.setErrorHandler(ConditionErrorHandler.instance);
            return builder;
        } catch (final ParserConfigurationException e) {
            throw ConditionContext.error(new ParserConfigurationExceptionCondition(e));
        }
    }

    private static final String externalGeneralEntities = "http://xml.org/sax/features/external-general-entities";
    private static final String externalParameterEntities = "http://xml.org/sax/features/external-parameter-entities";
    private static final String loadExternalDtd = "http://apache.org/xml/features/nonvalidating/load-external-dtd";

    // Keeps the default handler from printing "[Fatal Error]" lines to standard error.
    private static final class ConditionErrorHandler implements ErrorHandler {
        @Override
        public void warning(final SAXParseException exception) {
            ConditionContext.signal(new SAXExceptionCondition(exception));
        }

        @Override
        public void error(final SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(final SAXParseException exception) throws SAXException {
            throw exception;
        }

        private static final ConditionErrorHandler instance = new ConditionErrorHandler();
    }
}
