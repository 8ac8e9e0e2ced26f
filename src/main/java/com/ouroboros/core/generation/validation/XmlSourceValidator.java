package com.ouroboros.core.generation.validation;

import org.springframework.stereotype.Component;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParserFactory;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import java.util.Set;

/**
 * Well-formedness check with the JDK SAX parser. DTDs and external entities are refused.
 */
@Component
public class XmlSourceValidator implements SourceValidator {

    @Override
    public Set<String> extensions() {
        return Set.of("xml");
    }

    @Override
    public List<String> validate(String path, String content) {
        try {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.newSAXParser().parse(new InputSource(new StringReader(content)), new DefaultHandler());
            return List.of();
        } catch (SAXParseException e) {
            return List.of(String.format("%s:%d: %s", path, e.getLineNumber(), e.getMessage()));
        } catch (SAXException | IOException e) {
            return List.of(path + ": " + e.getMessage());
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not configurable", e);
        }
    }
}
