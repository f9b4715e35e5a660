package im.arun.tokenmap.parse;

import im.arun.tokenmap.model.ParseOptions;
import im.arun.tokenmap.model.ParsedNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Whole-document strategy for small and medium inputs: parse into a DOM, then walk it
 * once, building nodes post-order with an explicit stack.
 */
class DomParseStrategy implements ParseStrategy {
    private static final Logger logger = LoggerFactory.getLogger(DomParseStrategy.class);

    @Override
    public String name() {
        return "dom";
    }

    @Override
    public ParsedNode parse(String sanitized, ParseOptions options, ParseEmitter emitter) throws MarkupParseException {
        long total = sanitized.length();
        emitter.progress(0, total, ParseStage.PARSING);

        Document document = parseDocument(sanitized, options);

        emitter.progress((long) Math.floor(total * 0.6), total, ParseStage.HASHING);

        ParsedNode root = buildTree(document.getDocumentElement(), options, emitter);

        emitter.progress(total, total, ParseStage.HASHING);
        return root;
    }

    private Document parseDocument(String sanitized, ParseOptions options) throws MarkupParseException {
        try {
            DocumentBuilder builder = newFactory(options).newDocumentBuilder();
            builder.setErrorHandler(new RethrowingErrorHandler());
            return builder.parse(new InputSource(new StringReader(sanitized)));
        } catch (SAXParseException e) {
            throw new MarkupParseException(e.getMessage(), e.getLineNumber(), e.getColumnNumber(), e);
        } catch (SAXException | IOException e) {
            throw new MarkupParseException(e.getMessage(), -1, -1, e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support the required security features", e);
        }
    }

    private static DocumentBuilderFactory newFactory(ParseOptions options) throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(options.isHonorNamespaces());
        factory.setCoalescing(true);
        factory.setIgnoringComments(true);
        factory.setExpandEntityReferences(false);
        factory.setXIncludeAware(false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        // A DOCTYPE that survived sanitizing is rejected outright
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        return factory;
    }

    private ParsedNode buildTree(Element rootElement, ParseOptions options, ParseEmitter emitter) {
        Deque<Cursor> stack = new ArrayDeque<>();
        stack.push(new Cursor(rootElement, NodeFrame.root(rootElement.getNodeName(), attributesOf(rootElement, options))));
        ParsedNode root = null;

        while (!stack.isEmpty()) {
            Cursor top = stack.peek();
            NodeList childNodes = top.element.getChildNodes();

            if (top.next < childNodes.getLength()) {
                Node child = childNodes.item(top.next++);
                switch (child.getNodeType()) {
                    case Node.TEXT_NODE:
                    case Node.CDATA_SECTION_NODE:
                        top.frame.appendText(child.getNodeValue());
                        break;
                    case Node.ELEMENT_NODE:
                        Element element = (Element) child;
                        NodeFrame frame = top.frame.openChild(element.getNodeName(), attributesOf(element, options));
                        stack.push(new Cursor(element, frame));
                        break;
                    default:
                        // comments and anything else carry no content
                        break;
                }
                continue;
            }

            stack.pop();
            ParsedNode node = top.frame.finish(options.isRetainText());
            if (stack.isEmpty()) {
                root = node;
            } else {
                stack.peek().frame.addChild(node);
            }
            emitter.nodeCompleted(node, null, ParseStage.HASHING);
        }

        logger.debug("DOM walk built {} nodes", emitter.processed());
        return root;
    }

    private static Map<String, String> attributesOf(Element element, ParseOptions options) {
        if (!options.isPreserveAttributes() || !element.hasAttributes()) {
            return Map.of();
        }
        NamedNodeMap attrs = element.getAttributes();
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i < attrs.getLength(); i++) {
            Node attr = attrs.item(i);
            out.put(attr.getNodeName(), attr.getNodeValue());
        }
        return out;
    }

    private static final class Cursor {
        final Element element;
        final NodeFrame frame;
        int next;

        Cursor(Element element, NodeFrame frame) {
            this.element = element;
            this.frame = frame;
        }
    }

    private static final class RethrowingErrorHandler implements ErrorHandler {
        @Override
        public void warning(SAXParseException exception) {
            logger.debug("XML warning at {}:{}: {}", exception.getLineNumber(),
                exception.getColumnNumber(), exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
