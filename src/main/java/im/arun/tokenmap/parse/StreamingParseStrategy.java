package im.arun.tokenmap.parse;

import im.arun.tokenmap.model.ParseOptions;
import im.arun.tokenmap.model.ParsedNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Incremental strategy for large inputs. Feeds the text to a StAX reader in fixed-size
 * chunks and keeps a stack of open frames; each end tag finalizes its frame and
 * attaches the node to the parent, or records it as the root.
 */
class StreamingParseStrategy implements ParseStrategy {
    private static final Logger logger = LoggerFactory.getLogger(StreamingParseStrategy.class);

    private final int chunkSize;

    StreamingParseStrategy(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    @Override
    public String name() {
        return "streaming";
    }

    @Override
    public ParsedNode parse(String sanitized, ParseOptions options, ParseEmitter emitter) throws MarkupParseException {
        long total = sanitized.length();
        emitter.progress(0, total, ParseStage.PARSING);

        ChunkedReader reader = new ChunkedReader(sanitized, chunkSize,
            fed -> emitter.maybeProgress(total, ParseStage.PARSING));

        Deque<NodeFrame> stack = new ArrayDeque<>();
        ParsedNode root = null;
        XMLStreamReader xml = null;
        try {
            xml = newFactory(options).createXMLStreamReader(reader);
            while (xml.hasNext()) {
                int event = xml.next();
                switch (event) {
                    case XMLStreamConstants.START_ELEMENT: {
                        String tag = qualifiedName(xml.getPrefix(), xml.getLocalName());
                        Map<String, String> attrs = attributesOf(xml, options);
                        NodeFrame frame = stack.isEmpty()
                            ? NodeFrame.root(tag, attrs)
                            : stack.peek().openChild(tag, attrs);
                        stack.push(frame);
                        break;
                    }
                    case XMLStreamConstants.CHARACTERS:
                    case XMLStreamConstants.CDATA:
                    case XMLStreamConstants.SPACE:
                        if (!stack.isEmpty()) {
                            stack.peek().appendText(xml.getTextCharacters(), xml.getTextStart(), xml.getTextLength());
                        }
                        break;
                    case XMLStreamConstants.END_ELEMENT: {
                        NodeFrame frame = stack.pop();
                        ParsedNode node = frame.finish(options.isRetainText());
                        if (stack.isEmpty()) {
                            root = node;
                        } else {
                            stack.peek().addChild(node);
                        }
                        emitter.nodeCompleted(node, total, ParseStage.PARSING);
                        break;
                    }
                    case XMLStreamConstants.DTD:
                        Location location = xml.getLocation();
                        throw new MarkupParseException("DOCTYPE is disallowed",
                            location.getLineNumber(), location.getColumnNumber());
                    default:
                        // comments, processing instructions and document boundaries
                        break;
                }
            }
        } catch (XMLStreamException e) {
            Location location = e.getLocation();
            throw new MarkupParseException(e.getMessage(),
                location != null ? location.getLineNumber() : -1,
                location != null ? location.getColumnNumber() : -1, e);
        } finally {
            closeQuietly(xml);
        }

        if (!stack.isEmpty()) {
            throw new MarkupParseException("Unexpected end of input: " + stack.peek().path() + " is not closed", -1, -1);
        }
        if (root == null) {
            root = NodeFrame.emptyDocument(options.isRetainText());
        }

        logger.debug("Streaming parse built {} nodes from {} chars", emitter.processed(), total);
        emitter.progress(total, total, ParseStage.HASHING);
        return root;
    }

    private static XMLInputFactory newFactory(ParseOptions options) {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, options.isHonorNamespaces());
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_REPLACING_ENTITY_REFERENCES, true);
        factory.setProperty(XMLInputFactory.IS_COALESCING, false);
        return factory;
    }

    private static Map<String, String> attributesOf(XMLStreamReader xml, ParseOptions options) {
        if (!options.isPreserveAttributes()) {
            return Map.of();
        }
        Map<String, String> out = new LinkedHashMap<>();
        if (options.isHonorNamespaces()) {
            // Namespace declarations are reported apart from attributes; expose them the way a DOM does
            for (int i = 0; i < xml.getNamespaceCount(); i++) {
                String prefix = xml.getNamespacePrefix(i);
                String name = prefix == null || prefix.isEmpty() ? "xmlns" : "xmlns:" + prefix;
                out.put(name, xml.getNamespaceURI(i) == null ? "" : xml.getNamespaceURI(i));
            }
        }
        for (int i = 0; i < xml.getAttributeCount(); i++) {
            out.put(qualifiedName(xml.getAttributePrefix(i), xml.getAttributeLocalName(i)), xml.getAttributeValue(i));
        }
        return out;
    }

    private static String qualifiedName(String prefix, String localName) {
        return prefix == null || prefix.isEmpty() ? localName : prefix + ":" + localName;
    }

    private static void closeQuietly(XMLStreamReader xml) {
        if (xml == null) {
            return;
        }
        try {
            xml.close();
        } catch (XMLStreamException e) {
            logger.debug("Failed to close XML reader: {}", e.getMessage());
        }
    }
}
