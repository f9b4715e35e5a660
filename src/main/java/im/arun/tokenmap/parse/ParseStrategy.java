package im.arun.tokenmap.parse;

import im.arun.tokenmap.model.ParseOptions;
import im.arun.tokenmap.model.ParsedNode;

/**
 * One way of turning sanitized markup into a {@link ParsedNode} tree.
 * Implementations report progress and partial subtrees through the emitter; the
 * terminal event is left to {@link MarkupParser}.
 */
interface ParseStrategy {

    String name();

    ParsedNode parse(String sanitized, ParseOptions options, ParseEmitter emitter) throws MarkupParseException;
}
