package im.arun.tokenmap.export;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.tokenmap.model.DisplayNode;
import im.arun.tokenmap.model.TransformOptions;
import im.arun.tokenmap.model.TransformResult;
import org.apache.commons.text.StringEscapeUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Writes a transform result as indented JSON or as one CSV row per display node.
 */
public class SummaryExporter {

    public enum Format {
        JSON,
        CSV;

        public static Format fromName(String name) {
            if (name == null) {
                return JSON;
            }
            return Format.valueOf(name.trim().toUpperCase(Locale.ROOT));
        }
    }

    static final String CSV_HEADER = "path,name,value,total_value,aggregate";

    private final ObjectMapper objectMapper;

    public SummaryExporter() {
        this(TransformOptions.DEFAULT_MAX_VISIBLE_NODES);
    }

    /**
     * @param maxVisibleNodes budget the exported trees were built with; a display tree is
     *                        never deeper than its node count
     */
    public SummaryExporter(int maxVisibleNodes) {
        // Two JSON levels per display node (the object and its children array), plus the wrapper
        int maxNesting = Math.max(StreamWriteConstraints.DEFAULT_MAX_DEPTH, 2 * maxVisibleNodes + 8);
        JsonFactory jsonFactory = new JsonFactoryBuilder()
            .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(maxNesting).build())
            .build();
        this.objectMapper = new ObjectMapper(jsonFactory);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String export(TransformResult result, Format format) throws JsonProcessingException {
        return format == Format.CSV ? toCsv(result.getTree()) : toJson(result);
    }

    public void export(TransformResult result, Format format, Path output) throws IOException {
        Files.writeString(output, export(result, format));
    }

    public String toJson(TransformResult result) throws JsonProcessingException {
        return objectMapper.writeValueAsString(result);
    }

    /**
     * Pre-order rows, parents before children, children in display order.
     */
    public String toCsv(DisplayNode root) {
        StringBuilder csv = new StringBuilder(CSV_HEADER).append('\n');
        Deque<DisplayNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            DisplayNode node = stack.pop();
            csv.append(StringEscapeUtils.escapeCsv(node.getPath())).append(',')
                .append(StringEscapeUtils.escapeCsv(node.getName())).append(',')
                .append(node.getValue()).append(',')
                .append(node.getTotalValue()).append(',')
                .append(node.isAggregate())
                .append('\n');
            List<DisplayNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return csv.toString();
    }
}
