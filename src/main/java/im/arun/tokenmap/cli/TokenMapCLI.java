package im.arun.tokenmap.cli;

import im.arun.tokenmap.config.ConfigLoader;
import im.arun.tokenmap.config.TokenMapConfig;
import im.arun.tokenmap.export.SummaryExporter;
import im.arun.tokenmap.model.ModelConfig;
import im.arun.tokenmap.model.ModelTotals;
import im.arun.tokenmap.model.SizeBasis;
import im.arun.tokenmap.model.TransformResult;
import im.arun.tokenmap.service.TokenMapService;
import im.arun.tokenmap.token.UnknownModelException;
import im.arun.tokenmap.util.TreeUtils;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;

/**
 * Command-line interface for TokenMap using Picocli.
 */
@Command(
    name = "tokenmap",
    description = "Summarize where the characters and tokens of a markup document go",
    mixinStandardHelpOptions = true,
    version = "TokenMap 1.0"
)
public class TokenMapCLI implements Callable<Integer> {
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    @Option(names = {"--file"}, description = "Path to the XML document", required = true)
    private String file;

    @Option(names = {"--model"}, description = "Model id from the catalog (default: from config)")
    private String model;

    @Option(names = {"--basis"}, description = "Size basis: tokens or chars (default: from config)")
    private String basis;

    @Option(names = {"--threshold"}, description = "Aggregation threshold as a fraction of the document total")
    private Double threshold;

    @Option(names = {"--max-nodes"}, description = "Maximum number of visible nodes")
    private Integer maxNodes;

    @Option(names = {"--max-depth"}, description = "Maximum expanded depth (0 for unbounded)")
    private Integer maxDepth;

    @Option(names = {"--focus"}, description = "Path of the subtree to zoom into, e.g. root[1]/files[1]")
    private String focus;

    @Option(names = {"--format"}, description = "Output format: json or csv", defaultValue = "json")
    private String format;

    @Option(names = {"--output"}, description = "Output file path")
    private String outputPath;

    @Option(names = {"--config"}, description = "Path to a YAML configuration file")
    private String configPath;

    @Override
    public Integer call() throws Exception {
        Path inputPath = Paths.get(file);
        if (!Files.exists(inputPath)) {
            System.err.println("Error: file not found: " + file);
            return 1;
        }

        SummaryExporter.Format outputFormat;
        try {
            outputFormat = SummaryExporter.Format.fromName(format);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: unsupported format: " + format);
            return 1;
        }

        Map<String, Object> overrides = new HashMap<>();
        if (model != null) overrides.put("model", model);
        if (basis != null) overrides.put("basis", basis);
        if (threshold != null) overrides.put("aggregation_threshold", threshold);
        if (maxNodes != null) overrides.put("max_visible_nodes", maxNodes);
        if (maxDepth != null) overrides.put("max_depth", maxDepth);
        TokenMapConfig config = new ConfigLoader(configPath).load(overrides);

        String text = readDocument(inputPath);

        System.err.println("TokenMap - Markup Token Summary");
        System.err.println("=".repeat(50));
        System.err.println("File: " + file + " (" + text.length() + " chars)");
        System.err.println("Model: " + config.getModel());
        System.err.println("Basis: " + config.getBasis());

        TransformResult result;
        ModelTotals totals;
        try (TokenMapService service = new TokenMapService(config)) {
            result = service.analyze(inputPath.toString(), text, config.getModel(),
                SizeBasis.fromName(config.getBasis()), config.toTransformOptions(), focus).join();
            totals = service.totalsFor(config.getModel()).orElse(null);
            printUsage(service, totals);
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            System.err.println("Error processing document: " + cause.getMessage());
            return 1;
        } catch (IllegalArgumentException | UnknownModelException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        System.err.println("Visible nodes: " + TreeUtils.countNodes(result.getTree()));

        SummaryExporter exporter = new SummaryExporter(config.getMaxVisibleNodes());
        if (outputPath != null) {
            exporter.export(result, outputFormat, Paths.get(outputPath));
            System.err.println("Output written to: " + outputPath);
        } else {
            System.out.println(exporter.export(result, outputFormat));
        }
        return 0;
    }

    /**
     * Reads the document as UTF-8, dropping a leading byte order mark the XML parsers reject.
     */
    static String readDocument(Path inputPath) throws IOException {
        String text = Files.readString(inputPath, StandardCharsets.UTF_8);
        return text.startsWith(BYTE_ORDER_MARK) ? text.substring(1) : text;
    }

    private static void printUsage(TokenMapService service, ModelTotals totals) {
        if (totals == null) {
            return;
        }
        int overhead = service.getRegistry().catalog().find(totals.getModelId())
            .map(ModelConfig::getOverheadTokens).orElse(0);
        System.err.printf("Tokens: %,d  Chars: %,d%n", totals.getTotalTokens(), totals.getTotalChars());
        if (totals.getContextLimit() > 0) {
            System.err.printf("Context usage: %.1f%% of %,d%n",
                totals.contextUsage(overhead) * 100, totals.getContextLimit());
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TokenMapCLI()).execute(args);
        System.exit(exitCode);
    }
}
