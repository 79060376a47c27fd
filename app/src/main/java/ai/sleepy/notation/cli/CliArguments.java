package ai.sleepy.notation.cli;

import ai.sleepy.notation.config.LogFormat;
import ai.sleepy.notation.generate.GenerationMode;
import ai.sleepy.notation.report.OutputFormat;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import picocli.CommandLine;

@CommandLine.Command(name = "sleepy", mixinStandardHelpOptions = true, version = "sleepy 0.1.0",
        description = "Validate, format, classify and analyze Sleepy notation")
public class CliArguments {

    @CommandLine.Parameters(index = "0", converter = CommandConverter.class, paramLabel = "COMMAND",
            description = "validate, format, classify, analyze, parse or generate")
    private Command command;

    @CommandLine.Parameters(index = "1..*", paramLabel = "FILE", description = "Notation files; standard input when omitted")
    private List<Path> files = new ArrayList<>();

    @CommandLine.Option(names = "--output", converter = OutputFormatConverter.class, defaultValue = "TEXT", description = "Output format: text or json")
    private OutputFormat outputFormat = OutputFormat.TEXT;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log at debug level")
    private boolean verbose;

    @CommandLine.Option(names = "--write", description = "format: rewrite files in place")
    private boolean write;

    @CommandLine.Option(names = "--check", description = "format: exit with status 1 when a file is not canonical")
    private boolean check;

    @CommandLine.Option(names = "--max-depth", description = "Deepest bracket nesting parsed before reporting an error", paramLabel = "DEPTH")
    private Integer maxDepth;

    @CommandLine.Option(names = "--generation-mode", description = "generate: production or template", converter = GenerationModeConverter.class)
    private GenerationMode generationMode;

    @CommandLine.Option(names = "--request", description = "generate: free-form description of the component", paramLabel = "TEXT")
    private String request;

    @CommandLine.Option(names = "--tag", description = "generate: tag of the captured element", paramLabel = "TAG")
    private String tag;

    @CommandLine.Option(names = "--id", description = "generate: id of the captured element", paramLabel = "ID")
    private String elementId;

    @CommandLine.Option(names = "--class", description = "generate: CSS class of the captured element (repeatable)", paramLabel = "CLASS")
    private List<String> classes = new ArrayList<>();

    @CommandLine.Option(names = "--text", description = "generate: visible text of the captured element", paramLabel = "TEXT")
    private String text;

    @CommandLine.Option(names = "--attr", description = "generate: attribute of the captured element (repeatable)", paramLabel = "KEY=VALUE")
    private Map<String, String> attributes = new LinkedHashMap<>();

    public Command command() {
        return command;
    }

    public List<Path> files() {
        return files;
    }

    public OutputFormat outputFormat() {
        return outputFormat;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }

    public boolean write() {
        return write;
    }

    public boolean check() {
        return check;
    }

    public Integer maxDepth() {
        return maxDepth;
    }

    public GenerationMode generationMode() {
        return generationMode;
    }

    public String request() {
        return request;
    }

    public String tag() {
        return tag;
    }

    public String elementId() {
        return elementId;
    }

    public List<String> classes() {
        return classes;
    }

    public String text() {
        return text;
    }

    public Map<String, String> attributes() {
        return attributes;
    }
}
