package ai.sleepy.notation.cli;

import ai.sleepy.notation.NotationEngine;
import ai.sleepy.notation.ast.ParseResult;
import ai.sleepy.notation.config.Config;
import ai.sleepy.notation.config.ConfigLoader;
import ai.sleepy.notation.config.GeneratorConfig;
import ai.sleepy.notation.config.Secrets;
import ai.sleepy.notation.config.SystemEnvironmentReader;
import ai.sleepy.notation.diagnostic.Diagnostic;
import ai.sleepy.notation.generate.ChatModelNotationGenerator;
import ai.sleepy.notation.generate.ElementDescription;
import ai.sleepy.notation.generate.GenerationException;
import ai.sleepy.notation.generate.GenerationMode;
import ai.sleepy.notation.generate.GenerationRequest;
import ai.sleepy.notation.generate.GenerationResult;
import ai.sleepy.notation.generate.GenerationService;
import ai.sleepy.notation.generate.GeneratorFactory;
import ai.sleepy.notation.generate.NotationGenerator;
import ai.sleepy.notation.generate.TemplateNotationGenerator;
import ai.sleepy.notation.io.DocumentReader;
import ai.sleepy.notation.io.DocumentWriter;
import ai.sleepy.notation.io.NotationIoException;
import ai.sleepy.notation.logging.LoggingConfigurator;
import ai.sleepy.notation.report.ReportRenderer;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and engine.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_DIAGNOSTICS = 1;
    static final int EXIT_FAILURE = 3;
    private static final String STDIN = "<stdin>";

    private final ConfigLoader configLoader;
    private final DocumentReader documentReader;
    private final DocumentWriter documentWriter;
    private final InputStream in;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new DocumentReader(), new DocumentWriter(), System.in,
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, DocumentReader documentReader, DocumentWriter documentWriter,
                   InputStream in, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.documentReader = documentReader;
        this.documentWriter = documentWriter;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.debug("Running {} with max depth {}", cliArguments.command(), config.engineSettings().maxDepth());

        NotationEngine engine = new NotationEngine(config.engineSettings());
        ReportRenderer renderer = ReportRenderer.forFormat(cliArguments.outputFormat());
        try {
            if (!cliArguments.command().readsDocuments()) {
                return generate(cliArguments, config, engine, renderer, commandLine);
            }
            if (cliArguments.files().isEmpty()) {
                return process(cliArguments, engine, renderer, STDIN, documentReader.read(in), null);
            }
            int exitCode = EXIT_OK;
            for (Path file : cliArguments.files()) {
                int fileExit = process(cliArguments, engine, renderer, file.toString(), documentReader.read(file), file);
                exitCode = Math.max(exitCode, fileExit);
            }
            return exitCode;
        } catch (NotationIoException | GenerationException ex) {
            LOGGER.error("{}", ex.getMessage(), ex);
            commandLine.getErr().println(ex.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalStateException ex) {
            LOGGER.error("Command failed: {}", ex.getMessage(), ex);
            commandLine.getErr().println(ex.getMessage());
            return EXIT_FAILURE;
        } finally {
            out.flush();
        }
    }

    private int process(CliArguments arguments, NotationEngine engine, ReportRenderer renderer,
                        String source, String text, Path file) {
        return switch (arguments.command()) {
            case VALIDATE -> {
                List<Diagnostic> diagnostics = engine.parse(text).diagnostics();
                out.print(renderer.diagnostics(source, diagnostics));
                yield diagnostics.isEmpty() ? EXIT_OK : EXIT_DIAGNOSTICS;
            }
            case FORMAT -> format(arguments, engine, renderer, source, text, file);
            case CLASSIFY -> {
                out.print(renderer.spans(source, engine.classify(text)));
                yield EXIT_OK;
            }
            case ANALYZE -> {
                out.print(renderer.summary(source, engine.analyze(text)));
                yield EXIT_OK;
            }
            case PARSE -> {
                ParseResult result = engine.parse(text);
                out.print(renderer.tree(source, result));
                yield result.hasDiagnostics() ? EXIT_DIAGNOSTICS : EXIT_OK;
            }
            case GENERATE -> throw new IllegalStateException("generate does not read documents");
        };
    }

    private int format(CliArguments arguments, NotationEngine engine, ReportRenderer renderer,
                       String source, String text, Path file) {
        List<Diagnostic> diagnostics = engine.parse(text).diagnostics();
        if (!diagnostics.isEmpty()) {
            LOGGER.warn("Skipping {}: {} diagnostic(s)", source, diagnostics.size());
            out.print(renderer.diagnostics(source, diagnostics));
            return EXIT_DIAGNOSTICS;
        }
        String formatted = engine.format(text);
        boolean changed = !formatted.equals(text);
        if (arguments.check()) {
            if (changed) {
                out.println(source + ": not formatted");
                return EXIT_DIAGNOSTICS;
            }
            return EXIT_OK;
        }
        if (arguments.write() && file != null) {
            if (changed) {
                documentWriter.write(file, formatted);
                LOGGER.info("Formatted {}", file);
            }
            return EXIT_OK;
        }
        out.print(formatted);
        return EXIT_OK;
    }

    private int generate(CliArguments arguments, Config config, NotationEngine engine, ReportRenderer renderer,
                         CommandLine commandLine) {
        Optional<ElementDescription> element = Optional.ofNullable(arguments.tag())
                .filter(tag -> !tag.isBlank())
                .map(tag -> new ElementDescription(tag, Optional.ofNullable(arguments.elementId()), arguments.classes(),
                        Optional.ofNullable(arguments.text()), arguments.attributes()));
        Optional<String> prompt = Optional.ofNullable(arguments.request()).filter(value -> !value.isBlank());
        if (element.isEmpty() && prompt.isEmpty()) {
            commandLine.getErr().println("generate requires --request or --tag");
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        GeneratorConfig generatorConfig = config.generatorConfig();
        GenerationService service = new GenerationService(buildGeneratorFactory(config), engine,
                generatorConfig.maxAttempts());
        GenerationResult result = service.generate(new GenerationRequest(element, prompt), generatorConfig.mode());
        LOGGER.info("Generated notation from {} after {} model attempt(s)", result.source(), result.attempts());
        out.print(renderer.generation(result));
        return result.isValid() ? EXIT_OK : EXIT_DIAGNOSTICS;
    }

    private GeneratorFactory buildGeneratorFactory(Config config) {
        NotationGenerator templateGenerator = new TemplateNotationGenerator();
        GeneratorConfig generatorConfig = config.generatorConfig();
        if (generatorConfig.mode() == GenerationMode.TEMPLATE) {
            return new GeneratorFactory(templateGenerator, templateGenerator);
        }
        ChatModel chatModel = createChatModel(generatorConfig, config.secrets());
        NotationGenerator productionGenerator = new ChatModelNotationGenerator(chatModel,
                generatorConfig.provider().name(), generatorConfig.modelName());
        return new GeneratorFactory(productionGenerator, templateGenerator);
    }

    private ChatModel createChatModel(GeneratorConfig generatorConfig, Secrets secrets) {
        return switch (generatorConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(generatorConfig);
            case GEMINI -> createGeminiChatModel(generatorConfig, secrets);
        };
    }

    private ChatModel createOllamaChatModel(GeneratorConfig generatorConfig) {
        try {
            String baseUrl = generatorConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", generatorConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(generatorConfig.modelName())
                    .temperature(0.2)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private ChatModel createGeminiChatModel(GeneratorConfig generatorConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", generatorConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(generatorConfig.modelName())
                    .temperature(0.2)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
