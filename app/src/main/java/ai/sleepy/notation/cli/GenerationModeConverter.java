package ai.sleepy.notation.cli;

import ai.sleepy.notation.generate.GenerationMode;
import picocli.CommandLine;

/**
 * Parses generation mode CLI options.
 */
public class GenerationModeConverter implements CommandLine.ITypeConverter<GenerationMode> {
    @Override
    public GenerationMode convert(String value) {
        return GenerationMode.from(value);
    }
}
