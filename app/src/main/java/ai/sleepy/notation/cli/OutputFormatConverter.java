package ai.sleepy.notation.cli;

import ai.sleepy.notation.report.OutputFormat;
import picocli.CommandLine;

/**
 * Parses output format CLI options.
 */
public class OutputFormatConverter implements CommandLine.ITypeConverter<OutputFormat> {
    @Override
    public OutputFormat convert(String value) {
        return OutputFormat.from(value);
    }
}
