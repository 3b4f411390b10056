package com.gdformatter.plugins.gdscript;

import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.gdformatter.api.FormatterPlugin;
import com.gdformatter.api.FormatterResult;
import com.gdformatter.api.Refactoring;
import com.gdformatter.api.error.FormatterError;
import com.gdformatter.api.error.Severity;
import com.gdformatter.config.ConfigurationLoader;
import com.gdformatter.config.FormatterConfig;
import com.gdformatter.plugins.gdscript.format.FormatException;
import com.gdformatter.plugins.gdscript.format.FormatOptions;
import com.gdformatter.plugins.gdscript.format.Formatter;
import com.gdformatter.plugins.gdscript.format.SourceText;
import com.gdformatter.plugins.gdscript.reorder.ReorderEngine;
import com.gdformatter.plugins.gdscript.verify.SafetyChecker;
import com.gdformatter.plugins.gdscript.verify.SafetyViolation;
import com.gdformatter.util.LoggerUtil;

/**
 * GDScript plugin: format, optionally reorder declarations, then verify.
 * <p>
 * When a safety check fails the original text is returned untouched together with
 * an {@link Severity#ERROR}; a parse failure is {@link Severity#FATAL}.
 */
public class GDScriptFormatter implements FormatterPlugin {
    private static final Logger logger = LoggerUtil.getLogger(GDScriptFormatter.class);
    private static final String STDIN_NAME = "<stdin>";

    private FormatOptions options = FormatOptions.defaults();
    private boolean reorder;
    private boolean safetyChecks = true;
    private SafetyChecker safetyChecker = new SafetyChecker(options);

    @Override
    public void initialize(FormatterConfig config) {
        this.options = FormatOptions.fromConfig(config);
        this.reorder = config.getPluginConfig(ConfigurationLoader.GDSCRIPT_PLUGIN, "reorder", false);
        this.safetyChecks = config.getPluginConfig(ConfigurationLoader.GDSCRIPT_PLUGIN, "safetyChecks", true);
        this.safetyChecker = new SafetyChecker(options);
        logger.fine("GDScript plugin: " + options + ", reorder=" + reorder + ", safetyChecks=" + safetyChecks);
    }

    public FormatOptions getOptions() {
        return options;
    }

    public boolean isReorderEnabled() {
        return reorder;
    }

    public boolean isSafetyChecksEnabled() {
        return safetyChecks;
    }

    @Override
    public FormatterResult format(Path filePath, String sourceCode) {
        String fileName = filePath == null ? STDIN_NAME : filePath.toString();
        FormatterResult.Builder result = FormatterResult.builder().originalCode(sourceCode);

        try {
            String formatted = Formatter.format(sourceCode, options);
            if (safetyChecks) {
                SafetyViolation violation = safetyChecker.checkFormatting(sourceCode, formatted);
                if (violation != null) {
                    return _skipped(result, sourceCode, fileName, violation);
                }
            }

            if (reorder) {
                String reordered = ReorderEngine.reorder(formatted);
                if (safetyChecks) {
                    SafetyViolation violation = safetyChecker.checkReordering(formatted, reordered);
                    if (violation != null) {
                        return _skipped(result, sourceCode, fileName, violation);
                    }
                }
                if (!reordered.equals(formatted)) {
                    int lineCount = SourceText.splitLines(reordered).size();
                    result.addRefactoring(new Refactoring(Refactoring.REORDER, 1, lineCount,
                            "Moved declarations into canonical order"));
                    formatted = reordered;
                }
            }

            for (int line : Formatter.linesExceedingLength(formatted, options)) {
                result.addError(new FormatterError(Severity.INFO,
                        "Line is longer than " + options.getMaxLineLength() + " columns",
                        line, options.getMaxLineLength() + 1));
            }

            return result.successful(true).formattedCode(formatted).build();
        } catch (FormatException e) {
            if (e.getKind() == FormatException.Kind.PARSE) {
                logger.fine("Parse error in " + fileName + ": " + e.getMessage());
                return result.successful(false)
                        .formattedCode(sourceCode)
                        .addError(new FormatterError(Severity.FATAL, e.getMessage(),
                                Math.max(1, e.getLine()), e.getColumn() + 1,
                                "Fix the syntax error; the file was left unchanged"))
                        .build();
            }
            logger.log(Level.WARNING, "Could not reorder " + fileName, e);
            return result.successful(false)
                    .formattedCode(sourceCode)
                    .addError(new FormatterError(Severity.ERROR, e.getMessage(), Math.max(1, e.getLine()), 0))
                    .build();
        }
    }

    private static FormatterResult _skipped(FormatterResult.Builder result, String sourceCode,
                                            String fileName, SafetyViolation violation) {
        logger.fine("Skipping " + fileName + ": safety check failed (" + violation.getKind() + ")");
        return result.successful(false)
                .formattedCode(sourceCode)
                .addError(new FormatterError(Severity.ERROR, violation.describe(fileName), 1, 0,
                        "Please report this input; --unsafe-skip-checks formats it anyway"))
                .build();
    }
}
