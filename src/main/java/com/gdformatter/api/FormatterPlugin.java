package com.gdformatter.api;

import java.nio.file.Path;

import com.gdformatter.config.FormatterConfig;

/**
 * A language formatter that can be registered with the core.
 */
public interface FormatterPlugin {

    /**
     * Reads the plugin's settings. Called once before the first {@link #format}.
     */
    void initialize(FormatterConfig config);

    /**
     * Formats one source. Implementations never throw for bad input; problems are
     * reported as errors on the result.
     *
     * @param filePath path used in messages, may be null for standard input
     */
    FormatterResult format(Path filePath, String sourceCode);
}
