package com.gdformatter.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * Entry point for formatting single sources or whole project trees.
 */
public interface CodeFormatter {

    /**
     * Formats {@code sourceCode}; {@code filePath} selects the plugin and names the file in diagnostics.
     */
    FormatterResult formatFile(Path filePath, String sourceCode);

    /**
     * Formats every supported, non-ignored file below {@code directory} without writing anything.
     */
    Map<Path, FormatterResult> formatDirectory(Path directory);
}
