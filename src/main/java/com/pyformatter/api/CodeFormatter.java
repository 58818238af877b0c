package com.pyformatter.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * File-level entry points of the formatter.
 */
public interface CodeFormatter {
    FormatterResult formatFile(Path filePath, String sourceCode);
    FormatterResult checkFile(Path filePath, String sourceCode);
    Map<Path, FormatterResult> formatDirectory(Path directory);
}
