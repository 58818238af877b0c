package com.pyformatter.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.pyformatter.api.CheckResult;
import com.pyformatter.api.CodeFormatter;
import com.pyformatter.api.FormatOutcome;
import com.pyformatter.api.FormatterResult;
import com.pyformatter.api.error.FormatterError;
import com.pyformatter.api.error.FormattingException;
import com.pyformatter.api.error.InvariantViolationException;
import com.pyformatter.api.error.Severity;
import com.pyformatter.config.RuleConfig;
import com.pyformatter.util.LoggerUtil;

/**
 * Thread-safe file-level front end of the {@link StyleEngine}.
 * Every file runs through its own independent pass; a failure in one file becomes a
 * fatal result for that file and leaves its text untouched.
 */
public class PythonStyleFormatter implements CodeFormatter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(PythonStyleFormatter.class);
    private static final long TIMEOUT_MINUTES = 30;

    private final StyleEngine engine;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public PythonStyleFormatter(RuleConfig config) {
        this.engine = new StyleEngine(config);
        logger.fine("Formatter initialized with " + config);
    }

    /**
     * Whether the path names a Python source or stub file.
     */
    public static boolean isPythonFile(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".py") || name.endsWith(".pyi");
    }

    @Override
    public FormatterResult formatFile(Path filePath, String sourceCode) {
        processedFileCount.incrementAndGet();
        try {
            FormatOutcome outcome = engine.format(sourceCode);
            successCount.incrementAndGet();
            logger.fine(() -> (outcome.isChanged() ? "Formatted: " : "Already formatted: ") + filePath);
            return FormatterResult.builder()
                    .successful(true)
                    .formattedCode(outcome.getRenderedText())
                    .changed(outcome.isChanged())
                    .violations(outcome.getViolations())
                    .build();
        } catch (FormattingException | RuntimeException e) {
            return _failure(filePath, sourceCode, e);
        }
    }

    /**
     * Checks a file without producing formatted text: {@link FormatterResult#getFormattedCode()}
     * is the input and {@link FormatterResult#isChanged()} tells whether formatting would change it.
     */
    @Override
    public FormatterResult checkFile(Path filePath, String sourceCode) {
        processedFileCount.incrementAndGet();
        try {
            CheckResult check = engine.check(sourceCode);
            successCount.incrementAndGet();
            return FormatterResult.builder()
                    .successful(true)
                    .formattedCode(sourceCode)
                    .changed(check.wouldChange())
                    .violations(check.getViolations())
                    .build();
        } catch (FormattingException | RuntimeException e) {
            return _failure(filePath, sourceCode, e);
        }
    }

    private FormatterResult _failure(Path filePath, String sourceCode, Exception e) {
        errorCount.incrementAndGet();
        FormatterError error;
        if (e instanceof FormattingException) {
            logger.warning("Cannot format " + filePath + ": " + e.getMessage());
            error = FormatterError.fatal((FormattingException) e, "Fix the syntax error and run again");
        } else if (e instanceof InvariantViolationException) {
            logger.log(Level.SEVERE, "Formatter defect while processing " + filePath, e);
            error = new FormatterError(Severity.FATAL, e.getMessage(), 1, 1,
                    "Disable the offending rule and report the input");
        } else {
            logger.log(Level.SEVERE, "Unexpected error formatting file: " + filePath, e);
            error = new FormatterError(Severity.FATAL, "Unexpected error: " + e.getMessage(), 1, 1);
        }
        return FormatterResult.builder()
                .successful(false)
                .formattedCode(sourceCode)
                .addError(error)
                .build();
    }

    @Override
    public Map<Path, FormatterResult> formatDirectory(Path directory) {
        return formatDirectory(directory, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Formats every Python file below {@code directory} with the given number of threads.
     * Nothing is written back; callers decide what to do with changed results.
     */
    public Map<Path, FormatterResult> formatDirectory(Path directory, int threadCount) {
        if (!Files.isDirectory(directory)) {
            logger.warning("Not a directory: " + directory);
            return new TreeMap<>();
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(PythonStyleFormatter::isPythonFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + directory, e);
            return new TreeMap<>();
        }

        logger.info("Found " + files.size() + " files to process in " + directory);
        return processFiles(files, threadCount, false);
    }

    /**
     * Reads and formats (or checks) the given files on a fixed thread pool.
     *
     * @return results keyed and ordered by path
     */
    public Map<Path, FormatterResult> processFiles(List<Path> files, int threadCount, boolean checkOnly) {
        Map<Path, FormatterResult> results = new ConcurrentHashMap<>();
        if (files.isEmpty()) {
            return new TreeMap<>();
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(threadCount, files.size())));
        for (Path file : files) {
            executor.submit(() -> results.put(file, _processFile(file, checkOnly)));
        }

        executor.shutdown();
        try {
            if (!executor.awaitTermination(TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
                logger.warning("Timeout waiting for file processing to complete");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.log(Level.WARNING, "Processing interrupted", e);
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }

        logger.fine("Processed " + results.size() + " files");
        return new TreeMap<>(results);
    }

    private FormatterResult _processFile(Path file, boolean checkOnly) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            errorCount.incrementAndGet();
            logger.warning("Failed to read file " + file + ": " + e);
            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(null)
                    .addError(new FormatterError(Severity.FATAL, "Failed to read file: " + e, 1, 1,
                            "Python sources must be UTF-8 encoded"))
                    .build();
        }
        return checkOnly ? checkFile(file, content) : formatFile(file, content);
    }

    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    @Override
    public void close() {
        logger.fine("Closing formatter: processed=" + processedFileCount.get() +
                ", success=" + successCount.get() + ", errors=" + errorCount.get());
    }
}
