package com.pyformatter.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.pyformatter.api.FormatterResult;
import com.pyformatter.api.Violation;
import com.pyformatter.api.error.FormatterError;
import com.pyformatter.api.error.Severity;
import com.pyformatter.config.ConfigurationLoader;
import com.pyformatter.config.FormatterConfig;
import com.pyformatter.config.RuleConfig;
import com.pyformatter.core.PythonStyleFormatter;
import com.pyformatter.util.ErrorFormatter;
import com.pyformatter.util.LoggerUtil;

/**
 * Command line interface: {@code format}, {@code check} and {@code init}.
 *
 * <p>Exit codes: 0 on success, 1 when a file failed or (for {@code check}) would be
 * reformatted, 2 on usage errors.
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";
    private static final String CONFIG_FILE_NAME = ".pyformatter.yml";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static ErrorFormatter errorFormatter = new ErrorFormatter(false);

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = run(args);
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(exitCode);
    }

    /**
     * Runs one command and returns its exit code.
     */
    public static int run(String[] args) {
        boolean useColors = !_hasOption(args, "--no-color") && !_hasOption(args, "--ci");
        errorFormatter = new ErrorFormatter(useColors);

        if (args.length < 1) {
            _printUsage();
            return EXIT_USAGE;
        }

        LoggerUtil.setConsoleLevel(_hasOption(args, "--verbose") ? Level.FINE : Level.WARNING);
        String logFile = _getOptionValue(args, "--log-file");
        if (logFile != null) {
            LoggerUtil.setLogFilePath(Paths.get(logFile));
        }

        try {
            String command = args[0];
            switch (command) {
                case "format":
                    return _processFiles(args, false);
                case "check":
                    return _processFiles(args, true);
                case "init":
                    return _initializeConfig(args);
                case "--version":
                case "-v":
                    _printVersion();
                    return EXIT_OK;
                case "--help":
                case "-h":
                    _printUsage();
                    return EXIT_OK;
                default:
                    _printError("Unknown command: " + command);
                    _printUsage();
                    return EXIT_USAGE;
            }
        } catch (IOException e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);

            if (_hasOption(args, "--verbose")) {
                e.printStackTrace();
            } else {
                _printInfo("Use --verbose for stack trace");
            }
            return EXIT_FAILURE;
        }
    }

    private static void _printVersion() {
        System.out.println("pyformatter version " + VERSION);
    }

    private static void _printUsage() {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "pyformatter v" + VERSION));
        System.out.println("Usage:");
        System.out.println("  pyformatter init [--force]        - Write a default " + CONFIG_FILE_NAME);
        System.out.println("  pyformatter format <path>         - Format .py/.pyi files in place");
        System.out.println("  pyformatter check <path>          - Report files that would change, without writing");
        System.out.println("  pyformatter --help|-h             - Show this help");
        System.out.println("  pyformatter --version|-v          - Show version information");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --config=<file>                   - Use specific config file (default: " + CONFIG_FILE_NAME + ")");
        System.out.println("  --enable=<rule,...>               - Run only these rules");
        System.out.println("  --disable=<rule,...>              - Never run these rules");
        System.out.println("  --verbose                         - Show detailed output");
        System.out.println("  --ci                              - CI friendly output (simplified)");
        System.out.println("  --no-color                        - Disable colored output");
        System.out.println("  --include=<glob>                  - Only include files matching pattern");
        System.out.println("  --threads=<num>                   - Number of threads to use (default: available processors)");
        System.out.println("  --log-file=<file>                 - Also write the log to a file");
        System.out.println("  --force                           - Force overwrite (with init command)");
    }

    private static int _processFiles(String[] args, boolean checkOnly) throws IOException {
        if (args.length < 2 || args[1].startsWith("--")) {
            _printError("Error: Missing path argument");
            _printUsage();
            return EXIT_USAGE;
        }

        Path path = Paths.get(args[1]);
        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + path);
            return EXIT_USAGE;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");
        String includePattern = _getOptionValue(args, "--include");

        FormatterConfig config = _loadConfig(args);
        RuleConfig ruleConfig = config.toRuleConfig(
                _getListOption(args, "--enable"), _getListOption(args, "--disable"));
        ruleConfig.getWarnings().forEach(w -> _printWarning(errorFormatter.formatError(w)));

        int threads = _threadCount(args, config);
        List<Path> files = _findFiles(path, config.getGeneralConfig("ignoreFiles", new ArrayList<String>()),
                includePattern);
        _printInfo("Found " + files.size() + " files to " + (checkOnly ? "check" : "format"));

        Instant start = Instant.now();
        Map<Path, List<FormatterError>> errorsByFile = new LinkedHashMap<>();
        int changedCount = 0;
        int unchangedCount = 0;
        int violationCount = 0;

        try (PythonStyleFormatter formatter = new PythonStyleFormatter(ruleConfig)) {
            Map<Path, FormatterResult> results = formatter.processFiles(files, threads, checkOnly);

            for (Map.Entry<Path, FormatterResult> entry : results.entrySet()) {
                Path file = entry.getKey();
                FormatterResult result = entry.getValue();

                if (!result.isSuccessful()) {
                    _printError((checkOnly ? "Failed to check: " : "Failed to format: ") + file);
                    result.getErrors().forEach(e -> _printError("  " + errorFormatter.formatError(e)));
                    errorsByFile.put(file, result.getErrors());
                    continue;
                }

                if (!result.isChanged()) {
                    unchangedCount++;
                    if (verbose) {
                        _printSuccess("  OK: " + file);
                    }
                    continue;
                }

                changedCount++;
                violationCount += result.getViolations().size();
                if (checkOnly) {
                    _printWarning("Would reformat: " + file);
                    for (Violation violation : result.getViolations()) {
                        System.out.println("  " + errorFormatter.formatViolation(file, violation));
                    }
                } else if (_writeFormatted(file, result, errorsByFile)) {
                    _printSuccess("Formatted: " + file);
                    if (verbose && !ciMode) {
                        result.getViolations().forEach(v -> _printInfo("    - " + v));
                    }
                }
            }
        }

        Duration duration = Duration.between(start, Instant.now());
        _printSummary(checkOnly, duration, files.size(), changedCount, unchangedCount, violationCount, errorsByFile.size());

        if (!errorsByFile.isEmpty() && !ciMode) {
            System.out.println("\n" + errorFormatter.formatErrorSummary(errorsByFile));
        }
        if (ciMode) {
            System.out.println("RESULT:files=" + files.size() +
                    ";changed=" + changedCount +
                    ";violations=" + violationCount +
                    ";errors=" + errorsByFile.size());
        }

        boolean failed = !errorsByFile.isEmpty() || (checkOnly && changedCount > 0);
        return failed ? EXIT_FAILURE : EXIT_OK;
    }

    private static boolean _writeFormatted(Path file, FormatterResult result, Map<Path, List<FormatterError>> errorsByFile) {
        try {
            Files.writeString(file, result.getFormattedCode(), StandardCharsets.UTF_8);
            return true;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error writing file: " + file, e);
            _printError("Error writing file: " + file + ": " + e.getMessage());
            errorsByFile.put(file, List.of(new FormatterError(
                    Severity.FATAL,
                    "Failed to write file: " + e.getMessage(), 0, 0,
                    "Check the file permissions")));
            return false;
        }
    }

    private static void _printSummary(boolean checkOnly, Duration duration, int total, int changed,
                                      int unchanged, int violations, int failed) {
        System.out.println("\n" + (checkOnly ? "Check" : "Formatting") + " complete in " + _formatDuration(duration) + ":");
        System.out.println("  Processed files: " + total);
        System.out.println((checkOnly ? "  Files needing formatting: " : "  Reformatted files: ") + changed);
        System.out.println("  Unchanged files: " + unchanged);
        System.out.println("  Violations: " + violations);
        System.out.println("  Files with errors: " + failed);
    }

    private static int _initializeConfig(String[] args) throws IOException {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = Paths.get(configFile != null ? configFile : CONFIG_FILE_NAME);
        boolean force = _hasOption(args, "--force");

        if (Files.exists(configPath) && !force) {
            _printWarning("Configuration file already exists: " + configPath);
            System.out.println("Use --force to overwrite it or specify a different path with --config");
            return EXIT_FAILURE;
        }

        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();
        ConfigurationLoader.saveConfig(config, configPath);
        _printSuccess("Created configuration file: " + configPath);
        return EXIT_OK;
    }

    private static FormatterConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        if (configFile != null) {
            _printInfo("Using config file: " + configFile);
            return ConfigurationLoader.loadConfig(Paths.get(configFile));
        }
        return ConfigurationLoader.loadConfig(Paths.get(CONFIG_FILE_NAME));
    }

    private static int _threadCount(String[] args, FormatterConfig config) {
        int threads = config.getGeneralConfig("threads", 0);
        String threadsStr = _getOptionValue(args, "--threads");
        if (threadsStr != null) {
            try {
                threads = Integer.parseInt(threadsStr);
            } catch (NumberFormatException e) {
                _printWarning("Invalid thread count: " + threadsStr + ", using default");
            }
        }
        return threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
    }

    static List<Path> _findFiles(Path path, List<String> ignorePatterns, String includePattern) throws IOException {
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }

        try (Stream<Path> walk = Files.walk(path)) {
            return walk.filter(Files::isRegularFile)
                    .filter(PythonStyleFormatter::isPythonFile)
                    .filter(p -> _matchesIncludePattern(p, includePattern))
                    .filter(p -> !_isIgnored(p, path, ignorePatterns))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            _printError("Error scanning directory: " + e.getMessage());
            throw e;
        }
    }

    private static boolean _matchesIncludePattern(Path file, String includePattern) {
        if (includePattern == null || includePattern.isEmpty()) {
            return true;
        }

        String fileName = file.getFileName().toString();

        if (includePattern.startsWith("*.")) {
            return fileName.endsWith(includePattern.substring(1));
        } else if (includePattern.contains("*")) {
            return fileName.matches(_globToRegex(includePattern));
        } else {
            return fileName.contains(includePattern);
        }
    }

    static boolean _isIgnored(Path file, Path basePath, List<String> ignorePatterns) {
        if (ignorePatterns == null || ignorePatterns.isEmpty()) {
            return false;
        }

        String relativePath = basePath.relativize(file).toString().replace("\\", "/");

        for (String pattern : ignorePatterns) {
            if (pattern.startsWith("**/")) {
                String suffix = pattern.substring(3);
                if (relativePath.equals(suffix) || relativePath.endsWith("/" + suffix)) {
                    return true;
                }
            } else if (pattern.endsWith("/**")) {
                String prefix = pattern.substring(0, pattern.length() - 3);
                if (relativePath.startsWith(prefix + "/")) {
                    return true;
                }
            } else if (pattern.contains("*")) {
                if (relativePath.matches(_globToRegex(pattern))) {
                    return true;
                }
            } else if (pattern.equals(relativePath)) {
                return true;
            }
        }

        return false;
    }

    private static String _globToRegex(String glob) {
        return glob.replace(".", "\\.")
                .replace("*", ".*")
                .replace("?", ".");
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    private static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static List<String> _getListOption(String[] args, String option) {
        String value = _getOptionValue(args, option);
        if (value == null || value.isBlank()) {
            return new ArrayList<>();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        } else {
            long minutes = seconds / 60;
            seconds = seconds % 60;
            return String.format("%d min %d sec", minutes, seconds);
        }
    }

    private static void _printSuccess(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private static void _printError(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private static void _printWarning(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
    }

    private static void _printInfo(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }
}
