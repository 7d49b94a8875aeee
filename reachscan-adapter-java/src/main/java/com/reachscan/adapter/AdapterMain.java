package com.reachscan.adapter;

import ch.qos.logback.classic.Level;
import com.reachscan.adapter.ast.SourceUnit;
import com.reachscan.adapter.exclusion.ExclusionFilter;
import com.reachscan.adapter.exclusion.ExclusionPattern;
import com.reachscan.adapter.manifest.ManifestConfig;
import com.reachscan.adapter.manifest.ManifestReader;
import com.reachscan.adapter.reachability.AnalysisOptions;
import com.reachscan.adapter.reachability.CancellationToken;
import com.reachscan.adapter.reachability.ReachabilityAnalyzer;
import com.reachscan.adapter.report.ReportBuilder;
import com.reachscan.adapter.report.ReportModel;
import com.reachscan.adapter.report.ReportSerializer;
import com.reachscan.adapter.static_analysis.StaticAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for the reachscan-adapter-java command line.
 *
 * Usage:
 *   java -jar reachscan-adapter-java.jar analyze \
 *     [--project] <project-dir> \
 *     [--manifest <path-to-reachscan.json>] \
 *     [--output   <output-dir>] \
 *     [--entry <function>]... [-e <pattern>...]... [--threads <n>] [-v] [-h]
 *
 * Exit codes: 0 no unreachable code, 1 unreachable code found, 2 analysis could not complete.
 */
public class AdapterMain {

    private static final Logger LOGGER = LoggerFactory.getLogger(AdapterMain.class);

    static final int EXIT_CLEAN = 0;
    static final int EXIT_FINDINGS = 1;
    static final int EXIT_FAILED = 2;

    static final String USAGE = String.join("\n",
            "Usage: java -jar reachscan-adapter-java.jar analyze [--project] <dir> [options]",
            "",
            "Reports code that can never execute from the project's entry points.",
            "",
            "Options:",
            "  --project <dir>     project root (or give it as the first positional argument)",
            "  --manifest <file>   analysis config (default: <dir>/reachscan.json when present)",
            "  --output <dir>      report directory (default: <dir>/target/reachscan)",
            "  --entry <function>  extra entry point; repeatable",
            "  -e <pattern>...     exclude symbols or paths: symbol:<glob>, path:<glob> or <glob>",
            "  --threads <n>       worker threads for graph construction",
            "  -v, --verbose       debug logging",
            "  -h, --help          show this help and exit");

    public static void main(String[] args) {
        try {
            System.exit(run(args));
        } catch (UsageException e) {
            LOGGER.error(e.getMessage());
            System.err.println(USAGE);
            System.exit(EXIT_FAILED);
        } catch (Exception e) {
            LOGGER.error("Analysis failed: {}", e.getMessage());
            LOGGER.debug("Stack trace", e);
            System.exit(EXIT_FAILED);
        }
    }

    /**
     * Runs the command and returns its exit code. Failures that prevent a complete analysis
     * propagate as exceptions, which {@link #main} maps to exit code 2.
     */
    static int run(String[] args) {
        CommandLine cli = CommandLine.parse(args);
        if (cli.help) {
            System.out.println(USAGE);
            return EXIT_CLEAN;
        }
        if (cli.verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME)).setLevel(Level.DEBUG);
        }

        Path projectRoot = Paths.get(cli.project).toAbsolutePath().normalize();
        if (!Files.isDirectory(projectRoot)) {
            throw new UsageException("Project directory not found: " + projectRoot);
        }

        // 1. Read manifest
        ManifestReader manifestReader = new ManifestReader();
        ManifestConfig config = cli.manifest != null
                ? manifestReader.read(Paths.get(cli.manifest))
                : manifestReader.readOrDefault(projectRoot);
        String projectName = config.getProjectName() != null
                ? config.getProjectName()
                : projectRoot.getFileName().toString();

        // 2. Compile exclusions before any parsing so a bad rule fails fast
        List<String> excludes = new ArrayList<>(config.getExclude());
        for (String rule : cli.excludes) {
            excludes.add(normalizeExclude(projectRoot, rule));
        }
        ExclusionFilter.compile(excludes);

        // 3. Parse sources
        LOGGER.info("Analyzing {}", projectRoot);
        List<SourceUnit> units = new StaticAnalyzer()
                .analyze(projectRoot, config.getSourceDirs(), config.isIncludeTests());

        // 4. Reachability
        List<String> entryPoints = new ArrayList<>(config.getEntryPoints());
        entryPoints.addAll(cli.entries);
        AnalysisOptions options = new AnalysisOptions(
                entryPoints,
                excludes,
                config.isExportedEntryPoints(),
                config.isIncludeTests(),
                config.isExternalOverridesAreEntryPoints(),
                cli.threads != null ? cli.threads : config.getThreads(),
                CancellationToken.none());
        ReachabilityAnalyzer.AnalysisResult result = new ReachabilityAnalyzer().analyze(units, options);

        // 5. Report
        ReportBuilder builder = new ReportBuilder();
        ReportModel.ReportRoot report = builder.build(result, projectRoot.toString(), projectName);
        builder.logFindings(report);
        Path output = cli.output != null ? Paths.get(cli.output) : projectRoot.resolve("target/reachscan");
        new ReportSerializer().write(report, output, projectName);

        LOGGER.info("Done: {} functions, {} dead, {} findings",
                report.summary.functions, report.summary.deadFunctions, report.summary.findings);
        return report.summary.findings > 0 ? EXIT_FINDINGS : EXIT_CLEAN;
    }

    /**
     * Makes absolute exclusion paths relative to the project root and warns about plain paths
     * that do not exist.
     */
    static String normalizeExclude(Path projectRoot, String rule) {
        ExclusionPattern pattern = ExclusionPattern.parse(rule);
        if (pattern.scope() == ExclusionPattern.Scope.SYMBOL) {
            return rule;
        }
        String prefix = pattern.scope() == ExclusionPattern.Scope.PATH ? "path:" : "";
        String glob = rule.trim().substring(prefix.length());
        if (glob.contains("*") || glob.contains("?") || glob.contains("[") || glob.contains("{")) {
            return rule;
        }
        Path path = Paths.get(glob);
        if (path.isAbsolute() && path.normalize().startsWith(projectRoot)) {
            glob = projectRoot.relativize(path.normalize()).toString().replace('\\', '/');
            path = Paths.get(glob);
        }
        if (!path.isAbsolute() && !Files.exists(projectRoot.resolve(path)) && looksLikePath(glob)) {
            LOGGER.warn("Exclude path does not exist: {}", glob);
        }
        return prefix + glob;
    }

    private static boolean looksLikePath(String glob) {
        return glob.contains("/") || glob.endsWith(".java");
    }

    static final class CommandLine {
        String project;
        String manifest;
        String output;
        Integer threads;
        boolean verbose;
        boolean help;
        final List<String> entries = new ArrayList<>();
        final List<String> excludes = new ArrayList<>();

        static CommandLine parse(String[] args) {
            CommandLine cli = new CommandLine();
            if (args.length > 0 && (args[0].equals("-h") || args[0].equals("--help"))) {
                cli.help = true;
                return cli;
            }
            if (args.length == 0) {
                throw new UsageException("No subcommand specified");
            }
            if (!args[0].equals("analyze")) {
                throw new UsageException("Unknown subcommand: " + args[0]);
            }

            for (int i = 1; i < args.length; i++) {
                switch (args[i]) {
                    case "--project"  -> cli.project  = requireNext(args, i++, "--project");
                    case "--manifest" -> cli.manifest = requireNext(args, i++, "--manifest");
                    case "--output"   -> cli.output   = requireNext(args, i++, "--output");
                    case "--entry"    -> cli.entries.add(requireNext(args, i++, "--entry"));
                    case "--threads"  -> cli.threads  = parseThreads(requireNext(args, i++, "--threads"));
                    case "-v", "--verbose" -> cli.verbose = true;
                    case "-h", "--help"    -> cli.help = true;
                    case "-e", "--exclude" -> {
                        requireNext(args, i, args[i]);
                        while (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                            cli.excludes.add(args[++i]);
                        }
                    }
                    default -> {
                        if (args[i].startsWith("-")) throw new UsageException("Unknown flag: " + args[i]);
                        if (cli.project != null) throw new UsageException("Unexpected argument: " + args[i]);
                        cli.project = args[i];
                    }
                }
            }

            if (!cli.help && cli.project == null) throw new UsageException("A project directory is required");
            return cli;
        }

        private static Integer parseThreads(String value) {
            try {
                int threads = Integer.parseInt(value);
                if (threads < 1) throw new UsageException("--threads must be at least 1");
                return threads;
            } catch (NumberFormatException e) {
                throw new UsageException("--threads expects a number, got: " + value);
            }
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
