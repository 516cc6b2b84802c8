package com.stockharvest.app;

import com.stockharvest.jp.config.Config;
import com.stockharvest.jp.config.ScreeningConfig;
import com.stockharvest.jp.data.CachingMarketDataProvider;
import com.stockharvest.jp.data.JsonFileMarketDataProvider;
import com.stockharvest.jp.data.SnapshotAssembler;
import com.stockharvest.jp.data.SnapshotJsonReader;
import com.stockharvest.jp.history.DetectionHistoryStore;
import com.stockharvest.jp.history.InMemoryDetectionHistoryStore;
import com.stockharvest.jp.history.JsonLinesDetectionHistoryStore;
import com.stockharvest.jp.model.SignalAction;
import com.stockharvest.jp.model.StockSnapshot;
import com.stockharvest.jp.model.TradingSignal;
import com.stockharvest.jp.scan.BatchScanner;
import com.stockharvest.jp.scan.ScanOutcome;
import com.stockharvest.jp.scan.Sleeper;
import com.stockharvest.jp.signal.SignalIntegrator;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Command-line entry: evaluates snapshots from a JSON file, or scans a symbol list against a
 * directory of per-symbol market data, and prints the ranked signals.
 * Exit code 0 on success, 1 on runtime failure, 2 on bad arguments or configuration.
 */
public final class ScreenerApplication {
    private static final String APP_NAME = "stock-harvest";

    private final PrintStream out;
    private final PrintStream err;
    private final Clock clock;
    private final Sleeper sleeper;

    public ScreenerApplication(PrintStream out, PrintStream err, Clock clock) {
        this(out, err, clock, Sleeper.system());
    }

    ScreenerApplication(PrintStream out, PrintStream err, Clock clock, Sleeper sleeper) {
        this.out = out;
        this.err = err;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public static void main(String[] args) {
        int exit = new ScreenerApplication(System.out, System.err, Clock.systemUTC()).run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp(APP_NAME, options);
            err.println("ERROR: " + e.getMessage());
            return 2;
        }
        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp(APP_NAME, options);
            return 0;
        }
        if (cmd.hasOption("snapshots") == cmd.hasOption("symbols")) {
            new HelpFormatter().printHelp(APP_NAME, options);
            err.println("ERROR: exactly one of --snapshots or --symbols is required");
            return 2;
        }

        Path workingDir = Path.of(cmd.getOptionValue("config-dir", ".")).toAbsolutePath().normalize();
        if (System.getProperty("stockharvest.log.dir") == null) {
            System.setProperty("stockharvest.log.dir", workingDir.resolve("logs").toString());
        }
        Logger log = LogManager.getLogger(ScreenerApplication.class);

        ScreeningConfig screening;
        Config config;
        try {
            config = Config.load(workingDir);
            screening = ScreeningConfig.from(config);
        } catch (IllegalArgumentException e) {
            err.println("ERROR: invalid configuration: " + e.getMessage());
            return 2;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, screening.scanConcurrency));
        try {
            DetectionHistoryStore history = openHistory(cmd, config, screening);
            SignalIntegrator integrator = SignalIntegrator.create(screening, history, pool, clock);

            List<TradingSignal> signals = cmd.hasOption("symbols")
                    ? scanSymbols(cmd, workingDir, screening, integrator, log)
                    : evaluateSnapshotFile(cmd, workingDir, integrator, log);
            signals.sort(Comparator.comparingDouble((TradingSignal s) -> s.signalStrength).reversed()
                    .thenComparing(s -> s.symbol));

            int top = parseTop(cmd.getOptionValue("top"), signals.size());
            List<TradingSignal> shown = signals.subList(0, Math.min(top, signals.size()));
            out.println(new SignalJsonWriter().toJson(shown).toString(2));

            long buys = signals.stream().filter(s -> s.action == SignalAction.STRONG_BUY || s.action == SignalAction.BUY).count();
            log.info("done: signals={}, buy={}, errors={}", signals.size(), buys, signals.stream().filter(TradingSignal::isError).count());
            return 0;
        } catch (IOException e) {
            err.println("ERROR: " + e.getMessage());
            log.error("screening run failed", e);
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("ERROR: " + e.getMessage());
            return 2;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("ERROR: scan interrupted");
            return 1;
        } finally {
            pool.shutdown();
        }
    }

    private List<TradingSignal> evaluateSnapshotFile(CommandLine cmd, Path workingDir, SignalIntegrator integrator, Logger log)
            throws IOException {
        Path input = workingDir.resolve(cmd.getOptionValue("snapshots")).normalize();
        String json = Files.readString(input, StandardCharsets.UTF_8);
        List<StockSnapshot> snapshots = new SnapshotJsonReader().readAll(json, clock.instant());
        log.info("evaluating {} snapshots from {}", snapshots.size(), input);

        List<TradingSignal> signals = new ArrayList<>(snapshots.size());
        for (StockSnapshot snapshot : snapshots) {
            signals.add(integrator.evaluate(snapshot));
        }
        return signals;
    }

    /**
     * Symbols whose market data cannot be fetched are reported on stderr and left out of the output.
     */
    private List<TradingSignal> scanSymbols(CommandLine cmd, Path workingDir, ScreeningConfig screening,
                                            SignalIntegrator integrator, Logger log) throws InterruptedException {
        List<String> symbols = parseSymbols(cmd.getOptionValue("symbols"));
        Path dataDir = workingDir.resolve(cmd.getOptionValue("market-data", "market-data")).normalize();
        log.info("scanning {} symbols against {}", symbols.size(), dataDir);

        CachingMarketDataProvider provider = new CachingMarketDataProvider(new JsonFileMarketDataProvider(dataDir), clock);
        BatchScanner scanner = new BatchScanner(new SnapshotAssembler(provider, clock), integrator, screening.scanConcurrency, sleeper);

        List<TradingSignal> signals = new ArrayList<>(symbols.size());
        for (ScanOutcome outcome : scanner.scan(symbols)) {
            if (outcome.outcome.success) {
                signals.add(outcome.signal());
            } else {
                err.println("WARN: " + outcome.symbol + " skipped (" + outcome.outcome.causeCode + "): " + outcome.outcome.message);
            }
        }
        return signals;
    }

    static List<String> parseSymbols(String raw) {
        List<String> out = new ArrayList<>();
        if (raw != null) {
            Arrays.stream(raw.split(","))
                    .map(String::trim)
                    .filter(symbol -> !symbol.isEmpty())
                    .distinct()
                    .forEach(out::add);
        }
        if (out.isEmpty()) {
            throw new IllegalArgumentException("--symbols must list at least one symbol");
        }
        return out;
    }

    private DetectionHistoryStore openHistory(CommandLine cmd, Config config, ScreeningConfig screening) throws IOException {
        Path path = cmd.hasOption("history")
                ? config.workingDir().resolve(cmd.getOptionValue("history")).normalize()
                : config.getPath("history.path");
        if (path == null) {
            return new InMemoryDetectionHistoryStore(screening.historyCapacity);
        }
        return JsonLinesDetectionHistoryStore.open(path, screening.historyCapacity);
    }

    static int parseTop(String raw, int fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Math.max(0, Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--top must be a number: " + raw, e);
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("snapshots").hasArg().argName("file").desc("JSON file with one snapshot or an array of snapshots").build());
        options.addOption(Option.builder().longOpt("symbols").hasArg().argName("list").desc("comma-separated symbols to scan against --market-data").build());
        options.addOption(Option.builder().longOpt("market-data").hasArg().argName("dir").desc("directory of <symbol>.json market data (default: market-data)").build());
        options.addOption(Option.builder().longOpt("history").hasArg().argName("file").desc("JSON-lines detection history (overrides history.path)").build());
        options.addOption(Option.builder().longOpt("config-dir").hasArg().argName("dir").desc("directory holding config.properties (default: current directory)").build());
        options.addOption(Option.builder().longOpt("top").hasArg().argName("n").desc("print only the n strongest signals").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
