package com.stockharvest.jp.scan;

import com.stockharvest.core.diagnostics.CauseCode;
import com.stockharvest.jp.data.MarketDataException;
import com.stockharvest.jp.data.SnapshotAssembler;
import com.stockharvest.jp.model.StockSnapshot;
import com.stockharvest.jp.model.TradingSignal;
import com.stockharvest.jp.signal.SignalIntegrator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Scans a symbol list on a fixed worker pool. Each fetch is preceded by a delay that shrinks
 * as the scan progresses, to stay under the data source's request limits.
 */
public final class BatchScanner {
    private static final Logger LOG = LogManager.getLogger(BatchScanner.class);

    static final Duration EARLY_DELAY = Duration.ofSeconds(2);
    static final Duration MIDDLE_DELAY = Duration.ofSeconds(1);
    static final Duration LATE_DELAY = Duration.ofMillis(500);

    private static final Comparator<ScanOutcome> RANKING = Comparator
            .comparingDouble(ScanOutcome::strength).reversed()
            .thenComparing(outcome -> outcome.symbol);

    private final SnapshotAssembler assembler;
    private final SignalIntegrator integrator;
    private final int concurrency;
    private final Sleeper sleeper;

    public BatchScanner(SnapshotAssembler assembler, SignalIntegrator integrator, int concurrency, Sleeper sleeper) {
        this.assembler = assembler;
        this.integrator = integrator;
        this.concurrency = Math.max(1, concurrency);
        this.sleeper = sleeper;
    }

    /**
     * @return one outcome per symbol, strongest signal first, ties by symbol
     */
    public List<ScanOutcome> scan(List<String> symbols) throws InterruptedException {
        int total = symbols == null ? 0 : symbols.size();
        if (total == 0) {
            return List.of();
        }
        long startedNanos = System.nanoTime();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(concurrency, total));
        CompletionService<ScanOutcome> completion = new ExecutorCompletionService<>(pool);
        for (int i = 0; i < total; i++) {
            completion.submit(new SymbolTask(symbols.get(i), delayFor(i, total)));
        }

        List<ScanOutcome> outcomes = new ArrayList<>(total);
        int failed = 0;
        try {
            for (int i = 0; i < total; i++) {
                Future<ScanOutcome> future = completion.take();
                try {
                    ScanOutcome outcome = future.get();
                    if (!outcome.outcome.success) {
                        failed++;
                    }
                    outcomes.add(outcome);
                } catch (ExecutionException e) {
                    failed++;
                    LOG.warn("scan task failed: {}", String.valueOf(e.getCause()));
                }
            }
        } finally {
            pool.shutdownNow();
        }

        outcomes.sort(RANKING);
        long detected = outcomes.stream().filter(ScanOutcome::anyDetected).count();
        LOG.info("scan finished: symbols={}, failed={}, detected={}, elapsedMs={}",
                total, failed, detected, (System.nanoTime() - startedNanos) / 1_000_000L);
        return outcomes;
    }

    /**
     * 2s for the first 10% of the list, 1s up to the half-way point, 0.5s after that.
     */
    static Duration delayFor(int index, int total) {
        double progress = total <= 0 ? 0.0 : (double) index / total;
        if (progress < 0.1) {
            return EARLY_DELAY;
        }
        if (progress < 0.5) {
            return MIDDLE_DELAY;
        }
        return LATE_DELAY;
    }

    ScanOutcome scanOne(String symbol, Duration delay) throws InterruptedException {
        sleeper.sleep(delay);
        try {
            StockSnapshot snapshot = assembler.assemble(symbol);
            TradingSignal signal = integrator.evaluate(snapshot);
            return ScanOutcome.of(symbol, signal);
        } catch (MarketDataException e) {
            LOG.warn("market data unavailable for {}: {}", symbol, e.getMessage());
            return ScanOutcome.failed(symbol, CauseCode.FETCH_FAILED, e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("scan failed for {}: {}", symbol, e.toString());
            return ScanOutcome.failed(symbol, CauseCode.RUNTIME_ERROR, e.toString());
        }
    }

    private final class SymbolTask implements Callable<ScanOutcome> {
        private final String symbol;
        private final Duration delay;

        private SymbolTask(String symbol, Duration delay) {
            this.symbol = symbol;
            this.delay = delay;
        }

        @Override
        public ScanOutcome call() throws InterruptedException {
            return scanOne(symbol, delay);
        }
    }
}
