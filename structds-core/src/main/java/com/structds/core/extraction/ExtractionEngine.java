package com.structds.core.extraction;

import com.structds.core.assembler.EntityAssembler;
import com.structds.core.config.ConfigurationException;
import com.structds.core.extractor.ParsedSource.ModuleRecord;
import com.structds.core.extractor.SourceExtractor;
import com.structds.core.extractor.SourceSyntaxException;
import com.structds.core.loader.SourceSet;
import com.structds.core.loader.SourceUnit;
import com.structds.core.loader.UnreadableSource;
import com.structds.core.model.Repository;
import com.structds.core.model.RepositoryIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Extracts all source units of a repository in parallel.
 *
 * <p>Each unit is parsed independently on a fixed pool of worker threads. The coordinator
 * waits for every task before assembling anything, so a caller never observes a partially
 * built repository. Units that fail are recorded and left out; the remaining units still
 * produce their modules.
 *
 * <p><b>Failure handling:</b>
 * <ul>
 *   <li>syntax errors become {@link FailureKind#SYNTAX_ERROR}</li>
 *   <li>files the loader could not read become {@link FailureKind#IO_FAILURE}</li>
 *   <li>tasks still running when the timeout expires become {@link FailureKind#CANCELLED}</li>
 *   <li>unexpected extractor failures become {@link FailureKind#INTERNAL_ERROR}</li>
 * </ul>
 *
 * <p>Interrupting the calling thread cancels the whole run with a
 * {@link CancellationException}.
 */
public class ExtractionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExtractionEngine.class);

    private final SourceExtractor extractor;
    private final EntityAssembler assembler;
    private final int workers;
    private final Duration timeout;

    /**
     * Creates an engine.
     *
     * @param extractor language extractor, shared by all workers
     * @param assembler entity assembler
     * @param workers number of worker threads, at least 1
     * @param timeout bound on the whole extraction, {@link Duration#ZERO} for none
     * @throws ConfigurationException if workers is below one or the timeout is negative
     */
    public ExtractionEngine(SourceExtractor extractor, EntityAssembler assembler, int workers, Duration timeout) {
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (workers < 1) {
            throw new ConfigurationException("workers must be at least 1, got " + workers);
        }
        if (timeout.isNegative()) {
            throw new ConfigurationException("timeout must not be negative, got " + timeout);
        }
        this.workers = workers;
        this.timeout = timeout;
    }

    /**
     * Extracts a repository from its loaded sources.
     *
     * @param identity repository identity
     * @param sources loaded source units
     * @return repository, failures and statistics
     * @throws CancellationException if the calling thread is interrupted
     */
    public ExtractionResult extract(RepositoryIdentity identity, SourceSet sources) {
        List<SourceUnit> units = sources.units();
        ExtractionStatistics.Builder stats = new ExtractionStatistics.Builder()
            .filesDiscovered(sources.discovered());
        List<ExtractionFailure> failures = new ArrayList<>();

        for (UnreadableSource unreadable : sources.unreadable()) {
            failures.add(ExtractionFailure.of(unreadable.filePath(), FailureKind.IO_FAILURE, unreadable.message()));
        }

        log.info("Extracting {} files of {} with {} workers", units.size(), identity.name(), workers);
        List<Outcome> outcomes = runAll(units);

        List<ModuleRecord> modules = new ArrayList<>(units.size());
        for (Outcome outcome : outcomes) {
            if (outcome.module() != null) {
                modules.add(outcome.module());
            } else {
                failures.add(outcome.failure());
            }
        }

        failures.sort(Comparator.comparing(ExtractionFailure::filePath));
        for (ExtractionFailure failure : failures) {
            log.warn("Skipping {}", failure.describe());
            stats.incrementFilesFailed().addError(failure.kind().name(), failure.describe());
        }
        modules.forEach(module -> stats.incrementFilesParsed());

        Repository repository = assembler.assemble(identity, modules);
        ExtractionStatistics statistics = stats.build();
        log.info("Extraction of {} finished. {}", identity.name(), statistics.getSummary());
        return new ExtractionResult(repository, failures, statistics);
    }

    private List<Outcome> runAll(List<SourceUnit> units) {
        if (units.isEmpty()) {
            return List.of();
        }
        List<Callable<Outcome>> tasks = units.stream()
            .map(unit -> (Callable<Outcome>) () -> parse(unit))
            .toList();

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(workers, units.size()), new WorkerThreadFactory());
        try {
            List<Future<Outcome>> futures = timeout.isZero()
                ? executor.invokeAll(tasks)
                : executor.invokeAll(tasks, timeout.toMillis(), TimeUnit.MILLISECONDS);

            List<Outcome> outcomes = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(collect(units.get(i), futures.get(i)));
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Extraction interrupted");
            cancelled.initCause(e);
            throw cancelled;
        } finally {
            executor.shutdownNow();
        }
    }

    private Outcome collect(SourceUnit unit, Future<Outcome> future) throws InterruptedException {
        if (future.isCancelled()) {
            return Outcome.failed(ExtractionFailure.of(unit.filePath(), FailureKind.CANCELLED,
                "extraction did not finish within " + timeout.toSeconds() + "s"));
        }
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return Outcome.failed(ExtractionFailure.of(unit.filePath(), FailureKind.INTERNAL_ERROR, cause.toString()));
        } catch (CancellationException e) {
            return Outcome.failed(ExtractionFailure.of(unit.filePath(), FailureKind.CANCELLED, "extraction cancelled"));
        }
    }

    private Outcome parse(SourceUnit unit) {
        log.debug("Parsing {}", unit.filePath());
        try {
            return Outcome.parsed(extractor.extract(unit.filePath(), unit.text()));
        } catch (SourceSyntaxException e) {
            return Outcome.failed(ExtractionFailure.syntaxError(e));
        } catch (RuntimeException | StackOverflowError e) {
            log.debug("Extractor failed on {}", unit.filePath(), e);
            return Outcome.failed(ExtractionFailure.of(unit.filePath(), FailureKind.INTERNAL_ERROR, e.toString()));
        }
    }

    /**
     * Result of one task: exactly one of module and failure is set.
     */
    private record Outcome(ModuleRecord module, ExtractionFailure failure) {
        static Outcome parsed(ModuleRecord module) {
            return new Outcome(module, null);
        }

        static Outcome failed(ExtractionFailure failure) {
            return new Outcome(null, failure);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL = new AtomicInteger();
        private final int pool = POOL.incrementAndGet();
        private final AtomicInteger thread = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread worker = new Thread(runnable, "structds-extract-" + pool + "-" + thread.incrementAndGet());
            worker.setDaemon(true);
            return worker;
        }
    }
}
