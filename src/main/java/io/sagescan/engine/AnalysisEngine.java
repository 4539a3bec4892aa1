package io.sagescan.engine;

import io.sagescan.aggregate.IssueAggregator;
import io.sagescan.aggregate.IssueFilter;
import io.sagescan.detectors.AnalysisSettings;
import io.sagescan.detectors.Detector;
import io.sagescan.detectors.DetectorRegistry;
import io.sagescan.discovery.FileAccessException;
import io.sagescan.discovery.FileDiscovery;
import io.sagescan.discovery.GlobFileDiscovery;
import io.sagescan.discovery.SourceReader;
import io.sagescan.enrich.IssueEnricher;
import io.sagescan.model.FileRecord;
import io.sagescan.model.Issue;
import io.sagescan.model.ProjectResult;
import io.sagescan.model.SourceText;
import io.sagescan.rules.PatternDetector;
import io.sagescan.rules.RuleCatalog;
import io.sagescan.security.SecretScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a whole analysis: discovery, per-file detection, project-wide dedup and ranking,
 * optional enrichment and result assembly.
 * <p>
 * Files are analysed either on the calling thread or on a fixed pool of
 * {@code min(maxWorkers, fileCount)} daemon threads. Either way the records are collected
 * in discovery order, so a run's output does not depend on scheduling. A failure while
 * analysing one file becomes a failed record for that file; only a discovery error aborts
 * the run.
 */
public class AnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(AnalysisEngine.class);

    public static final int DEFAULT_MAX_WORKERS = 4;
    public static final int DEFAULT_MAX_ENRICHED = 10;

    static final String UNSUPPORTED = "Unsupported file type";

    private final DetectorRegistry registry;
    private final FileDiscovery discovery;
    private final PatternDetector patternDetector;
    private final SecretScanner secretScanner;
    private final IssueAggregator aggregator;
    private final IssueFilter filter;
    private final IssueEnricher enricher;
    private final int maxEnriched;
    private final boolean parallel;
    private final int maxWorkers;
    private final AnalysisListener listener;
    private final ResultAssembler assembler = new ResultAssembler();
    private final SourceReader reader = new SourceReader();

    private AnalysisEngine(Builder builder) {
        this.registry = builder.registry != null
                ? builder.registry
                : DetectorRegistry.createDefault(builder.settings);
        this.registry.freeze();
        this.discovery = builder.discovery != null
                ? builder.discovery
                : new GlobFileDiscovery(List.of(), List.of(), true);
        this.patternDetector = new PatternDetector(builder.rules != null ? builder.rules : RuleCatalog.loadDefault());
        this.secretScanner = builder.secretScanner;
        this.aggregator = builder.aggregator != null ? builder.aggregator : new IssueAggregator();
        this.filter = builder.filter;
        this.enricher = builder.enricher;
        this.maxEnriched = builder.maxEnriched;
        this.parallel = builder.parallel;
        this.maxWorkers = builder.maxWorkers;
        this.listener = builder.listener;
    }

    public static Builder builder() {
        return new Builder();
    }

    public DetectorRegistry registry() {
        return registry;
    }

    /**
     * Analyses every file {@link FileDiscovery} finds under {@code root}.
     *
     * @throws FileAccessException         if the root does not exist
     * @throws AnalysisCancelledException  if the calling thread is interrupted
     * @throws IOException                 if the tree cannot be enumerated
     */
    public ProjectResult analyzeProject(Path root) throws IOException {
        Instant startedAt = Instant.now();
        long start = System.nanoTime();

        List<Path> files = discovery.discover(root);
        log.info("Found {} files to analyze under {}", files.size(), root);
        for (Path file : files) {
            listener.onStateChange(file, FileState.PENDING);
        }

        List<FileRecord> records = parallel && files.size() > 1
                ? analyzeParallel(files)
                : analyzeSequential(files);

        List<Issue> all = new ArrayList<>();
        for (FileRecord record : records) {
            all.addAll(record.issues());
        }
        List<Issue> ranked = aggregator.rank(aggregator.deduplicate(all));
        if (filter != null) {
            ranked = aggregator.filter(ranked, filter);
        }
        ranked = enrich(ranked);

        List<FileRecord> finalRecords = repartition(records, ranked);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        ProjectResult result = assembler.assemble(root.toString(), startedAt, finalRecords, elapsed);
        log.info("Analysis completed in {} ms: {} issues across {} files",
                elapsed.toMillis(), result.totalIssues(), result.totalFiles());
        return result;
    }

    /**
     * Analyses one file: language detector first, then the pattern rules and, when enabled,
     * the secret scanner over the same content. Never throws for per-file problems.
     */
    public FileRecord analyzeFile(Path file) {
        long start = System.nanoTime();
        listener.onStateChange(file, FileState.ANALYZING);
        FileRecord record;
        try {
            record = runDetectors(file);
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("Analysis of {} failed", file, e);
            record = FileRecord.failed(file.toString(), registry.languageOf(file), Detector.describeFailure(e));
        }
        record = record.withDuration(Duration.ofNanos(System.nanoTime() - start));
        listener.onStateChange(file, record.success() ? FileState.SUCCEEDED : FileState.FAILED);
        return record;
    }

    private FileRecord runDetectors(Path file) {
        String path = file.toString();
        Optional<Detector> match = registry.getDetector(file);
        if (match.isEmpty()) {
            log.debug("No detector for {}", path);
            return FileRecord.failed(path, FileRecord.UNKNOWN_LANGUAGE, UNSUPPORTED);
        }
        Detector detector = match.get();

        SourceText source;
        try {
            source = SourceText.of(path, reader.read(file));
        } catch (FileAccessException e) {
            log.warn("Cannot read {}: {}", path, e.getMessage());
            return FileRecord.failed(path, detector.language(), e.getMessage());
        }

        FileRecord record = detector.analyzeSource(source);
        if (!record.success()) {
            return record;
        }

        List<Issue> extra = new ArrayList<>(patternDetector.matchFile(source, detector.language()));
        if (secretScanner != null) {
            extra.addAll(secretScanner.scan(source, detector.language()));
        }
        return record.withAdditionalIssues(extra);
    }

    private List<FileRecord> analyzeSequential(List<Path> files) {
        List<FileRecord> records = new ArrayList<>(files.size());
        int index = 0;
        for (Path file : files) {
            if (Thread.currentThread().isInterrupted()) {
                throw new AnalysisCancelledException("Analysis interrupted after " + index + " files", null);
            }
            index++;
            log.debug("Analyzing {}/{}: {}", index, files.size(), file);
            records.add(analyzeFile(file));
        }
        return records;
    }

    private List<FileRecord> analyzeParallel(List<Path> files) {
        int workers = Math.max(1, Math.min(maxWorkers, files.size()));
        ExecutorService executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        try {
            List<Future<FileRecord>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(executor.submit(() -> analyzeFile(file)));
            }

            List<FileRecord> records = new ArrayList<>(files.size());
            for (int i = 0; i < files.size(); i++) {
                Path file = files.get(i);
                try {
                    records.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Error analyzing {}", file, cause);
                    records.add(FileRecord.failed(file.toString(), registry.languageOf(file),
                            Detector.describeFailure(cause)));
                    listener.onStateChange(file, FileState.FAILED);
                }
            }
            return records;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisCancelledException("Analysis interrupted", e);
        } finally {
            executor.shutdown();
        }
    }

    private List<Issue> enrich(List<Issue> ranked) {
        if (enricher == null || ranked.isEmpty() || maxEnriched <= 0) {
            return ranked;
        }
        int count = Math.min(maxEnriched, ranked.size());
        List<Issue> head = ranked.subList(0, count);
        List<Issue> enriched;
        try {
            enriched = enricher.enrich(head);
        } catch (RuntimeException e) {
            log.warn("Enrichment failed, keeping issues unchanged: {}", e.getMessage());
            return ranked;
        }
        if (enriched == null || enriched.size() != count) {
            log.warn("Enricher returned {} issues for {}; ignoring its result",
                    enriched == null ? 0 : enriched.size(), count);
            return ranked;
        }
        List<Issue> result = new ArrayList<>(enriched);
        result.addAll(ranked.subList(count, ranked.size()));
        return result;
    }

    private static List<FileRecord> repartition(List<FileRecord> records, List<Issue> ranked) {
        Map<String, List<Issue>> byFile = new LinkedHashMap<>();
        for (Issue issue : ranked) {
            byFile.computeIfAbsent(issue.filePath(), k -> new ArrayList<>()).add(issue);
        }
        List<FileRecord> result = new ArrayList<>(records.size());
        for (FileRecord record : records) {
            result.add(record.withIssues(byFile.getOrDefault(record.filePath(), List.of())));
        }
        return result;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "sage-scan-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    public static class Builder {
        private AnalysisSettings settings = AnalysisSettings.defaults();
        private DetectorRegistry registry;
        private FileDiscovery discovery;
        private RuleCatalog rules;
        private SecretScanner secretScanner;
        private IssueAggregator aggregator;
        private IssueFilter filter;
        private IssueEnricher enricher;
        private int maxEnriched = DEFAULT_MAX_ENRICHED;
        private boolean parallel = true;
        private int maxWorkers = DEFAULT_MAX_WORKERS;
        private AnalysisListener listener = AnalysisListener.NONE;

        /**
         * Thresholds for the default registry. Ignored when {@link #registry} is set.
         */
        public Builder settings(AnalysisSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder registry(DetectorRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder discovery(FileDiscovery discovery) {
            this.discovery = discovery;
            return this;
        }

        public Builder rules(RuleCatalog rules) {
            this.rules = rules;
            return this;
        }

        /**
         * Enables secret and injection scanning; null disables it.
         */
        public Builder secretScanner(SecretScanner secretScanner) {
            this.secretScanner = secretScanner;
            return this;
        }

        public Builder aggregator(IssueAggregator aggregator) {
            this.aggregator = aggregator;
            return this;
        }

        public Builder filter(IssueFilter filter) {
            this.filter = filter;
            return this;
        }

        public Builder enricher(IssueEnricher enricher, int maxIssues) {
            this.enricher = enricher;
            this.maxEnriched = maxIssues;
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder maxWorkers(int maxWorkers) {
            if (maxWorkers < 1) {
                throw new IllegalArgumentException("maxWorkers must be >= 1, was " + maxWorkers);
            }
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder listener(AnalysisListener listener) {
            this.listener = listener != null ? listener : AnalysisListener.NONE;
            return this;
        }

        public AnalysisEngine build() {
            return new AnalysisEngine(this);
        }
    }
}
