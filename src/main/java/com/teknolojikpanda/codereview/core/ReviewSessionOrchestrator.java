package com.teknolojikpanda.codereview.core;

import com.teknolojikpanda.codereview.api.AiReviewClient;
import com.teknolojikpanda.codereview.api.CancellationToken;
import com.teknolojikpanda.codereview.api.ReviewCanceledException;
import com.teknolojikpanda.codereview.api.ReviewEventListener;
import com.teknolojikpanda.codereview.api.ReviewSessionException;
import com.teknolojikpanda.codereview.api.SourceProvider;
import com.teknolojikpanda.codereview.model.FileReview;
import com.teknolojikpanda.codereview.model.Finding;
import com.teknolojikpanda.codereview.model.LogLevel;
import com.teknolojikpanda.codereview.model.ProgressEvent;
import com.teknolojikpanda.codereview.model.ReviewPhase;
import com.teknolojikpanda.codereview.model.ReviewSettings;
import com.teknolojikpanda.codereview.model.ReviewSummary;
import com.teknolojikpanda.codereview.model.SessionResult;
import com.teknolojikpanda.codereview.progress.ReviewEventBus;
import com.teknolojikpanda.codereview.util.LogContext;
import com.teknolojikpanda.codereview.util.LogSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives a single review session: lists the files, runs the heuristics and the remote client on
 * each one in order, and aggregates the outcome.
 * <p>
 * An instance runs once. Files are processed strictly sequentially; a failure on one file is
 * recorded on that file's review and the session moves on. Listeners registered through
 * {@link #addListener(ReviewEventListener)} receive every progress and log event synchronously.
 */
public class ReviewSessionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ReviewSessionOrchestrator.class);

    private final String sessionId;
    private final SourceProvider sourceProvider;
    private final HeuristicAnalyzer heuristicAnalyzer;
    private final AiReviewClient aiClient;
    private final ResultAggregator aggregator;
    private final ReviewSettings settings;
    private final CancellationToken cancellation;
    private final ReviewEventBus eventBus = new ReviewEventBus();
    private final AtomicBoolean started = new AtomicBoolean();

    private volatile ProgressEvent progress = ProgressEvent.idle();

    public ReviewSessionOrchestrator(@Nonnull SourceProvider sourceProvider,
                                     @Nonnull AiReviewClient aiClient,
                                     @Nonnull ReviewSettings settings) {
        this(UUID.randomUUID().toString(), sourceProvider, new HeuristicAnalyzer(), aiClient,
                new ResultAggregator(), settings, new CancellationToken());
    }

    public ReviewSessionOrchestrator(@Nonnull String sessionId,
                                     @Nonnull SourceProvider sourceProvider,
                                     @Nonnull HeuristicAnalyzer heuristicAnalyzer,
                                     @Nonnull AiReviewClient aiClient,
                                     @Nonnull ResultAggregator aggregator,
                                     @Nonnull ReviewSettings settings,
                                     @Nonnull CancellationToken cancellation) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.sourceProvider = Objects.requireNonNull(sourceProvider, "sourceProvider");
        this.heuristicAnalyzer = Objects.requireNonNull(heuristicAnalyzer, "heuristicAnalyzer");
        this.aiClient = Objects.requireNonNull(aiClient, "aiClient");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
    }

    @Nonnull
    public String getSessionId() {
        return sessionId;
    }

    @Nonnull
    public ReviewPhase getPhase() {
        return progress.getPhase();
    }

    @Nonnull
    public ProgressEvent getProgress() {
        return progress;
    }

    public void addListener(@Nonnull ReviewEventListener listener) {
        eventBus.register(listener);
    }

    public boolean removeListener(@Nonnull ReviewEventListener listener) {
        return eventBus.unregister(listener);
    }

    @Nonnull
    public ReviewEventBus getEventBus() {
        return eventBus;
    }

    /**
     * Requests cancellation. Takes effect before the next file or the next network dispatch.
     */
    public void cancel() {
        cancellation.cancel();
    }

    /**
     * Runs the session on the given executor.
     */
    @Nonnull
    public CompletableFuture<SessionResult> runAsync(@Nonnull Executor executor,
                                                     @Nonnull String repositoryRef,
                                                     @Nonnull String branchRef,
                                                     @Nonnull String complianceText) {
        Objects.requireNonNull(executor, "executor");
        return CompletableFuture.supplyAsync(() -> run(repositoryRef, branchRef, complianceText), executor);
    }

    /**
     * Runs the session to completion on the calling thread.
     *
     * @throws ReviewSessionException  when the file list cannot be obtained or is empty
     * @throws ReviewCanceledException when the session is cancelled
     * @throws IllegalStateException   when this instance has already been run
     */
    @Nonnull
    public SessionResult run(@Nonnull String repositoryRef,
                             @Nonnull String branchRef,
                             @Nonnull String complianceText) {
        Objects.requireNonNull(repositoryRef, "repositoryRef");
        Objects.requireNonNull(branchRef, "branchRef");
        Objects.requireNonNull(complianceText, "complianceText");
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Review session " + sessionId + " has already been run");
        }

        Instant startedAt = Instant.now();
        long startNanos = System.nanoTime();
        try (LogContext ignored = LogContext.forSession(sessionId, repositoryRef, branchRef)) {
            LogSupport.info(log, "session.started", null,
                    "provider", settings.getProviderId(),
                    "mode", settings.getConnectionMode().name().toLowerCase(Locale.ENGLISH));

            List<String> files;
            try {
                updateProgress(ProgressEvent.builder()
                        .phase(ReviewPhase.FETCHING)
                        .currentFile("Fetching repository files..."));
                files = listFiles(repositoryRef, branchRef);
                emitLog(LogLevel.INFO, "File list", files.size() + " file(s)");
                updateProgress(ProgressEvent.builder()
                        .phase(ReviewPhase.ANALYZING)
                        .totalFiles(files.size())
                        .currentFile("Found " + files.size() + " file(s)"));
            } catch (RuntimeException ex) {
                fail(ex);
                throw ex;
            }

            List<FileReview> reviews;
            try {
                reviews = analyzeFiles(files, complianceText);
            } catch (ReviewCanceledException ex) {
                fail(ex);
                throw ex;
            }

            ReviewSummary summary = aggregator.summarize(reviews);
            Instant finishedAt = Instant.now();
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

            emitLog(LogLevel.INFO, "Review complete",
                    "Analyzed " + summary.getTotalFiles() + " file(s), found "
                            + summary.getTotalFindings() + " issue(s)");
            updateProgress(progress.toBuilder()
                    .timestamp(System.currentTimeMillis())
                    .phase(ReviewPhase.COMPLETED)
                    .processedFiles(files.size())
                    .currentFile("Review complete"));
            LogSupport.info(log, "session.completed", null,
                    "files", summary.getTotalFiles(),
                    "findings", summary.getTotalFindings(),
                    "elapsedMs", elapsedMs);

            return SessionResult.builder()
                    .sessionId(sessionId)
                    .repositoryRef(repositoryRef)
                    .branchRef(branchRef)
                    .complianceText(complianceText)
                    .reviews(reviews)
                    .summary(summary)
                    .startedAt(startedAt)
                    .finishedAt(finishedAt)
                    .elapsedMs(elapsedMs)
                    .build();
        }
    }

    private List<String> listFiles(String repositoryRef, String branchRef) {
        List<String> files;
        try {
            files = sourceProvider.listFiles(repositoryRef, branchRef);
        } catch (IOException ex) {
            throw new ReviewSessionException("Failed to fetch repository files: " + ex.getMessage(), ex);
        }
        if (files == null || files.isEmpty()) {
            throw new ReviewSessionException("No analyzable files found");
        }
        return new ArrayList<>(files);
    }

    private List<FileReview> analyzeFiles(List<String> files, String complianceText) {
        List<FileReview> reviews = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            cancellation.throwIfCancellationRequested(sessionId);
            String path = files.get(i);
            updateProgress(progress.toBuilder()
                    .timestamp(System.currentTimeMillis())
                    .currentFile(path)
                    .processedFiles(i));

            FileReview review;
            try (LogContext ignored = LogContext.forFile(path)) {
                review = analyzeFile(path, complianceText);
            } catch (ReviewCanceledException ex) {
                throw ex;
            } catch (Exception ex) {
                String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
                LogSupport.warn(log, "session.file.failed", message, "path", path);
                emitLog(LogLevel.ERROR, "File review failed", path + " - " + message);
                review = FileReview.failed(path, "Review failed: " + message);
            }
            if (review == null) {
                continue;
            }
            reviews.add(review);
            if (i < files.size() - 1) {
                pause();
            }
        }
        return reviews;
    }

    /**
     * @return the file's review, or {@code null} when the file was skipped as blank
     */
    @Nullable
    private FileReview analyzeFile(String path, String complianceText) throws IOException {
        String content = sourceProvider.readFile(path);
        if (content == null || content.trim().isEmpty()) {
            emitLog(LogLevel.WARNING, "Empty file skipped", path);
            return null;
        }

        String language = LanguageDetector.detect(path);
        emitLog(LogLevel.INFO, "Language detected", path + " -> " + language);

        List<Finding> heuristics = heuristicAnalyzer.analyze(path, content);
        emitLog(LogLevel.INFO, "Heuristic check", path + " -> " + heuristics.size() + " issue(s)");

        if (content.length() > settings.getLargeFileThreshold()) {
            emitLog(LogLevel.WARNING, "Large file, delegated analysis skipped",
                    String.format(Locale.ENGLISH, "%s (%.1fKB)", path, content.length() / 1024.0));
            return new FileReview(path, heuristics,
                    "File too large for delegated analysis; " + heuristics.size() + " heuristic issue(s)");
        }

        FileReview remote = aiClient.review(path, content, language, complianceText,
                (phase, detail) -> emitLog(LogLevel.INFO, phase, detail),
                cancellation);

        List<Finding> merged = new ArrayList<>(heuristics.size() + remote.getFindings().size());
        merged.addAll(heuristics);
        merged.addAll(remote.getFindings());
        emitLog(LogLevel.INFO, "Analysis complete", path + " -> " + merged.size() + " issue(s)");
        return new FileReview(path, merged, "Found " + merged.size() + " issue(s); " + remote.getNote());
    }

    private void pause() {
        long delay = settings.getPacingDelayMs();
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ReviewCanceledException(sessionId, "Review execution interrupted");
        }
    }

    private void fail(RuntimeException ex) {
        String message = ex.getMessage() != null ? ex.getMessage() : "Review session failed";
        updateProgress(progress.toBuilder()
                .timestamp(System.currentTimeMillis())
                .phase(ReviewPhase.FAILED)
                .errorMessage(message));
        emitLog(LogLevel.ERROR, "Review session failed", message);
        LogSupport.error(log, "session.failed", message, ex);
    }

    private void updateProgress(ProgressEvent.Builder builder) {
        ProgressEvent next = builder.build();
        this.progress = next;
        eventBus.publishProgress(next);
    }

    private void emitLog(LogLevel level, String message, @Nullable String detail) {
        LogSupport.log(log, level, "session.log", message, "detail", detail);
        eventBus.publishLog(level, message, detail);
    }
}
