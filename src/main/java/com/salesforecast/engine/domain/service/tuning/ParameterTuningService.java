package com.salesforecast.engine.domain.service.tuning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesforecast.engine.domain.exception.ForecastException;
import com.salesforecast.engine.domain.exception.InsufficientHistoryException;
import com.salesforecast.engine.domain.exception.TuningConflictException;
import com.salesforecast.engine.domain.model.ForecastParameterRecord;
import com.salesforecast.engine.domain.model.Granularity;
import com.salesforecast.engine.domain.model.HolidayEvent;
import com.salesforecast.engine.domain.model.HyperparameterSet;
import com.salesforecast.engine.domain.model.TimeSeriesPoint;
import com.salesforecast.engine.domain.model.TuningJob;
import com.salesforecast.engine.domain.repository.ForecastParameterRepository;
import com.salesforecast.engine.domain.repository.TuningJobRepository;
import com.salesforecast.engine.domain.service.ForecastProperties;
import com.salesforecast.engine.domain.service.aggregation.TimeSeriesAggregator;
import com.salesforecast.engine.domain.service.evaluation.AccuracyReport;
import com.salesforecast.engine.domain.service.evaluation.ErrorEvaluator;
import com.salesforecast.engine.domain.service.history.TransactionHistorySource;
import com.salesforecast.engine.domain.service.holiday.HolidayCalendarProvider;
import com.salesforecast.engine.domain.service.parameter.ParameterResolver;
import com.salesforecast.engine.infra.metrics.ForecastMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

@Slf4j
@Service
@RequiredArgsConstructor
public class ParameterTuningService {

    static final List<TuningJob.Status> ACTIVE = List.of(TuningJob.Status.PENDING, TuningJob.Status.RUNNING);

    private final TuningJobRepository jobRepository;
    private final ForecastParameterRepository parameterRepository;
    private final TransactionHistorySource historySource;
    private final TimeSeriesAggregator aggregator;
    private final HolidayCalendarProvider holidayProvider;
    private final ParameterResolver parameterResolver;
    private final ErrorEvaluator evaluator;
    private final ForecastMetrics metrics;
    private final ForecastProperties properties;
    private final ObjectMapper objectMapper;

    @Qualifier("forecastExecutor")
    private final Executor forecastExecutor;

    private final ConcurrentMap<String, Object> categoryLocks = new ConcurrentHashMap<>();

    public TuningJob startTuning(String category, ParameterGrid grid) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category is required");
        }
        if (grid == null || grid.isEmpty()) {
            throw new IllegalArgumentException("At least one parameter must have candidate values");
        }

        TuningJob job;
        synchronized (categoryLocks.computeIfAbsent(category, k -> new Object())) {
            Optional<TuningJob> running = jobRepository.findFirstByCategoryAndStatusIn(category, ACTIVE);
            if (running.isPresent()) {
                throw new TuningConflictException(category, running.get().getId());
            }

            job = jobRepository.save(TuningJob.builder()
                    .category(category)
                    .status(TuningJob.Status.PENDING)
                    .progress(0)
                    .parameterGrid(toJson(grid))
                    .build());
        }

        log.info("[Tuning] job {} queued: category={}", job.getId(), category);
        Long jobId = job.getId();
        try {
            forecastExecutor.execute(() -> runJob(jobId, grid));
        } catch (RejectedExecutionException e) {
            log.warn("[Tuning] job {} rejected, worker pool saturated: category={}", jobId, category);
            job.setStatus(TuningJob.Status.FAILED);
            job.setError("Worker pool saturated, job was not started");
            jobRepository.save(job);
            throw e;
        }
        return job;
    }

    public Optional<TuningJob> findJob(long id) {
        return jobRepository.findById(id);
    }

    public List<TuningJob> findJobs(TuningJob.Status status, String category) {
        return jobRepository.search(status, category);
    }

    void runJob(long jobId, ParameterGrid grid) {
        TuningJob job = jobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.error("[Tuning] job {} not found", jobId);
            return;
        }

        try {
            updateProgress(job, TuningJob.Status.RUNNING, 5);
            String category = job.getCategory();

            List<TimeSeriesPoint> series = aggregator.aggregateAll(
                    historySource.findByCategory(category), Granularity.MONTHLY);
            updateProgress(job, TuningJob.Status.RUNNING, 20);

            HyperparameterSet base = parameterResolver.resolve(category);
            List<HyperparameterSet> candidates = grid.combinations(category, base);
            Set<HolidayEvent> holidays = holidaysFor(series);
            updateProgress(job, TuningJob.Status.RUNNING, 30);

            TuningOutcome outcome = metrics.timeTuning(() -> tune(series, holidays, candidates,
                    done -> updateProgress(job, TuningJob.Status.RUNNING, 30 + 60 * done / candidates.size())));

            saveBest(category, outcome);

            job.setResult(toJson(outcome));
            updateProgress(job, TuningJob.Status.COMPLETED, 100);
            log.info("[Tuning] job {} completed: category={}, best={}, mape={}, tested={}, ok={}",
                    jobId, category, outcome.getBestParameters(), String.format("%.2f", outcome.getMape()),
                    outcome.getTotalCombinationsTested(), outcome.getSuccessfulCombinations());
        } catch (RuntimeException e) {
            log.error("[Tuning] job {} failed: {}", jobId, e.getMessage(), e);
            job.setError(e.getMessage());
            job.setStatus(TuningJob.Status.FAILED);
            jobRepository.save(job);
        }
    }

    public TuningOutcome tune(List<TimeSeriesPoint> series, Set<HolidayEvent> holidays,
                              List<HyperparameterSet> candidates, IntConsumer onProgress) {
        int holdout = properties.getDefaultHoldoutSize();
        int parallelism = Math.max(1, Math.min(properties.getTuning().getParallelism(), candidates.size()));
        ExecutorService pool = Executors.newFixedThreadPool(parallelism, namedThreadFactory("forecast-tuning"));
        Object progressLock = new Object();
        int[] done = {0};

        List<TuningOutcome.CandidateScore> scores = new ArrayList<>(candidates.size());
        try {
            List<Future<TuningOutcome.CandidateScore>> pending = new ArrayList<>(candidates.size());
            for (HyperparameterSet candidate : candidates) {
                pending.add(pool.submit(() -> {
                    TuningOutcome.CandidateScore score = score(series, holidays, candidate, holdout);
                    synchronized (progressLock) {
                        onProgress.accept(++done[0]);
                    }
                    return score;
                }));
            }
            for (Future<TuningOutcome.CandidateScore> future : pending) {
                scores.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Tuning was interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Candidate scoring failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }

        List<TuningOutcome.CandidateScore> successful = scores.stream()
                .filter(TuningOutcome.CandidateScore::isSuccess)
                .sorted(Comparator.comparingDouble(TuningOutcome.CandidateScore::getMape))
                .toList();
        if (successful.isEmpty()) {
            throw new InsufficientHistoryException("No valid parameter combinations found during testing");
        }

        TuningOutcome.CandidateScore best = successful.get(0);
        return TuningOutcome.builder()
                .bestParameters(best.getParameters())
                .mape(best.getMape())
                .rmse(best.getRmse())
                .allResults(successful)
                .totalCombinationsTested(candidates.size())
                .successfulCombinations(successful.size())
                .build();
    }

    private void saveBest(String category, TuningOutcome outcome) {
        ForecastParameterRecord record = parameterRepository.findByCategory(category)
                .orElseGet(() -> ForecastParameterRecord.builder().category(category).build());
        record.apply(outcome.getBestParameters());
        record.setMape(outcome.getMape());
        record.setRmse(outcome.getRmse());
        parameterRepository.save(record);
    }

    private TuningOutcome.CandidateScore score(List<TimeSeriesPoint> series, Set<HolidayEvent> holidays,
                                               HyperparameterSet candidate, int holdout) {
        try {
            AccuracyReport report = evaluator.evaluate(series, candidate, holidays, Granularity.MONTHLY, holdout);
            if (!report.isMapeDefined()) {
                return failed(candidate, "MAPE undefined: all held-out actuals are zero");
            }
            return TuningOutcome.CandidateScore.builder()
                    .parameters(candidate)
                    .mape(report.getMape())
                    .rmse(report.getRmse())
                    .success(true)
                    .build();
        } catch (ForecastException e) {
            log.debug("[Tuning] candidate {} failed: {}", candidate, e.getMessage());
            return failed(candidate, e.getMessage());
        }
    }

    private Set<HolidayEvent> holidaysFor(List<TimeSeriesPoint> series) {
        String region = properties.getHolidayRegion();
        if (!holidayProvider.supports(region)) {
            log.warn("[Tuning] holiday calendar unavailable for region={}, tuning without holidays", region);
            return Set.of();
        }
        int window = properties.getHolidayWindowBuckets();
        int from = Granularity.MONTHLY.plusBuckets(series.get(0).bucketDate(), -window).getYear();
        int to = Granularity.MONTHLY.plusBuckets(series.get(series.size() - 1).bucketDate(), window).getYear();
        return holidayProvider.holidaysFor(region, from, to);
    }

    private void updateProgress(TuningJob job, TuningJob.Status status, int progress) {
        job.setStatus(status);
        job.setProgress(progress);
        jobRepository.save(job);
    }

    private static TuningOutcome.CandidateScore failed(HyperparameterSet candidate, String error) {
        return TuningOutcome.CandidateScore.builder()
                .parameters(candidate)
                .success(false)
                .error(error)
                .build();
    }

    private ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise " + value.getClass().getSimpleName(), e);
        }
    }
}
