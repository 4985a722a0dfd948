package net.quantuminvestor.fetch.core;

import net.quantuminvestor.fetch.ClassifiedFailure;
import net.quantuminvestor.fetch.Outcome;
import net.quantuminvestor.fetch.boundary.Boundary;
import net.quantuminvestor.fetch.boundary.FailureClassifier;
import net.quantuminvestor.fetch.boundary.HttpFailureClassifier;
import net.quantuminvestor.fetch.config.FetchConfig;
import net.quantuminvestor.fetch.ops.CompositeOpReporter;
import net.quantuminvestor.fetch.ops.OpReporter;
import net.quantuminvestor.fetch.ops.log4j.Log4jOpReporter;
import net.quantuminvestor.fetch.ops.metrics.MetricsOpReporter;
import net.quantuminvestor.fetch.ratelimit.RateLimiter;
import net.quantuminvestor.fetch.retry.Retrier;
import net.quantuminvestor.fetch.retry.RetryPolicy;
import net.quantuminvestor.fetch.retry.RetryResult;
import net.quantuminvestor.fetch.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fetches per-entity results from a primary provider with bounded retries and exponential
 * backoff, falling back to a secondary provider for a single attempt, and keeps statistics
 * on how each entity resolved.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ResilientFetcher fetcher = ResilientFetcher.builder()
 *     .config(FetchConfig.fromEnvironment())
 *     .build();
 *
 * Map<String, Quote> quotes = fetcher.fetchBatch(tickers, finnhub, marketstack, Duration.ZERO, true);
 * if (fetcher.hasFailures()) {
 *     log.warn("Failed tickers: {}", fetcher.failures().keySet());
 * }
 * }</pre>
 *
 * <p>Everything runs on the caller's thread. Within a batch, entities are processed in input
 * order and every side effect (rate-limit bookkeeping, statistics, logging) happens in that
 * order. An entity that cannot be fetched yields an empty result, never an exception.
 */
public final class ResilientFetcher {

    private static final Logger log = LoggerFactory.getLogger(ResilientFetcher.class);

    static final String EXHAUSTED_REASON = "All sources exhausted after retries";

    private final RetryPolicy policy;
    private final Retrier retrier;
    private final Boundary boundary;
    private final RateLimiter rateLimiter;
    private final Sleeper sleeper;
    private final FetchStatistics statistics = new FetchStatistics();

    private ResilientFetcher(Builder builder) {
        this.policy = builder.policy;
        this.sleeper = builder.sleeper;
        this.retrier = new Retrier(builder.reporter, builder.sleeper);
        this.boundary = Boundary.of(builder.classifier, builder.reporter);
        this.rateLimiter = builder.rateLimiter != null
                ? builder.rateLimiter
                : new RateLimiter(builder.clock, builder.sleeper);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for a ResilientFetcher. Every setting is optional.
     */
    public static final class Builder {
        private RetryPolicy policy = RetryPolicy.defaults("fetch");
        private OpReporter reporter;
        private FailureClassifier classifier = new HttpFailureClassifier();
        private RateLimiter rateLimiter;
        private Sleeper sleeper = Sleeper.THREAD;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder policy(RetryPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        /**
         * Derives the retry policy from configuration.
         */
        public Builder config(FetchConfig config) {
            return policy(config.retryPolicy("fetch"));
        }

        /**
         * Reporter for failures and retries; defaults to Log4j plus JSON-lines metrics.
         */
        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public Builder classifier(FailureClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        /**
         * Shares an existing limiter, e.g. one owned by the application session.
         */
        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public ResilientFetcher build() {
            if (reporter == null) {
                reporter = CompositeOpReporter.of(new Log4jOpReporter(), new MetricsOpReporter("fetch"));
            }
            return new ResilientFetcher(this);
        }
    }

    /**
     * Fetches one entity: primary with retries, then a single fallback attempt.
     *
     * @return how the entity resolved; never throws for provider failures
     */
    public <T> FetchResult<T> fetch(FetchRequest<T> request) {
        Objects.requireNonNull(request, "request must not be null");
        String key = request.entityKey();
        ProviderAdapter<T> primary = request.primary();
        statistics.recordAttempt();

        RetryPolicy effective = policy.withMinDelayFloor(request.rateLimitDelay());
        RetryResult<T> result = retrier.execute(operation(primary, key), effective,
                () -> callOnce(primary, key));
        Outcome<T> outcome = result.outcome();
        int attempts = result.attempts();

        if (outcome instanceof Outcome.Ok<T> ok) {
            statistics.recordPrimarySuccess(result.retriesUsed());
            if (result.retriesUsed() > 0) {
                log.info("{}: succeeded on attempt {}", key, attempts);
            }
            return FetchResult.primary(key, ok.value(), attempts);
        }
        if (outcome.isExists()) {
            statistics.recordPrimarySuccess(result.retriesUsed());
            log.info("{}: already exists at {}", key, primary.id());
            return FetchResult.existing(key, attempts);
        }

        ClassifiedFailure lastFailure = outcome.failureIfPresent().orElseThrow();

        Optional<ProviderAdapter<T>> fallback = request.fallbackAdapter();
        if (fallback.isPresent()) {
            ProviderAdapter<T> secondary = fallback.get();
            log.info("{}: trying fallback source {}", key, secondary.id());
            Outcome<T> fallbackOutcome = callOnce(secondary, key);
            if (fallbackOutcome instanceof Outcome.Ok<T> ok) {
                statistics.recordFallbackSuccess();
                log.info("{}: fallback {} succeeded", key, secondary.id());
                return FetchResult.fallback(key, ok.value(), attempts);
            }
            if (fallbackOutcome.isExists()) {
                statistics.recordFallbackSuccess();
                return FetchResult.existing(key, attempts);
            }
            lastFailure = fallbackOutcome.failureIfPresent().orElseThrow();
            log.warn("{}: fallback {} failed: {}", key, secondary.id(), lastFailure.describe());
        }

        statistics.recordFailure(key, EXHAUSTED_REASON);
        log.error("{}: {} (last failure: {})", key, EXHAUSTED_REASON, lastFailure.describe());
        return FetchResult.failed(key, lastFailure, attempts);
    }

    /**
     * Fetches one entity and returns its value, or empty when every source failed.
     *
     * <p>An entity that already exists also yields empty here, although it is counted as a
     * success and does not stop a batch. Callers of create-style adapters should use
     * {@link #fetch(FetchRequest)} and check {@link FetchResult#source()} to tell the two apart.
     */
    public <T> Optional<T> fetchWithRetry(String entityKey, ProviderAdapter<T> primary,
                                          ProviderAdapter<T> fallback, Duration rateLimitDelay) {
        return fetch(new FetchRequest<>(entityKey, primary, fallback, rateLimitDelay)).toOptional();
    }

    public <T> Optional<T> fetchWithRetry(String entityKey, ProviderAdapter<T> primary) {
        return fetchWithRetry(entityKey, primary, null, Duration.ZERO);
    }

    /**
     * Fetches every entity in order and returns the successful values.
     *
     * @param entityKeys entities, processed strictly in this order
     * @param primary provider tried first
     * @param fallback provider tried once per exhausted entity (may be null)
     * @param rateLimitDelay pause between consecutive entities
     * @param continueOnFailure if false, stop at the first entity that could not be fetched
     * @return entity to value, in input order, for successful entities only
     */
    public <T> Map<String, T> fetchBatch(List<String> entityKeys, ProviderAdapter<T> primary,
                                         ProviderAdapter<T> fallback, Duration rateLimitDelay,
                                         boolean continueOnFailure) {
        Map<String, T> values = new LinkedHashMap<>();
        for (FetchResult<T> result : fetchAll(entityKeys, primary, fallback, rateLimitDelay, continueOnFailure)) {
            if (result.isSuccess()) {
                values.put(result.entityKey(), result.value());
            }
        }
        return values;
    }

    /**
     * Like {@link #fetchBatch} but returns the full result of every processed entity.
     */
    public <T> List<FetchResult<T>> fetchAll(List<String> entityKeys, ProviderAdapter<T> primary,
                                             ProviderAdapter<T> fallback, Duration rateLimitDelay,
                                             boolean continueOnFailure) {
        Objects.requireNonNull(entityKeys, "entityKeys must not be null");
        Duration delay = rateLimitDelay == null ? Duration.ZERO : rateLimitDelay;
        List<FetchResult<T>> results = new ArrayList<>(entityKeys.size());

        for (int i = 0; i < entityKeys.size(); i++) {
            String key = entityKeys.get(i);
            if (i > 0) {
                pause(delay);
            }
            FetchResult<T> result = fetch(new FetchRequest<>(key, primary, fallback, delay));
            results.add(result);

            if (result.isFailure() && !continueOnFailure) {
                log.error("Aborting batch due to failure on {}", key);
                break;
            }
        }
        return results;
    }

    public Map<String, String> failures() {
        return statistics.failures();
    }

    public boolean hasFailures() {
        return statistics.hasFailures();
    }

    public int failureCount() {
        return statistics.failureCount();
    }

    public FetchStats stats() {
        return statistics.snapshot();
    }

    public double successRate() {
        return statistics.successRate();
    }

    /**
     * Clears counters and the failure map. Rate-limit state is kept: the providers still
     * remember our last call.
     */
    public void reset() {
        statistics.reset();
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public void logSummary() {
        FetchStats stats = stats();
        log.info("Fetch summary: attempts={}, primary={}, fallback={}, failures={}, retries={}, successRate={}%",
                stats.totalAttempts(),
                stats.primarySuccesses(),
                stats.fallbackSuccesses(),
                stats.totalFailures(),
                stats.retriesUsed(),
                String.format("%.1f", stats.successRate()));
        if (hasFailures()) {
            log.warn("Failed entities: {}", failures().keySet());
        }
    }

    private <T> Outcome<T> callOnce(ProviderAdapter<T> adapter, String key) {
        rateLimiter.waitIfNeeded(adapter.id(), adapter.minInterval());
        return boundary.call(operation(adapter, key), () -> adapter.fetch(key));
    }

    private static String operation(ProviderAdapter<?> adapter, String key) {
        return adapter.id() + ":" + key;
    }

    private void pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
