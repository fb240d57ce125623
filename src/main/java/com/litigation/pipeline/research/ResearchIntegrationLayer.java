package com.litigation.pipeline.research;

import com.litigation.pipeline.core.CancellationToken;
import com.litigation.pipeline.core.OperationCancelledException;
import com.litigation.pipeline.core.model.Entity;
import com.litigation.pipeline.core.model.EntityType;
import com.litigation.pipeline.core.model.Provenance;
import com.litigation.pipeline.graph.EntityCandidate;
import com.litigation.pipeline.graph.EntityKeys;
import com.litigation.pipeline.graph.GraphValidationException;
import com.litigation.pipeline.graph.KnowledgeGraphStore;
import com.litigation.pipeline.graph.RelationshipRequest;
import com.litigation.pipeline.jurisdiction.JurisdictionAuthorityResolver;
import com.litigation.pipeline.lock.LockAcquisitionException;
import com.litigation.pipeline.logging.LogContext;
import com.litigation.pipeline.metrics.MetricsService;
import com.litigation.pipeline.metrics.NoOpMetricsService;
import com.litigation.pipeline.research.cache.CachedResearch;
import com.litigation.pipeline.research.cache.NoOpResearchCache;
import com.litigation.pipeline.research.cache.ResearchCache;
import com.litigation.pipeline.resilience.CircuitBreaker;
import com.litigation.pipeline.resilience.FallbackChain;
import com.litigation.pipeline.resilience.RetryPolicy;
import com.litigation.pipeline.resilience.Sleeper;
import com.litigation.pipeline.scoring.ConfidenceFactors;
import com.litigation.pipeline.scoring.ConfidenceScorer;
import com.litigation.pipeline.tracing.NoOpTracingService;
import com.litigation.pipeline.tracing.Span;
import com.litigation.pipeline.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Queries external authority providers and turns their answers into ranked, gap-analyzed,
 * cached research results.
 *
 * <p>Each query runs one fallback chain: every provider in configured order, then the
 * cached result for the query fingerprint served as stale, then an empty result flagged
 * {@code insufficientCoverage}. A fresh cache hit short-circuits the chain. Each provider
 * call goes through the provider's shared rate limiter, a timeout and the provider's
 * circuit breaker; an open circuit skips the provider without calling it. Provider
 * failures never reach the caller.</p>
 *
 * <p>Fresh results are written to the knowledge graph as {@code AUTHORITY} entities linked
 * {@code CITED_FOR} to the query's anchor entities.</p>
 */
public class ResearchIntegrationLayer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResearchIntegrationLayer.class);

    public static final String CITED_FOR = "CITED_FOR";

    static final String STALE_CACHE_STRATEGY = "stale-cache";
    static final String EMPTY_STRATEGY = "insufficient-coverage";

    private final List<AuthorityProvider> providers;
    private final ProviderGuardRegistry guards;
    private final ResearchCache cache;
    private final JurisdictionAuthorityResolver resolver;
    private final ConfidenceScorer scorer;
    private final KnowledgeGraphStore graphStore;
    private final RetryPolicy retryPolicy;
    private final ResearchOptions options;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final QueryFormulator formulator;
    private final CitationRanker ranker;
    private final GapAnalyzer gapAnalyzer;

    private ResearchIntegrationLayer(Builder builder) {
        this.providers = List.copyOf(builder.providers);
        this.guards = builder.guards != null ? builder.guards : new ProviderGuardRegistry();
        this.cache = builder.cache != null ? builder.cache : new NoOpResearchCache();
        this.resolver = builder.resolver != null ? builder.resolver : new JurisdictionAuthorityResolver();
        this.scorer = builder.scorer != null ? builder.scorer : new ConfidenceScorer();
        this.graphStore = builder.graphStore;
        this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : RetryPolicy.defaults();
        this.options = builder.options != null ? builder.options : ResearchOptions.defaults();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
        this.ownsExecutor = builder.executor == null;
        this.executor = builder.executor != null ? builder.executor : Executors.newCachedThreadPool(daemonThreads());
        this.formulator = builder.formulator != null ? builder.formulator : new QueryFormulator();
        this.ranker = new CitationRanker(scorer, resolver, clock);
        this.gapAnalyzer = new GapAnalyzer(resolver, options.recencyHorizonYears(), clock);
        log.info("ResearchIntegrationLayer initialized: providers={} timeout={} retries={}",
                providers.stream().map(AuthorityProvider::getName).collect(Collectors.toList()),
                options.providerTimeout(), retryPolicy.maxAttempts());
    }

    public ResearchQuery formulateQuery(Collection<Entity> entities, List<String> legalIssues, String jurisdictionId) {
        return formulator.formulateQuery(entities, legalIssues, jurisdictionId);
    }

    public ResearchResult execute(ResearchQuery query) {
        return execute(query, CancellationToken.none());
    }

    /**
     * Runs the query. Never fails because of provider trouble; the returned result carries
     * {@code stale} or {@code insufficientCoverage} instead.
     *
     * @throws OperationCancelledException if the token is cancelled before a result is produced
     */
    public ResearchResult execute(ResearchQuery query, CancellationToken token) {
        Objects.requireNonNull(query, "query is required");
        String fingerprint = query.fingerprint();
        long start = System.nanoTime();
        List<ResearchStage.Transition> trail = new ArrayList<>();

        try (LogContext ignored = LogContext.forResearch(fingerprint);
             Span span = tracingService.startSpan("research.execute",
                     Map.of("jurisdiction", query.jurisdictionId(), "fingerprint", fingerprint))) {
            token.throwIfCancelled();
            stage(trail, ResearchStage.FORMULATED, null);

            Optional<CachedResearch> fresh = cache.getFresh(fingerprint, clock.instant());
            if (fresh.isPresent()) {
                metricsService.recordCacheHit();
                stage(trail, ResearchStage.CACHED, "fresh hit");
                span.setAttribute("cacheHit", true);
                log.debug("research.cache.hit fingerprint={}", fingerprint);
                return fresh.get().result().fromCache(false, List.copyOf(trail));
            }
            metricsService.recordCacheMiss();

            FallbackChain.Builder<ResearchResult> chain = FallbackChain.<ResearchResult>builder("research")
                    .propagate(OperationCancelledException.class);
            for (AuthorityProvider provider : providers) {
                chain.then(provider.getName(), () -> attemptProvider(provider, query, token, trail));
            }
            chain.then(STALE_CACHE_STRATEGY, () -> staleFromCache(fingerprint, trail))
                    .then(EMPTY_STRATEGY, () -> Optional.of(insufficientCoverage(query, trail)));

            FallbackChain.Outcome<ResearchResult> outcome = chain.build().execute();
            span.setAttribute("strategy", outcome.strategy());
            span.setAttribute("citations", (long) outcome.value().citations().size());
            span.setAttribute("stale", outcome.value().stale());
            return outcome.value();
        } finally {
            metricsService.recordResearchDuration(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Runs the query off the calling thread.
     */
    public CompletableFuture<ResearchResult> executeAsync(ResearchQuery query, CancellationToken token) {
        return CompletableFuture.supplyAsync(() -> execute(query, token), executor);
    }

    public ProviderGuardRegistry getGuards() {
        return guards;
    }

    public ResearchCache getCache() {
        return cache;
    }

    public List<String> getProviderNames() {
        return providers.stream().map(AuthorityProvider::getName).collect(Collectors.toList());
    }

    private Optional<ResearchResult> attemptProvider(AuthorityProvider provider, ResearchQuery query,
                                                     CancellationToken token, List<ResearchStage.Transition> trail) {
        String name = provider.getName();
        ProviderGuardRegistry.ProviderGuard guard = guards.guardFor(name);
        CircuitBreaker breaker = guard.circuitBreaker();

        if (breaker.getState() == CircuitBreaker.State.OPEN) {
            metricsService.incrementProviderCall(name, "circuit_open");
            stage(trail, ResearchStage.PROVIDER_FAILED, name + ": circuit open");
            log.warn("research.provider.skipped provider={} reason=circuit_open", name);
            return Optional.empty();
        }
        stage(trail, ResearchStage.DISPATCHED, name);

        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            token.throwIfCancelled();
            String failure;
            String outcome;

            OptionalLong permit = guard.rateLimiter().acquire(options.rateLimitMaxWait());
            if (permit.isEmpty()) {
                token.throwIfCancelled();
                failure = "throttled";
                outcome = failure;
                metricsService.incrementProviderCall(name, outcome);
            } else if (!breaker.allowRequest()) {
                metricsService.incrementProviderCall(name, "circuit_open");
                stage(trail, ResearchStage.PROVIDER_FAILED, name + ": circuit open");
                return Optional.empty();
            } else {
                ProviderResponse response;
                try {
                    response = callWithTimeout(provider, query, token, attempt);
                    failure = response.isSuccess() ? null : response.status().name().toLowerCase(Locale.ROOT);
                    outcome = failure;
                } catch (ProviderCallException e) {
                    response = null;
                    failure = e.getMessage();
                    outcome = e.outcome;
                } catch (RuntimeException e) {
                    // no outcome to record; a held half-open trial slot must not outlive the call
                    breaker.releaseTrial();
                    throw e;
                }
                if (response != null && response.reportsQuota()) {
                    guard.rateLimiter().syncHeadroom(response.remainingQuota());
                }
                if (failure == null) {
                    breaker.recordSuccess();
                    metricsService.incrementProviderCall(name, "success");
                    stage(trail, ResearchStage.PROVIDER_SUCCEEDED, name);
                    return Optional.of(complete(query, name, response.citations(), trail));
                }
                breaker.recordFailure();
                metricsService.incrementProviderCall(name, outcome);
            }

            stage(trail, ResearchStage.PROVIDER_FAILED, name + ": " + failure);
            log.warn("research.provider.failed provider={} attempt={} reason={}", name, attempt, failure);
            if (breaker.getState() == CircuitBreaker.State.OPEN || !retryPolicy.canRetry(attempt)) {
                break;
            }
            pause(retryPolicy.backoffFor(attempt), token);
        }
        return Optional.empty();
    }

    private ProviderResponse callWithTimeout(AuthorityProvider provider, ResearchQuery query,
                                             CancellationToken token, int attempt) {
        String name = provider.getName();
        try (Span span = tracingService.startSpan("research.provider",
                Map.of("provider", name, "attempt", String.valueOf(attempt)))) {
            Future<ProviderResponse> future = executor.submit(() -> provider.search(query));
            try (CancellationToken.Registration ignored = token.onCancel(() -> future.cancel(true))) {
                ProviderResponse response = future.get(options.providerTimeout().toMillis(), TimeUnit.MILLISECONDS);
                if (response == null) {
                    throw new ProviderCallException("error", "empty response");
                }
                span.setAttribute("status", response.status().name());
                return response;
            } catch (TimeoutException e) {
                future.cancel(true);
                span.setStatus(Span.SpanStatus.ERROR);
                throw new ProviderCallException("timeout", null);
            } catch (ExecutionException e) {
                span.recordException(e.getCause());
                span.setStatus(Span.SpanStatus.ERROR);
                throw new ProviderCallException("error", String.valueOf(e.getCause()));
            } catch (CancellationException e) {
                token.throwIfCancelled();
                throw new ProviderCallException("cancelled", null);
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new OperationCancelledException("interrupted while waiting for provider " + name);
            }
        }
    }

    private void pause(Duration backoff, CancellationToken token) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("interrupted during retry backoff");
        }
        token.throwIfCancelled();
    }

    private ResearchResult complete(ResearchQuery query, String providerName, List<RawCitation> raw,
                                    List<ResearchStage.Transition> trail) {
        List<Citation> citations = ranker.rank(raw, providerName, query, options.maxCitations());
        stage(trail, ResearchStage.RANKED, citations.size() + " citations");
        List<ResearchGap> gaps = gapAnalyzer.analyze(query, citations);
        stage(trail, ResearchStage.GAP_ANALYZED, gaps.size() + " gaps");
        double confidence = gapAnalyzer.confidence(query, citations);

        Instant now = clock.instant();
        Duration ttl = cache.getTtl();
        if (ttl != null) {
            citations = citations.stream().map(c -> c.cached(now, ttl)).collect(Collectors.toList());
            stage(trail, ResearchStage.CACHED, null);
        }
        ResearchResult result = new ResearchResult(query.fingerprint(), query.jurisdictionId(), citations,
                providerName, false, false, false, gaps, confidence, List.copyOf(trail), now);
        if (ttl != null) {
            cache.put(query.fingerprint(), result, now);
        }
        if (graphStore != null && options.writeToGraph()) {
            writeToGraph(query, citations);
        }
        log.info("research.completed provider={} citations={} gaps={} confidence={}",
                providerName, citations.size(), gaps.size(), String.format("%.3f", confidence));
        return result;
    }

    private Optional<ResearchResult> staleFromCache(String fingerprint, List<ResearchStage.Transition> trail) {
        Optional<CachedResearch> cached = cache.getAny(fingerprint);
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        metricsService.incrementResearchFallback("stale");
        stage(trail, ResearchStage.CACHED, "stale fallback");
        log.warn("research.fallback kind=stale cachedAt={}", cached.get().cachedAt());
        return Optional.of(cached.get().result().fromCache(true, List.copyOf(trail)));
    }

    private ResearchResult insufficientCoverage(ResearchQuery query, List<ResearchStage.Transition> trail) {
        metricsService.incrementResearchFallback("insufficient_coverage");
        List<ResearchGap> gaps = gapAnalyzer.analyze(query, List.of());
        stage(trail, ResearchStage.GAP_ANALYZED, gaps.size() + " gaps");
        log.warn("research.fallback kind=insufficient_coverage providers={}", providers.size());
        return new ResearchResult(query.fingerprint(), query.jurisdictionId(), List.of(), null, false, true,
                false, gaps, 0.0, List.copyOf(trail), clock.instant());
    }

    private void writeToGraph(ResearchQuery query, List<Citation> citations) {
        for (Citation citation : citations) {
            try {
                Entity authority = graphStore.upsertEntity(authorityCandidate(citation, query));
                for (String anchorId : query.anchorEntityIds()) {
                    if (graphStore.getEntity(anchorId).isEmpty() || alreadyCited(authority.getId(), anchorId)) {
                        continue;
                    }
                    graphStore.addRelationship(RelationshipRequest.of(authority.getId(), anchorId, CITED_FOR,
                            List.of(citation.sourceId())));
                }
            } catch (GraphValidationException | LockAcquisitionException e) {
                log.warn("research.graph.write.failed sourceId={} error={}", citation.sourceId(), e.getMessage());
            }
        }
    }

    private EntityCandidate authorityCandidate(Citation citation, ResearchQuery query) {
        double credibility = (6 - citation.authorityLevel()) / 5.0;
        double age = CitationRanker.ageYears(citation.decisionDate(), clock);
        ConfidenceFactors factors = new ConfidenceFactors(credibility, 1,
                age == Double.MAX_VALUE ? options.recencyHorizonYears() : age,
                resolver.isCompatible(citation.jurisdictionId(), query.jurisdictionId()));
        EntityCandidate.Builder builder = EntityCandidate.builder()
                .type(EntityType.AUTHORITY)
                .name(citation.title())
                .normalizedKey(EntityKeys.normalize(citation.sourceId()))
                .jurisdictionId(citation.jurisdictionId())
                .attribute("sourceId", citation.sourceId())
                .attribute("authorityLevel", citation.authorityLevel())
                .attribute("provider", citation.providerName())
                .factors(factors)
                .provenance(Provenance.of(citation.providerName()));
        if (citation.court() != null) {
            builder.attribute("court", citation.court());
        }
        if (citation.decisionDate() != null) {
            builder.attribute("decisionDate", citation.decisionDate().toString());
        }
        return builder.build();
    }

    private boolean alreadyCited(String authorityId, String anchorId) {
        return graphStore.getRelationships(authorityId).stream()
                .anyMatch(r -> CITED_FOR.equals(r.getType()) && r.getToEntityId().equals(anchorId));
    }

    private void stage(List<ResearchStage.Transition> trail, ResearchStage stage, String detail) {
        trail.add(new ResearchStage.Transition(stage, detail, clock.instant()));
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "research-provider-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * A provider call that failed for a reason other than cancellation.
     */
    private static final class ProviderCallException extends RuntimeException {
        private final String outcome;

        ProviderCallException(String outcome, String detail) {
            super(detail == null ? outcome : outcome + ": " + detail);
            this.outcome = outcome;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<AuthorityProvider> providers = new ArrayList<>();
        private ProviderGuardRegistry guards;
        private ResearchCache cache;
        private JurisdictionAuthorityResolver resolver;
        private ConfidenceScorer scorer;
        private KnowledgeGraphStore graphStore;
        private RetryPolicy retryPolicy;
        private ResearchOptions options;
        private MetricsService metricsService;
        private TracingService tracingService;
        private Clock clock;
        private Sleeper sleeper;
        private ExecutorService executor;
        private QueryFormulator formulator;

        /**
         * Adds a provider. Providers are tried in the order they are added.
         */
        public Builder provider(AuthorityProvider provider) {
            this.providers.add(Objects.requireNonNull(provider));
            return this;
        }

        public Builder providers(List<AuthorityProvider> providers) {
            providers.forEach(this::provider);
            return this;
        }

        public Builder guards(ProviderGuardRegistry guards) {
            this.guards = guards;
            return this;
        }

        public Builder cache(ResearchCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder resolver(JurisdictionAuthorityResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder scorer(ConfidenceScorer scorer) {
            this.scorer = scorer;
            return this;
        }

        public Builder graphStore(KnowledgeGraphStore graphStore) {
            this.graphStore = graphStore;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder options(ResearchOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /**
         * Executor running provider calls. The layer does not shut down an executor it was given.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder formulator(QueryFormulator formulator) {
            this.formulator = formulator;
            return this;
        }

        public ResearchIntegrationLayer build() {
            return new ResearchIntegrationLayer(this);
        }
    }
}
