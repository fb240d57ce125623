package com.litigation.pipeline.claims;

import com.litigation.pipeline.core.model.Entity;
import com.litigation.pipeline.graph.KnowledgeGraphStore;
import com.litigation.pipeline.jurisdiction.AuthorityResolution;
import com.litigation.pipeline.jurisdiction.JurisdictionAuthority;
import com.litigation.pipeline.jurisdiction.JurisdictionAuthorityResolver;
import com.litigation.pipeline.metrics.MetricsService;
import com.litigation.pipeline.metrics.NoOpMetricsService;
import com.litigation.pipeline.review.InMemoryReviewQueue;
import com.litigation.pipeline.review.ReviewItem;
import com.litigation.pipeline.review.ReviewQueue;
import com.litigation.pipeline.review.ReviewReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Derives causes of action from fact entities.
 *
 * <p>For every template that applies to the jurisdiction, each fact is matched against the
 * questions of each element. A fact that answers at least one question is attached to the
 * element with strength {@code min(1, sum of answered question weights)}. An element is
 * satisfied when one attachment reaches the satisfaction threshold, and a cause's
 * confidence is the share of satisfied elements. Causes below the minimum confidence are
 * left out entirely.</p>
 *
 * <p>The engine keeps no state between calls. Element satisfaction is not monotonic in
 * the fact set, so callers re-run detection whenever facts change.</p>
 */
public class ClaimsMatrixEngine {
    private static final Logger log = LoggerFactory.getLogger(ClaimsMatrixEngine.class);

    private final CauseTemplateCatalogue catalogue;
    private final JurisdictionAuthorityResolver resolver;
    private final ReviewQueue reviewQueue;
    private final MetricsService metricsService;
    private final ClaimsMatrixOptions options;
    private final Map<QuestionTemplate, List<Pattern>> patterns = new ConcurrentHashMap<>();

    private ClaimsMatrixEngine(Builder builder) {
        this.catalogue = builder.catalogue != null ? builder.catalogue : CauseTemplateCatalogue.defaults();
        this.resolver = builder.resolver != null ? builder.resolver : new JurisdictionAuthorityResolver();
        this.reviewQueue = builder.reviewQueue != null ? builder.reviewQueue : new InMemoryReviewQueue();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.options = builder.options != null ? builder.options : ClaimsMatrixOptions.defaults();
        for (CauseTemplate template : catalogue.getTemplates()) {
            for (ElementTemplate element : template.elements()) {
                for (QuestionTemplate question : element.questions()) {
                    patterns.put(question, question.compiledPatterns());
                }
            }
        }
        log.info("ClaimsMatrixEngine initialized: templates={} minConfidence={} satisfactionThreshold={}",
                catalogue.size(), options.minConfidence(), options.satisfactionThreshold());
    }

    /**
     * Runs detection over every factual entity currently in the graph.
     */
    public List<CauseOfAction> detectCauses(KnowledgeGraphStore store, String jurisdictionId) {
        List<Entity> facts = store.getAllEntities().stream()
                .filter(e -> e.getType().isFactual())
                .collect(Collectors.toList());
        return detectCauses(facts, jurisdictionId);
    }

    /**
     * Derives the causes of action the facts support in the given jurisdiction, ordered by
     * confidence descending. Never returns a cause below the configured minimum confidence.
     */
    public List<CauseOfAction> detectCauses(Collection<Entity> factEntities, String jurisdictionId) {
        Objects.requireNonNull(factEntities, "factEntities is required");
        List<Entity> facts = factEntities.stream()
                .sorted(Comparator.comparing(Entity::getId))
                .collect(Collectors.toList());

        List<CauseOfAction> causes = new ArrayList<>();
        for (CauseTemplate template : catalogue.getTemplates()) {
            if (!template.appliesTo(jurisdictionId)) {
                continue;
            }
            CauseOfAction cause = evaluate(template, facts, jurisdictionId);
            if (cause.confidence() <= 0.0 || cause.confidence() < options.minConfidence()) {
                log.debug("claims.cause.omitted type={} confidence={}", template.id(), cause.confidence());
                continue;
            }
            causes.add(cause);
        }
        causes.sort(Comparator.comparingDouble(CauseOfAction::confidence).reversed()
                .thenComparing(CauseOfAction::causeType));

        metricsService.recordCausesDetected(causes.size());
        log.info("claims.detected jurisdiction={} facts={} causes={}", jurisdictionId, facts.size(),
                causes.stream().map(CauseOfAction::causeType).collect(Collectors.toList()));
        return causes;
    }

    /**
     * Summarizes how well supported the cause is and which element is weakest.
     */
    public StrengthAnalysis analyzeStrength(CauseOfAction cause) {
        Map<String, Double> strengths = new LinkedHashMap<>();
        LegalElement weakest = null;
        for (LegalElement element : cause.elements()) {
            double strength = element.maxStrength();
            strengths.put(element.id(), strength);
            if (weakest == null || strength < weakest.maxStrength()) {
                weakest = element;
            }
        }
        return new StrengthAnalysis(cause.id(), cause.satisfiedCount(), cause.totalCount(), weakest, strengths);
    }

    public CauseTemplateCatalogue getCatalogue() {
        return catalogue;
    }

    public ClaimsMatrixOptions getOptions() {
        return options;
    }

    private CauseOfAction evaluate(CauseTemplate template, List<Entity> facts, String jurisdictionId) {
        String causeId = template.id() + ":" + jurisdictionId;
        List<LegalElement> elements = new ArrayList<>();
        Set<String> factJurisdictions = new LinkedHashSet<>();

        for (ElementTemplate elementTemplate : template.elements()) {
            String elementId = causeId + ":" + elementTemplate.id();
            Map<String, List<String>> answeredBy = new LinkedHashMap<>();
            elementTemplate.questions().forEach(q -> answeredBy.put(q.id(), new ArrayList<>()));
            List<FactElementAttachment> attachments = new ArrayList<>();

            for (Entity fact : facts) {
                String text = fact.searchableText();
                double strength = 0.0;
                List<String> matched = new ArrayList<>();
                for (QuestionTemplate question : elementTemplate.questions()) {
                    if (answers(question, text)) {
                        strength += question.weight();
                        matched.add(question.id());
                        answeredBy.get(question.id()).add(fact.getId());
                    }
                }
                if (!matched.isEmpty()) {
                    attachments.add(new FactElementAttachment(fact.getId(), elementId, Math.min(1.0, strength),
                            matched));
                    if (fact.getJurisdictionId() != null) {
                        factJurisdictions.add(fact.getJurisdictionId());
                    }
                }
            }

            List<ElementQuestion> questions = elementTemplate.questions().stream()
                    .map(q -> new ElementQuestion(elementId + ":" + q.id(), q.text(), q.weight(),
                            answeredBy.get(q.id())))
                    .collect(Collectors.toList());
            boolean satisfied = attachments.stream()
                    .anyMatch(a -> a.strength() >= options.satisfactionThreshold());
            elements.add(new LegalElement(elementId, elementTemplate.id(), elementTemplate.definition(),
                    questions, attachments, satisfied));
        }

        long satisfiedCount = elements.stream().filter(LegalElement::satisfied).count();
        double confidence = (double) satisfiedCount / elements.size();

        AuthorityResolution authority = null;
        boolean unresolved = false;
        if (confidence > 0.0 && confidence >= options.minConfidence()) {
            Set<String> candidates = new LinkedHashSet<>();
            if (jurisdictionId != null) {
                candidates.add(jurisdictionId);
            }
            candidates.addAll(factJurisdictions);
            if (!candidates.isEmpty()) {
                authority = resolver.resolveJurisdictions(candidates, template.legalArea());
                unresolved = authority.isUnresolvedConflict();
                if (unresolved) {
                    flagForReview(causeId, template, authority);
                }
            }
        }

        return new CauseOfAction(causeId, template.id(), template.name(), jurisdictionId, elements, confidence,
                authority, unresolved);
    }

    private boolean answers(QuestionTemplate question, String text) {
        for (Pattern pattern : patterns.computeIfAbsent(question, QuestionTemplate::compiledPatterns)) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private void flagForReview(String causeId, CauseTemplate template, AuthorityResolution authority) {
        boolean alreadyQueued = reviewQueue.getPendingByReason(ReviewReason.UNRESOLVED_AUTHORITY_CONFLICT).stream()
                .anyMatch(item -> item.getSubjectId().equals(causeId));
        if (alreadyQueued) {
            return;
        }
        List<String> tied = authority.tied().stream()
                .map(JurisdictionAuthority::jurisdictionId)
                .collect(Collectors.toList());
        reviewQueue.submit(ReviewItem.builder()
                .reason(ReviewReason.UNRESOLVED_AUTHORITY_CONFLICT)
                .subjectId(causeId)
                .relatedIds(tied)
                .summary("Controlling authority for " + template.name() + " is unresolved: " + authority.reason())
                .build());
        log.warn("claims.authority.unresolved cause={} tied={}", causeId, tied);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CauseTemplateCatalogue catalogue;
        private JurisdictionAuthorityResolver resolver;
        private ReviewQueue reviewQueue;
        private MetricsService metricsService;
        private ClaimsMatrixOptions options;

        public Builder catalogue(CauseTemplateCatalogue catalogue) {
            this.catalogue = catalogue;
            return this;
        }

        public Builder resolver(JurisdictionAuthorityResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder options(ClaimsMatrixOptions options) {
            this.options = options;
            return this;
        }

        public ClaimsMatrixEngine build() {
            return new ClaimsMatrixEngine(this);
        }
    }
}
