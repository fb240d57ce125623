package com.litigation.pipeline.claims;

import com.litigation.pipeline.core.model.EntityType;
import com.litigation.pipeline.core.model.Provenance;
import com.litigation.pipeline.graph.EntityCandidate;
import com.litigation.pipeline.graph.InMemoryKnowledgeGraphStore;
import com.litigation.pipeline.jurisdiction.ResolutionMethod;
import com.litigation.pipeline.review.InMemoryReviewQueue;
import com.litigation.pipeline.review.ReviewReason;
import com.litigation.pipeline.scoring.ConfidenceFactors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ClaimsMatrixEngineTest {

    private InMemoryKnowledgeGraphStore store;
    private InMemoryReviewQueue reviewQueue;
    private ClaimsMatrixEngine engine;

    @BeforeEach
    void setUp() {
        reviewQueue = new InMemoryReviewQueue();
        store = InMemoryKnowledgeGraphStore.builder().reviewQueue(reviewQueue).build();
        engine = ClaimsMatrixEngine.builder().reviewQueue(reviewQueue).build();
    }

    private String fact(String text, String jurisdictionId) {
        return store.upsertEntity(EntityCandidate.builder()
                .type(EntityType.FACT)
                .name(text)
                .jurisdictionId(jurisdictionId)
                .factors(ConfidenceFactors.of(0.9, true))
                .provenance(Provenance.foundational("complaint"))
                .build()).getId();
    }

    private void datedFact(String eventType, LocalDate date) {
        store.upsertEntity(EntityCandidate.builder()
                .type(EntityType.FACT)
                .name(eventType)
                .jurisdictionId("CA")
                .attribute("date", date)
                .factors(ConfidenceFactors.of(0.9, true))
                .provenance(Provenance.of("intake"))
                .build());
    }

    private void contractDispute(String jurisdictionId) {
        fact("Parties signed a purchase agreement", jurisdictionId);
        fact("Plaintiff delivered the goods on schedule", jurisdictionId);
        fact("Defendant refused to replace defective units", jurisdictionId);
        fact("Plaintiff lost $50,000 in refunds", jurisdictionId);
    }

    @Nested
    @DisplayName("Cause detection")
    class Detection {

        @Test
        @DisplayName("Should derive breach of contract with every element satisfied in CA")
        void testBreachOfContractInCalifornia() {
            contractDispute("CA");

            List<CauseOfAction> causes = engine.detectCauses(store, "CA");

            assertFalse(causes.isEmpty());
            CauseOfAction breach = causes.get(0);
            assertEquals("breach_of_contract", breach.causeType());
            assertEquals("CA", breach.jurisdictionId());
            assertEquals(1.0, breach.confidence(), 1e-9);
            assertEquals(4, breach.satisfiedCount());
            assertEquals(4, breach.supportingFactIds().size());
            assertFalse(breach.unresolvedConflict());
            assertEquals("CA", breach.authority().winner().jurisdictionId());
        }

        @Test
        @DisplayName("Should derive breach of contract from dated event facts in CA")
        void testDatedContractEvents() {
            datedFact("contract_signed", LocalDate.of(2024, 1, 15));
            datedFact("delivery_defective", LocalDate.of(2024, 3, 20));
            datedFact("refund_requested", LocalDate.of(2024, 3, 25));
            datedFact("refund_refused", LocalDate.of(2024, 3, 26));

            CauseOfAction breach = engine.detectCauses(store, "CA").stream()
                    .filter(c -> c.causeType().equals("breach_of_contract"))
                    .findFirst()
                    .orElseThrow();

            assertEquals(4, breach.elements().size());
            assertTrue(breach.satisfiedCount() >= 3);
            assertTrue(breach.confidence() >= 0.75);
        }

        @Test
        @DisplayName("Should order causes by confidence and never return one below the minimum")
        void testOrderingAndMinimum() {
            contractDispute("CA");
            fact("Defendant negligently left a hazard that caused injury", "CA");

            List<CauseOfAction> causes = engine.detectCauses(store, "CA");

            for (int i = 1; i < causes.size(); i++) {
                assertTrue(causes.get(i - 1).confidence() >= causes.get(i).confidence());
            }
            assertTrue(causes.stream().allMatch(c -> c.confidence() >= 0.25));
            assertTrue(causes.stream().anyMatch(c -> c.causeType().equals("negligence")));
        }

        @Test
        @DisplayName("Should omit causes below a configured minimum confidence")
        void testMinimumThreshold() {
            fact("Parties signed a purchase agreement", "CA");

            assertEquals(List.of("breach_of_contract"), engine.detectCauses(store, "CA").stream()
                    .map(CauseOfAction::causeType).toList());

            ClaimsMatrixEngine strict = ClaimsMatrixEngine.builder()
                    .options(new ClaimsMatrixOptions(0.5, 0.5))
                    .build();
            assertTrue(strict.detectCauses(store, "CA").isEmpty());
        }

        @Test
        @DisplayName("Should return nothing for an empty fact set")
        void testNoFacts() {
            assertTrue(engine.detectCauses(List.of(), "CA").isEmpty());
        }

        @Test
        @DisplayName("Should ignore non-factual entities")
        void testNonFactualIgnored() {
            store.upsertEntity(EntityCandidate.builder()
                    .type(EntityType.PARTY)
                    .name("Agreement Holdings")
                    .factors(ConfidenceFactors.of(0.9, true))
                    .provenance(Provenance.of("intake"))
                    .build());

            assertTrue(engine.detectCauses(store, "CA").isEmpty());
        }

        @Test
        @DisplayName("Should skip templates not recognized in the jurisdiction")
        void testJurisdictionLimitedTemplate() {
            CauseTemplate nyOnly = new CauseTemplate("ny_contract", "NY Contract", "contract", Set.of("NY"),
                    List.of(ElementTemplate.of("agreement", "An agreement exists.",
                            QuestionTemplate.of("agreed", "Was there an agreement?", 0.5, "agreement"))));
            ClaimsMatrixEngine limited = ClaimsMatrixEngine.builder()
                    .catalogue(CauseTemplateCatalogue.of(List.of(nyOnly)))
                    .build();
            fact("Parties signed a purchase agreement", "CA");

            assertTrue(limited.detectCauses(store, "CA").isEmpty());
            assertEquals(1, limited.detectCauses(store, "NY").size());
        }
    }

    @Nested
    @DisplayName("Authority conflicts")
    class AuthorityConflicts {

        @Test
        @DisplayName("Should flag a cause whose facts span tied jurisdictions and queue it for review once")
        void testUnresolvedConflict() {
            contractDispute("NY");

            CauseOfAction breach = engine.detectCauses(store, "CA").get(0);
            engine.detectCauses(store, "CA");

            assertTrue(breach.unresolvedConflict());
            assertEquals(ResolutionMethod.UNRESOLVED_CONFLICT, breach.authority().method());
            assertEquals(2, breach.authority().tied().size());
            assertEquals(1, reviewQueue.getPendingByReason(ReviewReason.UNRESOLVED_AUTHORITY_CONFLICT).size());
        }

        @Test
        @DisplayName("Should let federal facts control a state cause through preemption")
        void testFederalPreemption() {
            contractDispute("US");

            CauseOfAction breach = engine.detectCauses(store, "CA").get(0);

            assertFalse(breach.unresolvedConflict());
            assertEquals("US", breach.authority().winner().jurisdictionId());
        }
    }

    @Nested
    @DisplayName("Strength analysis")
    class Strength {

        @Test
        @DisplayName("Should report the weakest element")
        void testWeakestElement() {
            fact("Parties signed a purchase agreement", "CA");
            fact("Plaintiff delivered the goods on schedule", "CA");

            CauseOfAction breach = engine.detectCauses(store, "CA").get(0);
            StrengthAnalysis analysis = engine.analyzeStrength(breach);

            assertEquals(2, analysis.satisfiedCount());
            assertEquals(4, analysis.totalCount());
            assertFalse(analysis.isFullySupported());
            assertEquals(0.0, analysis.weakestElement().maxStrength(), 1e-9);
            assertEquals(0.8, analysis.elementStrengths().get(breach.id() + ":contract_formation"), 1e-9);
        }
    }

    @Nested
    @DisplayName("Template validation")
    class TemplateValidation {

        @Test
        @DisplayName("Should ship the five default theories")
        void testDefaults() {
            CauseTemplateCatalogue catalogue = CauseTemplateCatalogue.defaults();
            assertEquals(5, catalogue.size());
            assertTrue(catalogue.find("intentional_infliction_of_emotional_distress").isPresent());
        }

        @Test
        @DisplayName("Should reject duplicate element ids, empty catalogues and bad patterns")
        void testInvalidTemplates() {
            ElementTemplate element = ElementTemplate.of("duty", "Duty exists.",
                    QuestionTemplate.of("q", "Duty?", 0.5, "duty"));
            assertThrows(TemplateConfigurationException.class,
                    () -> new CauseTemplate("dup", "Dup", "tort", Set.of(), List.of(element, element)));
            assertThrows(TemplateConfigurationException.class, () -> CauseTemplateCatalogue.of(List.of()));
            assertThrows(TemplateConfigurationException.class,
                    () -> QuestionTemplate.of("bad", "Bad?", 0.5, "(unclosed"));
            assertThrows(TemplateConfigurationException.class,
                    () -> QuestionTemplate.of("heavy", "Heavy?", 1.5, "x"));
        }
    }
}
