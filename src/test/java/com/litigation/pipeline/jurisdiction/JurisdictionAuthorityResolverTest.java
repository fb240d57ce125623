package com.litigation.pipeline.jurisdiction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JurisdictionAuthorityResolverTest {

    private final JurisdictionAuthorityResolver resolver = new JurisdictionAuthorityResolver();

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        @Test
        @DisplayName("Should let federal authority preempt a state")
        void testPreemption() {
            AuthorityResolution resolution = resolver.resolveJurisdictions(List.of("CA", "US"), null);

            assertEquals(ResolutionMethod.PREEMPTION, resolution.method());
            assertEquals("US", resolution.winner().jurisdictionId());
            assertFalse(resolution.isUnresolvedConflict());
        }

        @Test
        @DisplayName("Should report tied states as an unresolved conflict")
        void testTie() {
            AuthorityResolution resolution = resolver.resolveJurisdictions(List.of("NY", "CA"), null);

            assertTrue(resolution.isUnresolvedConflict());
            assertNull(resolution.winner());
            assertTrue(resolution.winnerIfResolved().isEmpty());
            assertEquals(List.of("CA", "NY"),
                    resolution.tied().stream().map(JurisdictionAuthority::jurisdictionId).toList());
        }

        @Test
        @DisplayName("Should choose the lower precedence rank when nothing preempts")
        void testPrecedence() {
            JurisdictionAuthority high = JurisdictionAuthority.of("XX", 1);
            JurisdictionAuthority low = JurisdictionAuthority.of("YY", 3);

            AuthorityResolution resolution = resolver.resolve(List.of(low, high));

            assertEquals(ResolutionMethod.PRECEDENCE, resolution.method());
            assertEquals("XX", resolution.winner().jurisdictionId());
        }

        @Test
        @DisplayName("Should resolve a single candidate to itself")
        void testSingleCandidate() {
            AuthorityResolution resolution = resolver.resolveJurisdictions(List.of("TX"), null);
            assertEquals("TX", resolution.winner().jurisdictionId());
        }

        @Test
        @DisplayName("Should let an authority whose scope names the legal area preempt")
        void testLegalAreaPreemption() {
            JurisdictionAuthority federal = JurisdictionAuthority.of("FED", 2, "patent");
            JurisdictionAuthority state = JurisdictionAuthority.of("ST", 2);

            AuthorityResolution resolution = resolver.resolve(List.of(state, federal), "patent");

            assertEquals(ResolutionMethod.PREEMPTION, resolution.method());
            assertEquals("FED", resolution.winner().jurisdictionId());
        }

        @Test
        @DisplayName("Should reject an empty candidate set")
        void testEmpty() {
            assertThrows(IllegalArgumentException.class, () -> resolver.resolve(List.of()));
        }
    }

    @Nested
    @DisplayName("Compatibility")
    class Compatibility {

        @Test
        @DisplayName("Should accept the same jurisdiction regardless of case")
        void testSameJurisdiction() {
            assertTrue(resolver.isCompatible("ca", "CA"));
        }

        @Test
        @DisplayName("Should accept a preempting jurisdiction")
        void testPreemptingCitation() {
            assertTrue(resolver.isCompatible("US", "CA"));
        }

        @Test
        @DisplayName("Should reject a sibling or subordinate jurisdiction")
        void testIncompatible() {
            assertFalse(resolver.isCompatible("NY", "CA"));
            assertFalse(resolver.isCompatible("CA", "US"));
            assertFalse(resolver.isCompatible(null, "CA"));
        }
    }

    @Nested
    @DisplayName("Hierarchy")
    class Hierarchy {

        @Test
        @DisplayName("Should reject cyclic preemption at construction")
        void testCycleRejected() {
            assertThrows(AuthorityConfigurationException.class, () -> new AuthorityHierarchy(1, List.of(
                    JurisdictionAuthority.of("A", 1, "B"),
                    JurisdictionAuthority.of("B", 1, "C"),
                    JurisdictionAuthority.of("C", 1, "A"))));
        }

        @Test
        @DisplayName("Should reject duplicate jurisdictions")
        void testDuplicateRejected() {
            assertThrows(AuthorityConfigurationException.class, () -> new AuthorityHierarchy(1, List.of(
                    JurisdictionAuthority.of("CA", 2),
                    JurisdictionAuthority.of("ca", 3))));
        }

        @Test
        @DisplayName("Should bump the version when an authority is added")
        void testWithAuthority() {
            AuthorityHierarchy defaults = AuthorityHierarchy.defaults();
            AuthorityHierarchy extended = defaults.withAuthority(JurisdictionAuthority.of("IL", 2));

            assertEquals(defaults.getVersion() + 1, extended.getVersion());
            assertTrue(extended.find("IL").isPresent());
            assertTrue(defaults.find("IL").isEmpty());
        }

        @Test
        @DisplayName("Should publish only newer hierarchy versions")
        void testRegistryPublish() {
            AuthorityHierarchyRegistry registry = new AuthorityHierarchyRegistry();
            AuthorityHierarchy next = registry.current().withAuthority(JurisdictionAuthority.of("IL", 2));

            registry.publish(next);

            assertSame(next, registry.current());
            assertThrows(AuthorityConfigurationException.class,
                    () -> registry.publish(AuthorityHierarchy.defaults()));
            assertSame(next, registry.current());
        }
    }
}
