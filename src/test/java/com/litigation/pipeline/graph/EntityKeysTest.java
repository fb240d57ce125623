package com.litigation.pipeline.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EntityKeysTest {

    @Test
    @DisplayName("Should collapse case, punctuation and whitespace")
    void testNormalize() {
        assertEquals("acme_corp", EntityKeys.normalize("Acme Corp."));
        assertEquals("acme_corp", EntityKeys.normalize("  ACME   corp "));
    }

    @Test
    @DisplayName("Should strip accents")
    void testAccents() {
        assertEquals("societe_generale", EntityKeys.normalize("Société Générale"));
    }

    @Test
    @DisplayName("Should return an empty key for null or punctuation-only names")
    void testEmpty() {
        assertEquals("", EntityKeys.normalize(null));
        assertEquals("", EntityKeys.normalize("---"));
    }
}
