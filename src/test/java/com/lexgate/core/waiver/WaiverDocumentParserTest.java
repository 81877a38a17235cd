package com.lexgate.core.waiver;

import com.lexgate.core.model.ChangeContext;
import com.lexgate.core.model.Waiver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class WaiverDocumentParserTest {

    // ── Waiver lines ─────────────────────────────────────────────────

    @Nested
    @DisplayName("waiver lines")
    class Lines {

        @Test
        @DisplayName("reads every field of a full line")
        void fullLine() {
            WaiverDocument doc = WaiverDocumentParser.parse("PR-42",
                    "tf_id: BEX-001 scope: src/main/java/Foo.java expires: 2026-12-31 reason: vendor API: throws Exception",
                    "PR-42.md");

            assertEquals(1, doc.waivers().size());
            Waiver w = doc.waivers().get(0);
            assertEquals("BEX-001", w.tfId());
            assertEquals("src/main/java/Foo.java", w.scope());
            assertEquals(Instant.parse("2027-01-01T00:00:00Z"), w.expiry());
            assertEquals("vendor API: throws Exception", w.rationale());
            assertEquals("PR-42", w.context());
            assertTrue(doc.warnings().isEmpty());
        }

        @Test
        @DisplayName("a bare line is repo-wide, never expires and belongs to the document's context")
        void minimalLine() {
            Waiver w = WaiverDocumentParser.parse("PR-42", "- tf_id: X-001", "PR-42.md").waivers().get(0);

            assertTrue(w.isRepoWide());
            assertNull(w.expiry());
            assertEquals("PR-42", w.context());
        }

        @Test
        @DisplayName("an explicit context of * grants the waiver to every change")
        void anyContext() {
            Waiver w = WaiverDocumentParser.parse("PR-42", "tf_id: X-001 context: *", "PR-42.md").waivers().get(0);

            assertEquals(ChangeContext.ANY, w.context());
        }

        @Test
        @DisplayName("prose under a waiver line becomes its rationale")
        void proseRationale() {
            WaiverDocument doc = WaiverDocumentParser.parse("PR-42", """
                    # Waivers for PR-42

                    Some intro text before any waiver.

                    - tf_id: SIL-002 scope: src/**
                      The shutdown hook swallows interrupts on purpose.
                      Revisit after the executor rewrite.
                    - tf_id: BEX-001 reason: legacy
                    """, "PR-42.md");

            assertEquals(2, doc.waivers().size());
            assertEquals("The shutdown hook swallows interrupts on purpose. Revisit after the executor rewrite.",
                    doc.waivers().get(0).rationale());
            assertEquals("legacy", doc.waivers().get(1).rationale());
        }
    }

    // ── Warnings ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("warnings")
    class Warnings {

        @Test
        void invalidTfId() {
            WaiverDocument doc = WaiverDocumentParser.parse("PR-1", "tf_id: bex1 scope: *", "PR-1.md");

            assertTrue(doc.waivers().isEmpty());
            assertEquals("PR-1.md:1: invalid tf_id 'bex1'", doc.warnings().get(0));
        }

        @Test
        void unparseableExpiry() {
            WaiverDocument doc = WaiverDocumentParser.parse("PR-1", "\ntf_id: BEX-001 expires: someday", "PR-1.md");

            assertTrue(doc.waivers().isEmpty());
            assertEquals("PR-1.md:2: unparseable expiry 'someday' for BEX-001", doc.warnings().get(0));
        }

        @Test
        void invalidScopeGlob() {
            WaiverDocument doc = WaiverDocumentParser.parse("PR-1", "tf_id: X-001 scope: src/[a", "PR-1.md");

            assertTrue(doc.waivers().isEmpty());
            assertEquals(1, doc.warnings().size());
            assertTrue(doc.warnings().get(0).startsWith("PR-1.md:1: invalid scope glob 'src/[a' for X-001"));
        }

        @Test
        void fieldWithoutTfId() {
            WaiverDocument doc = WaiverDocumentParser.parse("PR-1", "scope: src/** tf_id: BEX-001", "PR-1.md");

            assertTrue(doc.waivers().isEmpty());
            assertEquals(1, doc.warnings().size());
        }

        @Test
        void proseMentioningTfId() {
            WaiverDocument doc = WaiverDocumentParser.parse("PR-1", "Please add a tf_id for this", "PR-1.md");

            assertEquals("PR-1.md:1: mentions tf_id but is not a waiver line", doc.warnings().get(0));
        }
    }

    // ── Expiry ───────────────────────────────────────────────────────

    @Test
    void expiryFormats() {
        assertEquals(Instant.parse("2026-03-02T00:00:00Z"), WaiverDocumentParser.parseExpiry("2026-03-01"));
        assertEquals(Instant.parse("2026-03-01T12:00:00Z"), WaiverDocumentParser.parseExpiry("2026-03-01T12:00:00Z"));
        assertEquals(Instant.parse("2026-03-01T10:00:00Z"), WaiverDocumentParser.parseExpiry("2026-03-01T12:00:00+02:00"));
        assertNull(WaiverDocumentParser.parseExpiry("tomorrow"));
    }

    @Test
    void tfIdPattern() {
        assertTrue(WaiverDocumentParser.isTfId("BEX-001"));
        assertFalse(WaiverDocumentParser.isTfId("bex-001"));
        assertFalse(WaiverDocumentParser.isTfId("BEX-1"));
        assertFalse(WaiverDocumentParser.isTfId(null));
    }
}
