package me.forma.organizer.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class LearnedPatternTest {

    private static final Instant MONDAY_MORNING = Instant.parse("2026-03-09T10:00:00Z");

    private static LearnedPattern pdfToFinance() {
        return LearnedPattern.builder()
                .description("PDF files go to Finance")
                .fileExtension("pdf")
                .destinationPath("Documents/Finance")
                .occurrenceCount(3)
                .confidenceScore(0.6)
                .conditions(List.of(Condition.extension("pdf")))
                .build();
    }

    // ===== Construction =====

    @Test
    void shouldFillDefaultsAndClampConfidence() {
        LearnedPattern pattern = LearnedPattern.builder().confidenceScore(1.7).build();

        assertNotNull(pattern.getId());
        assertEquals("", pattern.getFileExtension());
        assertEquals(Combinator.SINGLE, pattern.getCombinator());
        assertEquals(TimeCategory.ANY_TIME, pattern.getTimeCategory());
        assertTrue(pattern.getConditions().isEmpty());
        assertEquals(1.0, pattern.getConfidenceScore());
        assertEquals(0.0, LearnedPattern.builder().confidenceScore(-0.2).build().getConfidenceScore());
        assertEquals(0.0, LearnedPattern.builder().confidenceScore(Double.NaN).build().getConfidenceScore());
    }

    @Test
    void shouldPreferExtensionFromConditions() {
        LearnedPattern pattern = pdfToFinance().toBuilder()
                .fileExtension("")
                .conditions(List.of(Condition.nameStartsWith("Scan"), Condition.extension("tiff")))
                .build();

        assertEquals("tiff", pattern.primaryFileExtension());
        assertTrue(pattern.isCompound());
        assertEquals("pdf", pdfToFinance().toBuilder().conditions(List.of()).build().primaryFileExtension());
    }

    // ===== Updates =====

    @Test
    void shouldRecordOccurrenceWithoutMutating() {
        LearnedPattern original = pdfToFinance();

        LearnedPattern updated = original.recordNewOccurrence(0.75, MONDAY_MORNING, ZoneOffset.UTC);

        assertEquals(3, original.getOccurrenceCount());
        assertEquals(4, updated.getOccurrenceCount());
        assertEquals(0.75, updated.getConfidenceScore());
        assertEquals(MONDAY_MORNING, updated.getLastSeenDate());
        assertEquals(1, updated.getTemporalContexts().size());
        assertTrue(updated.getTemporalContexts().get(0).workHours());
        assertEquals(original.getId(), updated.getId());
    }

    @Test
    void shouldCategorizeOnceEnoughOccurrencesAreKnown() {
        LearnedPattern pattern = pdfToFinance()
                .recordNewOccurrence(0.6, MONDAY_MORNING, ZoneOffset.UTC)
                .recordNewOccurrence(0.6, MONDAY_MORNING.plusSeconds(3600), ZoneOffset.UTC);
        assertEquals(TimeCategory.ANY_TIME, pattern.getTimeCategory());

        pattern = pattern.recordNewOccurrence(0.6, MONDAY_MORNING.plusSeconds(7200), ZoneOffset.UTC);

        assertEquals(TimeCategory.WORK_HOURS, pattern.getTimeCategory());
    }

    @Test
    void shouldTrackRejectionsAndConversion() {
        UUID ruleId = UUID.randomUUID();

        LearnedPattern pattern = pdfToFinance().recordRejection().recordRejection().markConverted(ruleId);

        assertEquals(2, pattern.getRejectionCount());
        assertTrue(pattern.isConverted());
        assertEquals(ruleId, pattern.getConvertedToRuleId());
    }

    // ===== Negative patterns =====

    @Test
    void shouldSuppressOnlyMatchingExtensionAndDestination() {
        LearnedPattern negative = pdfToFinance().asNegative();

        assertTrue(negative.isNegative());
        assertEquals(1.0, negative.getConfidenceScore());
        assertTrue(negative.shouldSuppress("PDF", "Documents/Finance"));
        assertTrue(negative.shouldSuppress(".pdf", "Documents/Finance"));
        assertFalse(negative.shouldSuppress("pdf", "Documents/finance"));
        assertFalse(negative.shouldSuppress("docx", "Documents/Finance"));
        assertFalse(negative.shouldSuppress(null, "Documents/Finance"));
    }

    @Test
    void shouldNeverSuppressFromPositivePattern() {
        assertFalse(pdfToFinance().shouldSuppress("pdf", "Documents/Finance"));
    }
}
