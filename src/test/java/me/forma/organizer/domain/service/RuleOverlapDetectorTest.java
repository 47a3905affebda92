package me.forma.organizer.domain.service;

import me.forma.organizer.domain.model.CategoryScope;
import me.forma.organizer.domain.model.Combinator;
import me.forma.organizer.domain.model.Condition;
import me.forma.organizer.domain.model.Destination;
import me.forma.organizer.domain.model.OverlapType;
import me.forma.organizer.domain.model.Rule;
import me.forma.organizer.domain.model.RuleAction;
import me.forma.organizer.domain.model.RuleCategory;
import me.forma.organizer.domain.model.RuleOverlap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RuleOverlapDetectorTest {

    private static final String DOCS = "Documents";

    private RuleOverlapDetector detector;

    @BeforeEach
    void setUp() {
        detector = new RuleOverlapDetector();
    }

    private static Rule rule(String name, String destination, Combinator combinator, Condition... conditions) {
        return Rule.builder()
                .name(name)
                .conditions(List.of(conditions))
                .combinator(combinator)
                .destination(Destination.unresolved(destination))
                .build();
    }

    // ===== Classification =====

    @Test
    void shouldReportBroaderCandidateAsSuperset() {
        Rule candidate = rule("All PDFs", DOCS, Combinator.SINGLE, Condition.extension("pdf"));
        Rule existing = rule("Drafts", DOCS, Combinator.AND, Condition.extension("pdf"), Condition.nameContains("draft"));

        List<RuleOverlap> overlaps = detector.detectOverlaps(candidate, List.of(existing));

        assertEquals(1, overlaps.size());
        assertEquals(OverlapType.SUPERSET, overlaps.get(0).getType());
        assertSame(existing, overlaps.get(0).getExistingRule());
        assertNotNull(overlaps.get(0).getSuggestion());
    }

    @Test
    void shouldReportNarrowerCandidateAsSubset() {
        Rule candidate = rule("Drafts", DOCS, Combinator.AND, Condition.extension("pdf"), Condition.nameContains("draft"));
        Rule existing = rule("All PDFs", DOCS, Combinator.SINGLE, Condition.extension("pdf"));

        List<RuleOverlap> overlaps = detector.detectOverlaps(candidate, List.of(existing));

        assertEquals(OverlapType.SUBSET, overlaps.get(0).getType());
        assertNull(overlaps.get(0).getSuggestion());
    }

    @Test
    void shouldReportExactDuplicateRegardlessOfConditionOrder() {
        Rule candidate = rule("A", DOCS, Combinator.AND, Condition.extension("pdf"), Condition.nameContains("x"));
        Rule existing = rule("B", DOCS, Combinator.AND, Condition.nameContains("X"), Condition.extension(".PDF"));

        List<RuleOverlap> overlaps = detector.detectOverlaps(candidate, List.of(existing));

        assertEquals(OverlapType.EXACT_DUPLICATE, overlaps.get(0).getType());
        assertTrue(overlaps.get(0).getExplanation().contains("General/"));
    }

    @Test
    void shouldReportConflictForIdenticalConditionsWithDifferentDestination() {
        Rule candidate = rule("A", DOCS, Combinator.SINGLE, Condition.extension("pdf"));
        Rule existing = rule("B", "Archive", Combinator.SINGLE, Condition.extension("pdf"));

        assertEquals(OverlapType.CONFLICTING, detector.detectOverlaps(candidate, List.of(existing)).get(0).getType());
    }

    @Test
    void shouldTreatStricterDateBoundAsSubset() {
        Rule candidate = rule("Old", DOCS, Combinator.SINGLE, Condition.olderThan(30));
        Rule existing = rule("Week", DOCS, Combinator.SINGLE, Condition.olderThan(7));

        assertEquals(OverlapType.SUBSET, detector.detectOverlaps(candidate, List.of(existing)).get(0).getType());
        assertEquals(OverlapType.SUPERSET, detector.detectOverlaps(existing, List.of(candidate)).get(0).getType());
    }

    @Test
    void shouldReportPartialOverlapOnlyForDifferentDestinations() {
        Rule candidate = rule("Ext", DOCS, Combinator.SINGLE, Condition.extension("pdf"));
        Rule sameDestination = rule("Name", DOCS, Combinator.SINGLE, Condition.nameContains("invoice"));
        Rule otherDestination = rule("Name", "Finance", Combinator.SINGLE, Condition.nameContains("invoice"));

        assertTrue(detector.detectOverlaps(candidate, List.of(sameDestination)).isEmpty());
        assertEquals(OverlapType.PARTIAL_OVERLAP,
                detector.detectOverlaps(candidate, List.of(otherDestination)).get(0).getType());
    }

    @Test
    void shouldReportNothingForDisjointConditions() {
        Rule candidate = rule("PDF", DOCS, Combinator.SINGLE, Condition.extension("pdf"));
        Rule existing = rule("DOC", "Elsewhere", Combinator.SINGLE, Condition.extension("doc"));

        assertTrue(detector.detectOverlaps(candidate, List.of(existing)).isEmpty());
    }

    @Test
    void shouldCompareDeleteRulesByTrash() {
        Rule candidate = rule("A", DOCS, Combinator.SINGLE, Condition.extension("dmg")).toBuilder()
                .action(RuleAction.DELETE).destination(null).build();
        Rule existing = rule("B", DOCS, Combinator.SINGLE, Condition.extension("dmg")).toBuilder()
                .action(RuleAction.DELETE).destination(null).build();

        assertEquals(OverlapType.EXACT_DUPLICATE,
                detector.detectOverlaps(candidate, List.of(existing)).get(0).getType());
    }

    // ===== Filtering and ordering =====

    @Test
    void shouldSortBySeverityKeepingInputOrderForTies() {
        Rule candidate = rule("PDF", DOCS, Combinator.SINGLE, Condition.extension("pdf"));
        Rule partial = rule("Invoices", "Finance", Combinator.SINGLE, Condition.nameContains("invoice"));
        Rule supersetOf = rule("Drafts", DOCS, Combinator.AND, Condition.extension("pdf"), Condition.nameContains("d"));
        Rule duplicate = rule("Dup", DOCS, Combinator.SINGLE, Condition.extension("pdf"));
        Rule conflict = rule("Conflict", "Archive", Combinator.SINGLE, Condition.extension("pdf"));
        Rule supersetOf2 = rule("Finals", DOCS, Combinator.AND, Condition.extension("pdf"), Condition.nameContains("f"));

        List<RuleOverlap> overlaps = detector.detectOverlaps(candidate,
                List.of(partial, supersetOf, duplicate, conflict, supersetOf2));

        assertEquals(List.of(OverlapType.EXACT_DUPLICATE, OverlapType.CONFLICTING, OverlapType.SUPERSET,
                OverlapType.SUPERSET, OverlapType.PARTIAL_OVERLAP),
                overlaps.stream().map(RuleOverlap::getType).toList());
        assertSame(supersetOf, overlaps.get(2).getExistingRule());
        assertSame(supersetOf2, overlaps.get(3).getExistingRule());
    }

    @Test
    void shouldSkipDisabledAndExcludedRules() {
        Rule candidate = rule("PDF", DOCS, Combinator.SINGLE, Condition.extension("pdf"));
        Rule disabled = rule("Off", DOCS, Combinator.SINGLE, Condition.extension("pdf")).toBuilder()
                .enabled(false).build();
        Rule beingEdited = rule("Self", DOCS, Combinator.SINGLE, Condition.extension("pdf"));

        assertTrue(detector.detectOverlaps(candidate, List.of(disabled, beingEdited), beingEdited.getId()).isEmpty());
    }

    @Test
    void shouldSkipRulesWhoseScopesCannotOverlap() {
        RuleCategory desktop = RuleCategory.builder()
                .name("Desktop")
                .scope(CategoryScope.folders(Set.of("/Users/me/Desktop")))
                .build();
        RuleCategory downloads = RuleCategory.builder()
                .name("Downloads")
                .scope(CategoryScope.folders(Set.of("/Users/me/Downloads")))
                .build();
        RuleCategory nested = RuleCategory.builder()
                .name("Desktop screenshots")
                .scope(CategoryScope.folders(Set.of("/Users/me/Desktop/Screenshots")))
                .build();
        Rule candidate = rule("PDF", DOCS, Combinator.SINGLE, Condition.extension("pdf")).toBuilder()
                .category(desktop).build();
        Rule elsewhere = rule("PDF", DOCS, Combinator.SINGLE, Condition.extension("pdf")).toBuilder()
                .category(downloads).build();
        Rule inside = rule("PDF", DOCS, Combinator.SINGLE, Condition.extension("pdf")).toBuilder()
                .category(nested).build();

        List<RuleOverlap> overlaps = detector.detectOverlaps(candidate, List.of(elsewhere, inside));

        assertEquals(1, overlaps.size());
        assertSame(inside, overlaps.get(0).getExistingRule());
    }

    @Test
    void shouldReturnNothingForNoExistingRules() {
        Rule candidate = rule("PDF", DOCS, Combinator.SINGLE, Condition.extension("pdf"));

        assertTrue(detector.detectOverlaps(candidate, List.of()).isEmpty());
        assertTrue(detector.detectOverlaps(candidate, null).isEmpty());
    }
}
