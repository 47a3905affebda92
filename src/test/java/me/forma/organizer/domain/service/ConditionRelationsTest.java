package me.forma.organizer.domain.service;

import me.forma.organizer.domain.model.Combinator;
import me.forma.organizer.domain.model.Condition;
import me.forma.organizer.domain.model.ConditionRelation;
import me.forma.organizer.domain.model.FileLocationKind;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConditionRelationsTest {

    // ===== Single conditions =====

    @Test
    void shouldCompareExtensionsIgnoringDotAndCase() {
        assertEquals(ConditionRelation.IDENTICAL,
                ConditionRelations.compare(Condition.extension(".PDF"), Condition.extension("pdf")));
        assertEquals(ConditionRelation.NONE,
                ConditionRelations.compare(Condition.extension("pdf"), Condition.extension("docx")));
    }

    @Test
    void shouldTreatLongerNeedleAsNarrower() {
        assertEquals(ConditionRelation.SUBSET,
                ConditionRelations.compare(Condition.nameContains("invoice"), Condition.nameContains("voice")));
        assertEquals(ConditionRelation.SUPERSET,
                ConditionRelations.compare(Condition.nameStartsWith("IMG"), Condition.nameStartsWith("img_2026")));
        assertEquals(ConditionRelation.NONE,
                ConditionRelations.compare(Condition.nameEndsWith("_final"), Condition.nameEndsWith("_draft")));
    }

    @Test
    void shouldTreatLargerLowerBoundAsNarrower() {
        assertEquals(ConditionRelation.SUBSET,
                ConditionRelations.compare(Condition.largerThan(1_000_000), Condition.largerThan(1_000)));
        assertEquals(ConditionRelation.SUPERSET,
                ConditionRelations.compare(Condition.accessedOlderThan(7), Condition.accessedOlderThan(30)));
        assertEquals(ConditionRelation.IDENTICAL,
                ConditionRelations.compare(Condition.modifiedOlderThan(90), Condition.modifiedOlderThan(90)));
    }

    @Test
    void shouldNotRelateAgeConditionsWithDifferentExtensionFilters() {
        assertEquals(ConditionRelation.NONE,
                ConditionRelations.compare(Condition.olderThan(30, "pdf"), Condition.olderThan(7, "zip")));
        assertEquals(ConditionRelation.SUBSET,
                ConditionRelations.compare(Condition.olderThan(30, ".pdf"), Condition.olderThan(7, "PDF")));
    }

    @Test
    void shouldCompareKindsBySynonym() {
        assertEquals(ConditionRelation.IDENTICAL,
                ConditionRelations.compare(Condition.kindIs("image"), Condition.kindIs("Images")));
        assertEquals(ConditionRelation.NONE,
                ConditionRelations.compare(Condition.fromLocation(FileLocationKind.DESKTOP),
                        Condition.fromLocation(FileLocationKind.DOWNLOADS)));
    }

    @Test
    void shouldCompareTimeWindowsAsHourSets() {
        assertEquals(ConditionRelation.SUBSET,
                ConditionRelations.compare(Condition.timeOfDay(10, 12), Condition.timeOfDay(9, 17)));
        assertEquals(ConditionRelation.PARTIAL,
                ConditionRelations.compare(Condition.timeOfDay(22, 2), Condition.timeOfDay(0, 6)));
        assertEquals(ConditionRelation.NONE,
                ConditionRelations.compare(Condition.timeOfDay(6, 9), Condition.timeOfDay(18, 23)));
    }

    @Test
    void shouldCompareDaySets() {
        assertEquals(ConditionRelation.SUPERSET, ConditionRelations.compare(
                Condition.daysOfWeek(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY), Condition.daysOfWeek(DayOfWeek.SUNDAY)));
    }

    @Test
    void shouldFallBackForDifferentKinds() {
        assertEquals(ConditionRelations.CROSS_KIND_FALLBACK,
                ConditionRelations.compare(Condition.extension("pdf"), Condition.largerThan(10)));
        assertEquals(ConditionRelation.IDENTICAL, ConditionRelations.compare(
                Condition.not(Condition.nameContains("tmp")), Condition.not(Condition.nameContains("tmp"))));
    }

    // ===== Condition sets =====

    @Test
    void shouldTreatFewerConjunctsAsBroader() {
        List<Condition> broad = List.of(Condition.extension("pdf"));
        List<Condition> narrow = List.of(Condition.extension("pdf"), Condition.nameContains("invoice"));

        assertEquals(ConditionRelation.SUPERSET,
                ConditionRelations.compare(broad, Combinator.SINGLE, narrow, Combinator.AND));
        assertEquals(ConditionRelation.SUBSET,
                ConditionRelations.compare(narrow, Combinator.AND, broad, Combinator.SINGLE));
    }

    @Test
    void shouldTreatFewerDisjunctsAsNarrower() {
        List<Condition> one = List.of(Condition.extension("dmg"));
        List<Condition> two = List.of(Condition.extension("dmg"), Condition.extension("pkg"));

        assertEquals(ConditionRelation.SUBSET, ConditionRelations.compare(one, Combinator.SINGLE, two, Combinator.OR));
        assertEquals(ConditionRelation.SUPERSET, ConditionRelations.compare(two, Combinator.OR, one, Combinator.SINGLE));
    }

    @Test
    void shouldRequireMatchingCombinatorForIdenticalSets() {
        List<Condition> first = List.of(Condition.extension("pdf"), Condition.nameContains("scan"));
        List<Condition> second = List.of(Condition.nameContains("SCAN"), Condition.extension("pdf"));

        assertEquals(ConditionRelation.IDENTICAL,
                ConditionRelations.compare(first, Combinator.AND, second, Combinator.AND));
        assertEquals(ConditionRelation.PARTIAL,
                ConditionRelations.compare(first, Combinator.AND, second, Combinator.OR));
    }

    @Test
    void shouldReportNoRelationForEmptySets() {
        assertEquals(ConditionRelation.NONE,
                ConditionRelations.compare(List.of(), Combinator.AND, List.of(Condition.extension("pdf")),
                        Combinator.SINGLE));
    }
}
