package me.forma.organizer.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleTest {

    private static final Instant EARLY = Instant.parse("2026-01-05T09:00:00Z");
    private static final Instant LATE = Instant.parse("2026-02-10T09:00:00Z");

    private static Rule rule(String name, int sortOrder, Instant created) {
        return Rule.builder().name(name).sortOrder(sortOrder).creationDate(created).build();
    }

    @Test
    void shouldOrderBySortOrderThenCreationDate() {
        List<Rule> rules = new ArrayList<>(List.of(
                rule("late-first", 1, LATE),
                rule("undated", 0, null),
                rule("second", 2, EARLY),
                rule("early-first", 1, EARLY),
                rule("top", 0, LATE)));

        rules.sort(Rule.PRIORITY_ORDER);

        assertEquals(List.of("top", "undated", "early-first", "late-first", "second"),
                rules.stream().map(Rule::getName).toList());
    }

    @Test
    void shouldEvaluateOnlyFirstConditionOfSingleRule() {
        Rule rule = Rule.builder()
                .name("r")
                .conditions(List.of(Condition.extension("pdf"), Condition.nameContains("draft")))
                .build();

        assertEquals(List.of(Condition.extension("pdf")), rule.getEffectiveConditions());
        assertEquals("extension is .pdf", rule.conditionsSummary());
        assertEquals(RuleCategory.DEFAULT_NAME, rule.getCategoryName());
    }
}
