package me.forma.organizer.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * User-authored instruction: when a file satisfies the conditions (and no
 * exclusion) perform the action toward the destination.
 *
 * <p>
 * Rules are tried in ascending {@link #getSortOrder()}, ties broken by
 * creation date; see {@link #PRIORITY_ORDER}.
 */
@Value
@Builder(toBuilder = true)
public class Rule {

    public static final Comparator<Rule> PRIORITY_ORDER = Comparator.comparingInt(Rule::getSortOrder)
            .thenComparing(Rule::getCreationDate, Comparator.nullsLast(Comparator.naturalOrder()));

    @Builder.Default
    UUID id = UUID.randomUUID();

    String name;

    @Builder.Default
    List<Condition> conditions = List.of();

    @Builder.Default
    Combinator combinator = Combinator.SINGLE;

    @Builder.Default
    List<Condition> exclusions = List.of();

    @Builder.Default
    RuleAction action = RuleAction.MOVE;

    Destination destination;

    RuleCategory category;

    @Builder.Default
    boolean enabled = true;

    int sortOrder;

    Instant creationDate;

    /**
     * Conditions the rule actually evaluates. A {@link Combinator#SINGLE} rule
     * only looks at its first condition.
     */
    public List<Condition> getEffectiveConditions() {
        if (conditions == null || conditions.isEmpty()) {
            return List.of();
        }
        if (combinator == Combinator.SINGLE || combinator == null) {
            return List.of(conditions.get(0));
        }
        return conditions;
    }

    public CategoryScope getScope() {
        return category != null ? category.getScope() : CategoryScope.global();
    }

    public String getCategoryName() {
        return category != null ? category.getName() : RuleCategory.DEFAULT_NAME;
    }

    public String conditionsSummary() {
        List<Condition> effective = getEffectiveConditions();
        if (effective.isEmpty()) {
            return "No conditions";
        }
        String separator = combinator == Combinator.OR ? " OR " : " AND ";
        return effective.stream().map(Condition::describe).collect(Collectors.joining(separator));
    }
}
