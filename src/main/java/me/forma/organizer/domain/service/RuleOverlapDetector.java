package me.forma.organizer.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.forma.organizer.domain.model.ConditionRelation;
import me.forma.organizer.domain.model.Destination;
import me.forma.organizer.domain.model.OverlapType;
import me.forma.organizer.domain.model.Rule;
import me.forma.organizer.domain.model.RuleAction;
import me.forma.organizer.domain.model.RuleOverlap;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reports how a candidate rule overlaps the enabled rules already defined,
 * most severe findings first.
 */
@Service
@Slf4j
public class RuleOverlapDetector {

    private static final Comparator<RuleOverlap> BY_SEVERITY_DESC = Comparator
            .comparingInt((RuleOverlap overlap) -> overlap.getType().getSeverity())
            .reversed();

    public List<RuleOverlap> detectOverlaps(Rule candidate, List<Rule> existingRules) {
        return detectOverlaps(candidate, existingRules, null);
    }

    /**
     * @param excludeRuleId
     *            id of a rule to ignore, typically the rule being edited; may
     *            be {@code null}
     */
    public List<RuleOverlap> detectOverlaps(Rule candidate, List<Rule> existingRules, UUID excludeRuleId) {
        if (candidate == null || existingRules == null || existingRules.isEmpty()) {
            return List.of();
        }
        List<RuleOverlap> overlaps = new ArrayList<>();
        for (Rule existing : existingRules) {
            if (existing == null || !existing.isEnabled()) {
                continue;
            }
            if (excludeRuleId != null && excludeRuleId.equals(existing.getId())) {
                continue;
            }
            if (!candidate.getScope().couldOverlap(existing.getScope())) {
                continue;
            }
            classify(candidate, existing).ifPresent(overlaps::add);
        }
        overlaps.sort(BY_SEVERITY_DESC);
        if (!overlaps.isEmpty()) {
            log.debug("[OverlapDetector] Rule '{}' overlaps {} existing rules", candidate.getName(),
                    overlaps.size());
        }
        return overlaps;
    }

    private Optional<RuleOverlap> classify(Rule candidate, Rule existing) {
        ConditionRelation relation = ConditionRelations.compare(candidate.getEffectiveConditions(),
                candidate.getCombinator(), existing.getEffectiveConditions(), existing.getCombinator());
        boolean sameDestination = sameDestination(candidate, existing);
        String target = "'" + existing.getCategoryName() + "/" + existing.conditionsSummary() + "'";

        return switch (relation) {
            case IDENTICAL -> sameDestination
                    ? Optional.of(overlap(existing, OverlapType.EXACT_DUPLICATE,
                            "This rule has identical conditions and destination as " + target + ".",
                            "Consider deleting one of these rules."))
                    : Optional.of(overlap(existing, OverlapType.CONFLICTING,
                            "This rule matches the same files as " + target
                                    + " but sends them to a different location.",
                            "The higher-priority rule will take precedence. Adjust rule order if needed."));
            case SUBSET -> Optional.of(overlap(existing, OverlapType.SUBSET,
                    "This rule is more specific than " + target
                            + ". Files matching your rule would also match the existing rule.",
                    sameDestination ? null
                            : "Ensure your rule has higher priority if you want it to take precedence."));
            case SUPERSET -> Optional.of(overlap(existing, OverlapType.SUPERSET,
                    "This rule is broader than " + target
                            + ". It may match files the existing rule was meant to handle.",
                    "Consider making conditions more specific to avoid unexpected matches."));
            case PARTIAL -> sameDestination
                    ? Optional.empty()
                    : Optional.of(overlap(existing, OverlapType.PARTIAL_OVERLAP,
                            "This rule may match some of the same files as " + target + ".", null));
            case NONE -> Optional.empty();
        };
    }

    private static RuleOverlap overlap(Rule existing, OverlapType type, String explanation, String suggestion) {
        return RuleOverlap.builder()
                .existingRule(existing)
                .type(type)
                .explanation(explanation)
                .suggestion(suggestion)
                .build();
    }

    private static boolean sameDestination(Rule first, Rule second) {
        Destination a = effectiveDestination(first);
        Destination b = effectiveDestination(second);
        if (a == null || b == null) {
            return a == b;
        }
        return a.sameTarget(b);
    }

    private static Destination effectiveDestination(Rule rule) {
        return rule.getAction() == RuleAction.DELETE ? Destination.trash()
                : rule.getDestination();
    }
}
