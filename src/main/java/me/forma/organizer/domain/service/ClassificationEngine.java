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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.forma.organizer.domain.model.Combinator;
import me.forma.organizer.domain.model.Condition;
import me.forma.organizer.domain.model.Destination;
import me.forma.organizer.domain.model.FileItem;
import me.forma.organizer.domain.model.FileStatus;
import me.forma.organizer.domain.model.Rule;
import me.forma.organizer.domain.model.RuleAction;
import me.forma.organizer.domain.model.RuleCategory;
import me.forma.organizer.port.outbound.DestinationResolverPort;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Assigns each file the destination of the first applicable rule.
 *
 * <p>
 * Rules are tried in the order given. A rule applies when it is enabled, its
 * category is enabled and scopes the file, its primary conditions hold under
 * its combinator, none of its exclusions hold, and its destination can be
 * resolved. A rule whose destination cannot be resolved is skipped and the
 * next rule is tried.
 *
 * <p>
 * Resolved destinations are cached by display path for the lifetime of the
 * engine. The cache is not synchronised: use one engine per scan, obtained from
 * {@link ClassificationEngineFactory}.
 */
@Slf4j
@RequiredArgsConstructor
public class ClassificationEngine {

    static final double MULTI_CONDITION_CONFIDENCE = 0.9;
    static final double DEFAULT_CONFIDENCE = 0.5;
    private static final String DEFAULT_REASON = "Matches rule conditions";

    private final ConditionEvaluator evaluator;
    private final DestinationResolverPort resolver;
    private final Map<String, Destination> resolvedDestinations = new HashMap<>();

    /**
     * Classifies one file. The result is a copy of {@code file} that either
     * carries a complete match (destination, status READY, reason, confidence
     * and rule id) or has all of those cleared with status PENDING.
     */
    public FileItem classify(FileItem file, List<Rule> rules) {
        if (rules != null) {
            for (Rule rule : rules) {
                Optional<FileItem> matched = tryRule(file, rule);
                if (matched.isPresent()) {
                    return matched.get();
                }
            }
        }
        return file.withoutClassification();
    }

    public List<FileItem> classifyBatch(List<FileItem> files, List<Rule> rules) {
        if (files == null || files.isEmpty()) {
            return List.of();
        }
        List<FileItem> results = new ArrayList<>(files.size());
        for (FileItem file : files) {
            results.add(classify(file, rules));
        }
        long matched = results.stream().filter(item -> item.getStatus() == FileStatus.READY).count();
        log.debug("[RuleEngine] Classified {} files, {} matched", results.size(), matched);
        return results;
    }

    /**
     * Match predicate alone: enabled, in scope, conditions hold, not excluded.
     * Destination resolution is not attempted.
     */
    public boolean fileMatchesRule(FileItem file, Rule rule) {
        if (file == null || rule == null || !rule.isEnabled()) {
            return false;
        }
        RuleCategory category = rule.getCategory();
        if (category != null && (!category.isEnabled() || !category.getScope().contains(file.getPath()))) {
            return false;
        }
        if (!evaluator.matches(file, rule.getConditions(), rule.getCombinator())) {
            return false;
        }
        if (evaluator.matchesAny(file, rule.getExclusions())) {
            log.debug("[RuleEngine] Rule '{}' excluded for {}", rule.getName(), file.getName());
            return false;
        }
        return true;
    }

    public void clearCache() {
        resolvedDestinations.clear();
    }

    private Optional<FileItem> tryRule(FileItem file, Rule rule) {
        if (!fileMatchesRule(file, rule)) {
            return Optional.empty();
        }
        Optional<Destination> destination = destinationFor(rule);
        if (destination.isEmpty()) {
            return Optional.empty();
        }
        log.debug("[RuleEngine] {} matched rule '{}'", file.getName(), rule.getName());
        return Optional.of(file.toBuilder()
                .destination(destination.get())
                .status(FileStatus.READY)
                .matchReason(matchReason(rule))
                .confidenceScore(confidenceFor(rule))
                .matchedRuleId(rule.getId())
                .build());
    }

    private Optional<Destination> destinationFor(Rule rule) {
        if (rule.getAction() == RuleAction.DELETE) {
            return Optional.of(Destination.trash());
        }
        Destination destination = rule.getDestination();
        if (destination == null) {
            log.warn("[RuleEngine] Rule '{}' has no destination, skipping", rule.getName());
            return Optional.empty();
        }
        if (destination.isResolved()) {
            return Optional.of(destination);
        }

        Destination cached = resolvedDestinations.get(destination.getDisplayPath());
        if (cached != null) {
            return Optional.of(cached);
        }

        Optional<Destination> resolved = resolve(rule, destination);
        if (resolved.isPresent()) {
            resolvedDestinations.put(destination.getDisplayPath(), resolved.get());
            log.info("[RuleEngine] Resolved destination '{}' for rule '{}'", destination.getDisplayPath(),
                    rule.getName());
        }
        return resolved;
    }

    private Optional<Destination> resolve(Rule rule, Destination placeholder) {
        try {
            Optional<Destination> resolved = resolver.resolve(placeholder);
            if (resolved == null || resolved.isEmpty() || !resolved.get().isResolved()) {
                log.warn("[RuleEngine] Could not resolve destination '{}' for rule '{}', skipping",
                        placeholder.getDisplayPath(), rule.getName());
                return Optional.empty();
            }
            return resolved;
        } catch (RuntimeException e) {
            log.warn("[RuleEngine] Resolver failed for '{}' (rule '{}'): {}", placeholder.getDisplayPath(),
                    rule.getName(), e.getMessage());
            return Optional.empty();
        }
    }

    static double confidenceFor(Rule rule) {
        List<Condition> conditions = rule.getConditions();
        if (conditions == null || conditions.isEmpty()) {
            return DEFAULT_CONFIDENCE;
        }
        if (conditions.size() > 1) {
            return MULTI_CONDITION_CONFIDENCE;
        }
        return singleConditionConfidence(conditions.get(0));
    }

    private static double singleConditionConfidence(Condition condition) {
        return switch (condition.kind()) {
            case EXTENSION_EQUALS -> 0.5;
            case NAME_STARTS_WITH, NAME_CONTAINS, NAME_ENDS_WITH -> 0.7;
            case OLDER_THAN, MODIFIED_OLDER_THAN, ACCESSED_OLDER_THAN -> 0.7;
            case LARGER_THAN -> 0.7;
            case KIND_EQUALS -> 0.6;
            case FROM_LOCATION -> 0.8;
            case TIME_OF_DAY, DAYS_OF_WEEK -> 0.7;
            case NEGATED -> {
                Condition inner = ((Condition.Negated) condition).condition();
                yield inner != null ? singleConditionConfidence(inner) : DEFAULT_CONFIDENCE;
            }
        };
    }

    static String matchReason(Rule rule) {
        List<Condition> conditions = rule.getEffectiveConditions();
        if (conditions == null || conditions.isEmpty()) {
            return DEFAULT_REASON;
        }
        String separator = rule.getCombinator() == Combinator.OR ? " OR " : " AND ";
        String joined = conditions.stream().map(Condition::describe).collect(Collectors.joining(separator));
        return Character.toUpperCase(joined.charAt(0)) + joined.substring(1);
    }
}
