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
import me.forma.organizer.domain.model.ActivityRecord;
import me.forma.organizer.domain.model.ActivityType;
import me.forma.organizer.domain.model.Combinator;
import me.forma.organizer.domain.model.Condition;
import me.forma.organizer.domain.model.Destination;
import me.forma.organizer.domain.model.FileItem;
import me.forma.organizer.domain.model.LearnedPattern;
import me.forma.organizer.domain.model.Rule;
import me.forma.organizer.domain.model.RuleAction;
import me.forma.organizer.domain.model.TemporalContext;
import me.forma.organizer.domain.model.TimeCategory;
import me.forma.organizer.infrastructure.config.OrganizerProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Induces {@link LearnedPattern}s from the activity history and applies them.
 *
 * <p>
 * Induction runs four passes over the history:
 * <ol>
 * <li>simple: extension to destination</li>
 * <li>multi-condition: extension plus a significant name prefix or a purpose
 * keyword</li>
 * <li>temporal: extension to destination clustered in a time-of-week
 * bucket</li>
 * <li>negative: destinations repeatedly rejected for an extension</li>
 * </ol>
 * and then deduplicates so that a more specific pattern supersedes a simpler
 * one for the same extension and destination.
 *
 * <p>
 * Induction is a pure function of its input: groups are visited in first-seen
 * order and pattern ids derive from pattern content, so the same history
 * always yields equal output.
 */
@Service
@Slf4j
public class PatternLearner {

    private static final Comparator<LearnedPattern> BY_CONFIDENCE_DESC = Comparator
            .comparingDouble(LearnedPattern::getConfidenceScore).reversed();

    private final OrganizerProperties.LearningProperties settings;
    private final ConditionEvaluator conditionEvaluator;
    private final Clock clock;
    private final ZoneId zone;

    public PatternLearner(OrganizerProperties properties, ConditionEvaluator conditionEvaluator, Clock clock) {
        this.settings = properties.getLearning();
        this.conditionEvaluator = conditionEvaluator;
        this.clock = clock;
        this.zone = resolveZone(settings.getZone(), clock);
    }

    // ===== Induction =====

    public List<LearnedPattern> inducePatterns(List<ActivityRecord> activities) {
        if (activities == null || activities.isEmpty()) {
            return List.of();
        }
        List<ActivityRecord> organized = activities.stream()
                .filter(Objects::nonNull)
                .filter(activity -> activity.getActivityType() != null && activity.getActivityType().isOrganization())
                .toList();

        List<LearnedPattern> candidates = new ArrayList<>();
        candidates.addAll(simplePatterns(organized));
        candidates.addAll(prefixPatterns(organized));
        candidates.addAll(keywordPatterns(organized));
        candidates.addAll(temporalPatterns(organized));
        candidates.addAll(negativePatterns(activities));
        candidates.replaceAll(PatternLearner::withStableId);

        List<LearnedPattern> patterns = deduplicate(candidates);
        patterns.sort(BY_CONFIDENCE_DESC);
        log.debug("[PatternLearner] Induced {} patterns ({} candidates) from {} activities", patterns.size(),
                candidates.size(), activities.size());
        return patterns;
    }

    private List<LearnedPattern> simplePatterns(List<ActivityRecord> organized) {
        List<LearnedPattern> patterns = new ArrayList<>();
        groupByExtension(organized).forEach((extension, forExtension) -> groupByDestination(forExtension,
                ActivityDetailsParser::extractDestination).forEach((destination, forDestination) -> {
                    int count = forDestination.size();
                    if (count < settings.getMinimumOccurrences()) {
                        return;
                    }
                    double confidence = (double) count / forExtension.size();
                    patterns.add(pattern(extension, destination, forDestination)
                            .description(PatternSupport.simpleDescription(extension, destination))
                            .confidenceScore(confidence)
                            .conditions(List.of(Condition.extension(extension)))
                            .build());
                }));
        return patterns;
    }

    private List<LearnedPattern> prefixPatterns(List<ActivityRecord> organized) {
        List<LearnedPattern> patterns = new ArrayList<>();
        groupByExtension(organized).forEach((extension, forExtension) -> {
            for (String prefix : settings.getSignificantPrefixes()) {
                String lowered = prefix.toLowerCase(Locale.ROOT);
                List<ActivityRecord> matching = forExtension.stream()
                        .filter(activity -> lowerName(activity).startsWith(lowered))
                        .toList();
                patterns.addAll(compoundPatterns(extension, matching, settings.getPrefixBoost(),
                        Condition.nameStartsWith(prefix), lowered,
                        destination -> PatternSupport.prefixDescription(prefix, extension, destination)));
            }
        });
        return patterns;
    }

    private List<LearnedPattern> keywordPatterns(List<ActivityRecord> organized) {
        List<LearnedPattern> patterns = new ArrayList<>();
        groupByExtension(organized).forEach((extension, forExtension) -> {
            for (String keyword : settings.getPurposeKeywords()) {
                String lowered = keyword.toLowerCase(Locale.ROOT);
                List<ActivityRecord> matching = forExtension.stream()
                        .filter(activity -> lowerName(activity).contains(lowered))
                        .toList();
                patterns.addAll(compoundPatterns(extension, matching, settings.getKeywordBoost(),
                        Condition.nameContains(keyword), lowered,
                        destination -> PatternSupport.keywordDescription(keyword, extension, destination)));
            }
        });
        return patterns;
    }

    private List<LearnedPattern> compoundPatterns(String extension, List<ActivityRecord> matching, double boost,
            Condition nameCondition, String keyword, Function<String, String> describer) {
        if (matching.size() < settings.getMinimumOccurrences()) {
            return List.of();
        }
        List<LearnedPattern> patterns = new ArrayList<>();
        groupByDestination(matching, ActivityDetailsParser::extractDestination).forEach((destination, forDestination) -> {
            int count = forDestination.size();
            if (count < settings.getMinimumOccurrences()) {
                return;
            }
            double confidence = Math.min(1.0, (double) count / matching.size() * boost);
            patterns.add(pattern(extension, destination, forDestination)
                    .description(describer.apply(destination))
                    .confidenceScore(confidence)
                    .conditions(List.of(Condition.extension(extension), nameCondition))
                    .combinator(Combinator.AND)
                    .keywords(List.of(keyword))
                    .build());
        });
        return patterns;
    }

    private List<LearnedPattern> temporalPatterns(List<ActivityRecord> organized) {
        Map<String, List<ActivityRecord>> overallByExtension = groupByExtension(organized);
        Map<TimeCategory, List<ActivityRecord>> buckets = new EnumMap<>(TimeCategory.class);
        for (ActivityRecord activity : organized) {
            if (activity.getTimestamp() != null) {
                buckets.computeIfAbsent(bucketOf(TemporalContext.of(activity.getTimestamp(), zone)),
                        key -> new ArrayList<>()).add(activity);
            }
        }

        List<LearnedPattern> patterns = new ArrayList<>();
        buckets.forEach((category, inBucket) -> {
            if (inBucket.size() < settings.getMinimumOccurrences()) {
                return;
            }
            groupByExtension(inBucket).forEach((extension, forExtension) -> groupByDestination(forExtension,
                    ActivityDetailsParser::extractDestination).forEach((destination, forDestination) -> {
                        int count = forDestination.size();
                        if (count < settings.getMinimumOccurrences()) {
                            return;
                        }
                        List<ActivityRecord> allForExtension = overallByExtension.getOrDefault(extension, List.of());
                        long allToDestination = allForExtension.stream()
                                .filter(activity -> destination
                                        .equals(ActivityDetailsParser.extractDestination(activity.getDetails())))
                                .count();
                        double overallRatio = (double) allToDestination / allForExtension.size();
                        double bucketRatio = (double) count / forExtension.size();
                        if (bucketRatio <= overallRatio * settings.getTemporalRatioThreshold()) {
                            return;
                        }
                        List<Condition> conditions = new ArrayList<>();
                        conditions.add(Condition.extension(extension));
                        conditions.addAll(timeConditions(category));
                        patterns.add(pattern(extension, destination, forDestination)
                                .description(PatternSupport.temporalDescription(category, extension, destination))
                                .confidenceScore(bucketRatio)
                                .conditions(conditions)
                                .combinator(Combinator.AND)
                                .temporalContexts(forDestination.stream()
                                        .map(activity -> TemporalContext.of(activity.getTimestamp(), zone))
                                        .toList())
                                .timeCategory(category)
                                .build());
                    }));
        });
        return patterns;
    }

    private List<LearnedPattern> negativePatterns(List<ActivityRecord> activities) {
        List<ActivityRecord> skipped = activities.stream()
                .filter(Objects::nonNull)
                .filter(activity -> activity.getActivityType() == ActivityType.FILE_SKIPPED)
                .toList();
        int minimum = settings.getMinimumRejections();
        if (skipped.size() < minimum) {
            return List.of();
        }

        List<LearnedPattern> patterns = new ArrayList<>();
        groupByExtension(skipped).forEach((extension, forExtension) -> {
            if (forExtension.size() < minimum) {
                return;
            }
            groupByDestination(forExtension, ActivityDetailsParser::extractRejectedDestination)
                    .forEach((destination, rejections) -> {
                        int count = rejections.size();
                        if (count < minimum) {
                            return;
                        }
                        double confidence = Math.min(settings.getNegativeConfidenceCap(),
                                count / settings.getNegativeConfidenceDivisor());
                        patterns.add(pattern(extension, destination, rejections)
                                .description(PatternSupport.negativePatternDescription(extension, destination))
                                .confidenceScore(confidence)
                                .conditions(List.of(Condition.extension(extension)))
                                .negative(true)
                                .rejectionCount(count)
                                .build());
                    });
        });
        return patterns;
    }

    private List<LearnedPattern> deduplicate(List<LearnedPattern> candidates) {
        List<LearnedPattern> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingInt((LearnedPattern pattern) -> pattern.getConditions().size())
                .reversed()
                .thenComparing(BY_CONFIDENCE_DESC));

        Set<String> seen = new HashSet<>();
        List<LearnedPattern> kept = new ArrayList<>();
        for (LearnedPattern pattern : sorted) {
            String key = uniquenessKey(pattern);
            if (pattern.isCompound()) {
                if (seen.add(key + "|" + PatternSupport.conditionSignature(pattern.getConditions()))) {
                    kept.add(pattern);
                }
                continue;
            }
            boolean supersededByMoreSpecific = kept.stream()
                    .anyMatch(existing -> uniquenessKey(existing).equals(key)
                            && existing.getConditions().size() > pattern.getConditions().size());
            if (!supersededByMoreSpecific && seen.add(key)) {
                kept.add(pattern);
            }
        }
        return kept;
    }

    // ===== Application =====

    /**
     * Highest-confidence suggestible pattern whose conditions all hold for the
     * file. Negative patterns, repeatedly rejected patterns and patterns without
     * conditions never match.
     */
    public Optional<LearnedPattern> findMatchingPattern(FileItem file, List<LearnedPattern> patterns) {
        if (file == null || patterns == null || patterns.isEmpty()) {
            return Optional.empty();
        }
        List<LearnedPattern> byConfidence = new ArrayList<>(patterns);
        byConfidence.removeIf(Objects::isNull);
        byConfidence.sort(BY_CONFIDENCE_DESC);
        for (LearnedPattern pattern : byConfidence) {
            if (pattern.isNegative() || pattern.getRejectionCount() >= settings.getMaxPatternRejections()) {
                continue;
            }
            if (pattern.getConditions().isEmpty()) {
                continue;
            }
            boolean allHold = pattern.getConditions().stream()
                    .allMatch(condition -> conditionEvaluator.matches(file, condition));
            if (allHold) {
                return Optional.of(pattern);
            }
        }
        return Optional.empty();
    }

    /**
     * Drops suggestions vetoed by a negative pattern for the same extension and
     * destination.
     */
    public List<LearnedPattern> filterSuggestions(List<LearnedPattern> suggestions,
            List<LearnedPattern> negativePatterns) {
        if (suggestions == null || suggestions.isEmpty()) {
            return List.of();
        }
        List<LearnedPattern> negatives = negativePatterns != null ? negativePatterns : List.of();
        return suggestions.stream()
                .filter(suggestion -> negatives.stream()
                        .noneMatch(negative -> negative.shouldSuppress(suggestion.primaryFileExtension(),
                                suggestion.getDestinationPath())))
                .toList();
    }

    /**
     * Like {@link #filterSuggestions(List, List)}, and additionally drops a
     * suggestion when more than the configured share of files with its
     * extension have individually rejected its destination often enough.
     */
    public List<LearnedPattern> filterSuggestions(List<LearnedPattern> suggestions,
            List<LearnedPattern> negativePatterns, List<FileItem> files) {
        List<LearnedPattern> filtered = filterSuggestions(suggestions, negativePatterns);
        if (files == null || files.isEmpty()) {
            return filtered;
        }
        return filtered.stream()
                .filter(suggestion -> !rejectedByFiles(suggestion, files))
                .toList();
    }

    private boolean rejectedByFiles(LearnedPattern suggestion, List<FileItem> files) {
        String extension = normalizeExtension(suggestion.primaryFileExtension());
        List<FileItem> sameExtension = files.stream()
                .filter(Objects::nonNull)
                .filter(file -> normalizeExtension(file.getFileExtension()).equals(extension))
                .toList();
        if (sameExtension.isEmpty()) {
            return false;
        }
        long rejecting = sameExtension.stream()
                .filter(file -> suggestion.getDestinationPath().equals(file.getRejectedDestination()))
                .filter(file -> file.getRejectionCount() >= settings.getFileRejectionThreshold())
                .count();
        return (double) rejecting / sameExtension.size() > settings.getFileRejectionRateLimit();
    }

    public boolean shouldSuggest(LearnedPattern pattern) {
        return PatternSupport.shouldSuggest(pattern, settings.getMinimumSuggestionConfidence(),
                settings.getMaxPatternRejections());
    }

    // ===== Conversion =====

    public Rule convertToRule(LearnedPattern pattern) {
        return convertToRule(pattern, false);
    }

    /**
     * Builds a MOVE rule with the pattern's conditions toward its destination,
     * left unresolved for the engine to resolve.
     *
     * @throws IllegalArgumentException
     *             for negative patterns or patterns without a destination
     */
    public Rule convertToRule(LearnedPattern pattern, boolean enabled) {
        if (pattern.isNegative()) {
            throw new IllegalArgumentException("Negative patterns cannot become rules");
        }
        List<Condition> conditions = pattern.getConditions().isEmpty()
                ? List.of(Condition.extension(pattern.getFileExtension()))
                : pattern.getConditions();
        Combinator combinator = pattern.getCombinator();
        if (conditions.size() > 1 && combinator == Combinator.SINGLE) {
            combinator = Combinator.AND;
        }
        return Rule.builder()
                .name(ruleName(pattern, conditions))
                .conditions(conditions)
                .combinator(combinator)
                .action(RuleAction.MOVE)
                .destination(Destination.unresolved(pattern.getDestinationPath()))
                .enabled(enabled)
                .creationDate(clock.instant())
                .build();
    }

    private static String ruleName(LearnedPattern pattern, List<Condition> conditions) {
        String folder = PatternSupport.folderName(pattern.getDestinationPath());
        if (conditions.size() > 1) {
            String summary = conditions.stream()
                    .limit(2)
                    .map(Condition::describe)
                    .collect(Collectors.joining(" + "));
            return summary + " → " + folder;
        }
        return pattern.getFileExtension().toUpperCase(Locale.ROOT) + " → " + folder;
    }

    // ===== Incremental update =====

    /**
     * Merges freshly induced patterns into existing ones. A pattern saying the
     * same thing (polarity, extension, destination and conditions) records a
     * new occurrence; unknown patterns are appended.
     */
    public List<LearnedPattern> updatePatterns(List<LearnedPattern> existing, List<ActivityRecord> activities) {
        List<LearnedPattern> current = existing != null ? existing : List.of();
        List<LearnedPattern> induced = inducePatterns(activities);

        Map<String, LearnedPattern> inducedBySignature = new LinkedHashMap<>();
        for (LearnedPattern pattern : induced) {
            inducedBySignature.putIfAbsent(mergeSignature(pattern), pattern);
        }

        List<LearnedPattern> merged = new ArrayList<>();
        Set<String> matched = new HashSet<>();
        for (LearnedPattern pattern : current) {
            String signature = mergeSignature(pattern);
            LearnedPattern update = inducedBySignature.get(signature);
            if (update != null && matched.add(signature)) {
                Instant seenAt = update.getLastSeenDate() != null ? update.getLastSeenDate() : clock.instant();
                merged.add(pattern.recordNewOccurrence(update.getConfidenceScore(), seenAt, zone));
            } else {
                merged.add(pattern);
            }
        }
        inducedBySignature.forEach((signature, pattern) -> {
            if (!matched.contains(signature)) {
                merged.add(pattern);
            }
        });
        log.debug("[PatternLearner] Updated {} existing patterns, {} merged, {} new", current.size(),
                matched.size(), merged.size() - current.size());
        return merged;
    }

    // ===== Helpers =====

    private LearnedPattern.LearnedPatternBuilder pattern(String extension, String destination,
            List<ActivityRecord> occurrences) {
        Instant lastSeen = occurrences.stream()
                .map(ActivityRecord::getTimestamp)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
        Instant firstSeen = occurrences.stream()
                .map(ActivityRecord::getTimestamp)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder())
                .orElse(null);
        return LearnedPattern.builder()
                .fileExtension(extension)
                .destinationPath(destination)
                .occurrenceCount(occurrences.size())
                .lastSeenDate(lastSeen)
                .createdDate(firstSeen);
    }

    private static LearnedPattern withStableId(LearnedPattern pattern) {
        return pattern.toBuilder()
                .id(PatternSupport.patternId(pattern.isNegative(), pattern.getFileExtension(),
                        pattern.getDestinationPath(), pattern.getConditions()))
                .build();
    }

    private static TimeCategory bucketOf(TemporalContext context) {
        if (!context.workHours() && context.isWeekend()) {
            return TimeCategory.WEEKENDS;
        } else if (context.workHours()) {
            return TimeCategory.WORK_HOURS;
        } else if (context.hourOfDay() >= 5 && context.hourOfDay() < 12) {
            return TimeCategory.MORNINGS;
        }
        return TimeCategory.EVENINGS;
    }

    private static List<Condition> timeConditions(TimeCategory category) {
        return switch (category) {
            case WORK_HOURS -> List.of(Condition.timeOfDay(9, 17),
                    new Condition.DaysOfWeek(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY)));
            case EVENINGS -> List.of(Condition.timeOfDay(17, 23));
            case MORNINGS -> List.of(Condition.timeOfDay(5, 12));
            case WEEKENDS -> List.of(new Condition.DaysOfWeek(EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY)));
            case ANY_TIME -> List.of();
        };
    }

    private static Map<String, List<ActivityRecord>> groupByExtension(List<ActivityRecord> activities) {
        Map<String, List<ActivityRecord>> groups = new LinkedHashMap<>();
        for (ActivityRecord activity : activities) {
            String extension = normalizeExtension(activity.getFileExtension());
            if (!extension.isEmpty()) {
                groups.computeIfAbsent(extension, key -> new ArrayList<>()).add(activity);
            }
        }
        return groups;
    }

    private static Map<String, List<ActivityRecord>> groupByDestination(List<ActivityRecord> activities,
            Function<String, String> parser) {
        Map<String, List<ActivityRecord>> groups = new LinkedHashMap<>();
        for (ActivityRecord activity : activities) {
            String destination = parser.apply(activity.getDetails());
            if (!destination.isEmpty()) {
                groups.computeIfAbsent(destination, key -> new ArrayList<>()).add(activity);
            }
        }
        return groups;
    }

    // Key is polarity + extension + destination; positive and negative patterns
    // for the same pair never collapse into one.
    private static String uniquenessKey(LearnedPattern pattern) {
        return (pattern.isNegative() ? "-" : "+") + normalizeExtension(pattern.getFileExtension()) + "|"
                + pattern.getDestinationPath();
    }

    private static String mergeSignature(LearnedPattern pattern) {
        return uniquenessKey(pattern) + "|" + PatternSupport.conditionSignature(pattern.getConditions());
    }

    private static String lowerName(ActivityRecord activity) {
        return activity.getFileName() != null ? activity.getFileName().toLowerCase(Locale.ROOT) : "";
    }

    private static String normalizeExtension(String extension) {
        if (extension == null) {
            return "";
        }
        String trimmed = extension.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith(".") ? trimmed.substring(1) : trimmed;
    }

    private static ZoneId resolveZone(String configured, Clock clock) {
        if (configured == null || configured.isBlank()) {
            return clock.getZone();
        }
        try {
            return ZoneId.of(configured);
        } catch (DateTimeException e) {
            log.warn("[PatternLearner] Unknown zone '{}', using {}: {}", configured, clock.getZone(),
                    e.getMessage());
            return clock.getZone();
        }
    }
}
