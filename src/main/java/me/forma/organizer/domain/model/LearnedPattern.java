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
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Behavioural regularity induced from the activity history, e.g. "PDF files
 * go to Documents/Finance".
 *
 * <p>
 * A negative pattern records the opposite: a destination the user keeps
 * rejecting for an extension. Negative patterns are never suggested and
 * suppress matching positive suggestions instead.
 *
 * <p>
 * Instances are immutable; the {@code with*}/{@code record*} methods return
 * updated copies. Confidence is always clamped to {@code [0, 1]}.
 */
@Value
public class LearnedPattern {

    UUID id;
    String description;
    String fileExtension;
    String destinationPath;
    int occurrenceCount;
    double confidenceScore;
    Instant lastSeenDate;
    Instant createdDate;
    int rejectionCount;
    boolean negative;
    UUID convertedToRuleId;
    List<Condition> conditions;
    Combinator combinator;
    List<TemporalContext> temporalContexts;
    TimeCategory timeCategory;
    List<String> keywords;

    @Builder(toBuilder = true)
    public LearnedPattern(UUID id, String description, String fileExtension, String destinationPath, int occurrenceCount,
            double confidenceScore, Instant lastSeenDate, Instant createdDate, int rejectionCount, boolean negative,
            UUID convertedToRuleId, List<Condition> conditions, Combinator combinator,
            List<TemporalContext> temporalContexts, TimeCategory timeCategory, List<String> keywords) {
        this.id = id != null ? id : UUID.randomUUID();
        this.description = description != null ? description : "";
        this.fileExtension = fileExtension != null ? fileExtension : "";
        this.destinationPath = destinationPath != null ? destinationPath : "";
        this.occurrenceCount = occurrenceCount;
        this.confidenceScore = clamp(confidenceScore);
        this.lastSeenDate = lastSeenDate;
        this.createdDate = createdDate;
        this.rejectionCount = rejectionCount;
        this.negative = negative;
        this.convertedToRuleId = convertedToRuleId;
        this.conditions = conditions != null ? List.copyOf(conditions) : List.of();
        this.combinator = combinator != null ? combinator : Combinator.SINGLE;
        this.temporalContexts = temporalContexts != null ? List.copyOf(temporalContexts) : List.of();
        this.timeCategory = timeCategory != null ? timeCategory : TimeCategory.ANY_TIME;
        this.keywords = keywords != null ? List.copyOf(keywords) : List.of();
    }

    public boolean isCompound() {
        return conditions.size() > 1;
    }

    public boolean isConverted() {
        return convertedToRuleId != null;
    }

    /**
     * Extension named by the first extension condition, falling back to the
     * pattern's own extension.
     */
    public String primaryFileExtension() {
        return conditions.stream()
                .filter(Condition.ExtensionEquals.class::isInstance)
                .map(condition -> ((Condition.ExtensionEquals) condition).extension())
                .findFirst()
                .orElse(fileExtension);
    }

    /**
     * Whether this negative pattern vetoes suggesting {@code destination} for
     * files with {@code extension}.
     */
    public boolean shouldSuppress(String extension, String destination) {
        return negative
                && extension != null
                && withoutDot(primaryFileExtension()).equalsIgnoreCase(withoutDot(extension.trim()))
                && destinationPath.equals(destination);
    }

    private static String withoutDot(String extension) {
        return extension.startsWith(".") ? extension.substring(1) : extension;
    }

    public LearnedPattern recordNewOccurrence(double confidence, Instant seenAt, ZoneId zone) {
        List<TemporalContext> contexts = new ArrayList<>(temporalContexts);
        contexts.add(TemporalContext.of(seenAt, zone));
        return toBuilder()
                .occurrenceCount(occurrenceCount + 1)
                .confidenceScore(confidence)
                .lastSeenDate(seenAt)
                .temporalContexts(contexts)
                .timeCategory(TimeCategories.categorize(contexts))
                .build();
    }

    public LearnedPattern recordRejection() {
        return toBuilder().rejectionCount(rejectionCount + 1).build();
    }

    /**
     * Turns an explicit user rejection into a negative pattern held with full
     * confidence.
     */
    public LearnedPattern asNegative() {
        return toBuilder().negative(true).confidenceScore(1.0).build();
    }

    public LearnedPattern markConverted(UUID ruleId) {
        return toBuilder().convertedToRuleId(ruleId).build();
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
