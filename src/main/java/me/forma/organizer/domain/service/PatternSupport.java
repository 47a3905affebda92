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

import me.forma.organizer.domain.model.Combinator;
import me.forma.organizer.domain.model.Condition;
import me.forma.organizer.domain.model.LearnedPattern;
import me.forma.organizer.domain.model.TimeCategory;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Static helpers shared by pattern induction and the presentation of learned
 * patterns.
 */
public final class PatternSupport {

    private static final int MAX_DISPLAY_PATH_LENGTH = 35;
    private static final double HIGH_CONFIDENCE = 0.7;
    private static final double MEDIUM_CONFIDENCE = 0.5;

    private PatternSupport() {
    }

    /**
     * Whether a pattern may be offered to the user: positive, not yet turned
     * into a rule, rejected fewer than {@code maxRejections} times and at least
     * {@code minConfidence} confident.
     */
    public static boolean shouldSuggest(LearnedPattern pattern, double minConfidence, int maxRejections) {
        return pattern != null
                && !pattern.isNegative()
                && !pattern.isConverted()
                && pattern.getRejectionCount() < maxRejections
                && pattern.getConfidenceScore() >= minConfidence;
    }

    public static String confidenceLevel(double confidence) {
        if (confidence >= HIGH_CONFIDENCE) {
            return "High";
        } else if (confidence >= MEDIUM_CONFIDENCE) {
            return "Medium";
        }
        return "Low";
    }

    /**
     * {@code "extension is .pdf AND name contains 'invoice'"}; falls back to the
     * extension alone for patterns without conditions.
     */
    public static String conditionsDescription(LearnedPattern pattern) {
        List<Condition> conditions = pattern.getConditions();
        if (conditions.isEmpty()) {
            return "." + pattern.getFileExtension() + " files";
        }
        String separator = pattern.getCombinator() == Combinator.OR ? " OR " : " AND ";
        return conditions.stream().map(Condition::describe).collect(Collectors.joining(separator));
    }

    public static String negativePatternDescription(String extension, String destination) {
        return "Don't suggest " + abbreviatePath(destination) + " for " + upper(extension) + " files";
    }

    public static String simpleDescription(String extension, String destination) {
        return "Move " + upper(extension) + " files to " + abbreviatePath(destination);
    }

    public static String prefixDescription(String prefix, String extension, String destination) {
        return "Move " + prefix + " " + upper(extension) + " files to " + abbreviatePath(destination);
    }

    public static String keywordDescription(String keyword, String extension, String destination) {
        return "Move " + upper(extension) + " files containing '" + keyword + "' to " + abbreviatePath(destination);
    }

    public static String temporalDescription(TimeCategory category, String extension, String destination) {
        return "During " + category.getDisplayName() + ": " + simpleDescription(extension, destination);
    }

    /**
     * Shortens long paths to their last two segments, e.g.
     * {@code …/Finance/Invoices}.
     */
    public static String abbreviatePath(String path) {
        if (path == null) {
            return "";
        }
        if (path.length() > MAX_DISPLAY_PATH_LENGTH) {
            List<String> segments = Arrays.stream(path.split("/")).filter(s -> !s.isEmpty()).toList();
            if (segments.size() > 2) {
                return "…/" + String.join("/", segments.subList(segments.size() - 2, segments.size()));
            }
        }
        return path;
    }

    /**
     * Last segment of a display path: {@code Documents/Finance} gives
     * {@code Finance}.
     */
    public static String folderName(String path) {
        if (path == null) {
            return "";
        }
        List<String> segments = Arrays.stream(path.split("/")).filter(s -> !s.isEmpty()).toList();
        return segments.isEmpty() ? path : segments.get(segments.size() - 1);
    }

    /**
     * Stable identifier derived from what the pattern says, so inducing the
     * same history twice yields equal patterns.
     */
    static UUID patternId(boolean negative, String extension, String destination, List<Condition> conditions) {
        String signature = (negative ? "negative" : "positive") + "|" + extension + "|" + destination + "|"
                + conditionSignature(conditions);
        return UUID.nameUUIDFromBytes(signature.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Order-independent textual signature of a condition list.
     */
    static String conditionSignature(List<Condition> conditions) {
        return conditions.stream().map(Object::toString).sorted().collect(Collectors.joining(";"));
    }

    private static String upper(String extension) {
        return extension == null ? "" : extension.toUpperCase(Locale.ROOT);
    }
}
