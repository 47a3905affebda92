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
import me.forma.organizer.domain.model.Destination;
import me.forma.organizer.domain.model.DestinationSuggestion;
import me.forma.organizer.domain.model.FileItem;
import me.forma.organizer.domain.model.FileStatus;
import me.forma.organizer.domain.model.LearnedPattern;
import me.forma.organizer.domain.model.SuggestionSource;
import me.forma.organizer.infrastructure.config.OrganizerProperties;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Picks one destination suggestion for a classified file.
 *
 * <p>
 * Precedence: the rule that classified the file, then the best learned
 * pattern, then an external prediction if it is confident enough and no
 * negative pattern vetoes it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DestinationSuggestionService {

    private final PatternLearner patternLearner;
    private final OrganizerProperties properties;

    public Optional<DestinationSuggestion> suggest(FileItem file, List<LearnedPattern> patterns,
            DestinationSuggestion externalPrediction) {
        if (file == null) {
            return Optional.empty();
        }
        Optional<DestinationSuggestion> fromRule = fromRule(file);
        if (fromRule.isPresent()) {
            return fromRule;
        }

        List<LearnedPattern> known = patterns != null ? patterns : List.of();
        List<LearnedPattern> negatives = known.stream().filter(LearnedPattern::isNegative).toList();
        List<LearnedPattern> positives = patternLearner.filterSuggestions(
                known.stream().filter(pattern -> !pattern.isNegative()).toList(), negatives);
        Optional<DestinationSuggestion> fromPattern = patternLearner.findMatchingPattern(file, positives)
                .map(DestinationSuggestionService::fromPattern);
        if (fromPattern.isPresent()) {
            return fromPattern;
        }

        return fromPrediction(file, externalPrediction, negatives);
    }

    private static Optional<DestinationSuggestion> fromRule(FileItem file) {
        if (file.getStatus() != FileStatus.READY || file.getDestination() == null) {
            return Optional.empty();
        }
        return Optional.of(DestinationSuggestion.builder()
                .destination(file.getDestination())
                .confidence(file.getConfidenceScore() != null ? file.getConfidenceScore() : 0.0)
                .explanation(file.getMatchReason())
                .source(SuggestionSource.RULE)
                .ruleId(file.getMatchedRuleId())
                .build());
    }

    private static DestinationSuggestion fromPattern(LearnedPattern pattern) {
        return DestinationSuggestion.builder()
                .destination(Destination.unresolved(pattern.getDestinationPath()))
                .confidence(pattern.getConfidenceScore())
                .explanation(pattern.getDescription() + " (seen " + pattern.getOccurrenceCount() + " times)")
                .source(SuggestionSource.PATTERN)
                .patternId(pattern.getId())
                .build();
    }

    private Optional<DestinationSuggestion> fromPrediction(FileItem file, DestinationSuggestion prediction,
            List<LearnedPattern> negatives) {
        if (prediction == null || prediction.getDestination() == null) {
            return Optional.empty();
        }
        double minimum = properties.getSuggestion().getMinimumPredictionConfidence();
        if (prediction.getConfidence() < minimum) {
            log.debug("[Suggestions] Ignoring prediction for {} below confidence {}", file.getName(), minimum);
            return Optional.empty();
        }
        String destination = prediction.getDestination().getDisplayPath();
        boolean suppressed = negatives.stream()
                .anyMatch(negative -> negative.shouldSuppress(file.getFileExtension(), destination));
        if (suppressed) {
            log.debug("[Suggestions] Prediction '{}' for {} suppressed by a negative pattern", destination,
                    file.getName());
            return Optional.empty();
        }
        return Optional.of(prediction.getSource() == SuggestionSource.ML_PREDICTION ? prediction
                : DestinationSuggestion.builder()
                        .destination(prediction.getDestination())
                        .confidence(prediction.getConfidence())
                        .explanation(prediction.getExplanation())
                        .source(SuggestionSource.ML_PREDICTION)
                        .build());
    }
}
