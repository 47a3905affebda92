package me.forma.organizer.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the organizer core.
 *
 * <p>
 * Everything lives under the {@code organizer.*} prefix:
 * <ul>
 * <li>{@link LearningProperties} - thresholds for pattern induction and
 * suggestion filtering</li>
 * <li>{@link SuggestionProperties} - acceptance of external predictions</li>
 * <li>{@link ResolverProperties} - known-folder roots for destination
 * resolution</li>
 * <li>{@link TemplateProperties} - bundled rule template resource</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "organizer")
@Data
public class OrganizerProperties {

    private LearningProperties learning = new LearningProperties();
    private SuggestionProperties suggestion = new SuggestionProperties();
    private ResolverProperties resolver = new ResolverProperties();
    private TemplateProperties templates = new TemplateProperties();

    @Data
    public static class LearningProperties {
        private int minimumOccurrences = 3;
        private int minimumRejections = 2;
        private double negativeConfidenceDivisor = 5.0;
        private double negativeConfidenceCap = 0.9;
        private double prefixBoost = 1.15;
        private double keywordBoost = 1.10;
        private double temporalRatioThreshold = 1.3;
        private int maxPatternRejections = 3;
        private int fileRejectionThreshold = 2;
        private double fileRejectionRateLimit = 0.5;
        private double minimumSuggestionConfidence = 0.5;
        private String zone;
        private List<String> significantPrefixes = new ArrayList<>(List.of(
                "Invoice", "Receipt", "Screenshot", "Photo", "IMG", "DSC", "VID", "Report", "Contract",
                "Agreement", "Proposal", "Draft", "Final", "Meeting", "Notes", "Summary", "Backup", "Archive",
                "Export"));
        private List<String> purposeKeywords = new ArrayList<>(List.of(
                "invoice", "receipt", "statement", "contract", "agreement", "report", "presentation", "proposal",
                "meeting", "notes", "screenshot", "photo", "image", "video", "audio", "backup", "archive", "export",
                "download", "temp"));
    }

    @Data
    public static class SuggestionProperties {
        private double minimumPredictionConfidence = 0.7;
    }

    @Data
    public static class ResolverProperties {
        private Map<String, String> roots = new LinkedHashMap<>();
    }

    @Data
    public static class TemplateProperties {
        private String resource = "rule-templates.json";
    }
}
