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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.forma.organizer.domain.model.Combinator;
import me.forma.organizer.domain.model.Condition;
import me.forma.organizer.domain.model.Destination;
import me.forma.organizer.domain.model.Rule;
import me.forma.organizer.domain.model.RuleAction;
import me.forma.organizer.infrastructure.config.OrganizerProperties;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Bundled rule templates (PARA, Johnny Decimal and similar) that seed a rule
 * set in one step.
 *
 * <p>
 * Templates are read once from {@code classpath:rule-templates.json}. A
 * missing or malformed resource leaves the catalog empty.
 */
@Service
@Slf4j
public class RuleTemplateCatalog {

    private final ObjectMapper objectMapper;
    private final OrganizerProperties properties;
    private final Clock clock;
    private TemplateSet templates = new TemplateSet();

    public RuleTemplateCatalog(ObjectMapper objectMapper, OrganizerProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        String resourceName = properties.getTemplates().getResource();
        ClassPathResource resource = new ClassPathResource(resourceName);
        if (!resource.exists()) {
            log.warn("[Templates] No {} found, catalog is empty", resourceName);
            templates = new TemplateSet();
            return;
        }
        try (InputStream is = resource.getInputStream()) {
            TemplateSet loaded = objectMapper.readValue(is, TemplateSet.class);
            templates = loaded != null && loaded.getTemplates() != null ? loaded : new TemplateSet();
            log.info("[Templates] Loaded {} rule templates", templates.getTemplates().size());
        } catch (IOException e) {
            log.warn("[Templates] Failed to load {}: {}", resourceName, e.getMessage());
            templates = new TemplateSet();
        }
    }

    public List<RuleTemplate> listTemplates() {
        return List.copyOf(templates.getTemplates());
    }

    public Optional<RuleTemplate> findTemplate(String templateId) {
        return templates.getTemplates().stream()
                .filter(template -> template.getId() != null && template.getId().equals(templateId))
                .findFirst();
    }

    /**
     * Builds the template's rules with destinations placed under
     * {@code basePath}. Rules come back disabled, with unresolved destinations
     * and ascending sort order.
     *
     * @throws IllegalArgumentException
     *             if no template has the given id
     */
    public List<Rule> instantiate(String templateId, String basePath) {
        RuleTemplate template = findTemplate(templateId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown rule template: " + templateId));
        Instant now = clock.instant();
        List<Rule> rules = new ArrayList<>();
        int sortOrder = 0;
        for (TemplateRule templateRule : template.getRules()) {
            RuleAction action = templateRule.getAction() != null ? templateRule.getAction() : RuleAction.MOVE;
            rules.add(Rule.builder()
                    .name(templateRule.getName())
                    .conditions(templateRule.getConditions())
                    .combinator(templateRule.getCombinator() != null ? templateRule.getCombinator()
                            : Combinator.SINGLE)
                    .exclusions(templateRule.getExclusions() != null ? templateRule.getExclusions() : List.of())
                    .action(action)
                    .destination(action == RuleAction.DELETE ? Destination.trash()
                            : Destination.unresolved(joinPath(basePath, templateRule.getDestination())))
                    .enabled(false)
                    .sortOrder(sortOrder++)
                    .creationDate(now)
                    .build());
        }
        log.info("[Templates] Instantiated {} rules from template '{}'", rules.size(), templateId);
        return rules;
    }

    private static String joinPath(String basePath, String destination) {
        String relative = destination != null ? destination : "";
        if (basePath == null || basePath.isBlank()) {
            return relative;
        }
        String base = basePath.endsWith("/") ? basePath.substring(0, basePath.length() - 1) : basePath;
        return relative.isBlank() ? base : base + "/" + relative;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TemplateSet {
        private List<RuleTemplate> templates = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RuleTemplate {
        private String id;
        private String name;
        private String description;
        private List<TemplateRule> rules = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TemplateRule {
        private String name;
        private List<Condition> conditions = new ArrayList<>();
        private Combinator combinator;
        private List<Condition> exclusions = new ArrayList<>();
        private RuleAction action;
        private String destination;
    }
}
