package me.forma.organizer.infrastructure.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.forma.organizer.domain.model.Condition;
import me.forma.organizer.domain.model.RuleAction;
import me.forma.organizer.domain.service.RuleTemplateCatalog;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AutoConfigurationTest {

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();

    @Test
    void shouldWriteInstantsAsIsoStrings() throws JsonProcessingException {
        String json = objectMapper.writeValueAsString(Map.of("at", Instant.parse("2026-03-11T12:00:00Z")));

        assertEquals("{\"at\":\"2026-03-11T12:00:00Z\"}", json);
    }

    @Test
    void shouldIgnoreUnknownProperties() throws JsonProcessingException {
        String json = "{\"name\":\"Receipts\",\"icon\":\"doc\",\"action\":\"COPY\",\"destination\":\"Finance\","
                + "\"conditions\":[{\"type\":\"nameContains\",\"text\":\"receipt\"}]}";

        RuleTemplateCatalog.TemplateRule rule = objectMapper.readValue(json, RuleTemplateCatalog.TemplateRule.class);

        assertEquals(RuleAction.COPY, rule.getAction());
        assertEquals(Condition.nameContains("receipt"), rule.getConditions().get(0));
    }

    @Test
    void shouldDefaultPropertiesToDocumentedThresholds() {
        OrganizerProperties properties = new OrganizerProperties();

        assertEquals(3, properties.getLearning().getMinimumOccurrences());
        assertEquals(0.7, properties.getSuggestion().getMinimumPredictionConfidence());
        assertEquals("rule-templates.json", properties.getTemplates().getResource());
        assertTrue(properties.getResolver().getRoots().isEmpty());
    }
}
