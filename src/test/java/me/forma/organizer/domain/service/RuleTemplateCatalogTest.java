package me.forma.organizer.domain.service;

import me.forma.organizer.domain.model.Combinator;
import me.forma.organizer.domain.model.Condition;
import me.forma.organizer.domain.model.FileLocationKind;
import me.forma.organizer.domain.model.Rule;
import me.forma.organizer.domain.model.RuleAction;
import me.forma.organizer.infrastructure.config.AutoConfiguration;
import me.forma.organizer.infrastructure.config.OrganizerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleTemplateCatalogTest {

    private static final Instant NOW = Instant.parse("2026-03-11T12:00:00Z");

    private OrganizerProperties properties;
    private RuleTemplateCatalog catalog;

    @BeforeEach
    void setUp() {
        properties = new OrganizerProperties();
        catalog = new RuleTemplateCatalog(AutoConfiguration.objectMapper(), properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
        catalog.init();
    }

    // ===== Loading =====

    @Test
    void shouldLoadBundledTemplates() {
        List<String> ids = catalog.listTemplates().stream().map(RuleTemplateCatalog.RuleTemplate::getId).toList();

        assertEquals(List.of("para", "johnny-decimal", "minimal", "student"), ids);
        assertTrue(catalog.findTemplate("para").isPresent());
        assertTrue(catalog.findTemplate("gtd").isEmpty());
    }

    @Test
    void shouldLeaveCatalogEmptyWhenResourceIsMissing() {
        properties.getTemplates().setResource("no-such-templates.json");

        catalog.init();

        assertTrue(catalog.listTemplates().isEmpty());
    }

    // ===== Instantiation =====

    @Test
    void shouldInstantiateDisabledRulesUnderBasePath() {
        List<Rule> rules = catalog.instantiate("para", "Documents/");

        assertEquals(8, rules.size());
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            assertFalse(rule.isEnabled());
            assertEquals(i, rule.getSortOrder());
            assertEquals(NOW, rule.getCreationDate());
            assertFalse(rule.getDestination().isResolved());
        }
        assertEquals("Active Projects", rules.get(0).getName());
        assertEquals("Documents/Projects", rules.get(0).getDestination().getDisplayPath());
        assertEquals("Documents/Areas/Finance/Taxes", rules.get(3).getDestination().getDisplayPath());
    }

    @Test
    void shouldDeserializeCompoundConditions() {
        List<Rule> rules = catalog.instantiate("minimal", "Inbox");

        Rule screenshots = rules.get(0);
        assertEquals(Combinator.AND, screenshots.getCombinator());
        assertEquals(2, screenshots.getConditions().size());
        assertInstanceOf(Condition.NameStartsWith.class, screenshots.getConditions().get(0));
        assertEquals(Condition.fromLocation(FileLocationKind.DESKTOP), screenshots.getConditions().get(1));
    }

    @Test
    void shouldSendDeleteRulesToTrash() {
        Rule installers = catalog.instantiate("minimal", "Inbox").get(2);

        assertEquals(RuleAction.DELETE, installers.getAction());
        assertEquals(Combinator.OR, installers.getCombinator());
        assertTrue(installers.getDestination().isTrash());
    }

    @Test
    void shouldUseRelativeDestinationWithoutBasePath() {
        List<Rule> rules = catalog.instantiate("student", null);

        assertEquals("School/Assignments", rules.get(0).getDestination().getDisplayPath());
    }

    @Test
    void shouldRejectUnknownTemplate() {
        assertThrows(IllegalArgumentException.class, () -> catalog.instantiate("gtd", "Documents"));
    }
}
