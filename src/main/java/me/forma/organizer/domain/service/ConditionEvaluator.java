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
import me.forma.organizer.domain.model.FileItem;
import me.forma.organizer.domain.model.FileKind;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;

/**
 * Evaluates {@link Condition}s against a {@link FileItem}.
 *
 * <p>
 * Name and extension comparisons are case-insensitive on NFC-normalised text.
 * Date conditions compare against the injected clock; a timestamp matches
 * only when it is strictly before {@code now - days}. Conditions that cannot
 * be evaluated (non-positive day counts, missing dates, unknown kinds) do not
 * match.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConditionEvaluator {

    private final Clock clock;

    /**
     * Evaluates a condition list under a combinator. An empty list never
     * matches.
     */
    public boolean matches(FileItem file, List<Condition> conditions, Combinator combinator) {
        if (conditions == null || conditions.isEmpty()) {
            return false;
        }
        Combinator effective = combinator != null ? combinator : Combinator.SINGLE;
        return switch (effective) {
            case SINGLE -> matches(file, conditions.get(0));
            case AND -> conditions.stream().allMatch(condition -> matches(file, condition));
            case OR -> conditions.stream().anyMatch(condition -> matches(file, condition));
        };
    }

    /**
     * Whether any of the conditions holds; used for exclusions.
     */
    public boolean matchesAny(FileItem file, List<Condition> conditions) {
        if (conditions == null || conditions.isEmpty()) {
            return false;
        }
        return conditions.stream().anyMatch(condition -> matches(file, condition));
    }

    public boolean matches(FileItem file, Condition condition) {
        if (file == null || condition == null) {
            return false;
        }
        return switch (condition.kind()) {
            case EXTENSION_EQUALS -> extensionMatches(file, ((Condition.ExtensionEquals) condition).extension());
            case NAME_STARTS_WITH -> normalize(file.getName())
                    .startsWith(normalize(((Condition.NameStartsWith) condition).text()));
            case NAME_CONTAINS -> normalize(file.getName())
                    .contains(normalize(((Condition.NameContains) condition).text()));
            case NAME_ENDS_WITH -> normalize(file.getName())
                    .endsWith(normalize(((Condition.NameEndsWith) condition).text()));
            case OLDER_THAN -> olderThan(file, (Condition.OlderThan) condition);
            case MODIFIED_OLDER_THAN -> isOlderThan(file.getModificationDate(),
                    ((Condition.ModifiedOlderThan) condition).days());
            case ACCESSED_OLDER_THAN -> isOlderThan(file.getLastAccessedDate(),
                    ((Condition.AccessedOlderThan) condition).days());
            case LARGER_THAN -> file.getSizeInBytes() > ((Condition.LargerThan) condition).bytes();
            case KIND_EQUALS -> FileKind.fromName(((Condition.KindEquals) condition).kindName())
                    .map(kind -> kind.includes(file.getFileExtension()))
                    .orElse(false);
            case FROM_LOCATION -> file.getLocation() == ((Condition.FromLocation) condition).location();
            case NEGATED -> negated(file, (Condition.Negated) condition);
            case TIME_OF_DAY -> timeOfDay((Condition.TimeOfDay) condition);
            case DAYS_OF_WEEK -> ((Condition.DaysOfWeek) condition).days()
                    .contains(ZonedDateTime.now(clock).getDayOfWeek());
        };
    }

    private boolean extensionMatches(FileItem file, String expected) {
        String actual = stripDot(normalize(file.getFileExtension()));
        String wanted = stripDot(normalize(expected));
        return !wanted.isEmpty() && actual.equals(wanted);
    }

    private boolean olderThan(FileItem file, Condition.OlderThan condition) {
        String filter = condition.extensionFilter();
        if (filter != null && !filter.isBlank() && !extensionMatches(file, filter)) {
            return false;
        }
        return isOlderThan(file.getCreationDate(), condition.days());
    }

    private boolean isOlderThan(Instant timestamp, int days) {
        if (days <= 0) {
            log.warn("[RuleEngine] Ignoring date condition with non-positive day count: {}", days);
            return false;
        }
        if (timestamp == null) {
            return false;
        }
        Instant threshold = ZonedDateTime.now(clock).minusDays(days).toInstant();
        return timestamp.isBefore(threshold);
    }

    private boolean negated(FileItem file, Condition.Negated condition) {
        if (condition.condition() == null) {
            return false;
        }
        return !matches(file, condition.condition());
    }

    private boolean timeOfDay(Condition.TimeOfDay condition) {
        if (!validHour(condition.startHour()) || !validHour(condition.endHour())) {
            log.warn("[RuleEngine] Ignoring time window with invalid hours: {}-{}", condition.startHour(),
                    condition.endHour());
            return false;
        }
        return condition.containsHour(ZonedDateTime.now(clock).getHour());
    }

    private static boolean validHour(int hour) {
        return hour >= 0 && hour <= 24;
    }

    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return Normalizer.normalize(value, Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
    }

    private static String stripDot(String extension) {
        return extension.startsWith(".") ? extension.substring(1) : extension;
    }
}
