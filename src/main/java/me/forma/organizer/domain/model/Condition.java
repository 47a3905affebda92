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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A single test against a file's attributes (or the current time) used by
 * rules and learned patterns.
 *
 * <p>
 * Variants are immutable records with structural equality, so two conditions
 * with the same variant and payload are interchangeable. Text payloads are
 * stored as given and compared case-insensitively at evaluation time.
 *
 * <p>
 * The JSON form carries a {@code type} discriminator, e.g.
 * {@code {"type":"extensionEquals","extension":"pdf"}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Condition.ExtensionEquals.class, name = "extensionEquals"),
        @JsonSubTypes.Type(value = Condition.NameStartsWith.class, name = "nameStartsWith"),
        @JsonSubTypes.Type(value = Condition.NameContains.class, name = "nameContains"),
        @JsonSubTypes.Type(value = Condition.NameEndsWith.class, name = "nameEndsWith"),
        @JsonSubTypes.Type(value = Condition.OlderThan.class, name = "olderThan"),
        @JsonSubTypes.Type(value = Condition.ModifiedOlderThan.class, name = "modifiedOlderThan"),
        @JsonSubTypes.Type(value = Condition.AccessedOlderThan.class, name = "accessedOlderThan"),
        @JsonSubTypes.Type(value = Condition.LargerThan.class, name = "largerThan"),
        @JsonSubTypes.Type(value = Condition.KindEquals.class, name = "kindEquals"),
        @JsonSubTypes.Type(value = Condition.FromLocation.class, name = "fromLocation"),
        @JsonSubTypes.Type(value = Condition.Negated.class, name = "not"),
        @JsonSubTypes.Type(value = Condition.TimeOfDay.class, name = "timeOfDay"),
        @JsonSubTypes.Type(value = Condition.DaysOfWeek.class, name = "daysOfWeek")
})
public interface Condition {

    ConditionKind kind();

    /**
     * Short human-readable phrase, e.g. {@code extension is .pdf}.
     */
    String describe();

    static Condition extension(String extension) {
        return new ExtensionEquals(extension);
    }

    static Condition nameStartsWith(String text) {
        return new NameStartsWith(text);
    }

    static Condition nameContains(String text) {
        return new NameContains(text);
    }

    static Condition nameEndsWith(String text) {
        return new NameEndsWith(text);
    }

    static Condition olderThan(int days) {
        return new OlderThan(days, null);
    }

    static Condition olderThan(int days, String extensionFilter) {
        return new OlderThan(days, extensionFilter);
    }

    static Condition modifiedOlderThan(int days) {
        return new ModifiedOlderThan(days);
    }

    static Condition accessedOlderThan(int days) {
        return new AccessedOlderThan(days);
    }

    static Condition largerThan(long bytes) {
        return new LargerThan(bytes);
    }

    static Condition kindIs(String kind) {
        return new KindEquals(kind);
    }

    static Condition fromLocation(FileLocationKind location) {
        return new FromLocation(location);
    }

    static Condition not(Condition condition) {
        return new Negated(condition);
    }

    static Condition timeOfDay(int startHour, int endHour) {
        return new TimeOfDay(startHour, endHour);
    }

    static Condition daysOfWeek(DayOfWeek... days) {
        EnumSet<DayOfWeek> set = EnumSet.noneOf(DayOfWeek.class);
        if (days != null) {
            Collections.addAll(set, days);
        }
        return new DaysOfWeek(set);
    }

    record ExtensionEquals(String extension) implements Condition {
        public ExtensionEquals {
            extension = extension == null ? "" : extension;
        }

        @Override
        public ConditionKind kind() {
            return ConditionKind.EXTENSION_EQUALS;
        }

        @Override
        public String describe() {
            return "extension is ." + withoutDot(extension);
        }
    }

    record NameStartsWith(String text) implements Condition {
        public NameStartsWith {
            text = text == null ? "" : text;
        }

        @Override
        public ConditionKind kind() {
            return ConditionKind.NAME_STARTS_WITH;
        }

        @Override
        public String describe() {
            return "name starts with '" + text + "'";
        }
    }

    record NameContains(String text) implements Condition {
        public NameContains {
            text = text == null ? "" : text;
        }

        @Override
        public ConditionKind kind() {
            return ConditionKind.NAME_CONTAINS;
        }

        @Override
        public String describe() {
            return "name contains '" + text + "'";
        }
    }

    record NameEndsWith(String text) implements Condition {
        public NameEndsWith {
            text = text == null ? "" : text;
        }

        @Override
        public ConditionKind kind() {
            return ConditionKind.NAME_ENDS_WITH;
        }

        @Override
        public String describe() {
            return "name ends with '" + text + "'";
        }
    }

    /**
     * Creation date older than {@code days}; optionally restricted to files with
     * the given extension.
     */
    record OlderThan(int days, String extensionFilter) implements Condition {
        @Override
        public ConditionKind kind() {
            return ConditionKind.OLDER_THAN;
        }

        @Override
        public String describe() {
            if (extensionFilter != null && !extensionFilter.isBlank()) {
                return "." + withoutDot(extensionFilter) + " older than " + days + " days";
            }
            return "older than " + days + " days";
        }
    }

    record ModifiedOlderThan(int days) implements Condition {
        @Override
        public ConditionKind kind() {
            return ConditionKind.MODIFIED_OLDER_THAN;
        }

        @Override
        public String describe() {
            return "not modified in " + days + " days";
        }
    }

    record AccessedOlderThan(int days) implements Condition {
        @Override
        public ConditionKind kind() {
            return ConditionKind.ACCESSED_OLDER_THAN;
        }

        @Override
        public String describe() {
            return "not opened in " + days + " days";
        }
    }

    record LargerThan(long bytes) implements Condition {
        @Override
        public ConditionKind kind() {
            return ConditionKind.LARGER_THAN;
        }

        @Override
        public String describe() {
            return "larger than " + ByteSizes.format(bytes);
        }
    }

    record KindEquals(String kindName) implements Condition {
        public KindEquals {
            kindName = kindName == null ? "" : kindName;
        }

        @Override
        public ConditionKind kind() {
            return ConditionKind.KIND_EQUALS;
        }

        @Override
        public String describe() {
            return "file kind is " + kindName;
        }
    }

    record FromLocation(FileLocationKind location) implements Condition {
        public FromLocation {
            location = location == null ? FileLocationKind.UNKNOWN : location;
        }

        @Override
        public ConditionKind kind() {
            return ConditionKind.FROM_LOCATION;
        }

        @Override
        public String describe() {
            return "from " + location.getDisplayName();
        }
    }

    record Negated(Condition condition) implements Condition {
        @Override
        public ConditionKind kind() {
            return ConditionKind.NEGATED;
        }

        @Override
        public String describe() {
            return "NOT (" + (condition != null ? condition.describe() : "nothing") + ")";
        }
    }

    /**
     * Current local hour within {@code [startHour, endHour)}. A window whose start
     * is after its end wraps past midnight.
     */
    record TimeOfDay(int startHour, int endHour) implements Condition {
        @Override
        public ConditionKind kind() {
            return ConditionKind.TIME_OF_DAY;
        }

        @Override
        public String describe() {
            return "between " + startHour + ":00 and " + endHour + ":00";
        }

        public boolean containsHour(int hour) {
            if (startHour == endHour) {
                return false;
            }
            if (startHour < endHour) {
                return hour >= startHour && hour < endHour;
            }
            return hour >= startHour || hour < endHour;
        }
    }

    record DaysOfWeek(Set<DayOfWeek> days) implements Condition {
        public DaysOfWeek {
            EnumSet<DayOfWeek> copy = EnumSet.noneOf(DayOfWeek.class);
            if (days != null) {
                copy.addAll(days);
            }
            days = Collections.unmodifiableSet(copy);
        }

        @Override
        public ConditionKind kind() {
            return ConditionKind.DAYS_OF_WEEK;
        }

        @Override
        public String describe() {
            return "on " + days.stream()
                    .map(day -> day.getDisplayName(TextStyle.SHORT, Locale.ENGLISH))
                    .collect(Collectors.joining(", "));
        }
    }

    private static String withoutDot(String extension) {
        return extension.startsWith(".") ? extension.substring(1) : extension;
    }
}
