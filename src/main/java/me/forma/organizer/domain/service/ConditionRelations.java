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
import me.forma.organizer.domain.model.ConditionRelation;
import me.forma.organizer.domain.model.FileKind;

import java.text.Normalizer;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Decides how two conditions, or two condition sets, relate in terms of the
 * files they match. Relations are always stated from the first argument's
 * point of view.
 */
public final class ConditionRelations {

    /**
     * Relation assumed between conditions of different kinds. Nothing is known
     * about how, say, an extension test and a size test intersect, so they are
     * taken to possibly co-match.
     */
    public static final ConditionRelation CROSS_KIND_FALLBACK = ConditionRelation.PARTIAL;

    private ConditionRelations() {
    }

    // ===== Condition sets =====

    /**
     * Relation between two condition sets under their combinators.
     */
    public static ConditionRelation compare(List<Condition> first, Combinator firstCombinator,
            List<Condition> second, Combinator secondCombinator) {
        List<Condition> left = distinct(first);
        List<Condition> right = distinct(second);
        if (left.isEmpty() || right.isEmpty()) {
            return ConditionRelation.NONE;
        }
        if (left.size() == 1 && right.size() == 1) {
            return compare(left.get(0), right.get(0));
        }

        boolean leftInRight = containsAll(right, left);
        boolean rightInLeft = containsAll(left, right);
        if (leftInRight && rightInLeft
                && (left.size() == 1 || combinatorOf(left, firstCombinator) == combinatorOf(right, secondCombinator))) {
            return ConditionRelation.IDENTICAL;
        }

        if (conjunctive(left, firstCombinator) && conjunctive(right, secondCombinator)) {
            if (leftInRight && left.size() < right.size()) {
                return ConditionRelation.SUPERSET;
            }
            if (rightInLeft && right.size() < left.size()) {
                return ConditionRelation.SUBSET;
            }
        } else if (disjunctive(left, firstCombinator) && disjunctive(right, secondCombinator)) {
            if (leftInRight && left.size() < right.size()) {
                return ConditionRelation.SUBSET;
            }
            if (rightInLeft && right.size() < left.size()) {
                return ConditionRelation.SUPERSET;
            }
        }

        for (Condition a : left) {
            for (Condition b : right) {
                if (compare(a, b) != ConditionRelation.NONE) {
                    return ConditionRelation.PARTIAL;
                }
            }
        }
        return ConditionRelation.NONE;
    }

    // ===== Single conditions =====

    public static ConditionRelation compare(Condition first, Condition second) {
        if (first == null || second == null) {
            return ConditionRelation.NONE;
        }
        if (first.kind() != second.kind()) {
            return CROSS_KIND_FALLBACK;
        }
        return switch (first.kind()) {
            case EXTENSION_EQUALS -> equality(
                    extension(((Condition.ExtensionEquals) first).extension()),
                    extension(((Condition.ExtensionEquals) second).extension()));
            case NAME_CONTAINS -> containment(
                    text(((Condition.NameContains) first).text()),
                    text(((Condition.NameContains) second).text()),
                    (a, b) -> a.contains(b));
            case NAME_STARTS_WITH -> containment(
                    text(((Condition.NameStartsWith) first).text()),
                    text(((Condition.NameStartsWith) second).text()),
                    (a, b) -> a.startsWith(b));
            case NAME_ENDS_WITH -> containment(
                    text(((Condition.NameEndsWith) first).text()),
                    text(((Condition.NameEndsWith) second).text()),
                    (a, b) -> a.endsWith(b));
            case OLDER_THAN -> olderThan((Condition.OlderThan) first, (Condition.OlderThan) second);
            case MODIFIED_OLDER_THAN -> bound(((Condition.ModifiedOlderThan) first).days(),
                    ((Condition.ModifiedOlderThan) second).days());
            case ACCESSED_OLDER_THAN -> bound(((Condition.AccessedOlderThan) first).days(),
                    ((Condition.AccessedOlderThan) second).days());
            case LARGER_THAN -> bound(((Condition.LargerThan) first).bytes(),
                    ((Condition.LargerThan) second).bytes());
            case KIND_EQUALS -> kinds((Condition.KindEquals) first, (Condition.KindEquals) second);
            case FROM_LOCATION -> equality(((Condition.FromLocation) first).location(),
                    ((Condition.FromLocation) second).location());
            case NEGATED -> first.equals(second) ? ConditionRelation.IDENTICAL : CROSS_KIND_FALLBACK;
            case TIME_OF_DAY -> sets(hours((Condition.TimeOfDay) first), hours((Condition.TimeOfDay) second));
            case DAYS_OF_WEEK -> sets(daySet(((Condition.DaysOfWeek) first).days()),
                    daySet(((Condition.DaysOfWeek) second).days()));
        };
    }

    /**
     * Whether two conditions are interchangeable for overlap purposes.
     */
    public static boolean equivalent(Condition first, Condition second) {
        return compare(first, second) == ConditionRelation.IDENTICAL;
    }

    private static ConditionRelation equality(Object first, Object second) {
        return Objects.equals(first, second) ? ConditionRelation.IDENTICAL : ConditionRelation.NONE;
    }

    private interface TextMatch {
        boolean narrows(String candidate, String other);
    }

    private static ConditionRelation containment(String first, String second, TextMatch narrows) {
        if (first.equals(second)) {
            return ConditionRelation.IDENTICAL;
        }
        if (narrows.narrows(first, second)) {
            return ConditionRelation.SUBSET;
        }
        if (narrows.narrows(second, first)) {
            return ConditionRelation.SUPERSET;
        }
        return ConditionRelation.NONE;
    }

    private static ConditionRelation olderThan(Condition.OlderThan first, Condition.OlderThan second) {
        if (!Objects.equals(extension(first.extensionFilter()), extension(second.extensionFilter()))) {
            return ConditionRelation.NONE;
        }
        return bound(first.days(), second.days());
    }

    /**
     * Lower bounds: the larger bound matches fewer files.
     */
    private static ConditionRelation bound(long first, long second) {
        if (first == second) {
            return ConditionRelation.IDENTICAL;
        }
        return first > second ? ConditionRelation.SUBSET : ConditionRelation.SUPERSET;
    }

    private static ConditionRelation kinds(Condition.KindEquals first, Condition.KindEquals second) {
        Object a = FileKind.fromName(first.kindName()).map(Object.class::cast).orElse(text(first.kindName()));
        Object b = FileKind.fromName(second.kindName()).map(Object.class::cast).orElse(text(second.kindName()));
        return equality(a, b);
    }

    private static <T extends Comparable<T>> ConditionRelation sets(Set<T> first, Set<T> second) {
        if (first.isEmpty() || second.isEmpty()) {
            return ConditionRelation.NONE;
        }
        if (first.equals(second)) {
            return ConditionRelation.IDENTICAL;
        }
        if (second.containsAll(first)) {
            return ConditionRelation.SUBSET;
        }
        if (first.containsAll(second)) {
            return ConditionRelation.SUPERSET;
        }
        Set<T> shared = new TreeSet<>(first);
        shared.retainAll(second);
        return shared.isEmpty() ? ConditionRelation.NONE : ConditionRelation.PARTIAL;
    }

    private static Set<Integer> hours(Condition.TimeOfDay window) {
        Set<Integer> hours = new TreeSet<>();
        for (int hour = 0; hour < 24; hour++) {
            if (window.containsHour(hour)) {
                hours.add(hour);
            }
        }
        return hours;
    }

    private static Set<DayOfWeek> daySet(Set<DayOfWeek> days) {
        return days.isEmpty() ? EnumSet.noneOf(DayOfWeek.class) : EnumSet.copyOf(days);
    }

    // ===== Helpers =====

    private static List<Condition> distinct(List<Condition> conditions) {
        List<Condition> result = new ArrayList<>();
        if (conditions == null) {
            return result;
        }
        for (Condition condition : conditions) {
            if (condition != null && result.stream().noneMatch(existing -> equivalent(existing, condition))) {
                result.add(condition);
            }
        }
        return result;
    }

    private static boolean containsAll(List<Condition> container, List<Condition> contained) {
        return contained.stream()
                .allMatch(condition -> container.stream().anyMatch(other -> equivalent(other, condition)));
    }

    private static Combinator combinatorOf(List<Condition> conditions, Combinator combinator) {
        if (conditions.size() == 1 || combinator == null) {
            return Combinator.SINGLE;
        }
        return combinator;
    }

    private static boolean conjunctive(List<Condition> conditions, Combinator combinator) {
        return conditions.size() == 1 || combinator == Combinator.AND;
    }

    private static boolean disjunctive(List<Condition> conditions, Combinator combinator) {
        return conditions.size() == 1 || combinator == Combinator.OR;
    }

    private static String extension(String value) {
        if (value == null) {
            return "";
        }
        String normalized = text(value);
        return normalized.startsWith(".") ? normalized.substring(1) : normalized;
    }

    private static String text(String value) {
        if (value == null) {
            return "";
        }
        return Normalizer.normalize(value, Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
    }
}
