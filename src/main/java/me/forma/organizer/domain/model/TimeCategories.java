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

import java.util.List;

/**
 * Buckets a pattern's occurrence times into a {@link TimeCategory}.
 */
public final class TimeCategories {

    static final int MIN_CONTEXTS = 3;
    static final double DOMINANCE_RATIO = 0.6;

    private TimeCategories() {
    }

    /**
     * Returns the first bucket (work hours, evenings, mornings, weekends) that
     * holds at least 60% of the contexts; {@link TimeCategory#ANY_TIME} when
     * none does or fewer than three contexts are known.
     */
    public static TimeCategory categorize(List<TemporalContext> contexts) {
        if (contexts == null || contexts.size() < MIN_CONTEXTS) {
            return TimeCategory.ANY_TIME;
        }
        int workHours = 0;
        int evenings = 0;
        int mornings = 0;
        int weekends = 0;
        for (TemporalContext context : contexts) {
            if (context.isWeekend()) {
                weekends++;
            } else if (context.workHours()) {
                workHours++;
            } else if (context.hourOfDay() >= 18 && context.hourOfDay() <= 23) {
                evenings++;
            } else if (context.hourOfDay() >= 5 && context.hourOfDay() <= 8) {
                mornings++;
            }
        }
        int threshold = (int) Math.ceil(contexts.size() * DOMINANCE_RATIO);
        if (workHours >= threshold) {
            return TimeCategory.WORK_HOURS;
        } else if (evenings >= threshold) {
            return TimeCategory.EVENINGS;
        } else if (mornings >= threshold) {
            return TimeCategory.MORNINGS;
        } else if (weekends >= threshold) {
            return TimeCategory.WEEKENDS;
        }
        return TimeCategory.ANY_TIME;
    }
}
