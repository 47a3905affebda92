package me.forma.organizer.domain.model;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimeCategoriesTest {

    private static TemporalContext weekday(int hour) {
        return new TemporalContext(hour, DayOfWeek.TUESDAY, hour >= 9 && hour <= 17);
    }

    private static TemporalContext saturday(int hour) {
        return new TemporalContext(hour, DayOfWeek.SATURDAY, false);
    }

    @Test
    void shouldNeedThreeContexts() {
        assertEquals(TimeCategory.ANY_TIME, TimeCategories.categorize(List.of(weekday(10), weekday(11))));
        assertEquals(TimeCategory.ANY_TIME, TimeCategories.categorize(null));
    }

    @Test
    void shouldRecognizeWorkHours() {
        assertEquals(TimeCategory.WORK_HOURS,
                TimeCategories.categorize(List.of(weekday(9), weekday(13), weekday(17), weekday(20))));
    }

    @Test
    void shouldRecognizeEveningsAndMornings() {
        assertEquals(TimeCategory.EVENINGS,
                TimeCategories.categorize(List.of(weekday(18), weekday(21), weekday(23))));
        assertEquals(TimeCategory.MORNINGS,
                TimeCategories.categorize(List.of(weekday(5), weekday(7), weekday(8), weekday(12), weekday(6))));
    }

    @Test
    void shouldCountWeekendsRegardlessOfHour() {
        assertEquals(TimeCategory.WEEKENDS,
                TimeCategories.categorize(List.of(saturday(10), saturday(21), saturday(7), weekday(10))));
    }

    @Test
    void shouldRequireSixtyPercentRoundedUp() {
        // 3 of 5 reaches the bar, 2 of 4 does not
        assertEquals(TimeCategory.WORK_HOURS, TimeCategories.categorize(
                List.of(weekday(9), weekday(10), weekday(11), weekday(20), weekday(2))));
        assertEquals(TimeCategory.ANY_TIME, TimeCategories.categorize(
                List.of(weekday(9), weekday(10), weekday(20), weekday(2))));
    }
}
