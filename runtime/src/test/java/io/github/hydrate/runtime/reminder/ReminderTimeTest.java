package io.github.hydrate.runtime.reminder;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReminderTimeTest {

    @Test
    void parsesPaddedAndUnpaddedTimes() {
        assertThat(ReminderTime.parse("08:05")).contains(new ReminderTime(8, 5));
        assertThat(ReminderTime.parse("8:05")).contains(new ReminderTime(8, 5));
        assertThat(ReminderTime.parse(" 23:59 ")).contains(new ReminderTime(23, 59));
    }

    @Test
    void rejectsOutOfRangeAndGarbage() {
        assertThat(ReminderTime.parse("24:00")).isEmpty();
        assertThat(ReminderTime.parse("12:60")).isEmpty();
        assertThat(ReminderTime.parse("12")).isEmpty();
        assertThat(ReminderTime.parse("12:00:00")).isEmpty();
        assertThat(ReminderTime.parse("ab:cd")).isEmpty();
        assertThat(ReminderTime.parse(null)).isEmpty();
    }

    @Test
    void printsZeroPadded() {
        assertThat(new ReminderTime(7, 3)).hasToString("07:03");
    }
}
