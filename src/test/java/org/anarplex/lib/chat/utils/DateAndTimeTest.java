package org.anarplex.lib.chat.utils;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

import static org.junit.jupiter.api.Assertions.*;

class DateAndTimeTest {

    @Test
    void formatUsesLogPattern() {
        assertEquals("2024-05-01 09:03:07", DateAndTime.format(LocalDateTime.of(2024, 5, 1, 9, 3, 7, 999_000_000)));
    }

    @Test
    void parseReadsWhatFormatWrites() {
        LocalDateTime t = LocalDateTime.of(2023, 12, 31, 23, 59, 58);
        assertEquals(t, DateAndTime.parse(DateAndTime.format(t)));
    }

    @Test
    void nowIsInLogFormat() {
        assertTrue(DateAndTime.now().matches("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}"));
    }

    @Test
    void parseRejectsOtherFormats() {
        assertThrows(DateTimeParseException.class, () -> DateAndTime.parse("2024-05-01T09:03:07"));
    }
}
