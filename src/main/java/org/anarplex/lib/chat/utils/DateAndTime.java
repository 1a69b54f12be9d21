package org.anarplex.lib.chat.utils;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

public class DateAndTime {

    private static final DateTimeFormatter LOG_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private DateAndTime() {
    }

    /**
     * Format the supplied dateTime into a String of form "yyyy-MM-dd HH:mm:ss" (local time), the form used for every
     * timestamp written to the chat logs and group info files.
     */
    public static String format(LocalDateTime dateTime) {
        return LOG_FORMAT.format(dateTime);
    }

    /**
     * Current local time in log format.
     */
    public static String now() {
        return format(LocalDateTime.now());
    }

    /**
     * Parses a timestamp in log format "yyyy-MM-dd HH:mm:ss"
     */
    public static LocalDateTime parse(String timestamp) throws DateTimeParseException {
        return LocalDateTime.parse(timestamp, LOG_FORMAT);
    }
}
