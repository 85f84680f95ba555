package com.calendarreg.api.integration;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Map;

/**
 * Parses exam slots published by the registrar, e.g. {@code "31 มี.ค. 2569 เวลา 13:00 - 16:00"}.
 * Years are Buddhist era (CE + 543) and months use the Thai abbreviations.
 */
public final class ThaiExamDateParser {

    public static final int BUDDHIST_ERA_OFFSET = 543;

    private static final String TIME_SEPARATOR = " เวลา ";

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("ม.ค.", 1),
            Map.entry("ก.พ.", 2),
            Map.entry("มี.ค.", 3),
            Map.entry("เม.ย.", 4),
            Map.entry("พ.ค.", 5),
            Map.entry("มิ.ย.", 6),
            Map.entry("ก.ค.", 7),
            Map.entry("ส.ค.", 8),
            Map.entry("ก.ย.", 9),
            Map.entry("ต.ค.", 10),
            Map.entry("พ.ย.", 11),
            Map.entry("ธ.ค.", 12)
    );

    private ThaiExamDateParser() {}

    public record ExamPeriod(LocalDateTime start, LocalDateTime end) {}

    /**
     * @throws IllegalArgumentException when the text does not follow the registrar format
     */
    public static ExamPeriod parse(String text) {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("exam date is empty");
        String[] parts = text.trim().split(TIME_SEPARATOR);
        if (parts.length != 2) {
            throw new IllegalArgumentException("missing '" + TIME_SEPARATOR.trim() + "' separator: " + text);
        }

        String[] dateFields = parts[0].trim().split("\\s+");
        if (dateFields.length != 3) throw new IllegalArgumentException("invalid date part: " + parts[0]);
        int day = parseNumber(dateFields[0], "day");
        Integer month = MONTHS.get(dateFields[1]);
        if (month == null) throw new IllegalArgumentException("unknown month: " + dateFields[1]);
        int year = parseNumber(dateFields[2], "year") - BUDDHIST_ERA_OFFSET;

        String[] times = parts[1].split("-");
        if (times.length != 2) throw new IllegalArgumentException("invalid time range: " + parts[1]);

        LocalDate date;
        LocalTime start;
        LocalTime end;
        try {
            date = LocalDate.of(year, month, day);
            start = LocalTime.parse(times[0].trim());
            end = LocalTime.parse(times[1].trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("invalid exam date '" + text + "': " + e.getMessage(), e);
        }
        return new ExamPeriod(date.atTime(start), date.atTime(end));
    }

    /** Thai month abbreviation to month number, or 0 when unknown. */
    public static int monthOf(String abbreviation) {
        return MONTHS.getOrDefault(abbreviation, 0);
    }

    private static int parseNumber(String s, String what) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + what + ": " + s, e);
        }
    }
}
