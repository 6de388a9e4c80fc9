/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Parses the text output of the {@code date}, {@code time}, {@code timestamp} and {@code timestamptz} types in the
 * server's ISO {@code DateStyle}.
 * <p>
 * Besides the common forms this accepts years with more than four digits, the {@code BC} era suffix, the time
 * {@code 24:00:00} and offsets with seconds such as {@code +00:19:32}.
 */
final class PgTemporalParser {

    static final String POSITIVE_INFINITY = "infinity";
    static final String NEGATIVE_INFINITY = "-infinity";

    private static final class Parsed {
        boolean hasDate;
        boolean hasTime;
        boolean bc;
        int year;
        int month;
        int day;
        int hour;
        int minute;
        int second;
        int nanos;
        ZoneOffset offset;
    }

    private PgTemporalParser() {
    }

    static LocalDate toLocalDate(String text) {
        switch (text) {
            case POSITIVE_INFINITY:
                return LocalDate.MAX;
            case NEGATIVE_INFINITY:
                return LocalDate.MIN;
            default:
                Parsed parsed = parse(text);
                require(parsed.hasDate && !parsed.hasTime && parsed.offset == null, text, "date");
                return date(parsed);
        }
    }

    static LocalTime toLocalTime(String text) {
        Parsed parsed = parse(text);
        require(parsed.hasTime && !parsed.hasDate && parsed.offset == null, text, "time");
        if (isEndOfDay(parsed)) {
            return LocalTime.MAX;
        }
        return LocalTime.of(parsed.hour, parsed.minute, parsed.second, parsed.nanos);
    }

    static LocalDateTime toLocalDateTime(String text) {
        switch (text) {
            case POSITIVE_INFINITY:
                return LocalDateTime.MAX;
            case NEGATIVE_INFINITY:
                return LocalDateTime.MIN;
            default:
                Parsed parsed = parse(text);
                require(parsed.hasDate && parsed.hasTime && parsed.offset == null, text, "timestamp");
                return dateTime(parsed);
        }
    }

    static OffsetDateTime toOffsetDateTime(String text) {
        switch (text) {
            case POSITIVE_INFINITY:
                return OffsetDateTime.MAX;
            case NEGATIVE_INFINITY:
                return OffsetDateTime.MIN;
            default:
                Parsed parsed = parse(text);
                require(parsed.hasDate && parsed.hasTime && parsed.offset != null, text, "timestamptz");
                return OffsetDateTime.of(dateTime(parsed), parsed.offset);
        }
    }

    private static LocalDate date(Parsed parsed) {
        // year 1 BC is year 0 of the proleptic calendar
        int year = parsed.bc ? 1 - parsed.year : parsed.year;
        return LocalDate.of(year, parsed.month, parsed.day);
    }

    private static LocalDateTime dateTime(Parsed parsed) {
        if (isEndOfDay(parsed)) {
            return date(parsed).plusDays(1).atStartOfDay();
        }
        return LocalDateTime.of(date(parsed), LocalTime.of(parsed.hour, parsed.minute, parsed.second, parsed.nanos));
    }

    private static boolean isEndOfDay(Parsed parsed) {
        return parsed.hour == 24 && parsed.minute == 0 && parsed.second == 0 && parsed.nanos == 0;
    }

    private static void require(boolean condition, String text, String typeName) {
        if (!condition) {
            throw new IllegalArgumentException("'" + text + "' is not a valid " + typeName + " value");
        }
    }

    /**
     * Reads, in order and each optional: {@code y-m-d}, {@code h:m:s[.f]}, an offset {@code ±h[:m[:s]]} and an era.
     */
    private static Parsed parse(String text) {
        final char[] s = text.toCharArray();
        final Parsed result = new Parsed();

        int start = skipWhitespace(s, 0);
        int end = firstNonDigit(s, start);

        if (charAt(s, end) == '-') {
            result.hasDate = true;
            result.year = number(s, start, end);
            start = end + 1;

            end = firstNonDigit(s, start);
            result.month = number(s, start, end);
            expect(s, end, '-');
            start = end + 1;

            end = firstNonDigit(s, start);
            result.day = number(s, start, end);
            start = skipWhitespace(s, end);
        }

        if (Character.isDigit(charAt(s, start))) {
            result.hasTime = true;

            end = firstNonDigit(s, start);
            result.hour = number(s, start, end);
            expect(s, end, ':');
            start = end + 1;

            end = firstNonDigit(s, start);
            result.minute = number(s, start, end);
            expect(s, end, ':');
            start = end + 1;

            end = firstNonDigit(s, start);
            result.second = number(s, start, end);
            start = end;

            if (charAt(s, start) == '.') {
                end = firstNonDigit(s, start + 1);
                if (end - (start + 1) > 9) {
                    throw new IllegalArgumentException("too many fractional digits");
                }
                int nanos = number(s, start + 1, end);
                for (int digits = end - (start + 1); digits < 9; ++digits) {
                    nanos *= 10;
                }
                result.nanos = nanos;
                start = end;
            }
            start = skipWhitespace(s, start);
        }

        char sign = charAt(s, start);
        if (result.hasTime && (sign == '+' || sign == '-')) {
            end = firstNonDigit(s, start + 1);
            int hours = number(s, start + 1, end);
            start = end;
            int minutes = 0;
            int seconds = 0;
            if (charAt(s, start) == ':') {
                end = firstNonDigit(s, start + 1);
                minutes = number(s, start + 1, end);
                start = end;
            }
            if (charAt(s, start) == ':') {
                end = firstNonDigit(s, start + 1);
                seconds = number(s, start + 1, end);
                start = end;
            }
            result.offset = sign == '-'
                    ? ZoneOffset.ofHoursMinutesSeconds(-hours, -minutes, -seconds)
                    : ZoneOffset.ofHoursMinutesSeconds(hours, minutes, seconds);
            start = skipWhitespace(s, start);
        }

        if (result.hasDate && start < s.length) {
            String era = new String(s, start, s.length - start);
            if (era.startsWith("BC")) {
                result.bc = true;
                start += 2;
            }
            else if (era.startsWith("AD")) {
                start += 2;
            }
        }

        if (start < s.length) {
            throw new IllegalArgumentException("trailing text '" + new String(s, start, s.length - start) + "'");
        }
        if (!result.hasDate && !result.hasTime) {
            throw new IllegalArgumentException("neither date nor time");
        }
        return result;
    }

    private static void expect(char[] s, int pos, char expected) {
        char actual = charAt(s, pos);
        if (actual != expected) {
            throw new IllegalArgumentException("expected '" + expected + "' at index " + pos);
        }
    }

    private static int skipWhitespace(char[] s, int start) {
        int pos = start;
        while (pos < s.length && Character.isWhitespace(s[pos])) {
            pos++;
        }
        return pos;
    }

    private static int firstNonDigit(char[] s, int start) {
        int pos = start;
        while (pos < s.length && Character.isDigit(s[pos])) {
            pos++;
        }
        return pos;
    }

    private static char charAt(char[] s, int pos) {
        return pos >= 0 && pos < s.length ? s[pos] : '\0';
    }

    private static int number(char[] s, int start, int end) {
        if (start >= end) {
            throw new IllegalArgumentException("expected a number at index " + start);
        }
        return Integer.parseInt(new String(s, start, end - start));
    }
}
