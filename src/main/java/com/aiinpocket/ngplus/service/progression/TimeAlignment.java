package com.aiinpocket.ngplus.service.progression;

import com.aiinpocket.ngplus.exception.InvalidInputException;
import com.aiinpocket.ngplus.model.enums.CycleCadence;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;

/**
 * 日界線與週期區間計算。早於 {@code dayStartHour} 的時間算前一天。
 */
public final class TimeAlignment {

    private TimeAlignment() {
    }

    /** {@code instant} 所屬的日曆日 */
    public static LocalDate alignedDate(Instant instant, ZoneId zone, int dayStartHour) {
        requireHour(dayStartHour);
        ZonedDateTime local = instant.atZone(zone);
        LocalDate date = local.toLocalDate();
        return local.getHour() < dayStartHour ? date.minusDays(1) : date;
    }

    public static ZonedDateTime dayStart(LocalDate date, ZoneId zone, int dayStartHour) {
        return date.atStartOfDay(zone).withHour(dayStartHour);
    }

    /** 包含 {@code instant} 的對齊日 */
    public static CycleWindow dayWindow(Instant instant, ZoneId zone, int dayStartHour) {
        ZonedDateTime start = dayStart(alignedDate(instant, zone, dayStartHour), zone, dayStartHour);
        return new CycleWindow(start.toInstant(), start.plusDays(1).toInstant());
    }

    /**
     * 包含 {@code now} 的週期區間。
     * CUSTOM 區間從 {@code previousEnd} 接續，連續週期不留空隙；
     * 第一個週期從對齊日開始。
     */
    public static CycleWindow cycleWindow(CycleCadence cadence, int customIntervalDays, Instant now,
                                          Instant previousEnd, ZoneId zone, int dayStartHour) {
        LocalDate day = alignedDate(now, zone, dayStartHour);
        ZonedDateTime start;
        ZonedDateTime end;
        switch (cadence) {
            case DAILY -> {
                start = dayStart(day, zone, dayStartHour);
                end = start.plusDays(1);
            }
            case WEEKLY -> {
                start = dayStart(day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)), zone, dayStartHour);
                end = start.plusWeeks(1);
            }
            case MONTHLY -> {
                start = dayStart(day.withDayOfMonth(1), zone, dayStartHour);
                end = start.plusMonths(1);
            }
            case CUSTOM -> {
                requireInterval(customIntervalDays);
                start = (previousEnd != null && !previousEnd.isAfter(now))
                        ? previousEnd.atZone(zone)
                        : dayStart(day, zone, dayStartHour);
                long behind = Duration.between(start.toInstant(), now).toDays() / customIntervalDays;
                if (behind > 1) {
                    start = start.plusDays((behind - 1) * customIntervalDays);
                }
                end = start.plusDays(customIntervalDays);
                while (!now.isBefore(end.toInstant())) {
                    start = end;
                    end = start.plusDays(customIntervalDays);
                }
            }
            default -> throw new InvalidInputException("Unsupported cadence: " + cadence);
        }
        return new CycleWindow(start.toInstant(), end.toInstant());
    }

    /** 週期名目長度，導航用來判斷「超過一個週期」 */
    public static Duration cadencePeriod(CycleCadence cadence, int customIntervalDays) {
        return switch (cadence) {
            case DAILY -> Duration.ofDays(1);
            case WEEKLY -> Duration.ofDays(7);
            case MONTHLY -> Duration.ofDays(30);
            case CUSTOM -> Duration.ofDays(Math.max(1, customIntervalDays));
        };
    }

    public static void requireHour(int dayStartHour) {
        if (dayStartHour < 0 || dayStartHour > 23) {
            throw new InvalidInputException("Day start hour must be 0-23, got " + dayStartHour);
        }
    }

    public static void requireInterval(int customIntervalDays) {
        if (customIntervalDays < 1) {
            throw new InvalidInputException("Custom interval must be at least 1 day, got " + customIntervalDays);
        }
    }
}
