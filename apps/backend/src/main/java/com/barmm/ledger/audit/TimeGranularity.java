package com.barmm.ledger.audit;

import com.barmm.ledger.error.ValidationException;

import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * 时间线分桶粒度；周从周一开始。
 */
public enum TimeGranularity {
    HOUR,
    DAY,
    WEEK,
    MONTH;

    public ZonedDateTime bucketStart(ZonedDateTime t) {
        return switch (this) {
            case HOUR -> t.truncatedTo(ChronoUnit.HOURS);
            case DAY -> t.truncatedTo(ChronoUnit.DAYS);
            case WEEK -> t.truncatedTo(ChronoUnit.DAYS).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH -> t.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1);
        };
    }

    public static TimeGranularity parse(String value) {
        if (value == null || value.isBlank()) return DAY;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("granularity must be one of hour, day, week, month");
        }
    }
}
