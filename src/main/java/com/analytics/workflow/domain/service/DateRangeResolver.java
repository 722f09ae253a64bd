package com.analytics.workflow.domain.service;

import com.analytics.workflow.config.WorkflowEngineProperties;
import com.analytics.workflow.domain.exception.ValidationException;
import com.analytics.workflow.domain.model.DateRangeSpec;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a declarative {@link DateRangeSpec} into the ordered list of
 * calendar days to process.
 * 
 * Resolution rules (all days in the operating timezone):
 * - rolling{offsetDays}: the single day today - offsetDays
 * - relative{days}: the last N days ending at yesterday, or at today when
 *   relative-includes-today is set
 * - absolute{since, until}: every day from since to until, inclusive
 * 
 * The result is never empty, strictly ascending and gap-free, and holds at
 * most max-range-days days. Anything that cannot satisfy that raises
 * ValidationException.
 */
@Component
public class DateRangeResolver {
    
    private final Clock clock;
    private final ZoneId zone;
    private final boolean relativeIncludesToday;
    private final int maxRangeDays;
    
    @Autowired
    public DateRangeResolver(Clock clock, WorkflowEngineProperties properties) {
        this(clock, ZoneId.of(properties.getZone()), properties.isRelativeIncludesToday(),
                properties.getMaxRangeDays());
    }
    
    public DateRangeResolver(Clock clock, ZoneId zone, boolean relativeIncludesToday) {
        this(clock, zone, relativeIncludesToday, WorkflowEngineProperties.DEFAULT_MAX_RANGE_DAYS);
    }
    
    public DateRangeResolver(Clock clock, ZoneId zone, boolean relativeIncludesToday, int maxRangeDays) {
        this.clock = clock;
        this.zone = zone;
        this.relativeIncludesToday = relativeIncludesToday;
        this.maxRangeDays = maxRangeDays;
    }
    
    /**
     * Current calendar day in the operating timezone.
     */
    public LocalDate today() {
        return LocalDate.now(clock.withZone(zone));
    }
    
    public List<LocalDate> resolve(DateRangeSpec spec) {
        return resolve(spec, today());
    }
    
    /**
     * Resolves against an explicit "today"; same input, same output.
     */
    public List<LocalDate> resolve(DateRangeSpec spec, LocalDate today) {
        if (spec == null || spec.getType() == null) {
            throw new ValidationException("Date range type is required");
        }
        
        switch (spec.getType()) {
            case ROLLING:
                return resolveRolling(spec, today);
            case RELATIVE:
                return resolveRelative(spec, today);
            case ABSOLUTE:
                return resolveAbsolute(spec);
            default:
                throw new ValidationException("Unsupported date range type: " + spec.getType());
        }
    }
    
    private List<LocalDate> resolveRolling(DateRangeSpec spec, LocalDate today) {
        Integer offsetDays = spec.getOffsetDays();
        if (offsetDays == null) {
            throw new ValidationException("rolling date range requires offsetDays");
        }
        if (offsetDays < 0) {
            throw new ValidationException("rolling offsetDays must be >= 0, got " + offsetDays);
        }
        return List.of(today.minusDays(offsetDays));
    }
    
    private List<LocalDate> resolveRelative(DateRangeSpec spec, LocalDate today) {
        Integer days = spec.getDays();
        if (days == null) {
            throw new ValidationException("relative date range requires days");
        }
        if (days < 1) {
            throw new ValidationException("relative days must be >= 1, got " + days);
        }
        if (days > maxRangeDays) {
            throw new ValidationException(
                    String.format("relative days must be <= %d, got %d", maxRangeDays, days));
        }
        LocalDate until = relativeIncludesToday ? today : today.minusDays(1);
        LocalDate since = until.minusDays(days - 1L);
        return daysBetween(since, until);
    }
    
    private List<LocalDate> resolveAbsolute(DateRangeSpec spec) {
        LocalDate since = parseDay("since", spec.getSince());
        LocalDate until = parseDay("until", spec.getUntil());
        if (since.isAfter(until)) {
            throw new ValidationException(
                    String.format("absolute date range since (%s) is after until (%s)", since, until));
        }
        long span = ChronoUnit.DAYS.between(since, until) + 1;
        if (span > maxRangeDays) {
            throw new ValidationException(
                    String.format("absolute date range spans %d days, at most %d allowed", span, maxRangeDays));
        }
        return daysBetween(since, until);
    }
    
    static List<LocalDate> daysBetween(LocalDate since, LocalDate until) {
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate day = since; !day.isAfter(until); day = day.plusDays(1)) {
            days.add(day);
        }
        return days;
    }
    
    private LocalDate parseDay(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("absolute date range requires " + field);
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException(
                    String.format("absolute date range %s is not a valid YYYY-MM-DD date: %s", field, value), e);
        }
    }
}
