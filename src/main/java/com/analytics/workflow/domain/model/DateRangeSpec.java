package com.analytics.workflow.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Declarative date range of a workflow.
 * 
 * Tagged by {@link #type}; only the fields of that variant are read:
 * - rolling: offsetDays (0 = today, 1 = yesterday)
 * - relative: days (last N days)
 * - absolute: since / until (inclusive, YYYY-MM-DD)
 * 
 * Kept as raw values so a malformed spec can be reported by the resolver
 * instead of failing during JSON binding.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DateRangeSpec {
    
    private DateRangeType type;
    private Integer offsetDays;
    private Integer days;
    private String since;
    private String until;
    
    public static DateRangeSpec rolling(int offsetDays) {
        return DateRangeSpec.builder().type(DateRangeType.ROLLING).offsetDays(offsetDays).build();
    }
    
    public static DateRangeSpec relative(int days) {
        return DateRangeSpec.builder().type(DateRangeType.RELATIVE).days(days).build();
    }
    
    public static DateRangeSpec absolute(String since, String until) {
        return DateRangeSpec.builder().type(DateRangeType.ABSOLUTE).since(since).until(until).build();
    }
}
