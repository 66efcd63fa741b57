package com.deepansh.memory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Structured recurrence, e.g. {frequency: WEEKLY, dayOfWeek: MONDAY}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Recurrence {

    /** DAILY | WEEKLY | MONTHLY | YEARLY */
    private String frequency;

    @Builder.Default
    private int interval = 1;

    private String dayOfWeek;

    private Integer dayOfMonth;

    private Instant until;
}
