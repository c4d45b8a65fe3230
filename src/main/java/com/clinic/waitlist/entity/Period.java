package com.clinic.waitlist.entity;

import java.time.LocalTime;

/** Half-day bucket used both by slots and by patient availability. */
public enum Period {
    AM,
    PM;

    public static Period of(LocalTime time) {
        return time.getHour() >= 12 ? PM : AM;
    }
}
