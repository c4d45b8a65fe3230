package com.clinic.waitlist.service;

import com.clinic.waitlist.entity.Patient;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Elapsed time on the waitlist. Stateless apart from the injected clock.
 */
@Component
public class WaitTimeCalculator {

    private final Clock clock;

    public WaitTimeCalculator(Clock clock) {
        this.clock = clock;
    }

    /**
     * {@code now - joinedAt}, never negative.
     */
    public static Duration computeWaitTime(Instant joinedAt, Instant now) {
        if (joinedAt == null || now == null) return Duration.ZERO;
        Duration d = Duration.between(joinedAt, now);
        return d.isNegative() ? Duration.ZERO : d;
    }

    /**
     * Wait time of the patient as of the injected clock. Frozen at {@code waitFrozenAt} once the
     * patient is no longer waiting.
     */
    public Duration waitTimeOf(Patient patient) {
        return waitTimeOf(patient, clock.instant());
    }

    public Duration waitTimeOf(Patient patient, Instant now) {
        Instant end = patient.getWaitFrozenAt() != null ? patient.getWaitFrozenAt() : now;
        return computeWaitTime(patient.getJoinedAt(), end);
    }

    public Instant now() {
        return clock.instant();
    }

    public String describe(Patient patient) {
        return format(waitTimeOf(patient));
    }

    /**
     * Renders e.g. "5 days, 3 hours" or "1 hour". Minutes only appear for waits under an hour.
     */
    public static String format(Duration wait) {
        if (wait == null || wait.isNegative()) wait = Duration.ZERO;
        long days = wait.toDays();
        long hours = wait.toHoursPart();
        long minutes = wait.toMinutesPart();

        List<String> parts = new ArrayList<>(2);
        if (days > 0) parts.add(plural(days, "day"));
        if (hours > 0) parts.add(plural(hours, "hour"));
        if (parts.isEmpty()) parts.add(plural(minutes, "minute"));
        return String.join(", ", parts);
    }

    private static String plural(long n, String unit) {
        return n + " " + unit + (n == 1 ? "" : "s");
    }
}
