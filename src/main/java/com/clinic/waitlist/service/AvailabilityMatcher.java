package com.clinic.waitlist.service;

import com.clinic.waitlist.dto.MatchReport;
import com.clinic.waitlist.entity.Patient;
import com.clinic.waitlist.entity.Slot;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides which waiting patients fit an open slot and ranks them.
 * Works on in-memory entities only; loading and locking belong to the callers.
 */
@Component
public class AvailabilityMatcher {

    /** Hard constraints a candidate must all pass. */
    public enum Constraint {
        PROVIDER,
        DURATION,
        APPOINTMENT_TYPE,
        AVAILABILITY,
        STATUS
    }

    private static final Comparator<Long> NULLS_LAST = Comparator.nullsLast(Comparator.naturalOrder());
    private static final Comparator<Slot> SLOT_ORDER = Comparator
            .comparing(Slot::getDate)
            .thenComparing(Slot::getStartTime, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Slot::getPeriod)
            .thenComparing(Slot::getId, NULLS_LAST);

    private final WaitTimeCalculator waitTimeCalculator;

    public AvailabilityMatcher(WaitTimeCalculator waitTimeCalculator) {
        this.waitTimeCalculator = waitTimeCalculator;
    }

    /**
     * Eligible candidates for the slot, highest urgency first, then longest wait, then earliest join.
     */
    public List<Patient> findEligible(Slot slot, Collection<Patient> candidates) {
        Instant now = waitTimeCalculator.now();
        List<Patient> eligible = new ArrayList<>();
        for (Patient p : candidates) {
            if (failedConstraints(slot, p).isEmpty()) eligible.add(p);
        }
        eligible.sort(rankingOrder(eligible, now));
        return eligible;
    }

    /**
     * Eligible list as {@link #findEligible}, plus every rejected waiting candidate with its reasons.
     * Candidates that are not waiting are left out of the rejected list.
     */
    public MatchReport evaluate(Slot slot, Collection<Patient> candidates) {
        Instant now = waitTimeCalculator.now();
        List<Patient> eligible = new ArrayList<>();
        List<MatchReport.Rejection> rejected = new ArrayList<>();
        for (Patient p : candidates) {
            Set<Constraint> failed = failedConstraints(slot, p);
            if (failed.isEmpty()) {
                eligible.add(p);
            } else if (!failed.contains(Constraint.STATUS)) {
                rejected.add(new MatchReport.Rejection(p, failed));
            }
        }
        eligible.sort(rankingOrder(eligible, now));

        Map<Patient, Duration> waits = waitsOf(rejected.stream().map(MatchReport.Rejection::patient).toList(), now);
        rejected.sort(Comparator
                .comparing((MatchReport.Rejection r) -> waits.get(r.patient()), Comparator.reverseOrder())
                .thenComparing(r -> StringUtils.defaultString(r.patient().getName()), String.CASE_INSENSITIVE_ORDER)
                .thenComparing(r -> r.patient().getId(), NULLS_LAST));
        return new MatchReport(eligible, rejected);
    }

    /**
     * Available slots the patient could take, earliest first.
     */
    public List<Slot> findSlotsForPatient(Patient patient, Collection<Slot> slots) {
        return slots.stream()
                .filter(s -> s.getStatus() == Slot.Status.AVAILABLE)
                .filter(s -> failedConstraints(s, patient).isEmpty())
                .sorted(SLOT_ORDER)
                .toList();
    }

    public boolean isEligible(Slot slot, Patient patient) {
        return failedConstraints(slot, patient).isEmpty();
    }

    public Set<Constraint> failedConstraints(Slot slot, Patient patient) {
        Set<Constraint> failed = EnumSet.noneOf(Constraint.class);
        if (!providerMatches(slot, patient)) failed.add(Constraint.PROVIDER);
        if (patient.getDuration() != slot.getDuration()) failed.add(Constraint.DURATION);
        if (!appointmentTypeMatches(slot, patient)) failed.add(Constraint.APPOINTMENT_TYPE);
        if (!availableFor(slot, patient)) failed.add(Constraint.AVAILABILITY);
        if (patient.getStatus() != Patient.Status.WAITING) failed.add(Constraint.STATUS);
        return failed;
    }

    static boolean providerMatches(Slot slot, Patient patient) {
        if (patient.isNoPreference()) return true;
        return StringUtils.equalsIgnoreCase(StringUtils.trim(patient.getProviderPreference()), StringUtils.trim(slot.getProvider()));
    }

    static boolean appointmentTypeMatches(Slot slot, Patient patient) {
        if (StringUtils.isBlank(slot.getAppointmentType())) return true;
        return StringUtils.equalsIgnoreCase(StringUtils.trim(slot.getAppointmentType()), StringUtils.trim(patient.getAppointmentType()));
    }

    /**
     * Empty availability means any time. Otherwise the listed windows are either the only acceptable
     * ones (AVAILABLE) or the excluded ones (UNAVAILABLE).
     */
    static boolean availableFor(Slot slot, Patient patient) {
        if (patient.getAvailability() == null || patient.getAvailability().isEmpty()) return true;
        boolean listed = patient.isAvailableAt(slot.getDayOfWeek(), slot.getPeriod());
        return switch (patient.getAvailabilityMode()) {
            case AVAILABLE -> listed;
            case UNAVAILABLE -> !listed;
        };
    }

    private Comparator<Patient> rankingOrder(List<Patient> patients, Instant now) {
        Map<Patient, Duration> waits = waitsOf(patients, now);
        return Comparator
                .comparing((Patient p) -> p.getUrgency().rank(), Comparator.reverseOrder())
                .thenComparing(waits::get, Comparator.reverseOrder())
                .thenComparing(Patient::getJoinedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(Patient::getId, NULLS_LAST);
    }

    private Map<Patient, Duration> waitsOf(List<Patient> patients, Instant now) {
        Map<Patient, Duration> waits = new HashMap<>();
        for (Patient p : patients) waits.put(p, waitTimeCalculator.waitTimeOf(p, now));
        return waits;
    }
}
