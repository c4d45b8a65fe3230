package com.clinic.waitlist.dto;

import com.clinic.waitlist.entity.Patient;
import com.clinic.waitlist.service.AvailabilityMatcher;

import java.util.List;
import java.util.Set;

/**
 * Outcome of evaluating one open slot against the waiting patients.
 *
 * @param eligible   ranked for presentation; the caller may pick any entry
 * @param ineligible longest wait first, each with the constraints it failed
 */
public record MatchReport(List<Patient> eligible, List<Rejection> ineligible) {

    public MatchReport {
        eligible = List.copyOf(eligible);
        ineligible = List.copyOf(ineligible);
    }

    public record Rejection(Patient patient, Set<AvailabilityMatcher.Constraint> failed) {
        public Rejection {
            failed = Set.copyOf(failed);
        }
    }
}
