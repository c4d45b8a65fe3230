package com.clinic.waitlist.controller;

import com.clinic.waitlist.dto.MatchReport;
import com.clinic.waitlist.dto.MatchReportResponse;
import com.clinic.waitlist.dto.Pairing;
import com.clinic.waitlist.dto.PairingResponse;
import com.clinic.waitlist.dto.PatientResponse;
import com.clinic.waitlist.dto.SlotResponse;
import com.clinic.waitlist.entity.Patient;
import com.clinic.waitlist.entity.Slot;
import com.clinic.waitlist.service.WaitTimeCalculator;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Entity to JSON view mapping; wait times are rendered against one clock reading per response.
 */
@Component
public class WaitlistViews {

    private final WaitTimeCalculator waitTimeCalculator;

    public WaitlistViews(WaitTimeCalculator waitTimeCalculator) {
        this.waitTimeCalculator = waitTimeCalculator;
    }

    public PatientResponse patient(Patient p) {
        Duration wait = waitTimeCalculator.waitTimeOf(p);
        return PatientResponse.from(p, wait, WaitTimeCalculator.format(wait));
    }

    public List<PatientResponse> patients(List<Patient> patients) {
        return patients.stream().map(this::patient).toList();
    }

    public List<SlotResponse> slots(List<Slot> slots) {
        return slots.stream().map(SlotResponse::from).toList();
    }

    public PairingResponse pairing(Pairing pairing) {
        return new PairingResponse(SlotResponse.from(pairing.slot()), patient(pairing.patient()));
    }

    public MatchReportResponse matches(Slot slot, MatchReport report) {
        List<MatchReportResponse.IneligibleEntry> rejected = report.ineligible().stream()
                .map(r -> new MatchReportResponse.IneligibleEntry(
                        patient(r.patient()),
                        r.failed().stream().map(Enum::name).sorted().toList()))
                .toList();
        return new MatchReportResponse(SlotResponse.from(slot), patients(report.eligible()), rejected);
    }
}
