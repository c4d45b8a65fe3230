package com.clinic.waitlist.dto;

import java.util.List;

public record MatchReportResponse(SlotResponse slot, List<PatientResponse> eligible, List<IneligibleEntry> ineligible) {

    public record IneligibleEntry(PatientResponse patient, List<String> failed) {
    }
}
