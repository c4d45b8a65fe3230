package com.clinic.waitlist.dto;

public record PairingResponse(SlotResponse slot, PatientResponse patient) {
}
