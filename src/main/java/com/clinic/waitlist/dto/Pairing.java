package com.clinic.waitlist.dto;

import com.clinic.waitlist.entity.Patient;
import com.clinic.waitlist.entity.Slot;

/**
 * Both sides of a slot/patient pairing as committed by one transition.
 */
public record Pairing(Slot slot, Patient patient) {
}
