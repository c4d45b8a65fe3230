package com.clinic.waitlist.service;

import com.clinic.waitlist.entity.Patient;
import com.clinic.waitlist.entity.Slot;
import com.clinic.waitlist.exception.ConflictException;
import com.clinic.waitlist.repository.PatientRepository;
import com.clinic.waitlist.repository.SlotRepository;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Component;

/**
 * Row-lock reads for slots and patients. Must be called inside a transaction; the lock is held
 * until it ends. Callers that lock both take the slot first.
 */
@Component
public class RecordLocks {

    private final SlotRepository slotRepository;
    private final PatientRepository patientRepository;

    public RecordLocks(SlotRepository slotRepository, PatientRepository patientRepository) {
        this.slotRepository = slotRepository;
        this.patientRepository = patientRepository;
    }

    public Slot slot(Long id) {
        try {
            return slotRepository.findByIdForUpdate(id)
                    .orElseThrow(() -> new ConflictException("Slot " + id + " not found"));
        } catch (ConcurrencyFailureException e) {
            throw new ConflictException("Slot " + id + " is being changed by another request", e);
        }
    }

    public Patient patient(Long id) {
        try {
            return patientRepository.findByIdForUpdate(id)
                    .orElseThrow(() -> new ConflictException("Patient " + id + " not found"));
        } catch (ConcurrencyFailureException e) {
            throw new ConflictException("Patient " + id + " is being changed by another request", e);
        }
    }
}
