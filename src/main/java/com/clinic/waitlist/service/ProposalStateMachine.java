package com.clinic.waitlist.service;

import com.clinic.waitlist.dto.Pairing;
import com.clinic.waitlist.entity.Patient;
import com.clinic.waitlist.entity.Slot;
import com.clinic.waitlist.exception.ConflictException;
import com.clinic.waitlist.exception.ValidationException;
import com.clinic.waitlist.repository.PatientRepository;
import com.clinic.waitlist.repository.SlotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Objects;

/**
 * Propose / confirm / cancel for a (slot, patient) pair.
 * <p>
 * Each transition is one transaction: both rows are re-read under a write lock (slot first, then
 * patient), the preconditions are checked against what was just read, and both sides are written
 * and flushed together. A failed check throws {@link ConflictException} and nothing is written.
 */
@Service
public class ProposalStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ProposalStateMachine.class);

    private final SlotRepository slotRepository;
    private final PatientRepository patientRepository;
    private final RecordLocks locks;
    private final Clock clock;

    public ProposalStateMachine(SlotRepository slotRepository,
                                PatientRepository patientRepository,
                                RecordLocks locks,
                                Clock clock) {
        this.slotRepository = slotRepository;
        this.patientRepository = patientRepository;
        this.locks = locks;
        this.clock = clock;
    }

    @Transactional
    public Pairing propose(Long slotId, Long patientId) {
        requireIds(slotId, patientId);
        Slot slot = locks.slot(slotId);
        Patient patient = locks.patient(patientId);

        if (slot.getStatus() != Slot.Status.AVAILABLE) {
            throw reject("propose", slotId, patientId,
                    "Slot " + slotId + " is " + slot.getStatus() + ", expected AVAILABLE");
        }
        if (patient.getStatus() != Patient.Status.WAITING) {
            throw reject("propose", slotId, patientId,
                    "Patient " + patientId + " is " + patient.getStatus() + ", expected WAITING");
        }

        slot.markPending(patientId);
        patient.markPending(slotId, clock.instant());
        Pairing pairing = write(slot, patient);
        log.info("Proposed slot {} ({} {} {}) to patient {}", slotId, slot.getProvider(), slot.getDate(), slot.getPeriod(), patientId);
        return pairing;
    }

    @Transactional
    public Pairing confirm(Long slotId, Long patientId) {
        requireIds(slotId, patientId);
        Slot slot = locks.slot(slotId);
        Patient patient = locks.patient(patientId);
        requireProposed("confirm", slot, patient);

        slot.markConfirmed();
        patient.markConfirmed(clock.instant());
        Pairing pairing = write(slot, patient);
        log.info("Confirmed slot {} for patient {}", slotId, patientId);
        return pairing;
    }

    @Transactional
    public Pairing cancel(Long slotId, Long patientId) {
        requireIds(slotId, patientId);
        Slot slot = locks.slot(slotId);
        Patient patient = locks.patient(patientId);
        requireProposed("cancel", slot, patient);

        slot.markAvailable();
        patient.markWaiting();
        Pairing pairing = write(slot, patient);
        log.info("Cancelled proposal of slot {} to patient {}", slotId, patientId);
        return pairing;
    }

    private void requireProposed(String op, Slot slot, Patient patient) {
        Long slotId = slot.getId();
        Long patientId = patient.getId();
        if (slot.getStatus() != Slot.Status.PENDING) {
            throw reject(op, slotId, patientId, "Slot " + slotId + " is " + slot.getStatus() + ", not pending");
        }
        if (patient.getStatus() != Patient.Status.PENDING) {
            throw reject(op, slotId, patientId, "Patient " + patientId + " is " + patient.getStatus() + ", not pending");
        }
        if (!Objects.equals(slot.getProposedPatientId(), patientId)) {
            throw reject(op, slotId, patientId,
                    "Slot " + slotId + " is proposed to patient " + slot.getProposedPatientId() + ", not " + patientId);
        }
        if (!Objects.equals(patient.getProposedSlotId(), slotId)) {
            throw reject(op, slotId, patientId,
                    "Patient " + patientId + " holds a proposal for slot " + patient.getProposedSlotId() + ", not " + slotId);
        }
    }

    private Pairing write(Slot slot, Patient patient) {
        try {
            return new Pairing(slotRepository.saveAndFlush(slot), patientRepository.saveAndFlush(patient));
        } catch (ConcurrencyFailureException e) {
            throw new ConflictException("Slot " + slot.getId() + " or patient " + patient.getId() + " changed concurrently", e);
        }
    }

    private static void requireIds(Long slotId, Long patientId) {
        if (slotId == null || patientId == null) {
            throw new ValidationException("Both slotId and patientId are required");
        }
    }

    private static ConflictException reject(String op, Long slotId, Long patientId, String reason) {
        log.warn("Rejected {} slot={} patient={}: {}", op, slotId, patientId, reason);
        return new ConflictException(reason);
    }
}
