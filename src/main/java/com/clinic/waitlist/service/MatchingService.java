package com.clinic.waitlist.service;

import com.clinic.waitlist.dto.MatchReport;
import com.clinic.waitlist.entity.Patient;
import com.clinic.waitlist.entity.Slot;
import com.clinic.waitlist.exception.ValidationException;
import com.clinic.waitlist.repository.PatientRepository;
import com.clinic.waitlist.repository.SlotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Loads slots and patients from the store and runs them through {@link AvailabilityMatcher}.
 */
@Service
public class MatchingService {

    private static final Logger log = LoggerFactory.getLogger(MatchingService.class);

    private final SlotRepository slotRepository;
    private final PatientRepository patientRepository;
    private final AvailabilityMatcher matcher;

    public MatchingService(SlotRepository slotRepository,
                           PatientRepository patientRepository,
                           AvailabilityMatcher matcher) {
        this.slotRepository = slotRepository;
        this.patientRepository = patientRepository;
        this.matcher = matcher;
    }

    @Transactional(readOnly = true)
    public MatchReport findMatchesForSlot(Long slotId) {
        Slot slot = slotRepository.findById(slotId)
                .orElseThrow(() -> new ValidationException("Unknown slot id: " + slotId));
        if (slot.getStatus() != Slot.Status.AVAILABLE) {
            log.debug("Slot {} is {}; no candidates", slotId, slot.getStatus());
            return new MatchReport(List.of(), List.of());
        }
        List<Patient> waiting = patientRepository.findByStatusOrderByJoinedAtAsc(Patient.Status.WAITING);
        MatchReport report = matcher.evaluate(slot, waiting);
        log.debug("Slot {}: {} eligible, {} ineligible of {} waiting",
                slotId, report.eligible().size(), report.ineligible().size(), waiting.size());
        return report;
    }

    @Transactional(readOnly = true)
    public List<Slot> findSlotsForPatient(Long patientId) {
        Patient patient = patientRepository.findById(patientId)
                .orElseThrow(() -> new ValidationException("Unknown patient id: " + patientId));
        return matcher.findSlotsForPatient(patient, slotRepository.findByStatusOrderByDateAscStartTimeAsc(Slot.Status.AVAILABLE));
    }
}
