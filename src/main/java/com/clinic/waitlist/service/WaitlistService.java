package com.clinic.waitlist.service;

import com.clinic.waitlist.dto.CreatePatientRequest;
import com.clinic.waitlist.dto.CreateSlotRequest;
import com.clinic.waitlist.entity.AvailabilityWindow;
import com.clinic.waitlist.entity.Patient;
import com.clinic.waitlist.entity.Period;
import com.clinic.waitlist.entity.Slot;
import com.clinic.waitlist.exception.ConflictException;
import com.clinic.waitlist.exception.ValidationException;
import com.clinic.waitlist.repository.PatientRepository;
import com.clinic.waitlist.repository.SlotRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DayOfWeek;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Registration and removal of waitlist entries and open slots. Status transitions of a pairing
 * are left to {@link ProposalStateMachine}.
 */
@Service
public class WaitlistService {

    private static final Logger log = LoggerFactory.getLogger(WaitlistService.class);

    private final PatientRepository patientRepository;
    private final SlotRepository slotRepository;
    private final ProviderDirectory providerDirectory;
    private final RecordLocks locks;
    private final Clock clock;

    public WaitlistService(PatientRepository patientRepository,
                           SlotRepository slotRepository,
                           ProviderDirectory providerDirectory,
                           RecordLocks locks,
                           Clock clock) {
        this.patientRepository = patientRepository;
        this.slotRepository = slotRepository;
        this.providerDirectory = providerDirectory;
        this.locks = locks;
        this.clock = clock;
    }

    // =========================================================
    // PATIENTS
    // =========================================================
    @Transactional
    public Patient addPatient(CreatePatientRequest req) {
        Patient patient = Patient.builder().joinedAt(clock.instant()).build();
        applyPatientDetails(patient, req);
        patient = patientRepository.save(patient);
        log.info("Added patient {} to waitlist: type={} duration={} provider={} urgency={}",
                patient.getId(), patient.getAppointmentType(), patient.getDuration(),
                patient.getProviderPreference(), patient.getUrgency());
        return patient;
    }

    /**
     * Replaces the details of a waiting patient. Place in the queue (joinedAt) is kept.
     */
    @Transactional
    public Patient updatePatient(Long id, CreatePatientRequest req) {
        Patient patient = locks.patient(id);
        if (patient.getStatus() != Patient.Status.WAITING) {
            throw new ConflictException("Patient " + id + " is " + patient.getStatus() + " and cannot be edited");
        }
        applyPatientDetails(patient, req);
        patient = patientRepository.saveAndFlush(patient);
        log.info("Updated patient {}: type={} duration={} provider={} urgency={}",
                id, patient.getAppointmentType(), patient.getDuration(),
                patient.getProviderPreference(), patient.getUrgency());
        return patient;
    }

    @Transactional(readOnly = true)
    public List<Patient> listPatients(Patient.Status status) {
        return status == null
                ? patientRepository.findAllByOrderByJoinedAtAsc()
                : patientRepository.findByStatusOrderByJoinedAtAsc(status);
    }

    @Transactional(readOnly = true)
    public Patient getPatient(Long id) {
        return patientRepository.findById(id)
                .orElseThrow(() -> new ValidationException("Unknown patient id: " + id));
    }

    /**
     * Takes a waiting patient off the waitlist. The record stays, in CANCELLED status.
     */
    @Transactional
    public Patient withdrawPatient(Long id) {
        Patient patient = locks.patient(id);
        if (patient.getStatus() != Patient.Status.WAITING) {
            throw new ConflictException("Patient " + id + " is " + patient.getStatus() + " and cannot be withdrawn");
        }
        patient.markWithdrawn(clock.instant());
        patient = patientRepository.saveAndFlush(patient);
        log.info("Withdrew patient {} from waitlist", id);
        return patient;
    }

    // =========================================================
    // SLOTS
    // =========================================================
    @Transactional
    public Slot addSlot(CreateSlotRequest req) {
        Slot slot = Slot.builder().build();
        applySlotDetails(slot, req);
        slot = slotRepository.save(slot);
        log.info("Added open slot {}: provider={} date={} period={} duration={}",
                slot.getId(), slot.getProvider(), slot.getDate(), slot.getPeriod(), slot.getDuration());
        return slot;
    }

    /**
     * Replaces the details of an available slot; the period is re-derived from the start time.
     */
    @Transactional
    public Slot updateSlot(Long id, CreateSlotRequest req) {
        Slot slot = locks.slot(id);
        if (slot.getStatus() != Slot.Status.AVAILABLE) {
            throw new ConflictException("Slot " + id + " is " + slot.getStatus() + " and cannot be edited");
        }
        applySlotDetails(slot, req);
        slot = slotRepository.saveAndFlush(slot);
        log.info("Updated slot {}: provider={} date={} period={} duration={}",
                id, slot.getProvider(), slot.getDate(), slot.getPeriod(), slot.getDuration());
        return slot;
    }

    @Transactional(readOnly = true)
    public List<Slot> listSlots(Slot.Status status) {
        return status == null
                ? slotRepository.findAllByOrderByDateAscStartTimeAsc()
                : slotRepository.findByStatusOrderByDateAscStartTimeAsc(status);
    }

    @Transactional(readOnly = true)
    public Slot getSlot(Long id) {
        return slotRepository.findById(id)
                .orElseThrow(() -> new ValidationException("Unknown slot id: " + id));
    }

    /**
     * Deletes an open slot. A slot with an outstanding proposal must be cancelled first.
     */
    @Transactional
    public void removeSlot(Long id) {
        Slot slot = locks.slot(id);
        if (slot.getStatus() == Slot.Status.PENDING) {
            throw new ConflictException("Slot " + id + " has a pending proposal; cancel it first");
        }
        slotRepository.delete(slot);
        log.info("Removed slot {}", id);
    }

    /**
     * Deletes a confirmed slot and its patient once the booking has been recorded elsewhere.
     */
    @Transactional
    public void archiveConfirmed(Long slotId, Long patientId) {
        if (slotId == null || patientId == null) {
            throw new ValidationException("Both slotId and patientId are required");
        }
        Slot slot = locks.slot(slotId);
        Patient patient = locks.patient(patientId);
        if (slot.getStatus() != Slot.Status.CONFIRMED || patient.getStatus() != Patient.Status.CONFIRMED) {
            throw new ConflictException("Slot " + slotId + " and patient " + patientId + " are not a confirmed booking");
        }
        if (!Objects.equals(slot.getBookedPatientId(), patientId) || !Objects.equals(patient.getBookedSlotId(), slotId)) {
            throw new ConflictException("Slot " + slotId + " was not booked for patient " + patientId);
        }
        slotRepository.delete(slot);
        patientRepository.delete(patient);
        log.info("Archived confirmed booking: slot={} patient={}", slotId, patientId);
    }

    // =========================================================
    // VALIDATION
    // =========================================================
    private void applyPatientDetails(Patient patient, CreatePatientRequest req) {
        if (req == null) throw new ValidationException("Patient details are required");
        requireText(req.getName(), "name");
        requireText(req.getPhone(), "phone");
        requireText(req.getAppointmentType(), "appointmentType");
        int duration = requirePositiveDuration(req.getDuration());

        String preference = Patient.NO_PREFERENCE;
        if (StringUtils.isNotBlank(req.getProviderPreference())
                && !Patient.NO_PREFERENCE.equalsIgnoreCase(req.getProviderPreference().trim())) {
            preference = req.getProviderPreference().trim();
            if (!providerDirectory.exists(preference)) {
                throw new ValidationException("Unknown provider: " + preference);
            }
        }
        Patient.Urgency urgency = parseUrgency(req.getUrgency());
        Set<AvailabilityWindow> availability = parseAvailability(req.getAvailability());
        Patient.AvailabilityMode mode = parseAvailabilityMode(req.getAvailabilityMode());

        patient.setName(req.getName().trim());
        patient.setPhone(req.getPhone().trim());
        patient.setEmail(StringUtils.trimToNull(req.getEmail()));
        patient.setAppointmentType(req.getAppointmentType().trim());
        patient.setDuration(duration);
        patient.setProviderPreference(preference);
        patient.setUrgency(urgency);
        patient.getAvailability().clear();
        patient.getAvailability().addAll(availability);
        patient.setAvailabilityMode(mode);
        patient.setReason(StringUtils.trimToNull(req.getReason()));
    }

    private void applySlotDetails(Slot slot, CreateSlotRequest req) {
        if (req == null) throw new ValidationException("Slot details are required");
        requireText(req.getProvider(), "provider");
        String provider = req.getProvider().trim();
        if (Patient.NO_PREFERENCE.equalsIgnoreCase(provider)) {
            throw new ValidationException("A slot needs a concrete provider");
        }
        if (!providerDirectory.exists(provider)) {
            throw new ValidationException("Unknown provider: " + provider);
        }
        if (req.getDate() == null) throw new ValidationException("date is required");
        int duration = requirePositiveDuration(req.getDuration());
        Period period = resolvePeriod(req);

        slot.setProvider(provider);
        slot.setDate(req.getDate());
        slot.setStartTime(req.getStartTime());
        slot.setPeriod(period);
        slot.setDuration(duration);
        slot.setAppointmentType(StringUtils.trimToNull(req.getAppointmentType()));
        slot.setNotes(StringUtils.trimToNull(req.getNotes()));
    }

    // =========================================================
    // PARSING
    // =========================================================
    static Patient.Urgency parseUrgency(String raw) {
        if (StringUtils.isBlank(raw)) return Patient.Urgency.MEDIUM;
        try {
            return Patient.Urgency.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown urgency: " + raw);
        }
    }

    static Patient.AvailabilityMode parseAvailabilityMode(String raw) {
        if (StringUtils.isBlank(raw)) return Patient.AvailabilityMode.AVAILABLE;
        try {
            return Patient.AvailabilityMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown availability mode: " + raw);
        }
    }

    static Period parsePeriod(String raw) {
        try {
            return Period.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown period: " + raw);
        }
    }

    /**
     * Converts {"Tuesday": ["AM"]} style input to a set of windows. Day names are case-insensitive.
     */
    static Set<AvailabilityWindow> parseAvailability(Map<String, List<String>> raw) {
        Set<AvailabilityWindow> windows = new HashSet<>();
        if (raw == null) return windows;
        for (Map.Entry<String, List<String>> e : raw.entrySet()) {
            DayOfWeek day;
            try {
                day = DayOfWeek.valueOf(StringUtils.trimToEmpty(e.getKey()).toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new ValidationException("Unknown weekday: " + e.getKey());
            }
            if (e.getValue() == null) continue;
            for (String p : e.getValue()) {
                if (StringUtils.isBlank(p)) continue;
                windows.add(AvailabilityWindow.of(day, parsePeriod(p)));
            }
        }
        return windows;
    }

    private static Period resolvePeriod(CreateSlotRequest req) {
        if (StringUtils.isBlank(req.getPeriod())) {
            if (req.getStartTime() == null) {
                throw new ValidationException("Either period or startTime is required");
            }
            return Period.of(req.getStartTime());
        }
        Period period = parsePeriod(req.getPeriod());
        if (req.getStartTime() != null && Period.of(req.getStartTime()) != period) {
            throw new ValidationException("startTime " + req.getStartTime() + " is not in the " + period + " period");
        }
        return period;
    }

    private static void requireText(String value, String field) {
        if (StringUtils.isBlank(value)) throw new ValidationException(field + " is required");
    }

    private static int requirePositiveDuration(Integer duration) {
        if (duration == null || duration <= 0) {
            throw new ValidationException("duration must be a positive number of minutes");
        }
        return duration;
    }
}
