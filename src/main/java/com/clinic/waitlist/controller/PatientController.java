package com.clinic.waitlist.controller;

import com.clinic.waitlist.dto.CreatePatientRequest;
import com.clinic.waitlist.dto.PatientResponse;
import com.clinic.waitlist.dto.SlotResponse;
import com.clinic.waitlist.entity.Patient;
import com.clinic.waitlist.exception.ValidationException;
import com.clinic.waitlist.service.MatchingService;
import com.clinic.waitlist.service.WaitlistService;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/patients")
public class PatientController {

    private final WaitlistService waitlistService;
    private final MatchingService matchingService;
    private final WaitlistViews views;

    public PatientController(WaitlistService waitlistService, MatchingService matchingService, WaitlistViews views) {
        this.waitlistService = waitlistService;
        this.matchingService = matchingService;
        this.views = views;
    }

    @PostMapping
    public ResponseEntity<PatientResponse> add(@RequestBody CreatePatientRequest request) {
        Patient patient = waitlistService.addPatient(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(views.patient(patient));
    }

    @GetMapping
    public List<PatientResponse> list(@RequestParam(value = "status", required = false) String status) {
        return views.patients(waitlistService.listPatients(parseStatus(status)));
    }

    @GetMapping("/{id}")
    public PatientResponse get(@PathVariable Long id) {
        return views.patient(waitlistService.getPatient(id));
    }

    @PutMapping("/{id}")
    public PatientResponse update(@PathVariable Long id, @RequestBody CreatePatientRequest request) {
        return views.patient(waitlistService.updatePatient(id, request));
    }

    @DeleteMapping("/{id}")
    public PatientResponse withdraw(@PathVariable Long id) {
        return views.patient(waitlistService.withdrawPatient(id));
    }

    @GetMapping("/{id}/matches")
    public List<SlotResponse> matches(@PathVariable Long id) {
        return views.slots(matchingService.findSlotsForPatient(id));
    }

    private static Patient.Status parseStatus(String raw) {
        if (StringUtils.isBlank(raw)) return null;
        try {
            return Patient.Status.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown patient status: " + raw);
        }
    }
}
