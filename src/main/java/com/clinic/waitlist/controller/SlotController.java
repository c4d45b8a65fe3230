package com.clinic.waitlist.controller;

import com.clinic.waitlist.dto.CreateSlotRequest;
import com.clinic.waitlist.dto.MatchReportResponse;
import com.clinic.waitlist.dto.PairingResponse;
import com.clinic.waitlist.dto.SlotResponse;
import com.clinic.waitlist.entity.Slot;
import com.clinic.waitlist.exception.ValidationException;
import com.clinic.waitlist.service.MatchingService;
import com.clinic.waitlist.service.ProposalStateMachine;
import com.clinic.waitlist.service.WaitlistService;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/slots")
public class SlotController {

    private static final Logger log = LoggerFactory.getLogger(SlotController.class);

    private final WaitlistService waitlistService;
    private final MatchingService matchingService;
    private final ProposalStateMachine proposals;
    private final WaitlistViews views;

    public SlotController(WaitlistService waitlistService,
                          MatchingService matchingService,
                          ProposalStateMachine proposals,
                          WaitlistViews views) {
        this.waitlistService = waitlistService;
        this.matchingService = matchingService;
        this.proposals = proposals;
        this.views = views;
    }

    @PostMapping
    public ResponseEntity<SlotResponse> add(@RequestBody CreateSlotRequest request) {
        Slot slot = waitlistService.addSlot(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(SlotResponse.from(slot));
    }

    @GetMapping
    public List<SlotResponse> list(@RequestParam(value = "status", required = false) String status) {
        return views.slots(waitlistService.listSlots(parseStatus(status)));
    }

    @PutMapping("/{id}")
    public SlotResponse update(@PathVariable Long id, @RequestBody CreateSlotRequest request) {
        return SlotResponse.from(waitlistService.updateSlot(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> remove(@PathVariable Long id) {
        waitlistService.removeSlot(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{slotId}/matches")
    public MatchReportResponse matches(@PathVariable Long slotId) {
        Slot slot = waitlistService.getSlot(slotId);
        return views.matches(slot, matchingService.findMatchesForSlot(slotId));
    }

    // =========================================================
    // PROPOSALS
    // =========================================================
    @PostMapping("/{slotId}/proposals/{patientId}")
    public PairingResponse propose(@PathVariable Long slotId, @PathVariable Long patientId) {
        log.info("Propose request: slot={} patient={}", slotId, patientId);
        return views.pairing(proposals.propose(slotId, patientId));
    }

    @PostMapping("/{slotId}/proposals/{patientId}/confirm")
    public PairingResponse confirm(@PathVariable Long slotId, @PathVariable Long patientId) {
        log.info("Confirm request: slot={} patient={}", slotId, patientId);
        return views.pairing(proposals.confirm(slotId, patientId));
    }

    @PostMapping("/{slotId}/proposals/{patientId}/cancel")
    public PairingResponse cancel(@PathVariable Long slotId, @PathVariable Long patientId) {
        log.info("Cancel request: slot={} patient={}", slotId, patientId);
        return views.pairing(proposals.cancel(slotId, patientId));
    }

    @DeleteMapping("/{slotId}/proposals/{patientId}")
    public ResponseEntity<Void> archive(@PathVariable Long slotId, @PathVariable Long patientId) {
        waitlistService.archiveConfirmed(slotId, patientId);
        return ResponseEntity.noContent().build();
    }

    private static Slot.Status parseStatus(String raw) {
        if (StringUtils.isBlank(raw)) return null;
        try {
            return Slot.Status.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown slot status: " + raw);
        }
    }
}
