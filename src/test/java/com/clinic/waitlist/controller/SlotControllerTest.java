package com.clinic.waitlist.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.clinic.waitlist.dto.MatchReport;
import com.clinic.waitlist.dto.Pairing;
import com.clinic.waitlist.entity.Patient;
import com.clinic.waitlist.entity.Period;
import com.clinic.waitlist.entity.Slot;
import com.clinic.waitlist.exception.ConflictException;
import com.clinic.waitlist.exception.ValidationException;
import com.clinic.waitlist.service.AvailabilityMatcher;
import com.clinic.waitlist.service.MatchingService;
import com.clinic.waitlist.service.ProposalStateMachine;
import com.clinic.waitlist.service.WaitTimeCalculator;
import com.clinic.waitlist.service.WaitlistService;
import com.clinic.waitlist.support.MutableClock;
import com.clinic.waitlist.support.TestFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SlotController.class)
@Import({WaitlistViews.class, WaitTimeCalculator.class})
class SlotControllerTest {

    private static final Instant NOW = Instant.parse("2026-01-06T08:00:00Z");

    @TestConfiguration
    static class FixedClock {
        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(NOW);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private WaitlistService waitlistService;

    @MockBean
    private MatchingService matchingService;

    @MockBean
    private ProposalStateMachine proposals;

    private static Slot pendingSlot() {
        Slot slot = TestFixtures.slot("dr-a", TestFixtures.TUESDAY, Period.AM, 30).id(1L).build();
        slot.markPending(2L);
        return slot;
    }

    @Test
    @DisplayName("propose returns both sides of the pairing")
    void propose() throws Exception {
        Patient patient = TestFixtures.waiting("Ann", NOW.minusSeconds(7200)).id(2L).build();
        patient.markPending(1L, NOW);
        when(proposals.propose(1L, 2L)).thenReturn(new Pairing(pendingSlot(), patient));

        mockMvc.perform(post("/api/slots/1/proposals/2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.slot.status").value("pending"))
                .andExpect(jsonPath("$.slot.proposedPatientId").value(2))
                .andExpect(jsonPath("$.patient.proposedSlotId").value(1))
                .andExpect(jsonPath("$.patient.waitTime").value("2 hours"));
    }

    @Test
    @DisplayName("a conflict maps to 409")
    void conflict() throws Exception {
        when(proposals.propose(1L, 3L)).thenThrow(new ConflictException("Slot 1 is PENDING, expected AVAILABLE"));

        mockMvc.perform(post("/api/slots/1/proposals/3"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("conflict"))
                .andExpect(jsonPath("$.message").value("Slot 1 is PENDING, expected AVAILABLE"));
    }

    @Test
    @DisplayName("a validation failure maps to 400")
    void validation() throws Exception {
        when(waitlistService.addSlot(any())).thenThrow(new ValidationException("Unknown provider: dr-x"));

        mockMvc.perform(post("/api/slots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "provider", "dr-x", "date", "2026-01-06", "period", "AM", "duration", 30))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation"));
    }

    @Test
    @DisplayName("matches list eligible patients and rejected ones with reasons")
    void matches() throws Exception {
        Slot slot = TestFixtures.slot("dr-a", TestFixtures.TUESDAY, Period.AM, 30).id(1L).build();
        Patient eligible = TestFixtures.waiting("Eve", NOW.minusSeconds(600)).id(5L).build();
        Patient rejected = TestFixtures.waiting("Rex", NOW.minusSeconds(600)).id(6L).duration(60).build();
        when(waitlistService.getSlot(1L)).thenReturn(slot);
        when(matchingService.findMatchesForSlot(1L)).thenReturn(new MatchReport(
                List.of(eligible),
                List.of(new MatchReport.Rejection(rejected, Set.of(AvailabilityMatcher.Constraint.DURATION)))));

        mockMvc.perform(get("/api/slots/1/matches"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.slot.dayOfWeek").value("TUESDAY"))
                .andExpect(jsonPath("$.eligible[0].id").value(5))
                .andExpect(jsonPath("$.eligible[0].waitTime").value("10 minutes"))
                .andExpect(jsonPath("$.ineligible[0].patient.id").value(6))
                .andExpect(jsonPath("$.ineligible[0].failed[0]").value("DURATION"));
    }
}
