package com.clinic.waitlist.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;

import com.clinic.waitlist.entity.Patient;
import com.clinic.waitlist.entity.Period;
import com.clinic.waitlist.entity.Slot;
import com.clinic.waitlist.exception.ConflictException;
import com.clinic.waitlist.repository.PatientRepository;
import com.clinic.waitlist.repository.SlotRepository;
import com.clinic.waitlist.support.MutableClock;
import com.clinic.waitlist.support.TestFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

@ExtendWith(MockitoExtension.class)
class ProposalStateMachineTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    @Mock
    private SlotRepository slotRepository;

    @Mock
    private PatientRepository patientRepository;

    @Mock
    private RecordLocks locks;

    private ProposalStateMachine proposals;
    private Slot slot;
    private Patient patient;

    @BeforeEach
    void setUp() {
        proposals = new ProposalStateMachine(slotRepository, patientRepository, locks, new MutableClock(NOW));
        slot = TestFixtures.slot("dr-a", TestFixtures.TUESDAY, Period.AM, 30).id(1L).build();
        patient = TestFixtures.waiting("Ann", NOW.minusSeconds(3600)).id(2L).build();
        when(locks.slot(1L)).thenReturn(slot);
        when(locks.patient(2L)).thenReturn(patient);
    }

    @Test
    @DisplayName("a failed precondition writes nothing")
    void rejectedTransitionDoesNotSave() {
        slot.markPending(9L);

        assertThatThrownBy(() -> proposals.propose(1L, 2L)).isInstanceOf(ConflictException.class);

        verify(slotRepository, never()).saveAndFlush(any());
        verify(patientRepository, never()).saveAndFlush(any());
        assertThat(patient.getStatus()).isEqualTo(Patient.Status.WAITING);
    }

    @Test
    @DisplayName("propose freezes the patient's wait at the proposal time")
    void proposeFreezesWait() {
        when(slotRepository.saveAndFlush(slot)).thenReturn(slot);
        when(patientRepository.saveAndFlush(patient)).thenReturn(patient);

        proposals.propose(1L, 2L);

        assertThat(patient.getWaitFrozenAt()).isEqualTo(NOW);
        assertThat(patient.getProposedSlotId()).isEqualTo(1L);
        assertThat(slot.getProposedPatientId()).isEqualTo(2L);
    }

    @Test
    @DisplayName("a version clash on flush surfaces as a conflict")
    void versionClashIsConflict() {
        when(slotRepository.saveAndFlush(slot))
                .thenThrow(new ObjectOptimisticLockingFailureException(Slot.class, 1L));

        assertThatThrownBy(() -> proposals.propose(1L, 2L))
                .isInstanceOf(ConflictException.class)
                .hasCauseInstanceOf(ObjectOptimisticLockingFailureException.class);
    }
}
