package com.clinic.waitlist.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * An open appointment, typically left behind by a cancellation.
 */
@Entity
@Table(name = "open_slot", indexes = {
    @Index(name = "idx_open_slot_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Slot {

    public enum Status { AVAILABLE, PENDING, CONFIRMED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Provider key; always a concrete provider. */
    @Column(nullable = false, length = 50)
    private String provider;

    @Column(name = "slot_date", nullable = false)
    private LocalDate date;

    @Column(name = "start_time")
    private LocalTime startTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 2)
    private Period period;

    /** Minutes. */
    @Column(nullable = false)
    private int duration;

    /** Optional; when null any appointment type fits. */
    @Column(name = "appointment_type", length = 100)
    private String appointmentType;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private Status status = Status.AVAILABLE;

    @Column(name = "proposed_patient_id")
    @Setter(AccessLevel.NONE)
    private Long proposedPatientId;

    /** Patient the slot was confirmed for; set only once status is CONFIRMED. */
    @Column(name = "booked_patient_id")
    @Setter(AccessLevel.NONE)
    private Long bookedPatientId;

    @Version
    private Long version;

    public DayOfWeek getDayOfWeek() {
        return date.getDayOfWeek();
    }

    public void markPending(Long patientId) {
        this.status = Status.PENDING;
        this.proposedPatientId = patientId;
    }

    public void markConfirmed() {
        this.status = Status.CONFIRMED;
        this.bookedPatientId = proposedPatientId;
        this.proposedPatientId = null;
    }

    public void markAvailable() {
        this.status = Status.AVAILABLE;
        this.proposedPatientId = null;
    }
}
