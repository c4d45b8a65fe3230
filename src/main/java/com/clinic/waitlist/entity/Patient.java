package com.clinic.waitlist.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Waitlist entry. Status and the proposal cross-reference are only changed through the
 * transition methods below, which the proposal state machine drives.
 */
@Entity
@Table(name = "patient", indexes = {
    @Index(name = "idx_patient_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Patient {

    public static final String NO_PREFERENCE = "no preference";

    public enum Status { WAITING, PENDING, CONFIRMED, CANCELLED }

    public enum Urgency {
        LOW, MEDIUM, HIGH;

        /** Higher rank surfaces first. */
        public int rank() {
            return ordinal();
        }
    }

    /** How {@link #availability} is read: allow-list or deny-list. */
    public enum AvailabilityMode { AVAILABLE, UNAVAILABLE }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(nullable = false, length = 20)
    private String phone;

    @Column(length = 200)
    private String email;

    @Column(name = "appointment_type", nullable = false, length = 100)
    private String appointmentType;

    /** Minutes. */
    @Column(nullable = false)
    private int duration;

    @Column(name = "provider_preference", nullable = false, length = 50)
    @Builder.Default
    private String providerPreference = NO_PREFERENCE;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private Urgency urgency = Urgency.MEDIUM;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "patient_availability", joinColumns = @JoinColumn(name = "patient_id"))
    @Builder.Default
    private Set<AvailabilityWindow> availability = new HashSet<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "availability_mode", nullable = false, length = 12)
    @Builder.Default
    private AvailabilityMode availabilityMode = AvailabilityMode.AVAILABLE;

    @Column(columnDefinition = "TEXT")
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private Status status = Status.WAITING;

    @Column(name = "proposed_slot_id")
    @Setter(AccessLevel.NONE)
    private Long proposedSlotId;

    @Column(name = "booked_slot_id")
    @Setter(AccessLevel.NONE)
    private Long bookedSlotId;

    @Column(name = "joined_at", nullable = false, updatable = false)
    @Setter(AccessLevel.NONE)
    private Instant joinedAt;

    /** Instant the patient stopped waiting; null while waiting. */
    @Column(name = "wait_frozen_at")
    @Setter(AccessLevel.NONE)
    private Instant waitFrozenAt;

    @Version
    private Long version;

    public boolean isNoPreference() {
        return providerPreference == null || NO_PREFERENCE.equalsIgnoreCase(providerPreference.trim());
    }

    public boolean isAvailableAt(DayOfWeek day, Period period) {
        return availability.contains(AvailabilityWindow.of(day, period));
    }

    public void markPending(Long slotId, Instant at) {
        this.status = Status.PENDING;
        this.proposedSlotId = slotId;
        this.waitFrozenAt = at;
    }

    public void markConfirmed(Instant at) {
        this.status = Status.CONFIRMED;
        this.bookedSlotId = proposedSlotId;
        this.proposedSlotId = null;
        if (waitFrozenAt == null) waitFrozenAt = at;
    }

    /** Patient left the waitlist without a booking. */
    public void markWithdrawn(Instant at) {
        this.status = Status.CANCELLED;
        if (waitFrozenAt == null) waitFrozenAt = at;
    }

    public void markWaiting() {
        this.status = Status.WAITING;
        this.proposedSlotId = null;
        this.waitFrozenAt = null;
    }
}
