package com.clinic.waitlist.dto;

import com.clinic.waitlist.entity.Slot;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Locale;

public record SlotResponse(
        Long id,
        String provider,
        LocalDate date,
        String dayOfWeek,
        LocalTime startTime,
        String period,
        int duration,
        String appointmentType,
        String notes,
        String status,
        Long proposedPatientId
) {

    public static SlotResponse from(Slot s) {
        return new SlotResponse(
                s.getId(),
                s.getProvider(),
                s.getDate(),
                s.getDayOfWeek().name(),
                s.getStartTime(),
                s.getPeriod().name(),
                s.getDuration(),
                s.getAppointmentType(),
                s.getNotes(),
                s.getStatus().name().toLowerCase(Locale.ROOT),
                s.getProposedPatientId()
        );
    }
}
