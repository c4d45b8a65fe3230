package com.clinic.waitlist.dto;

import com.clinic.waitlist.entity.AvailabilityWindow;
import com.clinic.waitlist.entity.Patient;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

public record PatientResponse(
        Long id,
        String name,
        String phone,
        String email,
        String appointmentType,
        int duration,
        String providerPreference,
        String urgency,
        Map<DayOfWeek, List<String>> availability,
        String availabilityMode,
        String status,
        Long proposedSlotId,
        Instant joinedAt,
        long waitMinutes,
        String waitTime
) {

    public static PatientResponse from(Patient p, Duration wait, String waitTime) {
        Map<DayOfWeek, List<String>> grid = new TreeMap<>();
        for (AvailabilityWindow w : p.getAvailability()) {
            grid.computeIfAbsent(w.getDayOfWeek(), d -> new ArrayList<>()).add(w.getPeriod().name());
        }
        grid.values().forEach(l -> l.sort(null));
        return new PatientResponse(
                p.getId(),
                p.getName(),
                p.getPhone(),
                p.getEmail(),
                p.getAppointmentType(),
                p.getDuration(),
                p.getProviderPreference(),
                p.getUrgency().name().toLowerCase(Locale.ROOT),
                grid,
                p.getAvailabilityMode().name().toLowerCase(Locale.ROOT),
                p.getStatus().name().toLowerCase(Locale.ROOT),
                p.getProposedSlotId(),
                p.getJoinedAt(),
                wait.toMinutes(),
                waitTime
        );
    }
}
