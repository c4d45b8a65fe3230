package com.clinic.waitlist.support;

import com.clinic.waitlist.entity.AvailabilityWindow;
import com.clinic.waitlist.entity.Patient;
import com.clinic.waitlist.entity.Period;
import com.clinic.waitlist.entity.Slot;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;

public final class TestFixtures {

    /** A Tuesday. */
    public static final LocalDate TUESDAY = LocalDate.of(2026, 1, 6);
    public static final LocalDate MONDAY = LocalDate.of(2026, 1, 5);

    private TestFixtures() {
    }

    public static Slot.SlotBuilder slot(String provider, LocalDate date, Period period, int duration) {
        return Slot.builder()
                .provider(provider)
                .date(date)
                .period(period)
                .duration(duration);
    }

    public static Patient.PatientBuilder waiting(String name, Instant joinedAt) {
        return Patient.builder()
                .name(name)
                .phone("555-0100")
                .appointmentType("hygiene")
                .duration(30)
                .providerPreference(Patient.NO_PREFERENCE)
                .joinedAt(joinedAt);
    }

    public static Set<AvailabilityWindow> windows(DayOfWeek day, Period... periods) {
        Set<AvailabilityWindow> set = new HashSet<>();
        for (Period p : periods) set.add(AvailabilityWindow.of(day, p));
        return set;
    }
}
