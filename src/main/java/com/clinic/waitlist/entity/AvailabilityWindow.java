package com.clinic.waitlist.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.DayOfWeek;

/**
 * One (weekday, period) cell of a patient's weekly grid.
 */
@Embeddable
@Getter
@NoArgsConstructor
@AllArgsConstructor(staticName = "of")
@EqualsAndHashCode
@ToString
public class AvailabilityWindow {

    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", nullable = false, length = 10)
    private DayOfWeek dayOfWeek;

    @Enumerated(EnumType.STRING)
    @Column(name = "period", nullable = false, length = 2)
    private Period period;
}
