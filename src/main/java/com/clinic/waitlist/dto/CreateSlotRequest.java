package com.clinic.waitlist.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDate;
import java.time.LocalTime;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateSlotRequest {

    private String provider;

    private LocalDate date;

    private LocalTime startTime;

    /** AM | PM. Derived from startTime when absent. */
    private String period;

    /** Minutes. */
    private Integer duration;

    private String appointmentType;

    private String notes;
}
