package com.clinic.waitlist.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreatePatientRequest {

    private String name;

    private String phone;

    private String email;

    private String appointmentType;

    /** Minutes. */
    private Integer duration;

    /** Provider key, or "no preference" / blank. */
    private String providerPreference;

    /** low | medium | high; defaults to medium. */
    private String urgency;

    /**
     * Weekday name to periods, e.g. {"Tuesday": ["AM", "PM"]}.
     */
    private Map<String, List<String>> availability;

    /** available | unavailable; defaults to available. */
    private String availabilityMode;

    private String reason;
}
