package com.fhi.farm_breeding.dto;

import java.time.LocalDate;
import java.time.LocalTime;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * A delivery to record. Dam and sire default to the pregnancy's and must match it when given.
 */
@Data
public class BirthRequest
{
    @NotNull
    private Long pregnancyId;

    private Long damId;
    private Long sireId;

    @NotNull
    private LocalDate birthDate;
    private LocalTime birthTime;
    private String location;

    @NotNull @PositiveOrZero
    private Integer totalOffspring;

    @NotNull @PositiveOrZero
    private Integer liveBirths;

    @PositiveOrZero
    private int stillbirths;

    @PositiveOrZero
    private int weakOffspring;

    @PositiveOrZero
    private int maleOffspring;

    @PositiveOrZero
    private int femaleOffspring;

    /**
     * Recorded as the birth weight of every live offspring, when known.
     */
    @PositiveOrZero
    private Double birthWeightKg;

    private boolean assistedBirth;
    private String assistanceType;
    private String damCondition;
    private String damComplications;
    private String offspringComplications;

    private boolean requiresFollowup;
    private LocalDate followupDate;
    private String notes;
}
