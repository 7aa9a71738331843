package com.fhi.farm_breeding.dto;

import java.time.LocalDate;
import java.time.LocalTime;

import lombok.Data;

/**
 * Partial update of a birth event. Pregnancy, dam, sire and farm are immutable, and litter
 * counts are fixed once offspring have been created from them.
 */
@Data
public class BirthUpdateRequest
{
    private Long farmId;
    private Long pregnancyId;
    private Long damId;
    private Long sireId;

    private LocalTime birthTime;
    private String location;
    private Boolean assistedBirth;
    private String assistanceType;
    private String damCondition;
    private String damComplications;
    private String offspringComplications;
    private Boolean requiresFollowup;
    private LocalDate followupDate;
    private String notes;
}
