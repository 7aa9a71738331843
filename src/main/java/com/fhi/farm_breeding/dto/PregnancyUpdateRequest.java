package com.fhi.farm_breeding.dto;

import java.time.LocalDate;

import com.fhi.farm_breeding.model.ConfirmationMethod;

import lombok.Data;

/**
 * Partial update of a pregnancy. Farm, dam, sire and mating event are immutable:
 * sending a different value is refused.
 */
@Data
public class PregnancyUpdateRequest
{
    private Long farmId;
    private Long damId;
    private Long sireId;
    private Long matingEventId;

    private LocalDate confirmedDate;
    private ConfirmationMethod confirmationMethod;
    private Integer expectedLitterMin;
    private Integer expectedLitterMax;
    private Boolean requiresSpecialCare;
    private String specialCareInstructions;
    private String notes;
}
