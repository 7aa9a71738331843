package com.fhi.farm_breeding.dto;

import java.time.LocalDate;

import com.fhi.farm_breeding.model.ConfirmationMethod;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Manual pregnancy registration, e.g. confirmed by ultrasound for a mating whose
 * outcome was never recorded.
 */
@Data
public class PregnancyRequest
{
    @NotNull
    private Long matingEventId;

    @NotNull
    private Long damId;

    @NotNull
    private Long sireId;

    @NotNull
    private LocalDate conceptionDate;

    private LocalDate confirmedDate;
    private ConfirmationMethod confirmationMethod;

    /**
     * Overrides the animal-type gestation length.
     */
    @Min(1)
    private Integer expectedGestationDays;

    @Min(0)
    private Integer expectedLitterMin;
    @Min(0)
    private Integer expectedLitterMax;

    private boolean requiresSpecialCare;
    private String specialCareInstructions;
    private String notes;
}
