package com.fhi.farm_breeding.dto;

import java.time.LocalDate;

import com.fhi.farm_breeding.model.MatingOutcome;
import com.fhi.farm_breeding.model.MatingStatus;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class MatingOutcomeRequest
{
    /**
     * COMPLETED or FAILED.
     */
    @NotNull
    private MatingStatus status;

    /**
     * Defaults to UNKNOWN.
     */
    private MatingOutcome outcome;

    private LocalDate outcomeDate;

    private String notes;
}
