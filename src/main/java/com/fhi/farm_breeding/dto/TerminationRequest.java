package com.fhi.farm_breeding.dto;

import java.time.LocalDate;

import com.fhi.farm_breeding.model.PregnancyStatus;
import com.fhi.farm_breeding.model.TerminationReason;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class TerminationRequest
{
    /**
     * ABORTED or FAILED.
     */
    @NotNull
    private PregnancyStatus status;

    private TerminationReason reason;

    /**
     * Defaults to today.
     */
    private LocalDate date;

    private String notes;
}
