package com.fhi.farm_breeding.dto;

import java.time.LocalDate;

import com.fhi.farm_breeding.model.DeathCause;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class DeathRequest
{
    @NotNull
    private LocalDate deathDate;

    @NotNull
    private DeathCause cause;

    private String notes;
}
