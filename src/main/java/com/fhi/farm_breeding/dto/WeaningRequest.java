package com.fhi.farm_breeding.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class WeaningRequest
{
    @NotNull
    private LocalDate weaningDate;

    @PositiveOrZero
    private Double weaningWeightKg;

    private String notes;
}
