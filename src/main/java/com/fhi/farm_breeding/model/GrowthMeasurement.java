package com.fhi.farm_breeding.model;

import java.time.LocalDate;

import jakarta.annotation.Nullable;
import jakarta.persistence.Embeddable;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Embeddable
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
public class GrowthMeasurement
{
    @NotNull
    private LocalDate measuredOn;

    @Nullable
    @PositiveOrZero
    private Double weightKg;

    @Nullable
    @PositiveOrZero
    private Double heightCm;

    @Nullable
    private String notes;
}
