package com.fhi.farm_breeding.model;

import java.time.LocalDate;

import jakarta.annotation.Nullable;
import jakarta.persistence.Embeddable;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Embeddable
@Getter @Setter
@NoArgsConstructor
public class PregnancyCheckup
{
    @NotNull
    private LocalDate checkupDate;

    @Nullable
    private Double weightKg;

    @Nullable
    private String findings;

    @Nullable
    private String examiner;

    @Nullable
    private String notes;
}
