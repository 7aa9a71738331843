package com.fhi.farm_breeding.model;

import jakarta.annotation.Nullable;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;

/**
 * Per animal-type genetics settings. Any field left null falls back to the
 * application defaults.
 */
@Embeddable
@Getter @Setter
public class GeneticsSettings
{
    @Nullable
    @Min(0)
    private Integer minBreedingAgeDays;

    @Nullable
    @Min(0)
    private Integer maturityAgeDays;

    @Nullable
    @Min(1)
    private Integer gestationPeriodDays;

    @Nullable
    @Enumerated(EnumType.STRING)
    private BreedingSeason breedingSeason;

    @Nullable
    @Min(1)
    private Integer averageLitterSize;

    @Nullable
    @DecimalMin("0.0") @DecimalMax("1.0")
    private Double inbreedingThreshold;

    @Override
    public String toString()
    {   return "[gestation=" + gestationPeriodDays + "d, minBreedingAge=" + minBreedingAgeDays + "d]";
    }
}
