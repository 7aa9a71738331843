package com.fhi.farm_breeding.model;

import java.time.LocalDate;

import jakarta.annotation.Nullable;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.Getter;
import lombok.Setter;

@Embeddable
@Getter @Setter
public class BreedingProfile
{
    private boolean breeder = false;

    @Enumerated(EnumType.STRING)
    private BreedingEligibility eligibility = BreedingEligibility.INELIGIBLE;

    /**
     * Why the animal is not ELIGIBLE; null when it is.
     */
    @Nullable
    private String eligibilityReason;

    @Enumerated(EnumType.STRING)
    private BreedingSeason breedingSeason = BreedingSeason.UNKNOWN;

    @Nullable
    private LocalDate ageAtMaturity;

    /**
     * Age in days at the first recorded mating.
     */
    @Nullable
    private Integer firstBreedingAgeDays;

    @Nullable
    private LocalDate lastBreedingDate;


    public void grade(BreedingEligibility eligibility, @Nullable String reason)
    {   this.eligibility = eligibility;
        this.eligibilityReason = reason;
    }
}
