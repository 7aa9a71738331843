package com.fhi.farm_breeding.model;

import jakarta.persistence.Embeddable;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;

/**
 * Heuristic trait scores on a 1-10 scale. 5 means "no data".
 */
@Embeddable
@Getter @Setter
public class TraitScores
{
    public static final int NEUTRAL = 5;

    @Min(1) @Max(10)
    private int growthRate = NEUTRAL;

    @Min(1) @Max(10)
    private int fertility = NEUTRAL;

    @Min(1) @Max(10)
    private int litterSizePotential = NEUTRAL;

    @Min(1) @Max(10)
    private int offspringViability = NEUTRAL;
}
