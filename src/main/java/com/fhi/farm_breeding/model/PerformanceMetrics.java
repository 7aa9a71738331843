package com.fhi.farm_breeding.model;

import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.Setter;

/**
 * Reproductive performance aggregated from mating, pregnancy and birth history.
 * Rates are percentages.
 */
@Embeddable
@Getter @Setter
public class PerformanceMetrics
{
    private int totalMatings;
    private int successfulMatings;
    private double matingSuccessRate;

    private int totalPregnancies;
    private int successfulPregnancies;
    private double pregnancySuccessRate;

    private int totalOffspring;
    private int liveOffspring;
    private double offspringSurvivalRate;

    private double averageLitterSize;
    private double averageGestationDays;
}
