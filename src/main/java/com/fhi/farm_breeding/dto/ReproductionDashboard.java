package com.fhi.farm_breeding.dto;

import java.util.List;

import com.fhi.farm_breeding.model.BirthEvent;
import com.fhi.farm_breeding.model.MatingEvent;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One-call overview of a farm's reproduction: totals, the four statistics, latest activity,
 * pregnancy alerts and headline rates.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReproductionDashboard
{
    private Long farmId;
    private Overview overview;

    private MatingStatistics matingStatistics;
    private PregnancyStatistics pregnancyStatistics;
    private BirthStatistics birthStatistics;
    private OffspringStatistics offspringStatistics;

    /**
     * Latest matings by mating date, at most five.
     */
    private List<MatingEvent> recentMatings;

    /**
     * Ongoing pregnancies due first, at most five.
     */
    private List<PregnancyView> currentPregnancies;

    /**
     * Latest births by birth date, at most five.
     */
    private List<BirthEvent> recentBirths;

    private PregnancyAlerts alerts;
    private Performance performance;


    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Overview
    {
        private int totalMatings;
        private int totalPregnancies;
        private int totalBirths;
        private int totalOffspring;

        /**
         * The mating success rate.
         */
        private double overallSuccessRate;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Performance
    {
        private double fertilityRate;
        private double pregnancySuccessRate;
        private double averageLitterSize;
        private double offspringSurvivalRate;
    }
}
