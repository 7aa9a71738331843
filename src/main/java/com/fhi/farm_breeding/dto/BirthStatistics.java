package com.fhi.farm_breeding.dto;

import java.util.List;
import java.util.SortedMap;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BirthStatistics
{
    private Long farmId;
    private int totalBirthEvents;
    private int totalOffspringBorn;
    private int totalLiveBirths;
    private int totalStillbirths;

    /**
     * Live births per birth event.
     */
    private double averageLitterSize;

    /**
     * Stillbirths over all offspring born, in percent.
     */
    private double stillbirthRate;

    /**
     * Offspring of these births still on the farm (ALIVE or WEANED) over live births, in percent.
     */
    private double survivalRate;

    /**
     * Birth events per month, keyed "yyyy-MM".
     */
    private SortedMap<String, Long> byMonth;

    /**
     * Most offspring first, at most ten.
     */
    private List<DamRecord> topProducingDams;


    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DamRecord
    {
        private Long damId;
        private int birthEvents;
        private int totalOffspring;
        private int liveBirths;
        private double averageLitterSize;
    }
}
