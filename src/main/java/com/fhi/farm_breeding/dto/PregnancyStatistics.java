package com.fhi.farm_breeding.dto;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import com.fhi.farm_breeding.model.PregnancyStatus;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * All-time pregnancy figures of a farm. Statuses are read as of today, so a confirmed
 * pregnancy past the progressing threshold counts as PROGRESSING.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PregnancyStatistics
{
    private Long farmId;
    private int totalPregnancies;
    private int currentPregnancies;
    private int deliveredPregnancies;
    private int terminatedPregnancies;

    /**
     * Delivered over all pregnancies, in percent.
     */
    private double successRate;

    private Map<PregnancyStatus, Long> byStatus;

    /**
     * Pregnancies per month of conception, keyed "yyyy-MM".
     */
    private SortedMap<String, Long> byMonth;

    /**
     * Conception to actual delivery, over delivered pregnancies.
     */
    private double averageGestationDays;

    /**
     * Best delivery ratio first, at most ten.
     */
    private List<DamRecord> topDams;


    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DamRecord
    {
        private Long damId;
        private int totalPregnancies;
        private int deliveredPregnancies;
    }
}
