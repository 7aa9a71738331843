package com.fhi.farm_breeding.dto;

import java.util.List;
import java.util.Map;

import com.fhi.farm_breeding.model.OffspringStatus;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OffspringStatistics
{
    private Long farmId;
    private int totalOffspring;
    private Map<OffspringStatus, Long> byStatus;

    /**
     * Keyed by breed, "unknown" for offspring without one.
     */
    private Map<String, Long> byBreed;

    /**
     * ALIVE or WEANED over all tracked offspring, in percent.
     */
    private double survivalRate;

    /**
     * Offspring with a weaning date over all tracked offspring, in percent. Weaned offspring
     * that were sold later still count.
     */
    private double weaningRate;

    private double averageWeaningAgeDays;

    /**
     * Most offspring first, at most ten each.
     */
    private List<ParentRecord> topDams;
    private List<ParentRecord> topSires;


    /**
     * Offspring of one parent. Sold offspring count as alive.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ParentRecord
    {
        private Long parentId;
        private int totalOffspring;
        private int aliveOffspring;
        private int weanedOffspring;
    }
}
