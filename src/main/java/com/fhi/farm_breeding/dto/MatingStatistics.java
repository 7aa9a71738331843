package com.fhi.farm_breeding.dto;

import java.util.Map;

import com.fhi.farm_breeding.model.MatingStatus;
import com.fhi.farm_breeding.model.MatingType;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MatingStatistics
{
    private Long farmId;
    private int totalMatings;
    private Map<MatingStatus, Long> byStatus;
    private Map<MatingType, Long> byType;
    private int successfulMatings;

    /**
     * Successful outcomes over completed events, in percent.
     */
    private double successRate;
}
