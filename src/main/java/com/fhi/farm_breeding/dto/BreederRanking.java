package com.fhi.farm_breeding.dto;

import com.fhi.farm_breeding.model.Gender;
import com.fhi.farm_breeding.model.PerformanceMetrics;
import com.fhi.farm_breeding.model.TraitScores;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BreederRanking
{
    private Long animalId;
    private Gender gender;

    /**
     * Weighted score, 0 to 100.
     */
    private int breedingScore;

    private TraitScores traits;
    private PerformanceMetrics performance;
}
