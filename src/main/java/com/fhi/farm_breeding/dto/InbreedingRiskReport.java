package com.fhi.farm_breeding.dto;

import java.util.List;

import com.fhi.farm_breeding.model.Relationship;
import com.fhi.farm_breeding.model.RiskLevel;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inbreeding risk of mating two animals, from their kinship and their own inbreeding.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InbreedingRiskReport
{
    private Long animalId;
    private Long partnerId;

    /**
     * False only for HIGH risk. Breeder status is not considered here.
     */
    private boolean canBreed;
    private RiskLevel riskLevel;

    /**
     * The known kinship, if any. Empty for unrelated animals.
     */
    private List<Risk> risks;

    /**
     * Mean of the two animals' own inbreeding coefficients.
     */
    private double combinedInbreedingCoefficient;

    private List<String> recommendations;


    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Risk
    {
        private Relationship relationship;
        private double coefficient;
        private String description;
    }
}
