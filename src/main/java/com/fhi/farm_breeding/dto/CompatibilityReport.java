package com.fhi.farm_breeding.dto;

import java.util.List;

import com.fhi.farm_breeding.model.Relationship;
import com.fhi.farm_breeding.model.RiskLevel;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Breeding assessment of one pair of animals.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CompatibilityReport
{
    private Long animalId;
    private Long partnerId;

    private boolean canBreed;
    private RiskLevel riskLevel;

    /**
     * How the partner relates to the animal, null if unrelated as far as known.
     */
    private Relationship relationship;

    /**
     * 0 to 100.
     */
    private int compatibilityScore;

    private List<String> warnings;
    private List<String> expectedBenefits;
}
