package com.fhi.farm_breeding.dto;

import java.time.LocalDateTime;
import java.util.List;

import com.fhi.farm_breeding.model.AvoidPair;
import com.fhi.farm_breeding.model.Gender;
import com.fhi.farm_breeding.model.RecommendedPair;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Farm-wide summary of the stored genetic profiles.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GeneticsDashboard
{
    private Long farmId;

    private int totalProfiles;
    private int activeBreeders;
    private int eligibleBreeders;

    private TraitAverages traitAverages;
    private InbreedingDistribution inbreedingDistribution;

    /**
     * Over breeders only.
     */
    private PerformanceAverages performanceAverages;

    /**
     * The most recently computed breeders with their recommendations.
     */
    private List<BreederRecommendations> recentRecommendations;

    /**
     * {@code (1 - mean inbreeding) x 100}, 0 with fewer than two profiles.
     */
    private int geneticDiversityScore;

    /**
     * {@code 0.4 mean survival + 0.3 mean fertility x 10 + 0.3 breeder share x 100}.
     */
    private int breedingProgramStrength;


    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TraitAverages
    {
        private double growthRate;
        private double fertility;
        private double offspringViability;
    }

    /**
     * Profiles by own inbreeding coefficient: low below 0.1, medium up to 0.3, high above.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class InbreedingDistribution
    {
        private int lowRisk;
        private int mediumRisk;
        private int highRisk;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PerformanceAverages
    {
        private double offspringSurvivalRate;
        private double matingSuccessRate;
        private double pregnancySuccessRate;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BreederRecommendations
    {
        private Long animalId;
        private Gender gender;
        private List<RecommendedPair> recommendedPairs;
        private List<AvoidPair> avoidPairs;
        private LocalDateTime computedAt;
    }
}
