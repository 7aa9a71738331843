package com.fhi.farm_breeding.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.fhi.farm_breeding.dto.CompatibilityReport;
import com.fhi.farm_breeding.dto.InbreedingRiskReport;
import com.fhi.farm_breeding.model.GeneticProfile;
import com.fhi.farm_breeding.model.KnownRelative;
import com.fhi.farm_breeding.model.Relationship;
import com.fhi.farm_breeding.model.RiskLevel;

/**
 * Pairwise breeding assessment of two genetic profiles. Pure: reads the profiles only.
 */
@Component
public class CompatibilityScorer
{
    static final String NOT_BREEDERS_WARNING = "One or both animals are not designated as breeders";
    static final String STANDARD_PAIR = "Standard breeding pair";


    /**
     * Relationship risk, breeder check, score and expected benefits of pairing {@code a} with {@code b}.
     *
     * <p>The relationship is looked up in {@code a}'s known relatives first, then in {@code b}'s
     * (inverted, so it always reads as "b is a's ..."). HIGH risk relationships block breeding,
     * MEDIUM ones only warn.
     */
    public CompatibilityReport assess(GeneticProfile a, GeneticProfile b)
    {
        List<String> warnings = new ArrayList<>();
        boolean canBreed = true;

        Optional<Relationship> relationship = relationshipBetween(a, b);
        RiskLevel risk = relationship.map(Relationship::getRisk).orElse(RiskLevel.LOW);
        if (risk == RiskLevel.HIGH)
        {   warnings.add("High inbreeding risk: " + relationship.get().label());
            canBreed = false;
        }
        else if (risk == RiskLevel.MEDIUM)
        {   warnings.add("Medium inbreeding risk: " + relationship.get().label());
        }

        if (!a.isBreeder() || !b.isBreeder())
        {   warnings.add(NOT_BREEDERS_WARNING);
            canBreed = false;
        }

        return new CompatibilityReport(a.getAnimalId(),
                                       b.getAnimalId(),
                                       canBreed,
                                       risk,
                                       relationship.orElse(null),
                                       compatibilityScore(a, b),
                                       warnings,
                                       expectedBenefits(a, b));
    }

    /**
     * Kinship risk of pairing {@code a} with {@code b}, with the mean of their own inbreeding
     * coefficients and advice matching the two.
     */
    public InbreedingRiskReport inbreedingRisk(GeneticProfile a, GeneticProfile b)
    {
        Optional<Relationship> relationship = relationshipBetween(a, b);
        RiskLevel risk = relationship.map(Relationship::getRisk).orElse(RiskLevel.LOW);
        List<InbreedingRiskReport.Risk> risks = relationship.map(r -> new InbreedingRiskReport.Risk(r, r.getCoefficient(), r.description()))
                                                            .map(List::of)
                                                            .orElse(List.of());
        double combined = (a.getInbreedingCoefficient() + b.getInbreedingCoefficient()) / 2;

        return new InbreedingRiskReport(a.getAnimalId(),
                                        b.getAnimalId(),
                                        risk != RiskLevel.HIGH,
                                        risk,
                                        risks,
                                        combined,
                                        breedingRecommendations(risk, combined));
    }

    static List<String> breedingRecommendations(RiskLevel risk, double combinedCoefficient)
    {
        if (risk == RiskLevel.HIGH)      return List.of("Avoid breeding - close relatives", "Consider using unrelated animals");
        if (risk == RiskLevel.MEDIUM)    return List.of("Proceed with caution", "Monitor offspring health closely");
        if (combinedCoefficient > 0.3)   return List.of("Moderate inbreeding risk", "Consider introducing new bloodline");
        return List.of("Low inbreeding risk", "Suitable for breeding");
    }

    /**
     * How {@code b} relates to {@code a}, as far as either profile knows.
     */
    public Optional<Relationship> relationshipBetween(GeneticProfile a, GeneticProfile b)
    {
        Optional<Relationship> direct = a.findRelative(b.getAnimalId()).map(KnownRelative::getRelationship);
        if (direct.isPresent()) return direct;
        return b.findRelative(a.getAnimalId()).map(KnownRelative::getRelationship).map(Relationship::inverse);
    }

    /**
     * {@code 50 - 30 * avg(inbreeding) + 2 * (10 - |growth difference|) + avg(survival rate) / 2},
     * rounded and clamped to [0, 100].
     */
    public int compatibilityScore(GeneticProfile a, GeneticProfile b)
    {
        double score = 50;
        score -= (a.getInbreedingCoefficient() + b.getInbreedingCoefficient()) / 2 * 30;
        score += (10 - Math.abs(a.getTraits().getGrowthRate() - b.getTraits().getGrowthRate())) * 2;
        score += averageSurvivalRate(a, b) / 2;
        return (int) Math.max(0, Math.min(100, Math.round(score)));
    }

    public List<String> expectedBenefits(GeneticProfile a, GeneticProfile b)
    {
        List<String> benefits = new ArrayList<>();
        if (Math.abs(a.getTraits().getGrowthRate() - b.getTraits().getGrowthRate()) >= 3)
        {   benefits.add("Complementary growth traits for improved offspring");
        }
        if (a.getTraits().getOffspringViability() >= 8 && b.getTraits().getOffspringViability() >= 8)
        {   benefits.add("High offspring viability expected");
        }
        if (a.getInbreedingCoefficient() < 0.1 && b.getInbreedingCoefficient() < 0.1)
        {   benefits.add("Low inbreeding risk");
        }
        if (averageSurvivalRate(a, b) > 80)
        {   benefits.add("High survival rate expected");
        }
        return benefits.isEmpty() ? new ArrayList<>(List.of(STANDARD_PAIR)) : benefits;
    }

    private static double averageSurvivalRate(GeneticProfile a, GeneticProfile b)
    {   return (a.getPerformanceMetrics().getOffspringSurvivalRate() + b.getPerformanceMetrics().getOffspringSurvivalRate()) / 2;
    }
}
