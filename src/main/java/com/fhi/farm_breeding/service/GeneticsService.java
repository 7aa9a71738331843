package com.fhi.farm_breeding.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.ToDoubleFunction;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fhi.farm_breeding.config.BreedingProperties;
import com.fhi.farm_breeding.dto.BatchComputeResult;
import com.fhi.farm_breeding.dto.BreederRanking;
import com.fhi.farm_breeding.dto.CompatibilityReport;
import com.fhi.farm_breeding.dto.GeneticsDashboard;
import com.fhi.farm_breeding.dto.InbreedingRiskReport;
import com.fhi.farm_breeding.dto.PairSuggestion;
import com.fhi.farm_breeding.dto.PairSuggestionCriteria;
import com.fhi.farm_breeding.dto.PedigreeNode;
import com.fhi.farm_breeding.model.Animal;
import com.fhi.farm_breeding.model.Gender;
import com.fhi.farm_breeding.model.GeneticProfile;
import com.fhi.farm_breeding.model.TraitScores;
import com.fhi.farm_breeding.registry.AnimalRegistry;
import com.fhi.farm_breeding.service.exception.breeding.BreedingException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Caller-facing genetics operations: ownership checks in front of the profile engine,
 * plus the farm-wide rankings built on stored profiles.
 *
 * <p>Rankings, pair suggestions and the dashboard read the profiles as last stored;
 * {@link #batchCompute} brings a whole farm up to date.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GeneticsService
{
    private static final int PRIME_AGE_FROM_DAYS = 365;
    private static final int PRIME_AGE_TO_DAYS = 5 * 365;

    private static final double LOW_INBREEDING_BELOW = 0.1;
    private static final double HIGH_INBREEDING_ABOVE = 0.3;
    private static final int DASHBOARD_RECENT_BREEDERS = 5;

    private final GeneticProfileService profileService;
    private final PedigreeTracer pedigreeTracer;
    private final CompatibilityScorer compatibilityScorer;
    private final AnimalRegistry animalRegistry;
    private final BreedingValidator validator;
    private final BreedingProperties properties;


    /**
     * @throws BreedingException FEATURE_DISABLED if genetics is off for the animal's type.
     */
    public GeneticProfile getProfile(Long animalId, boolean forceRefresh, Long userId)
    {
        Animal animal = validator.requireAccessibleAnimal(animalId, userId);
        validator.requireGeneticsEnabled(animal);
        return profileService.computeProfile(animalId, forceRefresh);
    }

    /**
     * @param depth generations below the root; null means the configured pedigree depth.
     *              Clamped to 1 .. maxPedigreeTreeDepth.
     */
    @Transactional(readOnly = true)
    public PedigreeNode pedigreeTree(Long animalId, Integer depth, Long userId)
    {
        Animal animal = validator.requireAccessibleAnimal(animalId, userId);
        int requested = depth != null ? depth : properties.getPedigreeDepth();
        int effective = Math.max(1, Math.min(properties.getMaxPedigreeTreeDepth(), requested));
        return pedigreeTracer.buildTree(animal, effective);
    }

    /**
     * The caller must own the farms of both animals.
     */
    public CompatibilityReport compatibility(Long animalId, Long partnerId, Long userId)
    {
        if (animalId.equals(partnerId))
        {   throw BreedingException.validation("An animal cannot be paired with itself");
        }
        validator.requireAccessibleAnimal(animalId, userId);
        validator.requireAccessibleAnimal(partnerId, userId);

        GeneticProfile profile = profileService.computeProfile(animalId, false);
        GeneticProfile partnerProfile = profileService.computeProfile(partnerId, false);
        return compatibilityScorer.assess(profile, partnerProfile);
    }

    /**
     * Kinship risk of pairing two animals. The caller must own the farms of both.
     */
    public InbreedingRiskReport inbreedingRisk(Long animalId, Long partnerId, Long userId)
    {
        if (animalId.equals(partnerId))
        {   throw BreedingException.validation("An animal cannot be paired with itself");
        }
        validator.requireAccessibleAnimal(animalId, userId);
        validator.requireAccessibleAnimal(partnerId, userId);

        GeneticProfile profile = profileService.computeProfile(animalId, false);
        GeneticProfile partnerProfile = profileService.computeProfile(partnerId, false);
        return compatibilityScorer.inbreedingRisk(profile, partnerProfile);
    }

    /**
     * Best compatible sire/dam pairs among the farm's eligible breeders of the same animal type,
     * best first.
     *
     * @throws BreedingException VALIDATION_ERROR for a minimum compatibility outside 0..100,
     *         a limit below 1 or an UNKNOWN gender.
     */
    @Transactional(readOnly = true)
    public List<PairSuggestion> pairSuggestions(Long farmId, PairSuggestionCriteria criteria, Long userId)
    {
        validator.requireFarmAccess(farmId, userId);

        int minCompatibility = criteria.getMinCompatibility() != null ? criteria.getMinCompatibility()
                                                                      : properties.getPairSuggestionMinCompatibility();
        int limit = criteria.getLimit() != null ? criteria.getLimit() : properties.getPairSuggestionLimit();
        if (minCompatibility < 0 || minCompatibility > 100)
        {   throw BreedingException.validation("minCompatibility must be between 0 and 100, got " + minCompatibility);
        }
        if (limit < 1)
        {   throw BreedingException.validation("limit must be positive");
        }
        if (criteria.getGender() == Gender.UNKNOWN)
        {   throw BreedingException.validation("gender must be MALE or FEMALE");
        }

        Long animalTypeId = criteria.getAnimalTypeId();
        List<GeneticProfile> breeders = profileService.findEligibleBreeders(farmId)
                                                      .stream()
                                                      .filter(p -> animalTypeId == null || animalTypeId.equals(p.getAnimalTypeId()))
                                                      .toList();
        List<GeneticProfile> sires = breeders.stream().filter(p -> p.getGender() == Gender.MALE).toList();
        List<GeneticProfile> dams = breeders.stream().filter(p -> p.getGender() == Gender.FEMALE).toList();

        List<PairSuggestion> suggestions = new ArrayList<>();
        for (GeneticProfile sire : sires)
        {
            for (GeneticProfile dam : dams)
            {
                if (!sire.getAnimalTypeId().equals(dam.getAnimalTypeId())) continue;

                CompatibilityReport report = compatibilityScorer.assess(sire, dam);
                if (report.isCanBreed() && report.getCompatibilityScore() >= minCompatibility)
                {   suggestions.add(new PairSuggestion(sire.getAnimalId(), dam.getAnimalId(), report.getCompatibilityScore(),
                                                       report.getExpectedBenefits(), report.getWarnings()));
                }
            }
        }
        log.debug("Farm {}: {} sires, {} dams, {} pairs scoring {} or more", farmId, sires.size(), dams.size(), suggestions.size(), minCompatibility);

        Set<Long> suggestedFor = new HashSet<>();
        return suggestions.stream()
                          .sorted(Comparator.comparingInt(PairSuggestion::getCompatibilityScore).reversed())
                          .filter(s -> criteria.getGender() == null || suggestedFor.add(focusAnimal(s, criteria.getGender())))
                          .limit(limit)
                          .toList();
    }

    private static Long focusAnimal(PairSuggestion suggestion, Gender gender)
    {   return gender == Gender.MALE ? suggestion.getSireId() : suggestion.getDamId();
    }

    @Transactional(readOnly = true)
    public List<BreederRanking> topBreeders(Long farmId, int limit, Long userId)
    {
        validator.requireFarmAccess(farmId, userId);
        if (limit < 1)
        {   throw BreedingException.validation("limit must be positive");
        }

        return profileService.findEligibleBreeders(farmId)
                             .stream()
                             .map(p -> new BreederRanking(p.getAnimalId(), p.getGender(), breedingScore(p),
                                                          p.getTraits(), p.getPerformanceMetrics()))
                             .sorted(Comparator.comparingInt(BreederRanking::getBreedingScore).reversed())
                             .limit(limit)
                             .toList();
    }

    /**
     * Recomputes the profile of every alive animal on the farm. A failing animal is counted
     * and reported, the others are still computed.
     */
    public BatchComputeResult batchCompute(Long farmId, Long userId)
    {
        validator.requireFarmAccess(farmId, userId);

        List<Animal> animals = animalRegistry.findAliveOnFarm(farmId);
        List<BatchComputeResult.AnimalError> errors = new ArrayList<>();
        int processed = 0;
        int failed = 0;

        for (Animal animal : animals)
        {
            try
            {   profileService.computeProfile(animal.getId(), true);
                processed++;
            }
            catch (RuntimeException e)
            {   failed++;
                log.warn("Farm {}: genetic profile of animal {} failed: {}", farmId, animal.describe(), e.toString());
                if (errors.size() < properties.getBatchErrorReportLimit())
                {   errors.add(new BatchComputeResult.AnimalError(animal.getId(), e.getMessage()));
                }
            }
        }

        log.info("Farm {}: batch computed {} of {} genetic profiles, {} failed", farmId, processed, animals.size(), failed);
        return new BatchComputeResult(farmId, animals.size(), processed, failed, errors);
    }


    /**
     * Breeder counts, trait and performance averages and the inbreeding spread over the farm's
     * stored profiles. Animals without a profile are not counted; run {@link #batchCompute} first
     * for a complete picture.
     */
    @Transactional(readOnly = true)
    public GeneticsDashboard dashboard(Long farmId, Long userId)
    {
        validator.requireFarmAccess(farmId, userId);

        List<GeneticProfile> profiles = profileService.findFarmProfiles(farmId);
        List<GeneticProfile> breeders = profiles.stream().filter(GeneticProfile::isBreeder).toList();
        int eligible = (int) breeders.stream().filter(GeneticProfile::isEligible).count();

        GeneticsDashboard.TraitAverages traits = new GeneticsDashboard.TraitAverages(
                average(profiles, p -> p.getTraits().getGrowthRate()),
                average(profiles, p -> p.getTraits().getFertility()),
                average(profiles, p -> p.getTraits().getOffspringViability()));

        GeneticsDashboard.InbreedingDistribution inbreeding = new GeneticsDashboard.InbreedingDistribution(
                (int) profiles.stream().filter(p -> p.getInbreedingCoefficient() < LOW_INBREEDING_BELOW).count(),
                (int) profiles.stream().filter(p -> p.getInbreedingCoefficient() >= LOW_INBREEDING_BELOW
                                                 && p.getInbreedingCoefficient() <= HIGH_INBREEDING_ABOVE).count(),
                (int) profiles.stream().filter(p -> p.getInbreedingCoefficient() > HIGH_INBREEDING_ABOVE).count());

        GeneticsDashboard.PerformanceAverages performance = new GeneticsDashboard.PerformanceAverages(
                average(breeders, p -> p.getPerformanceMetrics().getOffspringSurvivalRate()),
                average(breeders, p -> p.getPerformanceMetrics().getMatingSuccessRate()),
                average(breeders, p -> p.getPerformanceMetrics().getPregnancySuccessRate()));

        List<GeneticsDashboard.BreederRecommendations> recent = breeders.stream()
                .filter(p -> p.getComputedAt() != null)
                .sorted(Comparator.comparing(GeneticProfile::getComputedAt).reversed())
                .limit(DASHBOARD_RECENT_BREEDERS)
                .map(p -> new GeneticsDashboard.BreederRecommendations(p.getAnimalId(), p.getGender(),
                                                                       List.copyOf(p.getRecommendedPairs()),
                                                                       List.copyOf(p.getAvoidPairs()),
                                                                       p.getComputedAt()))
                .toList();

        log.debug("Farm {}: genetics dashboard over {} profiles, {} breeders", farmId, profiles.size(), breeders.size());
        return new GeneticsDashboard(farmId, profiles.size(), breeders.size(), eligible, traits, inbreeding, performance, recent,
                                     geneticDiversityScore(profiles), breedingProgramStrength(profiles, breeders));
    }

    static int geneticDiversityScore(List<GeneticProfile> profiles)
    {
        if (profiles.size() < 2) return 0;
        double meanInbreeding = profiles.stream().mapToDouble(GeneticProfile::getInbreedingCoefficient).average().orElse(0);
        return (int) Math.round((1 - meanInbreeding) * 100);
    }

    static int breedingProgramStrength(List<GeneticProfile> profiles, List<GeneticProfile> breeders)
    {
        if (breeders.isEmpty()) return 0;
        double meanSurvival = breeders.stream().mapToDouble(p -> p.getPerformanceMetrics().getOffspringSurvivalRate()).average().orElse(0);
        double meanFertility = breeders.stream().mapToDouble(p -> p.getTraits().getFertility()).average().orElse(0);
        double breederShare = (double) breeders.size() / profiles.size();
        return (int) Math.round(meanSurvival * 0.4 + meanFertility * 10 * 0.3 + breederShare * 100 * 0.3);
    }

    private static double average(List<GeneticProfile> profiles, ToDoubleFunction<GeneticProfile> value)
    {   return Math.round(profiles.stream().mapToDouble(value).average().orElse(0) * 10) / 10.0;
    }


    /**
     * Weighted 0-100 score of a breeder:
     * <pre>
     *   0.3 offspring survival rate
     * + 0.2 fertility x 10
     * + 0.2 growth rate x 10
     * + 0.1 (1 - inbreeding coefficient) x 100
     * + 0.2 age score
     * </pre>
     * The age score uses the age at first breeding, 365 days when unknown: 100 from one to five
     * years, losing 10 points per year past five, and 50 below one year. The total is rounded.
     */
    static int breedingScore(GeneticProfile profile)
    {
        TraitScores traits = profile.getTraits();
        double score = profile.getPerformanceMetrics().getOffspringSurvivalRate() * 0.3
                     + traits.getFertility() * 10 * 0.2
                     + traits.getGrowthRate() * 10 * 0.2
                     + (1 - profile.getInbreedingCoefficient()) * 100 * 0.1
                     + ageScore(profile.getBreedingProfile().getFirstBreedingAgeDays()) * 0.2;
        return (int) Math.round(score);
    }

    static double ageScore(Integer firstBreedingAgeDays)
    {
        int age = firstBreedingAgeDays == null || firstBreedingAgeDays == 0 ? PRIME_AGE_FROM_DAYS : firstBreedingAgeDays;
        if (age < PRIME_AGE_FROM_DAYS) return 50;
        if (age <= PRIME_AGE_TO_DAYS)  return 100;
        return Math.max(0, 100 - (age - PRIME_AGE_TO_DAYS) / 365.0 * 10);
    }
}
