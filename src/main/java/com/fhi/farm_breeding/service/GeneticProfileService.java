package com.fhi.farm_breeding.service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import com.fhi.farm_breeding.config.BreedingProperties;
import com.fhi.farm_breeding.dto.CompatibilityReport;
import com.fhi.farm_breeding.model.Animal;
import com.fhi.farm_breeding.model.AvoidPair;
import com.fhi.farm_breeding.model.BirthEvent;
import com.fhi.farm_breeding.model.BreedingEligibility;
import com.fhi.farm_breeding.model.BreedingProfile;
import com.fhi.farm_breeding.model.BreedingStatus;
import com.fhi.farm_breeding.model.Gender;
import com.fhi.farm_breeding.model.GeneticProfile;
import com.fhi.farm_breeding.model.HealthStatus;
import com.fhi.farm_breeding.model.MatingEvent;
import com.fhi.farm_breeding.model.PedigreeAncestor;
import com.fhi.farm_breeding.model.PerformanceMetrics;
import com.fhi.farm_breeding.model.Pregnancy;
import com.fhi.farm_breeding.model.PregnancyStatus;
import com.fhi.farm_breeding.model.RecommendedPair;
import com.fhi.farm_breeding.model.ReproductiveStatus;
import com.fhi.farm_breeding.model.RiskLevel;
import com.fhi.farm_breeding.model.TraitScores;
import com.fhi.farm_breeding.registry.AnimalRegistry;
import com.fhi.farm_breeding.registry.AnimalTypeCapabilities;
import com.fhi.farm_breeding.registry.AnimalTypeCatalog;
import com.fhi.farm_breeding.repo.BirthEventRepository;
import com.fhi.farm_breeding.repo.GeneticProfileRepository;
import com.fhi.farm_breeding.repo.MatingEventRepository;
import com.fhi.farm_breeding.repo.PregnancyRepository;
import com.fhi.farm_breeding.service.exception.breeding.BreedingException;
import com.fhi.farm_breeding.tools.SingleFlight;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Computes and caches genetic profiles.
 *
 * <p>A profile is rebuilt from scratch in six passes:
 * <ol>
 *   <li>breeding profile (breeder flag, eligibility, season, maturity, breeding dates)</li>
 *   <li>performance metrics from the mating, pregnancy and birth history</li>
 *   <li>trait scores derived from weight and performance</li>
 *   <li>close relatives and inbreeding coefficient</li>
 *   <li>pedigree trace</li>
 *   <li>breeding recommendations against the farm's other breeders</li>
 * </ol>
 * A stored profile is served as is while {@link ProfileFreshnessPolicy} considers it fresh.
 * Concurrent computations for the same animal run once; the others wait for that result.
 * A forced refresh never settles for the result of a plain lookup running at the same time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GeneticProfileService
{
    private final AnimalRegistry animalRegistry;
    private final AnimalTypeCatalog animalTypeCatalog;
    private final GeneticProfileRepository profileRepository;
    private final MatingEventRepository matingEventRepository;
    private final PregnancyRepository pregnancyRepository;
    private final BirthEventRepository birthEventRepository;
    private final InbreedingAnalyzer inbreedingAnalyzer;
    private final PedigreeTracer pedigreeTracer;
    private final CompatibilityScorer compatibilityScorer;
    private final ProfileFreshnessPolicy freshnessPolicy;
    private final BreedingProperties properties;
    private final SingleFlight<Long, GeneticProfile> profileSingleFlight;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;


    /**
     * Stored profile if still fresh, otherwise a recomputed and persisted one.
     *
     * <p>The computation runs in its own transaction (or joins the caller's), so the profile
     * handed to waiting callers is the one that gets stored.
     *
     * @param forceRefresh recompute even if the stored profile is fresh
     * @throws BreedingException NOT_FOUND if the animal does not exist.
     */
    public GeneticProfile computeProfile(Long animalId, boolean forceRefresh)
    {   return profileSingleFlight.execute(animalId, forceRefresh,
                                           () -> transactionTemplate.execute(status -> computeOrReuse(animalId, forceRefresh)));
    }

    public Optional<GeneticProfile> findStoredProfile(Long animalId)
    {   return profileRepository.findByAnimalId(animalId);
    }

    /**
     * Every stored profile of the farm, as last computed.
     */
    public List<GeneticProfile> findFarmProfiles(Long farmId)
    {   return profileRepository.findByFarmIdOrderByAnimalId(farmId);
    }

    /**
     * Stored profiles of the farm's eligible breeders, as last computed.
     */
    public List<GeneticProfile> findEligibleBreeders(Long farmId)
    {   return profileRepository.findBreeders(farmId, BreedingEligibility.ELIGIBLE);
    }

    /**
     * Profile of a prospective partner: the stored one while fresh, otherwise computed on the
     * fly without recommendations and without being stored.
     */
    public GeneticProfile partnerProfile(Animal partner)
    {
        LocalDateTime now = LocalDateTime.now(clock);
        return profileRepository.findByAnimalId(partner.getId())
                                .filter(stored -> !freshnessPolicy.isStale(stored, now))
                                .orElseGet(() -> computeCore(GeneticProfile.forAnimal(partner), partner));
    }


    private GeneticProfile computeOrReuse(Long animalId, boolean forceRefresh)
    {
        Animal animal = animalRegistry.findAnimal(animalId)
                                      .orElseThrow(() -> BreedingException.notFound("Animal", animalId));
        LocalDateTime now = LocalDateTime.now(clock);

        Optional<GeneticProfile> stored = profileRepository.findByAnimalId(animalId);
        if (stored.isPresent() && !forceRefresh && !freshnessPolicy.isStale(stored.get(), now))
        {   log.debug("Animal {}: serving genetic profile computed at {}", animal.describe(), stored.get().getComputedAt());
            return stored.get();
        }

        GeneticProfile profile = stored.orElseGet(() -> GeneticProfile.forAnimal(animal));
        profile.refreshIdentity(animal);
        computeCore(profile, animal);
        updateRecommendations(profile, animal);
        profile.setComputedAt(now);

        GeneticProfile saved = profileRepository.save(profile);
        log.info("Animal {}: genetic profile computed (breeder={}, {}, inbreeding {}, {} relatives, {} ancestors)",
                 animal.describe(), saved.isBreeder(), saved.getBreedingProfile().getEligibility(),
                 saved.getInbreedingCoefficient(), saved.getKnownCloseRelatives().size(), saved.getPedigree().size());
        return saved;
    }

    /**
     * Passes 1 to 5, everything but the recommendations.
     */
    private GeneticProfile computeCore(GeneticProfile profile, Animal animal)
    {
        LocalDate today = LocalDate.now(clock);
        AnimalTypeCapabilities capabilities = animalTypeCatalog.capabilities(animal.getAnimalTypeId());
        List<MatingEvent> matings = matingHistory(animal);

        profile.setBreedingProfile(breedingProfile(animal, capabilities, matings, today));
        profile.setPerformanceMetrics(performanceMetrics(animal, matings));
        profile.setTraits(traitScores(animal, profile.getPerformanceMetrics(), today));

        profile.replaceRelatives(inbreedingAnalyzer.findCloseRelatives(animal));
        profile.setInbreedingCoefficient(inbreedingAnalyzer.inbreedingCoefficient(animal));

        List<PedigreeAncestor> ancestors = pedigreeTracer.traceAncestors(animal, properties.getPedigreeDepth(),
                                                                         properties.getPedigreeMaxAncestors());
        profile.replacePedigree(ancestors);
        profile.setPedigreeGeneration(ancestors.stream().mapToInt(PedigreeAncestor::getGeneration).max().orElse(0));
        return profile;
    }


    // -----------------------------------------
    // Pass 1: breeding profile
    // -----------------------------------------

    private BreedingProfile breedingProfile(Animal animal, AnimalTypeCapabilities capabilities,
                                            List<MatingEvent> matings, LocalDate today)
    {
        BreedingProfile breedingProfile = new BreedingProfile();
        breedingProfile.setBreeder(isBreeder(animal, capabilities));
        gradeEligibility(breedingProfile, animal, capabilities.minBreedingAgeDays(properties.getMinBreedingAgeDays()), today);
        breedingProfile.setBreedingSeason(capabilities.breedingSeason());

        if (animal.getDateOfBirth() != null)
        {   breedingProfile.setAgeAtMaturity(animal.getDateOfBirth().plusDays(capabilities.maturityAgeDays(properties.getMaturityAgeDays())));
        }
        if (!matings.isEmpty())
        {
            LocalDate first = matings.get(0).getMatingDate();
            LocalDate last = matings.get(matings.size() - 1).getMatingDate();
            if (animal.getDateOfBirth() != null)
            {   breedingProfile.setFirstBreedingAgeDays((int) ChronoUnit.DAYS.between(animal.getDateOfBirth(), first));
            }
            breedingProfile.setLastBreedingDate(last);
        }
        return breedingProfile;
    }

    static boolean isBreeder(Animal animal, AnimalTypeCapabilities capabilities)
    {
        if (!capabilities.geneticsEnabled()) return false;
        if (!animal.isAlive() || !animal.isActive()) return false;

        if (animal.isFemale())
        {   ReproductiveStatus status = animal.getReproductiveStatus();
            return status == null || status == ReproductiveStatus.OPEN || status == ReproductiveStatus.DRY;
        }
        if (animal.isMale())
        {   BreedingStatus status = animal.getBreedingStatus();
            return status == null || status == BreedingStatus.ACTIVE;
        }
        return false;
    }

    /**
     * Grades the animal and records why it is not ELIGIBLE. The first failing check wins.
     */
    static void gradeEligibility(BreedingProfile breedingProfile, Animal animal, int minBreedingAgeDays, LocalDate today)
    {
        if (animal.getGender() == null || animal.getGender() == Gender.UNKNOWN)
        {   breedingProfile.grade(BreedingEligibility.INELIGIBLE, "Sex is unknown");
        }
        else if (!animal.isAlive())
        {   breedingProfile.grade(BreedingEligibility.INELIGIBLE, "Animal is " + animal.getStatus());
        }
        else if (animal.getDateOfBirth() == null)
        {   breedingProfile.grade(BreedingEligibility.INELIGIBLE, "Date of birth is missing, age cannot be checked");
        }
        else if (animal.getAgeInDays(today) < minBreedingAgeDays)
        {   breedingProfile.grade(BreedingEligibility.INELIGIBLE,
                                  "Aged " + animal.getAgeInDays(today) + " days, below the minimum breeding age of " + minBreedingAgeDays);
        }
        else if ((animal.isFemale() && animal.getReproductiveStatus() == ReproductiveStatus.INFERTILE)
              || (animal.isMale() && animal.getBreedingStatus() == BreedingStatus.INFERTILE))
        {   breedingProfile.grade(BreedingEligibility.INELIGIBLE, "Recorded as infertile");
        }
        else if (animal.getHealthStatus() == HealthStatus.POOR || animal.getHealthStatus() == HealthStatus.CRITICAL)
        {   breedingProfile.grade(BreedingEligibility.RESTRICTED, "Health status is " + animal.getHealthStatus());
        }
        else
        {   breedingProfile.grade(BreedingEligibility.ELIGIBLE, null);
        }
    }

    /**
     * The animal's matings in date order, as sire or as dam.
     */
    private List<MatingEvent> matingHistory(Animal animal)
    {
        if (animal.isMale())   return matingEventRepository.findBySireIdAndActiveTrueOrderByMatingDate(animal.getId());
        if (animal.isFemale()) return matingEventRepository.findByDam(animal.getId());
        return List.of();
    }


    // -----------------------------------------
    // Pass 2: performance metrics
    // -----------------------------------------

    private PerformanceMetrics performanceMetrics(Animal animal, List<MatingEvent> matings)
    {
        PerformanceMetrics metrics = new PerformanceMetrics();
        List<BirthEvent> births = List.of();

        if (animal.isMale())
        {
            metrics.setTotalMatings(matings.size());
            metrics.setSuccessfulMatings((int) matings.stream().filter(MatingEvent::isSuccessful).count());
            metrics.setMatingSuccessRate(percentage(metrics.getSuccessfulMatings(), metrics.getTotalMatings()));
            births = birthEventRepository.findBySireIdAndActiveTrueOrderByBirthDate(animal.getId());
        }
        else if (animal.isFemale())
        {
            List<Pregnancy> pregnancies = pregnancyRepository.findByDamIdAndActiveTrueOrderByConceptionDate(animal.getId());
            List<Pregnancy> delivered = pregnancies.stream()
                                                   .filter(p -> p.getStatus() == PregnancyStatus.DELIVERED)
                                                   .toList();
            metrics.setTotalPregnancies(pregnancies.size());
            metrics.setSuccessfulPregnancies(delivered.size());
            metrics.setPregnancySuccessRate(percentage(delivered.size(), pregnancies.size()));
            metrics.setAverageGestationDays(delivered.stream()
                                                     .filter(p -> p.getActualDeliveryDate() != null)
                                                     .mapToLong(p -> ChronoUnit.DAYS.between(p.getConceptionDate(), p.getActualDeliveryDate()))
                                                     .average()
                                                     .orElse(0.0));

            births = birthEventRepository.findByDamIdAndActiveTrueOrderByBirthDate(animal.getId());
            metrics.setAverageLitterSize(births.stream().mapToInt(BirthEvent::getTotalOffspring).average().orElse(0.0));
        }

        metrics.setTotalOffspring(births.stream().mapToInt(BirthEvent::getTotalOffspring).sum());
        metrics.setLiveOffspring(births.stream().mapToInt(BirthEvent::getLiveBirths).sum());
        metrics.setOffspringSurvivalRate(percentage(metrics.getLiveOffspring(), metrics.getTotalOffspring()));
        return metrics;
    }

    private static double percentage(int part, int total)
    {   return total == 0 ? 0.0 : part * 100.0 / total;
    }


    // -----------------------------------------
    // Pass 3: traits
    // -----------------------------------------

    private static TraitScores traitScores(Animal animal, PerformanceMetrics metrics, LocalDate today)
    {
        TraitScores traits = new TraitScores();

        long ageInDays = animal.getAgeInDays(today);
        if (animal.getWeightKg() != null && ageInDays > 0)
        {   traits.setGrowthRate(clampTrait(animal.getWeightKg() / ageInDays * 100));
        }

        if (animal.isMale() && metrics.getTotalMatings() > 0)
        {   traits.setFertility(clampTrait(metrics.getMatingSuccessRate() / 10));
        }
        else if (animal.isFemale() && metrics.getTotalPregnancies() > 0)
        {   traits.setFertility(clampTrait(metrics.getPregnancySuccessRate() / 10));
        }

        if (animal.isFemale() && metrics.getAverageLitterSize() > 0)
        {   traits.setLitterSizePotential(clampTrait(metrics.getAverageLitterSize()));
        }

        if (metrics.getTotalOffspring() > 0)
        {   traits.setOffspringViability(clampTrait(metrics.getOffspringSurvivalRate() / 10));
        }
        return traits;
    }

    private static int clampTrait(double value)
    {   return (int) Math.max(1, Math.min(10, Math.round(value)));
    }


    // -----------------------------------------
    // Pass 6: recommendations
    // -----------------------------------------

    private void updateRecommendations(GeneticProfile profile, Animal animal)
    {
        if (!profile.isBreeder() || !profile.isEligible())
        {   profile.replaceRecommendations(List.of(), List.of());
            return;
        }

        Gender partnerGender = animal.isMale() ? Gender.FEMALE : Gender.MALE;
        List<RecommendedPair> recommended = new ArrayList<>();
        List<AvoidPair> avoid = new ArrayList<>();

        for (Animal partner : animalRegistry.findBreedingCandidates(animal.getFarmId(), partnerGender, animal.getAnimalTypeId()))
        {
            if (partner.getId().equals(animal.getId())) continue;

            GeneticProfile partnerProfile = partnerProfile(partner);
            if (!partnerProfile.isBreeder()) continue;

            CompatibilityReport report = compatibilityScorer.assess(profile, partnerProfile);
            if (report.isCanBreed())
            {   recommended.add(new RecommendedPair(partner.getId(), report.getCompatibilityScore(),
                                                    report.getExpectedBenefits(), report.getWarnings()));
            }
            else
            {   avoid.add(new AvoidPair(partner.getId(), String.join(", ", report.getWarnings()),
                                        report.getRiskLevel() == RiskLevel.HIGH ? RiskLevel.HIGH : RiskLevel.MEDIUM));
            }
        }

        recommended.sort(Comparator.comparingInt(RecommendedPair::getCompatibilityScore).reversed());
        int limit = properties.getRecommendationLimit();
        profile.replaceRecommendations(recommended.stream().limit(limit).toList(),
                                       avoid.stream().limit(limit).toList());
        log.debug("Animal {}: {} recommended and {} avoided partners", animal.describe(), recommended.size(), avoid.size());
    }
}
