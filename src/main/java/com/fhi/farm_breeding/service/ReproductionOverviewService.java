package com.fhi.farm_breeding.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fhi.farm_breeding.dto.AnimalReproductionSummary;
import com.fhi.farm_breeding.dto.BirthStatistics;
import com.fhi.farm_breeding.dto.MatingStatistics;
import com.fhi.farm_breeding.dto.OffspringStatistics;
import com.fhi.farm_breeding.dto.OffspringTrackingView;
import com.fhi.farm_breeding.dto.PregnancyStatistics;
import com.fhi.farm_breeding.dto.PregnancyView;
import com.fhi.farm_breeding.dto.ReproductionDashboard;
import com.fhi.farm_breeding.model.Animal;
import com.fhi.farm_breeding.model.BirthEvent;
import com.fhi.farm_breeding.model.MatingEvent;
import com.fhi.farm_breeding.model.MatingStatus;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read views that span the reproduction services: the farm dashboard and the per-animal summary.
 *
 * <p>Both read pregnancies through {@link PregnancyService}, so a due CONFIRMED -> PROGRESSING
 * advance is persisted here as on any other pregnancy read.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReproductionOverviewService
{
    private static final int DASHBOARD_RECENT = 5;
    private static final int SUMMARY_LATEST = 10;

    private final MatingEventService matingEventService;
    private final PregnancyService pregnancyService;
    private final BirthEventService birthEventService;
    private final OffspringTrackingService trackingService;
    private final BreedingValidator validator;


    @Transactional
    public ReproductionDashboard dashboard(Long farmId, Long userId)
    {
        validator.requireFarmAccess(farmId, userId);

        MatingStatistics matings = matingEventService.statistics(farmId, userId);
        PregnancyStatistics pregnancies = pregnancyService.statistics(farmId, userId);
        BirthStatistics births = birthEventService.statistics(farmId, userId);
        OffspringStatistics offspring = trackingService.statistics(farmId, userId);

        List<MatingEvent> recentMatings = matingEventService.listByFarm(farmId, null, userId)
                                                            .stream()
                                                            .limit(DASHBOARD_RECENT)
                                                            .toList();
        List<PregnancyView> currentPregnancies = pregnancyService.listByFarm(farmId, userId)
                                                                 .stream()
                                                                 .filter(v -> v.getPregnancy().isOngoing())
                                                                 .sorted(Comparator.comparing((PregnancyView v) -> v.getPregnancy().getExpectedDeliveryDate()))
                                                                 .limit(DASHBOARD_RECENT)
                                                                 .toList();
        List<BirthEvent> recentBirths = birthEventService.listByFarm(farmId, userId)
                                                         .stream()
                                                         .limit(DASHBOARD_RECENT)
                                                         .toList();

        ReproductionDashboard.Overview overview = new ReproductionDashboard.Overview(matings.getTotalMatings(),
                                                                                     pregnancies.getTotalPregnancies(),
                                                                                     births.getTotalBirthEvents(),
                                                                                     offspring.getTotalOffspring(),
                                                                                     matings.getSuccessRate());
        ReproductionDashboard.Performance performance = new ReproductionDashboard.Performance(matings.getSuccessRate(),
                                                                                              pregnancies.getSuccessRate(),
                                                                                              births.getAverageLitterSize(),
                                                                                              offspring.getSurvivalRate());

        log.debug("Farm {}: reproduction dashboard with {} matings, {} pregnancies, {} births",
                  farmId, matings.getTotalMatings(), pregnancies.getTotalPregnancies(), births.getTotalBirthEvents());
        return new ReproductionDashboard(farmId, overview, matings, pregnancies, births, offspring,
                                         recentMatings, currentPregnancies, recentBirths,
                                         pregnancyService.alerts(farmId, userId), performance);
    }

    /**
     * Pregnancies, births and offspring of a female; matings as sire and offspring of a male.
     */
    @Transactional
    public AnimalReproductionSummary animalSummary(Long animalId, Long userId)
    {
        Animal animal = validator.requireAccessibleAnimal(animalId, userId);

        AnimalReproductionSummary summary = new AnimalReproductionSummary();
        summary.setAnimalId(animal.getId());
        summary.setTagNumber(animal.getTagNumber());
        summary.setName(animal.getName());
        summary.setGender(animal.getGender());
        summary.setBreed(animal.getBreed());
        summary.setReproductiveStatus(animal.getReproductiveStatus());
        summary.setBreedingStatus(animal.getBreedingStatus());

        if (animal.isFemale())
        {
            List<PregnancyView> pregnancies = pregnancyService.listByDam(animalId, userId);
            List<BirthEvent> births = birthEventService.listByDam(animalId, userId);
            List<OffspringTrackingView> offspring = trackingService.listByDam(animalId, userId);
            summary.setFemaleRecord(new AnimalReproductionSummary.FemaleRecord(latest(pregnancies),
                                                                               latest(births),
                                                                               latest(offspring),
                                                                               pregnancies.size(),
                                                                               births.size(),
                                                                               offspring.size()));
        }
        else if (animal.isMale())
        {
            List<MatingEvent> matings = matingEventService.listByAnimal(animalId, "sire", userId);
            List<OffspringTrackingView> offspring = trackingService.listBySire(animalId, userId);
            long completed = matings.stream().filter(m -> m.getStatus() == MatingStatus.COMPLETED).count();
            long successful = matings.stream().filter(MatingEvent::isSuccessful).count();
            summary.setMaleRecord(new AnimalReproductionSummary.MaleRecord(matings.stream().limit(SUMMARY_LATEST).toList(),
                                                                           latest(offspring),
                                                                           matings.size(),
                                                                           offspring.size(),
                                                                           Rates.percent(successful, completed)));
        }
        return summary;
    }


    /**
     * Last entries of an oldest-first listing, most recent first.
     */
    private static <T> List<T> latest(List<T> oldestFirst)
    {
        List<T> tail = new ArrayList<>(oldestFirst.subList(Math.max(0, oldestFirst.size() - SUMMARY_LATEST), oldestFirst.size()));
        Collections.reverse(tail);
        return tail;
    }
}
