package com.fhi.farm_breeding.service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fhi.farm_breeding.dto.BirthRequest;
import com.fhi.farm_breeding.dto.BirthStatistics;
import com.fhi.farm_breeding.dto.BirthUpdateRequest;
import com.fhi.farm_breeding.dto.DeathRequest;
import com.fhi.farm_breeding.dto.NeonatalDeathRequest;
import com.fhi.farm_breeding.model.Animal;
import com.fhi.farm_breeding.model.BirthEvent;
import com.fhi.farm_breeding.model.BirthEventStatus;
import com.fhi.farm_breeding.model.NeonatalDeath;
import com.fhi.farm_breeding.model.OffspringTracking;
import com.fhi.farm_breeding.model.Pregnancy;
import com.fhi.farm_breeding.model.PregnancyStatus;
import com.fhi.farm_breeding.repo.BirthEventRepository;
import com.fhi.farm_breeding.service.exception.breeding.BreedingException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Records deliveries.
 *
 * <p>Recording a birth closes the pregnancy and creates the offspring in one transaction:
 * <ol>
 *   <li>persist the {@link BirthEvent}</li>
 *   <li>move the pregnancy to DELIVERED</li>
 *   <li>create one registry entry and tracking record per live birth</li>
 * </ol>
 * Any failure rolls all three back and leaves the pregnancy active.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BirthEventService
{
    private static final String ENTITY = "birth event";
    private static final int TOP_RECORDS = 10;

    private final BirthEventRepository birthEventRepository;
    private final PregnancyService pregnancyService;
    private final OffspringFactory offspringFactory;
    private final OffspringTrackingService trackingService;
    private final BreedingValidator validator;
    private final Clock clock;


    /**
     * @throws BreedingException VALIDATION_ERROR if dam or sire differ from the pregnancy's or the
     *         counts are inconsistent; INVALID_SEX; INVALID_TRANSITION if the pregnancy is not active;
     *         INCONSISTENT_STATE if offspring creation fails unexpectedly.
     */
    @Transactional
    public BirthEvent recordBirth(BirthRequest request, Long userId)
    {
        Pregnancy pregnancy = pregnancyService.requirePregnancy(request.getPregnancyId());
        validator.requireFarmAccess(pregnancy.getFarmId(), userId);

        Long damId = request.getDamId() != null ? request.getDamId() : pregnancy.getDamId();
        Long sireId = request.getSireId() != null ? request.getSireId() : pregnancy.getSireId();
        if (!damId.equals(pregnancy.getDamId()) || !sireId.equals(pregnancy.getSireId()))
        {   throw BreedingException.validation("Dam and sire must match pregnancy " + pregnancy.getId()
                                               + " (dam " + pregnancy.getDamId() + ", sire " + pregnancy.getSireId() + ")");
        }
        Animal dam = validator.requireAnimal(damId);
        Animal sire = validator.requireAnimal(sireId);
        validator.requireDam(dam);
        validator.requireSire(sire);

        if (!pregnancy.getStatus().isActive())
        {   throw BreedingException.invalidTransition("record a birth for", "pregnancy", pregnancy.getId(), pregnancy.getStatus());
        }
        if (birthEventRepository.existsByPregnancyId(pregnancy.getId()))
        {   throw BreedingException.conflict("Pregnancy " + pregnancy.getId() + " already has a birth event");
        }
        validateCounts(request);

        BirthEvent birthEvent = birthEventRepository.save(toBirthEvent(request, pregnancy, userId));

        PregnancyStatus previous = pregnancy.getStatus();
        pregnancy.changeStatus(PregnancyStatus.DELIVERED);
        pregnancy.setActualDeliveryDate(request.getBirthDate());
        log.info("Birth event {} recorded for dam {}: pregnancy {} {} -> DELIVERED, {} live of {}",
                 birthEvent.getId(), dam.describe(), pregnancy.getId(), previous,
                 birthEvent.getLiveBirths(), birthEvent.getTotalOffspring());

        if (birthEvent.getLiveBirths() > 0)
        {   createOffspring(birthEvent, dam, sire, request.getBirthWeightKg(), userId);
        }
        return birthEvent;
    }

    @Transactional(readOnly = true)
    public BirthEvent get(Long birthEventId, Long userId)
    {   return requireAccessibleBirthEvent(birthEventId, userId);
    }

    @Transactional(readOnly = true)
    public List<BirthEvent> listByFarm(Long farmId, Long userId)
    {
        validator.requireFarmAccess(farmId, userId);
        return birthEventRepository.findByFarmIdAndActiveTrueOrderByBirthDateDesc(farmId);
    }

    @Transactional(readOnly = true)
    public List<BirthEvent> listByDam(Long damId, Long userId)
    {
        validator.requireAccessibleAnimal(damId, userId);
        return birthEventRepository.findByDamIdAndActiveTrueOrderByBirthDate(damId);
    }

    /**
     * Updates the descriptive fields.
     *
     * @throws BreedingException IMMUTABLE_FIELD_CHANGE on an attempt to rebind pregnancy, dam, sire or farm.
     */
    @Transactional
    public BirthEvent update(Long birthEventId, BirthUpdateRequest request, Long userId)
    {
        BirthEvent birthEvent = requireAccessibleBirthEvent(birthEventId, userId);

        requireUnchanged("farmId",      request.getFarmId(),      birthEvent.getFarmId(),      birthEventId);
        requireUnchanged("pregnancyId", request.getPregnancyId(), birthEvent.getPregnancyId(), birthEventId);
        requireUnchanged("damId",       request.getDamId(),       birthEvent.getDamId(),       birthEventId);
        requireUnchanged("sireId",      request.getSireId(),      birthEvent.getSireId(),      birthEventId);

        if (request.getBirthTime() != null)               birthEvent.setBirthTime(request.getBirthTime());
        if (request.getLocation() != null)                birthEvent.setLocation(request.getLocation());
        if (request.getAssistedBirth() != null)           birthEvent.setAssistedBirth(request.getAssistedBirth());
        if (request.getAssistanceType() != null)          birthEvent.setAssistanceType(request.getAssistanceType());
        if (request.getDamCondition() != null)            birthEvent.setDamCondition(request.getDamCondition());
        if (request.getDamComplications() != null)        birthEvent.setDamComplications(request.getDamComplications());
        if (request.getOffspringComplications() != null)  birthEvent.setOffspringComplications(request.getOffspringComplications());
        if (request.getRequiresFollowup() != null)        birthEvent.setRequiresFollowup(request.getRequiresFollowup());
        if (request.getFollowupDate() != null)            birthEvent.setFollowupDate(request.getFollowupDate());
        if (request.getNotes() != null)                   birthEvent.setNotes(request.getNotes());

        return birthEvent;
    }

    /**
     * Closes the birth event. Without any live birth it is recorded as FAILED, with neonatal
     * losses as PARTIAL_SUCCESS.
     */
    @Transactional
    public BirthEvent markCompleted(Long birthEventId, Long userId)
    {
        BirthEvent birthEvent = requireAccessibleBirthEvent(birthEventId, userId);
        if (birthEvent.getStatus() != BirthEventStatus.IN_PROGRESS)
        {   throw BreedingException.invalidTransition("complete", ENTITY, birthEventId, birthEvent.getStatus());
        }

        BirthEventStatus status;
        if (birthEvent.getLiveBirths() == 0)                 status = BirthEventStatus.FAILED;
        else if (!birthEvent.getNeonatalDeaths().isEmpty()
              || birthEvent.getStillbirths() > 0)            status = BirthEventStatus.PARTIAL_SUCCESS;
        else                                                 status = BirthEventStatus.COMPLETED;

        birthEvent.setStatus(status);
        birthEvent.setCompletionDate(LocalDate.now(clock));
        log.info("Birth event {} closed as {}", birthEventId, status);
        return birthEvent;
    }

    /**
     * Records the death of a newborn of this event and applies it to the offspring's tracking
     * and registry entry.
     *
     * @throws BreedingException VALIDATION_ERROR if the offspring was not born in this event.
     */
    @Transactional
    public BirthEvent recordNeonatalDeath(Long birthEventId, NeonatalDeathRequest request, Long userId)
    {
        BirthEvent birthEvent = requireAccessibleBirthEvent(birthEventId, userId);
        if (!birthEvent.hasOffspring(request.getOffspringId()))
        {   throw BreedingException.validation("Animal " + request.getOffspringId() + " was not born in birth event " + birthEventId);
        }

        DeathRequest death = new DeathRequest();
        death.setDeathDate(request.getDeathDate());
        death.setCause(request.getCause());
        death.setNotes(request.getNotes());
        trackingService.recordDeath(request.getOffspringId(), death, userId);

        birthEvent.getNeonatalDeaths().add(new NeonatalDeath(request.getOffspringId(), request.getDeathDate(),
                                                             request.getCause(), request.getNotes()));
        log.info("Birth event {}: neonatal death of offspring {} ({})", birthEventId, request.getOffspringId(), request.getCause());
        return birthEvent;
    }

    /**
     * All-time figures over the farm's birth events. Survival follows the offspring's tracking
     * records: still ALIVE or WEANED counts as survived.
     */
    @Transactional(readOnly = true)
    public BirthStatistics statistics(Long farmId, Long userId)
    {
        validator.requireFarmAccess(farmId, userId);
        List<BirthEvent> births = birthEventRepository.findByFarmIdAndActiveTrueOrderByBirthDateDesc(farmId);

        Map<Long, Long> survivorsByBirth = trackingService.findFarmTracking(farmId)
                .stream()
                .filter(t -> t.getBirthEventId() != null && t.getStatus().isOnFarm())
                .collect(Collectors.groupingBy(OffspringTracking::getBirthEventId, Collectors.counting()));

        SortedMap<String, Long> byMonth = new TreeMap<>();
        Map<Long, BirthStatistics.DamRecord> dams = new LinkedHashMap<>();
        int born = 0;
        int live = 0;
        int still = 0;
        long survived = 0;

        for (BirthEvent birth : births)
        {
            born += birth.getTotalOffspring();
            live += birth.getLiveBirths();
            still += birth.getStillbirths();
            survived += survivorsByBirth.getOrDefault(birth.getId(), 0L);
            byMonth.merge(YearMonth.from(birth.getBirthDate()).toString(), 1L, Long::sum);

            BirthStatistics.DamRecord dam = dams.computeIfAbsent(birth.getDamId(), id -> new BirthStatistics.DamRecord(id, 0, 0, 0, 0.0));
            dam.setBirthEvents(dam.getBirthEvents() + 1);
            dam.setTotalOffspring(dam.getTotalOffspring() + birth.getTotalOffspring());
            dam.setLiveBirths(dam.getLiveBirths() + birth.getLiveBirths());
        }
        dams.values().forEach(d -> d.setAverageLitterSize(Rates.average(d.getLiveBirths(), d.getBirthEvents())));

        List<BirthStatistics.DamRecord> topDams = dams.values()
                                                      .stream()
                                                      .sorted(Comparator.comparingInt(BirthStatistics.DamRecord::getTotalOffspring).reversed())
                                                      .limit(TOP_RECORDS)
                                                      .toList();

        return new BirthStatistics(farmId, births.size(), born, live, still,
                                   Rates.average(live, births.size()),
                                   Rates.percent(still, born),
                                   Rates.percent(survived, live),
                                   byMonth, topDams);
    }


    private void createOffspring(BirthEvent birthEvent, Animal dam, Animal sire, Double birthWeightKg, Long userId)
    {
        try
        {   offspringFactory.createOffspring(birthEvent, dam, sire, birthWeightKg, userId);
        }
        catch (BreedingException e)
        {   throw e;
        }
        catch (RuntimeException e)
        {   log.error("Offspring creation failed for birth event {} of pregnancy {}, rolling back",
                      birthEvent.getId(), birthEvent.getPregnancyId(), e);
            throw BreedingException.inconsistentState("Offspring creation failed for birth event " + birthEvent.getId(), e);
        }
    }

    /**
     * Count invariants: live + still &lt;= total, weak &lt;= live, male + female &lt;= live.
     */
    private static void validateCounts(BirthRequest request)
    {
        int total = request.getTotalOffspring();
        int live = request.getLiveBirths();

        if (total < 0 || live < 0 || request.getStillbirths() < 0 || request.getWeakOffspring() < 0
            || request.getMaleOffspring() < 0 || request.getFemaleOffspring() < 0)
        {   throw BreedingException.validation("Offspring counts cannot be negative");
        }
        if (live + request.getStillbirths() > total)
        {   throw BreedingException.validation("Live births (" + live + ") plus stillbirths (" + request.getStillbirths()
                                               + ") exceed total offspring (" + total + ")");
        }
        if (request.getWeakOffspring() > live)
        {   throw BreedingException.validation("Weak offspring (" + request.getWeakOffspring() + ") exceed live births (" + live + ")");
        }
        if (request.getMaleOffspring() + request.getFemaleOffspring() > live)
        {   throw BreedingException.validation("Male and female offspring (" + (request.getMaleOffspring() + request.getFemaleOffspring())
                                               + ") exceed live births (" + live + ")");
        }
    }

    private static BirthEvent toBirthEvent(BirthRequest request, Pregnancy pregnancy, Long userId)
    {
        BirthEvent birthEvent = new BirthEvent();
        birthEvent.setFarmId(pregnancy.getFarmId());
        birthEvent.setPregnancyId(pregnancy.getId());
        birthEvent.setDamId(pregnancy.getDamId());
        birthEvent.setSireId(pregnancy.getSireId());
        birthEvent.setBirthDate(request.getBirthDate());
        birthEvent.setBirthTime(request.getBirthTime());
        birthEvent.setLocation(request.getLocation());
        birthEvent.setTotalOffspring(request.getTotalOffspring());
        birthEvent.setLiveBirths(request.getLiveBirths());
        birthEvent.setStillbirths(request.getStillbirths());
        birthEvent.setWeakOffspring(request.getWeakOffspring());
        birthEvent.setMaleOffspring(request.getMaleOffspring());
        birthEvent.setFemaleOffspring(request.getFemaleOffspring());
        birthEvent.setAssistedBirth(request.isAssistedBirth());
        birthEvent.setAssistanceType(request.getAssistanceType());
        birthEvent.setDamCondition(request.getDamCondition());
        birthEvent.setDamComplications(request.getDamComplications());
        birthEvent.setOffspringComplications(request.getOffspringComplications());
        birthEvent.setRequiresFollowup(request.isRequiresFollowup());
        birthEvent.setFollowupDate(request.getFollowupDate());
        birthEvent.setNotes(request.getNotes());
        birthEvent.setRecordedBy(userId);
        return birthEvent;
    }

    private BirthEvent requireAccessibleBirthEvent(Long birthEventId, Long userId)
    {
        BirthEvent birthEvent = birthEventRepository.findById(birthEventId)
                                                    .filter(BirthEvent::isActive)
                                                    .orElseThrow(() -> BreedingException.notFound("Birth event", birthEventId));
        validator.requireFarmAccess(birthEvent.getFarmId(), userId);
        return birthEvent;
    }

    private static void requireUnchanged(String field, Long requested, Long current, Long birthEventId)
    {
        if (requested != null && !requested.equals(current))
        {   throw BreedingException.immutableField(field, ENTITY, birthEventId);
        }
    }
}
