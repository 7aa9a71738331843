package com.fhi.farm_breeding.service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fhi.farm_breeding.config.BreedingProperties;
import com.fhi.farm_breeding.dto.PregnancyAlerts;
import com.fhi.farm_breeding.dto.PregnancyRequest;
import com.fhi.farm_breeding.dto.PregnancyStatistics;
import com.fhi.farm_breeding.dto.PregnancyUpdateRequest;
import com.fhi.farm_breeding.dto.PregnancyView;
import com.fhi.farm_breeding.dto.TerminationRequest;
import com.fhi.farm_breeding.model.Animal;
import com.fhi.farm_breeding.model.ComplicationSeverity;
import com.fhi.farm_breeding.model.MatingEvent;
import com.fhi.farm_breeding.model.Pregnancy;
import com.fhi.farm_breeding.model.PregnancyCheckup;
import com.fhi.farm_breeding.model.PregnancyComplication;
import com.fhi.farm_breeding.model.PregnancyStatus;
import com.fhi.farm_breeding.model.ReproductiveStatus;
import com.fhi.farm_breeding.model.TerminationReason;
import com.fhi.farm_breeding.registry.AnimalRegistry;
import com.fhi.farm_breeding.repo.MatingEventRepository;
import com.fhi.farm_breeding.repo.PregnancyRepository;
import com.fhi.farm_breeding.service.exception.breeding.BreedingException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Pregnancy tracking: manual registration, gestation clock, checkups, complications and termination.
 *
 * <p>There is no scheduler. A confirmed pregnancy is advanced to PROGRESSING when it is read
 * after the configured number of days, and the new status is persisted then.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PregnancyService
{
    private static final String ENTITY = "pregnancy";
    private static final int TOP_RECORDS = 10;

    private final PregnancyRepository pregnancyRepository;
    private final MatingEventRepository matingEventRepository;
    private final AnimalRegistry animalRegistry;
    private final BreedingValidator validator;
    private final BreedingProperties properties;
    private final Clock clock;


    /**
     * Registers a pregnancy by hand, for a mating whose outcome was not recorded.
     * The dam is marked PREGNANT in the registry.
     *
     * @throws BreedingException VALIDATION_ERROR if the mating event does not involve this dam and sire.
     */
    @Transactional
    public PregnancyView createPregnancy(PregnancyRequest request, Long userId)
    {
        Animal dam = validator.requireAnimal(request.getDamId());
        Animal sire = validator.requireAnimal(request.getSireId());
        MatingEvent event = matingEventRepository.findById(request.getMatingEventId())
                                                 .filter(MatingEvent::isActive)
                                                 .orElseThrow(() -> BreedingException.notFound("Mating event", request.getMatingEventId()));

        validator.requireFarmAccess(dam.getFarmId(), userId);
        if (!event.getSireId().equals(sire.getId()) || !event.involvesDam(dam.getId()))
        {   throw BreedingException.validation("Mating event " + event.getId() + " does not involve dam "
                                               + dam.describe() + " and sire " + sire.describe());
        }
        validator.requireDam(dam);
        validator.requireSire(sire);
        validator.requireReproductionEnabled(dam);
        validator.requireNotPregnant(dam);
        requireLitterRange(request.getExpectedLitterMin(), request.getExpectedLitterMax());

        int gestationDays = request.getExpectedGestationDays() != null ? request.getExpectedGestationDays()
                                                                       : validator.resolveGestationDays(dam, sire);
        Pregnancy pregnancy = Pregnancy.fromMating(event, dam.getId(), gestationDays);
        pregnancy.setConceptionDate(request.getConceptionDate());
        pregnancy.setExpectedDeliveryDate(request.getConceptionDate().plusDays(gestationDays));
        pregnancy.setConfirmedDate(request.getConfirmedDate());
        pregnancy.setConfirmationMethod(request.getConfirmationMethod());
        pregnancy.setExpectedLitterMin(request.getExpectedLitterMin());
        pregnancy.setExpectedLitterMax(request.getExpectedLitterMax());
        pregnancy.setRequiresSpecialCare(request.isRequiresSpecialCare());
        pregnancy.setSpecialCareInstructions(request.getSpecialCareInstructions());
        pregnancy.setNotes(request.getNotes());
        pregnancy.setRecordedBy(userId);

        Pregnancy saved = pregnancyRepository.save(pregnancy);
        animalRegistry.updateReproductiveStatus(dam.getId(), ReproductiveStatus.PREGNANT);
        log.info("Pregnancy {} registered for dam {}, due {}", saved.getId(), dam.describe(), saved.getExpectedDeliveryDate());
        return view(saved);
    }

    @Transactional
    public PregnancyView get(Long pregnancyId, Long userId)
    {   return view(advance(requireAccessiblePregnancy(pregnancyId, userId)));
    }

    @Transactional
    public List<PregnancyView> listByFarm(Long farmId, Long userId)
    {
        validator.requireFarmAccess(farmId, userId);
        return pregnancyRepository.findByFarmIdAndActiveTrueOrderByConceptionDateDesc(farmId)
                                  .stream()
                                  .map(this::advance)
                                  .map(this::view)
                                  .toList();
    }

    @Transactional
    public List<PregnancyView> listByDam(Long damId, Long userId)
    {
        validator.requireAccessibleAnimal(damId, userId);
        return pregnancyRepository.findByDamIdAndActiveTrueOrderByConceptionDate(damId)
                                  .stream()
                                  .map(this::advance)
                                  .map(this::view)
                                  .toList();
    }

    /**
     * Partial update of the descriptive fields.
     *
     * @throws BreedingException IMMUTABLE_FIELD_CHANGE on an attempt to rebind farm, dam, sire or mating event.
     */
    @Transactional
    public PregnancyView update(Long pregnancyId, PregnancyUpdateRequest request, Long userId)
    {
        Pregnancy pregnancy = requireAccessiblePregnancy(pregnancyId, userId);

        requireUnchanged("farmId",        request.getFarmId(),        pregnancy.getFarmId(),        pregnancyId);
        requireUnchanged("damId",         request.getDamId(),         pregnancy.getDamId(),         pregnancyId);
        requireUnchanged("sireId",        request.getSireId(),        pregnancy.getSireId(),        pregnancyId);
        requireUnchanged("matingEventId", request.getMatingEventId(), pregnancy.getMatingEventId(), pregnancyId);

        Integer litterMin = request.getExpectedLitterMin() != null ? request.getExpectedLitterMin() : pregnancy.getExpectedLitterMin();
        Integer litterMax = request.getExpectedLitterMax() != null ? request.getExpectedLitterMax() : pregnancy.getExpectedLitterMax();
        requireLitterRange(litterMin, litterMax);

        if (request.getConfirmedDate() != null)           pregnancy.setConfirmedDate(request.getConfirmedDate());
        if (request.getConfirmationMethod() != null)      pregnancy.setConfirmationMethod(request.getConfirmationMethod());
        pregnancy.setExpectedLitterMin(litterMin);
        pregnancy.setExpectedLitterMax(litterMax);
        if (request.getRequiresSpecialCare() != null)     pregnancy.setRequiresSpecialCare(request.getRequiresSpecialCare());
        if (request.getSpecialCareInstructions() != null) pregnancy.setSpecialCareInstructions(request.getSpecialCareInstructions());
        if (request.getNotes() != null)                   pregnancy.setNotes(request.getNotes());

        return view(advance(pregnancy));
    }

    /**
     * Appends a checkup. Earlier checkups are never rewritten.
     */
    @Transactional
    public PregnancyView addCheckup(Long pregnancyId, PregnancyCheckup checkup, Long userId)
    {
        Pregnancy pregnancy = requireOngoing(pregnancyId, userId, "add a checkup to");
        pregnancy.getCheckups().add(checkup);
        log.debug("Pregnancy {}: checkup of {} recorded", pregnancyId, checkup.getCheckupDate());
        return view(pregnancy);
    }

    @Transactional
    public PregnancyView addComplication(Long pregnancyId, PregnancyComplication complication, Long userId)
    {
        Pregnancy pregnancy = requireOngoing(pregnancyId, userId, "add a complication to");
        pregnancy.getComplications().add(complication);
        if (complication.getSeverity() == ComplicationSeverity.SEVERE)
        {   pregnancy.setRequiresSpecialCare(true);
        }
        log.info("Pregnancy {}: {} complication '{}' recorded", pregnancyId, complication.getSeverity(), complication.getComplicationType());
        return view(pregnancy);
    }

    /**
     * Ends an active pregnancy without a birth. The dam goes back to OPEN.
     *
     * @throws BreedingException VALIDATION_ERROR if the target status is not ABORTED or FAILED,
     *         INVALID_TRANSITION if the pregnancy is no longer active.
     */
    @Transactional
    public PregnancyView terminate(Long pregnancyId, TerminationRequest request, Long userId)
    {
        PregnancyStatus target = request.getStatus();
        if (target != PregnancyStatus.ABORTED && target != PregnancyStatus.FAILED)
        {   throw BreedingException.validation("A pregnancy can only be terminated as ABORTED or FAILED, got " + target);
        }
        Pregnancy pregnancy = requireOngoing(pregnancyId, userId, "terminate");

        PregnancyStatus previous = pregnancy.getStatus();
        pregnancy.changeStatus(target);
        pregnancy.setAbortionDate(request.getDate() != null ? request.getDate() : LocalDate.now(clock));
        pregnancy.setAbortionReason(request.getReason() != null ? request.getReason() : TerminationReason.UNKNOWN);
        pregnancy.setAbortionNotes(request.getNotes());

        animalRegistry.updateReproductiveStatus(pregnancy.getDamId(), ReproductiveStatus.OPEN);
        log.info("Pregnancy {}: {} -> {} ({})", pregnancyId, previous, target, pregnancy.getAbortionReason());
        return view(pregnancy);
    }

    /**
     * Pregnancies of the farm due within the configured window, overdue, or with unresolved complications.
     */
    @Transactional
    public PregnancyAlerts alerts(Long farmId, Long userId)
    {
        validator.requireFarmAccess(farmId, userId);
        LocalDate today = LocalDate.now(clock);

        List<PregnancyView> ongoing = pregnancyRepository.findByFarmIdAndActiveTrueAndStatusIn(farmId, PregnancyStatus.ACTIVE)
                                                         .stream()
                                                         .map(this::advance)
                                                         .map(this::view)
                                                         .toList();

        List<PregnancyView> dueSoon = ongoing.stream()
                .filter(v -> v.getDaysRemaining() >= 0 && v.getDaysRemaining() <= properties.getDueSoonWindowDays())
                .toList();
        List<PregnancyView> overdue = ongoing.stream()
                .filter(PregnancyView::isOverdue)
                .toList();
        List<PregnancyView> withComplications = ongoing.stream()
                .filter(v -> v.getPregnancy().hasUnresolvedComplications())
                .toList();

        log.debug("Farm {} alerts on {}: {} due soon, {} overdue, {} with complications",
                  farmId, today, dueSoon.size(), overdue.size(), withComplications.size());
        return new PregnancyAlerts(farmId, dueSoon, overdue, withComplications);
    }

    /**
     * All-time figures over the farm's pregnancies. Read-only: statuses are evaluated as of today
     * without persisting the advance.
     */
    @Transactional(readOnly = true)
    public PregnancyStatistics statistics(Long farmId, Long userId)
    {
        validator.requireFarmAccess(farmId, userId);
        LocalDate today = LocalDate.now(clock);
        List<Pregnancy> pregnancies = pregnancyRepository.findByFarmIdAndActiveTrueOrderByConceptionDateDesc(farmId);

        Map<PregnancyStatus, Long> byStatus = new EnumMap<>(PregnancyStatus.class);
        SortedMap<String, Long> byMonth = new TreeMap<>();
        Map<Long, PregnancyStatistics.DamRecord> dams = new LinkedHashMap<>();
        long gestationDays = 0;
        int delivered = 0;

        for (Pregnancy pregnancy : pregnancies)
        {
            PregnancyStatus status = pregnancy.effectiveStatus(today, properties.getProgressingAfterDays());
            byStatus.merge(status, 1L, Long::sum);
            byMonth.merge(YearMonth.from(pregnancy.getConceptionDate()).toString(), 1L, Long::sum);

            PregnancyStatistics.DamRecord dam = dams.computeIfAbsent(pregnancy.getDamId(), id -> new PregnancyStatistics.DamRecord(id, 0, 0));
            dam.setTotalPregnancies(dam.getTotalPregnancies() + 1);
            if (status == PregnancyStatus.DELIVERED)
            {   dam.setDeliveredPregnancies(dam.getDeliveredPregnancies() + 1);
                if (pregnancy.getActualDeliveryDate() != null)
                {   gestationDays += ChronoUnit.DAYS.between(pregnancy.getConceptionDate(), pregnancy.getActualDeliveryDate());
                    delivered++;
                }
            }
        }

        int current = (int) pregnancies.stream().filter(Pregnancy::isOngoing).count();
        int deliveredTotal = byStatus.getOrDefault(PregnancyStatus.DELIVERED, 0L).intValue();
        int terminated = byStatus.getOrDefault(PregnancyStatus.ABORTED, 0L).intValue()
                       + byStatus.getOrDefault(PregnancyStatus.FAILED, 0L).intValue();
        List<PregnancyStatistics.DamRecord> topDams = dams.values()
                .stream()
                .sorted(Comparator.comparingDouble((PregnancyStatistics.DamRecord d) -> (double) d.getDeliveredPregnancies() / d.getTotalPregnancies())
                                  .reversed())
                .limit(TOP_RECORDS)
                .toList();

        return new PregnancyStatistics(farmId, pregnancies.size(), current, deliveredTotal, terminated,
                                       Rates.percent(deliveredTotal, pregnancies.size()), byStatus, byMonth,
                                       Rates.average(gestationDays, delivered), topDams);
    }

    /**
     * Soft delete. The pregnancy also gives up its dam's active slot; an ongoing one puts the
     * dam back to OPEN, as termination does.
     */
    @Transactional
    public void delete(Long pregnancyId, Long userId)
    {
        Pregnancy pregnancy = requireAccessiblePregnancy(pregnancyId, userId);
        boolean wasOngoing = pregnancy.isOngoing();
        pregnancy.deactivate();
        if (wasOngoing)
        {   animalRegistry.updateReproductiveStatus(pregnancy.getDamId(), ReproductiveStatus.OPEN);
        }
        log.info("Pregnancy {} deleted{}", pregnancyId, wasOngoing ? ", dam back to OPEN" : "");
    }


    /**
     * Active, ongoing pregnancy used by birth recording. No ownership check.
     */
    public Pregnancy requirePregnancy(Long pregnancyId)
    {   return pregnancyRepository.findById(pregnancyId)
                                  .filter(Pregnancy::isActive)
                                  .orElseThrow(() -> BreedingException.notFound("Pregnancy", pregnancyId));
    }

    /**
     * Persists the CONFIRMED -> PROGRESSING advance if it is due.
     */
    public Pregnancy advance(Pregnancy pregnancy)
    {
        PregnancyStatus effective = pregnancy.effectiveStatus(LocalDate.now(clock), properties.getProgressingAfterDays());
        if (effective != pregnancy.getStatus())
        {   log.info("Pregnancy {}: {} -> {}", pregnancy.getId(), pregnancy.getStatus(), effective);
            pregnancy.changeStatus(effective);
        }
        return pregnancy;
    }

    private PregnancyView view(Pregnancy pregnancy)
    {   return PregnancyView.of(pregnancy, LocalDate.now(clock), properties.getProgressingAfterDays());
    }

    private Pregnancy requireAccessiblePregnancy(Long pregnancyId, Long userId)
    {   Pregnancy pregnancy = requirePregnancy(pregnancyId);
        validator.requireFarmAccess(pregnancy.getFarmId(), userId);
        return pregnancy;
    }

    private Pregnancy requireOngoing(Long pregnancyId, Long userId, String action)
    {
        Pregnancy pregnancy = advance(requireAccessiblePregnancy(pregnancyId, userId));
        if (!pregnancy.isOngoing())
        {   throw BreedingException.invalidTransition(action, ENTITY, pregnancyId, pregnancy.getStatus());
        }
        return pregnancy;
    }

    private static void requireUnchanged(String field, Long requested, Long current, Long pregnancyId)
    {
        if (requested != null && !requested.equals(current))
        {   throw BreedingException.immutableField(field, ENTITY, pregnancyId);
        }
    }

    private static void requireLitterRange(Integer min, Integer max)
    {
        if (min != null && max != null && min > max)
        {   throw BreedingException.validation("Expected litter minimum " + min + " exceeds maximum " + max);
        }
    }
}
