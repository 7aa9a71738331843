package com.fhi.farm_breeding.service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fhi.farm_breeding.dto.MatingOutcomeRequest;
import com.fhi.farm_breeding.dto.MatingRequest;
import com.fhi.farm_breeding.dto.MatingStatistics;
import com.fhi.farm_breeding.dto.MatingUpdateRequest;
import com.fhi.farm_breeding.model.Animal;
import com.fhi.farm_breeding.model.MatingEvent;
import com.fhi.farm_breeding.model.MatingOutcome;
import com.fhi.farm_breeding.model.MatingStatus;
import com.fhi.farm_breeding.model.MatingType;
import com.fhi.farm_breeding.model.Pregnancy;
import com.fhi.farm_breeding.model.PregnancyStatus;
import com.fhi.farm_breeding.repo.MatingEventRepository;
import com.fhi.farm_breeding.repo.PregnancyRepository;
import com.fhi.farm_breeding.service.exception.breeding.BreedingException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Records breeding attempts and their outcome.
 *
 * <p>A successful outcome fans out into one confirmed {@link Pregnancy} per dam, in the same
 * transaction as the outcome itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatingEventService
{
    private static final String ENTITY = "mating event";

    private final MatingEventRepository matingEventRepository;
    private final PregnancyRepository pregnancyRepository;
    private final BreedingValidator validator;
    private final Clock clock;


    /**
     * Records a planned mating between a sire and one or more dams of the caller's farm.
     *
     * @throws BreedingException NOT_FOUND, PERMISSION_DENIED, VALIDATION_ERROR if the dams live on
     *         another farm, INVALID_SEX, FEATURE_DISABLED, ALREADY_PREGNANT; checked in that order.
     */
    @Transactional
    public MatingEvent recordMating(MatingRequest request, Long userId)
    {
        List<Long> damIds = distinct(request.getDamIds());
        Animal sire = validator.requireAnimal(request.getSireId());
        List<Animal> dams = damIds.stream().map(validator::requireAnimal).toList();

        validator.requireFarmAccess(sire.getFarmId(), userId);
        requireSameFarm(sire, dams);

        validator.requireSire(sire);
        dams.forEach(validator::requireDam);

        validator.requireReproductionEnabled(sire);
        dams.forEach(validator::requireReproductionEnabled);

        dams.forEach(validator::requireNotPregnant);

        MatingEvent event = new MatingEvent();
        event.setFarmId(sire.getFarmId());
        event.setSireId(sire.getId());
        event.setDamIds(new ArrayList<>(damIds));
        event.setMatingType(request.getMatingType());
        event.setMatingDate(request.getMatingDate());
        event.setExpectedConceptionDate(request.getExpectedConceptionDate());
        event.getSemenSource().setSource(request.getSemenSource());
        event.getSemenSource().setBatchNumber(request.getSemenBatchNumber());
        event.getSemenSource().setStrawsUsed(request.getStrawsUsed());
        event.setTechnician(request.getTechnician());
        event.setLocation(request.getLocation());
        event.setCostAmount(request.getCostAmount());
        event.setCostCurrency(request.getCostCurrency());
        event.setRepeatService(request.isRepeatService());
        event.setPreviousMatingEventId(request.getPreviousMatingEventId());
        event.setNotes(request.getNotes());
        event.setRecordedBy(userId);

        MatingEvent saved = matingEventRepository.save(event);
        log.info("Recorded mating event {}: sire {} with dams {} on farm {}",
                 saved.getId(), sire.describe(), damIds, saved.getFarmId());
        return saved;
    }

    /**
     * Records the outcome of a planned mating. A successful outcome creates one pregnancy per dam.
     *
     * <p>Repeating a successful outcome on an already successful event only creates the pregnancies
     * that are missing.
     *
     * @throws BreedingException VALIDATION_ERROR for a status other than COMPLETED/FAILED, or SUCCESSFUL
     *         with FAILED; INVALID_TRANSITION if the event is not PLANNED; ALREADY_PREGNANT if a dam got
     *         pregnant in the meantime.
     */
    @Transactional
    public MatingEvent recordOutcome(Long eventId, MatingOutcomeRequest request, Long userId)
    {
        MatingEvent event = requireAccessibleEvent(eventId, userId);
        MatingStatus status = request.getStatus();
        MatingOutcome outcome = request.getOutcome() != null ? request.getOutcome() : MatingOutcome.UNKNOWN;

        if (status == null || !status.isOutcomeStatus())
        {   throw BreedingException.validation("Outcome status must be COMPLETED or FAILED, got " + status);
        }
        if (outcome == MatingOutcome.SUCCESSFUL && status != MatingStatus.COMPLETED)
        {   throw BreedingException.validation("A SUCCESSFUL outcome requires status COMPLETED");
        }

        boolean repeatedSuccess = event.getStatus() == MatingStatus.COMPLETED
                               && event.isSuccessful()
                               && outcome == MatingOutcome.SUCCESSFUL;
        if (event.getStatus() != MatingStatus.PLANNED && !repeatedSuccess)
        {   throw BreedingException.invalidTransition("record outcome for", ENTITY, eventId, event.getStatus());
        }

        event.setStatus(status);
        event.setOutcome(outcome);
        event.setOutcomeDate(request.getOutcomeDate() != null ? request.getOutcomeDate() : LocalDate.now(clock));
        if (request.getNotes() != null)
        {   event.setOutcomeNotes(request.getNotes());
        }
        log.info("Mating event {}: outcome {} / {}", eventId, status, outcome);

        if (outcome == MatingOutcome.SUCCESSFUL)
        {   createPregnancies(event, userId);
        }
        return matingEventRepository.save(event);
    }

    @Transactional
    public MatingEvent cancel(Long eventId, Long userId)
    {
        MatingEvent event = requireAccessibleEvent(eventId, userId);
        if (event.getStatus() != MatingStatus.PLANNED)
        {   throw BreedingException.invalidTransition("cancel", ENTITY, eventId, event.getStatus());
        }
        event.setStatus(MatingStatus.CANCELLED);
        log.info("Mating event {} cancelled", eventId);
        return event;
    }

    /**
     * Partial update. Sire and dams can only be rebound while the event is planned, and are
     * validated like on creation.
     */
    @Transactional
    public MatingEvent update(Long eventId, MatingUpdateRequest request, Long userId)
    {
        MatingEvent event = requireAccessibleEvent(eventId, userId);

        if (request.getFarmId() != null && !request.getFarmId().equals(event.getFarmId()))
        {   throw BreedingException.immutableField("farmId", ENTITY, eventId);
        }

        boolean rebindsSire = request.getSireId() != null && !request.getSireId().equals(event.getSireId());
        boolean rebindsDams = request.getDamIds() != null && !distinct(request.getDamIds()).equals(event.getDamIds());
        if (rebindsSire || rebindsDams)
        {
            if (event.getStatus() != MatingStatus.PLANNED)
            {   throw BreedingException.immutableField(rebindsSire ? "sireId" : "damIds", ENTITY, eventId);
            }
            rebindParticipants(event, rebindsSire ? request.getSireId() : event.getSireId(),
                                      rebindsDams ? distinct(request.getDamIds()) : event.getDamIds());
        }

        if (request.getMatingType() != null)             event.setMatingType(request.getMatingType());
        if (request.getMatingDate() != null)             event.setMatingDate(request.getMatingDate());
        if (request.getExpectedConceptionDate() != null) event.setExpectedConceptionDate(request.getExpectedConceptionDate());
        if (request.getTechnician() != null)             event.setTechnician(request.getTechnician());
        if (request.getLocation() != null)               event.setLocation(request.getLocation());
        if (request.getCostAmount() != null)             event.setCostAmount(request.getCostAmount());
        if (request.getCostCurrency() != null)           event.setCostCurrency(request.getCostCurrency());
        if (request.getNotes() != null)                  event.setNotes(request.getNotes());

        log.debug("Mating event {} updated", eventId);
        return event;
    }

    /**
     * Soft delete.
     *
     * @throws BreedingException CONFLICT while an active pregnancy still references the event.
     */
    @Transactional
    public void delete(Long eventId, Long userId)
    {
        MatingEvent event = requireAccessibleEvent(eventId, userId);
        if (pregnancyRepository.existsByMatingEventIdAndActiveTrueAndStatusIn(eventId, PregnancyStatus.ACTIVE))
        {   throw BreedingException.conflict("Mating event " + eventId + " is referenced by an active pregnancy");
        }
        event.setActive(false);
        log.info("Mating event {} deleted", eventId);
    }

    @Transactional(readOnly = true)
    public MatingEvent get(Long eventId, Long userId)
    {   return requireAccessibleEvent(eventId, userId);
    }

    @Transactional(readOnly = true)
    public List<MatingEvent> listByFarm(Long farmId, MatingStatus status, Long userId)
    {
        validator.requireFarmAccess(farmId, userId);
        return status == null ? matingEventRepository.findByFarmIdAndActiveTrueOrderByMatingDateDesc(farmId)
                              : matingEventRepository.findByFarmIdAndStatusAndActiveTrueOrderByMatingDateDesc(farmId, status);
    }

    /**
     * Events the animal took part in.
     *
     * @param role "sire", "dam", or null for both
     */
    @Transactional(readOnly = true)
    public List<MatingEvent> listByAnimal(Long animalId, String role, Long userId)
    {
        validator.requireAccessibleAnimal(animalId, userId);

        String normalizedRole = role == null ? "any" : role.toLowerCase();
        List<MatingEvent> events = new ArrayList<>();
        switch (normalizedRole)
        {
            case "sire" -> events.addAll(matingEventRepository.findBySireIdAndActiveTrueOrderByMatingDate(animalId));
            case "dam"  -> events.addAll(matingEventRepository.findByDam(animalId));
            case "any"  ->
            {   events.addAll(matingEventRepository.findBySireIdAndActiveTrueOrderByMatingDate(animalId));
                events.addAll(matingEventRepository.findByDam(animalId));
            }
            default -> throw BreedingException.validation("Unknown role '" + role + "', expected sire, dam or any");
        }
        events.sort((a, b) -> b.getMatingDate().compareTo(a.getMatingDate()));
        return events;
    }

    @Transactional(readOnly = true)
    public MatingStatistics statistics(Long farmId, Long userId)
    {
        validator.requireFarmAccess(farmId, userId);
        List<MatingEvent> events = matingEventRepository.findByFarmIdAndActiveTrueOrderByMatingDateDesc(farmId);

        Map<MatingStatus, Long> byStatus = events.stream()
                .collect(Collectors.groupingBy(MatingEvent::getStatus, () -> new EnumMap<>(MatingStatus.class), Collectors.counting()));
        Map<MatingType, Long> byType = events.stream()
                .collect(Collectors.groupingBy(MatingEvent::getMatingType, () -> new EnumMap<>(MatingType.class), Collectors.counting()));

        long completed = byStatus.getOrDefault(MatingStatus.COMPLETED, 0L);
        int successful = (int) events.stream().filter(MatingEvent::isSuccessful).count();
        return new MatingStatistics(farmId, events.size(), byStatus, byType, successful, Rates.percent(successful, completed));
    }


    private MatingEvent requireAccessibleEvent(Long eventId, Long userId)
    {
        MatingEvent event = matingEventRepository.findById(eventId)
                                                 .filter(MatingEvent::isActive)
                                                 .orElseThrow(() -> BreedingException.notFound("Mating event", eventId));
        validator.requireFarmAccess(event.getFarmId(), userId);
        return event;
    }

    /**
     * One confirmed pregnancy per dam that has none yet for this event, confirmed as of the outcome date.
     */
    private void createPregnancies(MatingEvent event, Long userId)
    {
        Set<Long> alreadyPregnantFromEvent = pregnancyRepository.findByMatingEventIdAndActiveTrue(event.getId())
                                                                .stream()
                                                                .map(Pregnancy::getDamId)
                                                                .collect(Collectors.toSet());
        Animal sire = validator.requireAnimal(event.getSireId());

        for (Long damId : event.getDamIds())
        {
            if (alreadyPregnantFromEvent.contains(damId))
            {   log.debug("Dam {} already has a pregnancy from mating event {}, skipped", damId, event.getId());
                continue;
            }
            Animal dam = validator.requireAnimal(damId);
            validator.requireNotPregnant(dam);

            Pregnancy pregnancy = Pregnancy.fromMating(event, damId, validator.resolveGestationDays(dam, sire));
            pregnancy.setConfirmedDate(event.getOutcomeDate());
            pregnancy.setRecordedBy(userId);
            Pregnancy saved = pregnancyRepository.save(pregnancy);
            log.info("Pregnancy {} created for dam {} from mating event {}, due {}",
                     saved.getId(), dam.describe(), event.getId(), saved.getExpectedDeliveryDate());
        }
    }

    private void rebindParticipants(MatingEvent event, Long sireId, List<Long> damIds)
    {
        Animal sire = validator.requireAnimal(sireId);
        List<Animal> dams = damIds.stream().map(validator::requireAnimal).toList();

        if (!sire.getFarmId().equals(event.getFarmId()))
        {   throw BreedingException.validation("Sire " + sire.describe() + " does not live on farm " + event.getFarmId());
        }
        requireSameFarm(sire, dams);
        validator.requireSire(sire);
        dams.forEach(validator::requireDam);
        validator.requireReproductionEnabled(sire);
        dams.forEach(validator::requireReproductionEnabled);
        dams.stream().filter(dam -> !event.involvesDam(dam.getId())).forEach(validator::requireNotPregnant);

        event.setSireId(sireId);
        event.getDamIds().clear();
        event.getDamIds().addAll(damIds);
    }

    private static void requireSameFarm(Animal sire, List<Animal> dams)
    {
        for (Animal dam : dams)
        {
            if (!dam.getFarmId().equals(sire.getFarmId()))
            {   throw BreedingException.validation("Dam " + dam.describe() + " does not live on the sire's farm " + sire.getFarmId());
            }
        }
    }

    private static List<Long> distinct(List<Long> ids)
    {   return new ArrayList<>(new LinkedHashSet<>(ids));
    }
}
