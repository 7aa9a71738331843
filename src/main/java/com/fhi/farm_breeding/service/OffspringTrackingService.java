package com.fhi.farm_breeding.service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fhi.farm_breeding.dto.CullingRequest;
import com.fhi.farm_breeding.dto.DeathRequest;
import com.fhi.farm_breeding.dto.OffspringStatistics;
import com.fhi.farm_breeding.dto.OffspringTrackingView;
import com.fhi.farm_breeding.dto.SaleRequest;
import com.fhi.farm_breeding.dto.TrackingUpdateRequest;
import com.fhi.farm_breeding.dto.TransferRequest;
import com.fhi.farm_breeding.dto.WeaningRequest;
import com.fhi.farm_breeding.model.Animal;
import com.fhi.farm_breeding.model.AnimalStatus;
import com.fhi.farm_breeding.model.CullingDetails;
import com.fhi.farm_breeding.model.DeathCause;
import com.fhi.farm_breeding.model.DeathDetails;
import com.fhi.farm_breeding.model.GrowthMeasurement;
import com.fhi.farm_breeding.model.OffspringStatus;
import com.fhi.farm_breeding.model.OffspringTracking;
import com.fhi.farm_breeding.model.SaleDetails;
import com.fhi.farm_breeding.model.TransferDetails;
import com.fhi.farm_breeding.registry.AnimalRegistry;
import com.fhi.farm_breeding.repo.OffspringTrackingRepository;
import com.fhi.farm_breeding.service.exception.breeding.BreedingException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Post-birth lifecycle of offspring.
 *
 * <pre>
 *   ALIVE -> WEANED -> SOLD | DIED | TRANSFERRED | CULLED
 *   ALIVE -> SOLD | DIED | TRANSFERRED | CULLED
 * </pre>
 *
 * Terminal transitions are mirrored onto the offspring's registry entry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OffspringTrackingService
{
    private static final String ENTITY = "offspring";
    private static final int TOP_RECORDS = 10;

    private final OffspringTrackingRepository trackingRepository;
    private final AnimalRegistry animalRegistry;
    private final BreedingValidator validator;
    private final Clock clock;


    /**
     * Tracking record of the animal. Animals without one (registered before tracking existed)
     * get one on first access. The identity snapshot is refreshed from the registry.
     */
    @Transactional
    public OffspringTrackingView get(Long offspringId, Long userId)
    {   return view(requireTracking(offspringId, userId));
    }

    /**
     * @throws BreedingException INVALID_TRANSITION unless the offspring is ALIVE.
     */
    @Transactional
    public OffspringTrackingView recordWeaning(Long offspringId, WeaningRequest request, Long userId)
    {
        OffspringTracking tracking = requireTracking(offspringId, userId);
        if (tracking.getStatus() != OffspringStatus.ALIVE)
        {   throw BreedingException.invalidTransition("wean", ENTITY, offspringId, tracking.getStatus());
        }

        LocalDate date = orToday(request.getWeaningDate());
        tracking.setWeaningDate(date);
        if (request.getWeaningWeightKg() != null)
        {   tracking.setWeaningWeightKg(request.getWeaningWeightKg());
        }
        if (request.getNotes() != null)
        {   tracking.setNotes(request.getNotes());
        }
        transition(tracking, OffspringStatus.WEANED, date);
        return view(tracking);
    }

    @Transactional
    public OffspringTrackingView recordSale(Long offspringId, SaleRequest request, Long userId)
    {
        OffspringTracking tracking = requireOnFarm(offspringId, userId, "sell");

        LocalDate date = orToday(request.getSaleDate());
        SaleDetails sale = new SaleDetails();
        sale.setSaleDate(date);
        sale.setSalePrice(request.getSalePrice());
        sale.setSaleCurrency(request.getSaleCurrency());
        sale.setBuyer(request.getBuyer());
        sale.setBuyerContact(request.getBuyerContact());
        tracking.setSale(sale);

        transition(tracking, OffspringStatus.SOLD, date);
        return view(tracking);
    }

    /**
     * @throws BreedingException ALREADY_TERMINAL if the offspring is already recorded as dead,
     *         INVALID_TRANSITION if it left the farm otherwise.
     */
    @Transactional
    public OffspringTrackingView recordDeath(Long offspringId, DeathRequest request, Long userId)
    {
        OffspringTracking tracking = requireTracking(offspringId, userId);
        if (tracking.getStatus() == OffspringStatus.DIED)
        {   throw BreedingException.alreadyTerminal(offspringId, tracking.getStatus());
        }
        if (!tracking.getStatus().isOnFarm())
        {   throw BreedingException.invalidTransition("record the death of", ENTITY, offspringId, tracking.getStatus());
        }

        LocalDate date = orToday(request.getDeathDate());
        DeathDetails death = new DeathDetails();
        death.setDeathDate(date);
        death.setDeathCause(request.getCause() != null ? request.getCause() : DeathCause.OTHER);
        death.setDeathNotes(request.getNotes());
        tracking.setDeath(death);

        transition(tracking, OffspringStatus.DIED, date);
        return view(tracking);
    }

    @Transactional
    public OffspringTrackingView recordCulling(Long offspringId, CullingRequest request, Long userId)
    {
        OffspringTracking tracking = requireOnFarm(offspringId, userId, "cull");

        LocalDate date = orToday(request.getCullingDate());
        CullingDetails culling = new CullingDetails();
        culling.setCullingDate(date);
        culling.setCullingReason(request.getReason());
        culling.setCullingNotes(request.getNotes());
        tracking.setCulling(culling);

        transition(tracking, OffspringStatus.CULLED, date);
        return view(tracking);
    }

    @Transactional
    public OffspringTrackingView recordTransfer(Long offspringId, TransferRequest request, Long userId)
    {
        OffspringTracking tracking = requireOnFarm(offspringId, userId, "transfer");

        LocalDate date = orToday(request.getTransferDate());
        TransferDetails transfer = new TransferDetails();
        transfer.setTransferDate(date);
        transfer.setTransferDestination(request.getDestination());
        transfer.setTransferNotes(request.getNotes());
        tracking.setTransfer(transfer);

        transition(tracking, OffspringStatus.TRANSFERRED, date);
        return view(tracking);
    }

    /**
     * Appends a growth measurement. Measurements are never rewritten.
     */
    @Transactional
    public OffspringTrackingView recordGrowth(Long offspringId, GrowthMeasurement measurement, Long userId)
    {
        OffspringTracking tracking = requireOnFarm(offspringId, userId, "record growth of");
        if (measurement.getMeasuredOn() == null)
        {   measurement.setMeasuredOn(LocalDate.now(clock));
        }
        tracking.getGrowthMeasurements().add(measurement);
        log.debug("Offspring {}: growth measurement of {} recorded ({} kg)", offspringId, measurement.getMeasuredOn(), measurement.getWeightKg());
        return view(tracking);
    }

    /**
     * Updates health, birth weight and notes.
     *
     * @throws BreedingException IMMUTABLE_FIELD_CHANGE on an attempt to rebind farm, offspring, dam,
     *         sire or birth event.
     */
    @Transactional
    public OffspringTrackingView update(Long offspringId, TrackingUpdateRequest request, Long userId)
    {
        OffspringTracking tracking = requireTracking(offspringId, userId);

        requireUnchanged("farmId",       request.getFarmId(),       tracking.getFarmId(),       offspringId);
        requireUnchanged("offspringId",  request.getOffspringId(),  tracking.getOffspringId(),  offspringId);
        requireUnchanged("damId",        request.getDamId(),        tracking.getDamId(),        offspringId);
        requireUnchanged("sireId",       request.getSireId(),       tracking.getSireId(),       offspringId);
        requireUnchanged("birthEventId", request.getBirthEventId(), tracking.getBirthEventId(), offspringId);

        if (request.getNeonatalHealth() != null)           tracking.setNeonatalHealth(request.getNeonatalHealth());
        if (request.getBirthWeightKg() != null)            tracking.setBirthWeightKg(request.getBirthWeightKg());
        if (request.getRequiresSpecialAttention() != null) tracking.setRequiresSpecialAttention(request.getRequiresSpecialAttention());
        if (request.getNotes() != null)                    tracking.setNotes(request.getNotes());

        return view(tracking);
    }

    @Transactional(readOnly = true)
    public List<OffspringTrackingView> listByDam(Long damId, Long userId)
    {
        validator.requireAccessibleAnimal(damId, userId);
        return trackingRepository.findByDamIdAndActiveTrueOrderByOffspringId(damId).stream().map(this::view).toList();
    }

    @Transactional(readOnly = true)
    public List<OffspringTrackingView> listBySire(Long sireId, Long userId)
    {
        validator.requireAccessibleAnimal(sireId, userId);
        return trackingRepository.findBySireIdAndActiveTrueOrderByOffspringId(sireId).stream().map(this::view).toList();
    }

    /**
     * All-time figures over the farm's tracking records. Animals never accessed through tracking
     * have no record yet and are not counted.
     */
    @Transactional(readOnly = true)
    public OffspringStatistics statistics(Long farmId, Long userId)
    {
        validator.requireFarmAccess(farmId, userId);
        List<OffspringTracking> offspring = findFarmTracking(farmId);

        Map<OffspringStatus, Long> byStatus = offspring.stream()
                .collect(Collectors.groupingBy(OffspringTracking::getStatus, () -> new EnumMap<>(OffspringStatus.class), Collectors.counting()));
        Map<String, Long> byBreed = offspring.stream()
                .collect(Collectors.groupingBy(t -> t.getSnapshot().getBreed() != null ? t.getSnapshot().getBreed() : "unknown",
                                               TreeMap::new, Collectors.counting()));

        long onFarm = offspring.stream().filter(t -> t.getStatus().isOnFarm()).count();
        List<OffspringTracking> weaned = offspring.stream().filter(t -> t.getWeaningDate() != null).toList();
        List<Long> weaningAges = weaned.stream()
                                       .filter(t -> t.getSnapshot().getDateOfBirth() != null)
                                       .map(t -> ChronoUnit.DAYS.between(t.getSnapshot().getDateOfBirth(), t.getWeaningDate()))
                                       .toList();

        return new OffspringStatistics(farmId,
                                       offspring.size(),
                                       byStatus,
                                       byBreed,
                                       Rates.percent(onFarm, offspring.size()),
                                       Rates.percent(weaned.size(), offspring.size()),
                                       Rates.average(weaningAges.stream().mapToLong(Long::longValue).sum(), weaningAges.size()),
                                       topParents(offspring, OffspringTracking::getDamId),
                                       topParents(offspring, OffspringTracking::getSireId));
    }

    /**
     * The farm's active tracking records. No ownership check.
     */
    public List<OffspringTracking> findFarmTracking(Long farmId)
    {   return trackingRepository.findByFarmIdAndActiveTrueOrderByOffspringId(farmId);
    }


    private static List<OffspringStatistics.ParentRecord> topParents(List<OffspringTracking> offspring, Function<OffspringTracking, Long> parent)
    {
        Map<Long, OffspringStatistics.ParentRecord> parents = new LinkedHashMap<>();
        for (OffspringTracking tracking : offspring)
        {
            Long parentId = parent.apply(tracking);
            if (parentId == null) continue;

            OffspringStatistics.ParentRecord record = parents.computeIfAbsent(parentId, id -> new OffspringStatistics.ParentRecord(id, 0, 0, 0));
            record.setTotalOffspring(record.getTotalOffspring() + 1);
            if (tracking.getStatus().isOnFarm() || tracking.getStatus() == OffspringStatus.SOLD)
            {   record.setAliveOffspring(record.getAliveOffspring() + 1);
            }
            if (tracking.getWeaningDate() != null)
            {   record.setWeanedOffspring(record.getWeanedOffspring() + 1);
            }
        }
        return parents.values()
                      .stream()
                      .sorted(Comparator.comparingInt(OffspringStatistics.ParentRecord::getTotalOffspring).reversed())
                      .limit(TOP_RECORDS)
                      .toList();
    }

    private OffspringTracking requireTracking(Long offspringId, Long userId)
    {
        Animal animal = validator.requireAccessibleAnimal(offspringId, userId);
        OffspringTracking tracking = trackingRepository.findByOffspringId(offspringId)
                                                       .orElseGet(() -> createForExistingAnimal(animal, userId));
        tracking.refreshSnapshot(animal);
        return tracking;
    }

    private OffspringTracking createForExistingAnimal(Animal animal, Long userId)
    {
        OffspringTracking tracking = OffspringTracking.forAnimal(animal, userId);
        OffspringStatus status = statusOf(animal.getStatus());
        if (status != OffspringStatus.ALIVE)
        {   tracking.changeStatus(status, animal.getStatusDate() != null ? animal.getStatusDate() : animal.getDateOfDeath());
        }
        if (status == OffspringStatus.DIED)
        {   DeathDetails death = new DeathDetails();
            death.setDeathDate(animal.getDateOfDeath());
            death.setDeathCause(DeathCause.OTHER);
            tracking.setDeath(death);
        }
        log.info("Created tracking for existing animal {} in status {}", animal.describe(), status);
        return trackingRepository.save(tracking);
    }

    private OffspringTracking requireOnFarm(Long offspringId, Long userId, String action)
    {
        OffspringTracking tracking = requireTracking(offspringId, userId);
        if (!tracking.getStatus().isOnFarm())
        {   throw BreedingException.invalidTransition(action, ENTITY, offspringId, tracking.getStatus());
        }
        return tracking;
    }

    private void transition(OffspringTracking tracking, OffspringStatus target, LocalDate date)
    {
        log.info("Offspring {}: {} -> {} on {}", tracking.getOffspringId(), tracking.getStatus(), target, date);
        tracking.changeStatus(target, date);

        AnimalStatus mirrored = target.mirroredAnimalStatus();
        if (mirrored != null)
        {   animalRegistry.updateLifecycleStatus(tracking.getOffspringId(), mirrored, date);
        }
    }

    private OffspringTrackingView view(OffspringTracking tracking)
    {   return OffspringTrackingView.of(tracking, LocalDate.now(clock));
    }

    private LocalDate orToday(LocalDate date)
    {   return date != null ? date : LocalDate.now(clock);
    }

    private static OffspringStatus statusOf(AnimalStatus animalStatus)
    {
        if (animalStatus == null) return OffspringStatus.ALIVE;
        return switch (animalStatus)
        {
            case DECEASED    -> OffspringStatus.DIED;
            case SOLD        -> OffspringStatus.SOLD;
            case CULLED      -> OffspringStatus.CULLED;
            case TRANSFERRED -> OffspringStatus.TRANSFERRED;
            case ALIVE, ARCHIVED -> OffspringStatus.ALIVE;
        };
    }

    private static void requireUnchanged(String field, Long requested, Long current, Long offspringId)
    {
        if (requested != null && !requested.equals(current))
        {   throw BreedingException.immutableField(field, ENTITY, offspringId);
        }
    }
}
