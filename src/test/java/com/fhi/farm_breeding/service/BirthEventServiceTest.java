package com.fhi.farm_breeding.service;

import static com.fhi.farm_breeding.support.BreedingAssertions.assertBreedingError;
import static com.fhi.farm_breeding.support.TestHerd.GREEN_MEADOW;
import static com.fhi.farm_breeding.support.TestHerd.GREEN_MEADOW_OWNER;
import static com.fhi.farm_breeding.support.TestHerd.STONY_RIDGE_OWNER;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import com.fhi.farm_breeding.dto.BirthRequest;
import com.fhi.farm_breeding.dto.BirthUpdateRequest;
import com.fhi.farm_breeding.dto.MatingOutcomeRequest;
import com.fhi.farm_breeding.dto.MatingRequest;
import com.fhi.farm_breeding.dto.NeonatalDeathRequest;
import com.fhi.farm_breeding.fixtures_fmwk.annotation.Fixtures;
import com.fhi.farm_breeding.fixtures_fmwk.springfixtureloader.annotation.SpringIntegrationTest;
import com.fhi.farm_breeding.model.Animal;
import com.fhi.farm_breeding.model.AnimalStatus;
import com.fhi.farm_breeding.model.AnimalType;
import com.fhi.farm_breeding.model.BirthEvent;
import com.fhi.farm_breeding.model.BirthEventStatus;
import com.fhi.farm_breeding.model.DeathCause;
import com.fhi.farm_breeding.model.Farm;
import com.fhi.farm_breeding.model.Gender;
import com.fhi.farm_breeding.model.MatingEvent;
import com.fhi.farm_breeding.model.MatingOutcome;
import com.fhi.farm_breeding.model.MatingStatus;
import com.fhi.farm_breeding.model.MatingType;
import com.fhi.farm_breeding.model.OffspringStatus;
import com.fhi.farm_breeding.model.OffspringTracking;
import com.fhi.farm_breeding.model.Pregnancy;
import com.fhi.farm_breeding.model.PregnancyStatus;
import com.fhi.farm_breeding.model.ReproductiveStatus;
import com.fhi.farm_breeding.repo.AnimalRepository;
import com.fhi.farm_breeding.repo.OffspringTrackingRepository;
import com.fhi.farm_breeding.repo.PregnancyRepository;
import com.fhi.farm_breeding.service.exception.breeding.BreedingException.Cause;
import com.fhi.farm_breeding.support.TestHerd;


/**
 * Mating on 2025-05-01, litter born 30 days later.
 */
@SpringIntegrationTest
@Fixtures({ AnimalType.class, Farm.class })
class BirthEventServiceTest
{
    private static final LocalDate ADULT = LocalDate.of(2023, 3, 1);
    private static final LocalDate MATING_DATE = LocalDate.of(2025, 5, 1);
    private static final LocalDate BIRTH_DATE = MATING_DATE.plusDays(30);

    @Autowired
    private BirthEventService birthEventService;

    @Autowired
    private MatingEventService matingEventService;

    @Autowired
    private PregnancyRepository pregnancyRepository;

    @Autowired
    private OffspringTrackingRepository trackingRepository;

    @Autowired
    private AnimalRepository animalRepository;

    @Autowired
    private TestHerd herd;

    private Animal buck;
    private Animal doe;
    private Pregnancy pregnancy;

    @BeforeEach
    void setUp()
    {
        Farm farm = herd.farm(GREEN_MEADOW);
        AnimalType rabbit = herd.type("Rabbit");
        buck = herd.male(farm, rabbit, "BUCK-1", ADULT);
        doe = herd.female(farm, rabbit, "DOE-1", ADULT);

        MatingRequest mating = new MatingRequest();
        mating.setSireId(buck.getId());
        mating.setDamIds(List.of(doe.getId()));
        mating.setMatingType(MatingType.NATURAL);
        mating.setMatingDate(MATING_DATE);
        MatingEvent event = matingEventService.recordMating(mating, GREEN_MEADOW_OWNER);

        MatingOutcomeRequest outcome = new MatingOutcomeRequest();
        outcome.setStatus(MatingStatus.COMPLETED);
        outcome.setOutcome(MatingOutcome.SUCCESSFUL);
        matingEventService.recordOutcome(event.getId(), outcome, GREEN_MEADOW_OWNER);

        pregnancy = pregnancyRepository.findByMatingEventIdAndActiveTrue(event.getId()).get(0);
    }

    private BirthRequest litter(int total, int live, int males, int females)
    {
        BirthRequest request = new BirthRequest();
        request.setPregnancyId(pregnancy.getId());
        request.setBirthDate(BIRTH_DATE);
        request.setTotalOffspring(total);
        request.setLiveBirths(live);
        request.setStillbirths(total - live);
        request.setMaleOffspring(males);
        request.setFemaleOffspring(females);
        request.setBirthWeightKg(0.06);
        return request;
    }


    @DisplayName("A litter of 4 with 3 live births creates 3 registered offspring with farm tags")
    @Test
    void recordBirth_shouldCreateOneAnimalPerLiveBirth()
    {
        BirthEvent birthEvent = birthEventService.recordBirth(litter(4, 3, 2, 1), GREEN_MEADOW_OWNER);

        assertThat(birthEvent.getStatus()).isEqualTo(BirthEventStatus.IN_PROGRESS);
        assertThat(birthEvent.getDamId()).isEqualTo(doe.getId());
        assertThat(birthEvent.getSireId()).isEqualTo(buck.getId());
        assertThat(birthEvent.getOffspringIds()).hasSize(3);

        List<Animal> offspring = birthEvent.getOffspringIds().stream().map(id -> animalRepository.findById(id).orElseThrow()).toList();
        assertThat(offspring).extracting(Animal::getTagNumber).containsExactly("RAB25001", "RAB25002", "RAB25003");
        assertThat(offspring).extracting(Animal::getGender).containsExactly(Gender.MALE, Gender.MALE, Gender.FEMALE);
        assertThat(offspring).allSatisfy(child ->
        {
            assertThat(child.getSireId()).isEqualTo(buck.getId());
            assertThat(child.getDamId()).isEqualTo(doe.getId());
            assertThat(child.getBirthEventId()).isEqualTo(birthEvent.getId());
            assertThat(child.getDateOfBirth()).isEqualTo(BIRTH_DATE);
            assertThat(child.getBreed()).isEqualTo("Rabbit common");
            assertThat(child.getStatus()).isEqualTo(AnimalStatus.ALIVE);
            assertThat(child.getReproductiveStatus()).isEqualTo(ReproductiveStatus.IMMATURE);
        });

        List<OffspringTracking> tracking = trackingRepository.findByBirthEventId(birthEvent.getId());
        assertThat(tracking).hasSize(3);
        assertThat(tracking).allSatisfy(t ->
        {
            assertThat(t.getStatus()).isEqualTo(OffspringStatus.ALIVE);
            assertThat(t.getBirthWeightKg()).isEqualTo(0.06);
            assertThat(t.getDamId()).isEqualTo(doe.getId());
        });

        Pregnancy delivered = pregnancyRepository.findById(pregnancy.getId()).orElseThrow();
        assertThat(delivered.getStatus()).isEqualTo(PregnancyStatus.DELIVERED);
        assertThat(delivered.getActualDeliveryDate()).isEqualTo(BIRTH_DATE);
        assertThat(delivered.getActiveDamId()).isNull();

        // the dam's registry status is left to the farmer
        assertThat(herd.reload(doe).getReproductiveStatus()).isEqualTo(ReproductiveStatus.OPEN);
    }

    @Test
    void recordBirth_withoutLiveBirths_shouldCreateNoOffspring()
    {
        BirthEvent birthEvent = birthEventService.recordBirth(litter(2, 0, 0, 0), GREEN_MEADOW_OWNER);

        assertThat(birthEvent.getOffspringIds()).isEmpty();
        assertThat(trackingRepository.findByBirthEventId(birthEvent.getId())).isEmpty();
        assertThat(birthEventService.markCompleted(birthEvent.getId(), GREEN_MEADOW_OWNER).getStatus()).isEqualTo(BirthEventStatus.FAILED);
    }

    @Test
    void recordBirth_shouldValidateCounts()
    {
        assertBreedingError(Cause.VALIDATION_ERROR, () -> birthEventService.recordBirth(litter(3, 4, 0, 0), GREEN_MEADOW_OWNER));
        assertBreedingError(Cause.VALIDATION_ERROR, () -> birthEventService.recordBirth(litter(4, 3, 2, 2), GREEN_MEADOW_OWNER));

        BirthRequest weak = litter(4, 3, 1, 1);
        weak.setWeakOffspring(4);
        assertBreedingError(Cause.VALIDATION_ERROR, () -> birthEventService.recordBirth(weak, GREEN_MEADOW_OWNER));
    }

    @Test
    void recordBirth_shouldRejectMismatchingParents()
    {
        BirthRequest request = litter(3, 3, 1, 2);
        request.setSireId(doe.getId());

        assertBreedingError(Cause.VALIDATION_ERROR, () -> birthEventService.recordBirth(request, GREEN_MEADOW_OWNER));
    }

    @Test
    void recordBirth_shouldRejectOtherOwners()
    {
        assertBreedingError(Cause.PERMISSION_DENIED, () -> birthEventService.recordBirth(litter(3, 3, 1, 2), STONY_RIDGE_OWNER));
    }

    @Test
    void recordBirth_shouldRefuseSecondBirthForThePregnancy()
    {
        birthEventService.recordBirth(litter(3, 3, 1, 2), GREEN_MEADOW_OWNER);

        assertBreedingError(Cause.INVALID_TRANSITION, () -> birthEventService.recordBirth(litter(3, 3, 1, 2), GREEN_MEADOW_OWNER));
    }

    @Test
    void recordNeonatalDeath_shouldMarkOffspringDeadAndCompletePartially()
    {
        BirthEvent birthEvent = birthEventService.recordBirth(litter(3, 3, 1, 2), GREEN_MEADOW_OWNER);
        Long firstBorn = birthEvent.getOffspringIds().get(0);

        NeonatalDeathRequest request = new NeonatalDeathRequest();
        request.setOffspringId(firstBorn);
        request.setDeathDate(BIRTH_DATE.plusDays(1));
        request.setCause(DeathCause.CONGENITAL);
        BirthEvent updated = birthEventService.recordNeonatalDeath(birthEvent.getId(), request, GREEN_MEADOW_OWNER);

        assertThat(updated.getNeonatalDeaths()).hasSize(1);
        assertThat(trackingRepository.findByOffspringId(firstBorn).orElseThrow().getStatus()).isEqualTo(OffspringStatus.DIED);
        Animal dead = animalRepository.findById(firstBorn).orElseThrow();
        assertThat(dead.getStatus()).isEqualTo(AnimalStatus.DECEASED);
        assertThat(dead.getDateOfDeath()).isEqualTo(BIRTH_DATE.plusDays(1));

        BirthEvent completed = birthEventService.markCompleted(birthEvent.getId(), GREEN_MEADOW_OWNER);
        assertThat(completed.getStatus()).isEqualTo(BirthEventStatus.PARTIAL_SUCCESS);
        assertThat(completed.getCompletionDate()).isEqualTo(LocalDate.of(2025, 6, 1));
        assertBreedingError(Cause.INVALID_TRANSITION, () -> birthEventService.markCompleted(birthEvent.getId(), GREEN_MEADOW_OWNER));
    }

    @Test
    void recordNeonatalDeath_shouldRejectForeignOffspring()
    {
        BirthEvent birthEvent = birthEventService.recordBirth(litter(3, 3, 1, 2), GREEN_MEADOW_OWNER);
        NeonatalDeathRequest request = new NeonatalDeathRequest();
        request.setOffspringId(doe.getId());
        request.setDeathDate(BIRTH_DATE);
        request.setCause(DeathCause.OTHER);

        assertBreedingError(Cause.VALIDATION_ERROR,
                            () -> birthEventService.recordNeonatalDeath(birthEvent.getId(), request, GREEN_MEADOW_OWNER));
    }

    @Test
    void markCompleted_withoutLosses_shouldComplete()
    {
        BirthEvent birthEvent = birthEventService.recordBirth(litter(3, 3, 1, 2), GREEN_MEADOW_OWNER);

        assertThat(birthEventService.markCompleted(birthEvent.getId(), GREEN_MEADOW_OWNER).getStatus())
            .isEqualTo(BirthEventStatus.COMPLETED);
    }

    @Test
    void update_shouldRefuseRebindingTheDam()
    {
        BirthEvent birthEvent = birthEventService.recordBirth(litter(3, 3, 1, 2), GREEN_MEADOW_OWNER);

        BirthUpdateRequest rebind = new BirthUpdateRequest();
        rebind.setDamId(buck.getId());
        assertBreedingError(Cause.IMMUTABLE_FIELD_CHANGE, () -> birthEventService.update(birthEvent.getId(), rebind, GREEN_MEADOW_OWNER));

        BirthUpdateRequest followup = new BirthUpdateRequest();
        followup.setRequiresFollowup(true);
        followup.setFollowupDate(LocalDate.of(2025, 6, 7));
        BirthEvent updated = birthEventService.update(birthEvent.getId(), followup, GREEN_MEADOW_OWNER);
        assertThat(updated.isRequiresFollowup()).isTrue();
        assertThat(updated.getFollowupDate()).isEqualTo(LocalDate.of(2025, 6, 7));
    }

    @Test
    void listByDam_shouldReturnTheDamsBirths()
    {
        birthEventService.recordBirth(litter(3, 3, 1, 2), GREEN_MEADOW_OWNER);

        assertThat(birthEventService.listByDam(doe.getId(), GREEN_MEADOW_OWNER)).hasSize(1);
        assertThat(birthEventService.listByFarm(doe.getFarmId(), GREEN_MEADOW_OWNER)).hasSize(1);
    }
}
