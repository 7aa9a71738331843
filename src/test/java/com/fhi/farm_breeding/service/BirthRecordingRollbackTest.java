package com.fhi.farm_breeding.service;

import static com.fhi.farm_breeding.support.BreedingAssertions.assertBreedingError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import com.fhi.farm_breeding.config.SpringTestConfig;
import com.fhi.farm_breeding.dto.BirthRequest;
import com.fhi.farm_breeding.dto.MatingOutcomeRequest;
import com.fhi.farm_breeding.dto.MatingRequest;
import com.fhi.farm_breeding.model.Animal;
import com.fhi.farm_breeding.model.AnimalStatus;
import com.fhi.farm_breeding.model.AnimalType;
import com.fhi.farm_breeding.model.Farm;
import com.fhi.farm_breeding.model.MatingEvent;
import com.fhi.farm_breeding.model.MatingOutcome;
import com.fhi.farm_breeding.model.MatingStatus;
import com.fhi.farm_breeding.model.MatingType;
import com.fhi.farm_breeding.model.Pregnancy;
import com.fhi.farm_breeding.model.PregnancyStatus;
import com.fhi.farm_breeding.repo.AnimalRepository;
import com.fhi.farm_breeding.repo.AnimalTypeRepository;
import com.fhi.farm_breeding.repo.BirthEventRepository;
import com.fhi.farm_breeding.repo.FarmRepository;
import com.fhi.farm_breeding.repo.MatingEventRepository;
import com.fhi.farm_breeding.repo.PregnancyRepository;
import com.fhi.farm_breeding.service.exception.breeding.BreedingException.Cause;
import com.fhi.farm_breeding.support.TestHerd;


/**
 * Birth recording against committed data: the test itself is not transactional, so the
 * rollback observed here is the service's own.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(SpringTestConfig.class)
class BirthRecordingRollbackTest
{
    private static final Long OWNER = 900L;
    private static final LocalDate ADULT = LocalDate.of(2023, 3, 1);

    @SpyBean
    private OffspringFactory offspringFactory;

    @Autowired
    private BirthEventService birthEventService;

    @Autowired
    private MatingEventService matingEventService;

    @Autowired
    private FarmRepository farmRepository;

    @Autowired
    private AnimalTypeRepository animalTypeRepository;

    @Autowired
    private AnimalRepository animalRepository;

    @Autowired
    private MatingEventRepository matingEventRepository;

    @Autowired
    private PregnancyRepository pregnancyRepository;

    @Autowired
    private BirthEventRepository birthEventRepository;

    @Autowired
    private TestHerd herd;

    private Farm farm;
    private AnimalType type;
    private Animal buck;
    private Animal doe;
    private MatingEvent event;
    private Pregnancy pregnancy;

    @BeforeEach
    void setUp()
    {
        farm = new Farm();
        farm.setName("Rollback Hollow");
        farm.setOwnerUserId(OWNER);
        farm = farmRepository.save(farm);

        type = new AnimalType();
        type.setName("Rollback Rabbit");
        type.setReproductionEnabled(true);
        type.getGeneticsSettings().setGestationPeriodDays(31);
        type = animalTypeRepository.save(type);

        buck = herd.male(farm, type, "RB-BUCK", ADULT);
        doe = herd.female(farm, type, "RB-DOE", ADULT);

        MatingRequest mating = new MatingRequest();
        mating.setSireId(buck.getId());
        mating.setDamIds(List.of(doe.getId()));
        mating.setMatingType(MatingType.NATURAL);
        mating.setMatingDate(LocalDate.of(2025, 5, 1));
        event = matingEventService.recordMating(mating, OWNER);

        MatingOutcomeRequest outcome = new MatingOutcomeRequest();
        outcome.setStatus(MatingStatus.COMPLETED);
        outcome.setOutcome(MatingOutcome.SUCCESSFUL);
        matingEventService.recordOutcome(event.getId(), outcome, OWNER);

        pregnancy = pregnancyRepository.findByMatingEventIdAndActiveTrue(event.getId()).get(0);
    }

    @AfterEach
    void tearDown()
    {
        birthEventRepository.findByFarmIdAndActiveTrueOrderByBirthDateDesc(farm.getId()).forEach(birthEventRepository::delete);
        pregnancyRepository.deleteById(pregnancy.getId());
        matingEventRepository.deleteById(event.getId());
        animalRepository.findByFarmIdAndStatusAndActiveTrueOrderById(farm.getId(), AnimalStatus.ALIVE)
                        .forEach(animalRepository::delete);
        animalTypeRepository.deleteById(type.getId());
        farmRepository.deleteById(farm.getId());
    }


    @Test
    void recordBirth_whenOffspringCreationFails_shouldRollBackEverything()
    {
        doThrow(new IllegalStateException("registry unavailable"))
            .when(offspringFactory).createOffspring(any(), any(), any(), any(), any());

        BirthRequest request = new BirthRequest();
        request.setPregnancyId(pregnancy.getId());
        request.setBirthDate(LocalDate.of(2025, 5, 31));
        request.setTotalOffspring(3);
        request.setLiveBirths(3);
        request.setFemaleOffspring(3);

        assertBreedingError(Cause.INCONSISTENT_STATE, () -> birthEventService.recordBirth(request, OWNER));

        assertThat(birthEventRepository.existsByPregnancyId(pregnancy.getId())).isFalse();
        Pregnancy reloaded = pregnancyRepository.findById(pregnancy.getId()).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(PregnancyStatus.CONFIRMED);
        assertThat(reloaded.getActiveDamId()).isEqualTo(doe.getId());
        assertThat(reloaded.getActualDeliveryDate()).isNull();
        assertThat(animalRepository.findChildrenOf(doe.getId())).isEmpty();
    }
}
