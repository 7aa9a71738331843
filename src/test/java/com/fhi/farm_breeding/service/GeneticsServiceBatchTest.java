package com.fhi.farm_breeding.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fhi.farm_breeding.config.BreedingProperties;
import com.fhi.farm_breeding.dto.BatchComputeResult;
import com.fhi.farm_breeding.model.Animal;
import com.fhi.farm_breeding.model.GeneticProfile;
import com.fhi.farm_breeding.registry.AnimalRegistry;
import com.fhi.farm_breeding.service.exception.breeding.BreedingException;

/**
 * Failure accounting of the batch computation, without a database.
 */
class GeneticsServiceBatchTest
{
    private static final Long FARM_ID = 1L;
    private static final Long OWNER = 100L;

    private final GeneticProfileService profileService = mock(GeneticProfileService.class);
    private final AnimalRegistry animalRegistry = mock(AnimalRegistry.class);
    private final BreedingValidator validator = mock(BreedingValidator.class);
    private final BreedingProperties properties = new BreedingProperties();

    private GeneticsService geneticsService()
    {   return new GeneticsService(profileService, mock(PedigreeTracer.class), new CompatibilityScorer(),
                                   animalRegistry, validator, properties);
    }

    private static Animal animal(long id)
    {
        Animal animal = new Animal();
        animal.setId(id);
        animal.setTagNumber("A-" + id);
        return animal;
    }


    @Test
    void batchCompute_shouldCountFailuresAndKeepGoing()
    {
        properties.setBatchErrorReportLimit(1);
        when(animalRegistry.findAliveOnFarm(FARM_ID)).thenReturn(List.of(animal(1), animal(2), animal(3), animal(4)));
        when(profileService.computeProfile(1L, true)).thenReturn(new GeneticProfile());
        when(profileService.computeProfile(2L, true)).thenThrow(BreedingException.notFound("Animal", 2L));
        when(profileService.computeProfile(3L, true)).thenThrow(new IllegalStateException("pedigree loop"));
        when(profileService.computeProfile(4L, true)).thenReturn(new GeneticProfile());

        BatchComputeResult result = geneticsService().batchCompute(FARM_ID, OWNER);

        verify(validator).requireFarmAccess(FARM_ID, OWNER);
        assertThat(result.getFarmId()).isEqualTo(FARM_ID);
        assertThat(result.getTotalAnimals()).isEqualTo(4);
        assertThat(result.getProcessed()).isEqualTo(2);
        assertThat(result.getFailed()).isEqualTo(2);
        // only the first error is reported
        assertThat(result.getErrors()).hasSize(1);
        assertThat(result.getErrors().get(0).getAnimalId()).isEqualTo(2L);
        verify(profileService).computeProfile(4L, true);
    }

    @Test
    void batchCompute_onEmptyFarm_shouldReportNothing()
    {
        when(animalRegistry.findAliveOnFarm(FARM_ID)).thenReturn(List.of());

        BatchComputeResult result = geneticsService().batchCompute(FARM_ID, OWNER);

        assertThat(result.getTotalAnimals()).isZero();
        assertThat(result.getErrors()).isEmpty();
    }
}
