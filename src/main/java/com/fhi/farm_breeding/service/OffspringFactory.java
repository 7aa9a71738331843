package com.fhi.farm_breeding.service;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fhi.farm_breeding.model.Animal;
import com.fhi.farm_breeding.model.AnimalStatus;
import com.fhi.farm_breeding.model.BirthEvent;
import com.fhi.farm_breeding.model.Gender;
import com.fhi.farm_breeding.model.HealthStatus;
import com.fhi.farm_breeding.model.OffspringTracking;
import com.fhi.farm_breeding.model.ReproductiveStatus;
import com.fhi.farm_breeding.registry.AnimalRegistry;
import com.fhi.farm_breeding.registry.AnimalTypeCapabilities;
import com.fhi.farm_breeding.registry.AnimalTypeCatalog;
import com.fhi.farm_breeding.repo.OffspringTrackingRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates the registry entries and tracking records of a litter's live births.
 *
 * <p>Gender is assigned by position: the first {@code maleOffspring} births are male, the rest
 * female. Runs inside the birth recording transaction; any failure rolls the whole birth back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OffspringFactory
{
    private final AnimalRegistry animalRegistry;
    private final AnimalTypeCatalog animalTypeCatalog;
    private final OffspringTrackingRepository trackingRepository;
    private final OffspringTagGenerator tagGenerator;


    /**
     * Creates {@code birthEvent.liveBirths} offspring and appends their ids to the birth event.
     *
     * @param birthWeightKg recorded on every tracking record, may be null
     * @return the new animals, in birth order
     */
    @Transactional
    public List<Animal> createOffspring(BirthEvent birthEvent, Animal dam, Animal sire, Double birthWeightKg, Long userId)
    {
        Animal typeSource = dam.getAnimalTypeId() != null ? dam : sire;
        AnimalTypeCapabilities capabilities = animalTypeCatalog.capabilities(typeSource.getAnimalTypeId());
        String species = capabilities.speciesName() != null ? capabilities.speciesName() : "Unknown";

        List<Animal> offspring = new ArrayList<>();
        for (int i = 0; i < birthEvent.getLiveBirths(); i++)
        {
            Animal animal = new Animal();
            animal.setFarmId(birthEvent.getFarmId());
            animal.setAnimalTypeId(typeSource.getAnimalTypeId());
            animal.setTagNumber(tagGenerator.generate(birthEvent.getFarmId(), species, birthEvent.getBirthDate()));
            animal.setName(species + " Offspring " + (i + 1));
            animal.setGender(i < birthEvent.getMaleOffspring() ? Gender.MALE : Gender.FEMALE);
            animal.setBreed(resolveBreed(dam, sire, species));
            animal.setDateOfBirth(birthEvent.getBirthDate());
            animal.setWeightKg(birthWeightKg);
            animal.setStatus(AnimalStatus.ALIVE);
            animal.setStatusDate(birthEvent.getBirthDate());
            animal.setReproductiveStatus(ReproductiveStatus.IMMATURE);
            animal.setHealthStatus(HealthStatus.GOOD);
            animal.setSireId(sire.getId());
            animal.setDamId(dam.getId());
            animal.setBirthEventId(birthEvent.getId());
            animal.setCreatedBy(userId);

            Animal registered = animalRegistry.register(animal);
            trackingRepository.save(OffspringTracking.forNewborn(birthEvent, registered, userId, birthWeightKg));
            birthEvent.getOffspringIds().add(registered.getId());
            offspring.add(registered);
        }

        log.info("Birth event {}: created {} offspring {}", birthEvent.getId(), offspring.size(),
                 offspring.stream().map(Animal::getTagNumber).toList());
        return offspring;
    }

    private static String resolveBreed(Animal dam, Animal sire, String species)
    {
        if (dam.getBreed() != null && !dam.getBreed().isBlank()) return dam.getBreed();
        if (sire.getBreed() != null && !sire.getBreed().isBlank()) return sire.getBreed();
        return species;
    }
}
