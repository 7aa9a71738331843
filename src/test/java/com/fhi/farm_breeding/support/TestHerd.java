package com.fhi.farm_breeding.support;

import java.time.LocalDate;

import com.fhi.farm_breeding.model.Animal;
import com.fhi.farm_breeding.model.AnimalType;
import com.fhi.farm_breeding.model.BreedingStatus;
import com.fhi.farm_breeding.model.Farm;
import com.fhi.farm_breeding.model.Gender;
import com.fhi.farm_breeding.model.HealthStatus;
import com.fhi.farm_breeding.model.ReproductiveStatus;
import com.fhi.farm_breeding.repo.AnimalRepository;
import com.fhi.farm_breeding.repo.AnimalTypeRepository;
import com.fhi.farm_breeding.repo.FarmRepository;

import lombok.RequiredArgsConstructor;

/**
 * Builds and saves animals on top of the shared farm and animal type fixtures.
 */
@RequiredArgsConstructor
public class TestHerd
{
    public static final String GREEN_MEADOW = "Green Meadow";
    public static final Long GREEN_MEADOW_OWNER = 100L;

    public static final String STONY_RIDGE = "Stony Ridge";
    public static final Long STONY_RIDGE_OWNER = 200L;

    private final FarmRepository farmRepository;
    private final AnimalTypeRepository animalTypeRepository;
    private final AnimalRepository animalRepository;


    public Farm farm(String name)
    {   return farmRepository.findByName(name)
                             .orElseThrow(() -> new IllegalStateException("Farm fixture missing: " + name));
    }

    public AnimalType type(String name)
    {   return animalTypeRepository.findByName(name)
                                   .orElseThrow(() -> new IllegalStateException("Animal type fixture missing: " + name));
    }

    public Animal male(Farm farm, AnimalType type, String tag, LocalDate dateOfBirth)
    {   return save(animal(farm, type, tag, Gender.MALE, dateOfBirth));
    }

    public Animal female(Farm farm, AnimalType type, String tag, LocalDate dateOfBirth)
    {   return save(animal(farm, type, tag, Gender.FEMALE, dateOfBirth));
    }

    /**
     * An animal of the dam's farm and type with both parents linked.
     */
    public Animal offspringOf(Animal sire, Animal dam, Gender gender, String tag, LocalDate dateOfBirth)
    {
        Animal child = new Animal();
        child.setFarmId(dam.getFarmId());
        child.setAnimalTypeId(dam.getAnimalTypeId());
        child.setTagNumber(tag);
        child.setName(tag);
        child.setGender(gender);
        child.setBreed(dam.getBreed());
        child.setDateOfBirth(dateOfBirth);
        child.setHealthStatus(HealthStatus.GOOD);
        child.setSireId(sire == null ? null : sire.getId());
        child.setDamId(dam == null ? null : dam.getId());
        if (gender == Gender.FEMALE) child.setReproductiveStatus(ReproductiveStatus.OPEN);
        if (gender == Gender.MALE)   child.setBreedingStatus(BreedingStatus.ACTIVE);
        return save(child);
    }

    public Animal save(Animal animal)
    {   return animalRepository.saveAndFlush(animal);
    }

    public Animal reload(Animal animal)
    {   return animalRepository.findById(animal.getId()).orElseThrow();
    }


    private static Animal animal(Farm farm, AnimalType type, String tag, Gender gender, LocalDate dateOfBirth)
    {
        Animal animal = new Animal();
        animal.setFarmId(farm.getId());
        animal.setAnimalTypeId(type.getId());
        animal.setTagNumber(tag);
        animal.setName(tag);
        animal.setGender(gender);
        animal.setBreed(type.getName() + " common");
        animal.setDateOfBirth(dateOfBirth);
        animal.setHealthStatus(HealthStatus.GOOD);
        if (gender == Gender.FEMALE) animal.setReproductiveStatus(ReproductiveStatus.OPEN);
        if (gender == Gender.MALE)   animal.setBreedingStatus(BreedingStatus.ACTIVE);
        return animal;
    }
}
