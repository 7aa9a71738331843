package com.fhi.farm_breeding.registry;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import com.fhi.farm_breeding.model.Animal;
import com.fhi.farm_breeding.model.AnimalStatus;
import com.fhi.farm_breeding.model.Gender;
import com.fhi.farm_breeding.model.ReproductiveStatus;

/**
 * Read and side-effect interface of the animal registry, the source of truth for animal
 * identity, sex, age, status and lineage links.
 */
public interface AnimalRegistry
{
    Optional<Animal> findAnimal(Long animalId);

    /**
     * Persists a new animal (offspring) and returns it with its id.
     */
    Animal register(Animal animal);

    void updateReproductiveStatus(Long animalId, ReproductiveStatus status);

    /**
     * Sets the animal's lifecycle status. {@code DECEASED} also sets the date of death.
     */
    void updateLifecycleStatus(Long animalId, AnimalStatus status, LocalDate date);

    /**
     * Animals whose sire or dam is the given animal.
     */
    List<Animal> findChildrenOf(Long parentId);

    List<Animal> findAliveOnFarm(Long farmId);

    /**
     * Alive, active animals of the farm with the given sex and animal type.
     */
    List<Animal> findBreedingCandidates(Long farmId, Gender gender, Long animalTypeId);

    /**
     * Tag numbers of the farm's animals born in {@code year} and starting with {@code prefix}.
     */
    List<String> findTagNumbersBornIn(Long farmId, int year, String prefix);
}
