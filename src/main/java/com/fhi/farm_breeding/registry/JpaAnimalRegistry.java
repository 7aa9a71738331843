package com.fhi.farm_breeding.registry;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.fhi.farm_breeding.model.Animal;
import com.fhi.farm_breeding.model.AnimalStatus;
import com.fhi.farm_breeding.model.Gender;
import com.fhi.farm_breeding.model.ReproductiveStatus;
import com.fhi.farm_breeding.repo.AnimalRepository;
import com.fhi.farm_breeding.service.exception.breeding.BreedingException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Registry backed by the local {@code animal} table.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaAnimalRegistry implements AnimalRegistry
{
    private final AnimalRepository animalRepository;

    @Override
    public Optional<Animal> findAnimal(Long animalId)
    {   return animalId == null ? Optional.empty() : animalRepository.findById(animalId);
    }

    @Override
    @Transactional
    public Animal register(Animal animal)
    {   Animal saved = animalRepository.save(animal);
        log.debug("Registered animal {} on farm {}", saved.describe(), saved.getFarmId());
        return saved;
    }

    @Override
    @Transactional
    public void updateReproductiveStatus(Long animalId, ReproductiveStatus status)
    {
        Animal animal = require(animalId);
        log.debug("Animal {}: reproductive status {} -> {}", animal.describe(), animal.getReproductiveStatus(), status);
        animal.setReproductiveStatus(status);
    }

    @Override
    @Transactional
    public void updateLifecycleStatus(Long animalId, AnimalStatus status, LocalDate date)
    {
        Animal animal = require(animalId);
        log.debug("Animal {}: status {} -> {}", animal.describe(), animal.getStatus(), status);
        animal.setStatus(status);
        animal.setStatusDate(date);
        if (status == AnimalStatus.DECEASED)
        {   animal.setDateOfDeath(date);
        }
    }

    @Override
    public List<Animal> findChildrenOf(Long parentId)
    {   return animalRepository.findChildrenOf(parentId);
    }

    @Override
    public List<Animal> findAliveOnFarm(Long farmId)
    {   return animalRepository.findByFarmIdAndStatusAndActiveTrueOrderById(farmId, AnimalStatus.ALIVE);
    }

    @Override
    public List<Animal> findBreedingCandidates(Long farmId, Gender gender, Long animalTypeId)
    {   return animalRepository.findByFarmIdAndGenderAndAnimalTypeIdAndStatusAndActiveTrueOrderById(
                    farmId, gender, animalTypeId, AnimalStatus.ALIVE);
    }

    @Override
    public List<String> findTagNumbersBornIn(Long farmId, int year, String prefix)
    {   return animalRepository.findTagNumbers(farmId, LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31), prefix);
    }

    private Animal require(Long animalId)
    {   return animalRepository.findById(animalId)
                               .orElseThrow(() -> BreedingException.notFound("Animal", animalId));
    }
}
