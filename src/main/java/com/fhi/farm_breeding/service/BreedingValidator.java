package com.fhi.farm_breeding.service;

import java.util.Optional;

import org.springframework.stereotype.Service;

import com.fhi.farm_breeding.config.BreedingProperties;
import com.fhi.farm_breeding.model.Animal;
import com.fhi.farm_breeding.registry.AnimalRegistry;
import com.fhi.farm_breeding.registry.AnimalTypeCapabilities;
import com.fhi.farm_breeding.registry.AnimalTypeCatalog;
import com.fhi.farm_breeding.registry.FarmOwnership;
import com.fhi.farm_breeding.repo.PregnancyRepository;
import com.fhi.farm_breeding.service.exception.breeding.BreedingException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Lookups and rule checks shared by the mating, pregnancy and birth services.
 *
 * <p>Every check throws a {@link BreedingException} with the matching cause; none of them write.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BreedingValidator
{
    private final AnimalRegistry animalRegistry;
    private final FarmOwnership farmOwnership;
    private final AnimalTypeCatalog animalTypeCatalog;
    private final PregnancyRepository pregnancyRepository;
    private final BreedingProperties properties;


    public Animal requireAnimal(Long animalId)
    {   return animalRegistry.findAnimal(animalId)
                             .orElseThrow(() -> BreedingException.notFound("Animal", animalId));
    }

    /**
     * @throws BreedingException PERMISSION_DENIED if the farm is not the caller's.
     */
    public void requireFarmAccess(Long farmId, Long userId)
    {
        if (!farmOwnership.isOwnedBy(farmId, userId))
        {   log.debug("User {} denied access to farm {}", userId, farmId);
            throw BreedingException.permissionDenied(farmId, userId);
        }
    }

    /**
     * Resolves the animal and checks that its farm belongs to the caller.
     */
    public Animal requireAccessibleAnimal(Long animalId, Long userId)
    {   Animal animal = requireAnimal(animalId);
        requireFarmAccess(animal.getFarmId(), userId);
        return animal;
    }

    public void requireSire(Animal sire)
    {
        if (!sire.isMale())
        {   throw BreedingException.invalidSex("Sire", sire, "MALE");
        }
    }

    public void requireDam(Animal dam)
    {
        if (!dam.isFemale())
        {   throw BreedingException.invalidSex("Dam", dam, "FEMALE");
        }
    }

    public AnimalTypeCapabilities capabilitiesOf(Animal animal)
    {   return animalTypeCatalog.capabilities(animal.getAnimalTypeId());
    }

    public void requireReproductionEnabled(Animal animal)
    {
        if (!capabilitiesOf(animal).reproductionEnabled())
        {   throw BreedingException.featureDisabled("Reproduction", animal);
        }
    }

    public void requireGeneticsEnabled(Animal animal)
    {
        if (!capabilitiesOf(animal).geneticsEnabled())
        {   throw BreedingException.featureDisabled("Genetics", animal);
        }
    }

    public void requireNotPregnant(Animal dam)
    {
        if (pregnancyRepository.existsByActiveDamId(dam.getId()))
        {   throw BreedingException.alreadyPregnant(dam);
        }
    }

    /**
     * Gestation length: the dam's animal type, else the sire's, else the configured default.
     */
    public int resolveGestationDays(Animal dam, Animal sire)
    {
        return capabilitiesOf(dam).gestationPeriodDays()
                .or(() -> sire == null ? Optional.empty() : capabilitiesOf(sire).gestationPeriodDays())
                .orElse(properties.getDefaultGestationDays());
    }
}
