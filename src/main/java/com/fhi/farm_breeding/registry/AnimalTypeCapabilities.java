package com.fhi.farm_breeding.registry;

import java.util.Optional;

import com.fhi.farm_breeding.model.BreedingSeason;
import com.fhi.farm_breeding.model.GeneticsSettings;

/**
 * What an animal type allows, and its genetics settings.
 * Unknown animal types have no capabilities.
 */
public record AnimalTypeCapabilities(Long animalTypeId,
                                     String speciesName,
                                     boolean reproductionEnabled,
                                     boolean geneticsEnabled,
                                     GeneticsSettings settings)
{
    public static AnimalTypeCapabilities none(Long animalTypeId)
    {   return new AnimalTypeCapabilities(animalTypeId, null, false, false, new GeneticsSettings());
    }

    public Optional<Integer> gestationPeriodDays()
    {   return Optional.ofNullable(settings.getGestationPeriodDays());
    }

    public int minBreedingAgeDays(int fallback)
    {   return settings.getMinBreedingAgeDays() != null ? settings.getMinBreedingAgeDays() : fallback;
    }

    public int maturityAgeDays(int fallback)
    {   return settings.getMaturityAgeDays() != null ? settings.getMaturityAgeDays() : fallback;
    }

    public BreedingSeason breedingSeason()
    {   return settings.getBreedingSeason() != null ? settings.getBreedingSeason() : BreedingSeason.UNKNOWN;
    }
}
