package com.fhi.farm_breeding.registry;

import org.springframework.stereotype.Component;

import com.fhi.farm_breeding.model.GeneticsSettings;
import com.fhi.farm_breeding.repo.AnimalTypeRepository;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class JpaAnimalTypeCatalog implements AnimalTypeCatalog
{
    private final AnimalTypeRepository animalTypeRepository;

    @Override
    public AnimalTypeCapabilities capabilities(Long animalTypeId)
    {
        if (animalTypeId == null) return AnimalTypeCapabilities.none(null);

        return animalTypeRepository.findById(animalTypeId)
                .map(type -> new AnimalTypeCapabilities(type.getId(),
                                                        type.getName(),
                                                        type.isReproductionEnabled(),
                                                        type.isGeneticsEnabled(),
                                                        type.getGeneticsSettings() != null ? type.getGeneticsSettings()
                                                                                           : new GeneticsSettings()))
                .orElseGet(() -> AnimalTypeCapabilities.none(animalTypeId));
    }
}
