package com.fhi.farm_breeding.registry;

/**
 * Feature flags and genetics settings per animal type.
 */
public interface AnimalTypeCatalog
{
    AnimalTypeCapabilities capabilities(Long animalTypeId);
}
