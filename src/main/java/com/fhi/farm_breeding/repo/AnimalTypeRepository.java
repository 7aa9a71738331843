package com.fhi.farm_breeding.repo;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;

import com.fhi.farm_breeding.model.AnimalType;

public interface AnimalTypeRepository extends JpaRepository<AnimalType, Long>
{
    /**
     * Looks up an animal type by its natural id, e.g. "Rabbit".
     */
    Optional<AnimalType> findByName(String name);
}
