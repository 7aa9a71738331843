package com.fhi.farm_breeding.repo;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.fhi.farm_breeding.model.BreedingEligibility;
import com.fhi.farm_breeding.model.GeneticProfile;

public interface GeneticProfileRepository extends JpaRepository<GeneticProfile, Long>
{
    Optional<GeneticProfile> findByAnimalId(Long animalId);

    List<GeneticProfile> findByFarmIdOrderByAnimalId(Long farmId);

    /**
     * Stored profiles of the farm's breeders with the given eligibility.
     */
    @Query("select p from GeneticProfile p"
         + " where p.farmId = :farmId and p.breedingProfile.breeder = true and p.breedingProfile.eligibility = :eligibility"
         + " order by p.animalId")
    List<GeneticProfile> findBreeders(@Param("farmId") Long farmId,
                                      @Param("eligibility") BreedingEligibility eligibility);
}
