package com.fhi.farm_breeding.repo;

import java.time.LocalDate;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.fhi.farm_breeding.model.Animal;
import com.fhi.farm_breeding.model.AnimalStatus;
import com.fhi.farm_breeding.model.Gender;

public interface AnimalRepository extends JpaRepository<Animal, Long>
{
    /**
     * Animals having the given animal as sire or dam.
     */
    @Query("select a from Animal a where a.sireId = :parentId or a.damId = :parentId order by a.id")
    List<Animal> findChildrenOf(@Param("parentId") Long parentId);

    List<Animal> findByFarmIdAndStatusAndActiveTrueOrderById(Long farmId, AnimalStatus status);

    List<Animal> findByFarmIdAndGenderAndAnimalTypeIdAndStatusAndActiveTrueOrderById(Long farmId,
                                                                                     Gender gender,
                                                                                     Long animalTypeId,
                                                                                     AnimalStatus status);

    /**
     * Tags of the farm's animals born within the date range and starting with the prefix.
     */
    @Query("select a.tagNumber from Animal a"
         + " where a.farmId = :farmId and a.dateOfBirth between :from and :to and a.tagNumber like concat(:prefix, '%')")
    List<String> findTagNumbers(@Param("farmId") Long farmId,
                                @Param("from") LocalDate from,
                                @Param("to") LocalDate to,
                                @Param("prefix") String prefix);
}
