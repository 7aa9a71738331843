package com.fhi.farm_breeding.repo;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.fhi.farm_breeding.model.BirthEvent;

public interface BirthEventRepository extends JpaRepository<BirthEvent, Long>
{
    boolean existsByPregnancyId(Long pregnancyId);

    List<BirthEvent> findByFarmIdAndActiveTrueOrderByBirthDateDesc(Long farmId);

    List<BirthEvent> findByDamIdAndActiveTrueOrderByBirthDate(Long damId);

    List<BirthEvent> findBySireIdAndActiveTrueOrderByBirthDate(Long sireId);
}
