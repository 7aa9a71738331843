package com.fhi.farm_breeding.repo;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;

import com.fhi.farm_breeding.model.OffspringTracking;

public interface OffspringTrackingRepository extends JpaRepository<OffspringTracking, Long>
{
    Optional<OffspringTracking> findByOffspringId(Long offspringId);

    List<OffspringTracking> findByBirthEventId(Long birthEventId);

    List<OffspringTracking> findByFarmIdAndActiveTrueOrderByOffspringId(Long farmId);

    List<OffspringTracking> findByDamIdAndActiveTrueOrderByOffspringId(Long damId);

    List<OffspringTracking> findBySireIdAndActiveTrueOrderByOffspringId(Long sireId);
}
