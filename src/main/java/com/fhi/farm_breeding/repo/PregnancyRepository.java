package com.fhi.farm_breeding.repo;

import java.util.Collection;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.fhi.farm_breeding.model.Pregnancy;
import com.fhi.farm_breeding.model.PregnancyStatus;

public interface PregnancyRepository extends JpaRepository<Pregnancy, Long>
{
    /**
     * True if the dam has a pregnancy holding the active-dam slot.
     */
    boolean existsByActiveDamId(Long damId);

    boolean existsByMatingEventIdAndActiveTrueAndStatusIn(Long matingEventId, Collection<PregnancyStatus> statuses);

    List<Pregnancy> findByMatingEventIdAndActiveTrue(Long matingEventId);

    List<Pregnancy> findByDamIdAndActiveTrueOrderByConceptionDate(Long damId);

    List<Pregnancy> findByFarmIdAndActiveTrueOrderByConceptionDateDesc(Long farmId);

    List<Pregnancy> findByFarmIdAndActiveTrueAndStatusIn(Long farmId, Collection<PregnancyStatus> statuses);
}
