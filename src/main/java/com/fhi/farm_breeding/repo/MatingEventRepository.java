package com.fhi.farm_breeding.repo;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.fhi.farm_breeding.model.MatingEvent;
import com.fhi.farm_breeding.model.MatingStatus;

public interface MatingEventRepository extends JpaRepository<MatingEvent, Long>
{
    List<MatingEvent> findByFarmIdAndActiveTrueOrderByMatingDateDesc(Long farmId);

    List<MatingEvent> findByFarmIdAndStatusAndActiveTrueOrderByMatingDateDesc(Long farmId, MatingStatus status);

    List<MatingEvent> findBySireIdAndActiveTrueOrderByMatingDate(Long sireId);

    @Query("select m from MatingEvent m where :damId member of m.damIds and m.active = true order by m.matingDate")
    List<MatingEvent> findByDam(@Param("damId") Long damId);
}
