package com.fhi.farm_breeding.repo;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;

import com.fhi.farm_breeding.model.Farm;

public interface FarmRepository extends JpaRepository<Farm, Long>
{
    boolean existsByIdAndOwnerUserIdAndArchivedFalse(Long id, Long ownerUserId);

    Optional<Farm> findByName(String name);
}
