package com.fhi.farm_breeding.registry;

import org.springframework.stereotype.Component;

import com.fhi.farm_breeding.repo.FarmRepository;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class JpaFarmOwnership implements FarmOwnership
{
    private final FarmRepository farmRepository;

    @Override
    public boolean isOwnedBy(Long farmId, Long userId)
    {   return farmId != null && userId != null && farmRepository.existsByIdAndOwnerUserIdAndArchivedFalse(farmId, userId);
    }
}
