package com.fhi.farm_breeding.service;

import java.time.Duration;
import java.time.LocalDateTime;

import org.springframework.stereotype.Component;

import com.fhi.farm_breeding.config.BreedingProperties;
import com.fhi.farm_breeding.model.GeneticProfile;

/**
 * Decides whether a stored genetic profile can be served as is.
 */
@Component
public class ProfileFreshnessPolicy
{
    private final Duration freshness;

    public ProfileFreshnessPolicy(BreedingProperties properties)
    {   this.freshness = properties.getProfileFreshness();
    }

    /**
     * A profile is stale when it was never computed or once {@code freshness} has fully elapsed
     * since its computation.
     */
    public boolean isStale(GeneticProfile profile, LocalDateTime now)
    {
        if (profile == null || profile.getComputedAt() == null) return true;
        return !profile.getComputedAt().plus(freshness).isAfter(now);
    }
}
