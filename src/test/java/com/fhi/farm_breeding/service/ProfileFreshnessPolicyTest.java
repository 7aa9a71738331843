package com.fhi.farm_breeding.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.LocalDateTime;

import org.junit.jupiter.api.Test;

import com.fhi.farm_breeding.config.BreedingProperties;
import com.fhi.farm_breeding.model.GeneticProfile;

class ProfileFreshnessPolicyTest
{
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 6, 1, 10, 0);

    private final ProfileFreshnessPolicy policy = new ProfileFreshnessPolicy(new BreedingProperties());

    private static GeneticProfile computedAt(LocalDateTime computedAt)
    {   GeneticProfile profile = new GeneticProfile();
        profile.setComputedAt(computedAt);
        return profile;
    }

    @Test
    void isStale_shouldBeTrueWhenNeverComputed()
    {
        assertThat(policy.isStale(null, NOW)).isTrue();
        assertThat(policy.isStale(new GeneticProfile(), NOW)).isTrue();
    }

    @Test
    void isStale_shouldBeFalseWithinWindow()
    {
        assertThat(policy.isStale(computedAt(NOW), NOW)).isFalse();
        assertThat(policy.isStale(computedAt(NOW.minusHours(23).minusMinutes(59)), NOW)).isFalse();
    }

    @Test
    void isStale_shouldBeTrueOnceWindowHasElapsed()
    {
        assertThat(policy.isStale(computedAt(NOW.minusHours(24)), NOW)).isTrue();
        assertThat(policy.isStale(computedAt(NOW.minusDays(3)), NOW)).isTrue();
    }

    @Test
    void isStale_shouldHonourConfiguredWindow()
    {
        BreedingProperties properties = new BreedingProperties();
        properties.setProfileFreshness(Duration.ofMinutes(5));
        ProfileFreshnessPolicy shortPolicy = new ProfileFreshnessPolicy(properties);

        assertThat(shortPolicy.isStale(computedAt(NOW.minusMinutes(4)), NOW)).isFalse();
        assertThat(shortPolicy.isStale(computedAt(NOW.minusMinutes(6)), NOW)).isTrue();
    }
}
