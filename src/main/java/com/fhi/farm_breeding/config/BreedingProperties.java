package com.fhi.farm_breeding.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

/**
 * Reproduction and genetics settings, bound from the {@code breeding.*} properties.
 *
 * <p>Values here are farm-wide fallbacks. Animal-type genetics settings take precedence
 * where they are set.
 */
@Validated
@ConfigurationProperties(prefix = "breeding")
@Getter
@Setter
public class BreedingProperties
{
    /**
     * Gestation length used when neither the dam's nor the sire's animal type defines one.
     */
    @Min(1)
    private int defaultGestationDays = 30;

    /**
     * A confirmed pregnancy reads as progressing once more days than this have elapsed.
     */
    @Min(0)
    private int progressingAfterDays = 7;

    /**
     * Pregnancies due within this many days are reported as "due soon".
     */
    @Min(0)
    private int dueSoonWindowDays = 7;

    /**
     * Genetic profiles older than this are stale and get recomputed on read.
     */
    @NotNull
    private Duration profileFreshness = Duration.ofHours(24);

    @Min(1) @Max(10)
    private int pedigreeDepth = 3;

    @Min(1) @Max(10)
    private int maxPedigreeTreeDepth = 6;

    /**
     * Upper bound on the number of ancestors kept in a profile's pedigree.
     */
    @Min(1)
    private int pedigreeMaxAncestors = 50;

    @Min(1)
    private int recommendationLimit = 10;

    @Min(0)
    private int minBreedingAgeDays = 180;

    @Min(0)
    private int maturityAgeDays = 365;

    @Min(0) @Max(100)
    private int pairSuggestionMinCompatibility = 70;

    @Min(1)
    private int pairSuggestionLimit = 5;

    /**
     * How long a concurrent profile request waits for the in-flight computation of the same animal.
     */
    @NotNull
    private Duration singleFlightTimeout = Duration.ofSeconds(30);

    @Min(1)
    private int batchErrorReportLimit = 10;
}
