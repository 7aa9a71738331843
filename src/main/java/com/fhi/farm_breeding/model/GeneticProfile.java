package com.fhi.farm_breeding.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.hibernate.annotations.Fetch;
import org.hibernate.annotations.FetchMode;

import jakarta.annotation.Nullable;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

/**
 * Derived genetic profile of one animal.
 *
 * <p>Holds no authoritative data: everything here is computed from the registry and the
 * reproduction history and can be rebuilt at any time. {@code computedAt} drives staleness.
 */
@Entity
@Table(name = "genetic_profile")
@Getter
@Setter
public class GeneticProfile
{
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(nullable = false, unique = true)
    private Long animalId;

    @NotNull
    @Column(nullable = false)
    private Long farmId;

    @Nullable
    private Long animalTypeId;

    @Nullable
    @Enumerated(EnumType.STRING)
    private Gender gender;

    @Nullable
    private Long sireId;

    @Nullable
    private Long damId;

    @Embedded
    private BreedingProfile breedingProfile = new BreedingProfile();

    @Embedded
    private PerformanceMetrics performanceMetrics = new PerformanceMetrics();

    @Embedded
    private TraitScores traits = new TraitScores();

    @DecimalMin("0.0") @DecimalMax("1.0")
    private double inbreedingCoefficient;

    @ElementCollection(fetch = FetchType.EAGER)
    @Fetch(FetchMode.SELECT)
    @CollectionTable(name = "genetic_profile_relative", joinColumns = @JoinColumn(name = "profile_id"))
    @OrderColumn(name = "position")
    private List<KnownRelative> knownCloseRelatives = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @Fetch(FetchMode.SELECT)
    @CollectionTable(name = "genetic_profile_recommended_pair", joinColumns = @JoinColumn(name = "profile_id"))
    @OrderColumn(name = "position")
    private List<RecommendedPair> recommendedPairs = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @Fetch(FetchMode.SELECT)
    @CollectionTable(name = "genetic_profile_avoid_pair", joinColumns = @JoinColumn(name = "profile_id"))
    @OrderColumn(name = "position")
    private List<AvoidPair> avoidPairs = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @Fetch(FetchMode.SELECT)
    @CollectionTable(name = "genetic_profile_ancestor", joinColumns = @JoinColumn(name = "profile_id"))
    @OrderColumn(name = "position")
    private List<PedigreeAncestor> pedigree = new ArrayList<>();

    /**
     * Deepest generation reached by the pedigree trace.
     */
    private int pedigreeGeneration;

    private LocalDateTime computedAt;


    public static GeneticProfile forAnimal(Animal animal)
    {
        GeneticProfile profile = new GeneticProfile();
        profile.animalId = animal.getId();
        profile.refreshIdentity(animal);
        return profile;
    }

    /**
     * Copies the registry fields the profile is keyed and filtered on.
     */
    public void refreshIdentity(Animal animal)
    {   this.farmId = animal.getFarmId();
        this.animalTypeId = animal.getAnimalTypeId();
        this.gender = animal.getGender();
        this.sireId = animal.getSireId();
        this.damId = animal.getDamId();
    }

    public Optional<KnownRelative> findRelative(Long otherAnimalId)
    {   return knownCloseRelatives.stream()
                                  .filter(r -> r.getRelativeId().equals(otherAnimalId))
                                  .findFirst();
    }

    public boolean isBreeder()
    {   return breedingProfile != null && breedingProfile.isBreeder();
    }

    public boolean isEligible()
    {   return breedingProfile != null && breedingProfile.getEligibility() == BreedingEligibility.ELIGIBLE;
    }

    // Replace collection contents in place so Hibernate keeps tracking the same instances.

    public void replaceRelatives(List<KnownRelative> relatives)
    {   knownCloseRelatives.clear();
        knownCloseRelatives.addAll(relatives);
    }

    public void replacePedigree(List<PedigreeAncestor> ancestors)
    {   pedigree.clear();
        pedigree.addAll(ancestors);
    }

    public void replaceRecommendations(List<RecommendedPair> recommended, List<AvoidPair> avoid)
    {   recommendedPairs.clear();
        recommendedPairs.addAll(recommended);
        avoidPairs.clear();
        avoidPairs.addAll(avoid);
    }
}
