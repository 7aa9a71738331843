package com.fhi.farm_breeding.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

import jakarta.annotation.Nullable;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

/**
 * An animal as kept by the animal registry.
 *
 * <p>Lineage and ownership are plain ids (farm, animal type, sire, dam, birth event);
 * they are resolved through the registry when needed.
 */
@Entity
@Table(name = "animal",
       uniqueConstraints = @UniqueConstraint(name = "uk_animal_farm_tag", columnNames = { "farm_id", "tag_number" }))
@Setter
@Getter
public class Animal
{
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(nullable = false)
    private Long farmId;

    @NotNull
    @Column(nullable = false)
    private Long animalTypeId;

    @NotBlank
    @Size(max = 30)
    @Column(nullable = false)
    private String tagNumber;

    @Nullable
    @Size(max = 100)
    private String name;

    @NotNull
    @Enumerated(EnumType.STRING)
    private Gender gender;

    @Nullable
    private String breed;

    @NotNull
    private LocalDate dateOfBirth;

    @Nullable
    @PositiveOrZero
    private Double weightKg;

    @Nullable
    @Enumerated(EnumType.STRING)
    private HealthStatus healthStatus;

    @NotNull
    @Enumerated(EnumType.STRING)
    private AnimalStatus status = AnimalStatus.ALIVE;

    @Nullable
    private LocalDate statusDate;

    @Nullable
    private LocalDate dateOfDeath;

    private boolean active = true;

    @Nullable
    @Enumerated(EnumType.STRING)
    private ReproductiveStatus reproductiveStatus;

    @Nullable
    @Enumerated(EnumType.STRING)
    private BreedingStatus breedingStatus;

    // --- Lineage ---

    @Nullable // might not be known
    private Long sireId;

    @Nullable // might not be known
    private Long damId;

    @Nullable // only set for animals born on the farm
    private Long birthEventId;

    @Nullable
    private Long createdBy;


    public boolean isMale()
    {   return gender == Gender.MALE;
    }

    public boolean isFemale()
    {   return gender == Gender.FEMALE;
    }

    public boolean isAlive()
    {   return status == AnimalStatus.ALIVE;
    }

    public long getAgeInDays(LocalDate today)
    {   return dateOfBirth == null ? 0 : ChronoUnit.DAYS.between(dateOfBirth, today);
    }

    /**
     * Role-free label for logs and messages.
     */
    public String describe()
    {   return (tagNumber != null ? tagNumber : "?") + " (#" + id + ")";
    }

    @Override
    public String toString()
    {   return describe();
    }
}
