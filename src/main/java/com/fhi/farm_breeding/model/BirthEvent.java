package com.fhi.farm_breeding.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Fetch;
import org.hibernate.annotations.FetchMode;
import org.hibernate.annotations.UpdateTimestamp;

import jakarta.annotation.Nullable;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
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
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;

/**
 * The delivery that closes a pregnancy. Exactly one per pregnancy.
 */
@Entity
@Table(name = "birth_event")
@Getter
@Setter
public class BirthEvent
{
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(nullable = false)
    private Long farmId;

    @NotNull
    @Column(nullable = false, unique = true)
    private Long pregnancyId;

    @NotNull
    @Column(nullable = false)
    private Long damId;

    @NotNull
    @Column(nullable = false)
    private Long sireId;

    @NotNull
    private LocalDate birthDate;

    @Nullable
    private LocalTime birthTime;

    @Nullable
    private String location;

    // --- Litter counts ---

    @PositiveOrZero
    private int totalOffspring;

    @PositiveOrZero
    private int liveBirths;

    @PositiveOrZero
    private int stillbirths;

    @PositiveOrZero
    private int weakOffspring;

    @PositiveOrZero
    private int maleOffspring;

    @PositiveOrZero
    private int femaleOffspring;

    /**
     * Registry ids of the offspring created for the live births, in birth order.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @Fetch(FetchMode.SELECT)
    @CollectionTable(name = "birth_event_offspring", joinColumns = @JoinColumn(name = "birth_event_id"))
    @OrderColumn(name = "position")
    @Column(name = "offspring_id", nullable = false)
    private List<Long> offspringIds = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @Fetch(FetchMode.SELECT)
    @CollectionTable(name = "birth_event_neonatal_death", joinColumns = @JoinColumn(name = "birth_event_id"))
    @OrderColumn(name = "position")
    private List<NeonatalDeath> neonatalDeaths = new ArrayList<>();

    private boolean assistedBirth = false;

    @Nullable
    private String assistanceType;

    @Nullable
    private String damCondition;

    @Nullable
    private String damComplications;

    @Nullable
    private String offspringComplications;

    @NotNull
    @Enumerated(EnumType.STRING)
    private BirthEventStatus status = BirthEventStatus.IN_PROGRESS;

    @Nullable
    private LocalDate completionDate;

    private boolean requiresFollowup = false;

    @Nullable
    private LocalDate followupDate;

    @Nullable
    private String notes;

    @Nullable
    private Long recordedBy;

    private boolean active = true;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;


    public boolean hasOffspring(Long animalId)
    {   return offspringIds.contains(animalId);
    }
}
