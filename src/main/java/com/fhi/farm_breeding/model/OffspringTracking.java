package com.fhi.farm_breeding.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Fetch;
import org.hibernate.annotations.FetchMode;
import org.hibernate.annotations.UpdateTimestamp;

import com.fasterxml.jackson.annotation.JsonIgnore;

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
import jakarta.validation.constraints.NotNull;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * Post-birth lifecycle record of one offspring. Distinct from the offspring's registry entry,
 * which it only mirrors terminal statuses onto.
 */
@Entity
@Table(name = "offspring_tracking")
@Getter
@Setter
public class OffspringTracking
{
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(nullable = false)
    private Long farmId;

    @Nullable // animals registered before birth tracking existed have no birth event
    private Long birthEventId;

    @Nullable
    private Long damId;

    @Nullable
    private Long sireId;

    @NotNull
    @Column(nullable = false, unique = true)
    private Long offspringId;

    @Embedded
    private OffspringSnapshot snapshot = new OffspringSnapshot();

    @Nullable
    private Double birthWeightKg;

    @Nullable
    private LocalDate weaningDate;

    @Nullable
    private Double weaningWeightKg;

    @Nullable
    @Enumerated(EnumType.STRING)
    private NeonatalHealth neonatalHealth;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Setter(AccessLevel.NONE)
    private OffspringStatus status = OffspringStatus.ALIVE;

    @Nullable
    @Setter(AccessLevel.NONE)
    private LocalDate statusDate;

    @Embedded
    private SaleDetails sale;

    @Embedded
    private DeathDetails death;

    @Embedded
    private CullingDetails culling;

    @Embedded
    private TransferDetails transfer;

    @ElementCollection(fetch = FetchType.EAGER)
    @Fetch(FetchMode.SELECT)
    @CollectionTable(name = "offspring_growth_measurement", joinColumns = @JoinColumn(name = "tracking_id"))
    @OrderColumn(name = "position")
    private List<GrowthMeasurement> growthMeasurements = new ArrayList<>();

    private boolean requiresSpecialAttention = false;

    @Nullable
    private String notes;

    @Nullable
    private Long recordedBy;

    private boolean active = true;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;


    /**
     * Tracking record for a freshly created offspring.
     */
    public static OffspringTracking forNewborn(BirthEvent birthEvent, Animal offspring, Long userId, Double birthWeightKg)
    {
        OffspringTracking tracking = forAnimal(offspring, userId);
        tracking.birthEventId = birthEvent.getId();
        tracking.birthWeightKg = birthWeightKg;
        tracking.statusDate = birthEvent.getBirthDate();
        return tracking;
    }

    /**
     * Tracking record for an animal already in the registry, lineage copied from it.
     */
    public static OffspringTracking forAnimal(Animal offspring, Long userId)
    {
        OffspringTracking tracking = new OffspringTracking();
        tracking.farmId = offspring.getFarmId();
        tracking.birthEventId = offspring.getBirthEventId();
        tracking.damId = offspring.getDamId();
        tracking.sireId = offspring.getSireId();
        tracking.offspringId = offspring.getId();
        tracking.snapshot = OffspringSnapshot.of(offspring);
        tracking.statusDate = offspring.getDateOfBirth();
        tracking.recordedBy = userId;
        return tracking;
    }

    public void changeStatus(OffspringStatus newStatus, LocalDate date)
    {   this.status = newStatus;
        this.statusDate = date;
    }

    public void refreshSnapshot(Animal offspring)
    {   this.snapshot = OffspringSnapshot.of(offspring);
    }

    /**
     * Weight of the most recent measurement by date; later entries win ties.
     */
    @JsonIgnore
    public Optional<Double> getCurrentWeightKg()
    {
        return growthMeasurements.stream()
                                 .filter(m -> m.getWeightKg() != null)
                                 .reduce((a, b) -> b.getMeasuredOn().isBefore(a.getMeasuredOn()) ? a : b)
                                 .map(GrowthMeasurement::getWeightKg);
    }

    public long ageInDays(LocalDate today)
    {   return snapshot.getDateOfBirth() == null ? 0 : ChronoUnit.DAYS.between(snapshot.getDateOfBirth(), today);
    }
}
