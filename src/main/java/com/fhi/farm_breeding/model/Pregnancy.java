package com.fhi.farm_breeding.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Fetch;
import org.hibernate.annotations.FetchMode;
import org.hibernate.annotations.UpdateTimestamp;

import com.fasterxml.jackson.annotation.JsonIgnore;

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
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * A pregnancy of one dam, spawned by a mating event.
 *
 * <p>The {@code activeDamId} column mirrors {@code damId} while the pregnancy is
 * {@link PregnancyStatus#ACTIVE active} and is null otherwise. It carries a unique
 * constraint, so the database refuses a second active pregnancy for the same dam.
 */
@Entity
@Table(name = "pregnancy")
@Getter
@Setter
public class Pregnancy
{
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(nullable = false)
    private Long farmId;

    @NotNull
    @Column(nullable = false)
    private Long damId;

    @NotNull
    @Column(nullable = false)
    private Long sireId;

    @NotNull
    @Column(nullable = false)
    private Long matingEventId;

    @NotNull
    private LocalDate conceptionDate;

    @Nullable
    private LocalDate confirmedDate;

    @Nullable
    @Enumerated(EnumType.STRING)
    private ConfirmationMethod confirmationMethod;

    @Min(1)
    private int expectedGestationDays;

    @NotNull
    private LocalDate expectedDeliveryDate;

    @Nullable
    private Integer expectedLitterMin;

    @Nullable
    private Integer expectedLitterMax;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Setter(AccessLevel.NONE)
    private PregnancyStatus status = PregnancyStatus.CONFIRMED;

    @JsonIgnore
    @Setter(AccessLevel.NONE)
    @Column(unique = true)
    private Long activeDamId;

    @ElementCollection(fetch = FetchType.EAGER)
    @Fetch(FetchMode.SELECT)
    @CollectionTable(name = "pregnancy_checkup", joinColumns = @JoinColumn(name = "pregnancy_id"))
    @OrderColumn(name = "position")
    private List<PregnancyCheckup> checkups = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @Fetch(FetchMode.SELECT)
    @CollectionTable(name = "pregnancy_complication", joinColumns = @JoinColumn(name = "pregnancy_id"))
    @OrderColumn(name = "position")
    private List<PregnancyComplication> complications = new ArrayList<>();

    // --- Termination ---

    @Nullable
    private LocalDate abortionDate;

    @Nullable
    @Enumerated(EnumType.STRING)
    private TerminationReason abortionReason;

    @Nullable
    private String abortionNotes;

    @Nullable
    private LocalDate actualDeliveryDate;

    private boolean requiresSpecialCare = false;

    @Nullable
    private String specialCareInstructions;

    @Nullable
    private String notes;

    @Nullable
    private Long recordedBy;

    @Setter(AccessLevel.NONE)
    private boolean active = true;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;


    /**
     * Builds a confirmed pregnancy for one dam of a mating event.
     */
    public static Pregnancy fromMating(MatingEvent event, Long damId, int gestationDays)
    {
        Pregnancy pregnancy = new Pregnancy();
        pregnancy.farmId = event.getFarmId();
        pregnancy.damId = damId;
        pregnancy.sireId = event.getSireId();
        pregnancy.matingEventId = event.getId();
        pregnancy.conceptionDate = event.resolveConceptionDate();
        pregnancy.expectedGestationDays = gestationDays;
        pregnancy.expectedDeliveryDate = pregnancy.conceptionDate.plusDays(gestationDays);
        pregnancy.changeStatus(PregnancyStatus.CONFIRMED);
        return pregnancy;
    }

    /**
     * Moves to the given status and keeps the active-dam slot in sync.
     */
    public void changeStatus(PregnancyStatus newStatus)
    {   this.status = newStatus;
        syncActiveDamSlot();
    }

    /**
     * Soft-deletes the pregnancy. It no longer counts as the dam's active pregnancy.
     */
    public void deactivate()
    {   this.active = false;
        syncActiveDamSlot();
    }

    @JsonIgnore
    public boolean isOngoing()
    {   return active && status.isActive();
    }

    private void syncActiveDamSlot()
    {   this.activeDamId = (active && status.isActive()) ? damId : null;
    }


    // -----------------------------------------
    // Gestation clock, evaluated against "today"
    // -----------------------------------------

    public long daysPregnant(LocalDate today)
    {   return Math.max(0, ChronoUnit.DAYS.between(conceptionDate, today));
    }

    public long daysRemaining(LocalDate today)
    {   return ChronoUnit.DAYS.between(today, expectedDeliveryDate);
    }

    /**
     * Percentage of the expected gestation elapsed, floored and capped at 100.
     */
    public int gestationProgress(LocalDate today)
    {
        if (expectedGestationDays <= 0) return 100;
        long progress = daysPregnant(today) * 100 / expectedGestationDays;
        return (int) Math.min(100, progress);
    }

    /**
     * Status as of today: a confirmed pregnancy reads as progressing once more than
     * {@code progressingAfterDays} have elapsed since conception.
     */
    public PregnancyStatus effectiveStatus(LocalDate today, int progressingAfterDays)
    {
        if (status == PregnancyStatus.CONFIRMED && daysPregnant(today) > progressingAfterDays)
        {   return PregnancyStatus.PROGRESSING;
        }
        return status;
    }

    public boolean isOverdue(LocalDate today, int progressingAfterDays)
    {   return today.isAfter(expectedDeliveryDate)
            && effectiveStatus(today, progressingAfterDays) == PregnancyStatus.PROGRESSING;
    }

    public boolean hasUnresolvedComplications()
    {   return complications.stream().anyMatch(c -> !c.isResolved());
    }
}
