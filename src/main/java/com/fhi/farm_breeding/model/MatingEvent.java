package com.fhi.farm_breeding.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

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
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

/**
 * A breeding attempt between one sire and one or more dams.
 */
@Entity
@Table(name = "mating_event")
@Getter
@Setter
public class MatingEvent
{
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(nullable = false)
    private Long farmId;

    @NotNull
    @Column(nullable = false)
    private Long sireId;

    @NotEmpty
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "mating_event_dam", joinColumns = @JoinColumn(name = "mating_event_id"))
    @OrderColumn(name = "position")
    @Column(name = "dam_id", nullable = false)
    private List<Long> damIds = new ArrayList<>();

    @NotNull
    @Enumerated(EnumType.STRING)
    private MatingType matingType;

    @NotNull
    private LocalDate matingDate;

    @Nullable
    private LocalDate expectedConceptionDate;

    @NotNull
    @Enumerated(EnumType.STRING)
    private MatingStatus status = MatingStatus.PLANNED;

    @Nullable // not recorded yet
    @Enumerated(EnumType.STRING)
    private MatingOutcome outcome;

    @Nullable
    private LocalDate outcomeDate;

    @Nullable
    private String outcomeNotes;

    @Embedded
    private SemenSource semenSource = new SemenSource();

    @Nullable
    private String technician;

    @Nullable
    private String location;

    @Nullable
    private BigDecimal costAmount;

    @Nullable
    private String costCurrency;

    private boolean repeatService = false;

    @Nullable
    private Long previousMatingEventId;

    @Nullable
    private String notes;

    @Nullable
    private Long recordedBy;

    private boolean active = true;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;


    public boolean involvesDam(Long damId)
    {   return damIds.contains(damId);
    }

    public boolean isSuccessful()
    {   return outcome == MatingOutcome.SUCCESSFUL;
    }

    /**
     * Conception date used for pregnancies spawned by this event.
     */
    public LocalDate resolveConceptionDate()
    {   return expectedConceptionDate != null ? expectedConceptionDate : matingDate;
    }
}
