package com.fhi.farm_breeding.model;

import java.time.LocalDate;

import jakarta.annotation.Nullable;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Embeddable
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
public class NeonatalDeath
{
    @NotNull
    private Long offspringId;

    @NotNull
    private LocalDate deathDate;

    @NotNull
    @Enumerated(EnumType.STRING)
    private DeathCause cause;

    @Nullable
    private String notes;
}
