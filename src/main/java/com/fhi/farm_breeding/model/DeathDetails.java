package com.fhi.farm_breeding.model;

import java.time.LocalDate;

import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.Getter;
import lombok.Setter;

@Embeddable
@Getter @Setter
public class DeathDetails
{
    private LocalDate deathDate;

    @Enumerated(EnumType.STRING)
    private DeathCause deathCause;

    private String deathNotes;
}
