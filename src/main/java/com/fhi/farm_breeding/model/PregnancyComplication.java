package com.fhi.farm_breeding.model;

import java.time.LocalDate;

import jakarta.annotation.Nullable;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Embeddable
@Getter @Setter
@NoArgsConstructor
public class PregnancyComplication
{
    @NotNull
    private LocalDate complicationDate;

    @NotNull
    private String complicationType;

    @Nullable
    private String description;

    @NotNull
    @Enumerated(EnumType.STRING)
    private ComplicationSeverity severity = ComplicationSeverity.MILD;

    @Nullable
    private String treatment;

    private boolean resolved = false;
}
