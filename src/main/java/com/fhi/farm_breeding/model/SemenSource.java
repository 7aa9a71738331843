package com.fhi.farm_breeding.model;

import jakarta.annotation.Nullable;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;

/**
 * Semen details, only meaningful for artificial insemination.
 */
@Embeddable
@Getter @Setter
public class SemenSource
{
    @Nullable
    @Column(name = "semen_source")
    private String source;

    @Nullable
    @Column(name = "semen_batch_number")
    private String batchNumber;

    @Nullable
    @Min(0)
    @Column(name = "straws_used")
    private Integer strawsUsed;
}
