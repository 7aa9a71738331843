package com.fhi.farm_breeding.dto;

import com.fhi.farm_breeding.model.NeonatalHealth;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * Partial update of an offspring tracking record. Status changes go through the
 * dedicated transitions; the identity fields are immutable.
 */
@Data
public class TrackingUpdateRequest
{
    private Long farmId;
    private Long offspringId;
    private Long damId;
    private Long sireId;
    private Long birthEventId;

    private NeonatalHealth neonatalHealth;
    @PositiveOrZero
    private Double birthWeightKg;
    private Boolean requiresSpecialAttention;
    private String notes;
}
