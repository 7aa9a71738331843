package com.fhi.farm_breeding.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import com.fhi.farm_breeding.model.MatingType;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * A breeding attempt to record. The farm is taken from the sire.
 */
@Data
public class MatingRequest
{
    @NotNull
    private Long sireId;

    @NotEmpty
    private List<@NotNull Long> damIds;

    @NotNull
    private MatingType matingType;

    @NotNull
    private LocalDate matingDate;

    private LocalDate expectedConceptionDate;

    // artificial insemination only
    private String semenSource;
    private String semenBatchNumber;
    @PositiveOrZero
    private Integer strawsUsed;

    private String technician;
    private String location;

    @PositiveOrZero
    private BigDecimal costAmount;
    private String costCurrency;

    private boolean repeatService;
    private Long previousMatingEventId;
    private String notes;
}
