package com.fhi.farm_breeding.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import com.fhi.farm_breeding.model.MatingType;

import lombok.Data;

/**
 * Partial update of a mating event. Null fields are left untouched.
 * {@code farmId} can never change; sire and dams only while the event is planned.
 */
@Data
public class MatingUpdateRequest
{
    private Long farmId;
    private Long sireId;
    private List<Long> damIds;

    private MatingType matingType;
    private LocalDate matingDate;
    private LocalDate expectedConceptionDate;
    private String technician;
    private String location;
    private BigDecimal costAmount;
    private String costCurrency;
    private String notes;
}
