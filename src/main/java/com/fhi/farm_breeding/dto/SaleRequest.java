package com.fhi.farm_breeding.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class SaleRequest
{
    @NotNull
    private LocalDate saleDate;

    @PositiveOrZero
    private BigDecimal salePrice;

    private String saleCurrency;
    private String buyer;
    private String buyerContact;
}
