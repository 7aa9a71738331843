package com.fhi.farm_breeding.model;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.Setter;

@Embeddable
@Getter @Setter
public class SaleDetails
{
    private LocalDate saleDate;
    private BigDecimal salePrice;
    private String saleCurrency;
    private String buyer;
    private String buyerContact;
}
