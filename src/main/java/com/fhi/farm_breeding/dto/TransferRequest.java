package com.fhi.farm_breeding.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class TransferRequest
{
    @NotNull
    private LocalDate transferDate;

    @NotBlank
    private String destination;

    private String notes;
}
