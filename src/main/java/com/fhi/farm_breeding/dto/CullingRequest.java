package com.fhi.farm_breeding.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class CullingRequest
{
    @NotNull
    private LocalDate cullingDate;

    @NotBlank
    private String reason;

    private String notes;
}
