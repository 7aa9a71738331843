package com.fhi.farm_breeding.model;

import java.time.LocalDate;

import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.Setter;

@Embeddable
@Getter @Setter
public class CullingDetails
{
    private LocalDate cullingDate;
    private String cullingReason;
    private String cullingNotes;
}
