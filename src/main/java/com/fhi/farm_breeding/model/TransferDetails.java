package com.fhi.farm_breeding.model;

import java.time.LocalDate;

import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.Setter;

@Embeddable
@Getter @Setter
public class TransferDetails
{
    private LocalDate transferDate;
    private String transferDestination;
    private String transferNotes;
}
