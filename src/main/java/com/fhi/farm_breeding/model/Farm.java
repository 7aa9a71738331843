package com.fhi.farm_breeding.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

/**
 * A farm and the user owning it. Only the ownership part is used here;
 * farm management itself lives elsewhere.
 */
@Entity
@Table(name = "farm")
@Getter
@Setter
public class Farm
{
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Column(nullable = false, unique = true)
    private String name;

    @NotNull
    @Column(name = "owner_user_id", nullable = false)
    private Long ownerUserId;

    private boolean archived = false;

    @Override
    public String toString()
    {   return name;
    }
}
