package com.wpanther.ocppcentral.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "driver_groups")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriverGroup {

    @Id
    private Long id;

    @Column(name = "company_id", nullable = false)
    private Long companyId;

    @Column(name = "name")
    private String name;

    // Tariff applied to sessions of the group's drivers
    @Column(name = "tariff_id")
    private Long tariffId;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;
}
