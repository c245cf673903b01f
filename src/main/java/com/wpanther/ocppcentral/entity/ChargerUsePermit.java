package com.wpanther.ocppcentral.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-driver, per-site permission. Absence of a record means the driver
 * may charge; a disabled record blocks the driver at that site.
 */
@Entity
@Table(name = "charger_use_permits")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChargerUsePermit {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id", nullable = false)
    private Long companyId;

    @Column(name = "site_id", nullable = false)
    private Long siteId;

    @Column(name = "driver_id", nullable = false)
    private Long driverId;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;
}
