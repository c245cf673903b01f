package com.wpanther.ocppcentral.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "rfid_cards")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RfidCard {

    // The idTag presented by the card
    @Id
    private String id;

    @Column(name = "company_id")
    private Long companyId;

    @Column(name = "driver_id")
    private Long driverId;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;
}
