package com.wpanther.ocppcentral.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.wpanther.ocppcentral.entity.Connector;

@Repository
public interface ConnectorRepository extends JpaRepository<Connector, Long> {

    Optional<Connector> findByChargerIdAndConnectorId(Long chargerId, Integer connectorId);

    List<Connector> findByChargerIdOrderByConnectorIdAsc(Long chargerId);
}
