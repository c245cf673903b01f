package com.wpanther.ocppcentral.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.wpanther.ocppcentral.entity.Tariff;

@Repository
public interface TariffRepository extends JpaRepository<Tariff, Long> {
}
