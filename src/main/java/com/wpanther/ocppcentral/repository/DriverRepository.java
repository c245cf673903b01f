package com.wpanther.ocppcentral.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.wpanther.ocppcentral.entity.Driver;

@Repository
public interface DriverRepository extends JpaRepository<Driver, Long> {
}
