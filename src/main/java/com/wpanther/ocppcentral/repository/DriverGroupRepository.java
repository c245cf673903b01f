package com.wpanther.ocppcentral.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.wpanther.ocppcentral.entity.DriverGroup;

@Repository
public interface DriverGroupRepository extends JpaRepository<DriverGroup, Long> {
}
