package com.wpanther.ocppcentral.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.wpanther.ocppcentral.entity.RfidCard;

@Repository
public interface RfidCardRepository extends JpaRepository<RfidCard, String> {
}
