package com.wpanther.ocppcentral.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.wpanther.ocppcentral.entity.PaymentTransaction;

@Repository
public interface PaymentTransactionRepository extends JpaRepository<PaymentTransaction, Long> {

    /**
     * Find a transaction by the payment gateway's intent id
     */
    Optional<PaymentTransaction> findByExternalIntentId(String externalIntentId);

    /**
     * Latest transaction linked to a session
     */
    Optional<PaymentTransaction> findFirstBySessionIdOrderByCreatedAtDescIdDesc(Long sessionId);
}
