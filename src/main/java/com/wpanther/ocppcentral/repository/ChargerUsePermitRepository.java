package com.wpanther.ocppcentral.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.wpanther.ocppcentral.entity.ChargerUsePermit;

@Repository
public interface ChargerUsePermitRepository extends JpaRepository<ChargerUsePermit, Long> {

    /**
     * Permission record of a driver at a site, if one was configured
     */
    Optional<ChargerUsePermit> findFirstByCompanyIdAndSiteIdAndDriverId(Long companyId, Long siteId, Long driverId);
}
