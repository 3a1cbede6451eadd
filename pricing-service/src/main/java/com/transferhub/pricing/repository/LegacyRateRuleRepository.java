package com.transferhub.pricing.repository;

import com.transferhub.pricing.entity.LegacyRateRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface LegacyRateRuleRepository extends JpaRepository<LegacyRateRule, UUID> {

    Optional<LegacyRateRule> findByVehicleClassId(String vehicleClassId);
}
