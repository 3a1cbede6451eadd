package com.transferhub.pricing.repository;

import com.transferhub.pricing.entity.PricingScheme;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PricingSchemeRepository extends JpaRepository<PricingScheme, UUID> {

    List<PricingScheme> findByActiveTrueOrderByCreatedAtAsc();
}
