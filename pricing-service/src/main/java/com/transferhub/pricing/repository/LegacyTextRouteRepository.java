package com.transferhub.pricing.repository;

import com.transferhub.pricing.entity.LegacyTextRoute;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface LegacyTextRouteRepository extends JpaRepository<LegacyTextRoute, UUID> {

    List<LegacyTextRoute> findByActiveTrueOrderByCreatedAtAsc();
}
