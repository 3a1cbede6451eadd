package com.transferhub.pricing.repository;

import com.transferhub.pricing.entity.GeoFixedRoute;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface GeoFixedRouteRepository extends JpaRepository<GeoFixedRoute, UUID> {

    List<GeoFixedRoute> findByActiveTrueOrderByPriorityDescCreatedAtAsc();
}
