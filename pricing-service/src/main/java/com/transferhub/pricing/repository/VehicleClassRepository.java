package com.transferhub.pricing.repository;

import com.transferhub.pricing.entity.VehicleClass;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface VehicleClassRepository extends JpaRepository<VehicleClass, String> {

    List<VehicleClass> findByActiveTrueOrderBySortOrderAsc();
}
