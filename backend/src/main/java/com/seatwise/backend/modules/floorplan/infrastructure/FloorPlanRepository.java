package com.seatwise.backend.modules.floorplan.infrastructure;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.seatwise.backend.modules.floorplan.domain.FloorPlan;

public interface FloorPlanRepository extends JpaRepository<FloorPlan, UUID> {

    List<FloorPlan> findByClient_IdOrderByCreatedAtDesc(UUID clientId);

    @EntityGraph(attributePaths = "client")
    Optional<FloorPlan> findWithClientById(UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select f from FloorPlan f where f.id = :id")
    Optional<FloorPlan> findByIdForUpdate(@Param("id") UUID id);
}
