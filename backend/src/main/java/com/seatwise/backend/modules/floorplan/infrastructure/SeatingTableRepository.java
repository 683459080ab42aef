package com.seatwise.backend.modules.floorplan.infrastructure;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.seatwise.backend.modules.floorplan.domain.SeatingTable;

public interface SeatingTableRepository extends JpaRepository<SeatingTable, UUID> {

    List<SeatingTable> findByFloorPlan_IdOrderByTableNumberAsc(UUID floorPlanId);

    @Query("select coalesce(max(t.tableNumber), 0) from SeatingTable t where t.floorPlan.id = :floorPlanId")
    int findMaxTableNumber(@Param("floorPlanId") UUID floorPlanId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from SeatingTable t where t.id = :id")
    Optional<SeatingTable> findByIdForUpdate(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from SeatingTable t where t.id in :ids order by t.id")
    List<SeatingTable> findByIdInForUpdate(@Param("ids") Collection<UUID> ids);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from SeatingTable t where t.floorPlan.id = :floorPlanId order by t.tableNumber")
    List<SeatingTable> findByFloorPlanIdForUpdate(@Param("floorPlanId") UUID floorPlanId);
}
