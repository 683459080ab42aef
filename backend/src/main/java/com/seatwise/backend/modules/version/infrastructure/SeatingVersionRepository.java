package com.seatwise.backend.modules.version.infrastructure;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.seatwise.backend.modules.version.domain.SeatingVersion;

public interface SeatingVersionRepository extends JpaRepository<SeatingVersion, UUID> {

    List<SeatingVersion> findByFloorPlanIdOrderByVersionNumberDesc(UUID floorPlanId);

    Optional<SeatingVersion> findByIdAndFloorPlanId(UUID id, UUID floorPlanId);

    @Query("select coalesce(max(v.versionNumber), 0) from SeatingVersion v where v.floorPlanId = :floorPlanId")
    int findMaxVersionNumber(@Param("floorPlanId") UUID floorPlanId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SeatingVersion v set v.currentVersion = false where v.floorPlanId = :floorPlanId and v.currentVersion = true")
    int clearCurrent(@Param("floorPlanId") UUID floorPlanId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SeatingVersion v set v.currentVersion = true where v.id = :id")
    int markCurrent(@Param("id") UUID id);
}
