package com.seatwise.backend.modules.changelog.infrastructure;

import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import com.seatwise.backend.modules.changelog.domain.SeatingChangeLogEntry;

public interface SeatingChangeLogRepository extends JpaRepository<SeatingChangeLogEntry, UUID> {

    List<SeatingChangeLogEntry> findByFloorPlanIdOrderByChangedAtDesc(UUID floorPlanId, Pageable pageable);
}
