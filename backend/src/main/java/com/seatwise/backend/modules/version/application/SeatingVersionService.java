package com.seatwise.backend.modules.version.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.seatwise.backend.global.error.ProblemException;
import com.seatwise.backend.modules.changelog.application.SeatingChangeLogService;
import com.seatwise.backend.modules.changelog.application.SeatingChangeLogService.ChangeLogCommand;
import com.seatwise.backend.modules.changelog.domain.ChangeAction;
import com.seatwise.backend.modules.floorplan.domain.FloorPlan;
import com.seatwise.backend.modules.floorplan.domain.SeatingTable;
import com.seatwise.backend.modules.floorplan.infrastructure.FloorPlanRepository;
import com.seatwise.backend.modules.floorplan.infrastructure.SeatingTableRepository;
import com.seatwise.backend.modules.guest.domain.Guest;
import com.seatwise.backend.modules.guest.infrastructure.GuestRepository;
import com.seatwise.backend.modules.seating.application.SeatingProblems;
import com.seatwise.backend.modules.seating.domain.GuestAssignment;
import com.seatwise.backend.modules.seating.infrastructure.GuestAssignmentRepository;
import com.seatwise.backend.modules.version.domain.AssignmentLayoutSnapshot;
import com.seatwise.backend.modules.version.domain.AssignmentSnapshot;
import com.seatwise.backend.modules.version.domain.SeatingVersion;
import com.seatwise.backend.modules.version.domain.TableLayoutSnapshot;
import com.seatwise.backend.modules.version.domain.TableSnapshot;
import com.seatwise.backend.modules.version.infrastructure.SeatingVersionRepository;
import com.seatwise.backend.modules.version.presentation.dto.RestoreVersionResponse;
import com.seatwise.backend.modules.version.presentation.dto.SaveVersionRequest;
import com.seatwise.backend.modules.version.presentation.dto.VersionDetailResponse;
import com.seatwise.backend.modules.version.presentation.dto.VersionSummaryResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.AuditorAware;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Named snapshots of a floor plan. After a save or restore exactly one version of the floor plan is current.
 */
@Service
@Transactional
public class SeatingVersionService {

    private static final Logger log = LoggerFactory.getLogger(SeatingVersionService.class);

    private final SeatingVersionRepository seatingVersionRepository;
    private final FloorPlanRepository floorPlanRepository;
    private final SeatingTableRepository seatingTableRepository;
    private final GuestAssignmentRepository guestAssignmentRepository;
    private final GuestRepository guestRepository;
    private final SeatingChangeLogService seatingChangeLogService;
    private final AuditorAware<UUID> auditorAware;
    private final Clock clock;

    public SeatingVersionService(
            SeatingVersionRepository seatingVersionRepository,
            FloorPlanRepository floorPlanRepository,
            SeatingTableRepository seatingTableRepository,
            GuestAssignmentRepository guestAssignmentRepository,
            GuestRepository guestRepository,
            SeatingChangeLogService seatingChangeLogService,
            AuditorAware<UUID> auditorAware,
            Clock clock
    ) {
        this.seatingVersionRepository = seatingVersionRepository;
        this.floorPlanRepository = floorPlanRepository;
        this.seatingTableRepository = seatingTableRepository;
        this.guestAssignmentRepository = guestAssignmentRepository;
        this.guestRepository = guestRepository;
        this.seatingChangeLogService = seatingChangeLogService;
        this.auditorAware = auditorAware;
        this.clock = clock;
    }

    @Transactional(isolation = Isolation.SERIALIZABLE)
    public VersionSummaryResponse saveVersion(UUID floorPlanId, SaveVersionRequest request) {
        // Row lock on the floor plan serializes version numbering.
        FloorPlan floorPlan = floorPlanRepository.findByIdForUpdate(floorPlanId)
                .orElseThrow(() -> SeatingProblems.floorPlanNotFound(floorPlanId));

        List<TableSnapshot> tables = seatingTableRepository.findByFloorPlan_IdOrderByTableNumberAsc(floorPlanId)
                .stream()
                .map(TableSnapshot::of)
                .toList();
        List<AssignmentSnapshot> assignments = guestAssignmentRepository.findByFloorPlanId(floorPlanId).stream()
                .map(AssignmentSnapshot::of)
                .toList();
        long totalGuests = guestRepository.countByClientId(floorPlan.getClientId());
        int nextNumber = seatingVersionRepository.findMaxVersionNumber(floorPlanId) + 1;

        SeatingVersion version = new SeatingVersion();
        version.setFloorPlanId(floorPlanId);
        version.setVersionNumber(nextNumber);
        version.setName(request.name().trim());
        version.setDescription(request.description());
        version.setTableSnapshot(new TableLayoutSnapshot(tables));
        version.setAssignmentSnapshot(new AssignmentLayoutSnapshot(assignments));
        version.setTotalGuests((int) totalGuests);
        version.setAssignedGuests(assignments.size());
        version.setTotalTables(tables.size());
        version.setCurrent(true);
        version.setAutoSave(Boolean.TRUE.equals(request.autoSave()));
        version.setCreatedBy(auditorAware.getCurrentAuditor().orElse(null));
        version.setCreatedAt(OffsetDateTime.now(clock));

        seatingVersionRepository.clearCurrent(floorPlanId);
        SeatingVersion saved = seatingVersionRepository.save(version);
        log.info("Saved version {} (#{}) of floor plan {}", saved.getId(), nextNumber, floorPlanId);
        return VersionSummaryResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public List<VersionSummaryResponse> listVersions(UUID floorPlanId) {
        return seatingVersionRepository.findByFloorPlanIdOrderByVersionNumberDesc(floorPlanId).stream()
                .map(VersionSummaryResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public VersionDetailResponse getVersion(UUID floorPlanId, UUID versionId) {
        return VersionDetailResponse.from(loadVersion(floorPlanId, versionId));
    }

    /**
     * Rewrites table geometry and replaces every assignment with the snapshot. Tables deleted since the
     * snapshot are skipped along with the assignments that pointed at them, as are guests no longer on
     * the roster. A snapshot that would overfill a table whose capacity was lowered is rejected.
     */
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public RestoreVersionResponse restoreVersion(UUID floorPlanId, UUID versionId) {
        SeatingVersion version = loadVersion(floorPlanId, versionId);
        int versionNumber = version.getVersionNumber();
        List<TableSnapshot> tableSnapshots = version.getTableSnapshot().tables();
        List<AssignmentSnapshot> assignmentSnapshots = version.getAssignmentSnapshot().assignments();

        Map<UUID, SeatingTable> liveTables = seatingTableRepository.findByFloorPlanIdForUpdate(floorPlanId).stream()
                .collect(Collectors.toMap(SeatingTable::getId, Function.identity()));

        Set<UUID> rosterGuests = guestRepository.findAllById(
                        assignmentSnapshots.stream().map(AssignmentSnapshot::guestId).toList())
                .stream()
                .map(Guest::getId)
                .collect(Collectors.toSet());
        List<AssignmentSnapshot> restorable = assignmentSnapshots.stream()
                .filter(snapshot -> liveTables.containsKey(snapshot.tableId()))
                .filter(snapshot -> rosterGuests.contains(snapshot.guestId()))
                .toList();
        ensureFits(restorable, liveTables);

        int restoredTables = 0;
        int skippedTables = 0;
        for (TableSnapshot snapshot : tableSnapshots) {
            SeatingTable table = liveTables.get(snapshot.id());
            if (table == null) {
                skippedTables++;
                continue;
            }
            table.moveTo(snapshot.x(), snapshot.y());
            table.resize(snapshot.width(), snapshot.height());
            table.setRotation(snapshot.rotation());
            restoredTables++;
        }

        guestAssignmentRepository.deleteByFloorPlan(floorPlanId);
        List<GuestAssignment> rows = new ArrayList<>(restorable.size());
        for (AssignmentSnapshot snapshot : restorable) {
            rows.add(new GuestAssignment(floorPlanId, snapshot.tableId(), snapshot.guestId(), snapshot.seatNumber()));
        }
        guestAssignmentRepository.saveAll(rows);

        seatingVersionRepository.clearCurrent(floorPlanId);
        seatingVersionRepository.markCurrent(versionId);

        RestoreVersionResponse response = new RestoreVersionResponse(
                versionId, versionNumber, restoredTables, rows.size(), skippedTables);
        Map<String, Object> newState = new LinkedHashMap<>();
        newState.put("versionId", versionId);
        newState.put("versionNumber", versionNumber);
        newState.put("restoredTables", restoredTables);
        newState.put("restoredAssignments", rows.size());
        newState.put("skippedTables", skippedTables);
        seatingChangeLogService.log(new ChangeLogCommand(
                floorPlanId, ChangeAction.RESTORE_VERSION, null, null, null, newState));

        log.info("Restored version #{} of floor plan {}: {} table(s), {} assignment(s), {} table(s) skipped",
                versionNumber, floorPlanId, restoredTables, rows.size(), skippedTables);
        return response;
    }

    /**
     * Deleting the current version leaves the floor plan without one until the next save or restore.
     */
    public void deleteVersion(UUID floorPlanId, UUID versionId) {
        SeatingVersion version = loadVersion(floorPlanId, versionId);
        seatingVersionRepository.delete(version);
        if (version.isCurrent()) {
            log.info("Deleted current version {} of floor plan {}; no version is current now", versionId, floorPlanId);
        }
    }

    private void ensureFits(List<AssignmentSnapshot> restorable, Map<UUID, SeatingTable> liveTables) {
        Map<UUID, Integer> counts = new HashMap<>();
        for (AssignmentSnapshot snapshot : restorable) {
            int next = counts.merge(snapshot.tableId(), 1, Integer::sum);
            SeatingTable table = liveTables.get(snapshot.tableId());
            if (next > table.getCapacity()) {
                throw SeatingProblems.capacityExceeded(table);
            }
        }
    }

    private SeatingVersion loadVersion(UUID floorPlanId, UUID versionId) {
        return seatingVersionRepository.findByIdAndFloorPlanId(versionId, floorPlanId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "VERSION_NOT_FOUND",
                        "Version " + versionId + " not found"));
    }
}
