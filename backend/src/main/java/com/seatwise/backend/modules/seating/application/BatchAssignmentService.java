package com.seatwise.backend.modules.seating.application;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
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
import com.seatwise.backend.modules.floorplan.domain.SeatingTable;
import com.seatwise.backend.modules.floorplan.infrastructure.SeatingTableRepository;
import com.seatwise.backend.modules.guest.domain.Guest;
import com.seatwise.backend.modules.guest.infrastructure.GuestRepository;
import com.seatwise.backend.modules.seating.domain.GuestAssignment;
import com.seatwise.backend.modules.seating.infrastructure.GuestAssignmentRepository;
import com.seatwise.backend.modules.seating.presentation.dto.BatchAssignRequest;
import com.seatwise.backend.modules.seating.presentation.dto.BatchAssignResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

/**
 * All-or-nothing placement of many guests, used by optimizer imports. Every check runs before
 * the first write so a rejected batch leaves the floor plan untouched.
 */
@Service
public class BatchAssignmentService {

    private static final Logger log = LoggerFactory.getLogger(BatchAssignmentService.class);

    private final GuestAssignmentRepository guestAssignmentRepository;
    private final SeatingTableRepository seatingTableRepository;
    private final GuestRepository guestRepository;
    private final SeatingChangeLogService seatingChangeLogService;

    public BatchAssignmentService(
            GuestAssignmentRepository guestAssignmentRepository,
            SeatingTableRepository seatingTableRepository,
            GuestRepository guestRepository,
            SeatingChangeLogService seatingChangeLogService
    ) {
        this.guestAssignmentRepository = guestAssignmentRepository;
        this.seatingTableRepository = seatingTableRepository;
        this.guestRepository = guestRepository;
        this.seatingChangeLogService = seatingChangeLogService;
    }

    @Transactional(isolation = Isolation.SERIALIZABLE)
    public BatchAssignResponse batchAssign(UUID floorPlanId, BatchAssignRequest request) {
        List<BatchAssignRequest.Item> items = request.assignments();
        if (items == null || items.isEmpty()) {
            return new BatchAssignResponse(0, 0);
        }

        Set<UUID> guestIds = new LinkedHashSet<>();
        for (BatchAssignRequest.Item item : items) {
            if (!guestIds.add(item.guestId())) {
                throw new ProblemException(HttpStatus.BAD_REQUEST, "DUPLICATE_GUEST_IN_BATCH",
                        "Guest " + item.guestId() + " appears more than once in the batch");
            }
        }

        Map<UUID, SeatingTable> tables = lockTargetTables(floorPlanId, items);
        UUID clientId = tables.values().iterator().next().getFloorPlan().getClientId();
        ensureGuestsOfClient(guestIds, clientId);

        Map<UUID, Integer> occupancy = new HashMap<>();
        for (GuestAssignment kept : guestAssignmentRepository.findByFloorPlanIdExcludingGuests(floorPlanId, guestIds)) {
            occupancy.merge(kept.getTableId(), 1, Integer::sum);
        }
        for (BatchAssignRequest.Item item : items) {
            SeatingTable table = tables.get(item.tableId());
            int next = occupancy.merge(item.tableId(), 1, Integer::sum);
            if (next > table.getCapacity()) {
                log.info("Rejected batch for floor plan {}: table {} would hold {} of {} seats",
                        floorPlanId, table.getId(), next, table.getCapacity());
                throw SeatingProblems.capacityExceeded(table);
            }
        }

        int replaced = guestAssignmentRepository.deleteByFloorPlanAndGuests(floorPlanId, guestIds);
        List<GuestAssignment> rows = new ArrayList<>(items.size());
        for (BatchAssignRequest.Item item : items) {
            rows.add(new GuestAssignment(floorPlanId, item.tableId(), item.guestId(), item.seatNumber()));
        }
        guestAssignmentRepository.saveAll(rows);

        Map<String, Object> newState = new LinkedHashMap<>();
        newState.put("assigned", rows.size());
        newState.put("replaced", replaced);
        newState.put("tableIds", List.copyOf(tables.keySet()));
        seatingChangeLogService.log(new ChangeLogCommand(
                floorPlanId, ChangeAction.BATCH_ASSIGN, null, null, null, newState));

        log.info("Batch assigned {} guest(s) on floor plan {} ({} replaced)", rows.size(), floorPlanId, replaced);
        return new BatchAssignResponse(rows.size(), replaced);
    }

    private Map<UUID, SeatingTable> lockTargetTables(UUID floorPlanId, List<BatchAssignRequest.Item> items) {
        Set<UUID> tableIds = items.stream()
                .map(BatchAssignRequest.Item::tableId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<UUID, SeatingTable> found = seatingTableRepository.findByIdInForUpdate(tableIds).stream()
                .collect(Collectors.toMap(SeatingTable::getId, Function.identity()));

        Map<UUID, SeatingTable> ordered = new LinkedHashMap<>();
        for (UUID tableId : tableIds) {
            SeatingTable table = found.get(tableId);
            if (table == null || !table.belongsTo(floorPlanId)) {
                throw SeatingProblems.tableNotFound(tableId);
            }
            ordered.put(tableId, table);
        }
        return ordered;
    }

    // Guests on another client's roster are reported the same as missing ones.
    private void ensureGuestsOfClient(Set<UUID> guestIds, UUID clientId) {
        Set<UUID> existing = guestRepository.findAllById(guestIds).stream()
                .filter(guest -> clientId.equals(guest.getClientId()))
                .map(Guest::getId)
                .collect(Collectors.toSet());
        for (UUID guestId : guestIds) {
            if (!existing.contains(guestId)) {
                throw SeatingProblems.guestNotFound(guestId);
            }
        }
    }
}
