package com.seatwise.backend.modules.seating.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.seatwise.backend.modules.changelog.application.SeatingChangeLogService;
import com.seatwise.backend.modules.changelog.application.SeatingChangeLogService.ChangeLogCommand;
import com.seatwise.backend.modules.changelog.domain.ChangeAction;
import com.seatwise.backend.modules.floorplan.domain.FloorPlan;
import com.seatwise.backend.modules.floorplan.domain.SeatingTable;
import com.seatwise.backend.modules.floorplan.infrastructure.FloorPlanRepository;
import com.seatwise.backend.modules.floorplan.infrastructure.SeatingTableRepository;
import com.seatwise.backend.modules.guest.domain.Guest;
import com.seatwise.backend.modules.guest.infrastructure.GuestRepository;
import com.seatwise.backend.modules.seating.domain.GuestAssignment;
import com.seatwise.backend.modules.seating.infrastructure.GuestAssignmentRepository;
import com.seatwise.backend.modules.seating.presentation.dto.AssignGuestRequest;
import com.seatwise.backend.modules.seating.presentation.dto.AssignGuestResponse;
import com.seatwise.backend.modules.seating.presentation.dto.AssignmentResponse;
import com.seatwise.backend.modules.seating.presentation.dto.ConflictCheckResponse;
import com.seatwise.backend.modules.seating.presentation.dto.SeatedGuest;
import com.seatwise.backend.modules.seating.presentation.dto.UnassignedGuestResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Single-guest seating. Capacity is a hard limit checked under a row lock on the table;
 * conflicts are advisory and only recorded.
 */
@Service
@Transactional
public class SeatAssignmentService {

    private static final Logger log = LoggerFactory.getLogger(SeatAssignmentService.class);

    private final GuestAssignmentRepository guestAssignmentRepository;
    private final SeatingTableRepository seatingTableRepository;
    private final FloorPlanRepository floorPlanRepository;
    private final GuestRepository guestRepository;
    private final SeatingConflictEvaluator seatingConflictEvaluator;
    private final SeatingChangeLogService seatingChangeLogService;

    public SeatAssignmentService(
            GuestAssignmentRepository guestAssignmentRepository,
            SeatingTableRepository seatingTableRepository,
            FloorPlanRepository floorPlanRepository,
            GuestRepository guestRepository,
            SeatingConflictEvaluator seatingConflictEvaluator,
            SeatingChangeLogService seatingChangeLogService
    ) {
        this.guestAssignmentRepository = guestAssignmentRepository;
        this.seatingTableRepository = seatingTableRepository;
        this.floorPlanRepository = floorPlanRepository;
        this.guestRepository = guestRepository;
        this.seatingConflictEvaluator = seatingConflictEvaluator;
        this.seatingChangeLogService = seatingChangeLogService;
    }

    @Transactional(isolation = Isolation.SERIALIZABLE)
    public AssignGuestResponse assign(UUID floorPlanId, AssignGuestRequest request) {
        UUID tableId = request.tableId();
        UUID guestId = request.guestId();

        SeatingTable table = seatingTableRepository.findByIdForUpdate(tableId)
                .filter(candidate -> candidate.belongsTo(floorPlanId))
                .orElseThrow(() -> SeatingProblems.tableNotFound(tableId));
        Guest guest = guestRepository.findById(guestId)
                .orElseThrow(() -> SeatingProblems.guestNotFound(guestId));
        if (!guest.getClientId().equals(table.getFloorPlan().getClientId())) {
            throw SeatingProblems.guestNotFound(guestId);
        }

        long occupants = guestAssignmentRepository.countByTableIdAndGuestIdNot(tableId, guestId);
        if (occupants >= table.getCapacity()) {
            log.info("Rejected seating guest {} at table {}: {} of {} seats taken",
                    guestId, tableId, occupants, table.getCapacity());
            throw SeatingProblems.capacityExceeded(table);
        }

        ConflictCheckResponse check = request.force()
                ? ConflictCheckResponse.empty()
                : seatingConflictEvaluator.evaluate(guestId, tableId);
        if (check.hasConflicts()) {
            log.info("Guest {} seated at table {} alongside {} conflicting guest(s)",
                    guestId, tableId, check.conflicts().size());
            seatingChangeLogService.log(new ChangeLogCommand(
                    floorPlanId,
                    ChangeAction.SEATING_CONFLICT,
                    guestId,
                    tableId,
                    null,
                    Map.of("conflictingGuestIds", check.conflicts().stream().map(SeatedGuest::guestId).toList())
            ));
        }

        Optional<GuestAssignment> previous = guestAssignmentRepository.findByFloorPlanIdAndGuestId(floorPlanId, guestId);
        UUID previousTableId = previous.map(GuestAssignment::getTableId).orElse(null);
        guestAssignmentRepository.deleteByFloorPlanAndGuest(floorPlanId, guestId);
        GuestAssignment saved = guestAssignmentRepository.save(
                new GuestAssignment(floorPlanId, tableId, guestId, request.seatNumber()));

        Map<String, Object> previousState = new LinkedHashMap<>();
        previousState.put("tableId", previousTableId);
        Map<String, Object> newState = new LinkedHashMap<>();
        newState.put("tableId", tableId);
        newState.put("seatNumber", request.seatNumber());
        seatingChangeLogService.log(new ChangeLogCommand(
                floorPlanId, ChangeAction.ASSIGN, guestId, tableId, previousState, newState));

        return new AssignGuestResponse(AssignmentResponse.from(saved), check.conflicts(), check.hasConflicts());
    }

    /**
     * Idempotent: removing a guest who is not seated is a no-op and writes no log entry.
     */
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public void unassign(UUID floorPlanId, UUID guestId) {
        Optional<GuestAssignment> existing = guestAssignmentRepository.findByFloorPlanIdAndGuestId(floorPlanId, guestId);
        if (existing.isEmpty()) {
            return;
        }
        UUID tableId = existing.get().getTableId();
        int removed = guestAssignmentRepository.deleteByFloorPlanAndGuest(floorPlanId, guestId);
        if (removed > 0) {
            seatingChangeLogService.log(new ChangeLogCommand(
                    floorPlanId, ChangeAction.UNASSIGN, guestId, tableId, Map.of("tableId", tableId), null));
        }
    }

    @Transactional(readOnly = true)
    public List<AssignmentResponse> listAssignments(UUID floorPlanId) {
        return guestAssignmentRepository.findByFloorPlanId(floorPlanId).stream()
                .map(AssignmentResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<UnassignedGuestResponse> unassignedGuests(UUID floorPlanId) {
        FloorPlan floorPlan = floorPlanRepository.findById(floorPlanId)
                .orElseThrow(() -> SeatingProblems.floorPlanNotFound(floorPlanId));
        return guestAssignmentRepository.findUnassignedGuests(floorPlanId, floorPlan.getClientId()).stream()
                .map(UnassignedGuestResponse::from)
                .toList();
    }
}
