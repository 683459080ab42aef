package com.seatwise.backend.modules.seating.application;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

import com.seatwise.backend.modules.floorplan.domain.FloorPlan;
import com.seatwise.backend.modules.floorplan.infrastructure.SeatingTableRepository;
import com.seatwise.backend.modules.guest.application.GuestRelationshipService;
import com.seatwise.backend.modules.guest.domain.Guest;
import com.seatwise.backend.modules.guest.domain.GuestConflict;
import com.seatwise.backend.modules.guest.infrastructure.GuestConflictRepository;
import com.seatwise.backend.modules.guest.infrastructure.GuestRepository;
import com.seatwise.backend.modules.seating.domain.GuestAssignment;
import com.seatwise.backend.modules.seating.infrastructure.GuestAssignmentRepository;
import com.seatwise.backend.modules.seating.presentation.dto.ConflictCheckResponse;
import com.seatwise.backend.modules.seating.presentation.dto.SeatedGuest;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Advisory check of who a guest would sit with. Never blocks a write.
 */
@Service
@Transactional(readOnly = true)
public class SeatingConflictEvaluator {

    private final GuestRepository guestRepository;
    private final GuestRelationshipService guestRelationshipService;
    private final GuestConflictRepository guestConflictRepository;
    private final GuestAssignmentRepository guestAssignmentRepository;
    private final SeatingTableRepository seatingTableRepository;

    public SeatingConflictEvaluator(
            GuestRepository guestRepository,
            GuestRelationshipService guestRelationshipService,
            GuestConflictRepository guestConflictRepository,
            GuestAssignmentRepository guestAssignmentRepository,
            SeatingTableRepository seatingTableRepository
    ) {
        this.guestRepository = guestRepository;
        this.guestRelationshipService = guestRelationshipService;
        this.guestConflictRepository = guestConflictRepository;
        this.guestAssignmentRepository = guestAssignmentRepository;
        this.seatingTableRepository = seatingTableRepository;
    }

    /**
     * Evaluates only a table of this floor plan against a guest of its client; anything else
     * yields an empty result.
     */
    public ConflictCheckResponse evaluateOnFloorPlan(FloorPlan floorPlan, UUID guestId, UUID tableId) {
        boolean tableOnPlan = seatingTableRepository.findById(tableId)
                .map(table -> table.belongsTo(floorPlan.getId()))
                .orElse(false);
        boolean guestOfClient = guestRepository.findById(guestId)
                .map(guest -> floorPlan.getClientId().equals(guest.getClientId()))
                .orElse(false);
        if (!tableOnPlan || !guestOfClient) {
            return ConflictCheckResponse.empty();
        }
        return evaluate(guestId, tableId);
    }

    public ConflictCheckResponse evaluate(UUID guestId, UUID tableId) {
        if (!guestRepository.existsById(guestId)) {
            return ConflictCheckResponse.empty();
        }

        Set<UUID> conflictPartners = guestRelationshipService.conflictPartnersOf(guestId);
        Set<UUID> preferencePartners = guestRelationshipService.preferencePartnersOf(guestId);
        if (conflictPartners.isEmpty() && preferencePartners.isEmpty()) {
            return ConflictCheckResponse.empty();
        }

        List<Guest> occupants = guestAssignmentRepository.findOccupantsExcluding(tableId, guestId);
        List<SeatedGuest> conflicts = occupants.stream()
                .filter(occupant -> conflictPartners.contains(occupant.getId()))
                .map(SeatedGuest::from)
                .toList();
        List<SeatedGuest> preferences = occupants.stream()
                .filter(occupant -> preferencePartners.contains(occupant.getId()))
                .map(SeatedGuest::from)
                .toList();
        return ConflictCheckResponse.of(conflicts, preferences);
    }

    /**
     * Conflicting pairs already seated together, keyed by table. Pairs render as "first-second"
     * in canonical order and tables without conflicts are omitted.
     */
    public Map<UUID, List<String>> tableConflicts(UUID floorPlanId, UUID clientId) {
        Map<UUID, UUID> tableByGuest = new HashMap<>();
        for (GuestAssignment assignment : guestAssignmentRepository.findByFloorPlanId(floorPlanId)) {
            tableByGuest.put(assignment.getGuestId(), assignment.getTableId());
        }
        if (tableByGuest.isEmpty()) {
            return Map.of();
        }

        Map<UUID, Set<String>> pairsByTable = new TreeMap<>();
        for (GuestConflict conflict : guestConflictRepository.findByClientIdAndActiveTrue(clientId)) {
            UUID tableOne = tableByGuest.get(conflict.getGuestOneId());
            UUID tableTwo = tableByGuest.get(conflict.getGuestTwoId());
            if (tableOne != null && tableOne.equals(tableTwo)) {
                pairsByTable.computeIfAbsent(tableOne, key -> new TreeSet<>())
                        .add(conflict.getGuestOneId() + "-" + conflict.getGuestTwoId());
            }
        }

        Map<UUID, List<String>> result = new LinkedHashMap<>();
        pairsByTable.forEach((tableId, pairs) -> result.put(tableId, List.copyOf(pairs)));
        return result;
    }
}
