package com.seatwise.backend.modules.seating.presentation;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.seatwise.backend.modules.floorplan.application.FloorPlanAccessPolicy;
import com.seatwise.backend.modules.floorplan.domain.FloorPlan;
import com.seatwise.backend.modules.seating.application.BatchAssignmentService;
import com.seatwise.backend.modules.seating.application.SeatAssignmentService;
import com.seatwise.backend.modules.seating.application.SeatingConflictEvaluator;
import com.seatwise.backend.modules.seating.presentation.dto.AssignGuestRequest;
import com.seatwise.backend.modules.seating.presentation.dto.AssignGuestResponse;
import com.seatwise.backend.modules.seating.presentation.dto.AssignmentResponse;
import com.seatwise.backend.modules.seating.presentation.dto.BatchAssignRequest;
import com.seatwise.backend.modules.seating.presentation.dto.BatchAssignResponse;
import com.seatwise.backend.modules.seating.presentation.dto.ConflictCheckResponse;
import com.seatwise.backend.modules.seating.presentation.dto.UnassignedGuestResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/floor-plans/{floorPlanId}")
public class SeatAssignmentController {

    private final SeatAssignmentService seatAssignmentService;
    private final BatchAssignmentService batchAssignmentService;
    private final SeatingConflictEvaluator seatingConflictEvaluator;
    private final FloorPlanAccessPolicy floorPlanAccessPolicy;

    public SeatAssignmentController(
            SeatAssignmentService seatAssignmentService,
            BatchAssignmentService batchAssignmentService,
            SeatingConflictEvaluator seatingConflictEvaluator,
            FloorPlanAccessPolicy floorPlanAccessPolicy
    ) {
        this.seatAssignmentService = seatAssignmentService;
        this.batchAssignmentService = batchAssignmentService;
        this.seatingConflictEvaluator = seatingConflictEvaluator;
        this.floorPlanAccessPolicy = floorPlanAccessPolicy;
    }

    @Operation(summary = "Check seating conflicts", description = "Advisory: who the guest would clash with or like to sit with at the table.")
    @GetMapping("/conflicts/check")
    public ResponseEntity<ConflictCheckResponse> checkConflicts(
            @PathVariable("floorPlanId") UUID floorPlanId,
            @RequestParam("guestId") UUID guestId,
            @RequestParam("tableId") UUID tableId
    ) {
        FloorPlan floorPlan = floorPlanAccessPolicy.requireAccessibleFloorPlan(floorPlanId);
        return ResponseEntity.ok(seatingConflictEvaluator.evaluateOnFloorPlan(floorPlan, guestId, tableId));
    }

    @Operation(summary = "Conflicting pairs seated together, per table")
    @GetMapping("/conflicts")
    public ResponseEntity<Map<UUID, List<String>>> tableConflicts(@PathVariable("floorPlanId") UUID floorPlanId) {
        FloorPlan floorPlan = floorPlanAccessPolicy.requireAccessibleFloorPlan(floorPlanId);
        return ResponseEntity.ok(seatingConflictEvaluator.tableConflicts(floorPlanId, floorPlan.getClientId()));
    }

    @Operation(summary = "Seat a guest", description = "Moves the guest if already seated elsewhere on this floor plan.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Seated; conflicts are reported but do not block"),
            @ApiResponse(responseCode = "404", description = "Table or guest not found"),
            @ApiResponse(responseCode = "409", description = "Table is full")
    })
    @PostMapping("/assignments")
    public ResponseEntity<AssignGuestResponse> assignGuest(
            @PathVariable("floorPlanId") UUID floorPlanId,
            @Valid @RequestBody AssignGuestRequest request
    ) {
        floorPlanAccessPolicy.requireAccessibleFloorPlan(floorPlanId);
        return ResponseEntity.ok(seatAssignmentService.assign(floorPlanId, request));
    }

    @Operation(summary = "Unseat a guest", description = "No-op when the guest is not seated.")
    @DeleteMapping("/assignments/{guestId}")
    public ResponseEntity<Void> unassignGuest(
            @PathVariable("floorPlanId") UUID floorPlanId,
            @PathVariable("guestId") UUID guestId
    ) {
        floorPlanAccessPolicy.requireAccessibleFloorPlan(floorPlanId);
        seatAssignmentService.unassign(floorPlanId, guestId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/assignments")
    public ResponseEntity<List<AssignmentResponse>> listAssignments(@PathVariable("floorPlanId") UUID floorPlanId) {
        floorPlanAccessPolicy.requireAccessibleFloorPlan(floorPlanId);
        return ResponseEntity.ok(seatAssignmentService.listAssignments(floorPlanId));
    }

    @GetMapping("/unassigned-guests")
    public ResponseEntity<List<UnassignedGuestResponse>> unassignedGuests(@PathVariable("floorPlanId") UUID floorPlanId) {
        floorPlanAccessPolicy.requireAccessibleFloorPlan(floorPlanId);
        return ResponseEntity.ok(seatAssignmentService.unassignedGuests(floorPlanId));
    }

    @Operation(summary = "Seat many guests at once", description = "All or nothing; conflicts are not evaluated.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Applied"),
            @ApiResponse(responseCode = "400", description = "A guest appears twice"),
            @ApiResponse(responseCode = "404", description = "A table or guest does not exist"),
            @ApiResponse(responseCode = "409", description = "A table would exceed its capacity")
    })
    @PostMapping("/assignments/batch")
    public ResponseEntity<BatchAssignResponse> batchAssign(
            @PathVariable("floorPlanId") UUID floorPlanId,
            @Valid @RequestBody BatchAssignRequest request
    ) {
        floorPlanAccessPolicy.requireAccessibleFloorPlan(floorPlanId);
        return ResponseEntity.ok(batchAssignmentService.batchAssign(floorPlanId, request));
    }
}
