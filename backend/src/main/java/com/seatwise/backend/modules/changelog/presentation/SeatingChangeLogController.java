package com.seatwise.backend.modules.changelog.presentation;

import java.util.List;
import java.util.UUID;

import com.seatwise.backend.modules.changelog.application.ChangeLogResult;
import com.seatwise.backend.modules.changelog.application.SeatingChangeLogService;
import com.seatwise.backend.modules.changelog.application.SeatingChangeLogService.ChangeLogCommand;
import com.seatwise.backend.modules.changelog.presentation.dto.ChangeLogEntryResponse;
import com.seatwise.backend.modules.changelog.presentation.dto.RecordChangeRequest;
import com.seatwise.backend.modules.changelog.presentation.dto.RecordChangeResponse;
import com.seatwise.backend.modules.floorplan.application.FloorPlanAccessPolicy;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/floor-plans/{floorPlanId}/change-log")
public class SeatingChangeLogController {

    private final SeatingChangeLogService seatingChangeLogService;
    private final FloorPlanAccessPolicy floorPlanAccessPolicy;

    public SeatingChangeLogController(SeatingChangeLogService seatingChangeLogService, FloorPlanAccessPolicy floorPlanAccessPolicy) {
        this.seatingChangeLogService = seatingChangeLogService;
        this.floorPlanAccessPolicy = floorPlanAccessPolicy;
    }

    @Operation(summary = "Seating change history", description = "Newest first; limit defaults to 50.")
    @GetMapping
    public ResponseEntity<List<ChangeLogEntryResponse>> history(
            @PathVariable("floorPlanId") UUID floorPlanId,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        floorPlanAccessPolicy.requireAccessibleFloorPlan(floorPlanId);
        return ResponseEntity.ok(seatingChangeLogService.history(floorPlanId, limit));
    }

    @Operation(summary = "Record a client-side change", description = "Best effort; a failed write is reported, not raised.")
    @PostMapping
    public ResponseEntity<RecordChangeResponse> recordChange(
            @PathVariable("floorPlanId") UUID floorPlanId,
            @Valid @RequestBody RecordChangeRequest request
    ) {
        floorPlanAccessPolicy.requireAccessibleFloorPlan(floorPlanId);
        ChangeLogResult result = seatingChangeLogService.log(new ChangeLogCommand(
                floorPlanId,
                request.action(),
                request.guestId(),
                request.tableId(),
                request.previousState(),
                request.newState()
        ));
        return ResponseEntity.ok(RecordChangeResponse.from(result));
    }
}
