package com.seatwise.backend.modules.floorplan.presentation;

import java.util.List;
import java.util.UUID;

import com.seatwise.backend.modules.floorplan.application.FloorPlanAccessPolicy;
import com.seatwise.backend.modules.floorplan.application.SeatingTableService;
import com.seatwise.backend.modules.floorplan.presentation.dto.AddTableRequest;
import com.seatwise.backend.modules.floorplan.presentation.dto.SeatingTableResponse;
import com.seatwise.backend.modules.floorplan.presentation.dto.UpdateTableRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/floor-plans/{floorPlanId}/tables")
public class SeatingTableController {

    private final SeatingTableService seatingTableService;
    private final FloorPlanAccessPolicy floorPlanAccessPolicy;

    public SeatingTableController(SeatingTableService seatingTableService, FloorPlanAccessPolicy floorPlanAccessPolicy) {
        this.seatingTableService = seatingTableService;
        this.floorPlanAccessPolicy = floorPlanAccessPolicy;
    }

    @GetMapping
    public ResponseEntity<List<SeatingTableResponse>> listTables(@PathVariable("floorPlanId") UUID floorPlanId) {
        floorPlanAccessPolicy.requireAccessibleFloorPlan(floorPlanId);
        return ResponseEntity.ok(seatingTableService.listTables(floorPlanId));
    }

    @Operation(summary = "Add a table")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "422", description = "Capacity outside 1..20 or malformed colour")
    })
    @PostMapping
    public ResponseEntity<SeatingTableResponse> addTable(
            @PathVariable("floorPlanId") UUID floorPlanId,
            @Valid @RequestBody AddTableRequest request
    ) {
        floorPlanAccessPolicy.requireAccessibleFloorPlan(floorPlanId);
        SeatingTableResponse response = seatingTableService.addTable(floorPlanId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Move, resize or reconfigure a table")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated"),
            @ApiResponse(responseCode = "404", description = "Table not on this floor plan"),
            @ApiResponse(responseCode = "409", description = "Capacity below current occupancy")
    })
    @PatchMapping("/{tableId}")
    public ResponseEntity<SeatingTableResponse> updateTable(
            @PathVariable("floorPlanId") UUID floorPlanId,
            @PathVariable("tableId") UUID tableId,
            @Valid @RequestBody UpdateTableRequest request
    ) {
        floorPlanAccessPolicy.requireAccessibleFloorPlan(floorPlanId);
        return ResponseEntity.ok(seatingTableService.updateTable(floorPlanId, tableId, request));
    }

    @Operation(summary = "Delete a table", description = "Guests seated at the table become unassigned.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Deleted"),
            @ApiResponse(responseCode = "404", description = "Table not on this floor plan")
    })
    @DeleteMapping("/{tableId}")
    public ResponseEntity<Void> deleteTable(
            @PathVariable("floorPlanId") UUID floorPlanId,
            @PathVariable("tableId") UUID tableId
    ) {
        floorPlanAccessPolicy.requireAccessibleFloorPlan(floorPlanId);
        seatingTableService.deleteTable(floorPlanId, tableId);
        return ResponseEntity.noContent().build();
    }
}
