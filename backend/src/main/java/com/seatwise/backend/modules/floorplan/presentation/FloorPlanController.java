package com.seatwise.backend.modules.floorplan.presentation;

import java.util.List;
import java.util.UUID;

import com.seatwise.backend.modules.client.application.ClientAccessPolicy;
import com.seatwise.backend.modules.floorplan.application.FloorPlanAccessPolicy;
import com.seatwise.backend.modules.floorplan.application.FloorPlanService;
import com.seatwise.backend.modules.floorplan.presentation.dto.CreateFloorPlanRequest;
import com.seatwise.backend.modules.floorplan.presentation.dto.FloorPlanDetailResponse;
import com.seatwise.backend.modules.floorplan.presentation.dto.FloorPlanResponse;
import com.seatwise.backend.modules.floorplan.presentation.dto.UpdateFloorPlanRequest;

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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/floor-plans")
public class FloorPlanController {

    private final FloorPlanService floorPlanService;
    private final FloorPlanAccessPolicy floorPlanAccessPolicy;
    private final ClientAccessPolicy clientAccessPolicy;

    public FloorPlanController(
            FloorPlanService floorPlanService,
            FloorPlanAccessPolicy floorPlanAccessPolicy,
            ClientAccessPolicy clientAccessPolicy
    ) {
        this.floorPlanService = floorPlanService;
        this.floorPlanAccessPolicy = floorPlanAccessPolicy;
        this.clientAccessPolicy = clientAccessPolicy;
    }

    @Operation(summary = "List floor plans of a client", description = "Newest first.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Listed"),
            @ApiResponse(responseCode = "403", description = "Client belongs to another company"),
            @ApiResponse(responseCode = "404", description = "Client not found")
    })
    @GetMapping
    public ResponseEntity<List<FloorPlanResponse>> listFloorPlans(@RequestParam("clientId") UUID clientId) {
        clientAccessPolicy.requireAccessibleClient(clientId);
        return ResponseEntity.ok(floorPlanService.listByClient(clientId));
    }

    @Operation(summary = "Create a floor plan")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "403", description = "Admin role or client access required"),
            @ApiResponse(responseCode = "422", description = "Canvas size out of range")
    })
    @PostMapping
    public ResponseEntity<FloorPlanResponse> createFloorPlan(@Valid @RequestBody CreateFloorPlanRequest request) {
        clientAccessPolicy.requireAccessibleClient(request.clientId());
        FloorPlanResponse response = floorPlanService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Get a floor plan", description = "Includes tables, assignments and the conflicts seated at each table.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "403", description = "Floor plan belongs to another company"),
            @ApiResponse(responseCode = "404", description = "Floor plan not found")
    })
    @GetMapping("/{floorPlanId}")
    public ResponseEntity<FloorPlanDetailResponse> getFloorPlan(@PathVariable("floorPlanId") UUID floorPlanId) {
        floorPlanAccessPolicy.requireAccessibleFloorPlan(floorPlanId);
        return ResponseEntity.ok(floorPlanService.getDetail(floorPlanId));
    }

    @Operation(summary = "Update floor plan settings", description = "Only the supplied fields change.")
    @PatchMapping("/{floorPlanId}")
    public ResponseEntity<FloorPlanResponse> updateFloorPlan(
            @PathVariable("floorPlanId") UUID floorPlanId,
            @Valid @RequestBody UpdateFloorPlanRequest request
    ) {
        floorPlanAccessPolicy.requireAccessibleFloorPlan(floorPlanId);
        return ResponseEntity.ok(floorPlanService.update(floorPlanId, request));
    }

    @Operation(summary = "Delete a floor plan", description = "Tables, assignments and versions are removed with it.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Deleted"),
            @ApiResponse(responseCode = "404", description = "Floor plan not found")
    })
    @DeleteMapping("/{floorPlanId}")
    public ResponseEntity<Void> deleteFloorPlan(@PathVariable("floorPlanId") UUID floorPlanId) {
        floorPlanAccessPolicy.requireAccessibleFloorPlan(floorPlanId);
        floorPlanService.delete(floorPlanId);
        return ResponseEntity.noContent().build();
    }
}
