package com.seatwise.backend.modules.version.presentation;

import java.util.List;
import java.util.UUID;

import com.seatwise.backend.modules.floorplan.application.FloorPlanAccessPolicy;
import com.seatwise.backend.modules.version.application.SeatingVersionService;
import com.seatwise.backend.modules.version.presentation.dto.RestoreVersionResponse;
import com.seatwise.backend.modules.version.presentation.dto.SaveVersionRequest;
import com.seatwise.backend.modules.version.presentation.dto.VersionDetailResponse;
import com.seatwise.backend.modules.version.presentation.dto.VersionSummaryResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/floor-plans/{floorPlanId}/versions")
public class SeatingVersionController {

    private final SeatingVersionService seatingVersionService;
    private final FloorPlanAccessPolicy floorPlanAccessPolicy;

    public SeatingVersionController(SeatingVersionService seatingVersionService, FloorPlanAccessPolicy floorPlanAccessPolicy) {
        this.seatingVersionService = seatingVersionService;
        this.floorPlanAccessPolicy = floorPlanAccessPolicy;
    }

    @Operation(summary = "List saved versions", description = "Highest version number first.")
    @GetMapping
    public ResponseEntity<List<VersionSummaryResponse>> listVersions(@PathVariable("floorPlanId") UUID floorPlanId) {
        floorPlanAccessPolicy.requireAccessibleFloorPlan(floorPlanId);
        return ResponseEntity.ok(seatingVersionService.listVersions(floorPlanId));
    }

    @Operation(summary = "Save the current layout as a version", description = "The new version becomes current.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Saved"),
            @ApiResponse(responseCode = "404", description = "Floor plan not found")
    })
    @PostMapping
    public ResponseEntity<VersionSummaryResponse> saveVersion(
            @PathVariable("floorPlanId") UUID floorPlanId,
            @Valid @RequestBody SaveVersionRequest request
    ) {
        floorPlanAccessPolicy.requireAccessibleFloorPlan(floorPlanId);
        VersionSummaryResponse response = seatingVersionService.saveVersion(floorPlanId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{versionId}")
    public ResponseEntity<VersionDetailResponse> getVersion(
            @PathVariable("floorPlanId") UUID floorPlanId,
            @PathVariable("versionId") UUID versionId
    ) {
        floorPlanAccessPolicy.requireAccessibleFloorPlan(floorPlanId);
        return ResponseEntity.ok(seatingVersionService.getVersion(floorPlanId, versionId));
    }

    @Operation(summary = "Restore a version", description = "Replaces all assignments and table positions with the snapshot.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Restored"),
            @ApiResponse(responseCode = "404", description = "Version not found on this floor plan"),
            @ApiResponse(responseCode = "409", description = "Snapshot no longer fits a table's capacity")
    })
    @PostMapping("/{versionId}/restore")
    public ResponseEntity<RestoreVersionResponse> restoreVersion(
            @PathVariable("floorPlanId") UUID floorPlanId,
            @PathVariable("versionId") UUID versionId
    ) {
        floorPlanAccessPolicy.requireAccessibleFloorPlan(floorPlanId);
        return ResponseEntity.ok(seatingVersionService.restoreVersion(floorPlanId, versionId));
    }

    @DeleteMapping("/{versionId}")
    public ResponseEntity<Void> deleteVersion(
            @PathVariable("floorPlanId") UUID floorPlanId,
            @PathVariable("versionId") UUID versionId
    ) {
        floorPlanAccessPolicy.requireAccessibleFloorPlan(floorPlanId);
        seatingVersionService.deleteVersion(floorPlanId, versionId);
        return ResponseEntity.noContent().build();
    }
}
