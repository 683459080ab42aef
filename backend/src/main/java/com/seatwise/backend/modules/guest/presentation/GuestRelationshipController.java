package com.seatwise.backend.modules.guest.presentation;

import java.util.List;
import java.util.UUID;

import com.seatwise.backend.modules.client.application.ClientAccessPolicy;
import com.seatwise.backend.modules.guest.application.GuestRelationshipService;
import com.seatwise.backend.modules.guest.presentation.dto.GuestConflictRequest;
import com.seatwise.backend.modules.guest.presentation.dto.GuestConflictResponse;
import com.seatwise.backend.modules.guest.presentation.dto.GuestPreferenceRequest;
import com.seatwise.backend.modules.guest.presentation.dto.GuestPreferenceResponse;

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
@RequestMapping("/clients/{clientId}")
public class GuestRelationshipController {

    private final GuestRelationshipService guestRelationshipService;
    private final ClientAccessPolicy clientAccessPolicy;

    public GuestRelationshipController(
            GuestRelationshipService guestRelationshipService,
            ClientAccessPolicy clientAccessPolicy
    ) {
        this.guestRelationshipService = guestRelationshipService;
        this.clientAccessPolicy = clientAccessPolicy;
    }

    @Operation(summary = "List active guest conflicts", description = "Pairs of guests who should not share a table.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Listed"),
            @ApiResponse(responseCode = "403", description = "Client belongs to another company"),
            @ApiResponse(responseCode = "404", description = "Client not found")
    })
    @GetMapping("/guest-conflicts")
    public ResponseEntity<List<GuestConflictResponse>> listConflicts(@PathVariable("clientId") UUID clientId) {
        clientAccessPolicy.requireAccessibleClient(clientId);
        return ResponseEntity.ok(guestRelationshipService.getConflicts(clientId));
    }

    @Operation(summary = "Add or reactivate a guest conflict")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Conflict stored"),
            @ApiResponse(responseCode = "400", description = "Both ids name the same guest"),
            @ApiResponse(responseCode = "404", description = "Client or guest not found")
    })
    @PostMapping("/guest-conflicts")
    public ResponseEntity<GuestConflictResponse> addConflict(
            @PathVariable("clientId") UUID clientId,
            @Valid @RequestBody GuestConflictRequest request
    ) {
        clientAccessPolicy.requireAccessibleClient(clientId);
        GuestConflictResponse response = guestRelationshipService.addConflict(clientId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Remove a guest conflict")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Deactivated"),
            @ApiResponse(responseCode = "404", description = "Conflict not found")
    })
    @DeleteMapping("/guest-conflicts/{conflictId}")
    public ResponseEntity<Void> removeConflict(
            @PathVariable("clientId") UUID clientId,
            @PathVariable("conflictId") UUID conflictId
    ) {
        clientAccessPolicy.requireAccessibleClient(clientId);
        guestRelationshipService.removeConflict(clientId, conflictId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "List active guest preferences", description = "Pairs of guests who would like to sit near each other.")
    @GetMapping("/guest-preferences")
    public ResponseEntity<List<GuestPreferenceResponse>> listPreferences(@PathVariable("clientId") UUID clientId) {
        clientAccessPolicy.requireAccessibleClient(clientId);
        return ResponseEntity.ok(guestRelationshipService.getPreferences(clientId));
    }

    @Operation(summary = "Add or reactivate a guest preference")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Preference stored"),
            @ApiResponse(responseCode = "400", description = "Both ids name the same guest"),
            @ApiResponse(responseCode = "404", description = "Client or guest not found")
    })
    @PostMapping("/guest-preferences")
    public ResponseEntity<GuestPreferenceResponse> addPreference(
            @PathVariable("clientId") UUID clientId,
            @Valid @RequestBody GuestPreferenceRequest request
    ) {
        clientAccessPolicy.requireAccessibleClient(clientId);
        GuestPreferenceResponse response = guestRelationshipService.addPreference(clientId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @DeleteMapping("/guest-preferences/{preferenceId}")
    public ResponseEntity<Void> removePreference(
            @PathVariable("clientId") UUID clientId,
            @PathVariable("preferenceId") UUID preferenceId
    ) {
        clientAccessPolicy.requireAccessibleClient(clientId);
        guestRelationshipService.removePreference(clientId, preferenceId);
        return ResponseEntity.noContent().build();
    }
}
