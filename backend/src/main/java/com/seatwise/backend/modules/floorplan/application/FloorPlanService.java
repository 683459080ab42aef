package com.seatwise.backend.modules.floorplan.application;

import java.util.List;
import java.util.UUID;

import com.seatwise.backend.modules.client.infrastructure.ClientRepository;
import com.seatwise.backend.modules.floorplan.domain.FloorPlan;
import com.seatwise.backend.modules.floorplan.infrastructure.FloorPlanRepository;
import com.seatwise.backend.modules.floorplan.infrastructure.SeatingTableRepository;
import com.seatwise.backend.modules.floorplan.presentation.dto.CreateFloorPlanRequest;
import com.seatwise.backend.modules.floorplan.presentation.dto.FloorPlanDetailResponse;
import com.seatwise.backend.modules.floorplan.presentation.dto.FloorPlanResponse;
import com.seatwise.backend.modules.floorplan.presentation.dto.SeatingTableResponse;
import com.seatwise.backend.modules.floorplan.presentation.dto.UpdateFloorPlanRequest;
import com.seatwise.backend.modules.seating.application.SeatingConflictEvaluator;
import com.seatwise.backend.modules.seating.application.SeatingProblems;
import com.seatwise.backend.modules.seating.infrastructure.GuestAssignmentRepository;
import com.seatwise.backend.modules.seating.presentation.dto.AssignmentResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class FloorPlanService {

    private static final Logger log = LoggerFactory.getLogger(FloorPlanService.class);

    private final FloorPlanRepository floorPlanRepository;
    private final ClientRepository clientRepository;
    private final SeatingTableRepository seatingTableRepository;
    private final GuestAssignmentRepository guestAssignmentRepository;
    private final SeatingConflictEvaluator seatingConflictEvaluator;

    public FloorPlanService(
            FloorPlanRepository floorPlanRepository,
            ClientRepository clientRepository,
            SeatingTableRepository seatingTableRepository,
            GuestAssignmentRepository guestAssignmentRepository,
            SeatingConflictEvaluator seatingConflictEvaluator
    ) {
        this.floorPlanRepository = floorPlanRepository;
        this.clientRepository = clientRepository;
        this.seatingTableRepository = seatingTableRepository;
        this.guestAssignmentRepository = guestAssignmentRepository;
        this.seatingConflictEvaluator = seatingConflictEvaluator;
    }

    @Transactional(readOnly = true)
    public List<FloorPlanResponse> listByClient(UUID clientId) {
        return floorPlanRepository.findByClient_IdOrderByCreatedAtDesc(clientId).stream()
                .map(FloorPlanResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public FloorPlanDetailResponse getDetail(UUID floorPlanId) {
        FloorPlan floorPlan = loadFloorPlan(floorPlanId);
        List<SeatingTableResponse> tables = seatingTableRepository.findByFloorPlan_IdOrderByTableNumberAsc(floorPlanId)
                .stream()
                .map(SeatingTableResponse::from)
                .toList();
        List<AssignmentResponse> assignments = guestAssignmentRepository.findByFloorPlanId(floorPlanId).stream()
                .map(AssignmentResponse::from)
                .toList();
        return new FloorPlanDetailResponse(
                FloorPlanResponse.from(floorPlan),
                tables,
                assignments,
                seatingConflictEvaluator.tableConflicts(floorPlanId, floorPlan.getClientId())
        );
    }

    public FloorPlanResponse create(CreateFloorPlanRequest request) {
        FloorPlan floorPlan = new FloorPlan();
        floorPlan.setClient(clientRepository.getReferenceById(request.clientId()));
        floorPlan.setName(request.name().trim());
        floorPlan.setVenueName(trimToNull(request.venueName()));
        floorPlan.setEventDate(request.eventDate());
        floorPlan.setCanvasWidth(request.canvasWidth() != null ? request.canvasWidth() : FloorPlan.DEFAULT_CANVAS_WIDTH);
        floorPlan.setCanvasHeight(request.canvasHeight() != null ? request.canvasHeight() : FloorPlan.DEFAULT_CANVAS_HEIGHT);
        if (request.displaySettings() != null) {
            request.displaySettings().applyTo(floorPlan.getDisplaySettings());
        }
        FloorPlan saved = floorPlanRepository.save(floorPlan);
        log.info("Created floor plan {} for client {}", saved.getId(), request.clientId());
        return FloorPlanResponse.from(saved);
    }

    public FloorPlanResponse update(UUID floorPlanId, UpdateFloorPlanRequest request) {
        FloorPlan floorPlan = loadFloorPlan(floorPlanId);
        if (request.name() != null && !request.name().isBlank()) {
            floorPlan.setName(request.name().trim());
        }
        if (request.venueName() != null) {
            floorPlan.setVenueName(trimToNull(request.venueName()));
        }
        if (request.eventDate() != null) {
            floorPlan.setEventDate(request.eventDate());
        }
        if (request.backgroundImageUrl() != null) {
            floorPlan.setBackgroundImageUrl(request.backgroundImageUrl());
        }
        if (request.canvasWidth() != null) {
            floorPlan.setCanvasWidth(request.canvasWidth());
        }
        if (request.canvasHeight() != null) {
            floorPlan.setCanvasHeight(request.canvasHeight());
        }
        if (request.displaySettings() != null) {
            request.displaySettings().applyTo(floorPlan.getDisplaySettings());
        }
        return FloorPlanResponse.from(floorPlan);
    }

    /**
     * Removes the floor plan with its tables, assignments and versions. Change-log rows are kept.
     */
    public void delete(UUID floorPlanId) {
        FloorPlan floorPlan = loadFloorPlan(floorPlanId);
        floorPlanRepository.delete(floorPlan);
        log.info("Deleted floor plan {}", floorPlanId);
    }

    private FloorPlan loadFloorPlan(UUID floorPlanId) {
        return floorPlanRepository.findById(floorPlanId)
                .orElseThrow(() -> SeatingProblems.floorPlanNotFound(floorPlanId));
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
