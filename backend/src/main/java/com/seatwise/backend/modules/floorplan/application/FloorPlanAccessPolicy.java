package com.seatwise.backend.modules.floorplan.application;

import java.util.UUID;

import com.seatwise.backend.global.error.ProblemException;
import com.seatwise.backend.global.security.SecurityUtils;
import com.seatwise.backend.modules.floorplan.domain.FloorPlan;
import com.seatwise.backend.modules.floorplan.infrastructure.FloorPlanRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Verifies that the caller's company owns the floor plan's client before any seating operation runs.
 */
@Component
public class FloorPlanAccessPolicy {

    private final FloorPlanRepository floorPlanRepository;

    public FloorPlanAccessPolicy(FloorPlanRepository floorPlanRepository) {
        this.floorPlanRepository = floorPlanRepository;
    }

    @Transactional(readOnly = true)
    public FloorPlan requireAccessibleFloorPlan(UUID floorPlanId) {
        FloorPlan floorPlan = floorPlanRepository.findWithClientById(floorPlanId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "FLOOR_PLAN_NOT_FOUND",
                        "Floor plan " + floorPlanId + " not found"));
        if (!floorPlan.getClient().belongsTo(SecurityUtils.getCurrentCompanyId())) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "FLOOR_PLAN_ACCESS_DENIED",
                    "Floor plan does not belong to your company");
        }
        return floorPlan;
    }
}
