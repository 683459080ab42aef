package com.seatwise.backend.support;

import java.util.UUID;

import com.seatwise.backend.modules.client.domain.Client;
import com.seatwise.backend.modules.floorplan.domain.FloorPlan;
import com.seatwise.backend.modules.floorplan.domain.SeatingTable;
import com.seatwise.backend.modules.seating.domain.GuestAssignment;

/**
 * Detached domain objects with ids for Mockito-based service tests.
 */
public final class SeatingObjects {

    private SeatingObjects() {
    }

    public static FloorPlan floorPlan(UUID floorPlanId, UUID clientId) {
        FloorPlan floorPlan = TestEntities.withId(new FloorPlan(), floorPlanId);
        floorPlan.setClient(new Client(clientId, UUID.randomUUID(), "Kim & Lee Wedding"));
        floorPlan.setName("Main hall");
        return floorPlan;
    }

    public static SeatingTable table(FloorPlan floorPlan, UUID tableId, int tableNumber, int capacity) {
        SeatingTable table = TestEntities.withId(new SeatingTable(), tableId);
        table.setFloorPlan(floorPlan);
        table.setTableNumber(tableNumber);
        table.setCapacity(capacity);
        table.moveTo(tableNumber * 150, 100);
        return table;
    }

    public static GuestAssignment assignment(UUID floorPlanId, UUID tableId, UUID guestId) {
        return TestEntities.withId(new GuestAssignment(floorPlanId, tableId, guestId, null), UUID.randomUUID());
    }
}
