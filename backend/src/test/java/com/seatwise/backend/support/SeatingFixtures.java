package com.seatwise.backend.support;

import java.util.UUID;

import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Inserts roster rows (clients, guests) and seating rows directly, bypassing the API.
 */
public final class SeatingFixtures {

    private final JdbcTemplate jdbcTemplate;

    public SeatingFixtures(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public UUID client(UUID companyId, String name) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update("INSERT INTO client (id, company_id, name) VALUES (?, ?, ?)", id, companyId, name);
        return id;
    }

    public UUID guest(UUID clientId, String firstName, String lastName) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update("INSERT INTO guest (id, client_id, first_name, last_name) VALUES (?, ?, ?, ?)",
                id, clientId, firstName, lastName);
        return id;
    }

    public UUID floorPlan(UUID clientId, String name) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update("""
                INSERT INTO floor_plan (id, client_id, name, created_at, updated_at)
                VALUES (?, ?, ?, now(), now())
                """, id, clientId, name);
        return id;
    }

    public UUID table(UUID floorPlanId, int tableNumber, int capacity) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update("""
                INSERT INTO seating_table (id, floor_plan_id, table_number, shape, x, y, capacity, created_at, updated_at)
                VALUES (?, ?, ?, 'ROUND', ?, ?, ?, now(), now())
                """, id, floorPlanId, tableNumber, tableNumber * 150, 100, capacity);
        return id;
    }

    public void seat(UUID floorPlanId, UUID tableId, UUID guestId) {
        jdbcTemplate.update("""
                INSERT INTO guest_assignment (id, floor_plan_id, table_id, guest_id, created_at, updated_at)
                VALUES (?, ?, ?, ?, now(), now())
                """, UUID.randomUUID(), floorPlanId, tableId, guestId);
    }

    public int assignmentCount(UUID floorPlanId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM guest_assignment WHERE floor_plan_id = ?", Integer.class, floorPlanId);
        return count != null ? count : 0;
    }

    public UUID tableOf(UUID floorPlanId, UUID guestId) {
        return jdbcTemplate.query(
                "SELECT table_id FROM guest_assignment WHERE floor_plan_id = ? AND guest_id = ?",
                rs -> rs.next() ? rs.getObject(1, UUID.class) : null,
                floorPlanId, guestId);
    }
}
