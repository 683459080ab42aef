package com.seatwise.backend.modules.seating.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.seatwise.backend.modules.floorplan.domain.FloorPlan;
import com.seatwise.backend.modules.floorplan.domain.SeatingTable;
import com.seatwise.backend.modules.floorplan.infrastructure.SeatingTableRepository;
import com.seatwise.backend.modules.guest.application.GuestRelationshipService;
import com.seatwise.backend.modules.guest.domain.Guest;
import com.seatwise.backend.modules.guest.domain.GuestConflict;
import com.seatwise.backend.modules.guest.domain.GuestPair;
import com.seatwise.backend.modules.guest.infrastructure.GuestConflictRepository;
import com.seatwise.backend.modules.guest.infrastructure.GuestRepository;
import com.seatwise.backend.modules.seating.infrastructure.GuestAssignmentRepository;
import com.seatwise.backend.modules.seating.presentation.dto.ConflictCheckResponse;
import com.seatwise.backend.modules.seating.presentation.dto.SeatedGuest;
import com.seatwise.backend.support.SeatingObjects;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SeatingConflictEvaluatorTest {

    private static final UUID CLIENT_ID = UUID.fromString("00000000-0000-0000-0000-0000000000c1");
    private static final UUID FLOOR_PLAN_ID = UUID.fromString("00000000-0000-0000-0000-0000000000f1");
    private static final UUID TABLE_ID = UUID.fromString("00000000-0000-0000-0000-0000000000d1");

    @Mock
    private GuestRepository guestRepository;

    @Mock
    private GuestRelationshipService guestRelationshipService;

    @Mock
    private GuestConflictRepository guestConflictRepository;

    @Mock
    private GuestAssignmentRepository guestAssignmentRepository;

    @Mock
    private SeatingTableRepository seatingTableRepository;

    private SeatingConflictEvaluator evaluator;

    private final Guest g1 = new Guest(UUID.fromString("10000000-0000-0000-0000-000000000001"), CLIENT_ID, "Grace", "Han");
    private final Guest g2 = new Guest(UUID.fromString("20000000-0000-0000-0000-000000000002"), CLIENT_ID, "Minho", "Choi");
    private final Guest g3 = new Guest(UUID.fromString("30000000-0000-0000-0000-000000000003"), CLIENT_ID, "Sora", "Yoon");

    @BeforeEach
    void setUp() {
        evaluator = new SeatingConflictEvaluator(
                guestRepository,
                guestRelationshipService,
                guestConflictRepository,
                guestAssignmentRepository,
                seatingTableRepository
        );
    }

    @Test
    @DisplayName("a conflicting occupant is reported for the guest being evaluated")
    void reportsConflictingOccupant() {
        when(guestRepository.existsById(g2.getId())).thenReturn(true);
        when(guestRelationshipService.conflictPartnersOf(g2.getId())).thenReturn(Set.of(g1.getId()));
        when(guestRelationshipService.preferencePartnersOf(g2.getId())).thenReturn(Set.of(g3.getId()));
        when(guestAssignmentRepository.findOccupantsExcluding(TABLE_ID, g2.getId())).thenReturn(List.of(g1, g3));

        ConflictCheckResponse result = evaluator.evaluate(g2.getId(), TABLE_ID);

        assertThat(result.hasConflicts()).isTrue();
        assertThat(result.conflicts()).containsExactly(new SeatedGuest(g1.getId(), "Grace Han"));
        assertThat(result.hasPreferences()).isTrue();
        assertThat(result.preferences()).extracting(SeatedGuest::guestId).containsExactly(g3.getId());
    }

    @Test
    void unknownGuestYieldsEmptyResult() {
        when(guestRepository.existsById(g2.getId())).thenReturn(false);

        ConflictCheckResponse result = evaluator.evaluate(g2.getId(), TABLE_ID);

        assertThat(result).isEqualTo(ConflictCheckResponse.empty());
        verifyNoInteractions(guestRelationshipService, guestAssignmentRepository);
    }

    @Test
    void guestWithoutEdgesSkipsOccupantLookup() {
        when(guestRepository.existsById(g2.getId())).thenReturn(true);
        when(guestRelationshipService.conflictPartnersOf(g2.getId())).thenReturn(Set.of());
        when(guestRelationshipService.preferencePartnersOf(g2.getId())).thenReturn(Set.of());

        assertThat(evaluator.evaluate(g2.getId(), TABLE_ID).hasConflicts()).isFalse();
        verifyNoInteractions(guestAssignmentRepository);
    }

    @Test
    @DisplayName("table conflicts list only pairs seated at the same table")
    void tableConflictsGroupsPairsByTable() {
        UUID otherTable = UUID.randomUUID();
        when(guestAssignmentRepository.findByFloorPlanId(FLOOR_PLAN_ID)).thenReturn(List.of(
                SeatingObjects.assignment(FLOOR_PLAN_ID, TABLE_ID, g1.getId()),
                SeatingObjects.assignment(FLOOR_PLAN_ID, TABLE_ID, g2.getId()),
                SeatingObjects.assignment(FLOOR_PLAN_ID, otherTable, g3.getId())
        ));
        GuestConflict together = new GuestConflict();
        together.setPair(GuestPair.of(g2.getId(), g1.getId()));
        GuestConflict apart = new GuestConflict();
        apart.setPair(GuestPair.of(g1.getId(), g3.getId()));
        when(guestConflictRepository.findByClientIdAndActiveTrue(CLIENT_ID)).thenReturn(List.of(together, apart));

        Map<UUID, List<String>> conflicts = evaluator.tableConflicts(FLOOR_PLAN_ID, CLIENT_ID);

        assertThat(conflicts).containsOnlyKeys(TABLE_ID);
        assertThat(conflicts.get(TABLE_ID)).containsExactly(g1.getId() + "-" + g2.getId());
    }

    @Test
    @DisplayName("a guest of another client yields nothing even at a table of this floor plan")
    void guestOfAnotherClientYieldsEmptyResult() {
        FloorPlan floorPlan = SeatingObjects.floorPlan(FLOOR_PLAN_ID, CLIENT_ID);
        SeatingTable table = SeatingObjects.table(floorPlan, TABLE_ID, 1, 8);
        Guest outsider = new Guest(UUID.randomUUID(), UUID.randomUUID(), "Jisoo", "Park");
        when(seatingTableRepository.findById(TABLE_ID)).thenReturn(Optional.of(table));
        when(guestRepository.findById(outsider.getId())).thenReturn(Optional.of(outsider));

        ConflictCheckResponse result = evaluator.evaluateOnFloorPlan(floorPlan, outsider.getId(), TABLE_ID);

        assertThat(result).isEqualTo(ConflictCheckResponse.empty());
        verifyNoInteractions(guestRelationshipService, guestAssignmentRepository);
    }

    @Test
    void tableOfAnotherFloorPlanYieldsEmptyResult() {
        FloorPlan floorPlan = SeatingObjects.floorPlan(FLOOR_PLAN_ID, CLIENT_ID);
        FloorPlan elsewhere = SeatingObjects.floorPlan(UUID.randomUUID(), UUID.randomUUID());
        UUID foreignTableId = UUID.randomUUID();
        SeatingTable foreignTable = SeatingObjects.table(elsewhere, foreignTableId, 1, 8);
        when(seatingTableRepository.findById(foreignTableId)).thenReturn(Optional.of(foreignTable));
        when(guestRepository.findById(g2.getId())).thenReturn(Optional.of(g2));

        ConflictCheckResponse result = evaluator.evaluateOnFloorPlan(floorPlan, g2.getId(), foreignTableId);

        assertThat(result).isEqualTo(ConflictCheckResponse.empty());
        verifyNoInteractions(guestRelationshipService, guestAssignmentRepository);
    }

    @Test
    void ownGuestAndTableAreEvaluated() {
        FloorPlan floorPlan = SeatingObjects.floorPlan(FLOOR_PLAN_ID, CLIENT_ID);
        SeatingTable table = SeatingObjects.table(floorPlan, TABLE_ID, 1, 8);
        when(seatingTableRepository.findById(TABLE_ID)).thenReturn(Optional.of(table));
        when(guestRepository.findById(g2.getId())).thenReturn(Optional.of(g2));
        when(guestRepository.existsById(g2.getId())).thenReturn(true);
        when(guestRelationshipService.conflictPartnersOf(g2.getId())).thenReturn(Set.of(g1.getId()));
        when(guestRelationshipService.preferencePartnersOf(g2.getId())).thenReturn(Set.of());
        when(guestAssignmentRepository.findOccupantsExcluding(TABLE_ID, g2.getId())).thenReturn(List.of(g1));

        ConflictCheckResponse result = evaluator.evaluateOnFloorPlan(floorPlan, g2.getId(), TABLE_ID);

        assertThat(result.conflicts()).extracting(SeatedGuest::guestId).containsExactly(g1.getId());
    }
}
