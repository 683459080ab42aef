package com.seatwise.backend.modules.seating.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.seatwise.backend.global.error.ProblemException;
import com.seatwise.backend.modules.changelog.application.SeatingChangeLogService;
import com.seatwise.backend.modules.changelog.application.SeatingChangeLogService.ChangeLogCommand;
import com.seatwise.backend.modules.changelog.domain.ChangeAction;
import com.seatwise.backend.modules.floorplan.domain.FloorPlan;
import com.seatwise.backend.modules.floorplan.domain.SeatingTable;
import com.seatwise.backend.modules.floorplan.infrastructure.FloorPlanRepository;
import com.seatwise.backend.modules.floorplan.infrastructure.SeatingTableRepository;
import com.seatwise.backend.modules.guest.domain.Guest;
import com.seatwise.backend.modules.guest.infrastructure.GuestRepository;
import com.seatwise.backend.modules.seating.domain.GuestAssignment;
import com.seatwise.backend.modules.seating.infrastructure.GuestAssignmentRepository;
import com.seatwise.backend.modules.seating.presentation.dto.AssignGuestRequest;
import com.seatwise.backend.modules.seating.presentation.dto.AssignGuestResponse;
import com.seatwise.backend.modules.seating.presentation.dto.ConflictCheckResponse;
import com.seatwise.backend.modules.seating.presentation.dto.SeatedGuest;
import com.seatwise.backend.support.SeatingObjects;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class SeatAssignmentServiceTest {

    private static final UUID CLIENT_ID = UUID.fromString("00000000-0000-0000-0000-0000000000c1");
    private static final UUID FLOOR_PLAN_ID = UUID.fromString("00000000-0000-0000-0000-0000000000f1");

    @Mock
    private GuestAssignmentRepository guestAssignmentRepository;

    @Mock
    private SeatingTableRepository seatingTableRepository;

    @Mock
    private FloorPlanRepository floorPlanRepository;

    @Mock
    private GuestRepository guestRepository;

    @Mock
    private SeatingConflictEvaluator seatingConflictEvaluator;

    @Mock
    private SeatingChangeLogService seatingChangeLogService;

    private SeatAssignmentService service;

    private FloorPlan floorPlan;
    private SeatingTable table;
    private Guest alice;

    @BeforeEach
    void setUp() {
        service = new SeatAssignmentService(
                guestAssignmentRepository,
                seatingTableRepository,
                floorPlanRepository,
                guestRepository,
                seatingConflictEvaluator,
                seatingChangeLogService
        );
        floorPlan = SeatingObjects.floorPlan(FLOOR_PLAN_ID, CLIENT_ID);
        table = SeatingObjects.table(floorPlan, UUID.randomUUID(), 3, 2);
        alice = new Guest(UUID.randomUUID(), CLIENT_ID, "Alice", "Kim");
    }

    private void stubTableAndGuest() {
        when(seatingTableRepository.findByIdForUpdate(table.getId())).thenReturn(Optional.of(table));
        when(guestRepository.findById(alice.getId())).thenReturn(Optional.of(alice));
    }

    private void stubSave() {
        when(guestAssignmentRepository.save(any(GuestAssignment.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    @DisplayName("seats a guest, replacing any previous table and logging ASSIGN")
    void assignMovesGuestAndLogs() {
        stubTableAndGuest();
        stubSave();
        UUID previousTableId = UUID.randomUUID();
        when(guestAssignmentRepository.countByTableIdAndGuestIdNot(table.getId(), alice.getId())).thenReturn(1L);
        when(seatingConflictEvaluator.evaluate(alice.getId(), table.getId())).thenReturn(ConflictCheckResponse.empty());
        when(guestAssignmentRepository.findByFloorPlanIdAndGuestId(FLOOR_PLAN_ID, alice.getId()))
                .thenReturn(Optional.of(SeatingObjects.assignment(FLOOR_PLAN_ID, previousTableId, alice.getId())));

        AssignGuestResponse response = service.assign(FLOOR_PLAN_ID,
                new AssignGuestRequest(table.getId(), alice.getId(), 2, false));

        assertThat(response.assignment().tableId()).isEqualTo(table.getId());
        assertThat(response.assignment().seatNumber()).isEqualTo(2);
        assertThat(response.hasConflicts()).isFalse();
        verify(guestAssignmentRepository).deleteByFloorPlanAndGuest(FLOOR_PLAN_ID, alice.getId());

        ArgumentCaptor<ChangeLogCommand> captor = ArgumentCaptor.forClass(ChangeLogCommand.class);
        verify(seatingChangeLogService).log(captor.capture());
        ChangeLogCommand command = captor.getValue();
        assertThat(command.action()).isEqualTo(ChangeAction.ASSIGN);
        assertThat(command.previousState()).containsEntry("tableId", previousTableId);
        assertThat(command.newState()).containsEntry("tableId", table.getId());
    }

    @Test
    @DisplayName("a full table rejects a new guest with 409 and writes nothing")
    void fullTableRejectsGuest() {
        stubTableAndGuest();
        when(guestAssignmentRepository.countByTableIdAndGuestIdNot(table.getId(), alice.getId())).thenReturn(2L);

        assertThatThrownBy(() -> service.assign(FLOOR_PLAN_ID,
                new AssignGuestRequest(table.getId(), alice.getId(), null, false)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo(SeatingProblems.TABLE_CAPACITY_EXCEEDED);
                    assertThat(ex.getDetailMessage()).isEqualTo("Table 3 is at full capacity (2 seats)");
                });

        verify(guestAssignmentRepository, never()).save(any());
        verify(guestAssignmentRepository, never()).deleteByFloorPlanAndGuest(any(), any());
        verifyNoInteractions(seatingChangeLogService);
    }

    @Test
    @DisplayName("re-seating a guest at the full table they already occupy is allowed")
    void reseatAtOwnFullTable() {
        stubTableAndGuest();
        stubSave();
        // the other occupant only; alice's own row is excluded from the count
        when(guestAssignmentRepository.countByTableIdAndGuestIdNot(table.getId(), alice.getId())).thenReturn(1L);
        when(guestAssignmentRepository.findByFloorPlanIdAndGuestId(FLOOR_PLAN_ID, alice.getId()))
                .thenReturn(Optional.of(SeatingObjects.assignment(FLOOR_PLAN_ID, table.getId(), alice.getId())));

        AssignGuestResponse response = service.assign(FLOOR_PLAN_ID,
                new AssignGuestRequest(table.getId(), alice.getId(), 1, true));

        assertThat(response.assignment().tableId()).isEqualTo(table.getId());
        verifyNoInteractions(seatingConflictEvaluator);
    }

    @Test
    @DisplayName("conflicts are advisory: the guest is seated and SEATING_CONFLICT is logged")
    void conflictsDoNotBlockAssignment() {
        stubTableAndGuest();
        stubSave();
        SeatedGuest bob = new SeatedGuest(UUID.randomUUID(), "Bob Lee");
        when(guestAssignmentRepository.countByTableIdAndGuestIdNot(table.getId(), alice.getId())).thenReturn(1L);
        when(seatingConflictEvaluator.evaluate(alice.getId(), table.getId()))
                .thenReturn(ConflictCheckResponse.of(List.of(bob), List.of()));
        when(guestAssignmentRepository.findByFloorPlanIdAndGuestId(FLOOR_PLAN_ID, alice.getId())).thenReturn(Optional.empty());

        AssignGuestResponse response = service.assign(FLOOR_PLAN_ID,
                new AssignGuestRequest(table.getId(), alice.getId(), null, false));

        assertThat(response.hasConflicts()).isTrue();
        assertThat(response.conflicts()).containsExactly(bob);

        ArgumentCaptor<ChangeLogCommand> captor = ArgumentCaptor.forClass(ChangeLogCommand.class);
        verify(seatingChangeLogService, times(2)).log(captor.capture());
        assertThat(captor.getAllValues())
                .extracting(ChangeLogCommand::action)
                .containsExactly(ChangeAction.SEATING_CONFLICT, ChangeAction.ASSIGN);
    }

    @Test
    void rejectsTableFromAnotherFloorPlan() {
        FloorPlan other = SeatingObjects.floorPlan(UUID.randomUUID(), CLIENT_ID);
        SeatingTable foreign = SeatingObjects.table(other, UUID.randomUUID(), 1, 8);
        when(seatingTableRepository.findByIdForUpdate(foreign.getId())).thenReturn(Optional.of(foreign));

        assertThatThrownBy(() -> service.assign(FLOOR_PLAN_ID,
                new AssignGuestRequest(foreign.getId(), alice.getId(), null, false)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("TABLE_NOT_FOUND"));
    }

    @Test
    @DisplayName("a guest from another client cannot be seated")
    void rejectsGuestOfAnotherClient() {
        Guest stranger = new Guest(UUID.randomUUID(), UUID.randomUUID(), "Eve", "Park");
        when(seatingTableRepository.findByIdForUpdate(table.getId())).thenReturn(Optional.of(table));
        when(guestRepository.findById(stranger.getId())).thenReturn(Optional.of(stranger));

        assertThatThrownBy(() -> service.assign(FLOOR_PLAN_ID,
                new AssignGuestRequest(table.getId(), stranger.getId(), null, false)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("GUEST_NOT_FOUND");
                });
    }

    @Test
    @DisplayName("unassigning a guest who is not seated is a silent no-op")
    void unassignIsIdempotent() {
        when(guestAssignmentRepository.findByFloorPlanIdAndGuestId(FLOOR_PLAN_ID, alice.getId())).thenReturn(Optional.empty());

        service.unassign(FLOOR_PLAN_ID, alice.getId());

        verify(guestAssignmentRepository, never()).deleteByFloorPlanAndGuest(any(), any());
        verifyNoInteractions(seatingChangeLogService);
    }

    @Test
    void unassignRemovesRowAndLogs() {
        when(guestAssignmentRepository.findByFloorPlanIdAndGuestId(FLOOR_PLAN_ID, alice.getId()))
                .thenReturn(Optional.of(SeatingObjects.assignment(FLOOR_PLAN_ID, table.getId(), alice.getId())));
        when(guestAssignmentRepository.deleteByFloorPlanAndGuest(FLOOR_PLAN_ID, alice.getId())).thenReturn(1);

        service.unassign(FLOOR_PLAN_ID, alice.getId());

        ArgumentCaptor<ChangeLogCommand> captor = ArgumentCaptor.forClass(ChangeLogCommand.class);
        verify(seatingChangeLogService).log(captor.capture());
        assertThat(captor.getValue().action()).isEqualTo(ChangeAction.UNASSIGN);
        assertThat(captor.getValue().tableId()).isEqualTo(table.getId());
    }
}
