package com.seatwise.backend.modules.floorplan.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
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
import com.seatwise.backend.modules.floorplan.domain.TableShape;
import com.seatwise.backend.modules.floorplan.domain.TableStyle;
import com.seatwise.backend.modules.floorplan.infrastructure.FloorPlanRepository;
import com.seatwise.backend.modules.floorplan.infrastructure.SeatingTableRepository;
import com.seatwise.backend.modules.floorplan.presentation.dto.AddTableRequest;
import com.seatwise.backend.modules.floorplan.presentation.dto.SeatingTableResponse;
import com.seatwise.backend.modules.floorplan.presentation.dto.UpdateTableRequest;
import com.seatwise.backend.modules.seating.infrastructure.GuestAssignmentRepository;
import com.seatwise.backend.support.SeatingObjects;
import com.seatwise.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class SeatingTableServiceTest {

    private static final UUID CLIENT_ID = UUID.fromString("00000000-0000-0000-0000-0000000000c1");
    private static final UUID FLOOR_PLAN_ID = UUID.fromString("00000000-0000-0000-0000-0000000000f1");

    @Mock
    private SeatingTableRepository seatingTableRepository;

    @Mock
    private FloorPlanRepository floorPlanRepository;

    @Mock
    private GuestAssignmentRepository guestAssignmentRepository;

    @Mock
    private SeatingChangeLogService seatingChangeLogService;

    private SeatingTableService service;
    private FloorPlan floorPlan;

    @BeforeEach
    void setUp() {
        service = new SeatingTableService(
                seatingTableRepository,
                floorPlanRepository,
                guestAssignmentRepository,
                seatingChangeLogService
        );
        floorPlan = SeatingObjects.floorPlan(FLOOR_PLAN_ID, CLIENT_ID);
    }

    @Test
    @DisplayName("a new table takes the next table number and default size, capacity and style")
    void addTableAppliesDefaults() {
        UUID newId = UUID.randomUUID();
        when(floorPlanRepository.findById(FLOOR_PLAN_ID)).thenReturn(Optional.of(floorPlan));
        when(seatingTableRepository.findMaxTableNumber(FLOOR_PLAN_ID)).thenReturn(4);
        when(seatingTableRepository.save(any(SeatingTable.class)))
                .thenAnswer(invocation -> TestEntities.withId(invocation.getArgument(0), newId));

        SeatingTableResponse response = service.addTable(FLOOR_PLAN_ID, new AddTableRequest(
                null, "  ", TableShape.RECTANGLE, 300, 200, null, null, null, null, null, null, null));

        assertThat(response.id()).isEqualTo(newId);
        assertThat(response.tableNumber()).isEqualTo(5);
        assertThat(response.tableName()).isNull();
        assertThat(response.width()).isEqualTo(SeatingTable.DEFAULT_SIZE);
        assertThat(response.capacity()).isEqualTo(SeatingTable.DEFAULT_CAPACITY);
        assertThat(response.minCapacity()).isEqualTo(TableStyle.DEFAULT_MIN_CAPACITY);
        assertThat(response.fillColor()).isEqualTo(TableStyle.DEFAULT_FILL_COLOR);
        assertThat(response.vip()).isFalse();

        ArgumentCaptor<ChangeLogCommand> captor = ArgumentCaptor.forClass(ChangeLogCommand.class);
        verify(seatingChangeLogService).log(captor.capture());
        assertThat(captor.getValue().action()).isEqualTo(ChangeAction.ADD_TABLE);
        assertThat(captor.getValue().tableId()).isEqualTo(newId);
    }

    @Test
    @DisplayName("capacity cannot drop below the guests already seated")
    void capacityBelowOccupancyIsRejected() {
        SeatingTable table = SeatingObjects.table(floorPlan, UUID.randomUUID(), 2, 8);
        when(seatingTableRepository.findByIdForUpdate(table.getId())).thenReturn(Optional.of(table));
        when(guestAssignmentRepository.countByTableId(table.getId())).thenReturn(5L);

        assertThatThrownBy(() -> service.updateTable(FLOOR_PLAN_ID, table.getId(),
                new UpdateTableRequest(null, null, null, null, null, 4, null, null, null, null, null)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("CAPACITY_BELOW_OCCUPANCY");
                });
        assertThat(table.getCapacity()).isEqualTo(8);
        verifyNoInteractions(seatingChangeLogService);
    }

    @Test
    void moveIsLoggedWithBeforeAndAfterGeometry() {
        SeatingTable table = SeatingObjects.table(floorPlan, UUID.randomUUID(), 1, 8);
        when(seatingTableRepository.findByIdForUpdate(table.getId())).thenReturn(Optional.of(table));

        SeatingTableResponse response = service.updateTable(FLOOR_PLAN_ID, table.getId(),
                new UpdateTableRequest(640, null, null, null, 45, null, null, null, null, null, null));

        assertThat(response.x()).isEqualTo(640);
        assertThat(response.y()).isEqualTo(100);
        assertThat(response.rotation()).isEqualTo(45);

        ArgumentCaptor<ChangeLogCommand> captor = ArgumentCaptor.forClass(ChangeLogCommand.class);
        verify(seatingChangeLogService).log(captor.capture());
        ChangeLogCommand command = captor.getValue();
        assertThat(command.action()).isEqualTo(ChangeAction.MOVE_TABLE);
        assertThat(command.previousState()).containsEntry("x", 150).containsEntry("rotation", 0);
        assertThat(command.newState()).containsEntry("x", 640).containsEntry("rotation", 45);
    }

    @Test
    @DisplayName("style-only edits do not write a MOVE_TABLE entry")
    void styleChangeIsNotLogged() {
        SeatingTable table = SeatingObjects.table(floorPlan, UUID.randomUUID(), 1, 8);
        when(seatingTableRepository.findByIdForUpdate(table.getId())).thenReturn(Optional.of(table));

        SeatingTableResponse response = service.updateTable(FLOOR_PLAN_ID, table.getId(),
                new UpdateTableRequest(null, null, null, null, null, null, "Head table", null, null, "#FF0000", true));

        assertThat(response.tableName()).isEqualTo("Head table");
        assertThat(response.fillColor()).isEqualTo("#FF0000");
        assertThat(response.vip()).isTrue();
        verifyNoInteractions(seatingChangeLogService);
    }

    @Test
    @DisplayName("deleting a table removes its assignments first and logs who was unseated")
    void deleteTableCascadesAssignments() {
        SeatingTable table = SeatingObjects.table(floorPlan, UUID.randomUUID(), 7, 8);
        UUID seatedGuest = UUID.randomUUID();
        when(seatingTableRepository.findByIdForUpdate(table.getId())).thenReturn(Optional.of(table));
        when(guestAssignmentRepository.findByTableId(table.getId()))
                .thenReturn(List.of(SeatingObjects.assignment(FLOOR_PLAN_ID, table.getId(), seatedGuest)));

        service.deleteTable(FLOOR_PLAN_ID, table.getId());

        InOrder order = inOrder(guestAssignmentRepository, seatingTableRepository);
        order.verify(guestAssignmentRepository).deleteByTable(table.getId());
        order.verify(seatingTableRepository).delete(table);

        ArgumentCaptor<ChangeLogCommand> captor = ArgumentCaptor.forClass(ChangeLogCommand.class);
        verify(seatingChangeLogService).log(captor.capture());
        assertThat(captor.getValue().action()).isEqualTo(ChangeAction.DELETE_TABLE);
        assertThat(captor.getValue().previousState())
                .containsEntry("tableNumber", 7)
                .containsEntry("removedGuestIds", List.of(seatedGuest));
    }

    @Test
    void deletingTableOfAnotherFloorPlanIsNotFound() {
        FloorPlan other = SeatingObjects.floorPlan(UUID.randomUUID(), CLIENT_ID);
        SeatingTable foreign = SeatingObjects.table(other, UUID.randomUUID(), 1, 8);
        when(seatingTableRepository.findByIdForUpdate(foreign.getId())).thenReturn(Optional.of(foreign));

        assertThatThrownBy(() -> service.deleteTable(FLOOR_PLAN_ID, foreign.getId()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("TABLE_NOT_FOUND"));
        verify(seatingTableRepository, never()).delete(any());
    }
}
