package com.seatwise.backend.modules.floorplan.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.seatwise.backend.global.error.ProblemException;
import com.seatwise.backend.modules.changelog.application.SeatingChangeLogService;
import com.seatwise.backend.modules.changelog.application.SeatingChangeLogService.ChangeLogCommand;
import com.seatwise.backend.modules.changelog.domain.ChangeAction;
import com.seatwise.backend.modules.floorplan.domain.FloorPlan;
import com.seatwise.backend.modules.floorplan.domain.SeatingTable;
import com.seatwise.backend.modules.floorplan.domain.TableStyle;
import com.seatwise.backend.modules.floorplan.infrastructure.FloorPlanRepository;
import com.seatwise.backend.modules.floorplan.infrastructure.SeatingTableRepository;
import com.seatwise.backend.modules.floorplan.presentation.dto.AddTableRequest;
import com.seatwise.backend.modules.floorplan.presentation.dto.SeatingTableResponse;
import com.seatwise.backend.modules.floorplan.presentation.dto.UpdateTableRequest;
import com.seatwise.backend.modules.seating.application.SeatingProblems;
import com.seatwise.backend.modules.seating.domain.GuestAssignment;
import com.seatwise.backend.modules.seating.infrastructure.GuestAssignmentRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Table registry of a floor plan.
 */
@Service
@Transactional
public class SeatingTableService {

    private static final Logger log = LoggerFactory.getLogger(SeatingTableService.class);

    private final SeatingTableRepository seatingTableRepository;
    private final FloorPlanRepository floorPlanRepository;
    private final GuestAssignmentRepository guestAssignmentRepository;
    private final SeatingChangeLogService seatingChangeLogService;

    public SeatingTableService(
            SeatingTableRepository seatingTableRepository,
            FloorPlanRepository floorPlanRepository,
            GuestAssignmentRepository guestAssignmentRepository,
            SeatingChangeLogService seatingChangeLogService
    ) {
        this.seatingTableRepository = seatingTableRepository;
        this.floorPlanRepository = floorPlanRepository;
        this.guestAssignmentRepository = guestAssignmentRepository;
        this.seatingChangeLogService = seatingChangeLogService;
    }

    @Transactional(readOnly = true)
    public List<SeatingTableResponse> listTables(UUID floorPlanId) {
        return seatingTableRepository.findByFloorPlan_IdOrderByTableNumberAsc(floorPlanId).stream()
                .map(SeatingTableResponse::from)
                .toList();
    }

    @Transactional(isolation = Isolation.SERIALIZABLE)
    public SeatingTableResponse addTable(UUID floorPlanId, AddTableRequest request) {
        FloorPlan floorPlan = floorPlanRepository.findById(floorPlanId)
                .orElseThrow(() -> SeatingProblems.floorPlanNotFound(floorPlanId));

        SeatingTable table = new SeatingTable();
        table.setFloorPlan(floorPlan);
        table.setTableNumber(request.tableNumber() != null
                ? request.tableNumber()
                : seatingTableRepository.findMaxTableNumber(floorPlanId) + 1);
        table.setTableName(trimToNull(request.tableName()));
        table.setShape(request.shape());
        table.moveTo(request.x(), request.y());
        table.resize(
                request.width() != null ? request.width() : SeatingTable.DEFAULT_SIZE,
                request.height() != null ? request.height() : SeatingTable.DEFAULT_SIZE
        );
        table.setRotation(request.rotation() != null ? request.rotation() : 0);
        table.setCapacity(request.capacity() != null ? request.capacity() : SeatingTable.DEFAULT_CAPACITY);
        table.setStyle(new TableStyle(
                request.minCapacity() != null ? request.minCapacity() : TableStyle.DEFAULT_MIN_CAPACITY,
                request.fillColor() != null ? request.fillColor() : TableStyle.DEFAULT_FILL_COLOR,
                Boolean.TRUE.equals(request.vip())
        ));

        SeatingTable saved = seatingTableRepository.save(table);
        seatingChangeLogService.log(new ChangeLogCommand(
                floorPlanId, ChangeAction.ADD_TABLE, null, saved.getId(), null, geometry(saved)));
        return SeatingTableResponse.from(saved);
    }

    /**
     * Applies the non-null fields. Capacity may not drop below the number of guests already seated.
     */
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public SeatingTableResponse updateTable(UUID floorPlanId, UUID tableId, UpdateTableRequest request) {
        SeatingTable table = lockTable(floorPlanId, tableId);
        Map<String, Object> before = geometry(table);

        if (request.capacity() != null && request.capacity() != table.getCapacity()) {
            long occupants = guestAssignmentRepository.countByTableId(tableId);
            if (request.capacity() < occupants) {
                throw new ProblemException(HttpStatus.CONFLICT, "CAPACITY_BELOW_OCCUPANCY",
                        table.getDisplayLabel() + " already seats " + occupants + " guests");
            }
            table.setCapacity(request.capacity());
        }
        if (request.x() != null || request.y() != null) {
            table.moveTo(
                    request.x() != null ? request.x() : table.getX(),
                    request.y() != null ? request.y() : table.getY()
            );
        }
        if (request.width() != null || request.height() != null) {
            table.resize(
                    request.width() != null ? request.width() : table.getWidth(),
                    request.height() != null ? request.height() : table.getHeight()
            );
        }
        if (request.rotation() != null) {
            table.setRotation(request.rotation());
        }
        if (request.tableName() != null) {
            table.setTableName(trimToNull(request.tableName()));
        }
        if (request.shape() != null) {
            table.setShape(request.shape());
        }
        TableStyle style = table.getStyle();
        if (request.minCapacity() != null) {
            style = style.withMinCapacity(request.minCapacity());
        }
        if (request.fillColor() != null) {
            style = style.withFillColor(request.fillColor());
        }
        if (request.vip() != null) {
            style = style.withVip(request.vip());
        }
        table.setStyle(style);

        Map<String, Object> after = geometry(table);
        if (!before.equals(after)) {
            seatingChangeLogService.log(new ChangeLogCommand(
                    floorPlanId, ChangeAction.MOVE_TABLE, null, tableId, before, after));
        }
        return SeatingTableResponse.from(table);
    }

    /**
     * Deletes the table together with the assignments seated at it.
     */
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public void deleteTable(UUID floorPlanId, UUID tableId) {
        SeatingTable table = lockTable(floorPlanId, tableId);
        List<UUID> seatedGuests = guestAssignmentRepository.findByTableId(tableId).stream()
                .map(GuestAssignment::getGuestId)
                .toList();

        guestAssignmentRepository.deleteByTable(tableId);
        seatingTableRepository.delete(table);

        Map<String, Object> previousState = geometry(table);
        previousState.put("tableNumber", table.getTableNumber());
        previousState.put("tableName", table.getTableName());
        previousState.put("removedGuestIds", seatedGuests);
        seatingChangeLogService.log(new ChangeLogCommand(
                floorPlanId, ChangeAction.DELETE_TABLE, null, tableId, previousState, null));
        log.info("Deleted table {} from floor plan {} ({} assignment(s) removed)",
                tableId, floorPlanId, seatedGuests.size());
    }

    private SeatingTable lockTable(UUID floorPlanId, UUID tableId) {
        return seatingTableRepository.findByIdForUpdate(tableId)
                .filter(table -> table.belongsTo(floorPlanId))
                .orElseThrow(() -> SeatingProblems.tableNotFound(tableId));
    }

    private static Map<String, Object> geometry(SeatingTable table) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("x", table.getX());
        state.put("y", table.getY());
        state.put("width", table.getWidth());
        state.put("height", table.getHeight());
        state.put("rotation", table.getRotation());
        state.put("capacity", table.getCapacity());
        return state;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
