package com.seatwise.backend.modules.changelog.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.seatwise.backend.global.error.ProblemException;
import com.seatwise.backend.modules.changelog.domain.ChangeAction;
import com.seatwise.backend.modules.changelog.domain.SeatingChangeLogEntry;
import com.seatwise.backend.modules.changelog.infrastructure.SeatingChangeLogRepository;
import com.seatwise.backend.modules.changelog.presentation.dto.ChangeLogEntryResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.AuditorAware;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SeatingChangeLogService {

    private static final Logger log = LoggerFactory.getLogger(SeatingChangeLogService.class);

    static final int DEFAULT_HISTORY_LIMIT = 50;

    private final ChangeLogWriter changeLogWriter;
    private final SeatingChangeLogRepository seatingChangeLogRepository;
    private final AuditorAware<UUID> auditorAware;
    private final Clock clock;
    private final int historyMaxLimit;

    public SeatingChangeLogService(
            ChangeLogWriter changeLogWriter,
            SeatingChangeLogRepository seatingChangeLogRepository,
            AuditorAware<UUID> auditorAware,
            Clock clock,
            @Value("${seatwise.change-log.history-max-limit:100}") int historyMaxLimit
    ) {
        this.changeLogWriter = changeLogWriter;
        this.seatingChangeLogRepository = seatingChangeLogRepository;
        this.auditorAware = auditorAware;
        this.clock = clock;
        this.historyMaxLimit = historyMaxLimit;
    }

    /**
     * Best-effort append. Failures are logged and reported as {@link ChangeLogResult#skipped}; they never propagate.
     */
    public ChangeLogResult log(ChangeLogCommand command) {
        try {
            Objects.requireNonNull(command.floorPlanId(), "floorPlanId is required");
            Objects.requireNonNull(command.action(), "action is required");

            SeatingChangeLogEntry entry = new SeatingChangeLogEntry();
            entry.setFloorPlanId(command.floorPlanId());
            entry.setAction(command.action());
            entry.setGuestId(command.guestId());
            entry.setTableId(command.tableId());
            entry.setPreviousState(copyOrNull(command.previousState()));
            entry.setNewState(copyOrNull(command.newState()));
            entry.setChangedBy(auditorAware.getCurrentAuditor().orElse(null));
            entry.setChangedAt(OffsetDateTime.now(clock));

            return ChangeLogResult.recorded(changeLogWriter.write(entry));
        } catch (RuntimeException ex) {
            log.warn("Change log write skipped for floor plan {} action {}: {}",
                    command.floorPlanId(), command.action(), ex.getMessage());
            return ChangeLogResult.skipped(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        }
    }

    @Transactional(readOnly = true)
    public List<ChangeLogEntryResponse> history(UUID floorPlanId, Integer limit) {
        int effectiveLimit = limit != null ? limit : Math.min(DEFAULT_HISTORY_LIMIT, historyMaxLimit);
        if (effectiveLimit < 1 || effectiveLimit > historyMaxLimit) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "validation_error",
                    "limit must be between 1 and " + historyMaxLimit);
        }
        return seatingChangeLogRepository
                .findByFloorPlanIdOrderByChangedAtDesc(floorPlanId, PageRequest.of(0, effectiveLimit))
                .stream()
                .map(ChangeLogEntryResponse::from)
                .toList();
    }

    private static Map<String, Object> copyOrNull(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return null;
        }
        return new LinkedHashMap<>(source);
    }

    public record ChangeLogCommand(
            UUID floorPlanId,
            ChangeAction action,
            UUID guestId,
            UUID tableId,
            Map<String, Object> previousState,
            Map<String, Object> newState
    ) {

        public static ChangeLogCommand of(UUID floorPlanId, ChangeAction action) {
            return new ChangeLogCommand(floorPlanId, action, null, null, null, null);
        }
    }
}
