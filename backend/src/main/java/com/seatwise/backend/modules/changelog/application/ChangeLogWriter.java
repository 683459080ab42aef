package com.seatwise.backend.modules.changelog.application;

import java.util.UUID;

import com.seatwise.backend.modules.changelog.domain.SeatingChangeLogEntry;
import com.seatwise.backend.modules.changelog.infrastructure.SeatingChangeLogRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists a single entry in its own transaction so a failed insert cannot mark the caller's
 * seating transaction rollback-only.
 */
@Component
public class ChangeLogWriter {

    private final SeatingChangeLogRepository seatingChangeLogRepository;

    public ChangeLogWriter(SeatingChangeLogRepository seatingChangeLogRepository) {
        this.seatingChangeLogRepository = seatingChangeLogRepository;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public UUID write(SeatingChangeLogEntry entry) {
        return seatingChangeLogRepository.saveAndFlush(entry).getId();
    }
}
