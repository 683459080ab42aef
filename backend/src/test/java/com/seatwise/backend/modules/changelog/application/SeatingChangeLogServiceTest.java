package com.seatwise.backend.modules.changelog.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.seatwise.backend.global.error.ProblemException;
import com.seatwise.backend.modules.changelog.application.SeatingChangeLogService.ChangeLogCommand;
import com.seatwise.backend.modules.changelog.domain.ChangeAction;
import com.seatwise.backend.modules.changelog.domain.SeatingChangeLogEntry;
import com.seatwise.backend.modules.changelog.infrastructure.SeatingChangeLogRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.AuditorAware;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class SeatingChangeLogServiceTest {

    private static final UUID FLOOR_PLAN_ID = UUID.fromString("00000000-0000-0000-0000-0000000000f1");
    private static final UUID ACTOR_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");

    @Mock
    private ChangeLogWriter changeLogWriter;

    @Mock
    private SeatingChangeLogRepository seatingChangeLogRepository;

    @Mock
    private AuditorAware<UUID> auditorAware;

    private SeatingChangeLogService service;
    private Clock clock;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.parse("2026-06-01T10:00:00Z").toInstant(), ZoneOffset.UTC);
        service = new SeatingChangeLogService(changeLogWriter, seatingChangeLogRepository, auditorAware, clock, 100);
    }

    @Test
    void recordsEntryWithActorAndTimestamp() {
        UUID entryId = UUID.randomUUID();
        UUID guestId = UUID.randomUUID();
        when(auditorAware.getCurrentAuditor()).thenReturn(Optional.of(ACTOR_ID));
        when(changeLogWriter.write(any(SeatingChangeLogEntry.class))).thenReturn(entryId);

        ChangeLogResult result = service.log(new ChangeLogCommand(
                FLOOR_PLAN_ID, ChangeAction.UNASSIGN, guestId, null, Map.of("tableId", "t-1"), Map.of()));

        assertThat(result.recorded()).isTrue();
        assertThat(result.entryId()).isEqualTo(entryId);

        ArgumentCaptor<SeatingChangeLogEntry> captor = ArgumentCaptor.forClass(SeatingChangeLogEntry.class);
        verify(changeLogWriter).write(captor.capture());
        SeatingChangeLogEntry entry = captor.getValue();
        assertThat(entry.getAction()).isEqualTo(ChangeAction.UNASSIGN);
        assertThat(entry.getGuestId()).isEqualTo(guestId);
        assertThat(entry.getPreviousState()).containsEntry("tableId", "t-1");
        assertThat(entry.getNewState()).isNull();
        assertThat(entry.getChangedBy()).isEqualTo(ACTOR_ID);
        assertThat(entry.getChangedAt()).isEqualTo(OffsetDateTime.now(clock));
    }

    @Test
    @DisplayName("a failing write is reported as skipped instead of propagating")
    void writerFailureIsSwallowed() {
        when(auditorAware.getCurrentAuditor()).thenReturn(Optional.empty());
        when(changeLogWriter.write(any(SeatingChangeLogEntry.class)))
                .thenThrow(new DataIntegrityViolationException("value too long"));

        ChangeLogResult result = service.log(ChangeLogCommand.of(FLOOR_PLAN_ID, ChangeAction.ADD_TABLE));

        assertThat(result.recorded()).isFalse();
        assertThat(result.entryId()).isNull();
        assertThat(result.skipReason()).contains("value too long");
    }

    @Test
    void missingActionIsSkipped() {
        ChangeLogResult result = service.log(new ChangeLogCommand(FLOOR_PLAN_ID, null, null, null, null, null));

        assertThat(result.recorded()).isFalse();
        assertThat(result.skipReason()).isEqualTo("action is required");
        verifyNoInteractions(changeLogWriter);
    }

    @Test
    @DisplayName("history defaults to the newest 50 entries")
    void historyUsesDefaultLimit() {
        when(seatingChangeLogRepository.findByFloorPlanIdOrderByChangedAtDesc(eq(FLOOR_PLAN_ID), any(Pageable.class)))
                .thenReturn(List.of());

        assertThat(service.history(FLOOR_PLAN_ID, null)).isEmpty();

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(seatingChangeLogRepository).findByFloorPlanIdOrderByChangedAtDesc(eq(FLOOR_PLAN_ID), page.capture());
        assertThat(page.getValue().getPageSize()).isEqualTo(SeatingChangeLogService.DEFAULT_HISTORY_LIMIT);
    }

    @Test
    void historyLimitOutsideRangeIsRejected() {
        assertThatThrownBy(() -> service.history(FLOOR_PLAN_ID, 0))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY));
        assertThatThrownBy(() -> service.history(FLOOR_PLAN_ID, 101))
                .isInstanceOf(ProblemException.class);
        verifyNoInteractions(seatingChangeLogRepository);
    }
}
