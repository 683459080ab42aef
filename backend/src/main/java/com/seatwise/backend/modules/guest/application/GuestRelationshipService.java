package com.seatwise.backend.modules.guest.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.seatwise.backend.global.error.ProblemException;
import com.seatwise.backend.modules.guest.domain.ConflictSeverity;
import com.seatwise.backend.modules.guest.domain.ConflictType;
import com.seatwise.backend.modules.guest.domain.Guest;
import com.seatwise.backend.modules.guest.domain.GuestConflict;
import com.seatwise.backend.modules.guest.domain.GuestPair;
import com.seatwise.backend.modules.guest.domain.GuestPreference;
import com.seatwise.backend.modules.guest.domain.GuestRelationship;
import com.seatwise.backend.modules.guest.domain.PreferenceStrength;
import com.seatwise.backend.modules.guest.domain.PreferenceType;
import com.seatwise.backend.modules.guest.infrastructure.GuestConflictRepository;
import com.seatwise.backend.modules.guest.infrastructure.GuestPreferenceRepository;
import com.seatwise.backend.modules.guest.infrastructure.GuestRepository;
import com.seatwise.backend.modules.guest.presentation.dto.GuestConflictRequest;
import com.seatwise.backend.modules.guest.presentation.dto.GuestConflictResponse;
import com.seatwise.backend.modules.guest.presentation.dto.GuestPreferenceRequest;
import com.seatwise.backend.modules.guest.presentation.dto.GuestPreferenceResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.AuditorAware;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Maintains the symmetric conflict / preference graph between guests of a client.
 */
@Service
@Transactional
public class GuestRelationshipService {

    private static final Logger log = LoggerFactory.getLogger(GuestRelationshipService.class);

    private final GuestRepository guestRepository;
    private final GuestConflictRepository guestConflictRepository;
    private final GuestPreferenceRepository guestPreferenceRepository;
    private final AuditorAware<UUID> auditorAware;
    private final Clock clock;

    public GuestRelationshipService(
            GuestRepository guestRepository,
            GuestConflictRepository guestConflictRepository,
            GuestPreferenceRepository guestPreferenceRepository,
            AuditorAware<UUID> auditorAware,
            Clock clock
    ) {
        this.guestRepository = guestRepository;
        this.guestConflictRepository = guestConflictRepository;
        this.guestPreferenceRepository = guestPreferenceRepository;
        this.auditorAware = auditorAware;
        this.clock = clock;
    }

    /**
     * Records that two guests must not sit together. Re-adding an existing (possibly removed)
     * pair updates it in place and reactivates it.
     */
    public GuestConflictResponse addConflict(UUID clientId, GuestConflictRequest request) {
        GuestPair pair = resolvePair(clientId, request.guestOneId(), request.guestTwoId());
        ConflictType type = request.conflictType() != null ? request.conflictType() : ConflictType.GENERAL;
        ConflictSeverity severity = request.severity() != null ? request.severity() : ConflictSeverity.MODERATE;

        UUID id = guestConflictRepository.upsertConflict(
                clientId, pair, type, severity, trimToNull(request.reason()), currentActor(), OffsetDateTime.now(clock));
        log.debug("Guest conflict {} upserted for client {} ({})", id, clientId, pair);
        GuestConflict conflict = guestConflictRepository.findById(id)
                .orElseThrow(() -> new IllegalStateException("Upserted conflict " + id + " not visible"));
        return GuestConflictResponse.from(conflict);
    }

    public GuestPreferenceResponse addPreference(UUID clientId, GuestPreferenceRequest request) {
        GuestPair pair = resolvePair(clientId, request.guestOneId(), request.guestTwoId());
        PreferenceType type = request.preferenceType() != null ? request.preferenceType() : PreferenceType.TOGETHER;
        PreferenceStrength strength = request.strength() != null ? request.strength() : PreferenceStrength.PREFERRED;

        UUID id = guestPreferenceRepository.upsertPreference(
                clientId, pair, type, strength, trimToNull(request.reason()), currentActor(), OffsetDateTime.now(clock));
        log.debug("Guest preference {} upserted for client {} ({})", id, clientId, pair);
        GuestPreference preference = guestPreferenceRepository.findById(id)
                .orElseThrow(() -> new IllegalStateException("Upserted preference " + id + " not visible"));
        return GuestPreferenceResponse.from(preference);
    }

    public void removeConflict(UUID clientId, UUID conflictId) {
        GuestConflict conflict = guestConflictRepository.findByIdAndClientId(conflictId, clientId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "CONFLICT_NOT_FOUND",
                        "Guest conflict " + conflictId + " not found"));
        conflict.setActive(false);
    }

    public void removePreference(UUID clientId, UUID preferenceId) {
        GuestPreference preference = guestPreferenceRepository.findByIdAndClientId(preferenceId, clientId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "PREFERENCE_NOT_FOUND",
                        "Guest preference " + preferenceId + " not found"));
        preference.setActive(false);
    }

    @Transactional(readOnly = true)
    public List<GuestConflictResponse> getConflicts(UUID clientId) {
        return guestConflictRepository.findByClientIdAndActiveTrue(clientId).stream()
                .map(GuestConflictResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<GuestPreferenceResponse> getPreferences(UUID clientId) {
        return guestPreferenceRepository.findByClientIdAndActiveTrue(clientId).stream()
                .map(GuestPreferenceResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public Set<UUID> conflictPartnersOf(UUID guestId) {
        return partners(guestConflictRepository.findActiveByGuestId(guestId), guestId);
    }

    @Transactional(readOnly = true)
    public Set<UUID> preferencePartnersOf(UUID guestId) {
        return partners(guestPreferenceRepository.findActiveByGuestId(guestId), guestId);
    }

    private Set<UUID> partners(List<? extends GuestRelationship> edges, UUID guestId) {
        Set<UUID> result = new LinkedHashSet<>();
        for (GuestRelationship edge : edges) {
            result.add(edge.otherGuest(guestId));
        }
        return result;
    }

    private GuestPair resolvePair(UUID clientId, UUID guestOneId, UUID guestTwoId) {
        if (guestOneId.equals(guestTwoId)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "SELF_RELATIONSHIP",
                    "A guest cannot have a relationship with themselves");
        }
        requireClientGuest(clientId, guestOneId);
        requireClientGuest(clientId, guestTwoId);
        return GuestPair.of(guestOneId, guestTwoId);
    }

    private void requireClientGuest(UUID clientId, UUID guestId) {
        Guest guest = guestRepository.findById(guestId)
                .orElseThrow(() -> guestNotFound(guestId));
        if (!clientId.equals(guest.getClientId())) {
            throw guestNotFound(guestId);
        }
    }

    private ProblemException guestNotFound(UUID guestId) {
        return new ProblemException(HttpStatus.NOT_FOUND, "GUEST_NOT_FOUND", "Guest " + guestId + " not found");
    }

    private UUID currentActor() {
        return auditorAware.getCurrentAuditor().orElse(null);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
