package com.seatwise.backend.modules.guest.infrastructure;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.seatwise.backend.modules.guest.domain.ConflictSeverity;
import com.seatwise.backend.modules.guest.domain.ConflictType;
import com.seatwise.backend.modules.guest.domain.GuestPair;
import com.seatwise.backend.modules.guest.domain.PreferenceStrength;
import com.seatwise.backend.modules.guest.domain.PreferenceType;

/**
 * Single-statement insert-or-reactivate for relationship edges, keyed by (client, normalized pair).
 * Both methods return the id of the row that now holds the edge.
 */
public interface GuestRelationshipUpsertRepository {

    UUID upsertConflict(UUID clientId, GuestPair pair, ConflictType type, ConflictSeverity severity,
                        String reason, UUID createdBy, OffsetDateTime now);

    UUID upsertPreference(UUID clientId, GuestPair pair, PreferenceType type, PreferenceStrength strength,
                          String reason, UUID createdBy, OffsetDateTime now);
}
