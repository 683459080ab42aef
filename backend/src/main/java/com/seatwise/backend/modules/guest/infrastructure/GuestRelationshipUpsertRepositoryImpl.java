package com.seatwise.backend.modules.guest.infrastructure;

import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.seatwise.backend.modules.guest.domain.ConflictSeverity;
import com.seatwise.backend.modules.guest.domain.ConflictType;
import com.seatwise.backend.modules.guest.domain.GuestPair;
import com.seatwise.backend.modules.guest.domain.PreferenceStrength;
import com.seatwise.backend.modules.guest.domain.PreferenceType;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class GuestRelationshipUpsertRepositoryImpl implements GuestRelationshipUpsertRepository {

    private static final String UPSERT_CONFLICT = """
            insert into guest_conflict (
                id, client_id, guest_one_id, guest_two_id, conflict_type, severity, reason,
                is_active, created_by, created_at, updated_at
            ) values (
                gen_random_uuid(), :clientId, :guestOneId, :guestTwoId, :kind, :level, :reason,
                true, :createdBy, :now, :now
            )
            on conflict (client_id, guest_one_id, guest_two_id) do update
               set conflict_type = excluded.conflict_type,
                   severity = excluded.severity,
                   reason = excluded.reason,
                   is_active = true,
                   updated_at = excluded.updated_at
            returning id
            """;

    private static final String UPSERT_PREFERENCE = """
            insert into guest_preference (
                id, client_id, guest_one_id, guest_two_id, preference_type, strength, reason,
                is_active, created_by, created_at, updated_at
            ) values (
                gen_random_uuid(), :clientId, :guestOneId, :guestTwoId, :kind, :level, :reason,
                true, :createdBy, :now, :now
            )
            on conflict (client_id, guest_one_id, guest_two_id) do update
               set preference_type = excluded.preference_type,
                   strength = excluded.strength,
                   reason = excluded.reason,
                   is_active = true,
                   updated_at = excluded.updated_at
            returning id
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public GuestRelationshipUpsertRepositoryImpl(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public UUID upsertConflict(UUID clientId, GuestPair pair, ConflictType type, ConflictSeverity severity,
                               String reason, UUID createdBy, OffsetDateTime now) {
        return jdbcTemplate.queryForObject(UPSERT_CONFLICT,
                params(clientId, pair, type.name(), severity.name(), reason, createdBy, now), UUID.class);
    }

    @Override
    public UUID upsertPreference(UUID clientId, GuestPair pair, PreferenceType type, PreferenceStrength strength,
                                 String reason, UUID createdBy, OffsetDateTime now) {
        return jdbcTemplate.queryForObject(UPSERT_PREFERENCE,
                params(clientId, pair, type.name(), strength.name(), reason, createdBy, now), UUID.class);
    }

    private MapSqlParameterSource params(UUID clientId, GuestPair pair, String kind, String level,
                                         String reason, UUID createdBy, OffsetDateTime now) {
        return new MapSqlParameterSource()
                .addValue("clientId", clientId, Types.OTHER)
                .addValue("guestOneId", pair.first(), Types.OTHER)
                .addValue("guestTwoId", pair.second(), Types.OTHER)
                .addValue("kind", kind, Types.VARCHAR)
                .addValue("level", level, Types.VARCHAR)
                .addValue("reason", reason, Types.VARCHAR)
                .addValue("createdBy", createdBy, Types.OTHER)
                .addValue("now", now, Types.TIMESTAMP_WITH_TIMEZONE);
    }
}
