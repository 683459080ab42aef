package com.seatwise.backend.modules.guest.infrastructure;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.seatwise.backend.modules.guest.domain.GuestPreference;

public interface GuestPreferenceRepository extends GuestRelationshipUpsertRepository, JpaRepository<GuestPreference, UUID> {

    List<GuestPreference> findByClientIdAndActiveTrue(UUID clientId);

    Optional<GuestPreference> findByIdAndClientId(UUID id, UUID clientId);

    @Query("""
            select c
              from GuestPreference c
             where c.active = true
               and (c.guestOneId = :guestId or c.guestTwoId = :guestId)
            """)
    List<GuestPreference> findActiveByGuestId(@Param("guestId") UUID guestId);
}
