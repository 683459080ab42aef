package com.seatwise.backend.modules.guest.infrastructure;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.seatwise.backend.modules.guest.domain.GuestConflict;

public interface GuestConflictRepository extends GuestRelationshipUpsertRepository, JpaRepository<GuestConflict, UUID> {

    List<GuestConflict> findByClientIdAndActiveTrue(UUID clientId);

    Optional<GuestConflict> findByIdAndClientId(UUID id, UUID clientId);

    @Query("""
            select c
              from GuestConflict c
             where c.active = true
               and (c.guestOneId = :guestId or c.guestTwoId = :guestId)
            """)
    List<GuestConflict> findActiveByGuestId(@Param("guestId") UUID guestId);
}
