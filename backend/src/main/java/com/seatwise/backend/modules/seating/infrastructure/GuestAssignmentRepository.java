package com.seatwise.backend.modules.seating.infrastructure;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.seatwise.backend.modules.guest.domain.Guest;
import com.seatwise.backend.modules.seating.domain.GuestAssignment;

/**
 * Deletes are bulk statements executed immediately, so a delete followed by an insert for the
 * same (floor plan, guest) never trips the unique index at flush time.
 */
public interface GuestAssignmentRepository extends JpaRepository<GuestAssignment, UUID> {

    List<GuestAssignment> findByFloorPlanId(UUID floorPlanId);

    List<GuestAssignment> findByTableId(UUID tableId);

    Optional<GuestAssignment> findByFloorPlanIdAndGuestId(UUID floorPlanId, UUID guestId);

    long countByTableId(UUID tableId);

    long countByTableIdAndGuestIdNot(UUID tableId, UUID guestId);

    @Query("""
            select a
              from GuestAssignment a
             where a.floorPlanId = :floorPlanId
               and a.guestId not in :guestIds
            """)
    List<GuestAssignment> findByFloorPlanIdExcludingGuests(
            @Param("floorPlanId") UUID floorPlanId,
            @Param("guestIds") Collection<UUID> guestIds
    );

    @Query("""
            select g
              from GuestAssignment a
              join Guest g on g.id = a.guestId
             where a.tableId = :tableId
               and a.guestId <> :guestId
            """)
    List<Guest> findOccupantsExcluding(@Param("tableId") UUID tableId, @Param("guestId") UUID guestId);

    @Query("""
            select g
              from Guest g
             where g.clientId = :clientId
               and not exists (
                   select 1 from GuestAssignment a
                    where a.floorPlanId = :floorPlanId
                      and a.guestId = g.id
               )
             order by g.lastName, g.firstName
            """)
    List<Guest> findUnassignedGuests(@Param("floorPlanId") UUID floorPlanId, @Param("clientId") UUID clientId);

    @Modifying(flushAutomatically = true)
    @Query("delete from GuestAssignment a where a.floorPlanId = :floorPlanId and a.guestId = :guestId")
    int deleteByFloorPlanAndGuest(@Param("floorPlanId") UUID floorPlanId, @Param("guestId") UUID guestId);

    @Modifying(flushAutomatically = true)
    @Query("delete from GuestAssignment a where a.floorPlanId = :floorPlanId and a.guestId in :guestIds")
    int deleteByFloorPlanAndGuests(
            @Param("floorPlanId") UUID floorPlanId,
            @Param("guestIds") Collection<UUID> guestIds
    );

    @Modifying(flushAutomatically = true)
    @Query("delete from GuestAssignment a where a.tableId = :tableId")
    int deleteByTable(@Param("tableId") UUID tableId);

    @Modifying(flushAutomatically = true)
    @Query("delete from GuestAssignment a where a.floorPlanId = :floorPlanId")
    int deleteByFloorPlan(@Param("floorPlanId") UUID floorPlanId);
}
