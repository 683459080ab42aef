package com.seatwise.backend.modules.guest.infrastructure;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.seatwise.backend.modules.guest.domain.Guest;

public interface GuestRepository extends JpaRepository<Guest, UUID> {

    long countByClientId(UUID clientId);
}
