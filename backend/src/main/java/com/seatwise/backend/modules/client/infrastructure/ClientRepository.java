package com.seatwise.backend.modules.client.infrastructure;

import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.seatwise.backend.modules.client.domain.Client;

public interface ClientRepository extends JpaRepository<Client, UUID> {

    Optional<Client> findByIdAndCompanyId(UUID id, UUID companyId);
}
