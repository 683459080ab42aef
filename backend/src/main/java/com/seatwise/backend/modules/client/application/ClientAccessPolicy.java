package com.seatwise.backend.modules.client.application;

import java.util.UUID;

import com.seatwise.backend.global.error.ProblemException;
import com.seatwise.backend.global.security.SecurityUtils;
import com.seatwise.backend.modules.client.domain.Client;
import com.seatwise.backend.modules.client.infrastructure.ClientRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Request-layer tenant check for client-scoped endpoints. Seating services assume the caller
 * already passed through here.
 */
@Component
public class ClientAccessPolicy {

    private final ClientRepository clientRepository;

    public ClientAccessPolicy(ClientRepository clientRepository) {
        this.clientRepository = clientRepository;
    }

    @Transactional(readOnly = true)
    public Client requireAccessibleClient(UUID clientId) {
        Client client = clientRepository.findById(clientId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "CLIENT_NOT_FOUND",
                        "Client " + clientId + " not found"));
        ensureSameCompany(client);
        return client;
    }

    public void ensureSameCompany(Client client) {
        if (!client.belongsTo(SecurityUtils.getCurrentCompanyId())) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "CLIENT_ACCESS_DENIED",
                    "Client does not belong to your company");
        }
    }
}
