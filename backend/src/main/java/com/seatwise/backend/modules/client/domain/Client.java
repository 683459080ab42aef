package com.seatwise.backend.modules.client.domain;

import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

/**
 * A planner's customer (the couple or host). Owned by the client module of the wider product;
 * seating only reads it to resolve which company a floor plan or guest list belongs to.
 */
@Entity
@Immutable
@Table(name = "client")
public class Client {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "company_id", nullable = false, columnDefinition = "uuid")
    private UUID companyId;

    @Column(name = "name", nullable = false)
    private String name;

    protected Client() {
    }

    public Client(UUID id, UUID companyId, String name) {
        this.id = id;
        this.companyId = companyId;
        this.name = name;
    }

    public UUID getId() {
        return id;
    }

    public UUID getCompanyId() {
        return companyId;
    }

    public String getName() {
        return name;
    }

    public boolean belongsTo(UUID companyId) {
        return this.companyId != null && this.companyId.equals(companyId);
    }
}
