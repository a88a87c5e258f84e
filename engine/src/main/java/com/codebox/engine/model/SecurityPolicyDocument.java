package com.codebox.engine.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * The last policy applied through an administrative reload, stored as JSON
 * so that a restart comes back with it instead of the configured defaults.
 *
 * Single-row table; the id is always {@link #SINGLETON_ID}.
 *
 * DB table: security_policy  (created by Flyway V2 migration)
 */
@Entity
@Table(name = "security_policy")
public class SecurityPolicyDocument {

    public static final int SINGLETON_ID = 1;

    @Id
    private Integer id = SINGLETON_ID;

    @Column(name = "policy_json", columnDefinition = "TEXT", nullable = false)
    private String policyJson;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    protected SecurityPolicyDocument() {}   // required by JPA

    public SecurityPolicyDocument(String policyJson) {
        this.policyJson = policyJson;
    }

    public Integer getId()         { return id; }
    public String  getPolicyJson() { return policyJson; }
    public Instant getUpdatedAt()  { return updatedAt; }

    public void replace(String policyJson) {
        this.policyJson = policyJson;
        this.updatedAt  = Instant.now();
    }
}
