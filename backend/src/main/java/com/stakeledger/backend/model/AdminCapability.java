package com.stakeledger.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "admin_capabilities")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminCapability {

    @Id
    @Column(nullable = false, length = 128)
    private String identity;

    @Column(name = "granted_by", length = 128)
    private String grantedBy;

    @Column(name = "granted_at", nullable = false)
    private Instant grantedAt;
}
