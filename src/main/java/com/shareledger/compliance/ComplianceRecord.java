package com.shareledger.compliance;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Attestation outcome for one address, produced by the external compliance process.
 */
@Entity
@Table(name = "compliance_records")
@Data
@NoArgsConstructor
public class ComplianceRecord {

    @Id
    private String address;

    @Column(nullable = false)
    private boolean approved;

    /**
     * Ordinal tier in [0, MAX_KYC_LEVEL].
     */
    @Column(name = "kyc_level", nullable = false)
    private int level;

    /**
     * First block height at which the record no longer counts.
     */
    @Column(name = "expires_at", nullable = false)
    private long expiresAt;

    @Column(name = "attested_at", nullable = false)
    private long attestedAt;

    @Column(name = "attested_by", nullable = false)
    private String attestedBy;

    public ComplianceRecord(String address, boolean approved, int level, long expiresAt,
                            long attestedAt, String attestedBy) {
        this.address = address;
        this.approved = approved;
        this.level = level;
        this.expiresAt = expiresAt;
        this.attestedAt = attestedAt;
        this.attestedBy = attestedBy;
    }

    public boolean satisfies(int requiredLevel, long atHeight) {
        return approved && level >= requiredLevel && atHeight < expiresAt;
    }
}
