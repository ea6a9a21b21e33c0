package com.shareledger.governance;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Immutable audit record of one vote. Written once, never updated or deleted.
 */
@Entity
@Table(name = "vote_records")
@Getter
@ToString
@NoArgsConstructor
public class VoteRecord {

    @EmbeddedId
    private VoteRecordId id;

    @Column(nullable = false, updatable = false)
    private boolean support;

    /**
     * Weight captured at cast time; later balance changes do not affect it.
     */
    @Column(nullable = false, updatable = false)
    private long weight;

    @Column(name = "cast_at", nullable = false, updatable = false)
    private long castAt;

    public VoteRecord(long proposalId, String voter, boolean support, long weight, long castAt) {
        this.id = new VoteRecordId(proposalId, voter);
        this.support = support;
        this.weight = weight;
        this.castAt = castAt;
    }
}
