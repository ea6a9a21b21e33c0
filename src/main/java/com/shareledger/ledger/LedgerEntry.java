package com.shareledger.ledger;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;

/**
 * Immutable journal entry representing one side of a double-entry movement.
 *
 * Every movement results in exactly two entries sharing a transaction id:
 * - One debit
 * - One credit
 *
 * Journal entries are never updated or deleted - they are append-only.
 *
 * Ids derive from the journal sequence, so replaying the same calls yields the same
 * journal. {@code createdAt} is wall-clock audit metadata and never used for ordering.
 */
@Entity
@Table(name = "ledger_entries", indexes = {
    @Index(name = "idx_ledger_transaction_id", columnList = "transaction_id"),
    @Index(name = "idx_ledger_account_ref", columnList = "account_ref"),
    @Index(name = "idx_ledger_asset_id", columnList = "asset_id")
})
@Data
@NoArgsConstructor
public class LedgerEntry {

    @Id
    private String entryId;

    @Column(name = "journal_sequence", nullable = false, updatable = false)
    private long journalSequence;

    @Column(name = "transaction_id", nullable = false, updatable = false)
    private String transactionId;

    /**
     * Holder address, or a pool reference such as {@code asset:7:revenue}.
     */
    @Column(name = "account_ref", nullable = false, updatable = false)
    private String accountRef;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private EntryType entryType;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private TransactionType transactionType;

    @Column(name = "asset_id", nullable = false, updatable = false)
    private long assetId;

    @Column(name = "block_height", nullable = false, updatable = false)
    private long blockHeight;

    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public LedgerEntry(long journalSequence, String accountRef, EntryType entryType, long amount,
                       TransactionType transactionType, long assetId, long blockHeight,
                       String description) {
        this.journalSequence = journalSequence;
        this.transactionId = transactionId(journalSequence);
        this.entryId = transactionId + ":" + entryType.name().toLowerCase(Locale.ROOT);
        this.accountRef = accountRef;
        this.entryType = entryType;
        this.amount = amount;
        this.transactionType = transactionType;
        this.assetId = assetId;
        this.blockHeight = blockHeight;
        this.description = description;
        this.createdAt = Instant.now();
    }

    public static String transactionId(long journalSequence) {
        return "txn-" + journalSequence;
    }

    public enum EntryType {
        DEBIT,
        CREDIT
    }
}
