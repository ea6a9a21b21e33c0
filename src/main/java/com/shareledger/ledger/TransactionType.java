package com.shareledger.ledger;

/**
 * Types of journaled movements.
 *
 * Share movements are denominated in shares; revenue movements in revenue units.
 */
public enum TransactionType {
    /**
     * Full supply credited to the registrar at tokenization.
     */
    SHARE_ISSUANCE,

    /**
     * Shares moved between two holders of the same asset.
     */
    SHARE_TRANSFER,

    /**
     * Revenue credited to an asset's pool by the external revenue path.
     */
    REVENUE_DEPOSIT,

    /**
     * Harvested dividend moved from the asset's pool to a holder's payout account.
     */
    DIVIDEND_PAYOUT
}
