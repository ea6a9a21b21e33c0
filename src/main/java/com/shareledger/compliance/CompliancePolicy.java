package com.shareledger.compliance;

import com.shareledger.common.LedgerConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Required compliance level for each gated operation.
 *
 * Defaults to level 1 everywhere: any approved, unexpired attestation is enough.
 */
@Component
@Slf4j
public class CompliancePolicy {

    private final Map<GatedOperation, Integer> requiredLevels = new EnumMap<>(GatedOperation.class);

    public CompliancePolicy(
            @Value("${share-ledger.compliance.proposal-level:1}") int proposalLevel,
            @Value("${share-ledger.compliance.vote-level:1}") int voteLevel,
            @Value("${share-ledger.compliance.harvest-level:1}") int harvestLevel,
            @Value("${share-ledger.compliance.transfer-level:1}") int transferLevel) {
        requiredLevels.put(GatedOperation.PROPOSE, checkLevel(GatedOperation.PROPOSE, proposalLevel));
        requiredLevels.put(GatedOperation.VOTE, checkLevel(GatedOperation.VOTE, voteLevel));
        requiredLevels.put(GatedOperation.HARVEST, checkLevel(GatedOperation.HARVEST, harvestLevel));
        requiredLevels.put(GatedOperation.RECEIVE_SHARES, checkLevel(GatedOperation.RECEIVE_SHARES, transferLevel));
        log.info("Compliance levels: {}", requiredLevels);
    }

    public int requiredLevel(GatedOperation operation) {
        return requiredLevels.get(operation);
    }

    private static int checkLevel(GatedOperation operation, int level) {
        if (level < 0 || level > LedgerConstants.MAX_KYC_LEVEL) {
            throw new IllegalArgumentException(String.format(
                "Compliance level for %s must be within [0, %d]: %d",
                operation, LedgerConstants.MAX_KYC_LEVEL, level));
        }
        return level;
    }
}
