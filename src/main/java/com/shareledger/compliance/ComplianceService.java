package com.shareledger.compliance;

import com.shareledger.common.Addresses;
import com.shareledger.common.CallContext;
import com.shareledger.common.LedgerConstants;
import com.shareledger.common.exception.ErrorCode;
import com.shareledger.common.exception.InvalidInputException;
import com.shareledger.common.exception.LedgerEntityNotFoundException;
import com.shareledger.common.exception.NotAuthorizedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

/**
 * Compliance gate: lookups and validation over attestation records.
 *
 * Which operations are gated, and at which level, is decided by {@link CompliancePolicy}.
 */
@Service
@Slf4j
public class ComplianceService {

    private final ComplianceRecordRepository complianceRecordRepository;
    private final CompliancePolicy compliancePolicy;
    private final String registrar;

    public ComplianceService(ComplianceRecordRepository complianceRecordRepository,
                             CompliancePolicy compliancePolicy,
                             @Value("${share-ledger.registrar}") String registrar) {
        this.complianceRecordRepository = complianceRecordRepository;
        this.compliancePolicy = compliancePolicy;
        this.registrar = registrar;
    }

    /**
     * True iff a record exists for the address, is approved, meets the level and has not expired.
     */
    @Transactional(readOnly = true)
    public boolean isCompliant(String address, int requiredLevel, long atHeight) {
        if (address == null) {
            return false;
        }
        return complianceRecordRepository.findById(address)
            .map(record -> record.satisfies(requiredLevel, atHeight))
            .orElse(false);
    }

    @Transactional(readOnly = true)
    public boolean passes(String address, GatedOperation operation, long atHeight) {
        return isCompliant(address, compliancePolicy.requiredLevel(operation), atHeight);
    }

    /**
     * Reject the call with {@code KycRequired} unless the address passes the gate for the operation.
     */
    @Transactional(readOnly = true)
    public void requireCompliant(String address, GatedOperation operation, long atHeight) {
        if (!passes(address, operation, atHeight)) {
            log.debug("Compliance gate rejected {} for {} at height {} (level {} required)",
                address, operation, atHeight, compliancePolicy.requiredLevel(operation));
            throw NotAuthorizedException.kycRequired(address, operation.name().toLowerCase(Locale.ROOT));
        }
    }

    /**
     * Store the outcome of an external attestation. Replaces any earlier record for the address.
     */
    @Transactional
    public ComplianceRecord recordAttestation(CallContext context, String address, boolean approved,
                                              int level, long validForBlocks) {
        if (!registrar.equals(context.getCaller())) {
            throw NotAuthorizedException.ownerOnly(context.getCaller(), "record attestations");
        }
        if (!Addresses.isValid(address)) {
            throw new InvalidInputException(ErrorCode.INVALID_ADDRESS, "Invalid address: " + address);
        }
        if (level < 0 || level > LedgerConstants.MAX_KYC_LEVEL) {
            throw new InvalidInputException(ErrorCode.INVALID_KYC_LEVEL, String.format(
                "Compliance level must be within [0, %d]: %d", LedgerConstants.MAX_KYC_LEVEL, level));
        }
        if (validForBlocks <= 0 || validForBlocks > LedgerConstants.MAX_EXPIRY_BLOCKS) {
            throw new InvalidInputException(ErrorCode.INVALID_EXPIRY, String.format(
                "Validity must be within [1, %d] blocks: %d", LedgerConstants.MAX_EXPIRY_BLOCKS, validForBlocks));
        }

        long expiresAt = Math.addExact(context.getBlockHeight(), validForBlocks);
        ComplianceRecord record = new ComplianceRecord(address, approved, level, expiresAt,
            context.getBlockHeight(), context.getCaller());
        complianceRecordRepository.save(record);

        log.info("Recorded attestation for {}: approved={}, level={}, expiresAt={}",
            address, approved, level, expiresAt);
        return record;
    }

    @Transactional(readOnly = true)
    public ComplianceRecord getComplianceRecord(String address) {
        return complianceRecordRepository.findById(address)
            .orElseThrow(() -> new LedgerEntityNotFoundException("Compliance record", address));
    }
}
