package com.shareledger.compliance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for compliance records.
 */
@Repository
public interface ComplianceRecordRepository extends JpaRepository<ComplianceRecord, String> {
}
