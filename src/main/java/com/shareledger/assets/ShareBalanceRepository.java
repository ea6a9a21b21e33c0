package com.shareledger.assets;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for share balances.
 */
@Repository
public interface ShareBalanceRepository extends JpaRepository<ShareBalance, ShareBalanceId> {

    List<ShareBalance> findByIdAssetId(long assetId);

    @Query("select sum(b.amount) from ShareBalance b where b.id.assetId = :assetId")
    Long sumByAssetId(@Param("assetId") long assetId);
}
