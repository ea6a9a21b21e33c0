package com.shareledger.market;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for cached oracle prices.
 */
@Repository
public interface MarketPriceRepository extends JpaRepository<MarketPrice, Long> {
}
