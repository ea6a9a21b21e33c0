package com.shareledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Share Ledger.
 *
 * Share Ledger tokenizes registered assets into a fixed supply of shares, lets
 * shareholders govern each asset through weighted proposals, and distributes the
 * asset's revenue to shareholders pro-rata.
 */
@SpringBootApplication
public class ShareLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShareLedgerApplication.class, args);
    }
}
