package com.flagship.pharmacy_ledger;

import com.flagship.pharmacy_ledger.config.LedgerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Inventory and cash ledger reconciliation engine for the pharmacy platform.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(LedgerProperties.class)
public class PharmacyLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PharmacyLedgerApplication.class, args);
    }
}
