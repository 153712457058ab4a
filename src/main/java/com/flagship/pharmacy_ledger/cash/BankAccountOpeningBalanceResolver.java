package com.flagship.pharmacy_ledger.cash;

import com.flagship.pharmacy_ledger.ledger.LedgerDomain;
import com.flagship.pharmacy_ledger.projection.OpeningBalanceResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Cash balances start from the account's opening balance.
 */
@Component
@RequiredArgsConstructor
public class BankAccountOpeningBalanceResolver implements OpeningBalanceResolver {

    private final BankAccountRepository accountRepository;

    @Override
    public LedgerDomain domain() {
        return LedgerDomain.CASH;
    }

    @Override
    public BigDecimal openingBalance(String accountId) {
        return accountRepository.findById(accountId)
                .map(BankAccountEntity::getOpeningBalance)
                .orElse(BigDecimal.ZERO);
    }
}
