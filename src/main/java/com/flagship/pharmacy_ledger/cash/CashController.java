package com.flagship.pharmacy_ledger.cash;

import com.flagship.pharmacy_ledger.cash.dto.ApproveEntryRequest;
import com.flagship.pharmacy_ledger.cash.dto.BankAccountResponse;
import com.flagship.pharmacy_ledger.cash.dto.BankEntryResponse;
import com.flagship.pharmacy_ledger.cash.dto.OpenAccountRequest;
import com.flagship.pharmacy_ledger.cash.dto.ResolveFlaggedRequest;
import com.flagship.pharmacy_ledger.cash.dto.StatementLineRequest;
import com.flagship.pharmacy_ledger.exception.ResourceNotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST surface of the bank ledger.
 *
 * A mismatching statement line answers 422 but stays recorded as FLAGGED; it is resolved
 * through {@code POST /statement-entries/{id}/resolution}.
 */
@RestController
@RequestMapping("/api/cash")
@RequiredArgsConstructor
@Slf4j
public class CashController {

    private final CashReconciliationService cashService;

    @PostMapping("/accounts")
    public ResponseEntity<BankAccountResponse> openAccount(@Valid @RequestBody OpenAccountRequest request) {
        BankAccountEntity account = cashService.openAccount(request.getAccountId(), request.getAccountName(),
                request.getOpeningBalance(), request.getOpenedAt());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(BankAccountResponse.from(account, account.getOpeningBalance()));
    }

    @GetMapping("/accounts/{accountId}")
    public ResponseEntity<BankAccountResponse> getAccount(@PathVariable("accountId") String accountId) {
        BankAccountEntity account = cashService.requireAccount(accountId);
        return ResponseEntity.ok(BankAccountResponse.from(account, cashService.balance(accountId)));
    }

    @GetMapping("/accounts/{accountId}/balance")
    public ResponseEntity<Map<String, Object>> balance(
            @PathVariable("accountId") String accountId,
            @RequestParam(value = "as_of", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant asOf) {
        BigDecimal balance = asOf == null ? cashService.balance(accountId) : cashService.balanceAsOf(accountId, asOf);
        return ResponseEntity.ok(asOf == null
            ? Map.of("account_id", accountId, "balance", balance)
            : Map.of("account_id", accountId, "as_of", asOf, "balance", balance));
    }

    @GetMapping("/accounts/{accountId}/entries")
    public ResponseEntity<List<BankEntryResponse>> entries(@PathVariable("accountId") String accountId) {
        return ResponseEntity.ok(cashService.entries(accountId).stream()
            .map(BankEntryResponse::from)
            .collect(Collectors.toList()));
    }

    @PostMapping("/statement-entries")
    public ResponseEntity<BankEntryResponse> importStatementEntry(@Valid @RequestBody StatementLineRequest request) {
        log.info("Received statement line {} for account {}", request.getTranId(), request.getAccountId());
        BankLedgerEntry entry = cashService.importStatementEntry(request.toStatementLine());
        return ResponseEntity.status(HttpStatus.CREATED).body(BankEntryResponse.from(entry));
    }

    @GetMapping("/statement-entries/{entryId}")
    public ResponseEntity<BankEntryResponse> getEntry(@PathVariable("entryId") UUID entryId) {
        return cashService.findEntry(entryId)
            .map(entry -> ResponseEntity.ok(BankEntryResponse.from(entry)))
            .orElseThrow(() -> new ResourceNotFoundException("Bank entry not found: " + entryId));
    }

    @PostMapping("/statement-entries/{entryId}/resolution")
    public ResponseEntity<BankEntryResponse> resolveFlagged(@PathVariable("entryId") UUID entryId,
                                                            @Valid @RequestBody ResolveFlaggedRequest request) {
        BankLedgerEntry entry = cashService.resolveFlagged(entryId, request.getCorrectedLine().toStatementLine(),
                request.getResolvedBy());
        return ResponseEntity.status(HttpStatus.CREATED).body(BankEntryResponse.from(entry));
    }

    @PostMapping("/statement-entries/{entryId}/approval")
    public ResponseEntity<BankEntryResponse> approve(@PathVariable("entryId") UUID entryId,
                                                     @Valid @RequestBody ApproveEntryRequest request) {
        return ResponseEntity.ok(BankEntryResponse.from(cashService.approve(entryId, request.getApprovedBy())));
    }

    @GetMapping("/unreconciled")
    public ResponseEntity<List<BankEntryResponse>> unreconciled(
            @RequestParam(value = "account_id", required = false) String accountId) {
        return ResponseEntity.ok(cashService.unreconciled(accountId).stream()
            .map(BankEntryResponse::from)
            .collect(Collectors.toList()));
    }
}
