package com.flagship.balance_ledger.balance;

import com.flagship.balance_ledger.transaction.TransactionOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;

import static com.flagship.balance_ledger.TestAccounts.newAccountId;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@SpringBootTest(properties = {
        "ledger.reconciliation.enabled=true",
        "ledger.reconciliation.initial-delay-ms=3600000",
        "ledger.reconciliation.batch-size=2"
})
class ReconciliationSchedulerTest {

    @Autowired
    private ReconciliationScheduler scheduler;

    @Autowired
    private TransactionOrchestrator orchestrator;

    @SpyBean
    private BalanceReader balanceReader;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    @DisplayName("A run walks every page of accounts and counts drifted ones")
    void runFindsDrift() {
        long healthy = newAccountId();
        long drifted = newAccountId();
        orchestrator.credit(healthy, new BigDecimal("10"));
        orchestrator.credit(drifted, new BigDecimal("10"));
        jdbcTemplate.update("UPDATE balances SET amount = 99 WHERE account_id = ?", drifted);

        ReconciliationRunSummary summary = scheduler.runOnce();

        assertTrue(summary.getMismatches() >= 1, "Drifted account should be reported");
        assertTrue(summary.getChecked() >= 2);
        assertTrue(balanceReader.reconcile(healthy).isConsistent());
        assertFalse(balanceReader.reconcile(drifted).isConsistent());
    }

    @Test
    @DisplayName("Scheduled entry point never throws")
    void scheduledRunIsSafe() {
        assertDoesNotThrow(() -> scheduler.reconcileAllAccounts());
    }

    @Test
    @DisplayName("An account whose check fails is skipped and the run continues")
    void failingAccountDoesNotStopRun() {
        long first = newAccountId();
        long failing = newAccountId();
        long last = newAccountId();
        orchestrator.credit(first, new BigDecimal("10"));
        orchestrator.credit(failing, new BigDecimal("10"));
        orchestrator.credit(last, new BigDecimal("10"));
        doThrow(new QueryTimeoutException("simulated lock timeout"))
                .when(balanceReader).reconcile(failing);

        ReconciliationRunSummary summary = scheduler.runOnce();

        assertTrue(summary.getFailures() >= 1, "Failed account should be counted");
        verify(balanceReader).reconcile(first);
        verify(balanceReader).reconcile(failing);
        verify(balanceReader).reconcile(last);
        assertDoesNotThrow(() -> scheduler.reconcileAllAccounts());
    }
}
