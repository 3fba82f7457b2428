package com.flagship.balance_ledger.balance;

import com.flagship.balance_ledger.exception.ValidationException;
import com.flagship.balance_ledger.ledger.AccountBalance;
import com.flagship.balance_ledger.ledger.BalanceHistoryEntry;
import com.flagship.balance_ledger.observability.LedgerMetrics;
import com.flagship.balance_ledger.transaction.TransactionOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static com.flagship.balance_ledger.TestAccounts.newAccountId;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Balance reads: current balance, history, point-in-time and reconciliation.
 */
@SpringBootTest
class BalanceReaderTest {

    @Autowired
    private BalanceReader balanceReader;

    @Autowired
    private TransactionOrchestrator orchestrator;

    @Autowired
    private LedgerMetrics ledgerMetrics;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ApplicationContext applicationContext;

    private long accountId;

    @BeforeEach
    void setUp() {
        accountId = newAccountId();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private static void pause() {
        try {
            Thread.sleep(15);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    @Nested
    @DisplayName("Current balance")
    class CurrentBalance {

        @Test
        @DisplayName("Unknown account reads as zero and gets a persisted row")
        void unknownAccountIsZero() {
            printTestHeader("Unknown Account Balance");

            AccountBalance balance = balanceReader.getBalance(accountId);
            printOutput("Balance", balance);

            assertEquals(accountId, balance.getAccountId());
            assertEquals(0, balance.getAmount().signum());
            assertNotNull(balance.getLastUpdatedAt());

            Integer rows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM balances WHERE account_id = ?", Integer.class, accountId);
            assertEquals(1, rows);
        }

        @Test
        @DisplayName("Non-positive account id is rejected")
        void invalidAccountId() {
            assertThrows(ValidationException.class, () -> balanceReader.getBalance(0));
            assertThrows(ValidationException.class, () -> balanceReader.getHistory(-1, null, null));
        }
    }

    @Nested
    @DisplayName("History")
    class History {

        @Test
        @DisplayName("History is newest first and paginates")
        void historyOrderAndPaging() {
            orchestrator.credit(accountId, new BigDecimal("10"));
            orchestrator.credit(accountId, new BigDecimal("20"));
            orchestrator.debit(accountId, new BigDecimal("5"));

            List<BalanceHistoryEntry> all = balanceReader.getHistory(accountId, null, null);
            assertEquals(3, all.size());
            assertEquals(0, new BigDecimal("25").compareTo(all.get(0).getResultingBalance()));
            assertEquals(0, new BigDecimal("-5").compareTo(all.get(0).getChangeAmount()));
            assertEquals(0, new BigDecimal("10").compareTo(all.get(2).getResultingBalance()));

            List<BalanceHistoryEntry> page = balanceReader.getHistory(accountId, 1, 1);
            assertEquals(1, page.size());
            assertEquals(all.get(1).getId(), page.get(0).getId());

            assertTrue(balanceReader.getHistory(accountId, 10, 3).isEmpty());
        }

        @Test
        @DisplayName("Invalid pagination is rejected")
        void invalidPagination() {
            assertThrows(ValidationException.class, () -> balanceReader.getHistory(accountId, 0, 0));
            assertThrows(ValidationException.class, () -> balanceReader.getHistory(accountId, 10, -1));
        }

        @Test
        @DisplayName("Balance at a point in time follows the latest entry at or before it")
        void balanceAtTime() {
            printTestHeader("Point-in-time Balance");

            orchestrator.credit(accountId, new BigDecimal("100"));
            pause();
            orchestrator.credit(accountId, new BigDecimal("50"));
            pause();
            orchestrator.debit(accountId, new BigDecimal("30"));

            List<BalanceHistoryEntry> history = balanceReader.getHistory(accountId, null, null);
            Instant t1 = history.get(2).getCreatedAt();
            Instant t2 = history.get(1).getCreatedAt();
            Instant t3 = history.get(0).getCreatedAt();
            printOutput("t1", t1);
            printOutput("t2", t2);
            printOutput("t3", t3);
            assertTrue(t1.isBefore(t2) && t2.isBefore(t3));

            assertEquals(0, balanceReader.getBalanceAtTime(accountId, t1.minus(1, ChronoUnit.MILLIS)).signum());
            assertEquals(0, new BigDecimal("100").compareTo(balanceReader.getBalanceAtTime(accountId, t1)));
            assertEquals(0, new BigDecimal("150").compareTo(balanceReader.getBalanceAtTime(accountId, t2)));
            assertEquals(0, new BigDecimal("150").compareTo(
                    balanceReader.getBalanceAtTime(accountId, t3.minus(1, ChronoUnit.MILLIS))));
            assertEquals(0, new BigDecimal("120").compareTo(balanceReader.getBalanceAtTime(accountId, t3)));
            assertEquals(0, new BigDecimal("120").compareTo(
                    balanceReader.getBalanceAtTime(accountId, Instant.now().plus(1, ChronoUnit.DAYS))));
        }

        @Test
        @DisplayName("Point-in-time query without a timestamp is rejected")
        void balanceAtTimeRequiresTimestamp() {
            ValidationException e = assertThrows(ValidationException.class,
                    () -> balanceReader.getBalanceAtTime(accountId, null));
            assertEquals("timestamp", e.getField());
        }
    }

    @Nested
    @DisplayName("Reconciliation")
    class Reconciliation {

        @Test
        @DisplayName("Balance built through the ledger reconciles")
        void consistentAfterOperations() {
            orchestrator.credit(accountId, new BigDecimal("70.1234"));
            orchestrator.debit(accountId, new BigDecimal("0.1234"));

            ReconciliationResult result = balanceReader.reconcile(accountId);

            assertTrue(result.isConsistent());
            assertEquals(0, result.getDiscrepancy().signum());
            assertEquals(0, new BigDecimal("70").compareTo(balanceReader.calculateBalanceFromHistory(accountId)));
        }

        @Test
        @DisplayName("Drift between balance and history is detected, not corrected")
        void driftDetected() {
            printTestHeader("Reconciliation Drift");
            orchestrator.credit(accountId, new BigDecimal("40"));
            double mismatchesBefore = ledgerMetrics.reconciliationMismatchCount();

            // Simulate an out-of-band write that bypassed the ledger.
            jdbcTemplate.update("UPDATE balances SET amount = amount + 5 WHERE account_id = ?", accountId);

            ReconciliationResult result = balanceReader.reconcile(accountId);
            printOutput("Result", result);

            assertFalse(result.isConsistent());
            assertEquals(0, new BigDecimal("45").compareTo(result.getStoredBalance()));
            assertEquals(0, new BigDecimal("40").compareTo(result.getHistoryBalance()));
            assertEquals(0, new BigDecimal("5").compareTo(result.getDiscrepancy()));
            assertEquals(mismatchesBefore + 1, ledgerMetrics.reconciliationMismatchCount());

            assertEquals(0, new BigDecimal("45").compareTo(balanceReader.getBalance(accountId).getAmount()),
                    "Reconciliation must not rewrite the balance");
        }

        @Test
        @DisplayName("Scheduler is off unless enabled")
        void schedulerDisabledByDefault() {
            assertNull(applicationContext.getBeanProvider(ReconciliationScheduler.class).getIfAvailable());
        }
    }
}
