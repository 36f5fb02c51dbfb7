package com.waveflow.examples.close;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.waveflow.core.step.StepContext;
import com.waveflow.core.step.StepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Step and rollback actions of the month-end close, run against a {@link CloseLedger}.
 *
 * These activities demonstrate:
 * - Transient failures that succeed on retry (intercompany confirmation)
 * - Permanent failures that stop the close (review rejection)
 * - Rollback of steps with side effects on the ledger
 * - Passing figures between steps through the workflow state
 */
public class CloseActivities {

    private static final Logger log = LoggerFactory.getLogger(CloseActivities.class);

    public static final String ERROR_SUBLEDGER_VARIANCE = "SUBLEDGER_VARIANCE";
    public static final String ERROR_INTERCOMPANY_UNAVAILABLE = "INTERCOMPANY_UNAVAILABLE";
    public static final String ERROR_INTERCOMPANY_MISMATCH = "INTERCOMPANY_MISMATCH";
    public static final String ERROR_OUT_OF_BALANCE = "TRIAL_BALANCE_OUT_OF_BALANCE";
    public static final String ERROR_REVIEW_REJECTED = "REVIEW_REJECTED";

    public static final String STATE_ENTITIES_SYNCED = "entities_synced";
    public static final String STATE_ACCOUNTS_VALIDATED = "accounts_validated";
    public static final String STATE_SUBLEDGER_VARIANCE = "subledger_variance";
    public static final String STATE_INTERCOMPANY_VARIANCE = "intercompany_variance";
    public static final String STATE_ACCRUAL_TOTAL = "accrual_total";
    public static final String STATE_TRIAL_BALANCE = "trial_balance";

    static final String SOURCE_DATA_SYNC = "data_sync";
    static final String SOURCE_ACCRUALS = "accruals";

    private final CloseLedger ledger;

    // Failure simulation
    private final AtomicInteger intercompanyAttempts = new AtomicInteger(0);
    private volatile int intercompanyFailures = 0;
    private volatile String reviewRejection;

    public CloseActivities(CloseLedger ledger) {
        this.ledger = ledger;
    }

    public CloseLedger getLedger() {
        return ledger;
    }

    /**
     * Make the intercompany confirmation fail the given number of times before succeeding.
     */
    public void failIntercompanyConfirmation(int times) {
        intercompanyAttempts.set(0);
        intercompanyFailures = times;
    }

    /**
     * Make management review reject the close with the given reason.
     */
    public void rejectManagementReview(String reason) {
        reviewRejection = reason;
    }

    public void resetFailures() {
        intercompanyAttempts.set(0);
        intercompanyFailures = 0;
        reviewRejection = null;
    }

    // ========== Step Actions ==========

    /**
     * Import source system balances into the ledger.
     */
    public JsonNode syncData(StepContext ctx) {
        String period = period(ctx);
        Map<String, BigDecimal> balances = new LinkedHashMap<>();
        ctx.getParams().path("balances").fields()
            .forEachRemaining(e -> balances.put(e.getKey(), e.getValue().decimalValue()));
        ledger.importBalances(period, balances);

        int entities = ctx.getParams().path("entities").size();
        ctx.getState().put(STATE_ENTITIES_SYNCED, entities);
        log.info("Synced {} balance(s) from {} entities for {}", balances.size(), entities, period);

        ObjectNode output = ctx.newOutput();
        output.put("period", period);
        output.put("accounts", balances.size());
        output.put("syncedAt", Instant.now().toString());
        return output;
    }

    public void unsyncData(JsonNode params) {
        int removed = ledger.reverse(params.path("period").asText(), SOURCE_DATA_SYNC);
        log.info("Removed {} imported balance(s)", removed);
    }

    /**
     * Check that imported data is present for the period.
     */
    public JsonNode validateData(StepContext ctx) throws StepException {
        String period = period(ctx);
        int accounts = ledger.journals(period).size();
        if (accounts == 0) {
            throw StepException.permanent("NO_DATA", "No balances imported for " + period);
        }
        ctx.getState().put(STATE_ACCOUNTS_VALIDATED, accounts);
        return ctx.newOutput().put("accounts", accounts).put("valid", true);
    }

    /**
     * Compare subledger balances with the general ledger.
     */
    public JsonNode reconcileSubledger(StepContext ctx) throws StepException {
        String period = period(ctx);
        BigDecimal variance = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> entry : ledger.subledgerBalances().entrySet()) {
            BigDecimal difference = entry.getValue().subtract(ledger.balance(period, entry.getKey()));
            if (difference.signum() != 0) {
                log.warn("Subledger variance of {} on account {}", difference, entry.getKey());
            }
            variance = variance.add(difference.abs());
        }
        if (variance.signum() != 0) {
            throw StepException.permanent(ERROR_SUBLEDGER_VARIANCE, "Subledger variance of " + variance.toPlainString());
        }
        ctx.getState().put(STATE_SUBLEDGER_VARIANCE, variance.toPlainString());
        return ctx.newOutput().put("variance", variance).put("reconciled", true);
    }

    /**
     * Confirm intercompany balances with counterparties.
     */
    public JsonNode reconcileIntercompany(StepContext ctx) throws StepException {
        int attempt = intercompanyAttempts.incrementAndGet();
        if (attempt <= intercompanyFailures) {
            log.warn("SIMULATED FAILURE: intercompany confirmation unavailable (attempt {})", attempt);
            throw StepException.transientFailure(ERROR_INTERCOMPANY_UNAVAILABLE,
                "Counterparty confirmation service unavailable");
        }
        BigDecimal difference = ledger.intercompanyDifference();
        if (difference.signum() != 0) {
            throw StepException.permanent(ERROR_INTERCOMPANY_MISMATCH,
                "Intercompany out by " + difference.toPlainString());
        }
        ctx.getState().put(STATE_INTERCOMPANY_VARIANCE, difference.toPlainString());
        return ctx.newOutput().put("difference", difference).put("confirmedOnAttempt", ctx.getAttemptNumber());
    }

    /**
     * Post the period's accrual journals.
     */
    public JsonNode postAccruals(StepContext ctx) {
        String period = period(ctx);
        BigDecimal amount = ctx.getParams().path("accrualAmount").decimalValue();
        CloseLedger.Journal expense = ledger.post(period, SOURCE_ACCRUALS, "accrued_expenses", amount);
        CloseLedger.Journal liability = ledger.post(period, SOURCE_ACCRUALS, "accrued_liabilities", amount.negate());
        ctx.getState().put(STATE_ACCRUAL_TOTAL, amount.toPlainString());
        log.info("Posted accruals {} and {} for {}", expense.journalId(), liability.journalId(), amount);

        ObjectNode output = ctx.newOutput();
        output.putArray("journals").add(expense.journalId()).add(liability.journalId());
        output.put("amount", amount);
        return output;
    }

    public void reverseAccruals(JsonNode params) {
        int removed = ledger.reverse(params.path("period").asText(), SOURCE_ACCRUALS);
        log.info("Reversed {} accrual journal(s)", removed);
    }

    /**
     * Check that the trial balance nets to zero.
     */
    public JsonNode reviewTrialBalance(StepContext ctx) throws StepException {
        String period = period(ctx);
        BigDecimal total = ledger.trialBalance(period);
        if (total.signum() != 0) {
            throw StepException.permanent(ERROR_OUT_OF_BALANCE,
                "Trial balance out of balance by " + total.toPlainString());
        }
        ctx.getState().put(STATE_TRIAL_BALANCE, total.toPlainString());
        return ctx.newOutput().put("balanced", true).put("journals", ledger.journals(period).size());
    }

    public JsonNode managementReview(StepContext ctx) throws StepException {
        String rejection = reviewRejection;
        if (rejection != null) {
            throw StepException.permanent(ERROR_REVIEW_REJECTED, rejection);
        }
        String accruals = ctx.getState().getText(STATE_ACCRUAL_TOTAL, "0");
        return ctx.newOutput()
            .put("approved", true)
            .put("approver", ctx.getParam("approver", "controller"))
            .put("accrualsReviewed", accruals);
    }

    public JsonNode lockPeriod(StepContext ctx) {
        String period = period(ctx);
        ledger.lock(period);
        log.info("Locked period {}", period);
        return ctx.newOutput().put("period", period).put("locked", true);
    }

    public void unlockPeriod(JsonNode params) {
        String period = params.path("period").asText();
        ledger.unlock(period);
        log.info("Reopened period {}", period);
    }

    private static String period(StepContext ctx) {
        return ctx.getParam("period", "");
    }
}
