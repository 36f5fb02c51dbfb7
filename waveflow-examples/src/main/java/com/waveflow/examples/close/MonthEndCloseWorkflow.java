package com.waveflow.examples.close;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.waveflow.core.model.StepDefinition;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Month-end close workflow.
 *
 * Workflow Steps:
 * 1. data_sync - Import source system balances (rollback: remove them)
 * 2. validation - Check the imported data
 * 3. subledger_recon and intercompany_recon - Run in parallel
 * 4. accruals - Post accrual journals (rollback: reverse them)
 * 5. tb_review, then mgmt_review - Sequential reviews
 * 6. period_lock - Lock the period (rollback: reopen it)
 */
public final class MonthEndCloseWorkflow {

    public static final String WORKFLOW_TYPE = "month_end_close";

    // Step IDs
    public static final String STEP_DATA_SYNC = "data_sync";
    public static final String STEP_VALIDATION = "validation";
    public static final String STEP_SUBLEDGER_RECON = "subledger_recon";
    public static final String STEP_INTERCOMPANY_RECON = "intercompany_recon";
    public static final String STEP_ACCRUALS = "accruals";
    public static final String STEP_TB_REVIEW = "tb_review";
    public static final String STEP_MGMT_REVIEW = "mgmt_review";
    public static final String STEP_PERIOD_LOCK = "period_lock";

    private MonthEndCloseWorkflow() {
    }

    /**
     * Build the close steps for a period.
     */
    public static List<StepDefinition> createSteps(CloseActivities activities, String period) {
        List<StepDefinition> steps = new ArrayList<>();

        ObjectNode syncParams = periodParams(period);
        syncParams.putArray("entities").add("US01").add("UK02");
        ObjectNode balances = syncParams.putObject("balances");
        balances.put("cash", new BigDecimal("125000.00"));
        balances.put("receivables", new BigDecimal("48000.00"));
        balances.put("revenue", new BigDecimal("-173000.00"));

        steps.add(StepDefinition.builder(STEP_DATA_SYNC)
            .name("Sync source data")
            .action(activities::syncData)
            .rollbackAction(activities::unsyncData)
            .timeout(Duration.ofMinutes(5))
            .retryCount(2)
            .params(syncParams)
            .build());

        steps.add(StepDefinition.builder(STEP_VALIDATION)
            .name("Validate data")
            .action(activities::validateData)
            .dependsOn(STEP_DATA_SYNC)
            .params(periodParams(period))
            .build());

        steps.add(StepDefinition.builder(STEP_SUBLEDGER_RECON)
            .name("Subledger reconciliation")
            .action(activities::reconcileSubledger)
            .dependsOn(STEP_VALIDATION)
            .params(periodParams(period))
            .build());

        steps.add(StepDefinition.builder(STEP_INTERCOMPANY_RECON)
            .name("Intercompany reconciliation")
            .action(activities::reconcileIntercompany)
            .dependsOn(STEP_VALIDATION)
            .retryCount(3)
            .params(periodParams(period))
            .build());

        steps.add(StepDefinition.builder(STEP_ACCRUALS)
            .name("Post accruals")
            .action(activities::postAccruals)
            .rollbackAction(activities::reverseAccruals)
            .dependsOn(STEP_SUBLEDGER_RECON, STEP_INTERCOMPANY_RECON)
            .params(periodParams(period).put("accrualAmount", new BigDecimal("3500.00")))
            .build());

        steps.add(StepDefinition.builder(STEP_TB_REVIEW)
            .name("Trial balance review")
            .action(activities::reviewTrialBalance)
            .dependsOn(STEP_ACCRUALS)
            .sequential()
            .params(periodParams(period))
            .build());

        steps.add(StepDefinition.builder(STEP_MGMT_REVIEW)
            .name("Management review")
            .action(activities::managementReview)
            .dependsOn(STEP_ACCRUALS)
            .sequential()
            .params(periodParams(period).put("approver", "controller"))
            .build());

        steps.add(StepDefinition.builder(STEP_PERIOD_LOCK)
            .name("Lock period")
            .action(activities::lockPeriod)
            .rollbackAction(activities::unlockPeriod)
            .dependsOn(STEP_TB_REVIEW, STEP_MGMT_REVIEW)
            .params(periodParams(period))
            .build());

        return steps;
    }

    /**
     * Seed the ledger with subledger and intercompany figures matching the synced data.
     */
    public static CloseLedger sampleLedger() {
        CloseLedger ledger = new CloseLedger();
        ledger.setSubledgerBalance("receivables", new BigDecimal("48000.00"));
        ledger.setIntercompany("US01", new BigDecimal("12000.00"), new BigDecimal("12000.00"));
        ledger.setIntercompany("UK02", new BigDecimal("4500.00"), new BigDecimal("4500.00"));
        return ledger;
    }

    private static ObjectNode periodParams(String period) {
        return JsonNodeFactory.instance.objectNode().put("period", period);
    }
}
