package com.waveflow.examples.close;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.waveflow.core.event.WorkflowEventBus;
import com.waveflow.engine.event.InMemoryWorkflowEventBus;
import com.waveflow.engine.executor.WorkflowExecutor;
import com.waveflow.engine.json.WorkflowJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.Arrays;
import java.util.List;

/**
 * Command-line runner for the month-end close.
 *
 * Options:
 * <pre>
 * --period=2024-01          period to close (default 2024-01)
 * --flaky-intercompany      fail intercompany confirmation twice before it succeeds
 * --reject-review           reject management review, forcing a rollback
 * </pre>
 */
@SpringBootApplication
public class MonthEndCloseApplication implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(MonthEndCloseApplication.class);

    static final String DEFAULT_PERIOD = "2024-01";

    private final WorkflowExecutor executor;
    private final WorkflowEventBus eventBus;
    private final WorkflowJson json;
    private final CloseActivities activities;

    public MonthEndCloseApplication(
            WorkflowExecutor executor,
            WorkflowEventBus eventBus,
            WorkflowJson json,
            CloseActivities activities) {
        this.executor = executor;
        this.eventBus = eventBus;
        this.json = json;
        this.activities = activities;
    }

    public static void main(String[] args) {
        SpringApplication.run(MonthEndCloseApplication.class, args);
    }

    @Bean
    static CloseActivities closeActivities() {
        return new CloseActivities(MonthEndCloseWorkflow.sampleLedger());
    }

    @Override
    public void run(String... args) {
        List<String> options = Arrays.asList(args);
        if (options.contains("--flaky-intercompany")) {
            activities.failIntercompanyConfirmation(2);
        }
        if (options.contains("--reject-review")) {
            activities.rejectManagementReview("Accruals not supported by evidence");
        }
        String period = options.stream()
            .filter(o -> o.startsWith("--period="))
            .map(o -> o.substring("--period=".length()))
            .findFirst()
            .orElse(DEFAULT_PERIOD);

        if (eventBus instanceof InMemoryWorkflowEventBus) {
            ((InMemoryWorkflowEventBus) eventBus).subscribePattern("workflow:rollback:*", event ->
                log.info("Rollback event {}: {}", event.type().value(), event.reason()));
        }
        executor.setProgressCallback((stepId, result) ->
            log.info("Step {} -> {}", stepId, result.status().value()));

        MonthEndClose.Outcome outcome = new MonthEndClose(executor, activities).close(period);

        ObjectNode report = json.toJson(outcome.execution());
        if (outcome.rolledBack()) {
            report.set("rollback", json.toJson(outcome.rollback()));
        }
        log.info("Close result:{}{}", System.lineSeparator(), json.writePretty(report));
    }
}
