package com.adsintel.optimizer.output;

import com.adsintel.optimizer.model.OptimizationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists run reports to the optimization_runs and keyword_decisions tables.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcReportWriter {

    static final int BATCH_SIZE = 1000;

    static final String INSERT_RUN = """
        INSERT INTO optimization_runs
        (run_id, campaign_id, strategy, window_days, dry_run, status, error_message, generated_at, keyword_count)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    static final String INSERT_DECISION = """
        INSERT INTO keyword_decisions
        (run_id, keyword, keyword_kind, action, reason, clicks, cost, conversion_count, conversion_value,
         avg_cpc, current_bid, new_bid, apply_status, apply_message)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring report schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS optimization_runs
            (
                run_id          VARCHAR(36)   NOT NULL PRIMARY KEY,
                campaign_id     VARCHAR(32)   NOT NULL,
                strategy        VARCHAR(16)   NOT NULL,
                window_days     INT           NOT NULL,
                dry_run         BOOLEAN       NOT NULL,
                status          VARCHAR(16)   NOT NULL,
                error_message   VARCHAR(1024),
                generated_at    TIMESTAMP     NOT NULL,
                keyword_count   INT           NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS keyword_decisions
            (
                run_id            VARCHAR(36)    NOT NULL,
                keyword           VARCHAR(512)   NOT NULL,
                keyword_kind      VARCHAR(16)    NOT NULL,
                action            VARCHAR(16),
                reason            VARCHAR(512),
                clicks            BIGINT         NOT NULL,
                cost              DECIMAL(18, 4) NOT NULL,
                conversion_count  BIGINT         NOT NULL,
                conversion_value  DECIMAL(18, 4) NOT NULL,
                avg_cpc           DECIMAL(18, 4) NOT NULL,
                current_bid       DECIMAL(18, 6),
                new_bid           DECIMAL(18, 6),
                apply_status      VARCHAR(16),
                apply_message     VARCHAR(1024)
            )
        """);

        log.info("Report schema ready.");
    }

    public void write(OptimizationReport report) {
        jdbcTemplate.update(INSERT_RUN,
                report.getRunId(),
                report.getCampaignId(),
                report.getStrategy() != null ? report.getStrategy().name() : null,
                report.getWindowDays(),
                report.isDryRun(),
                report.getStatus(),
                report.getErrorMessage(),
                Timestamp.valueOf(report.getGeneratedAt()),
                report.getRows().size());

        List<OptimizationReport.Row> rows = report.getRows();
        int total = rows.size();
        for (int i = 0; i < total; i += BATCH_SIZE) {
            List<OptimizationReport.Row> batch = rows.subList(i, Math.min(i + BATCH_SIZE, total));
            jdbcTemplate.batchUpdate(INSERT_DECISION, toArgs(report.getRunId(), batch));
            log.debug("Wrote decisions {}/{}", Math.min(i + BATCH_SIZE, total), total);
        }

        log.info("Stored report {} with {} keyword rows", report.getRunId(), total);
    }

    private List<Object[]> toArgs(String runId, List<OptimizationReport.Row> batch) {
        List<Object[]> args = new ArrayList<>(batch.size());
        for (OptimizationReport.Row r : batch) {
            args.add(new Object[]{
                    runId,
                    r.getKeyword(),
                    r.getKeywordKind(),
                    r.getAction() != null ? r.getAction().name() : null,
                    r.getReason(),
                    r.getClicks(),
                    r.getCost(),
                    r.getConversionCount(),
                    r.getConversionValue(),
                    r.getAverageCostPerClick(),
                    r.getCurrentBid(),
                    r.getNewBid(),
                    r.getApplyStatus(),
                    r.getApplyMessage()
            });
        }
        return args;
    }
}
