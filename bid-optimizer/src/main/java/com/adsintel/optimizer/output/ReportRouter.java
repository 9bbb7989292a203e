package com.adsintel.optimizer.output;

import com.adsintel.optimizer.config.BidOptimizerProperties;
import com.adsintel.optimizer.model.OptimizationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Routes reports to the configured sink(s): DATABASE, CSV or BOTH.
 * A failing sink is logged and never fails the run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReportRouter implements ReportSink {

    private final JdbcReportWriter jdbcReportWriter;
    private final CsvReportWriter csvReportWriter;
    private final BidOptimizerProperties properties;

    @Override
    public void write(OptimizationReport report) {
        BidOptimizerProperties.Output.OutputMode mode = properties.getOutput().getMode();

        switch (mode) {
            case DATABASE -> toDatabase(report);
            case CSV -> toCsv(report);
            case BOTH -> {
                toDatabase(report);
                toCsv(report);
            }
        }
    }

    private void toDatabase(OptimizationReport report) {
        try {
            jdbcReportWriter.write(report);
        } catch (Exception e) {
            log.warn("Failed to store report {} in database: {}", report.getRunId(), e.getMessage());
        }
    }

    private void toCsv(OptimizationReport report) {
        try {
            csvReportWriter.write(report);
        } catch (Exception e) {
            log.warn("Failed to write report {} as CSV: {}", report.getRunId(), e.getMessage());
        }
    }
}
