package com.adsintel.optimizer.output;

import com.adsintel.optimizer.config.BidOptimizerProperties;
import com.adsintel.optimizer.model.OptimizationReport;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.format.DateTimeFormatter;

/**
 * Writes run reports to CSV files.
 *
 * Output path pattern: {outputDir}/bids_{campaignId}_{yyyyMMdd-HHmmss}.csv
 * e.g. /data/reports/bids_1234567890_20240115-040000.csv
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvReportWriter {

    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    static final String[] HEADERS = {
            "run_id", "campaign_id", "strategy", "dry_run",
            "keyword", "keyword_kind", "action", "reason",
            "clicks", "cost", "conversion_count", "conversion_value", "avg_cpc",
            "current_bid", "new_bid", "apply_status", "apply_message"
    };

    private final BidOptimizerProperties properties;

    public Path write(OptimizationReport report) {
        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);

        String filename = String.format("bids_%s_%s.csv", report.getCampaignId(), report.getGeneratedAt().format(FILE_TS));
        Path outputPath = outputDir.resolve(filename);

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }

            for (OptimizationReport.Row r : report.getRows()) {
                writer.writeNext(toRow(report, r));
            }

            log.info("Written {} keyword rows to CSV: {}", report.getRows().size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new RuntimeException("CSV write failed", e);
        }
    }

    private String[] toRow(OptimizationReport report, OptimizationReport.Row r) {
        return new String[]{
                str(report.getRunId()),
                str(report.getCampaignId()),
                str(report.getStrategy()),
                str(report.isDryRun()),
                str(r.getKeyword()),
                str(r.getKeywordKind()),
                str(r.getAction()),
                str(r.getReason()),
                str(r.getClicks()),
                money(r.getCost()),
                str(r.getConversionCount()),
                money(r.getConversionValue()),
                money(r.getAverageCostPerClick()),
                str(r.getCurrentBid() != null ? r.getCurrentBid().toPlainString() : null),
                str(r.getNewBid() != null ? r.getNewBid().toPlainString() : null),
                str(r.getApplyStatus()),
                str(r.getApplyMessage())
        };
    }

    private String money(BigDecimal val) {
        return val == null ? "" : val.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Cannot create output directory: " + dir, e);
        }
    }
}
