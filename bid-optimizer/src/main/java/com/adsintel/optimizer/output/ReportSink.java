package com.adsintel.optimizer.output;

import com.adsintel.optimizer.model.OptimizationReport;

/**
 * Destination for finished run reports. Fire-and-forget from the run's point of view.
 */
public interface ReportSink {

    void write(OptimizationReport report);
}
