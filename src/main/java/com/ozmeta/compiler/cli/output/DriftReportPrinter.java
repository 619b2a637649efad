package com.ozmeta.compiler.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ozmeta.compiler.drift.DriftFinding;
import com.ozmeta.compiler.drift.DriftReport;

public class DriftReportPrinter {

    private static final Logger log = LoggerFactory.getLogger(DriftReportPrinter.class);

    public void print(DriftReport report) {
        log.info("=================================================");
        log.info("DRIFT REPORT: {}", report.getTargetKey());
        log.info("=================================================");
        log.info("Objects Checked: {}", report.getObjectsChecked());
        if (!report.hasDrift()) {
            log.info("No drift detected");
            log.info("=================================================");
            return;
        }
        report.getCountsByKind().forEach((kind, count) -> log.warn("  {}: {}", kind, count));
        log.warn("");
        for (DriftFinding finding : report.getFindings()) {
            log.warn("  {}", finding);
        }
        log.info("=================================================");
    }
}
