package com.sentiment_retraining.service.drift;

import com.sentiment_retraining.config.PipelineSettings;
import com.sentiment_retraining.exception.FileProcessingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

@Component
@RequiredArgsConstructor
@Slf4j
public class DriftReportWriter {

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final PipelineSettings settings;

    public String write(DriftReport report) {
        File file = new File(settings.getReportsPath(), "drift_report_" + LocalDateTime.now().format(FILE_STAMP) + ".html");
        try {
            FileUtils.writeStringToFile(file, render(report), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FileProcessingException("Failed to write drift report to " + file, e);
        }
        log.info("📝 Drift report saved to: {}", file);
        return file.getPath();
    }

    String render(DriftReport report) {
        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n<html><head><meta charset=\"utf-8\"><title>Drift report</title></head><body>\n");
        html.append("<h1>Drift report</h1>\n");
        html.append("<h2>Data drift on '").append(HtmlUtils.htmlEscape(report.textColumn())).append("'</h2>\n<table>\n");
        row(html, "Reference rows", String.valueOf(report.referenceRows()));
        row(html, "Current rows", String.valueOf(report.currentRows()));
        row(html, "Domain classifier ROC AUC", number(report.domainAuc()));
        row(html, "AUC threshold", number(report.aucThreshold()));
        row(html, "Data drift detected", String.valueOf(report.driftDetected()));
        html.append("</table>\n<h2>Classification quality</h2>\n<table>\n");
        row(html, "Reference accuracy", number(report.referenceAccuracy()));
        row(html, "Current accuracy", number(report.currentAccuracy()));
        row(html, "Accuracy drop", number(report.referenceAccuracy() - report.currentAccuracy()));
        row(html, "Degradation threshold", number(report.degradationThreshold()));
        row(html, "Performance degraded", String.valueOf(report.performanceDegraded()));
        html.append("</table>\n</body></html>\n");
        return html.toString();
    }

    private static void row(StringBuilder html, String label, String value) {
        html.append("<tr><th>").append(label).append("</th><td>").append(HtmlUtils.htmlEscape(value)).append("</td></tr>\n");
    }

    private static String number(double value) {
        return Double.isNaN(value) ? "n/a" : String.format(Locale.ROOT, "%.4f", value);
    }
}
