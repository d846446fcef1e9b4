package com.testops.publisher.confluence;

import com.testops.publisher.summary.OverallStatus;
import com.testops.publisher.summary.TestSummary;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Title and storage-format body of a published report page.
 *
 * Only the summary block and the attachment links are generated here; the
 * report documents themselves are produced by an earlier CI stage.
 */
public final class ReportPage {

    private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    // ':' is not allowed in page titles
    private static final DateTimeFormatter TITLE   = DateTimeFormatter.ofPattern("yyyy-MM-dd HH-mm-ss");

    private final String              titlePrefix;
    private final int                 version;
    private final TestSummary         summary;
    private final LocalDateTime       timestamp;
    private final Map<String, String> links = new LinkedHashMap<>();

    public ReportPage(String titlePrefix, int version, TestSummary summary, LocalDateTime timestamp) {
        this.titlePrefix = titlePrefix;
        this.version     = version;
        this.summary     = summary;
        this.timestamp   = timestamp;
    }

    /** e.g. {@code Test Result Report v7 (PASS) - 2026-10-19 14-03-22} */
    public String title() {
        return titlePrefix + " v" + version + " (" + summary.overallStatus() + ") - " + TITLE.format(timestamp);
    }

    public ReportPage addLink(String fileName, String url) {
        links.put(fileName, url);
        return this;
    }

    public String body() {
        OverallStatus status = summary.overallStatus();
        String color = switch (status) {
            case PASS    -> "green";
            case FAIL    -> "red";
            case UNKNOWN -> "grey";
        };
        StringBuilder sb = new StringBuilder();
        sb.append("<h2>Test Report v").append(version).append("</h2>\n");
        sb.append("<p><b>Date:</b> ").append(DISPLAY.format(timestamp)).append("</p>\n");
        sb.append("<p><b>Status:</b> <span style=\"color:").append(color)
          .append(";font-weight:bold\">").append(status).append("</span></p>\n");
        sb.append("<p><b>Summary:</b> ").append(escape(summary.describe())).append("</p>\n");
        if (links.isEmpty()) {
            sb.append("<p>Attachments are available below.</p>\n");
        } else {
            sb.append("<h3>Attachments</h3>\n");
            links.forEach((name, url) ->
                    sb.append("<p><a href=\"").append(escape(url)).append("\">")
                      .append(escape(name)).append("</a></p>\n"));
        }
        return sb.toString();
    }

    static String escape(String s) {
        return s.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }
}
