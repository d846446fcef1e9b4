package com.testops.publisher.confluence;

import com.testops.publisher.summary.TestSummary;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class ReportPageTest {

    private static final LocalDateTime AT = LocalDateTime.of(2024, 5, 1, 14, 3, 22);

    @Test
    void title_carriesVersionStatusAndColonFreeTimestamp() {
        ReportPage page = new ReportPage("Test Result Report", 7, TestSummary.of(10, 0, 0, 1), AT);

        assertThat(page.title()).isEqualTo("Test Result Report v7 (PASS) - 2024-05-01 14-03-22");
    }

    @Test
    void body_colorsStatus() {
        assertThat(new ReportPage("R", 1, TestSummary.of(1, 1, 0, 0), AT).body()).contains("color:red");
        assertThat(new ReportPage("R", 1, TestSummary.of(1, 0, 0, 0), AT).body()).contains("color:green");
        assertThat(new ReportPage("R", 1, TestSummary.unavailable(), AT).body())
                .contains("color:grey")
                .contains("No test output found");
    }

    @Test
    void body_withoutLinks_pointsBelow() {
        String body = new ReportPage("R", 2, TestSummary.of(3, 0, 0, 0), AT).body();

        assertThat(body).contains("Attachments are available below.");
        assertThat(body).contains("<b>Date:</b> 2024-05-01 14:03:22");
    }

    @Test
    void body_listsLinksEscaped() {
        ReportPage page = new ReportPage("R", 2, TestSummary.of(3, 0, 0, 0), AT)
                .addLink("r_v2.pdf", "https://wiki/download/attachments/9/r_v2.pdf?a=1&b=2");

        assertThat(page.body())
                .contains("<h3>Attachments</h3>")
                .contains("href=\"https://wiki/download/attachments/9/r_v2.pdf?a=1&amp;b=2\"")
                .doesNotContain("available below");
    }

    @Test
    void escape_handlesMarkup() {
        assertThat(ReportPage.escape("<a href=\"x\">&</a>"))
                .isEqualTo("&lt;a href=&quot;x&quot;&gt;&amp;&lt;/a&gt;");
    }
}
