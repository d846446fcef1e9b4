package com.testops.publisher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CI publishing tool. Runs one stage (see {@link com.testops.publisher.cli.StageRunner})
 * and exits with its exit code.
 *
 * To run:
 *   JIRA_URL=... JIRA_USER=... JIRA_API_TOKEN=... \
 *   java -jar publisher.jar attach-reports --pdf=report/r_v3.pdf --html=report/r_v3.html
 */
@SpringBootApplication
public class PublisherApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PublisherApplication.class, args)));
    }
}
