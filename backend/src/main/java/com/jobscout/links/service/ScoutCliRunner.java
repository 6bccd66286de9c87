package com.jobscout.links.service;

import com.jobscout.config.ScoutProperties;
import com.jobscout.links.model.FoundJob;
import com.jobscout.links.model.PageScrapeSummary;
import com.jobscout.links.model.ScrapeRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class ScoutCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScoutCliRunner.class);

    private final ScoutProperties properties;
    private final ScrapeRunService scrapeRunService;
    private final ConfigurableApplicationContext applicationContext;

    public ScoutCliRunner(
        ScoutProperties properties,
        ScrapeRunService scrapeRunService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.scrapeRunService = scrapeRunService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        int exitCode = 0;
        try {
            ScrapeRunSummary summary = scrapeRunService.run(null);
            for (PageScrapeSummary page : summary.pages()) {
                log.info(
                    "Summary {}: links={}, newJobs={}, error={}",
                    page.sourcePageUrl(),
                    page.linksProcessed(),
                    page.newJobsFound(),
                    page.errorCode()
                );
            }
            for (FoundJob job : summary.newJobs()) {
                log.info("New job: {}", job.url());
            }
            if (!summary.newJobs().isEmpty() && !summary.saved()) {
                exitCode = 2;
            }
        } catch (TargetListUnavailableException e) {
            log.error("Cannot start scrape run: {}", e.getMessage());
            exitCode = 1;
        }

        if (properties.getCli().isExitAfterRun()) {
            int finalExitCode = exitCode;
            System.exit(SpringApplication.exit(applicationContext, () -> finalExitCode));
        }
    }
}
