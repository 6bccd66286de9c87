package com.jobscout.links.api;

import com.jobscout.links.model.FoundJob;
import com.jobscout.links.model.LinkDecision;
import com.jobscout.links.model.ScrapeRunSummary;
import com.jobscout.links.service.ScrapeRunService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;
import static org.springframework.http.HttpStatus.SERVICE_UNAVAILABLE;

@RestController
@RequestMapping("/api")
public class ScoutController {
    private final ScrapeRunService scrapeRunService;

    public ScoutController(ScrapeRunService scrapeRunService) {
        this.scrapeRunService = scrapeRunService;
    }

    @PostMapping("/runs")
    public ScrapeRunSummary startRun(@RequestBody(required = false) ScoutApiRunRequest request) {
        return scrapeRunService.run(request == null ? null : request.targets());
    }

    @GetMapping("/runs/latest")
    public ScrapeRunSummary latestRun() {
        return scrapeRunService.latestSummary()
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "no scrape run has completed yet"));
    }

    @GetMapping("/jobs")
    public List<FoundJob> jobs() {
        try {
            return scrapeRunService.currentJobs();
        } catch (IOException e) {
            throw new ResponseStatusException(SERVICE_UNAVAILABLE, "found-jobs list is unreadable", e);
        }
    }

    @PostMapping("/links/classify")
    public List<LinkDecision> classifyLinks(@RequestBody ClassifyLinksRequest request) {
        if (request == null || request.links() == null || request.links().isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "links must not be empty");
        }
        return scrapeRunService.dryRun(request.links());
    }
}
