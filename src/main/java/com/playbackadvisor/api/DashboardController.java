package com.playbackadvisor.api;

import com.playbackadvisor.dashboard.DashboardService;
import com.playbackadvisor.dashboard.DashboardSummary;
import com.playbackadvisor.model.PlaybackOutcome;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/dashboard")
public class DashboardController {

    private final DashboardService dashboardService;

    public DashboardController(DashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    @GetMapping("/outcomes")
    public List<PlaybackOutcome> outcomes(@RequestParam(defaultValue = "24") int hours) {
        return dashboardService.recentOutcomes(hours);
    }

    @GetMapping("/summary")
    public DashboardSummary summary() {
        return dashboardService.summary();
    }
}
