package com.smurthy.ai.assistant.controllers;

import com.smurthy.ai.assistant.activity.ActivityLog;
import com.smurthy.ai.assistant.observability.PerformanceMetrics;
import com.smurthy.ai.assistant.reasoning.ReasoningDispatcher;
import com.smurthy.ai.assistant.reasoning.RuntimeConfig;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Monitoring endpoint
 */
@RestController
@RequestMapping("/monitoring")
class MonitoringController {

    private final ReasoningDispatcher dispatcher;
    private final ActivityLog activityLog;

    public MonitoringController(ReasoningDispatcher dispatcher, ActivityLog activityLog) {
        this.dispatcher = dispatcher;
        this.activityLog = activityLog;
    }

    @GetMapping("/metrics")
    public PerformanceMetrics.MetricsSummary getMetrics() {
        return dispatcher.getMetrics();
    }

    @PostMapping("/metrics/reset")
    public void resetMetrics() {
        dispatcher.resetMetrics();
    }

    @GetMapping("/config")
    public RuntimeConfig getConfig() {
        return dispatcher.getConfig();
    }

    @PatchMapping("/config")
    public RuntimeConfig updateConfig(@RequestBody Map<String, Object> changes) {
        return dispatcher.updateConfig(changes);
    }

    @GetMapping("/activity")
    public ActivityLog.Snapshot getActivity() {
        return activityLog.snapshot();
    }
}
