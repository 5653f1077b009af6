package com.phillippitts.wfmparity.presentation.controller;

import com.phillippitts.wfmparity.domain.OperatorAlert;
import com.phillippitts.wfmparity.repository.OperatorAlertRepository;
import com.phillippitts.wfmparity.service.maintenance.CleanupSummary;
import com.phillippitts.wfmparity.service.maintenance.RetentionCleanupService;
import com.phillippitts.wfmparity.service.mining.FailurePatternMiner;
import com.phillippitts.wfmparity.service.mining.MiningSummary;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Manual triggers for the scheduled batches, and the operator alert queue.
 */
@RestController
class MaintenanceController {

    private static final int MAX_ALERTS = 500;

    private final FailurePatternMiner miner;
    private final RetentionCleanupService cleanup;
    private final OperatorAlertRepository alerts;

    MaintenanceController(FailurePatternMiner miner, RetentionCleanupService cleanup, OperatorAlertRepository alerts) {
        this.miner = miner;
        this.cleanup = cleanup;
        this.alerts = alerts;
    }

    @PostMapping("/api/v1/maintenance/mine")
    MiningSummary mine() {
        return miner.mine();
    }

    @PostMapping("/api/v1/maintenance/cleanup")
    CleanupSummary cleanup() {
        return cleanup.cleanup();
    }

    /**
     * Unacknowledged alerts, newest first.
     */
    @GetMapping("/api/v1/operator-alerts")
    List<OperatorAlert> operatorAlerts(@RequestParam(name = "limit", defaultValue = "50") int limit) {
        return alerts.findOpen(Math.max(1, Math.min(limit, MAX_ALERTS)));
    }

    @PostMapping("/api/v1/operator-alerts/{id}/acknowledge")
    ResponseEntity<Void> acknowledge(@PathVariable("id") UUID id) {
        return alerts.acknowledge(id) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }
}
