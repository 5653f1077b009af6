package com.phillippitts.wfmparity.presentation.controller;

import com.phillippitts.wfmparity.domain.AccuracySummary;
import com.phillippitts.wfmparity.domain.DataQualityIssue;
import com.phillippitts.wfmparity.domain.DeviationPattern;
import com.phillippitts.wfmparity.domain.RollingConfidence;
import com.phillippitts.wfmparity.domain.TrackingOutcome;
import com.phillippitts.wfmparity.presentation.dto.DataQualityIssueRequest;
import com.phillippitts.wfmparity.presentation.dto.TrackRequest;
import com.phillippitts.wfmparity.service.accuracy.AccuracyTracker;
import com.phillippitts.wfmparity.service.accuracy.DataQualityIssueLogger;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/accuracy")
class AccuracyController {

    private final AccuracyTracker tracker;
    private final DataQualityIssueLogger issueLogger;

    AccuracyController(AccuracyTracker tracker, DataQualityIssueLogger issueLogger) {
        this.tracker = tracker;
        this.issueLogger = issueLogger;
    }

    @PostMapping("/track")
    TrackingOutcome track(@Valid @RequestBody TrackRequest request) {
        return tracker.track(request.toTrackingRequest());
    }

    /**
     * Rolling confidence over the trailing {@code days}; both key parts are optional filters.
     */
    @GetMapping("/confidence")
    List<RollingConfidence> confidence(@RequestParam(name = "business_unit", required = false) String businessUnit,
                                       @RequestParam(name = "metric_type", required = false) String metricType,
                                       @RequestParam(name = "days", defaultValue = "30") int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive");
        }
        return tracker.rollingConfidence(businessUnit, metricType, days);
    }

    @GetMapping("/summary")
    AccuracySummary summary(@RequestParam(name = "business_unit", required = false) String businessUnit) {
        return tracker.summary(businessUnit);
    }

    @GetMapping("/deviation-patterns")
    List<DeviationPattern> deviationPatterns(
            @RequestParam(name = "business_unit", required = false) String businessUnit) {
        return tracker.deviationPatterns(businessUnit);
    }

    @PostMapping("/data-quality-issues")
    ResponseEntity<DataQualityIssue> logIssue(@Valid @RequestBody DataQualityIssueRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(issueLogger.log(request.toIssue()));
    }
}
