package com.phillippitts.wfmparity.presentation.controller;

import com.phillippitts.wfmparity.domain.Forecast;
import com.phillippitts.wfmparity.domain.HistoricalTrend;
import com.phillippitts.wfmparity.domain.OperationalTrendReport;
import com.phillippitts.wfmparity.domain.TrackingSignal;
import com.phillippitts.wfmparity.presentation.dto.GenerateTrendsRequest;
import com.phillippitts.wfmparity.service.trend.TrendEngine;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * Accuracy trends, forecasts and operational trend reports.
 */
@RestController
@RequestMapping("/api/v1/trends")
class TrendController {

    private final TrendEngine trends;

    TrendController(TrendEngine trends) {
        this.trends = trends;
    }

    @PostMapping("/generate")
    List<HistoricalTrend> generate(@Valid @RequestBody GenerateTrendsRequest request) {
        return trends.generateTrends(request.start(), request.end());
    }

    @GetMapping
    List<HistoricalTrend> list(@RequestParam("business_unit") String businessUnit,
                               @RequestParam("metric_type") String metricType) {
        return trends.listTrends(businessUnit, metricType);
    }

    /**
     * 404 when the key has no trends to project from.
     */
    @GetMapping("/forecast")
    ResponseEntity<Forecast> forecast(@RequestParam("business_unit") String businessUnit,
                                      @RequestParam("metric_type") String metricType) {
        return ResponseEntity.of(trends.forecastAccuracy(businessUnit, metricType));
    }

    @GetMapping("/operational")
    OperationalTrendReport operational(
            @RequestParam("project_code") String projectCode,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("to must not be before from");
        }
        return trends.operationalTrends(projectCode, from, to);
    }

    @GetMapping("/tracking-signal")
    TrackingSignal trackingSignal(@RequestParam("business_unit") String businessUnit,
                                  @RequestParam("metric_type") String metricType,
                                  @RequestParam(name = "days", defaultValue = "30") int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive");
        }
        return trends.trackingSignal(businessUnit, metricType, days);
    }
}
