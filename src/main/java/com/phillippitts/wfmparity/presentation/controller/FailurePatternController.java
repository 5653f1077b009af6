package com.phillippitts.wfmparity.presentation.controller;

import com.phillippitts.wfmparity.domain.FailurePattern;
import com.phillippitts.wfmparity.presentation.dto.ResolvePatternRequest;
import com.phillippitts.wfmparity.service.mining.FailurePatternMiner;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/failure-patterns")
class FailurePatternController {

    private final FailurePatternMiner miner;

    FailurePatternController(FailurePatternMiner miner) {
        this.miner = miner;
    }

    /**
     * Unresolved patterns, most severe first.
     */
    @GetMapping("/active")
    List<FailurePattern> active() {
        return miner.listActive();
    }

    @PostMapping("/{id}/resolve")
    FailurePattern resolve(@PathVariable("id") UUID id,
                           @Valid @RequestBody(required = false) ResolvePatternRequest request) {
        return miner.resolve(id, request == null ? null : request.note());
    }
}
