package com.phillippitts.wfmparity.domain;

import java.util.Objects;

/**
 * What a job calculates staffing for: a project and, optionally, one of its queues.
 *
 * @param projectCode project (business unit) code, never blank
 * @param queueCode   queue within the project, or null for the whole project
 */
public record JobTarget(String projectCode, String queueCode) {

    public JobTarget {
        Objects.requireNonNull(projectCode, "projectCode must not be null");
        if (projectCode.isBlank()) {
            throw new IllegalArgumentException("projectCode must not be blank");
        }
        queueCode = queueCode == null || queueCode.isBlank() ? null : queueCode;
    }

    public static JobTarget project(String projectCode) {
        return new JobTarget(projectCode, null);
    }

    @Override
    public String toString() {
        return queueCode == null ? projectCode : projectCode + "/" + queueCode;
    }
}
