package com.phillippitts.wfmparity.domain;

public enum ResolutionStatus {
    OPEN,
    RESOLVED
}
