package com.phillippitts.wfmparity.domain;

public enum FailureCategory {
    ACCURACY,
    DATA_QUALITY,
    PERFORMANCE
}
