package com.phillippitts.wfmparity.presentation.dto;

import jakarta.validation.constraints.Size;

public record ResolvePatternRequest(
        @Size(max = 2000, message = "note must be at most 2000 characters") String note
) {
}
