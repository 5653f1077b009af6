package com.phillippitts.wfmparity.service.queue;

import com.phillippitts.wfmparity.domain.InputParameters;
import com.phillippitts.wfmparity.domain.IntervalType;
import com.phillippitts.wfmparity.domain.JobSubmission;
import com.phillippitts.wfmparity.domain.JobType;
import com.phillippitts.wfmparity.exception.InvalidJobInputException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates job submissions before they are enqueued.
 *
 * <p>Required input fields must be present and numeric; the interval type must be known and
 * the priority, when given, within 1..5. All violations are reported together.
 */
@Component
public class JobInputValidator {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 5;

    static final List<String> REQUIRED_NUMERIC = List.of(
            InputParameters.OFFERED_CALLS,
            InputParameters.AVERAGE_HANDLE_TIME);

    /**
     * @throws InvalidJobInputException listing every violation found
     */
    public void validate(JobSubmission submission) {
        List<String> violations = new ArrayList<>();
        InputParameters params;
        try {
            params = InputParameters.of(submission.inputParameters());
        } catch (IllegalArgumentException e) {
            // nothing else can be checked against parameters that cannot be stored
            throw new InvalidJobInputException(e.getMessage());
        }

        for (String key : REQUIRED_NUMERIC) {
            if (!params.contains(key)) {
                violations.add("missing required input: " + key);
            } else if (!params.isNumeric(key)) {
                violations.add("input is not numeric: " + key);
            }
        }

        try {
            IntervalType.fromCode(submission.intervalType());
        } catch (IllegalArgumentException e) {
            violations.add(e.getMessage());
        }

        Integer priority = submission.priority();
        if (priority != null && (priority < MIN_PRIORITY || priority > MAX_PRIORITY)) {
            violations.add("priority must be in [" + MIN_PRIORITY + "," + MAX_PRIORITY + "], got: " + priority);
        }

        if (submission.type() == JobType.MULTI_SKILL && !params.hasSkillRequirements()) {
            violations.add("multi_skill job requires " + InputParameters.SKILL_REQUIREMENTS);
        }
        if (params.hasSkillRequirements()) {
            try {
                params.skillRequirements();
            } catch (IllegalArgumentException e) {
                violations.add("malformed " + InputParameters.SKILL_REQUIREMENTS + ": " + e.getMessage());
            }
        }

        if (!violations.isEmpty()) {
            throw new InvalidJobInputException(violations);
        }
    }

    /**
     * Type to store for a submission: as given, else MULTI_SKILL when skills are present.
     */
    public JobType resolveType(JobSubmission submission) {
        if (submission.type() != null) {
            return submission.type();
        }
        return InputParameters.of(submission.inputParameters()).hasSkillRequirements()
                ? JobType.MULTI_SKILL
                : JobType.ERLANG_C;
    }
}
