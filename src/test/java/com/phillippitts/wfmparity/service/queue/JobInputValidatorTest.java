package com.phillippitts.wfmparity.service.queue;

import com.phillippitts.wfmparity.domain.JobSubmission;
import com.phillippitts.wfmparity.domain.JobTarget;
import com.phillippitts.wfmparity.domain.JobType;
import com.phillippitts.wfmparity.exception.InvalidJobInputException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class JobInputValidatorTest {

    private static final JobTarget TARGET = new JobTarget("ACME", "billing");

    private final JobInputValidator validator = new JobInputValidator();

    @Test
    void acceptsCompleteSubmission() {
        JobSubmission s = JobSubmission.of(TARGET, "30m", Map.of("offered_calls", 120, "average_handle_time", 240));
        assertThatCode(() -> validator.validate(s)).doesNotThrowAnyException();
    }

    @Test
    void reportsEveryViolation() {
        JobSubmission s = new JobSubmission(null, TARGET, null, "2h",
                Map.of("offered_calls", "lots"), 9);

        InvalidJobInputException e = catchThrowableOfType(() -> validator.validate(s), InvalidJobInputException.class);

        assertThat(e.getViolations()).hasSize(4);
        assertThat(e.getViolations()).anySatisfy(v -> assertThat(v).contains("not numeric: offered_calls"));
        assertThat(e.getViolations()).anySatisfy(v -> assertThat(v).contains("missing required input: average_handle_time"));
        assertThat(e.getViolations()).anySatisfy(v -> assertThat(v).contains("priority"));
    }

    @Test
    void nonFiniteNumberIsAViolation() {
        JobSubmission s = JobSubmission.of(TARGET, "30m",
                Map.of("offered_calls", Double.POSITIVE_INFINITY, "average_handle_time", 240));

        InvalidJobInputException e = catchThrowableOfType(() -> validator.validate(s), InvalidJobInputException.class);

        assertThat(e.getViolations()).singleElement()
                .satisfies(v -> assertThat(v).contains("not valid JSON"));
    }

    @Test
    void multiSkillRequiresSkills() {
        JobSubmission s = new JobSubmission(JobType.MULTI_SKILL, TARGET, null, "1h",
                Map.of("offered_calls", 120, "average_handle_time", 240), null);
        assertThatThrownBy(() -> validator.validate(s))
                .isInstanceOf(InvalidJobInputException.class)
                .hasMessageContaining("skill_requirements");
    }

    @Test
    void derivesTypeFromSkills() {
        JobSubmission withSkills = JobSubmission.of(TARGET, "1h", Map.of("offered_calls", 120,
                "average_handle_time", 240,
                "skill_requirements", List.of(Map.of("skill_code", "billing", "demand_share", 0.6),
                        Map.of("skill_code", "sales", "demand_share", 0.4))));
        JobSubmission plain = JobSubmission.of(TARGET, "1h", Map.of("offered_calls", 120, "average_handle_time", 240));

        assertThat(validator.resolveType(withSkills)).isEqualTo(JobType.MULTI_SKILL);
        assertThat(validator.resolveType(plain)).isEqualTo(JobType.ERLANG_C);
    }
}
