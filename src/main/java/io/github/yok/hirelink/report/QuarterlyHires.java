package io.github.yok.hirelink.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Hires of one (department, job) pair per quarter of a year.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class QuarterlyHires {

    String department;
    String job;
    @JsonProperty("Q1")
    int q1;
    @JsonProperty("Q2")
    int q2;
    @JsonProperty("Q3")
    int q3;
    @JsonProperty("Q4")
    int q4;
}
