package com.kubeprov.provisioner.pipeline;

import java.time.Duration;
import java.util.List;

/**
 * Summary of a pipeline that ran to completion.
 *
 * @param pipeline Stage name.
 * @param stepsRun Names of the steps that ran, in order (all of them).
 * @param elapsed  Wall-clock time of the whole pipeline.
 */
public record RunReport(String pipeline, List<String> stepsRun, Duration elapsed) {

    public RunReport {
        stepsRun = List.copyOf(stepsRun);
    }
}
