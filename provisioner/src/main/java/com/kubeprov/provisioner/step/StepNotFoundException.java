package com.kubeprov.provisioner.step;

/**
 * A pipeline references a step name nothing registered. Always a build or
 * deployment defect, never retried.
 */
public class StepNotFoundException extends StepException {
    public StepNotFoundException(String name) {
        super(Kind.CONFIGURATION, name, "No step registered with name: '" + name + "'", null);
    }
}
