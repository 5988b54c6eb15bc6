package com.kubeprov.provisioner.step;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Test fixture: a step that appends "run:name" / "rollback:name" to a shared
 * journal and can be told to fail either phase or to act on the context.
 */
public class RecordingStep implements Step {

    private final StepManifest manifest;
    private final List<String> journal;

    private RuntimeException failOnRun;
    private RuntimeException failOnRollback;
    private Consumer<ExecutionContext> duringRun = ctx -> {};

    private final List<ExecutionContext> rollbackContexts = new ArrayList<>();

    public RecordingStep(String name, List<String> journal, String... depends) {
        this.manifest = StepManifest.of(name, "fixture step " + name, depends);
        this.journal  = journal;
    }

    public RecordingStep failingRun(RuntimeException e) {
        this.failOnRun = e;
        return this;
    }

    public RecordingStep failingRollback(RuntimeException e) {
        this.failOnRollback = e;
        return this;
    }

    public RecordingStep duringRun(Consumer<ExecutionContext> action) {
        this.duringRun = action;
        return this;
    }

    public List<ExecutionContext> rollbackContexts() {
        return rollbackContexts;
    }

    @Override
    public StepManifest manifest() {
        return manifest;
    }

    @Override
    public void run(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        journal.add("run:" + name());
        duringRun.accept(ctx);
        if (failOnRun != null) throw failOnRun;
        cfg.outputs().put(name(), "fixture." + name(), "done");
    }

    @Override
    public void rollback(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        journal.add("rollback:" + name());
        rollbackContexts.add(ctx);
        if (failOnRollback != null) throw failOnRollback;
        cfg.outputs().remove(name(), "fixture." + name());
    }
}
