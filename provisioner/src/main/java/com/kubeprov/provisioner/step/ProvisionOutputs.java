package com.kubeprov.provisioner.step;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Intermediate outputs written by steps and read by later steps of the same
 * run (VPC id, security group ids, resource group name...).
 *
 * Every key is owned by the step that first wrote it. Only the owner may
 * overwrite or remove it; any other step trying to do so is a programming
 * error and fails with {@link IllegalStateException}.
 *
 * <p>Not thread-safe: a run's outputs are only touched by that run's worker.
 */
public final class ProvisionOutputs {

    private static final String LIST_SEPARATOR = ",";

    private final Map<String, String> values = new LinkedHashMap<>();
    private final Map<String, String> owners = new HashMap<>();

    public void put(String owner, String key, String value) {
        checkOwner(owner, key);
        values.put(key, value);
        owners.put(key, owner);
    }

    /** Store a list value; elements must not contain commas (cloud resource ids never do). */
    public void putList(String owner, String key, List<String> value) {
        put(owner, key, String.join(LIST_SEPARATOR, value));
    }

    /** Append one element to a list value, creating it if absent. */
    public void append(String owner, String key, String element) {
        List<String> current = new ArrayList<>(getList(key));
        current.add(element);
        putList(owner, key, current);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public List<String> getList(String key) {
        String raw = values.get(key);
        if (raw == null || raw.isEmpty()) return List.of();
        return List.copyOf(Arrays.asList(raw.split(LIST_SEPARATOR)));
    }

    /**
     * Value written by an earlier step.
     *
     * @throws StepException CONFIGURATION if absent: the pipeline ran a consumer
     *                       before its producer
     */
    public String require(String key) {
        String value = values.get(key);
        if (value == null) {
            throw new StepException(StepException.Kind.CONFIGURATION,
                    "required output '" + key + "' was not produced by an earlier step");
        }
        return value;
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /** Remove a key. No-op when the key is absent. */
    public void remove(String owner, String key) {
        if (!values.containsKey(key)) return;
        checkOwner(owner, key);
        values.remove(key);
        owners.remove(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Immutable copy in insertion order. */
    public Map<String, String> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    private void checkOwner(String owner, String key) {
        String current = owners.get(key);
        if (current != null && !current.equals(owner)) {
            throw new IllegalStateException(
                    "output '" + key + "' is owned by step '" + current
                    + "', step '" + owner + "' may not change it");
        }
    }
}
