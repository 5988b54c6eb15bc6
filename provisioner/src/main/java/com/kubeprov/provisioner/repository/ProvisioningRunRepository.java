package com.kubeprov.provisioner.repository;

import com.kubeprov.provisioner.model.ProvisioningRun;
import com.kubeprov.provisioner.model.RunState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * CRUD + sweep queries for the provisioning_runs table.
 */
public interface ProvisioningRunRepository extends JpaRepository<ProvisioningRun, UUID> {

    /** Runs in any of {@code states} that have not been touched since {@code cutoff}. */
    List<ProvisioningRun> findByStateInAndUpdatedAtBefore(Collection<RunState> states, Instant cutoff);
}
