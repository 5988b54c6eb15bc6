package com.kubeprov.provisioner.step.aws;

import com.amazonaws.services.identitymanagement.AmazonIdentityManagement;
import com.amazonaws.services.identitymanagement.model.CreateRoleResult;
import com.amazonaws.services.identitymanagement.model.DeleteInstanceProfileRequest;
import com.amazonaws.services.identitymanagement.model.DeleteRolePolicyRequest;
import com.amazonaws.services.identitymanagement.model.DeleteRoleRequest;
import com.amazonaws.services.identitymanagement.model.EntityAlreadyExistsException;
import com.amazonaws.services.identitymanagement.model.NoSuchEntityException;
import com.amazonaws.services.identitymanagement.model.RemoveRoleFromInstanceProfileRequest;
import com.kubeprov.provisioner.step.ExecutionContext;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.StepException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CreateInstanceProfilesStepTest {

    @Mock AwsClientFactory         clients;
    @Mock AmazonIdentityManagement iam;

    PrintWriter out = new PrintWriter(new StringWriter(), true);

    @Test
    void run_createsProfilesForMastersAndNodes() {
        ProvisionConfig cfg = CreateVpcStepTest.config(null);
        when(clients.iam(cfg)).thenReturn(iam);

        new CreateInstanceProfilesStep(clients).run(ExecutionContext.background(), out, cfg);

        assertThat(cfg.outputs().get(AwsOutputs.MASTERS_INSTANCE_PROFILE)).contains("demo-c1-masters");
        assertThat(cfg.outputs().get(AwsOutputs.NODES_INSTANCE_PROFILE)).contains("demo-c1-nodes");
        verify(iam, times(2)).addRoleToInstanceProfile(any());
        verify(iam).shutdown();
    }

    @Test
    void run_nodesRoleFails_mastersPartsRemovedInReverse() {
        ProvisionConfig cfg = CreateVpcStepTest.config(null);
        when(clients.iam(cfg)).thenReturn(iam);
        when(iam.createRole(any()))
                .thenReturn(new CreateRoleResult())
                .thenThrow(new EntityAlreadyExistsException("Role with name demo-c1-nodes already exists."));

        Throwable thrown = catchThrowable(() ->
                new CreateInstanceProfilesStep(clients).run(ExecutionContext.background(), out, cfg));

        assertThat(thrown).isInstanceOf(StepException.class);
        assertThat(((StepException) thrown).getStepName()).isEqualTo(CreateInstanceProfilesStep.NAME);
        assertThat(((StepException) thrown).getKind()).isEqualTo(StepException.Kind.EXECUTION);

        InOrder cleanup = inOrder(iam);
        cleanup.verify(iam).removeRoleFromInstanceProfile(any(RemoveRoleFromInstanceProfileRequest.class));
        cleanup.verify(iam).deleteInstanceProfile(any(DeleteInstanceProfileRequest.class));
        cleanup.verify(iam).deleteRolePolicy(any(DeleteRolePolicyRequest.class));
        cleanup.verify(iam).deleteRole(any(DeleteRoleRequest.class));
        assertThat(cfg.outputs().isEmpty()).isTrue();
    }

    @Test
    void rollback_toleratesEntitiesAlreadyGone() {
        ProvisionConfig cfg = CreateVpcStepTest.config(null);
        CreateInstanceProfilesStep step = new CreateInstanceProfilesStep(clients);
        when(clients.iam(cfg)).thenReturn(iam);
        step.run(ExecutionContext.background(), out, cfg);
        when(iam.deleteRole(any())).thenThrow(new NoSuchEntityException("The role cannot be found."));

        step.rollback(ExecutionContext.background(), out, cfg);

        verify(iam, times(2)).deleteRole(any());
        assertThat(cfg.outputs().isEmpty()).isTrue();
    }

    @Test
    void rollback_nothingRecorded_createsNoClient() {
        new CreateInstanceProfilesStep(clients).rollback(
                ExecutionContext.background(), out, CreateVpcStepTest.config(null));

        verifyNoInteractions(clients);
    }
}
