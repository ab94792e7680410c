package fr.imt.launchpad.launchpad.business.service;

import fr.imt.launchpad.launchpad.business.model.Credential;
import fr.imt.launchpad.launchpad.business.model.Pipeline;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.model.RunOutcome;
import fr.imt.launchpad.launchpad.business.model.RunRecord;
import fr.imt.launchpad.launchpad.business.model.RunRequest;
import fr.imt.launchpad.launchpad.business.model.RunStatus;
import fr.imt.launchpad.launchpad.business.port.CredentialStore;
import fr.imt.launchpad.launchpad.business.port.RunStatusPublisherPort;
import fr.imt.launchpad.launchpad.exception.CredentialNotFoundException;
import fr.imt.launchpad.launchpad.exception.RunNotFoundException;
import fr.imt.launchpad.launchpad.infrastructure.history.InMemoryRunHistoryAdapter;
import fr.imt.launchpad.launchpad.testutil.TestRuns;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineRunServiceTest {

    @Mock
    private PipelineFactory pipelineFactory;
    @Mock
    private PipelineOrchestrator orchestrator;
    @Mock
    private AsyncRunExecutor asyncRunExecutor;
    @Mock
    private RunStatusPublisherPort statusPublisher;
    @Mock
    private CredentialStore credentialStore;

    private InMemoryRunHistoryAdapter history;
    private PipelineRunService pipelineRunService;
    private final Pipeline pipeline = Pipeline.builder().name("delivery").build();

    @BeforeEach
    void setUp() {
        history = new InMemoryRunHistoryAdapter(TestRuns.fastProperties());
        pipelineRunService = new PipelineRunService(pipelineFactory,
                new RunContextFactory(TestRuns.fastProperties(), Clock.systemUTC()),
                orchestrator, asyncRunExecutor, history, statusPublisher, credentialStore);
    }

    @Test
    void startRegistersTheRunAndHandsItToTheExecutor() {
        when(pipelineFactory.create()).thenReturn(pipeline);
        RunContext context = pipelineRunService.start(RunRequest.builder().runId("42").build());

        verify(asyncRunExecutor).execute(same(pipeline), same(context));
        verify(statusPublisher).publish("42", "CREATED", null);
        assertThat(pipelineRunService.find("42").isFinished()).isFalse();
    }

    @Test
    void runAndWaitStoresTheOutcome() {
        when(pipelineFactory.create()).thenReturn(pipeline);
        when(orchestrator.run(same(pipeline), any())).thenAnswer(invocation -> outcome(invocation.getArgument(1)));

        RunOutcome outcome = pipelineRunService.runAndWait(RunRequest.builder().runId("43").build());

        RunRecord record = pipelineRunService.find("43");
        assertThat(record.isFinished()).isTrue();
        assertThat(record.outcome()).isEqualTo(outcome);
    }

    @Test
    void declaredCredentialsAreMaskedBeforeTheFirstStage() {
        Pipeline withPush = Pipeline.builder().name("delivery").credential("docker-hub-credentials").build();
        when(pipelineFactory.create()).thenReturn(withPush);
        when(credentialStore.resolve("docker-hub-credentials"))
                .thenReturn(Credential.usernamePassword("docker-hub-credentials", "acme", "hunter2-secret"));
        when(orchestrator.run(same(withPush), any())).thenAnswer(invocation -> {
            RunContext context = invocation.getArgument(1);
            assertThat(context.redact("DOCKER_HUB_PASSWORD=hunter2-secret")).isEqualTo("DOCKER_HUB_PASSWORD=****");
            return outcome(context);
        });

        pipelineRunService.runAndWait(RunRequest.builder().runId("44").build());

        verify(orchestrator).run(same(withPush), any());
    }

    @Test
    void missingDeclaredCredentialStillStartsTheRun() {
        Pipeline withPush = Pipeline.builder().name("delivery").credential("docker-hub-credentials").build();
        when(pipelineFactory.create()).thenReturn(withPush);
        when(credentialStore.resolve("docker-hub-credentials"))
                .thenThrow(new CredentialNotFoundException("docker-hub-credentials"));

        RunContext context = pipelineRunService.start(RunRequest.builder().runId("45").build());

        assertThat(context.credential("docker-hub-credentials")).isEmpty();
        verify(asyncRunExecutor).execute(same(withPush), same(context));
    }

    @Test
    void aRunStillInProgressCannotBeStartedAgain() {
        when(pipelineFactory.create()).thenReturn(pipeline);
        pipelineRunService.start(RunRequest.builder().runId("42").build());

        assertThatThrownBy(() -> pipelineRunService.start(RunRequest.builder().runId("42").build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already in progress");
    }

    @Test
    void cancelFlagsTheLiveContext() {
        when(pipelineFactory.create()).thenReturn(pipeline);
        RunContext context = pipelineRunService.start(RunRequest.builder().runId("42").build());

        pipelineRunService.cancel("42");

        assertThat(context.isCancelled()).isTrue();
    }

    @Test
    void unknownRunIsNotFound() {
        assertThatThrownBy(() -> pipelineRunService.find("nope")).isInstanceOf(RunNotFoundException.class);
        assertThatThrownBy(() -> pipelineRunService.cancel("nope")).isInstanceOf(RunNotFoundException.class);
    }

    private static RunOutcome outcome(RunContext context) {
        return RunOutcome.builder()
                .runId(context.getRunId())
                .status(RunStatus.SUCCESS)
                .stages(List.of())
                .duration(Duration.ofSeconds(1))
                .hooksRun(List.of())
                .warnings(List.of())
                .build();
    }
}
