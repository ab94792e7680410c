package fr.imt.launchpad.launchpad.presentation.web;

import fr.imt.launchpad.launchpad.business.model.HookType;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.model.RunOutcome;
import fr.imt.launchpad.launchpad.business.model.RunRecord;
import fr.imt.launchpad.launchpad.business.model.RunRequest;
import fr.imt.launchpad.launchpad.business.model.RunStatus;
import fr.imt.launchpad.launchpad.business.model.RunWarning;
import fr.imt.launchpad.launchpad.business.model.StageOutcome;
import fr.imt.launchpad.launchpad.business.model.StageStatus;
import fr.imt.launchpad.launchpad.business.service.PipelineRunService;
import fr.imt.launchpad.launchpad.exception.RunNotFoundException;
import fr.imt.launchpad.launchpad.presentation.web.dto.mappers.RunMapper;
import fr.imt.launchpad.launchpad.testutil.TestRuns;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class PipelineControllerTest {

    @Mock
    private PipelineRunService pipelineRunService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        PipelineController controller = new PipelineController(pipelineRunService, Mappers.getMapper(RunMapper.class));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void postStartsARunAndAnswersAccepted() throws Exception {
        when(pipelineRunService.start(any())).thenReturn(TestRuns.context("118"));

        mockMvc.perform(post("/api/v1/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"runId\":\"118\",\"branch\":\"main\",\"revision\":\"abc123\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.runId").value("118"))
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.branch").value("main"));

        ArgumentCaptor<RunRequest> captor = ArgumentCaptor.forClass(RunRequest.class);
        verify(pipelineRunService).start(captor.capture());
        assertThat(captor.getValue().runId()).isEqualTo("118");
        assertThat(captor.getValue().revision()).isEqualTo("abc123");
    }

    @Test
    void runIdThatIsNotATagIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"runId\":\"feature/x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
    }

    @Test
    void runAlreadyInProgressIsABadRequest() throws Exception {
        when(pipelineRunService.start(any())).thenThrow(new IllegalArgumentException("Run 118 is already in progress"));

        mockMvc.perform(post("/api/v1/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"runId\":\"118\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_REQUEST"));
    }

    @Test
    void getReturnsTheFinishedRun() throws Exception {
        RunContext context = TestRuns.context("118");
        RunOutcome outcome = RunOutcome.builder()
                .runId("118")
                .status(RunStatus.FAILURE)
                .stages(List.of(
                        StageOutcome.builder().stageName("Train Model").status(StageStatus.FAILED)
                                .exitCode(2).output("").duration(Duration.ofMillis(1500)).build(),
                        StageOutcome.skipped("Build Docker Image")))
                .duration(Duration.ofSeconds(2))
                .hooksRun(List.of(HookType.FAILURE, HookType.ALWAYS))
                .warnings(List.of(new RunWarning(RunWarning.CLEANUP_INCOMPLETE, "Containers left behind: [x]")))
                .build();
        when(pipelineRunService.find("118")).thenReturn(RunRecord.started(context).finish(outcome));

        mockMvc.perform(get("/api/v1/runs/118"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FAILURE"))
                .andExpect(jsonPath("$.durationMs").value(2000))
                .andExpect(jsonPath("$.stages[0].name").value("Train Model"))
                .andExpect(jsonPath("$.stages[0].exitCode").value(2))
                .andExpect(jsonPath("$.stages[1].status").value("SKIPPED"))
                .andExpect(jsonPath("$.hooksRun[0]").value("FAILURE"))
                .andExpect(jsonPath("$.warnings[0]").value("CLEANUP_INCOMPLETE: Containers left behind: [x]"));
    }

    @Test
    void unknownRunIsNotFound() throws Exception {
        when(pipelineRunService.find("nope")).thenThrow(new RunNotFoundException("nope"));

        mockMvc.perform(get("/api/v1/runs/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }

    @Test
    void deleteRequestsCancellation() throws Exception {
        when(pipelineRunService.cancel("118")).thenReturn(RunRecord.started(TestRuns.context("118")));

        mockMvc.perform(delete("/api/v1/runs/118"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.runId").value("118"));

        verify(pipelineRunService).cancel("118");
    }
}
