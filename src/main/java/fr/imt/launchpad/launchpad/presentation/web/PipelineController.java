package fr.imt.launchpad.launchpad.presentation.web;

import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.model.RunRecord;
import fr.imt.launchpad.launchpad.business.model.RunRequest;
import fr.imt.launchpad.launchpad.business.service.PipelineRunService;
import fr.imt.launchpad.launchpad.presentation.web.dto.RunRequestBody;
import fr.imt.launchpad.launchpad.presentation.web.dto.RunResponse;
import fr.imt.launchpad.launchpad.presentation.web.dto.mappers.RunMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/runs")
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineRunService pipelineRunService;
    private final RunMapper runMapper;

    @PostMapping
    public ResponseEntity<RunResponse> startRun(@Valid @RequestBody(required = false) RunRequestBody body) {
        RunRequest request = body != null ? runMapper.toRequest(body) : RunRequest.local();
        RunContext context = pipelineRunService.start(request);
        return ResponseEntity.accepted().body(runMapper.toResponse(RunRecord.started(context)));
    }

    @GetMapping("/{runId}")
    public ResponseEntity<RunResponse> getRun(@PathVariable String runId) {
        return ResponseEntity.ok(runMapper.toResponse(pipelineRunService.find(runId)));
    }

    @DeleteMapping("/{runId}")
    public ResponseEntity<RunResponse> cancelRun(@PathVariable String runId) {
        return ResponseEntity.accepted().body(runMapper.toResponse(pipelineRunService.cancel(runId)));
    }
}
