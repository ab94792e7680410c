package fr.imt.launchpad.launchpad.presentation.web.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.Map;

@Data
public class RunRequestBody {

    @Size(max = 128)
    @Pattern(regexp = "[A-Za-z0-9_][A-Za-z0-9_.-]*", message = "must be a valid image tag")
    private String runId;

    @Size(max = 255)
    private String branch;

    @Size(max = 64)
    private String revision;

    private String buildUrl;

    private Map<String, String> environment;
}
