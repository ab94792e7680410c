package fr.imt.launchpad.launchpad.business.service.stages;

import fr.imt.launchpad.launchpad.business.model.ImageReference;
import fr.imt.launchpad.launchpad.business.model.ProcessResult;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.model.StageWork;
import fr.imt.launchpad.launchpad.business.service.image.ImageBuildService;
import lombok.RequiredArgsConstructor;

import java.nio.file.Path;

@RequiredArgsConstructor
public class ImageBuildStageWork implements StageWork {

    private final ImageBuildService imageBuildService;
    private final Path buildContext;
    private final String dockerfile;

    @Override
    public ProcessResult execute(RunContext context) {
        ImageReference planned = context.getPlannedImage();
        ImageReference built = imageBuildService.build(context, buildContext, dockerfile,
                planned.registry(), planned.repository(), planned.tags());
        context.setBuiltImage(built);
        return ProcessResult.success("Built " + built);
    }
}
