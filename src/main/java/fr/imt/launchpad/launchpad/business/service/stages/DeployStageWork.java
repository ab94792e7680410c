package fr.imt.launchpad.launchpad.business.service.stages;

import fr.imt.launchpad.launchpad.business.model.DeploymentTarget;
import fr.imt.launchpad.launchpad.business.model.ImageReference;
import fr.imt.launchpad.launchpad.business.model.ProcessResult;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.model.StageWork;
import fr.imt.launchpad.launchpad.business.service.deployment.DeploymentManager;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class DeployStageWork implements StageWork {

    private final DeploymentManager deploymentManager;
    private final String deploymentName;
    private final int hostPort;

    @Override
    public ProcessResult execute(RunContext context) throws InterruptedException {
        ImageReference image = context.getBuiltImage();
        if (image == null) {
            return new ProcessResult(1, "No image was built earlier in this run");
        }

        DeploymentTarget target = deploymentManager.deploy(context, deploymentName, image, hostPort);
        return ProcessResult.success("Deployed " + target.imageReference() + " as " + target.name()
                + " on port " + target.hostPort());
    }
}
