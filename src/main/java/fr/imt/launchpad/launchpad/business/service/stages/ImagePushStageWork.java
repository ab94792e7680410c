package fr.imt.launchpad.launchpad.business.service.stages;

import fr.imt.launchpad.launchpad.business.model.Credential;
import fr.imt.launchpad.launchpad.business.model.ImageReference;
import fr.imt.launchpad.launchpad.business.model.ProcessResult;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.model.StageWork;
import fr.imt.launchpad.launchpad.business.port.CredentialStore;
import fr.imt.launchpad.launchpad.business.service.image.ImageBuildService;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class ImagePushStageWork implements StageWork {

    private final ImageBuildService imageBuildService;
    private final CredentialStore credentialStore;
    private final String credentialName;

    @Override
    public ProcessResult execute(RunContext context) {
        ImageReference image = context.getBuiltImage();
        if (image == null) {
            return new ProcessResult(1, "No image was built earlier in this run");
        }

        Credential credential = context.credential(credentialName).orElseGet(() -> resolve(context));

        imageBuildService.publish(context, image, credential);
        return ProcessResult.success("Published " + image);
    }

    private Credential resolve(RunContext context) {
        Credential credential = credentialStore.resolve(credentialName);
        context.registerCredential(credential);
        return credential;
    }
}
