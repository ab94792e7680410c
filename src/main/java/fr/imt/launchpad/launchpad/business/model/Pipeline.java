package fr.imt.launchpad.launchpad.business.model;

import fr.imt.launchpad.launchpad.exception.PipelineDefinitionException;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered stage list plus post actions. Immutable once built.
 * Credentials lists the credential names the stages will resolve, so they can be masked from the first stage on.
 */
@Getter
public class Pipeline {

    private final String name;
    private final List<Stage> stages;
    private final PostActions postActions;
    private final Set<String> credentials;

    @Builder
    private Pipeline(String name, @Singular List<Stage> stages, PostActions postActions,
                     @Singular Set<String> credentials) {
        Set<String> names = new HashSet<>();
        for (Stage stage : stages) {
            if (!names.add(stage.name())) {
                throw new PipelineDefinitionException("Duplicate stage name: " + stage.name());
            }
        }
        this.name = name;
        this.stages = List.copyOf(stages);
        this.postActions = postActions != null ? postActions : PostActions.none();
        this.credentials = Set.copyOf(credentials);
    }
}
