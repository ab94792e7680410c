package fr.imt.launchpad.launchpad.business.model;

import lombok.Builder;

import java.util.Map;

@Builder
public record ContainerSpec(String name, String image, int hostPort, int containerPort,
                            Map<String, String> env, Map<String, String> labels) {

    public ContainerSpec {
        env = env == null ? Map.of() : Map.copyOf(env);
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
