package fr.imt.launchpad.launchpad.business.model;

import java.util.List;

/**
 * Registry-qualified image name with its tags. The first tag is the run-specific one.
 */
public record ImageReference(String registry, String repository, List<String> tags) {

    public ImageReference {
        if (tags == null || tags.isEmpty()) {
            throw new IllegalArgumentException("An image reference needs at least one tag");
        }
        tags = List.copyOf(tags);
    }

    public String name() {
        return registry == null || registry.isBlank() ? repository : registry + "/" + repository;
    }

    public String reference(String tag) {
        return name() + ":" + tag;
    }

    public String primaryTag() {
        return tags.get(0);
    }

    public String primaryReference() {
        return reference(primaryTag());
    }

    @Override
    public String toString() {
        return name() + ":" + String.join(",", tags);
    }
}
