package fr.imt.launchpad.launchpad.business.model;

import lombok.Builder;

@Builder
public record PostActions(PostAction onSuccess, PostAction onFailure, PostAction always) {

    public PostActions {
        onSuccess = onSuccess == null ? PostAction.NONE : onSuccess;
        onFailure = onFailure == null ? PostAction.NONE : onFailure;
        always = always == null ? PostAction.NONE : always;
    }

    public static PostActions none() {
        return new PostActions(null, null, null);
    }
}
