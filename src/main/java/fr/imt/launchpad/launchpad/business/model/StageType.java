package fr.imt.launchpad.launchpad.business.model;

import lombok.Getter;

@Getter
public enum StageType {
    COMMAND("COMMAND"),
    IMAGE_BUILD("IMAGE-BUILD"),
    IMAGE_TEST("IMAGE-TEST"),
    IMAGE_PUSH("IMAGE-PUSH"),
    DEPLOY("DEPLOY");

    private final String commandName;

    StageType(String commandName) {
        this.commandName = commandName;
    }
}
