package fr.imt.launchpad.launchpad.business.model;

public record ProcessResult(int exitCode, String output) {

    public static ProcessResult success(String output) {
        return new ProcessResult(0, output);
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
