package uk.gegc.revisionhelper.features.revision.domain.model;

public enum RunStatus {
    RUNNING("running"),
    COMPLETED("completed");

    private final String label;

    RunStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
