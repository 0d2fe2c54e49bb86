package biz.kryukov.dev.svcwatch;

/**
 * Liveness verdict of a target.
 */
public enum LivenessStatus {

    UP("up"),
    DOWN("down"),
    UNKNOWN("unknown");

    private final String label;

    LivenessStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
