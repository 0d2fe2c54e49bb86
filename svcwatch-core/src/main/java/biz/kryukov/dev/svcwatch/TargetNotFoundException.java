package biz.kryukov.dev.svcwatch;

/**
 * Thrown when an operation names a target that is not registered.
 */
public class TargetNotFoundException extends SvcWatchException {

    public TargetNotFoundException(String name) {
        super("Target not found: " + name);
    }
}
