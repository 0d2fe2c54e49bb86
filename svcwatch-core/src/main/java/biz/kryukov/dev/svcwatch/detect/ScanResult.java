package biz.kryukov.dev.svcwatch.detect;

/**
 * Result of an API endpoint scan.
 *
 * @param found    whether a candidate answered like an API
 * @param endpoint the first matching candidate path, or null
 */
public record ScanResult(boolean found, String endpoint) {

    private static final ScanResult NOT_FOUND = new ScanResult(false, null);

    public static ScanResult found(String endpoint) {
        return new ScanResult(true, endpoint);
    }

    public static ScanResult notFound() {
        return NOT_FOUND;
    }
}
