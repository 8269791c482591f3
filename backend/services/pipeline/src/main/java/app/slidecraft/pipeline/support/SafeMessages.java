package app.slidecraft.pipeline.support;

public final class SafeMessages {

    private static final int MAX_LENGTH = 200;

    private SafeMessages() {
    }

    public static String of(Throwable ex) {
        if (ex == null) {
            return "";
        }
        return truncate(ex.getMessage());
    }

    public static String truncate(String message) {
        if (message == null) {
            return "";
        }
        String trimmed = message.replaceAll("[\\r\\n]+", " ").trim();
        return trimmed.length() <= MAX_LENGTH ? trimmed : trimmed.substring(0, MAX_LENGTH) + "...";
    }
}
