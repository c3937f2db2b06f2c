package tech.unifiedportal.sdk.notification;

/**
 * Callbacks from a {@link NotificationChannel} connection.
 */
public interface FrameListener {

    void onFrame(String frame);

    void onError(Throwable error);

    void onClosed(int statusCode, String reason);
}
