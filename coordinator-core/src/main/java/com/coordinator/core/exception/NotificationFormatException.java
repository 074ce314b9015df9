package com.coordinator.core.exception;

/**
 * Thrown when a notification payload does not match the shape its type expects.
 * Never propagated past the delivery service, which falls back to the generic format.
 */
public class NotificationFormatException extends CoordinatorException {
    
    public static final String ERROR_CODE = "NOTIFICATION_FORMAT_ERROR";
    
    public NotificationFormatException(String notificationId, String reason) {
        super(ERROR_CODE, String.format(
            "Cannot format notification %s: %s",
            notificationId, reason
        ));
    }

    public NotificationFormatException(String notificationId, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Cannot format notification %s: %s",
            notificationId, cause.getMessage()
        ), cause);
    }
}
