package com.dispatchhub.notify;

/**
 * Failure of a single channel's delivery attempt.
 *
 * <p>Raised by delivery strategies and caught at the fan-out boundary of
 * {@link NotificationDispatcher}: it is logged and counted, never propagated to the
 * notification producer or to the other channels of the same notification.</p>
 */
public class ChannelDeliveryException extends Exception {

    private final String channelId;
    private final int statusCode;

    /**
     * Create an exception for a transport or strategy failure.
     *
     * @param channelId the channel that failed
     * @param message the error message
     * @param cause the underlying cause, may be null
     */
    public ChannelDeliveryException(String channelId, String message, Throwable cause) {
        super(message, cause);
        this.channelId = channelId;
        this.statusCode = -1;
    }

    /**
     * Create an exception for a non-2xx HTTP response.
     *
     * @param channelId the channel that failed
     * @param message the error message
     * @param statusCode the HTTP status returned by the endpoint
     */
    public ChannelDeliveryException(String channelId, String message, int statusCode) {
        super(message);
        this.channelId = channelId;
        this.statusCode = statusCode;
    }

    public String getChannelId() {
        return channelId;
    }

    /**
     * @return the HTTP status, or -1 if the failure was not an HTTP response
     */
    public int getStatusCode() {
        return statusCode;
    }
}
