package com.mimecast.dispatch.smtp;

/**
 * Reply codes the client branches on.
 * <p>Everything else is classified by reply class in {@link SmtpResponse}.
 */
public final class SmtpResponses {

    private SmtpResponses() {
        // Utility class.
    }

    /**
     * Banner and STARTTLS go ahead.
     */
    public static final int SERVICE_READY_220 = 220;

    public static final int AUTH_SUCCESS_235 = 235;

    /**
     * SASL continuation carrying a base64 challenge.
     */
    public static final int AUTH_CONTINUE_334 = 334;

    public static final int START_MAIL_INPUT_354 = 354;

    /**
     * Server is shutting down the channel; valid in reply to any command.
     */
    public static final int SERVICE_UNAVAILABLE_421 = 421;
}
