package com.leadfunnel.backend.exceptions;

/**
 * Thrown by the manual "post now" operations when no campaign is active.
 */
public class NoActiveCampaignException extends RuntimeException {

    public NoActiveCampaignException() {
        super("No active campaign");
    }
}
