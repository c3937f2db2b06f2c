package tech.unifiedportal.sdk.client.auth;

/**
 * Point-in-time view of the credential manager.
 *
 * @param authenticated an access token is present
 * @param refreshable a refresh token is present
 * @param renewalInFlight a renewal call is outstanding
 * @param bufferedCalls calls waiting for the outstanding renewal
 */
public record CredentialState(
    boolean authenticated,
    boolean refreshable,
    boolean renewalInFlight,
    int bufferedCalls
) {}
