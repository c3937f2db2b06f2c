package tech.unifiedportal.sdk.client.auth;

/**
 * Access and refresh credentials. Either may be null.
 */
public record TokenPair(String accessToken, String refreshToken) {

    @Override
    public String toString() {
        return "TokenPair[accessToken=" + mask(accessToken) + ", refreshToken=" + mask(refreshToken) + "]";
    }

    static String mask(String token) {
        if (token == null) {
            return "null";
        }
        return token.length() <= 6 ? "***" : token.substring(0, 6) + "***";
    }
}
