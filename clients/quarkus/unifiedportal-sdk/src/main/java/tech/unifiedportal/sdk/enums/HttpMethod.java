package tech.unifiedportal.sdk.enums;

public enum HttpMethod {
    GET(false, false),
    HEAD(false, false),
    OPTIONS(false, false),
    POST(true, true),
    PUT(true, true),
    PATCH(true, true),
    DELETE(true, true);

    private final boolean mutating;
    private final boolean allowsBody;

    HttpMethod(boolean mutating, boolean allowsBody) {
        this.mutating = mutating;
        this.allowsBody = allowsBody;
    }

    /**
     * Mutating calls are only retried when the caller opts in.
     */
    public boolean isMutating() {
        return mutating;
    }

    /**
     * Whether the payload travels as a request body. Otherwise it is encoded as query parameters.
     */
    public boolean allowsBody() {
        return allowsBody;
    }
}
