package tech.unifiedportal.sdk.support;

import com.github.f4b6a3.tsid.TsidCreator;

/**
 * Time-sorted identifiers for queued units of work and outgoing calls.
 *
 * <p>TSIDs sort by creation time, so ids logged for the same lane read in FIFO order.
 */
public final class TsidGenerator {

    private static final String REQUEST_PREFIX = "req_";

    private TsidGenerator() {}

    /**
     * Id of a queued unit of work, e.g. "0HZXEQ5Y8JY5Z".
     */
    public static String unitId() {
        return TsidCreator.getTsid().toString();
    }

    /**
     * Value for the X-Request-Id header, e.g. "req_0HZXEQ5Y8JY5Z".
     */
    public static String requestId() {
        return REQUEST_PREFIX + TsidCreator.getTsid().toString();
    }
}
