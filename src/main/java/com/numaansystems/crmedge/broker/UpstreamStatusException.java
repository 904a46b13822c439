package com.numaansystems.crmedge.broker;

import com.numaansystems.crmedge.resilience.EdgeException;
import com.numaansystems.crmedge.resilience.ErrorKind;

/**
 * Non-2xx answer from the upstream API, with the {@code message} and {@code code}
 * fields of its JSON body when present.
 */
public class UpstreamStatusException extends EdgeException {

    private final String upstreamMessage;
    private final String upstreamCode;

    public UpstreamStatusException(int status, String upstreamMessage, String upstreamCode) {
        super(ErrorKind.fromStatus(status), "Upstream responded with HTTP " + status, status, null, null);
        this.upstreamMessage = upstreamMessage;
        this.upstreamCode = upstreamCode;
    }

    public String getUpstreamMessage() {
        return upstreamMessage;
    }

    public String getUpstreamCode() {
        return upstreamCode;
    }
}
