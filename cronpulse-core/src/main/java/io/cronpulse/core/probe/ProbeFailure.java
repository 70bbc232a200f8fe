package io.cronpulse.core.probe;

import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import javax.net.ssl.SSLException;

public enum ProbeFailure {
    TIMEOUT("TIMEOUT"),
    DNS_FAILURE("DNS_FAILURE"),
    CONNECTION_REFUSED("CONNECTION_REFUSED"),
    TLS_FAILURE("TLS_FAILURE"),
    INVALID_URL("INVALID_URL"),
    IO_ERROR("IO_ERROR"),
    ABORTED("ABORTED");

    private final String code;

    ProbeFailure(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static ProbeFailure classify(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof UnknownHostException) {
                return DNS_FAILURE;
            }
            if (current instanceof ConnectException) {
                return CONNECTION_REFUSED;
            }
            if (current instanceof SSLException) {
                return TLS_FAILURE;
            }
            if (current instanceof InterruptedIOException) {
                // Okio reports a thread interrupt as "interrupted"; every other variant is a deadline.
                return "interrupted".equals(current.getMessage()) ? ABORTED : TIMEOUT;
            }
            current = current.getCause();
        }
        return IO_ERROR;
    }
}
