package io.cronpulse.core.probe;

import io.cronpulse.core.job.ExecutionOutcome;
import io.cronpulse.core.job.Job;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Okio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HttpProbeExecutor implements ProbeExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(HttpProbeExecutor.class);

    private final OkHttpClient client;
    private final String userAgent;

    public HttpProbeExecutor(Duration timeout, String userAgent) {
        this(new OkHttpClient.Builder()
            .callTimeout(positive(timeout))
            .connectTimeout(timeout)
            .readTimeout(timeout)
            .retryOnConnectionFailure(false)
            .build(), userAgent);
    }

    public HttpProbeExecutor(OkHttpClient client, String userAgent) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.userAgent = userAgent == null || userAgent.isBlank() ? "cronpulse/0.1" : userAgent;
    }

    @Override
    public ExecutionOutcome execute(Job job) {
        long started = System.nanoTime();
        HttpUrl url = HttpUrl.parse(job.url());
        if (url == null) {
            return ExecutionOutcome.failure(job, ProbeFailure.INVALID_URL.code(), elapsedMs(started));
        }

        Request request = new Request.Builder()
            .url(url)
            .get()
            .header("User-Agent", userAgent)
            .build();

        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (body != null) {
                body.source().readAll(Okio.blackhole());
            }
            return ExecutionOutcome.success(job, response.code(), elapsedMs(started));
        } catch (IOException e) {
            ProbeFailure failure = Thread.currentThread().isInterrupted() ? ProbeFailure.ABORTED : ProbeFailure.classify(e);
            LOG.debug("Probe of job {} failed with {}: {}", job.id(), failure.code(), e.getMessage());
            return ExecutionOutcome.failure(job, failure.code(), elapsedMs(started));
        }
    }

    // OkHttp reads a zero timeout as "no timeout".
    private static Duration positive(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        return timeout;
    }

    private long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
