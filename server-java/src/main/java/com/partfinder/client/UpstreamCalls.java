package com.partfinder.client;

import com.partfinder.exception.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;

/**
 * Executes an upstream request under a cancellation token and turns every
 * transport problem into {@link UpstreamUnavailableException}.
 */
@Slf4j
final class UpstreamCalls {

    private UpstreamCalls() {
    }

    static String execute(OkHttpClient httpClient, Request request, CancellationToken token, String upstream)
            throws UpstreamUnavailableException {
        if (token.isCancelled()) {
            throw new UpstreamUnavailableException(upstream + " call skipped: request cancelled");
        }
        Call call = token.register(httpClient.newCall(request));
        try (Response response = call.execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                log.error("{} error: {} - {}", upstream, response.code(), body);
                throw new UpstreamUnavailableException(
                        upstream + " error (" + response.code() + "): " + body, response.code(), null);
            }
            log.debug("{} raw response: {}", upstream, body);
            return body;
        } catch (UpstreamUnavailableException e) {
            throw e;
        } catch (IOException e) {
            String reason = call.isCanceled() ? "cancelled" : e.getMessage();
            throw new UpstreamUnavailableException(upstream + " unreachable: " + reason, e);
        } finally {
            token.unregister(call);
        }
    }
}
