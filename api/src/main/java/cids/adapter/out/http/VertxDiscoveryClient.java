package cids.adapter.out.http;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.core.http.HttpClient;
import io.vertx.mutiny.core.http.HttpClientRequest;
import io.vertx.mutiny.core.http.HttpClientResponse;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import cids.core.config.DiscoveryConfig;
import cids.core.model.discovery.DiscoveryErrorType;
import cids.core.model.discovery.DiscoveryException;
import cids.core.port.out.DiscoveryClient;

/**
 * Discovery client on the Vert.x web client.
 *
 * <p>Redirects are not followed, so an application cannot point the broker at a
 * different host than the one registered. Documents are read as a stream and the
 * connection is reset as soon as the size ceiling is crossed, whether or not the
 * server declared a {@code Content-Length}.
 */
@ApplicationScoped
public class VertxDiscoveryClient implements DiscoveryClient {

    private static final Logger LOG = Logger.getLogger(VertxDiscoveryClient.class);

    private final WebClient webClient;
    private final HttpClient httpClient;

    @Inject
    public VertxDiscoveryClient(Vertx vertx, DiscoveryConfig config) {
        final var connectTimeout = (int) config.connectTimeout().toMillis();
        this.webClient = WebClient.create(
                vertx,
                new WebClientOptions()
                        .setConnectTimeout(connectTimeout)
                        .setFollowRedirects(false)
                        .setUserAgentEnabled(false));
        this.httpClient = vertx.createHttpClient(new HttpClientOptions().setConnectTimeout(connectTimeout));
    }

    @Override
    public Uni<Integer> checkReachable(URI endpoint, Duration timeout) {
        return send(webClient.headAbs(endpoint.toString()), endpoint, timeout).map(HttpResponse::statusCode);
    }

    @Override
    public Uni<DiscoveryResponse> fetch(URI endpoint, Map<String, String> headers, Duration timeout, long maxBytes) {
        final var options = new RequestOptions()
                .setMethod(HttpMethod.GET)
                .setAbsoluteURI(endpoint.toString())
                .setSsl("https".equals(endpoint.getScheme()))
                .setFollowRedirects(false)
                .setIdleTimeout(timeout.toMillis());
        headers.forEach(options::putHeader);
        LOG.debugv("Fetching discovery document from {0}", endpoint);
        final Uni<DiscoveryResponse> exchange = httpClient
                .request(options)
                .flatMap(HttpClientRequest::send)
                .flatMap(response -> readBounded(endpoint, response, maxBytes));
        return guard(exchange, endpoint, timeout);
    }

    private static Uni<DiscoveryResponse> readBounded(URI endpoint, HttpClientResponse response, long maxBytes) {
        final var declared = response.getHeader("Content-Length");
        if (declared != null && parseLength(declared) > maxBytes) {
            response.request().reset();
            return Uni.createFrom().failure(tooLarge(endpoint, maxBytes));
        }
        final var body = Buffer.buffer();
        return response.toMulti()
                .onItem()
                .invoke(chunk -> {
                    if (body.length() + chunk.length() > maxBytes) {
                        response.request().reset();
                        throw tooLarge(endpoint, maxBytes);
                    }
                    body.appendBuffer(chunk);
                })
                .collect()
                .last()
                .map(ignored -> new DiscoveryResponse(response.statusCode(), body.toString()));
    }

    private Uni<HttpResponse<Buffer>> send(HttpRequest<Buffer> request, URI endpoint, Duration timeout) {
        LOG.debugv("Calling discovery endpoint {0}", endpoint);
        return guard(
                request.ssl("https".equals(endpoint.getScheme()))
                        .timeout(timeout.toMillis())
                        .send(),
                endpoint,
                timeout);
    }

    private static <T> Uni<T> guard(Uni<T> call, URI endpoint, Duration timeout) {
        return call.ifNoItem()
                .after(timeout)
                .failWith(() -> new DiscoveryException(
                        DiscoveryErrorType.TIMEOUT_ERROR, "Timed out after " + timeout + " calling " + endpoint))
                .onFailure(e -> !(e instanceof DiscoveryException))
                .transform(e -> classify(endpoint, e));
    }

    static DiscoveryException classify(URI endpoint, Throwable error) {
        if (isTimeout(error)) {
            return new DiscoveryException(
                    DiscoveryErrorType.TIMEOUT_ERROR, "Timed out calling " + endpoint + ": " + error.getMessage(), error);
        }
        return new DiscoveryException(
                DiscoveryErrorType.NETWORK_ERROR, "Unable to reach " + endpoint + ": " + error.getMessage(), error);
    }

    private static boolean isTimeout(Throwable error) {
        for (var current = error; current != null; current = current.getCause()) {
            if (current instanceof TimeoutException
                    || current.getClass().getSimpleName().contains("Timeout")) {
                return true;
            }
        }
        return false;
    }

    private static long parseLength(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static DiscoveryException tooLarge(URI endpoint, long maxBytes) {
        return DiscoveryException.validation(
                "Discovery response from " + endpoint + " exceeds " + maxBytes + " bytes");
    }
}
