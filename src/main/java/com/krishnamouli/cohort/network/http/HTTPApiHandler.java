package com.krishnamouli.cohort.network.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.krishnamouli.cohort.config.JsonMappers;
import com.krishnamouli.cohort.config.StorageBackend;
import com.krishnamouli.cohort.engine.AssignmentEngine;
import com.krishnamouli.cohort.events.EventRecorder;
import com.krishnamouli.cohort.events.EventValidationException;
import com.krishnamouli.cohort.events.ExperimentResults;
import com.krishnamouli.cohort.events.TrackedEvent;
import com.krishnamouli.cohort.experiment.Experiment;
import com.krishnamouli.cohort.monitoring.AssignmentOutcome;
import com.krishnamouli.cohort.monitoring.MetricsCollector;
import com.krishnamouli.cohort.store.Assignment;
import com.krishnamouli.cohort.store.AssignmentStore;
import com.krishnamouli.cohort.store.AssignmentStores;
import com.krishnamouli.cohort.store.StoreUnavailableException;
import com.krishnamouli.cohort.store.client.CookieClientState;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP binding of the assignment and tracking API, plus health, metrics and
 * statistics endpoints.
 *
 * <p>
 * With the client storage backend each request gets a store over its own
 * cookies, and cookies written while handling it are returned as
 * {@code Set-Cookie} headers.
 */
public class HTTPApiHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    private static final Logger logger = LoggerFactory.getLogger(HTTPApiHandler.class);

    private final AssignmentEngine engine;
    private final EventRecorder recorder;
    private final ObjectMapper objectMapper;

    public HTTPApiHandler(AssignmentEngine engine, EventRecorder recorder) {
        this.engine = engine;
        this.recorder = recorder;
        this.objectMapper = JsonMappers.newMapper();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        String uri = request.uri();
        HttpMethod method = request.method();
        String[] path = splitPath(new QueryStringDecoder(uri).path());

        CookieClientState cookies = null;
        AssignmentEngine requestEngine = engine;
        if (engine.getConfig().getStorageBackend() == StorageBackend.CLIENT) {
            cookies = new CookieClientState(request.headers().get(HttpHeaderNames.COOKIE));
            requestEngine = engine.withStore(AssignmentStores.forClient(cookies, engine.getConfig()));
        }

        FullHttpResponse response;
        try {
            response = route(method, path, request, requestEngine);
            if (cookies != null) {
                for (String header : cookies.setCookieHeaders()) {
                    response.headers().add(HttpHeaderNames.SET_COOKIE, header);
                }
            }
        } catch (JsonProcessingException e) {
            response = createJsonError(HttpResponseStatus.BAD_REQUEST, "Malformed JSON: " + e.getOriginalMessage());
        } catch (BadRequestException | EventValidationException e) {
            response = createJsonError(HttpResponseStatus.BAD_REQUEST, e.getMessage());
        } catch (StoreUnavailableException e) {
            logger.warn("Assignment store unavailable for {} {}: {}", method, uri, e.getMessage());
            response = createJsonError(HttpResponseStatus.SERVICE_UNAVAILABLE, "Assignment store unavailable");
        } catch (Exception e) {
            logger.error("Error handling HTTP request: {}", uri, e);
            response = createErrorResponse(e.getMessage());
        }

        sendResponse(ctx, response);
    }

    private FullHttpResponse route(HttpMethod method, String[] path, FullHttpRequest request,
            AssignmentEngine requestEngine) throws Exception {
        String root = path.length > 0 ? path[0] : "";

        if (method == HttpMethod.POST && path.length == 1 && root.equals("assign")) {
            return handleAssign(request, requestEngine);
        } else if (method == HttpMethod.POST && path.length == 1 && root.equals("assignment")) {
            return handlePushAssignment(request, requestEngine.getStore());
        } else if (method == HttpMethod.GET && path.length == 3 && root.equals("assignment")) {
            return handleGetAssignment(path[1], path[2], requestEngine.getStore());
        } else if (method == HttpMethod.POST && path.length == 1 && root.equals("track")) {
            return handleTrack(request);
        } else if (method == HttpMethod.GET && path.length == 2 && root.equals("results")) {
            return handleResults(path[1]);
        } else if (method == HttpMethod.GET && path.length == 3 && root.equals("config")) {
            return handleVariantConfig(path[1], path[2]);
        } else if (method == HttpMethod.GET && path.length == 1 && root.equals("experiments")) {
            return createJsonResponse(HttpResponseStatus.OK, engine.getCatalog().listActive(Instant.now()));
        } else if (method == HttpMethod.GET && root.equals("health")) {
            return handleHealth();
        } else if (method == HttpMethod.GET && root.equals("metrics")) {
            return handleMetrics();
        } else if (method == HttpMethod.GET && root.equals("stats")) {
            return handleStats();
        }
        return createNotFoundResponse();
    }

    private FullHttpResponse handleAssign(FullHttpRequest request, AssignmentEngine requestEngine)
            throws Exception {
        AssignRequest body = readBody(request, AssignRequest.class);
        requireText(body.getExperimentId(), "experimentId");
        requireText(body.getSubjectId(), "subjectId");

        String variantId = requestEngine.assign(body.getExperimentId(), body.getSubjectId(), body.getContext());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("experimentId", body.getExperimentId());
        data.put("variantId", variantId);
        return createJsonResponse(HttpResponseStatus.OK, data);
    }

    private FullHttpResponse handlePushAssignment(FullHttpRequest request, AssignmentStore store)
            throws Exception {
        AssignmentPush body = readBody(request, AssignmentPush.class);
        requireText(body.getExperimentId(), "experimentId");
        requireText(body.getSubjectId(), "subjectId");
        requireText(body.getVariantId(), "variantId");

        Instant assignedAt = body.getAssignedAt() != null ? body.getAssignedAt() : Instant.now();
        store.put(body.getExperimentId(), body.getSubjectId(),
                Assignment.of(body.getVariantId(), assignedAt, engine.getConfig().sessionTimeout()));

        return createJsonResponse(HttpResponseStatus.OK, Map.of("success", true));
    }

    private FullHttpResponse handleGetAssignment(String experimentId, String subjectId, AssignmentStore store)
            throws Exception {
        Optional<Assignment> assignment = store.get(experimentId, subjectId);
        if (assignment.isEmpty()) {
            return createJsonError(HttpResponseStatus.NOT_FOUND, "No assignment found");
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("variantId", assignment.get().getVariantId());
        data.put("assignedAt", assignment.get().getAssignedAt());
        return createJsonResponse(HttpResponseStatus.OK, data);
    }

    private FullHttpResponse handleTrack(FullHttpRequest request) throws Exception {
        TrackedEvent event = readBody(request, TrackedEvent.class);
        recorder.trackEvent(event);
        return createJsonResponse(HttpResponseStatus.ACCEPTED, Map.of("success", true));
    }

    private FullHttpResponse handleResults(String experimentId) throws Exception {
        Experiment experiment = engine.getCatalog().get(experimentId).orElse(null);
        List<TrackedEvent> events = recorder.getResults(experimentId);
        return createJsonResponse(HttpResponseStatus.OK,
                ExperimentResults.summarize(experimentId, experiment, events, Instant.now()));
    }

    private FullHttpResponse handleVariantConfig(String experimentId, String variantId) throws Exception {
        Map<String, JsonNode> config = engine.getVariantConfig(experimentId, variantId);
        if (config == null) {
            return createJsonError(HttpResponseStatus.NOT_FOUND, "Variant not found");
        }
        return createJsonResponse(HttpResponseStatus.OK, config);
    }

    private FullHttpResponse handleHealth() throws Exception {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", engine.getConfig().isEnabled() ? "healthy" : "disabled");
        data.put("storageBackend", engine.getConfig().getStorageBackend());
        data.put("experiments", engine.getCatalog().size());
        data.put("activeExperiments", engine.getCatalog().listActive(Instant.now()).size());
        data.put("queuedEvents", recorder.queuedEvents());
        return createJsonResponse(HttpResponseStatus.OK, data);
    }

    private FullHttpResponse handleMetrics() {
        MetricsCollector.MetricsSnapshot snapshot = engine.getMetrics().getSnapshot();

        // Prometheus-compatible format
        StringBuilder prometheus = new StringBuilder();
        prometheus.append("# HELP cohort_assignments_total Assignment requests by outcome\n");
        prometheus.append("# TYPE cohort_assignments_total counter\n");
        for (Map.Entry<AssignmentOutcome, Long> entry : snapshot.outcomes.entrySet()) {
            prometheus.append(String.format("cohort_assignments_total{outcome=\"%s\"} %d\n",
                    entry.getKey().metricName(), entry.getValue()));
        }

        prometheus.append("# HELP cohort_store_failures_total Failed assignment store calls\n");
        prometheus.append("# TYPE cohort_store_failures_total counter\n");
        prometheus.append(String.format("cohort_store_failures_total %d\n", snapshot.storeFailures));

        prometheus.append("# HELP cohort_store_evictions_total Sticky assignments evicted before expiry\n");
        prometheus.append("# TYPE cohort_store_evictions_total counter\n");
        prometheus.append(String.format("cohort_store_evictions_total %d\n", engine.getStore().evictedCount()));

        prometheus.append("# HELP cohort_events_total Tracked events by result\n");
        prometheus.append("# TYPE cohort_events_total counter\n");
        prometheus.append(String.format("cohort_events_total{result=\"accepted\"} %d\n", snapshot.eventsAccepted));
        prometheus.append(String.format("cohort_events_total{result=\"rejected\"} %d\n", snapshot.eventsRejected));
        prometheus.append(String.format("cohort_events_total{result=\"dropped\"} %d\n", snapshot.eventsDropped));
        prometheus.append(String.format("cohort_events_total{result=\"written\"} %d\n", snapshot.eventsWritten));

        prometheus.append("# HELP cohort_assign_latency_milliseconds Assignment latency percentiles\n");
        prometheus.append("# TYPE cohort_assign_latency_milliseconds summary\n");
        prometheus.append(String.format("cohort_assign_latency_milliseconds{quantile=\"0.5\"} %.4f\n",
                snapshot.p50LatencyMs));
        prometheus.append(String.format("cohort_assign_latency_milliseconds{quantile=\"0.95\"} %.4f\n",
                snapshot.p95LatencyMs));
        prometheus.append(String.format("cohort_assign_latency_milliseconds{quantile=\"0.99\"} %.4f\n",
                snapshot.p99LatencyMs));

        return createTextResponse(HttpResponseStatus.OK, prometheus.toString());
    }

    private FullHttpResponse handleStats() throws Exception {
        MetricsCollector.MetricsSnapshot snapshot = engine.getMetrics().getSnapshot();

        Map<String, Object> outcomes = new LinkedHashMap<>();
        snapshot.outcomes.forEach((outcome, count) -> outcomes.put(outcome.metricName(), count));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("assignments", snapshot.totalAssignments);
        data.put("outcomes", outcomes);
        data.put("storeFailures", snapshot.storeFailures);
        data.put("storeEvictions", engine.getStore().evictedCount());
        data.put("events", Map.of(
                "accepted", snapshot.eventsAccepted,
                "rejected", snapshot.eventsRejected,
                "dropped", snapshot.eventsDropped,
                "written", snapshot.eventsWritten));
        data.put("latency", Map.of(
                "p50Ms", snapshot.p50LatencyMs,
                "p95Ms", snapshot.p95LatencyMs,
                "p99Ms", snapshot.p99LatencyMs));

        return createJsonResponse(HttpResponseStatus.OK, data);
    }

    private <T> T readBody(FullHttpRequest request, Class<T> type) throws JsonProcessingException {
        String body = request.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new BadRequestException("Request body is required");
        }
        T parsed = objectMapper.readValue(body, type);
        if (parsed == null) {
            throw new BadRequestException("Request body is required");
        }
        return parsed;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new BadRequestException("Missing required field: " + field);
        }
    }

    private static String[] splitPath(String path) {
        String trimmed = path.replaceAll("^/+|/+$", "");
        return trimmed.isEmpty() ? new String[0] : trimmed.split("/+");
    }

    private FullHttpResponse createJsonResponse(HttpResponseStatus status, Object data)
            throws JsonProcessingException {
        String json = objectMapper.writeValueAsString(data);
        byte[] content = json.getBytes(StandardCharsets.UTF_8);

        FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1,
                status,
                Unpooled.wrappedBuffer(content));

        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json");
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, content.length);
        response.headers().set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, "*");

        return response;
    }

    private FullHttpResponse createJsonError(HttpResponseStatus status, String message) {
        try {
            return createJsonResponse(status, Map.of("error", message != null ? message : status.reasonPhrase()));
        } catch (JsonProcessingException e) {
            return createTextResponse(status, message);
        }
    }

    private FullHttpResponse createTextResponse(HttpResponseStatus status, String text) {
        byte[] content = text.getBytes(StandardCharsets.UTF_8);

        FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1,
                status,
                Unpooled.wrappedBuffer(content));

        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=utf-8");
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, content.length);
        response.headers().set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, "*");

        return response;
    }

    private FullHttpResponse createNotFoundResponse() {
        return createTextResponse(HttpResponseStatus.NOT_FOUND, "Not Found");
    }

    private FullHttpResponse createErrorResponse(String message) {
        return createTextResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR, "Error: " + message);
    }

    private void sendResponse(ChannelHandlerContext ctx, FullHttpResponse response) {
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("HTTP handler exception", cause);
        ctx.close();
    }
}
