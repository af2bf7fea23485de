package dev.plotrpc.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.plotrpc.transport.MessageEndpoint;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON-RPC 2.0 peer on top of any {@link MessageEndpoint}. Both directions are supported: outbound
 * calls and notifications, and inbound requests and notifications routed to registered handlers.
 *
 * <p>No threads of its own. Inbound messages, handlers included, run on the endpoint's dispatch
 * thread; {@link #call} and {@link #notify} send on the caller's thread. A handler must therefore
 * not block on the result of its own outbound call, because the reply is delivered by the very
 * thread it would be blocking.</p>
 */
public class JsonRpc implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonRpc.class);

    private final MessageEndpoint endpoint;
    private final ObjectMapper mapper;
    private final ObjectReader reader;
    private final String callbackName = "jsonrpc-" + UUID.randomUUID();

    private final Map<String, MethodHandler> handlers = new ConcurrentHashMap<>();
    private final Map<String, NotificationHandler> notifications = new ConcurrentHashMap<>();

    private final Map<Long, PendingCall> pendingCalls = new HashMap<>();
    private final Object pendingLock = new Object();
    private final AtomicLong requestCounter = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean();

    public JsonRpc(MessageEndpoint endpoint) {
        this(endpoint, new ObjectMapper());
    }

    public JsonRpc(MessageEndpoint endpoint, ObjectMapper mapper) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.reader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        endpoint.registerCallback(callbackName, this::handleIncomingMessage);
    }

    public MessageEndpoint getEndpoint() {
        return endpoint;
    }

    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    /**
     * Answer requests for {@code method}. Replaces an existing handler for the same name.
     */
    public void registerHandler(String method, MethodHandler handler) {
        handlers.put(Objects.requireNonNull(method, "method"), Objects.requireNonNull(handler, "handler"));
    }

    public void unregisterHandler(String method) {
        handlers.remove(method);
    }

    public void registerNotification(String method, NotificationHandler handler) {
        notifications.put(Objects.requireNonNull(method, "method"), Objects.requireNonNull(handler, "handler"));
        LOGGER.debug("Registered notification handler for {}", method);
    }

    public void unregisterNotification(String method) {
        notifications.remove(method);
    }

    /**
     * Issue a request and return immediately. The returned call resolves when the matching reply
     * arrives; nothing times out on its own. After {@link #close()} the call is returned already
     * resolved to {@code null} and nothing is sent.
     */
    public PendingCall call(String method, JsonNode params) {
        Objects.requireNonNull(method, "method");
        long id = requestCounter.incrementAndGet();
        PendingCall pending = new PendingCall(id, method, this::forget);
        boolean registered;
        synchronized (pendingLock) {
            registered = !closed.get();
            if (registered) {
                pendingCalls.put(id, pending);
            }
        }
        if (!registered) {
            LOGGER.warn("Call to {} after close, resolving to null", method);
            pending.cancel();
            return pending;
        }
        if (!send(JsonRpcMessages.request(method, params, id))) {
            LOGGER.warn("Request {} for {} was not delivered", id, method);
        }
        LOGGER.debug("Called {} method, id={}", method, id);
        return pending;
    }

    /**
     * Send a notification. No reply is expected.
     * @return whether the endpoint accepted the message
     */
    public boolean notify(String method, JsonNode params) {
        Objects.requireNonNull(method, "method");
        return send(JsonRpcMessages.notification(method, params));
    }

    public int getPendingCallCount() {
        synchronized (pendingLock) {
            return pendingCalls.size();
        }
    }

    /**
     * Stop the endpoint, detach from it, and resolve every outstanding call to {@code null}.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        endpoint.stop();
        endpoint.unregisterCallback(callbackName);
        List<PendingCall> outstanding;
        synchronized (pendingLock) {
            outstanding = new ArrayList<>(pendingCalls.values());
        }
        outstanding.forEach(PendingCall::cancel);
    }

    private void forget(PendingCall call) {
        synchronized (pendingLock) {
            pendingCalls.remove(call.id());
        }
    }

    void handleIncomingMessage(String message) {
        JsonNode parsed;
        try {
            parsed = reader.readTree(message);
        } catch (JsonProcessingException e) {
            LOGGER.error("JSON-RPC parse error: {}", e.getOriginalMessage());
            sendError(NullNode.getInstance(), JsonRpcErrorCode.PARSE_ERROR.code(),
                "Parse error: " + e.getOriginalMessage(), null);
            return;
        }
        if (parsed == null || parsed.isMissingNode()) {
            LOGGER.error("JSON-RPC parse error: empty message");
            sendError(NullNode.getInstance(), JsonRpcErrorCode.PARSE_ERROR.code(), "Parse error: empty message", null);
            return;
        }
        if (!parsed.isObject()) {
            LOGGER.warn("Ignoring non-object JSON-RPC message: {}", message);
            return;
        }
        if (JsonRpcMessages.isResponse(parsed)) {
            handleResponse(parsed);
            return;
        }

        JsonNode id = parsed.get("id");
        JsonNode version = parsed.get("jsonrpc");
        JsonNode methodNode = parsed.get("method");
        if (version == null || !version.isTextual() || !JsonRpcMessages.VERSION.equals(version.textValue())
            || methodNode == null || !methodNode.isTextual()) {
            if (id != null) {
                sendError(id, JsonRpcErrorCode.INVALID_REQUEST.code(), "Invalid JSON-RPC request format", null);
            } else {
                LOGGER.debug("Dropping malformed notification: {}", message);
            }
            return;
        }

        String method = methodNode.textValue();
        JsonNode params = parsed.has("params") ? parsed.get("params") : NullNode.getInstance();
        if (id == null) {
            handleNotification(method, params);
        } else {
            handleRequest(id, method, params);
        }
    }

    private void handleNotification(String method, JsonNode params) {
        NotificationHandler handler = notifications.get(method);
        if (handler == null) {
            LOGGER.debug("No notification handler for {}", method);
            return;
        }
        try {
            handler.handle(params);
        } catch (Exception e) {
            LOGGER.error("Notification handler for {} failed", method, e);
        }
    }

    private void handleRequest(JsonNode id, String method, JsonNode params) {
        MethodHandler handler = handlers.get(method);
        if (handler == null) {
            sendError(id, JsonRpcErrorCode.METHOD_NOT_FOUND.code(), "Method not found: " + method, null);
            return;
        }
        JsonNode result;
        try {
            result = handler.handle(params);
        } catch (JsonRpcException e) {
            sendError(id, e.getCode(), e.getMessage(), e.getData());
            return;
        } catch (Exception e) {
            LOGGER.error("Handler for method {} threw exception", method, e);
            sendError(id, JsonRpcErrorCode.INTERNAL_ERROR.code(), "Internal error: " + e.getMessage(), null);
            return;
        }
        send(JsonRpcMessages.result(id, result));
    }

    private void handleResponse(JsonNode response) {
        JsonNode id = response.get("id");
        if (id == null || !id.isIntegralNumber()) {
            LOGGER.debug("Dropping response without a numeric id: {}", response);
            return;
        }
        PendingCall pending;
        synchronized (pendingLock) {
            pending = pendingCalls.remove(id.asLong());
        }
        if (pending == null) {
            LOGGER.debug("No pending call for id {}, dropping response", id);
            return;
        }
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            pending.fail(JsonRpcException.fromErrorObject(error));
        } else {
            LOGGER.debug("Received response for {} method, id={}", pending.method(), id);
            pending.resolve(response.has("result") ? response.get("result") : NullNode.getInstance());
        }
    }

    private void sendError(JsonNode id, int code, String message, JsonNode data) {
        send(JsonRpcMessages.error(id, code, message, data));
    }

    private boolean send(ObjectNode message) {
        String json;
        try {
            json = mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to serialize JSON-RPC message", e);
            return false;
        }
        return endpoint.send(json);
    }
}
