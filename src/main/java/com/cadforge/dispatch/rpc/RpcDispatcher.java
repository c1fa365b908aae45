package com.cadforge.dispatch.rpc;

import com.cadforge.core.constraint.ConstraintService;
import com.cadforge.core.coordination.LeaseLockService;
import com.cadforge.core.entity.EntityService;
import com.cadforge.core.error.CadforgeException;
import com.cadforge.core.health.HealthCheckService;
import com.cadforge.core.model.ConflictResolution;
import com.cadforge.core.oplog.HistoryService;
import com.cadforge.core.workspace.WorkspaceService;
import com.cadforge.dispatch.Payloads;
import com.cadforge.dispatch.api.ApplyResponse;
import com.cadforge.dispatch.api.ConstraintReportResponse;
import com.cadforge.dispatch.api.ConstraintResponse;
import com.cadforge.dispatch.api.EntityDeletionResponse;
import com.cadforge.dispatch.api.EntityDetailsResponse;
import com.cadforge.dispatch.api.EntityResponse;
import com.cadforge.dispatch.api.EntityUpdateResponse;
import com.cadforge.dispatch.api.ErrorResponse;
import com.cadforge.dispatch.api.HealthResponse;
import com.cadforge.dispatch.api.LockResponse;
import com.cadforge.dispatch.api.MergeResponse;
import com.cadforge.dispatch.api.OperationResponse;
import com.cadforge.dispatch.api.UndoResponse;
import com.cadforge.dispatch.api.WorkspaceResponse;
import com.cadforge.dispatch.api.WorkspaceStatusResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * JSON-RPC 2.0 front end over the core services. One request per line in,
 * one response per line out; notifications (no {@code id}) get no response.
 * <p>
 * Core failures map to their {@code ErrorKind} code with
 * {@link ErrorResponse.Data} as error data. Results are the same response
 * records the REST API writes.
 */
@Component
public class RpcDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RpcDispatcher.class);

    static final int PARSE_ERROR = -32700;
    static final int INVALID_REQUEST = -32600;
    static final int METHOD_NOT_FOUND = -32601;
    static final int INVALID_PARAMS = -32602;
    static final int INTERNAL_ERROR = -32603;

    private static final TypeReference<Map<String, Double>> NUMBERS = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {};

    private final EntityService entityService;
    private final ConstraintService constraintService;
    private final WorkspaceService workspaceService;
    private final HistoryService historyService;
    private final LeaseLockService leaseLockService;
    private final HealthCheckService healthCheckService;
    private final ObjectMapper mapper;
    private final Map<String, Function<Call, Object>> methods = new LinkedHashMap<>();

    public RpcDispatcher(EntityService entityService,
                         ConstraintService constraintService,
                         WorkspaceService workspaceService,
                         HistoryService historyService,
                         LeaseLockService leaseLockService,
                         HealthCheckService healthCheckService,
                         ObjectMapper mapper) {
        this.entityService = entityService;
        this.constraintService = constraintService;
        this.workspaceService = workspaceService;
        this.historyService = historyService;
        this.leaseLockService = leaseLockService;
        this.healthCheckService = healthCheckService;
        this.mapper = mapper;
        registerMethods();
    }

    /** Method names this dispatcher answers, sorted. */
    public List<String> methodNames() {
        return List.copyOf(new TreeSet<>(methods.keySet()));
    }

    /**
     * Handles one request line.
     *
     * @param defaultAgentId agent used when the params carry no {@code agent_id}
     * @return the response line, or null for a notification
     */
    public String handle(String line, String defaultAgentId) {
        JsonNode request;
        try {
            request = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable request: {}", e.getOriginalMessage());
            return write(error(null, PARSE_ERROR, "Parse error", null));
        }
        if (request == null || !request.isObject()
                || !"2.0".equals(request.path("jsonrpc").asText())
                || !request.path("method").isTextual()) {
            return write(error(idOf(request), INVALID_REQUEST, "Invalid Request", null));
        }

        JsonNode id = request.get("id");
        boolean notification = id == null;
        String method = request.get("method").asText();
        JsonNode params = request.has("params") ? request.get("params") : mapper.createObjectNode();
        if (!params.isObject()) {
            return notification ? null
                    : write(error(id, INVALID_PARAMS, "params must be an object", null));
        }

        ObjectNode response = dispatch(id, method, params, defaultAgentId);
        return notification ? null : write(response);
    }

    private ObjectNode dispatch(JsonNode id, String method, JsonNode params, String defaultAgentId) {
        Function<Call, Object> handler = methods.get(method);
        if (handler == null) {
            return error(id, METHOD_NOT_FOUND, "Method not found: " + method, null);
        }
        String agentId = params.hasNonNull("agent_id") ? params.get("agent_id").asText() : defaultAgentId;
        try {
            Object result = handler.apply(new Call(params, agentId));
            ObjectNode response = envelope(id);
            response.set("result", mapper.valueToTree(result));
            return response;
        } catch (InvalidParamsException e) {
            return error(id, INVALID_PARAMS, e.getMessage(), null);
        } catch (CadforgeException e) {
            if (e.kind().httpStatus() >= 500) {
                log.error("{} failed: {}", method, e.getMessage(), e);
            } else {
                log.debug("{} rejected: {}", method, e.getMessage());
            }
            return error(id, e.kind().code(), e.getMessage(), ErrorResponse.Data.from(e));
        } catch (RuntimeException e) {
            log.error("{} failed unexpectedly", method, e);
            return error(id, INTERNAL_ERROR, "Internal error: " + e.getMessage(), null);
        }
    }

    private void registerMethods() {
        methods.put("entity.create", call -> EntityResponse.from(entityService.create(
                call.text("workspace_id"),
                Payloads.entityType(call.text("type")),
                call.numbers("parameters"),
                call.strings("parent_ids"),
                call.agentId())));
        methods.put("entity.update", call -> EntityUpdateResponse.from(entityService.update(
                call.text("workspace_id"), call.text("entity_id"), call.numbers("parameters"), call.agentId())));
        methods.put("entity.delete", call -> EntityDeletionResponse.from(entityService.delete(
                call.text("workspace_id"), call.text("entity_id"), call.agentId())));
        methods.put("entity.query", call -> EntityDetailsResponse.from(entityService.query(
                call.text("workspace_id"), call.text("entity_id"))));
        methods.put("entity.list", call -> entityService.list(
                        call.text("workspace_id"), Payloads.entityTypeOrNull(call.optionalText("type")))
                .stream().map(EntityResponse::from).toList());

        methods.put("constraint.apply", call -> ApplyResponse.from(constraintService.apply(
                call.text("workspace_id"),
                Payloads.constraintType(call.text("constraint_type")),
                call.strings("entity_ids"),
                call.numbers("parameters"),
                call.optionalNumber("tolerance"),
                call.agentId())));
        methods.put("constraint.remove", call -> ConstraintResponse.from(constraintService.remove(
                call.text("workspace_id"), call.text("constraint_id"), call.agentId())));
        methods.put("constraint.status", call -> ConstraintReportResponse.from(constraintService.status(
                call.text("workspace_id"), call.optionalText("sketch_id"))));

        methods.put("workspace.create", call -> WorkspaceResponse.from(workspaceService.create(
                call.text("name"), call.optionalText("base_workspace_id"), call.agentId())));
        methods.put("workspace.status", call -> WorkspaceStatusResponse.from(workspaceService.status(
                call.text("workspace_id"))));
        methods.put("workspace.list", call -> workspaceService.list().stream()
                .map(WorkspaceStatusResponse::from).toList());
        methods.put("workspace.delete", call -> WorkspaceResponse.Deleted.from(
                workspaceService.delete(call.text("workspace_id"), call.agentId())));
        methods.put("workspace.merge", this::merge);

        methods.put("history.list", call -> historyService.list(
                        call.text("workspace_id"), call.optionalInt("limit", 50), call.optionalInt("offset", 0))
                .stream().map(OperationResponse::from).toList());
        methods.put("history.undo", call -> UndoResponse.from(historyService.undo(
                call.text("workspace_id"), call.agentId())));

        methods.put("lock.acquire", call -> LockResponse.Granted.from(leaseLockService.acquire(
                call.text("resource_type"),
                call.text("resource_name"),
                call.optionalText("holder") != null ? call.optionalText("holder") : call.agentId(),
                call.optionalText("session_id"),
                call.optionalLong("ttl_seconds"))));
        methods.put("lock.release", call -> new LockResponse.Released(leaseLockService.release(
                call.text("resource_type"),
                call.text("resource_name"),
                call.optionalText("holder") != null ? call.optionalText("holder") : call.agentId())));
        methods.put("lock.status", call -> LockResponse.Status.of(
                leaseLockService.status(call.text("resource_type"), call.text("resource_name"))));
        methods.put("lock.list", call -> leaseLockService.list().stream().map(LockResponse::from).toList());

        methods.put("health.check", call -> healthCheckService.checkAll().stream()
                .map(HealthResponse.Check::from).toList());
    }

    private Object merge(Call call) {
        String source = call.text("source_workspace_id");
        String target = call.optionalText("target_workspace_id");
        if (target == null) {
            target = workspaceService.status(source).workspace().baseWorkspaceId();
        }
        Map<String, ConflictResolution> resolutions = new LinkedHashMap<>();
        JsonNode node = call.params().path("resolutions");
        if (!node.isMissingNode() && !node.isNull()) {
            if (!node.isObject()) {
                throw new InvalidParamsException("resolutions must be an object keyed by entity id");
            }
            node.fields().forEachRemaining(entry -> {
                JsonNode value = entry.getValue();
                Map<String, Double> parameters = value.has("parameters")
                        ? convert(value.get("parameters"), NUMBERS, "resolutions." + entry.getKey() + ".parameters")
                        : Map.of();
                resolutions.put(entry.getKey(), Payloads.resolution(value.path("option").asText(null), parameters));
            });
        }
        return MergeResponse.from(workspaceService.merge(source, target,
                Payloads.mergeStrategy(call.optionalText("strategy")), resolutions, call.agentId()));
    }

    private <T> T convert(JsonNode node, TypeReference<T> type, String name) {
        try {
            return mapper.convertValue(node, type);
        } catch (IllegalArgumentException e) {
            throw new InvalidParamsException("Invalid value for '" + name + "'");
        }
    }

    private ObjectNode envelope(JsonNode id) {
        ObjectNode response = mapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id != null ? id : JsonNodeFactory.instance.nullNode());
        return response;
    }

    private ObjectNode error(JsonNode id, int code, String message, Object data) {
        ObjectNode error = mapper.createObjectNode();
        error.put("code", code);
        error.put("message", message);
        if (data != null) {
            error.set("data", mapper.valueToTree(data));
        }
        ObjectNode response = envelope(id);
        response.set("error", error);
        return response;
    }

    private String write(ObjectNode response) {
        try {
            return mapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialise response", e);
            return "{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":" + INTERNAL_ERROR
                    + ",\"message\":\"Response serialisation failed\"}}";
        }
    }

    private static JsonNode idOf(JsonNode request) {
        return request != null && request.isObject() ? request.get("id") : null;
    }

    /** Params of one call with typed accessors; missing or mistyped values are invalid params. */
    private final class Call {

        private final JsonNode params;
        private final String agentId;

        private Call(JsonNode params, String agentId) {
            this.params = params;
            this.agentId = agentId;
        }

        JsonNode params() {
            return params;
        }

        String agentId() {
            return agentId;
        }

        String text(String name) {
            String value = optionalText(name);
            if (value == null || value.isBlank()) {
                throw new InvalidParamsException("Missing required parameter '" + name + "'");
            }
            return value;
        }

        String optionalText(String name) {
            JsonNode node = params.get(name);
            if (node == null || node.isNull()) {
                return null;
            }
            if (!node.isTextual()) {
                throw new InvalidParamsException("Parameter '" + name + "' must be a string");
            }
            return node.asText();
        }

        Map<String, Double> numbers(String name) {
            JsonNode node = params.get(name);
            return node == null || node.isNull() ? Map.of() : convert(node, NUMBERS, name);
        }

        List<String> strings(String name) {
            JsonNode node = params.get(name);
            return node == null || node.isNull() ? List.of() : convert(node, STRINGS, name);
        }

        Double optionalNumber(String name) {
            JsonNode node = params.get(name);
            if (node == null || node.isNull()) {
                return null;
            }
            if (!node.isNumber()) {
                throw new InvalidParamsException("Parameter '" + name + "' must be a number");
            }
            return node.asDouble();
        }

        Long optionalLong(String name) {
            JsonNode node = params.get(name);
            if (node == null || node.isNull()) {
                return null;
            }
            if (!node.canConvertToLong() || !node.isIntegralNumber()) {
                throw new InvalidParamsException("Parameter '" + name + "' must be an integer");
            }
            return node.asLong();
        }

        int optionalInt(String name, int defaultValue) {
            Long value = optionalLong(name);
            return value != null ? value.intValue() : defaultValue;
        }
    }

    static final class InvalidParamsException extends RuntimeException {
        InvalidParamsException(String message) {
            super(message);
        }
    }
}
