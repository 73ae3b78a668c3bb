package cloud.fleethub.sdk.outcome;

import cloud.fleethub.sdk.internal.ApiErrorDecoder;
import cloud.fleethub.sdk.internal.Json;
import cloud.fleethub.sdk.transport.RawResult;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps raw transport results onto retry dispositions and final {@link Outcome}s.
 */
public final class ErrorClassifier {

    /** Statuses retried unchanged besides the 5xx range. */
    public static final Set<Integer> TRANSIENT_STATUSES = Set.of(408, 425, 429, 500, 502, 503, 504);

    /** Statuses whose body may enumerate per-item results. */
    public static final Set<Integer> MULTI_STATUS = Set.of(206, 207);

    private static final Set<String> ITEM_SUCCESS = Set.of(
        "success", "succeeded", "ok", "completed", "created", "updated", "deleted", "accepted");
    private static final Set<String> ITEM_FAILURE = Set.of("failed", "failure", "error", "rejected");
    private static final List<String> ITEM_ARRAYS = List.of("results", "items", "data");

    public Disposition disposition(RawResult raw) {
        if (raw.isTransportFailure()) {
            return Disposition.TRANSIENT;
        }
        int status = raw.statusCode();
        if (status == 401 || status == 403) {
            return Disposition.AUTHENTICATION;
        }
        if (TRANSIENT_STATUSES.contains(status) || status >= 500) {
            return Disposition.TRANSIENT;
        }
        if (status >= 200 && status < 300) {
            return Disposition.SUCCESS;
        }
        return Disposition.TERMINAL;
    }

    /**
     * Classifies the terminal result of a (possibly retried) single request. A transient disposition reaching
     * this point means the retry budget is spent.
     */
    public Outcome classify(RawResult raw) {
        switch (disposition(raw)) {
            case AUTHENTICATION:
                return new Outcome.Authentication(Outcome.Authentication.Reason.REJECTED, diagnose(raw));
            case TRANSIENT:
                return new Outcome.Failed(Outcome.Failed.Reason.TRANSIENT_EXHAUSTED, diagnose(raw));
            case TERMINAL:
                return new Outcome.Failed(Outcome.Failed.Reason.BUSINESS, diagnose(raw));
            default:
                return classifySuccess(raw);
        }
    }

    private Outcome classifySuccess(RawResult raw) {
        JsonNode body = raw.json();
        if (body == null && raw.body().length > 0) {
            return new Outcome.Failed(Outcome.Failed.Reason.UNEXPECTED, new Diagnostic(
                "response body is not valid JSON", null, raw.statusCode()));
        }

        if (MULTI_STATUS.contains(raw.statusCode())) {
            List<ItemResult> results = itemResults(body);
            if (results.stream().anyMatch(item -> !item.succeeded())) {
                return new Outcome.PartialSuccess(raw.statusCode(), results, body);
            }
        }

        if (hasEmbeddedError(body)) {
            return new Outcome.Failed(Outcome.Failed.Reason.BUSINESS, diagnoseEmbedded(raw, body));
        }
        return new Outcome.Complete(raw.statusCode(), body, 1);
    }

    /**
     * Builds the richest diagnostic available: a message from the response body wins over transport text.
     */
    public Diagnostic diagnose(RawResult raw) {
        if (raw.isTransportFailure()) {
            Exception error = raw.transportError();
            String detail = error.getMessage() == null || error.getMessage().isBlank()
                ? error.getClass().getSimpleName() : error.getMessage();
            String prefix = error instanceof HttpTimeoutException ? "request timed out: " : "transport failure: ";
            return new Diagnostic(prefix + detail, null, 0);
        }

        JsonNode body = raw.json();
        String message = ApiErrorDecoder.message(body);
        String code = ApiErrorDecoder.code(body);
        if (message == null) {
            String text = body == null ? raw.bodyAsString().trim() : "";
            message = text.isEmpty() || text.length() > 512
                ? String.format(Locale.ROOT, "FleetHub request failed with status %d", raw.statusCode())
                : text;
        }
        return new Diagnostic(message, code, raw.statusCode());
    }

    /**
     * A 2xx body describes an application-level error only when it carries an explicit error signal:
     * {@code success:false}, a non-empty {@code errors} array, or an {@code error} object with a code or message.
     * A resource whose own {@code status} reads "failed" is a successful read of that resource.
     */
    public boolean hasEmbeddedError(JsonNode body) {
        if (body == null || !body.isObject()) {
            return false;
        }
        JsonNode success = body.path("success");
        if (success.isBoolean() && !success.asBoolean()) {
            return true;
        }
        JsonNode errors = body.path("errors");
        if (errors.isArray() && errors.size() > 0) {
            return true;
        }
        JsonNode error = body.path("error");
        return error.isObject() && (Json.text(error, "code") != null || Json.text(error, "message") != null);
    }

    private Diagnostic diagnoseEmbedded(RawResult raw, JsonNode body) {
        Diagnostic detail = diagnose(raw);
        JsonNode errors = body.path("errors");
        if (ApiErrorDecoder.message(body) != null || !errors.isArray() || errors.size() == 0) {
            return detail;
        }
        JsonNode first = errors.get(0);
        String message = first.isTextual() ? first.asText() : ApiErrorDecoder.message(first);
        String code = detail.code() != null ? detail.code() : ApiErrorDecoder.code(first);
        return new Diagnostic(message == null ? detail.message() : message, code, raw.statusCode());
    }

    /**
     * Reads per-item results from a multi-status body; items appear under {@code results}, {@code items} or
     * {@code data}, or the body itself is the array.
     */
    public List<ItemResult> itemResults(JsonNode body) {
        if (body == null) {
            return Collections.emptyList();
        }
        JsonNode array = body.isArray() ? body : null;
        if (array == null) {
            for (String field : ITEM_ARRAYS) {
                if (body.path(field).isArray()) {
                    array = body.path(field);
                    break;
                }
            }
        }
        if (array == null) {
            return Collections.emptyList();
        }

        List<ItemResult> results = new ArrayList<>(array.size());
        for (JsonNode item : array) {
            results.add(itemResult(item));
        }
        return results;
    }

    private ItemResult itemResult(JsonNode item) {
        String id = Json.text(item, "id");
        if (id == null) {
            id = Json.text(item, "name");
        }
        JsonNode statusNode = item.path("status");
        int status = statusNode.isInt() ? statusNode.asInt() : 0;
        return new ItemResult(id, itemSucceeded(item, statusNode), status,
            ApiErrorDecoder.code(item), ApiErrorDecoder.message(item), item);
    }

    private boolean itemSucceeded(JsonNode item, JsonNode statusNode) {
        if (statusNode.isInt()) {
            int status = statusNode.asInt();
            return status >= 200 && status < 300;
        }
        if (statusNode.isTextual()) {
            String status = statusNode.asText().toLowerCase(Locale.ROOT);
            if (ITEM_SUCCESS.contains(status)) {
                return true;
            }
            if (ITEM_FAILURE.contains(status)) {
                return false;
            }
        }
        JsonNode success = item.path("success");
        if (success.isBoolean()) {
            return success.asBoolean();
        }
        JsonNode error = item.path("error");
        return !(error.isObject() || error.isTextual()) && !item.hasNonNull("code");
    }
}
