package cloud.fleethub.sdk.outcome;

import cloud.fleethub.sdk.FleetHubException;
import cloud.fleethub.sdk.dryrun.RenderedRequest;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The single result of executing one {@link cloud.fleethub.sdk.request.RequestDescriptor}.
 *
 * <p>
 * Each variant carries only the fields relevant to it. Use {@link #category()} for switch-style dispatch, or
 * {@link #payloadOrThrow()} when any non-complete result should become an exception.
 * </p>
 */
public sealed interface Outcome
    permits Outcome.Complete, Outcome.PartialSuccess, Outcome.Failed, Outcome.Authentication,
    Outcome.Cancelled, Outcome.DryRun {

    enum Category {
        COMPLETE,
        PARTIAL_SUCCESS,
        FAILED,
        AUTHENTICATION,
        CANCELLED,
        DRY_RUN
    }

    Category category();

    default Optional<Diagnostic> diagnostic() {
        return Optional.empty();
    }

    /**
     * @return the payload of a {@link Complete} outcome.
     * @throws FleetHubException carrying this outcome's diagnostic for every other variant.
     */
    default JsonNode payloadOrThrow() throws FleetHubException {
        if (this instanceof Complete) {
            return ((Complete) this).payload();
        }
        Optional<Diagnostic> detail = diagnostic();
        if (detail.isPresent()) {
            throw detail.get().toException();
        }
        throw new FleetHubException("request did not complete: " + category());
    }

    /**
     * Request fully satisfied. For aggregated collections {@code payload} is an array holding every item in
     * fetch order and {@code pageCount} the number of pages fetched.
     */
    record Complete(int statusCode, JsonNode payload, int pageCount) implements Outcome {

        @Override
        public Category category() {
            return Category.COMPLETE;
        }

        public List<JsonNode> items() {
            if (payload == null || payload.isNull() || payload.isMissingNode()) {
                return List.of();
            }
            if (!payload.isArray()) {
                return List.of(payload);
            }
            List<JsonNode> items = new ArrayList<>(payload.size());
            payload.forEach(items::add);
            return items;
        }
    }

    /**
     * The service accepted the request but could not apply all of it.
     */
    record PartialSuccess(int statusCode, List<ItemResult> results, JsonNode payload) implements Outcome {

        public PartialSuccess {
            results = List.copyOf(results);
        }

        @Override
        public Category category() {
            return Category.PARTIAL_SUCCESS;
        }

        public List<ItemResult> succeeded() {
            return results.stream().filter(ItemResult::succeeded).toList();
        }

        public List<ItemResult> failed() {
            return results.stream().filter(item -> !item.succeeded()).toList();
        }

        @Override
        public Optional<Diagnostic> diagnostic() {
            List<ItemResult> failures = failed();
            String code = failures.isEmpty() ? null : failures.get(0).code();
            return Optional.of(new Diagnostic(
                failures.size() + " of " + results.size() + " items failed", code, statusCode));
        }
    }

    record Failed(Reason reason, Diagnostic detail) implements Outcome {

        public enum Reason {
            /** The descriptor itself was malformed; nothing was sent. */
            VALIDATION,
            /** 4xx other than authentication, or a 2xx body carrying an application error. */
            BUSINESS,
            /** Transient failures persisted through every allowed attempt. */
            TRANSIENT_EXHAUSTED,
            /** Pagination hit its page ceiling or a repeating cursor before the service reported the end. */
            PAGINATION_EXHAUSTED,
            /** A response that could not be interpreted. */
            UNEXPECTED
        }

        @Override
        public Category category() {
            return Category.FAILED;
        }

        @Override
        public Optional<Diagnostic> diagnostic() {
            return Optional.of(detail);
        }
    }

    /**
     * Session-related failure that needs operator attention; never retried further.
     */
    record Authentication(Reason reason, Diagnostic detail) implements Outcome {

        public enum Reason {
            /** No connect has occurred, or the session was disconnected. */
            NO_SESSION,
            /** The session was stale or rejected and could not be refreshed. */
            REFRESH_FAILED,
            /** The service rejected the request again after a refresh, or no refresh was possible. */
            REJECTED
        }

        @Override
        public Category category() {
            return Category.AUTHENTICATION;
        }

        @Override
        public Optional<Diagnostic> diagnostic() {
            return Optional.of(detail);
        }
    }

    /**
     * The caller aborted the call. Items gathered before the abort are kept in {@code partialItems} but the
     * result must not be mistaken for a complete one.
     */
    record Cancelled(String message, int pagesFetched, List<JsonNode> partialItems) implements Outcome {

        public Cancelled {
            partialItems = List.copyOf(partialItems);
        }

        @Override
        public Category category() {
            return Category.CANCELLED;
        }

        @Override
        public Optional<Diagnostic> diagnostic() {
            return Optional.of(Diagnostic.of(message));
        }
    }

    /**
     * Dry-run requested: the request was rendered and never sent.
     */
    record DryRun(RenderedRequest request) implements Outcome {

        @Override
        public Category category() {
            return Category.DRY_RUN;
        }
    }
}
