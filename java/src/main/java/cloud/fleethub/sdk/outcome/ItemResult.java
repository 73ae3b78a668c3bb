package cloud.fleethub.sdk.outcome;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result for one sub-item of a batch request reported through a multi-status response.
 *
 * @param id      item identifier when the service echoed one.
 * @param status  per-item HTTP status when reported, otherwise {@code 0}.
 * @param raw     the item exactly as the service returned it.
 */
public record ItemResult(String id, boolean succeeded, int status, String code, String message, JsonNode raw) {
}
