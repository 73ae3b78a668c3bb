package cloud.fleethub.sdk.paging;

import cloud.fleethub.sdk.FleetHubException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Extracts items and the continuation signal from a page body.
 */
@FunctionalInterface
public interface PageReader {

    /**
     * @throws FleetHubException when the body does not look like a page.
     */
    Page read(JsonNode body) throws FleetHubException;
}
