package cloud.fleethub.sdk.paging;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One page of a collection.
 *
 * @param continuation      value for the next page request, {@code null} when the service reported no more pages.
 * @param continuationParam query parameter that carries {@code continuation}, a cursor or an offset.
 */
public record Page(List<JsonNode> items, String continuation, String continuationParam) {

    public Page {
        items = List.copyOf(items);
        if (continuationParam == null) {
            continuationParam = PaginationAggregator.CURSOR_PARAM;
        }
    }

    public Page(List<JsonNode> items, String continuation) {
        this(items, continuation, PaginationAggregator.CURSOR_PARAM);
    }

    public boolean hasMore() {
        return continuation != null;
    }
}
