package cloud.fleethub.sdk.paging;

import cloud.fleethub.sdk.FleetHubException;
import cloud.fleethub.sdk.internal.Json;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the collection envelope used by the management API.
 *
 * <p>
 * A bare JSON array is a single, final page. Otherwise items are taken from {@code data}, {@code items} or
 * {@code results} and the cursor from {@code next_cursor}, {@code nextCursor}, {@code next} or
 * {@code meta.next_cursor}. A missing, null or blank cursor means no further pages.
 * </p>
 *
 * <p>
 * Without a cursor, an offset envelope ({@code offset}, {@code count}, {@code total}) continues with
 * {@code offset=offset+count} while that is below {@code total}. {@code count} defaults to the number of items on
 * the page; an empty page ends the collection.
 * </p>
 */
public final class CursorPageReader implements PageReader {

    private static final List<String> ITEM_FIELDS = List.of("data", "items", "results");
    private static final List<String> CURSOR_FIELDS = List.of("next_cursor", "nextCursor", "next");

    @Override
    public Page read(JsonNode body) throws FleetHubException {
        if (body == null || body.isNull()) {
            return new Page(List.of(), null);
        }
        if (body.isArray()) {
            return new Page(elements(body), null);
        }
        if (!body.isObject()) {
            throw new FleetHubException("collection response is neither an array nor an object");
        }

        JsonNode items = null;
        for (String field : ITEM_FIELDS) {
            if (body.path(field).isArray()) {
                items = body.path(field);
                break;
            }
        }
        if (items == null) {
            throw new FleetHubException("collection response has no data, items or results array");
        }
        List<JsonNode> elements = elements(items);
        String cursor = cursor(body);
        if (cursor != null) {
            return new Page(elements, cursor);
        }
        return new Page(elements, nextOffset(body, elements.size()), PaginationAggregator.OFFSET_PARAM);
    }

    private static String nextOffset(JsonNode body, int itemCount) {
        JsonNode total = body.path("total");
        if (!total.isNumber() || itemCount == 0) {
            return null;
        }
        JsonNode offset = body.path("offset");
        JsonNode count = body.path("count");
        long start = offset.isNumber() ? offset.asLong() : 0L;
        long size = count.isNumber() && count.asLong() > 0 ? count.asLong() : itemCount;
        long next = start + size;
        return next < total.asLong() ? Long.toString(next) : null;
    }

    private static String cursor(JsonNode body) {
        for (String field : CURSOR_FIELDS) {
            String value = Json.text(body, field);
            if (value != null) {
                return value;
            }
        }
        return Json.text(body.path("meta"), "next_cursor");
    }

    private static List<JsonNode> elements(JsonNode array) {
        List<JsonNode> items = new ArrayList<>(array.size());
        array.forEach(items::add);
        return items;
    }
}
