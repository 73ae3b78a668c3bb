package cloud.fleethub.sdk.paging;

import cloud.fleethub.sdk.CancellationToken;
import cloud.fleethub.sdk.FleetHubException;
import cloud.fleethub.sdk.internal.Json;
import cloud.fleethub.sdk.outcome.Diagnostic;
import cloud.fleethub.sdk.outcome.Outcome;
import cloud.fleethub.sdk.request.RequestDescriptor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Follows continuation cursors across a collection and concatenates the pages.
 *
 * <p>
 * Pages are fetched one after another through a caller-supplied fetch function, so each page gets its own
 * retries and session handling. Items keep page order and in-page order. Without
 * {@link RequestDescriptor#isSkipPaginationLimit()} the walk fails once {@code maxPages} pages have been read
 * and the service still reports more; with it, the walk continues until the service stops sending a cursor.
 * A cursor or offset the service already sent once is treated as a loop in either mode.
 * </p>
 */
public final class PaginationAggregator {

    private static final Logger LOGGER = Logger.getLogger(PaginationAggregator.class.getName());

    public static final int DEFAULT_PAGE_SIZE = 100;
    public static final int MAX_PAGE_SIZE = 1000;
    public static final int DEFAULT_MAX_PAGES = 50;
    public static final String LIMIT_PARAM = "limit";
    public static final String CURSOR_PARAM = "cursor";
    public static final String OFFSET_PARAM = "offset";

    private final PageReader reader;
    private final int pageSize;
    private final int maxPages;

    public PaginationAggregator(PageReader reader, int pageSize, int maxPages) {
        this.reader = Objects.requireNonNull(reader, "reader");
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("pageSize must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (maxPages < 1) {
            throw new IllegalArgumentException("maxPages must be positive");
        }
        this.pageSize = pageSize;
        this.maxPages = maxPages;
    }

    /**
     * @return the request for the first page: {@code descriptor} with {@code limit} set to the page size unless
     *         the caller already chose one.
     */
    public RequestDescriptor firstPage(RequestDescriptor descriptor) {
        return descriptor.getQuery().containsKey(LIMIT_PARAM)
            ? descriptor
            : descriptor.withQuery(LIMIT_PARAM, Integer.toString(pageSize));
    }

    /**
     * @param fetcher executes one page request and returns its outcome; anything other than
     *                {@link Outcome.Complete} ends the walk with that outcome.
     */
    public Outcome fetchAll(
        RequestDescriptor descriptor,
        CancellationToken cancellation,
        Function<RequestDescriptor, Outcome> fetcher
    ) {
        int ceiling = descriptor.isSkipPaginationLimit() ? Integer.MAX_VALUE : maxPages;
        RequestDescriptor first = firstPage(descriptor);

        List<JsonNode> collected = new ArrayList<>();
        Set<String> seenCursors = new HashSet<>();
        RequestDescriptor next = first;
        int pages = 0;
        int lastStatus = 200;

        while (true) {
            if (cancellation.isCancelled()) {
                int fetched = pages;
                LOGGER.info(() -> String.format(Locale.ROOT,
                    "[fleethub-sdk] %s cancelled after %d pages", descriptor, fetched));
                return new Outcome.Cancelled(cancellation.reason(), pages, collected);
            }
            if (pages >= ceiling) {
                int fetched = pages;
                LOGGER.warning(() -> String.format(Locale.ROOT,
                    "[fleethub-sdk] %s still reports more pages after %d; stopping", descriptor, fetched));
                return new Outcome.Failed(Outcome.Failed.Reason.PAGINATION_EXHAUSTED, Diagnostic.of(String.format(
                    Locale.ROOT, "pagination stopped after %d pages with more remaining; "
                        + "use skipPaginationLimit to fetch everything", pages)));
            }

            Outcome outcome = fetcher.apply(next);
            if (outcome instanceof Outcome.Cancelled) {
                return new Outcome.Cancelled(((Outcome.Cancelled) outcome).message(), pages, collected);
            }
            if (!(outcome instanceof Outcome.Complete)) {
                return outcome;
            }
            Outcome.Complete complete = (Outcome.Complete) outcome;
            pages++;
            lastStatus = complete.statusCode();

            Page page;
            try {
                page = reader.read(complete.payload());
            } catch (FleetHubException ex) {
                return new Outcome.Failed(Outcome.Failed.Reason.UNEXPECTED,
                    new Diagnostic(ex.getMessage(), null, complete.statusCode()));
            }
            collected.addAll(page.items());
            int pageNumber = pages;
            int itemCount = page.items().size();
            boolean more = page.hasMore();
            LOGGER.fine(() -> String.format(Locale.ROOT,
                "[fleethub-sdk] %s page %d: %d items (more=%s)", descriptor, pageNumber, itemCount, more));

            if (!page.hasMore()) {
                return new Outcome.Complete(lastStatus, toArray(collected), pages);
            }
            if (!seenCursors.add(page.continuationParam() + "=" + page.continuation())) {
                return new Outcome.Failed(Outcome.Failed.Reason.PAGINATION_EXHAUSTED, Diagnostic.of(
                    "pagination cursor repeated after page " + pages + "; the service is not advancing"));
            }
            next = first.withQuery(page.continuationParam(), page.continuation());
        }
    }

    private static ArrayNode toArray(List<JsonNode> items) {
        ArrayNode array = Json.mapper().createArrayNode();
        items.forEach(array::add);
        return array;
    }
}
