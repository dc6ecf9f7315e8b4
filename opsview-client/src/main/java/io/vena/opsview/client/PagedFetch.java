package io.vena.opsview.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.vena.opsview.ConfigObject;
import io.vena.opsview.ConfigObjectMap;
import io.vena.opsview.QueryParams;
import io.vena.opsview.exceptions.NotAnArrayException;
import io.vena.opsview.exceptions.ObjectNotFoundException;
import io.vena.opsview.exceptions.RowCountMismatchException;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a whole collection one page at a time, and refuses to return anything
 * if the collection appears to change along the way.
 *
 * <p>
 * Two checks guard against that. Every page must declare the same total row count
 * as the first one; and once the last page is in, the number of distinct objects
 * collected must equal that total. Either failure throws {@link RowCountMismatchException}
 * and the partial results are discarded.
 *
 * <p>
 * Pages are requested strictly in sequence, because each page's summary decides
 * whether there is a next one.
 */
final class PagedFetch {
	@FunctionalInterface
	interface PageSource {
		JsonNode get(String path, QueryParams params) throws IOException;
	}

	@FunctionalInterface
	interface PageDecoder<T extends ConfigObject<T>> {
		ConfigObjectMap<T> decode(JsonNode list) throws IOException;
	}

	private PagedFetch() {}

	/**
	 * @param params sent as-is for the first page; later pages add a <code>page</code> parameter, replacing any the caller gave
	 */
	static <T extends ConfigObject<T>> ConfigObjectMap<T> fetchAll(String path, QueryParams params, PageSource source, PageDecoder<T> decoder) throws IOException {
		ConfigObjectMap<T> accumulated = new ConfigObjectMap<>();
		long expectedRows = -1;
		long page = 1;
		while (true) {
			QueryParams pageParams = (page == 1) ? params : params.replacing("page", Long.toString(page));
			JsonNode response = source.get(path, pageParams);

			PageSummary summary = PageSummary.parse(response);
			if (page == 1) {
				expectedRows = summary.totalRows();
			} else if (summary.totalRows() != expectedRows) {
				LOGGER.warn("{} changed during fetch: page 1 declared {} rows, page {} declares {}",
					path, expectedRows, page, summary.totalRows());
				throw new RowCountMismatchException(expectedRows, summary.totalRows());
			}

			JsonNode list = response.get("list");
			if (list == null) {
				throw new ObjectNotFoundException("'" + path + "' not found");
			} else if (!list.isArray()) {
				throw new NotAnArrayException("'list' field of '" + path + "' is not an array");
			}
			accumulated.extend(decoder.decode(list));
			LOGGER.debug("{} page {}/{}: {} objects, {} so far", path, page, summary.totalPages(), list.size(), accumulated.size());

			// Also stops for an empty collection, which may declare zero pages
			if (page >= summary.totalPages()) {
				break;
			}
			page++;
		}

		if (accumulated.size() != expectedRows) {
			LOGGER.warn("{} declared {} rows but yielded {} distinct objects", path, expectedRows, accumulated.size());
			throw new RowCountMismatchException(expectedRows, accumulated.size());
		}
		return accumulated;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(PagedFetch.class);
}
