package io.vena.opsview.exceptions;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * A paginated fetch saw the collection change underneath it: either a later page
 * declared a different total than the first, or the number of distinct objects
 * collected disagrees with the declared total.
 *
 * <p>
 * No partial results accompany this exception; the whole fetch should be retried.
 */
@Getter
@Accessors(fluent = true)
public class RowCountMismatchException extends OpsviewClientException {
	private final long expectedRows;
	private final long actualRows;

	public RowCountMismatchException(long expectedRows, long actualRows) {
		super("Row count mismatch: expected " + expectedRows + ", got " + actualRows);
		this.expectedRows = expectedRows;
		this.actualRows = actualRows;
	}
}
