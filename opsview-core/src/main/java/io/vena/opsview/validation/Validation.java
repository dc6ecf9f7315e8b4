package io.vena.opsview.validation;

import io.vena.opsview.exceptions.DoesNotMatchRegexException;
import io.vena.opsview.exceptions.ForbiddenCharacterException;
import io.vena.opsview.exceptions.InvalidPercentageException;
import io.vena.opsview.exceptions.InvalidQuorumException;
import io.vena.opsview.exceptions.RequiredFieldEmptyException;
import io.vena.opsview.exceptions.StringTooLongException;
import io.vena.opsview.exceptions.StringTooLongWhenPercentEncodedException;
import io.vena.opsview.exceptions.StringTooShortException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URLEncoder;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Field validators shared by entity builders.
 */
public final class Validation {
	private static final Pattern PERCENTAGE = Pattern.compile("^\\d{1,3}\\.\\d{2}$");

	private Validation() {}

	public static <V> V requireField(V value, String fieldName) throws RequiredFieldEmptyException {
		if (value == null) {
			throw new RequiredFieldEmptyException(fieldName);
		}
		return value;
	}

	/**
	 * Trims <code>value</code>, then checks its length and that the whole of it matches <code>pattern</code>.
	 *
	 * @return the trimmed value
	 */
	public static String validateTrimmedString(String value, int minLength, int maxLength, Pattern pattern)
		throws StringTooShortException, StringTooLongException, DoesNotMatchRegexException
	{
		String trimmed = value.trim();
		int length = trimmed.codePointCount(0, trimmed.length());
		if (length < minLength) {
			throw new StringTooShortException(minLength, length);
		} else if (length > maxLength) {
			throw new StringTooLongException(maxLength, length);
		} else if (!pattern.matcher(trimmed).matches()) {
			throw new DoesNotMatchRegexException(trimmed, pattern.pattern());
		}
		return trimmed;
	}

	/**
	 * For values that end up in URLs, where the server's limit applies to the encoded form.
	 */
	public static String validatePercentEncodedLength(String value, int maxLength) throws StringTooLongWhenPercentEncodedException {
		int encodedLength = URLEncoder.encode(value, UTF_8).replace("+", "%20").length();
		if (encodedLength > maxLength) {
			throw new StringTooLongWhenPercentEncodedException(maxLength, encodedLength);
		}
		return value;
	}

	public static String forbidCharacters(String value, String forbidden) throws ForbiddenCharacterException {
		for (char c : value.toCharArray()) {
			if (forbidden.indexOf(c) >= 0) {
				throw new ForbiddenCharacterException(c);
			}
		}
		return value;
	}

	/**
	 * Checks that <code>percentage</code>, written with exactly two decimals, is
	 * what you'd get from <code>100*k/count</code> for some whole <code>k</code> between
	 * zero and <code>count</code>.
	 * <code>"0.00"</code> and <code>"100.00"</code> are accepted for any count.
	 *
	 * @throws InvalidQuorumException if <code>count</code> is zero and the percentage is not one of the extremes
	 * @throws InvalidPercentageException if the percentage is malformed or matches no ratio
	 */
	public static String validateRatioPercentage(String percentage, int count) throws InvalidPercentageException, InvalidQuorumException {
		if ("0.00".equals(percentage) || "100.00".equals(percentage)) {
			return percentage;
		}
		if (count == 0) {
			throw new InvalidQuorumException("Quorum percentage '" + percentage + "' requires at least one member");
		}
		if (!PERCENTAGE.matcher(percentage).matches()) {
			throw new InvalidPercentageException(percentage, "expected a number with exactly two decimals");
		}
		for (int k = 0; k <= count; k++) {
			String candidate = BigDecimal.valueOf(100L * k)
				.divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_EVEN)
				.toPlainString();
			if (candidate.equals(percentage)) {
				LOGGER.debug("Percentage {} matches {} of {}", percentage, k, count);
				return percentage;
			}
		}
		throw new InvalidPercentageException(percentage, "not a whole fraction of " + count);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Validation.class);
}
