package com.bondtrader.pricing;

import com.bondtrader.exception.MalformedInputException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between decimal bond prices and the desk's fractional notation.
 *
 * <p>Text form is {@code <whole>-<frac>[+]}:
 * <ul>
 *   <li>{@code whole}: integer points, one to three digits</li>
 *   <li>{@code frac}: two-digit thirty-seconds, 00 to 31</li>
 *   <li>{@code +}: optional half of a thirty-second (one sixty-fourth)</li>
 * </ul>
 * Examples: {@code 99-16} = 99.5, {@code 99-16+} = 99.515625, {@code 100-00} = 100.
 *
 * <p>Encoding truncates to the thirty-second below and appends {@code +} only when the
 * remainder is more than a quarter of a thirty-second. Every price on the 1/64 grid
 * therefore round-trips exactly; prices off the grid are truncated towards it.
 */
public final class FractionalPriceCodec {

    /** One sixty-fourth of a point, the smallest increment the notation can express. */
    public static final BigDecimal TICK = new BigDecimal("0.015625");

    private static final Pattern FORMAT = Pattern.compile("^(\\d{1,3})-(\\d{2})(\\+)?$");
    private static final BigDecimal THIRTY_TWO = BigDecimal.valueOf(32);
    private static final BigDecimal PLUS_THRESHOLD = new BigDecimal("0.25");
    private static final int MAX_THIRTY_SECONDS = 31;

    private FractionalPriceCodec() {}

    /**
     * Parses fractional notation into a decimal price.
     *
     * @throws MalformedInputException if the text does not match the notation or the
     *     thirty-seconds field is above 31
     */
    public static BigDecimal decode(String text) {
        if (text == null) {
            throw new MalformedInputException("Price text is null");
        }
        Matcher matcher = FORMAT.matcher(text.trim());
        if (!matcher.matches()) {
            throw new MalformedInputException("Price does not match <whole>-<32nds>[+]", text);
        }
        int thirtySeconds = Integer.parseInt(matcher.group(2));
        if (thirtySeconds > MAX_THIRTY_SECONDS) {
            throw new MalformedInputException("Thirty-seconds field out of range 00-31", text);
        }

        BigDecimal price = new BigDecimal(matcher.group(1))
                .add(BigDecimal.valueOf(thirtySeconds).divide(THIRTY_TWO));
        if (matcher.group(3) != null) {
            price = price.add(TICK);
        }
        return price;
    }

    /**
     * Formats a non-negative decimal price in fractional notation.
     *
     * @throws IllegalArgumentException for null or negative prices
     */
    public static String encode(BigDecimal price) {
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("Price must be non-negative: " + price);
        }
        BigDecimal whole = price.setScale(0, RoundingMode.FLOOR);
        BigDecimal scaledFraction = price.subtract(whole).multiply(THIRTY_TWO);
        BigDecimal thirtySeconds = scaledFraction.setScale(0, RoundingMode.FLOOR);
        boolean plus = scaledFraction.subtract(thirtySeconds).compareTo(PLUS_THRESHOLD) > 0;

        return String.format("%s-%02d%s", whole.toPlainString(), thirtySeconds.intValueExact(), plus ? "+" : "");
    }

    /** Convenience for callers holding a double, e.g. generated or legacy values. */
    public static String encode(double price) {
        return encode(BigDecimal.valueOf(price));
    }
}
