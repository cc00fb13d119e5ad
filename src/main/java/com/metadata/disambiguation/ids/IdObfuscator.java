package com.metadata.disambiguation.ids;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Encodes record references as opaque public ids and decodes them back.
 *
 * <p>An id is {@code <type code hex><3 hex>-<3 hex>-<3 hex>}, where the nine hex digits are
 * {@code pk * 0xDEADBEEF mod 10^10}. Decoding multiplies by the modular inverse.</p>
 */
public final class IdObfuscator {

    private static final BigInteger NUM = BigInteger.valueOf(0xDEADBEEFL);
    private static final BigInteger MOD = BigInteger.valueOf(10_000_000_000L);
    private static final BigInteger MOD_INV = NUM.modInverse(MOD);

    private static final Pattern FORMAT = Pattern.compile(
            "^([0-9A-Fa-f]+)([0-9A-Fa-f]{3})-([0-9A-Fa-f]{3})-([0-9A-Fa-f]{3})$");

    private IdObfuscator() {
        // utility class
    }

    /**
     * A decoded reference.
     *
     * @param typeCode code of the target schema
     * @param pk       record id
     */
    public record DecodedId(int typeCode, long pk) {
    }

    public static String encode(int typeCode, long pk) {
        if (typeCode < 0 || pk < 0) {
            throw new IllegalArgumentException("typeCode and pk must be non-negative");
        }
        long encoded = BigInteger.valueOf(pk).multiply(NUM).mod(MOD).longValue();
        String hex = String.format(Locale.ROOT, "%09X", encoded);
        return String.format(Locale.ROOT, "%X%s-%s-%s",
                typeCode, hex.substring(0, 3), hex.substring(3, 6), hex.substring(6));
    }

    /**
     * Decodes an id.
     *
     * @throws InvalidIdException if the id is not in the expected format
     */
    public static DecodedId decode(String id) throws InvalidIdException {
        if (id == null) {
            throw new InvalidIdException("Id must not be null");
        }
        Matcher matcher = FORMAT.matcher(id);
        if (!matcher.matches()) {
            throw new InvalidIdException("Malformed id: " + id);
        }
        int typeCode;
        long encoded;
        try {
            typeCode = Integer.parseInt(matcher.group(1), 16);
            encoded = Long.parseLong(matcher.group(2) + matcher.group(3) + matcher.group(4), 16);
        } catch (NumberFormatException e) {
            throw new InvalidIdException("Malformed id: " + id, e);
        }
        if (encoded >= MOD.longValue()) {
            throw new InvalidIdException("Id out of range: " + id);
        }
        long pk = BigInteger.valueOf(encoded).multiply(MOD_INV).mod(MOD).longValue();
        return new DecodedId(typeCode, pk);
    }
}
