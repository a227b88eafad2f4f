package io.github.cyfko.sqlguard.core.pagination;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Opaque position in a keyset-paginated listing: the sort value of the last row seen and
 * that row's id.
 * <p>
 * The wire form is the lowercase hex encoding of the UTF-8 text {@code value|id}. Hex keeps the
 * token URL-safe without any escaping. Decoding is lenient about nothing: odd length, non-hex
 * characters, invalid UTF-8 or a missing separator all yield {@link Optional#empty()}.
 * </p>
 *
 * <pre>{@code
 * String token = Cursor.ofNumber(123.45, "abc-123").encode();
 * Cursor.decode(token).flatMap(c -> ...);
 * }</pre>
 *
 * @param sortValue text form of the sort column value
 * @param id        id of the row
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Cursor(String sortValue, String id) {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    public Cursor {
        Objects.requireNonNull(sortValue, "sortValue cannot be null");
        Objects.requireNonNull(id, "id cannot be null");
        if (sortValue.indexOf('|') >= 0) {
            throw new IllegalArgumentException("Cursor sort value cannot contain '|'");
        }
    }

    public static Cursor ofNumber(double sortValue, String id) {
        return new Cursor(BigDecimal.valueOf(sortValue).stripTrailingZeros().toPlainString(), id);
    }

    public static Cursor ofEpochMicros(long timestampMicros, String id) {
        return new Cursor(Long.toString(timestampMicros), id);
    }

    public String encode() {
        byte[] bytes = (sortValue + "|" + id).getBytes(StandardCharsets.UTF_8);
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            out[2 * i] = HEX[(bytes[i] >> 4) & 0xF];
            out[2 * i + 1] = HEX[bytes[i] & 0xF];
        }
        return new String(out);
    }

    public static Optional<Cursor> decode(String token) {
        if (token == null || token.isEmpty() || token.length() % 2 != 0) {
            return Optional.empty();
        }
        byte[] bytes = new byte[token.length() / 2];
        for (int i = 0; i < bytes.length; i++) {
            int hi = Character.digit(token.charAt(2 * i), 16);
            int lo = Character.digit(token.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) {
                return Optional.empty();
            }
            bytes[i] = (byte) ((hi << 4) | lo);
        }

        String raw;
        try {
            raw = StandardCharsets.UTF_8.newDecoder()
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }

        int sep = raw.indexOf('|');
        if (sep < 0) {
            return Optional.empty();
        }
        return Optional.of(new Cursor(raw.substring(0, sep), raw.substring(sep + 1)));
    }

    public OptionalDouble numericValue() {
        try {
            return OptionalDouble.of(Double.parseDouble(sortValue));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    public OptionalLong epochMicros() {
        try {
            return OptionalLong.of(Long.parseLong(sortValue));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
