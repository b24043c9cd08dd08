package br.edu.ifba.graphsync.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.channels.Channel;
import java.nio.charset.StandardCharsets;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Encodes and decodes values stored in semi-structured columns (Snowflake {@code VARIANT},
 * SQLite JSON text).
 *
 * <p>Encoding turns any supported value into plain maps, lists and scalars; the JDBC layer
 * serializes that structure with {@link #toJson(Object)} and hands it to the column's parse
 * function, so nothing is escaped by hand. {@link #decodeColumn(Object)} accepts whatever the
 * driver returns for a column (native structures or JSON text) and never throws: malformed
 * text comes back raw and is logged. Decimals are read as {@code BigDecimal}, so no digits
 * are lost on the way back.</p>
 *
 * <h2>Supported values</h2>
 * <ul>
 *   <li>{@code null}, strings, characters, booleans, numbers (NaN and infinities excluded)</li>
 *   <li>maps with string, number, enum, UUID or character keys</li>
 *   <li>collections, arrays and {@link Optional}</li>
 *   <li>enums, UUIDs and {@code java.time} values (encoded as text)</li>
 *   <li>Jackson {@link JsonNode} trees and {@link Flattenable} values</li>
 * </ul>
 */
public final class SemiStructuredCodec {

    private static final Logger logger = LoggerFactory.getLogger(SemiStructuredCodec.class);

    /** Guards against cyclic structures. */
    private static final int MAX_DEPTH = 64;

    private static final int MAX_LOGGED_TEXT = 120;

    private final ObjectMapper objectMapper;

    public SemiStructuredCodec() {
        this.objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    // ===== Encoding =====

    /**
     * Encodes a value into plain maps, lists and scalars.
     *
     * @param value the value to encode (may be null)
     * @return the bindable structure, or null for null
     * @throws SemiStructuredEncodingException if the value, or anything nested in it, is not supported
     */
    @Nullable
    public Object encode(@Nullable Object value) {
        return encodeAt(value, "$", 0);
    }

    /**
     * Encodes an attribute map. Null encodes to an empty map.
     *
     * @param attributes the attribute map
     * @return the encoded map, keys in their original order
     * @throws SemiStructuredEncodingException if any attribute value is not supported
     */
    @NotNull
    public Map<String, Object> encodeAttributes(@Nullable Map<String, ?> attributes) {
        if (attributes == null) {
            return new LinkedHashMap<>();
        }
        return encodeMap(attributes, "$", 0);
    }

    /**
     * Serializes an encoded value to JSON text for the column's parse function.
     *
     * @param encoded a value produced by {@link #encode(Object)}
     * @return JSON text, or null for null
     */
    @Nullable
    public String toJson(@Nullable Object encoded) {
        if (encoded == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(encoded);
        } catch (JsonProcessingException e) {
            throw new SemiStructuredEncodingException("JSON serialization failed", "$", e);
        }
    }

    private Object encodeAt(Object value, String path, int depth) {
        if (depth > MAX_DEPTH) {
            throw new SemiStructuredEncodingException(
                "nesting deeper than " + MAX_DEPTH + " levels (cyclic structure?)", path);
        }
        if (value == null) {
            return null;
        }
        if (value instanceof Flattenable flattenable) {
            Map<String, ?> flattened = flattenable.flatten();
            if (flattened == null) {
                throw new SemiStructuredEncodingException(
                    value.getClass().getName() + ".flatten() returned null", path);
            }
            return encodeMap(flattened, path, depth);
        }
        if (value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Character character) {
            return String.valueOf(character);
        }
        if (value instanceof Number number) {
            return encodeNumber(number, path);
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (value instanceof UUID || value instanceof TemporalAccessor) {
            return value.toString();
        }
        if (value instanceof JsonNode node) {
            return encodeAt(objectMapper.convertValue(node, Object.class), path, depth + 1);
        }
        if (value instanceof Optional<?> optional) {
            return encodeAt(optional.orElse(null), path, depth + 1);
        }
        if (value instanceof Map<?, ?> map) {
            return encodeMap(map, path, depth);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> encoded = new ArrayList<>(collection.size());
            int index = 0;
            for (Object element : collection) {
                encoded.add(encodeAt(element, path + "[" + index++ + "]", depth + 1));
            }
            return encoded;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> encoded = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                encoded.add(encodeAt(Array.get(value, i), path + "[" + i + "]", depth + 1));
            }
            return encoded;
        }
        if (isOpenResource(value)) {
            throw new SemiStructuredEncodingException(
                "open resource of type " + value.getClass().getName() + " cannot be stored", path);
        }
        throw new SemiStructuredEncodingException(
            "unsupported value type " + value.getClass().getName()
                + " (implement Flattenable to store it)", path);
    }

    private Map<String, Object> encodeMap(Map<?, ?> map, String path, int depth) {
        Map<String, Object> encoded = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = encodeKey(entry.getKey(), path);
            encoded.put(key, encodeAt(entry.getValue(), path + "." + key, depth + 1));
        }
        return encoded;
    }

    private String encodeKey(Object key, String path) {
        if (key instanceof String text) {
            return text;
        }
        if (key instanceof Number || key instanceof Character || key instanceof UUID) {
            return key.toString();
        }
        if (key instanceof Enum<?> constant) {
            return constant.name();
        }
        throw new SemiStructuredEncodingException(
            "map key " + (key == null ? "null" : "of type " + key.getClass().getName())
                + " is not supported", path);
    }

    private Object encodeNumber(Number number, String path) {
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new SemiStructuredEncodingException("non-finite number " + d, path);
            }
            return d;
        }
        if (number instanceof BigDecimal || number instanceof BigInteger) {
            return number;
        }
        return number.longValue();
    }

    private static boolean isOpenResource(Object value) {
        return value instanceof Closeable
            || value instanceof AutoCloseable
            || value instanceof InputStream
            || value instanceof OutputStream
            || value instanceof Reader
            || value instanceof Writer
            || value instanceof Channel
            || value instanceof Thread;
    }

    // ===== Decoding =====

    /**
     * Decodes a logical value: a native structure or scalar as a driver or {@link #encode(Object)}
     * returns it. Strings are string scalars and are not parsed; use {@link #decodeColumn(Object)}
     * for the text of a semi-structured column.
     *
     * <p>{@code decode(encode(v))} equals {@code canonicalize(v)} for every supported value.</p>
     *
     * @param value the native value
     * @return the value in canonical form, or the value as-is if it cannot be encoded
     */
    @Nullable
    public Object decode(@Nullable Object value) {
        return decodeNative(value).value();
    }

    /**
     * Decodes what the driver returned for a semi-structured column. Text is parsed as JSON;
     * native structures are decoded as by {@link #decode(Object)}.
     *
     * <p>Malformed text is returned as-is and a warning is logged; use
     * {@link #tryDecodeColumn(Object)} to tell the two cases apart.</p>
     *
     * @param stored the value returned by the driver
     * @return the logical value in canonical form, or the raw text if it was malformed
     */
    @Nullable
    public Object decodeColumn(@Nullable Object stored) {
        return tryDecodeColumn(stored).value();
    }

    /**
     * Decodes what the driver returned for a semi-structured column and reports whether the
     * stored text was malformed.
     *
     * @param stored the value returned by the driver
     * @return the decoded value and its malformed flag
     */
    @NotNull
    public DecodedValue tryDecodeColumn(@Nullable Object stored) {
        if (stored instanceof String text) {
            return decodeText(text);
        }
        if (stored instanceof byte[] bytes) {
            return decodeText(new String(bytes, StandardCharsets.UTF_8));
        }
        return decodeNative(stored);
    }

    private DecodedValue decodeNative(Object value) {
        if (value == null) {
            return DecodedValue.parsed(null);
        }
        try {
            return DecodedValue.parsed(canonicalize(encode(value)));
        } catch (SemiStructuredEncodingException e) {
            logger.warn("Returning undecodable semi-structured value of type {} as-is: {}",
                value.getClass().getName(), e.getMessage());
            return DecodedValue.raw(value);
        }
    }

    /**
     * Decodes a stored attribute column into a map.
     *
     * <p>Null decodes to an empty map. A value that decodes to something other than a map
     * (including malformed text) is kept under the {@code _raw} key so it stays visible.</p>
     *
     * @param stored the value returned by the driver
     * @return the attribute map in canonical form
     */
    @NotNull
    @SuppressWarnings("unchecked")
    public Map<String, Object> decodeAttributes(@Nullable Object stored) {
        Object decoded = decodeColumn(stored);
        if (decoded == null) {
            return new TreeMap<>();
        }
        if (decoded instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        logger.warn("Semi-structured attribute column holds a {} instead of an object, keeping it under _raw",
            decoded.getClass().getSimpleName());
        Map<String, Object> wrapped = new TreeMap<>();
        wrapped.put("_raw", decoded);
        return wrapped;
    }

    private DecodedValue decodeText(String text) {
        try {
            Object parsed = objectMapper.readValue(text, Object.class);
            return DecodedValue.parsed(canonicalize(parsed));
        } catch (JsonProcessingException e) {
            logger.warn("Malformed semi-structured text returned raw: {} ({})",
                truncate(text), e.getOriginalMessage());
            return DecodedValue.raw(text);
        }
    }

    // ===== Canonical form =====

    /**
     * Returns the canonical form of a decoded or encoded value.
     *
     * <p>Integral numbers (including integral doubles such as {@code 3.0}) become {@code Long},
     * or {@code BigInteger} beyond its range. Decimals a double holds exactly become
     * {@code Double}; other decimals stay {@code BigDecimal}. Maps become key-sorted maps and
     * collections become lists. Two values that denote the same data have equal canonical forms.</p>
     *
     * @param value the value to canonicalize
     * @return the canonical value
     */
    @Nullable
    public Object canonicalize(@Nullable Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number number) {
            return canonicalNumber(number);
        }
        if (value instanceof Character character) {
            return String.valueOf(character);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                sorted.put(String.valueOf(entry.getKey()), canonicalize(entry.getValue()));
            }
            return sorted;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> list = new ArrayList<>(collection.size());
            for (Object element : collection) {
                list.add(canonicalize(element));
            }
            return list;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(canonicalize(Array.get(value, i)));
            }
            return list;
        }
        return value;
    }

    private static Object canonicalNumber(Number number) {
        if (number instanceof Long) {
            return number;
        }
        if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return number.longValue();
        }
        if (number instanceof BigInteger big) {
            return big.bitLength() < 64 ? (Object) big.longValue() : big;
        }
        if (number instanceof BigDecimal decimal) {
            BigDecimal stripped = decimal.stripTrailingZeros();
            if (stripped.scale() <= 0) {
                return canonicalNumber(stripped.toBigIntegerExact());
            }
            double d = decimal.doubleValue();
            if (!Double.isInfinite(d) && BigDecimal.valueOf(d).compareTo(decimal) == 0) {
                return d;
            }
            return stripped;
        }
        double d = number.doubleValue();
        if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 9.007199254740992E15) {
            return (long) d;
        }
        return d;
    }

    private static String truncate(String text) {
        return text.length() <= MAX_LOGGED_TEXT ? text : text.substring(0, MAX_LOGGED_TEXT) + "...";
    }
}
