package relay.util;

import java.util.Map;

/**
 * Codec for flat metadata maps to/from JSON.
 *
 * <p>Values may be strings, numbers, booleans or {@code null}; anything else is written
 * as its string form. Plug in Jackson or Gson by implementing this interface when nested
 * structures must survive a round trip.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a metadata map as a JSON object. Returns {@code "{}"} for a null or empty map.
     *
     * @throws IllegalArgumentException if the map has a null key
     */
    String toJson(Map<String, ?> values);

    /**
     * Parses a JSON object into a map of scalars. Integral numbers become {@code Long},
     * others {@code Double}; {@code null} members are dropped. Returns an empty map for
     * {@code null}, blank or {@code "null"} input.
     *
     * @throws IllegalArgumentException if the input is not a flat JSON object
     */
    Map<String, Object> parseObject(String json);
}
