package org.netpreserve.roundabout;

import org.netpreserve.roundabout.util.Url;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Maps requests to the slot they are scheduled in.
 */
public final class Slots {
    /**
     * Key of the slot override in the map form of a request (as produced by serializing a {@link Request}).
     */
    public static final String SLOT_KEY = "slot";
    public static final String URL_KEY = "url";

    private Slots() {
    }

    /**
     * Returns the slot of a request, which is either the one set by the caller or the host of its URL. In the
     * latter case the host is stored back into the request so later lookups agree.
     *
     * @param request a {@link Request} or the map form of one
     * @throws InvalidRequestException if given anything else
     */
    @SuppressWarnings("unchecked")
    public static String resolve(Object request) {
        if (request instanceof Request req) {
            return resolve(req);
        } else if (request instanceof Map<?, ?> map) {
            return resolve((Map<String, Object>) map);
        }
        throw new InvalidRequestException("Bad type of request " + (request == null ? "null" : request.getClass().getName()));
    }

    public static String resolve(Request request) {
        String slot = request.slot();
        if (slot == null) {
            slot = request.url().host();
            request.slot(slot);
        }
        return slot;
    }

    public static String resolve(Map<String, Object> request) {
        Object slot = request.get(SLOT_KEY);
        if (slot == null) {
            Object url = request.get(URL_KEY);
            slot = url == null ? "" : new Url(url.toString()).host();
            request.put(SLOT_KEY, slot);
        }
        return slot.toString();
    }

    /**
     * Converts a slot into a name that is safe to use as a directory. Characters other than letters, digits and
     * "-._" are replaced with "_", so an MD5 of the original slot is appended to keep distinct slots apart.
     */
    public static String toPath(String slot) {
        var builder = new StringBuilder(slot.length() + 33);
        slot.codePoints().forEach(c -> {
            if (Character.isLetterOrDigit(c) || c == '-' || c == '.' || c == '_') {
                builder.appendCodePoint(c);
            } else {
                builder.append('_');
            }
        });
        builder.append('-');
        builder.append(HexFormat.of().formatHex(md5(slot.getBytes(StandardCharsets.UTF_8))));
        return builder.toString();
    }

    private static byte[] md5(byte[] data) {
        try {
            return MessageDigest.getInstance("MD5").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException(e);
        }
    }
}
