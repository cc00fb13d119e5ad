package com.metadata.disambiguation.identifiers;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * Persistable form of an identifier. Host and scheme are always derived from the URI,
 * never taken from caller input, so they cannot drift from the URI they describe.
 *
 * @param uri     the canonical URI
 * @param host    host derived from the URI, empty when the URI has none
 * @param scheme  scheme derived from the URI
 * @param ownerId id of the work or agent the identifier belongs to
 */
public record IdentifierRecord(String uri, String host, String scheme, long ownerId) {

    public IdentifierRecord {
        Objects.requireNonNull(uri, "uri is required");
        host = deriveHost(uri);
        scheme = deriveScheme(uri);
    }

    public static IdentifierRecord of(String uri, long ownerId) {
        return new IdentifierRecord(uri, null, null, ownerId);
    }

    static String deriveScheme(String uri) {
        int colon = uri.indexOf(':');
        return colon > 0 ? uri.substring(0, colon).toLowerCase(Locale.ROOT) : "";
    }

    static String deriveHost(String uri) {
        try {
            URI parsed = new URI(uri);
            if (parsed.getHost() != null) {
                return parsed.getHost().toLowerCase(Locale.ROOT);
            }
            if (parsed.getAuthority() != null) {
                return parsed.getAuthority().toLowerCase(Locale.ROOT);
            }
            return "";
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Cannot derive host from " + uri, e);
        }
    }
}
