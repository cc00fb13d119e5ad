package com.metadata.disambiguation.identifiers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.IDN;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Built-in identifier rules: DOI, ORCID, ISSN, ISBN, ARK, e-mail addresses and plain URLs.
 */
public final class DefaultIriRules {
    private static final Logger log = LoggerFactory.getLogger(DefaultIriRules.class);

    /** Characters allowed unescaped in a URI path besides letters and digits. */
    private static final String PATH_CHARS = "-._~!$&'()*+,;=:@/";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private DefaultIriRules() {
        // Utility class
    }

    /**
     * Creates an IriNormalizer with all default rules.
     */
    public static IriNormalizer createDefaultNormalizer() {
        return new IriNormalizer(getRules());
    }

    public static List<IriRule> getRules() {
        return List.of(
                new DoiRule(),
                new OrcidRule(),
                new IssnRule(),
                new IsbnRule(),
                new ArkRule(),
                new MailtoRule(),
                new UrlRule()
        );
    }

    static final class DoiRule extends IriRule {
        DoiRule() {
            super("doi", "(?:doi:\\s*|https?://(?:dx\\.)?doi\\.org/)?(10\\.\\d{4,}(?:\\.\\d+)*/\\S+)", 10);
        }

        @Override
        protected NormalizedIri build(Matcher matcher, String input) {
            String doi = encodePath(matcher.group(1).toUpperCase(Locale.ROOT));
            return new NormalizedIri("http://dx.doi.org/" + doi, "http", "dx.doi.org", "/" + doi);
        }
    }

    static final class OrcidRule extends IriRule {
        OrcidRule() {
            super("orcid", "(?:https?://(?:www\\.)?orcid\\.org/)?(\\d{4})-?(\\d{4})-?(\\d{4})-?(\\d{3}[\\dX])", 20);
        }

        @Override
        protected NormalizedIri build(Matcher matcher, String input) throws InvalidIriException {
            String digits = (matcher.group(1) + matcher.group(2) + matcher.group(3) + matcher.group(4))
                    .toUpperCase(Locale.ROOT);
            int total = 0;
            for (int i = 0; i < 15; i++) {
                total = (total + Character.digit(digits.charAt(i), 10)) * 2;
            }
            int result = (12 - total % 11) % 11;
            char expected = result == 10 ? 'X' : Character.forDigit(result, 10);
            if (digits.charAt(15) != expected) {
                throw new InvalidIriException("Invalid ORCID checksum: " + input);
            }
            String orcid = digits.substring(0, 4) + "-" + digits.substring(4, 8) + "-"
                    + digits.substring(8, 12) + "-" + digits.substring(12);
            return new NormalizedIri("http://orcid.org/" + orcid, "http", "orcid.org", "/" + orcid);
        }
    }

    static final class IssnRule extends IriRule {
        IssnRule() {
            super("issn", "(?:issn:?\\s*|urn://issn/)?(\\d{4})-?(\\d{3})([\\dX])", 30);
        }

        @Override
        protected NormalizedIri build(Matcher matcher, String input) throws InvalidIriException {
            String digits = matcher.group(1) + matcher.group(2);
            int sum = 0;
            for (int i = 0; i < 7; i++) {
                sum += Character.digit(digits.charAt(i), 10) * (8 - i);
            }
            int check = (11 - sum % 11) % 11;
            char expected = check == 10 ? 'X' : Character.forDigit(check, 10);
            if (Character.toUpperCase(matcher.group(3).charAt(0)) != expected) {
                throw new InvalidIriException("Invalid ISSN checksum: " + input);
            }
            String issn = digits.substring(0, 4) + "-" + digits.substring(4) + expected;
            return new NormalizedIri("urn://issn/" + issn, "urn", "issn", "/" + issn);
        }
    }

    static final class IsbnRule extends IriRule {
        IsbnRule() {
            super("isbn", "(?:isbn(?:-1[03])?:?\\s*|urn://isbn/)([\\d\\- ]{8,16}[\\dX])", 40);
        }

        @Override
        protected NormalizedIri build(Matcher matcher, String input) throws InvalidIriException {
            String isbn = matcher.group(1).replaceAll("[^0-9Xx]", "").toUpperCase(Locale.ROOT);
            if (isbn.length() == 10) {
                isbn = toIsbn13(isbn, input);
            } else if (isbn.length() != 13 || !validIsbn13(isbn)) {
                throw new InvalidIriException("Invalid ISBN: " + input);
            }
            return new NormalizedIri("urn://isbn/" + isbn, "urn", "isbn", "/" + isbn);
        }

        private static String toIsbn13(String isbn10, String input) throws InvalidIriException {
            int sum = 0;
            for (int i = 0; i < 10; i++) {
                char c = isbn10.charAt(i);
                int value;
                if (c == 'X' && i == 9) {
                    value = 10;
                } else if (Character.isDigit(c)) {
                    value = Character.digit(c, 10);
                } else {
                    throw new InvalidIriException("Invalid ISBN: " + input);
                }
                sum += value * (10 - i);
            }
            if (sum % 11 != 0) {
                throw new InvalidIriException("Invalid ISBN checksum: " + input);
            }
            String body = "978" + isbn10.substring(0, 9);
            return body + isbn13CheckDigit(body);
        }

        private static boolean validIsbn13(String isbn) {
            if (!isbn.chars().allMatch(Character::isDigit)) {
                return false;
            }
            return isbn13CheckDigit(isbn.substring(0, 12)) == isbn.charAt(12) - '0';
        }

        private static int isbn13CheckDigit(String first12) {
            int sum = 0;
            for (int i = 0; i < 12; i++) {
                sum += Character.digit(first12.charAt(i), 10) * (i % 2 == 0 ? 1 : 3);
            }
            return (10 - sum % 10) % 10;
        }
    }

    static final class ArkRule extends IriRule {
        ArkRule() {
            super("ark", "(?:https?://[^/\\s]+/)?ark:/{0,2}(\\d{5,})/(\\S+)", 50);
        }

        @Override
        protected NormalizedIri build(Matcher matcher, String input) {
            String naan = matcher.group(1);
            String name = encodePath(matcher.group(2));
            return new NormalizedIri("ark://" + naan + "/" + name, "ark", naan, "/" + name);
        }
    }

    static final class MailtoRule extends IriRule {
        MailtoRule() {
            super("mailto", "(?:mailto:(?://)?)?([^@\\s:/]+)@([A-Za-z0-9.-]+\\.[A-Za-z]{2,})", 60);
        }

        @Override
        protected NormalizedIri build(Matcher matcher, String input) {
            String local = matcher.group(1);
            String host = matcher.group(2).toLowerCase(Locale.ROOT);
            return new NormalizedIri("mailto:" + local + "@" + host, "mailto", host, local);
        }
    }

    static final class UrlRule extends IriRule {
        private static final Pattern SCHEME_PREFIX = Pattern.compile("^(?:https?|ftp)://", Pattern.CASE_INSENSITIVE);

        UrlRule() {
            super("url", "((?:https?|ftp)://\\S+|[\\p{L}\\p{N}][\\p{L}\\p{N}_-]*(?:\\.[\\p{L}\\p{N}_-]+)*\\.\\p{L}{2,}(?::\\d+)?(?:[/?#]\\S*)?)", 100);
        }

        @Override
        protected NormalizedIri build(Matcher matcher, String input) throws InvalidIriException {
            String candidate = SCHEME_PREFIX.matcher(input).find() ? input : "http://" + input;
            URI uri;
            try {
                uri = new URI(candidate).normalize();
            } catch (URISyntaxException e) {
                throw new InvalidIriException("Unparseable URL: " + input, e);
            }

            // Registry-based authorities (IDN labels, underscores) have no URI host, so parse the raw authority
            String rawAuthority = uri.getRawAuthority();
            if (rawAuthority == null || rawAuthority.isEmpty()) {
                throw new InvalidIriException("URL has no host: " + input);
            }
            int at = rawAuthority.lastIndexOf('@');
            if (at >= 0) {
                log.debug("Dropping user info from {}", input);
                rawAuthority = rawAuthority.substring(at + 1);
            }
            String host = rawAuthority;
            int port = -1;
            int colon = rawAuthority.lastIndexOf(':');
            if (colon > rawAuthority.lastIndexOf(']')) {
                host = rawAuthority.substring(0, colon);
                String portText = rawAuthority.substring(colon + 1);
                if (!portText.isEmpty()) {
                    try {
                        port = Integer.parseInt(portText);
                    } catch (NumberFormatException e) {
                        throw new InvalidIriException("Invalid port in URL: " + input, e);
                    }
                }
            }

            String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
            host = canonicalHost(host, input);
            String authority = isDefaultPort(scheme, port) ? host : host + ":" + port;
            String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();

            StringBuilder iri = new StringBuilder(scheme).append("://").append(authority).append(path);
            if (uri.getRawQuery() != null) {
                iri.append('?').append(uri.getRawQuery());
            }
            return new NormalizedIri(iri.toString(), scheme, authority, path);
        }

        /**
         * Lower-cases the host and converts internationalized labels to their ASCII form.
         */
        private static String canonicalHost(String host, String input) throws InvalidIriException {
            if (host.isEmpty()) {
                throw new InvalidIriException("URL has no host: " + input);
            }
            String lower = host.toLowerCase(Locale.ROOT);
            if (lower.startsWith("[")) {
                return lower;
            }
            try {
                return IDN.toASCII(lower, IDN.ALLOW_UNASSIGNED);
            } catch (IllegalArgumentException e) {
                throw new InvalidIriException("Invalid host in URL: " + input, e);
            }
        }

        private static boolean isDefaultPort(String scheme, int port) {
            return port == -1
                    || ("http".equals(scheme) && port == 80)
                    || ("https".equals(scheme) && port == 443)
                    || ("ftp".equals(scheme) && port == 21);
        }
    }

    /**
     * Percent-encodes every character that may not appear in a URI path.
     * Existing escapes are kept, so encoding an encoded path changes nothing.
     */
    static String encodePath(String path) {
        byte[] bytes = path.getBytes(StandardCharsets.UTF_8);
        StringBuilder out = new StringBuilder(bytes.length);
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xFF;
            if (b == '%' && i + 2 < bytes.length && isHex(bytes[i + 1]) && isHex(bytes[i + 2])) {
                out.append('%');
            } else if (b < 0x80 && (Character.isLetterOrDigit(b) || PATH_CHARS.indexOf(b) >= 0)) {
                out.append((char) b);
            } else {
                out.append('%').append(HEX[b >> 4]).append(HEX[b & 0x0F]);
            }
        }
        return out.toString();
    }

    private static boolean isHex(byte b) {
        return Character.digit(b, 16) >= 0;
    }
}
