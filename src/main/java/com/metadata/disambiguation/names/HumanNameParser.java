package com.metadata.disambiguation.names;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rule-based parser for names written as {@code First Middle Last} or {@code Last, First Middle}.
 * Strips leading titles and trailing suffixes and keeps lowercase particles with the family name.
 * Stateless and thread-safe.
 */
public class HumanNameParser implements NameParser {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern COMMA = Pattern.compile("\\s*,\\s*");

    private static final Set<String> TITLES = Set.of(
            "dr", "prof", "professor", "mr", "mrs", "ms", "miss", "sir", "rev", "hon");

    private static final Set<String> SUFFIXES = Set.of(
            "jr", "sr", "ii", "iii", "iv", "phd", "md", "esq");

    private static final Set<String> PARTICLES = Set.of(
            "van", "von", "de", "da", "del", "der", "di", "la", "le", "du", "dos");

    @Override
    public HumanName parse(String name) {
        if (name == null) {
            return HumanName.EMPTY;
        }
        String full = WHITESPACE.matcher(name.trim()).replaceAll(" ");
        if (full.isEmpty()) {
            return HumanName.EMPTY;
        }

        List<String> parts = new ArrayList<>();
        for (String part : COMMA.split(full)) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        if (parts.isEmpty()) {
            return new HumanName(full, "", "", "", "", "");
        }

        List<String> body;
        List<String> familyPart = null;
        List<String> suffixes = new ArrayList<>();

        if (parts.size() == 1) {
            body = tokens(parts.get(0));
        } else if (allSuffixes(parts.subList(1, parts.size()))) {
            // "John Doe, Jr."
            body = tokens(parts.get(0));
            for (String part : parts.subList(1, parts.size())) {
                suffixes.addAll(tokens(part));
            }
        } else {
            // "Doe, John Q., Jr."
            familyPart = tokens(parts.get(0));
            body = tokens(parts.get(1));
            for (String part : parts.subList(2, parts.size())) {
                suffixes.addAll(tokens(part));
            }
        }

        List<String> titles = new ArrayList<>();
        while (!body.isEmpty() && isTitle(body.get(0)) && (body.size() > 1 || familyPart != null)) {
            titles.add(body.remove(0));
        }

        if (familyPart == null) {
            List<String> trailing = new ArrayList<>();
            while (body.size() > 1 && isSuffix(body.get(body.size() - 1))) {
                trailing.add(0, body.remove(body.size() - 1));
            }
            suffixes.addAll(0, trailing);
        }

        String first = "";
        String middle = "";
        String last;
        if (familyPart != null) {
            last = String.join(" ", familyPart);
            if (!body.isEmpty()) {
                first = body.get(0);
                middle = String.join(" ", body.subList(1, body.size()));
            }
        } else if (body.size() == 1) {
            first = body.get(0);
            last = "";
        } else if (body.isEmpty()) {
            last = "";
        } else {
            int lastStart = body.size() - 1;
            while (lastStart > 1 && isParticle(body.get(lastStart - 1))) {
                lastStart--;
            }
            first = body.get(0);
            middle = String.join(" ", body.subList(1, lastStart));
            last = String.join(" ", body.subList(lastStart, body.size()));
        }

        return new HumanName(full, String.join(" ", titles), first, middle, last, String.join(" ", suffixes));
    }

    private static List<String> tokens(String part) {
        return new ArrayList<>(Arrays.asList(WHITESPACE.split(part.trim())));
    }

    private static boolean allSuffixes(List<String> parts) {
        for (String part : parts) {
            for (String token : tokens(part)) {
                if (!isSuffix(token)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean isTitle(String token) {
        return TITLES.contains(bare(token));
    }

    private static boolean isSuffix(String token) {
        return SUFFIXES.contains(bare(token));
    }

    private static boolean isParticle(String token) {
        return PARTICLES.contains(token);
    }

    private static String bare(String token) {
        return token.replace(".", "").toLowerCase(Locale.ROOT);
    }
}
