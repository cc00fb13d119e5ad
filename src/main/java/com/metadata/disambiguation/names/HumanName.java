package com.metadata.disambiguation.names;

/**
 * Structured components of a person's name.
 * Empty components are represented by empty strings, never null.
 *
 * @param fullName the parsed input with whitespace collapsed
 * @param title    leading honorifics, e.g. {@code Dr.}
 * @param first    given name
 * @param middle   middle names and initials
 * @param last     family name including particles such as {@code van}
 * @param suffix   trailing generational or academic suffixes
 */
public record HumanName(String fullName, String title, String first, String middle, String last, String suffix) {

    public static final HumanName EMPTY = new HumanName("", "", "", "", "", "");

    public HumanName {
        fullName = fullName != null ? fullName : "";
        title = title != null ? title : "";
        first = first != null ? first : "";
        middle = middle != null ? middle : "";
        last = last != null ? last : "";
        suffix = suffix != null ? suffix : "";
    }

    /**
     * First character of the given name, or null when there is none.
     */
    public Character firstInitial() {
        return first.isEmpty() ? null : first.charAt(0);
    }

    public boolean isEmpty() {
        return fullName.isEmpty();
    }
}
