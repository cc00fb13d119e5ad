package com.metadata.disambiguation.identifiers;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes one family of identifiers (DOI, ORCID, URL, ...) and rewrites it to canonical form.
 * Rules are tried in priority order (lower number first); the first rule whose pattern
 * matches the whole input decides the outcome.
 */
public abstract class IriRule {

    private final String name;
    private final Pattern pattern;
    private final int priority;

    protected IriRule(String name, String pattern, int priority) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.pattern = Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
        this.priority = priority;
    }

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Returns true if this rule is responsible for the input.
     */
    public boolean matches(String input) {
        return pattern.matcher(input).matches();
    }

    /**
     * Normalizes an input this rule {@link #matches(String) matches}.
     *
     * @throws InvalidIriException if the input has the right shape but is not valid, e.g. a bad check digit
     */
    public NormalizedIri normalize(String input) throws InvalidIriException {
        Matcher matcher = pattern.matcher(input);
        if (!matcher.matches()) {
            throw new InvalidIriException("Rule '" + name + "' does not apply to " + input);
        }
        return build(matcher, input);
    }

    protected abstract NormalizedIri build(Matcher matcher, String input) throws InvalidIriException;

    @Override
    public String toString() {
        return "IriRule{" +
                "name='" + name + '\'' +
                ", pattern=" + pattern.pattern() +
                ", priority=" + priority +
                '}';
    }
}
