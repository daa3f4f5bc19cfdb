package com.pdp.combining;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Closed set of combining algorithms, looked up by document name when a policy is parsed.
 */
public enum CombiningAlgorithm {
    /**
     * Result of the first child that is applicable; an Indeterminate child stops the scan.
     */
    FIRST_APPLICABLE("FirstApplicableEffect"),

    /**
     * Any Deny wins, then Indeterminate, then Permit, else NotApplicable.
     */
    DENY_OVERRIDES("DenyOverrides"),

    /**
     * Any Permit wins, then Indeterminate, then Deny, else NotApplicable.
     */
    PERMIT_OVERRIDES("PermitOverrides"),

    /**
     * Exactly one child may be applicable; more than one is an ambiguity.
     */
    ONLY_ONE_APPLICABLE("OnlyOneApplicable"),

    /**
     * Permit if any child permits, Deny otherwise.
     */
    DENY_UNLESS_PERMIT("DenyUnlessPermit"),

    /**
     * Deny if any child denies, Permit otherwise.
     */
    PERMIT_UNLESS_DENY("PermitUnlessDeny"),

    /**
     * Selects children by id from the value of a map expression.
     */
    MAPPER("Mapper");

    private static final Map<String, CombiningAlgorithm> BY_NAME = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(a -> a.documentName.toLowerCase(Locale.ROOT),
                    Function.identity()));

    private final String documentName;

    CombiningAlgorithm(String documentName) {
        this.documentName = documentName;
    }

    public String getDocumentName() {
        return documentName;
    }

    /**
     * Look up an algorithm by document name, ignoring case.
     */
    public static Optional<CombiningAlgorithm> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    @Override
    public String toString() {
        return documentName;
    }
}
