package com.dcruver.notededup.domain;

/**
 * A category-qualified concept token. "coiling" as a PROCEDURE never equals "coiling" elsewhere.
 */
public record Concept(ConceptCategory category, String token) {

    @Override
    public String toString() {
        return category.name().toLowerCase() + ":" + token;
    }
}
