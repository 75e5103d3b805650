package com.policysonar.retrieval;

import com.policysonar.errors.InvalidInputException;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * PolicyRecord - A historical policy with its known outcome.
 * Immutable once loaded; the corpus order of records is significant for tie-breaking.
 */
public final class PolicyRecord {
    public final String id;
    public final String text;
    public final int year;
    public final String policyType;
    public final String jurisdiction;
    public final Set<String> riskFactors;
    public final String outcomeNarrative;

    public PolicyRecord(String id, String text, int year, String policyType,
                        String jurisdiction, Set<String> riskFactors, String outcomeNarrative) {
        if (id == null || id.isBlank()) {
            throw new InvalidInputException("Policy record is missing its id");
        }
        if (text == null) {
            throw new InvalidInputException("Policy record " + id + " is missing its text");
        }
        this.id = id;
        this.text = text;
        this.year = year;
        this.policyType = policyType != null ? policyType : "";
        this.jurisdiction = jurisdiction != null ? jurisdiction : "";
        this.riskFactors = riskFactors != null
            ? Collections.unmodifiableSet(new LinkedHashSet<>(riskFactors))
            : Collections.emptySet();
        this.outcomeNarrative = outcomeNarrative != null ? outcomeNarrative : "";
    }

    @Override
    public String toString() {
        return String.format("PolicyRecord{id='%s', year=%d, type='%s', jurisdiction='%s'}",
            id, year, policyType, jurisdiction);
    }
}
