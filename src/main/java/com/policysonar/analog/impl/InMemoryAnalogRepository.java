package com.policysonar.analog.impl;

import com.policysonar.analog.AnalogRepository;
import com.policysonar.analog.PolicyAnalog;
import com.policysonar.errors.InvalidInputException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

public class InMemoryAnalogRepository implements AnalogRepository {

    private final List<PolicyAnalog> analogs = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public PolicyAnalog save(PolicyAnalog analog) {
        PolicyAnalog stored = new PolicyAnalog(sequence.incrementAndGet(), analog.policyText,
            analog.historicalPolicyId, analog.historicalMatch, analog.similarityScore, analog.riskFactors,
            analog.outcomeNarrative, analog.policyType, analog.jurisdiction, analog.year, analog.createdAt);
        analogs.add(stored);
        return stored;
    }

    @Override
    public List<PolicyAnalog> findByPolicyText(String policyText) {
        return analogs.stream()
            .filter(a -> a.policyText.equals(policyText))
            .sorted(Comparator.comparingDouble((PolicyAnalog a) -> a.similarityScore).reversed())
            .collect(Collectors.toList());
    }

    @Override
    public List<PolicyAnalog> findTopMatches(String policyText, int limit) {
        if (limit < 0) {
            throw new InvalidInputException("Match limit must not be negative, got " + limit);
        }
        List<PolicyAnalog> all = findByPolicyText(policyText);
        return new ArrayList<>(all.subList(0, Math.min(limit, all.size())));
    }

    public int size() {
        return analogs.size();
    }
}
