package com.flplatform.common.privacy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only ledger of ε spent per round. Cumulative spend never decreases.
 * All methods are synchronized on the instance.
 */
public class PrivacyBudget {

    private final List<Entry> entries = new ArrayList<>();
    private double epsilonSpent;

    public synchronized Entry addRound(double epsilon, double noiseScale) {
        if (!Double.isFinite(epsilon) || epsilon < 0.0) {
            throw new IllegalArgumentException("epsilon must be finite and non-negative, got " + epsilon);
        }
        Entry entry = new Entry(entries.size() + 1, epsilon, noiseScale, Instant.now());
        entries.add(entry);
        epsilonSpent += epsilon;
        return entry;
    }

    public synchronized double epsilonSpent() {
        return epsilonSpent;
    }

    public synchronized int roundsParticipated() {
        return entries.size();
    }

    /** {@code max(0, maxEpsilon − spent)}. */
    public synchronized double remaining(double maxEpsilon) {
        return Math.max(0.0, maxEpsilon - epsilonSpent);
    }

    public synchronized boolean isExhausted(double maxEpsilon) {
        return epsilonSpent >= maxEpsilon;
    }

    public synchronized double averageEpsilonPerRound() {
        return epsilonSpent / Math.max(1, entries.size());
    }

    public synchronized List<Entry> entries() {
        return List.copyOf(entries);
    }

    /** One ledger line. {@code round} is 1-based in recording order. */
    public record Entry(int round, double epsilon, double noiseScale, Instant recordedAt) {}
}
