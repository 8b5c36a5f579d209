package com.netcourier.docstruct.service.dedup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The merged form of every extraction sharing a normalized key (and, for conflict variants, a value).
 * Only ever grows: comments are merged in, nothing is removed from the canonical set.
 */
public class CanonicalRecord {

    private final String normalizedKey;
    private final String key;
    private final String value;
    private final String comparisonValue;
    private final List<String> comments = new ArrayList<>();
    private final int firstSeenChunk;
    private final int sequence;
    private final boolean conflict;

    CanonicalRecord(String normalizedKey,
                    String key,
                    String value,
                    int firstSeenChunk,
                    int sequence,
                    boolean conflict) {
        this.normalizedKey = normalizedKey;
        this.key = key;
        this.value = value;
        this.comparisonValue = TextNormalizer.comparisonValue(value);
        this.firstSeenChunk = firstSeenChunk;
        this.sequence = sequence;
        this.conflict = conflict;
    }

    public String normalizedKey() {
        return normalizedKey;
    }

    /**
     * Key as first written by the model.
     */
    public String key() {
        return key;
    }

    public String value() {
        return value;
    }

    public List<String> comments() {
        return Collections.unmodifiableList(comments);
    }

    public int firstSeenChunk() {
        return firstSeenChunk;
    }

    public int sequence() {
        return sequence;
    }

    public boolean conflict() {
        return conflict;
    }

    boolean hasEquivalentValue(String candidate) {
        return comparisonValue.equals(TextNormalizer.comparisonValue(candidate));
    }

    /**
     * Adds a comment unless an existing one already contains it. Existing comments contained in the new one
     * are replaced by it, which keeps the longer wording at the position of the earliest one.
     *
     * @return {@code true} when the comment set changed
     */
    boolean mergeComment(String comment) {
        String candidate = TextNormalizer.collapseWhitespace(comment);
        if (candidate.isEmpty()) {
            return false;
        }
        for (String existing : comments) {
            if (existing.contains(candidate)) {
                return false;
            }
        }
        int replaceAt = -1;
        for (int index = comments.size() - 1; index >= 0; index--) {
            if (candidate.contains(comments.get(index))) {
                comments.remove(index);
                replaceAt = index;
            }
        }
        if (replaceAt < 0) {
            comments.add(candidate);
        } else {
            comments.add(replaceAt, candidate);
        }
        return true;
    }

    @Override
    public String toString() {
        return "CanonicalRecord{" + normalizedKey + "=" + value + (conflict ? " (conflict)" : "") + ", comments=" + comments + '}';
    }
}
