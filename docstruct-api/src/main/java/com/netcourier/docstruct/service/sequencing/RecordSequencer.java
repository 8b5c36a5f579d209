package com.netcourier.docstruct.service.sequencing;

import com.netcourier.docstruct.model.OutputRow;
import com.netcourier.docstruct.service.dedup.CanonicalRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Numbers canonical records in the order they were first observed and flattens their comments.
 */
public class RecordSequencer {

    public static final String COMMENT_SEPARATOR = "; ";

    private static final Comparator<CanonicalRecord> FIRST_SEEN = Comparator
            .comparingInt(CanonicalRecord::firstSeenChunk)
            .thenComparingInt(CanonicalRecord::sequence);

    private final boolean pruneCrossRecordComments;

    public RecordSequencer(boolean pruneCrossRecordComments) {
        this.pruneCrossRecordComments = pruneCrossRecordComments;
    }

    public List<OutputRow> sequence(Collection<CanonicalRecord> records) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        List<CanonicalRecord> ordered = records.stream().sorted(FIRST_SEEN).toList();
        List<List<String>> comments = new ArrayList<>();
        for (CanonicalRecord record : ordered) {
            comments.add(new ArrayList<>(record.comments()));
        }
        if (pruneCrossRecordComments) {
            pruneAcrossRows(comments);
        }
        List<OutputRow> rows = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            CanonicalRecord record = ordered.get(i);
            rows.add(new OutputRow(i + 1, record.key(), record.value(),
                    String.join(COMMENT_SEPARATOR, comments.get(i)), record.conflict()));
        }
        return List.copyOf(rows);
    }

    /**
     * Drops a comment when another row holds a longer comment containing it, or the same comment further
     * down the table. Case-insensitive.
     */
    private void pruneAcrossRows(List<List<String>> comments) {
        List<List<String>> lowered = comments.stream()
                .map(list -> list.stream().map(comment -> comment.toLowerCase(Locale.ROOT)).toList())
                .toList();
        for (int row = 0; row < comments.size(); row++) {
            List<String> kept = new ArrayList<>();
            List<String> rowComments = comments.get(row);
            for (int c = 0; c < rowComments.size(); c++) {
                if (!subsumedElsewhere(lowered, row, lowered.get(row).get(c))) {
                    kept.add(rowComments.get(c));
                }
            }
            comments.set(row, kept);
        }
    }

    private boolean subsumedElsewhere(List<List<String>> lowered, int row, String comment) {
        for (int other = 0; other < lowered.size(); other++) {
            if (other == row) {
                continue;
            }
            for (String candidate : lowered.get(other)) {
                if (candidate.equals(comment) ? other > row : candidate.contains(comment)) {
                    return true;
                }
            }
        }
        return false;
    }
}
