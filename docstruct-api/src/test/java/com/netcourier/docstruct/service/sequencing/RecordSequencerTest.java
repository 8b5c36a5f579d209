package com.netcourier.docstruct.service.sequencing;

import com.netcourier.docstruct.model.ExtractedRecord;
import com.netcourier.docstruct.model.OutputRow;
import com.netcourier.docstruct.service.dedup.CanonicalRecord;
import com.netcourier.docstruct.service.dedup.Deduplicator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class RecordSequencerTest {

    @Test
    void numbersRowsInFirstSeenOrderAndJoinsComments() {
        Deduplicator deduplicator = new Deduplicator();
        deduplicator.accept(new ExtractedRecord("Name", "Jane Doe", "From the header", 0));
        deduplicator.accept(new ExtractedRecord("City", "Jaipur", "", 0));
        deduplicator.accept(new ExtractedRecord("Employer", "Acme Corp", "Since 2015", 1));
        deduplicator.accept(new ExtractedRecord("Name", "Jane Doe", "Signed page 3", 2));
        List<CanonicalRecord> shuffled = new ArrayList<>(deduplicator.records());
        Collections.reverse(shuffled);

        List<OutputRow> rows = new RecordSequencer(false).sequence(shuffled);

        assertThat(rows).containsExactly(
                new OutputRow(1, "Name", "Jane Doe", "From the header; Signed page 3", false),
                new OutputRow(2, "City", "Jaipur", "", false),
                new OutputRow(3, "Employer", "Acme Corp", "Since 2015", false));
    }

    @Test
    void conflictVariantKeepsItsFlag() {
        Deduplicator deduplicator = new Deduplicator();
        deduplicator.accept(new ExtractedRecord("Total", "100", "", 0));
        deduplicator.accept(new ExtractedRecord("Total", "120", "After tax", 1));

        List<OutputRow> rows = new RecordSequencer(false).sequence(deduplicator.records());

        assertThat(rows).extracting(OutputRow::srNo, OutputRow::value, OutputRow::conflict)
                .containsExactly(
                        tuple(1, "100", false),
                        tuple(2, "120", true));
    }

    @Test
    void crossRecordPruningDropsCommentsCoveredByAnotherRow() {
        Deduplicator deduplicator = new Deduplicator();
        deduplicator.accept(new ExtractedRecord("City", "Jaipur", "born in jaipur", 0));
        deduplicator.accept(new ExtractedRecord("State", "Rajasthan", "Born in Jaipur, Rajasthan", 0));
        deduplicator.accept(new ExtractedRecord("Country", "India", "Resident since birth", 1));
        deduplicator.accept(new ExtractedRecord("Nationality", "Indian", "Resident since birth", 1));

        List<OutputRow> pruned = new RecordSequencer(true).sequence(deduplicator.records());
        List<OutputRow> untouched = new RecordSequencer(false).sequence(deduplicator.records());

        assertThat(pruned).extracting(OutputRow::comments)
                .containsExactly("", "Born in Jaipur, Rajasthan", "", "Resident since birth");
        assertThat(untouched).extracting(OutputRow::comments)
                .containsExactly("born in jaipur", "Born in Jaipur, Rajasthan", "Resident since birth", "Resident since birth");
    }

    @Test
    void emptyInputGivesNoRows() {
        assertThat(new RecordSequencer(false).sequence(List.of())).isEmpty();
    }
}
