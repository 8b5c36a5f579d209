package com.netcourier.docstruct.service.dedup;

import com.netcourier.docstruct.model.ExtractedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds extracted records into a duplicate-free canonical set, one run at a time. Records must be fed in
 * chunk order by a single caller; the merge is not thread-safe.
 * <p>
 * Comment redundancy is checked pairwise against the comments already held for the key, so a document costs
 * O(n²) comparisons in its comment count. That is fine for tens to hundreds of records per document.
 */
public class Deduplicator {

    private static final Logger log = LoggerFactory.getLogger(Deduplicator.class);

    private final Map<String, List<CanonicalRecord>> variantsByKey = new HashMap<>();
    private final List<CanonicalRecord> records = new ArrayList<>();
    private int conflicts;

    public MergeOutcome accept(ExtractedRecord record) {
        String normalizedKey = TextNormalizer.normalizeKey(record.key());
        List<CanonicalRecord> variants = variantsByKey.get(normalizedKey);
        if (variants == null) {
            CanonicalRecord created = create(normalizedKey, record, false);
            List<CanonicalRecord> list = new ArrayList<>();
            list.add(created);
            variantsByKey.put(normalizedKey, list);
            return MergeOutcome.CREATED;
        }
        for (CanonicalRecord existing : variants) {
            if (existing.hasEquivalentValue(record.value())) {
                existing.mergeComment(record.comment());
                return MergeOutcome.MERGED;
            }
        }
        CanonicalRecord variant = create(normalizedKey, record, true);
        variants.add(variant);
        conflicts++;
        log.info("Conflicting value for key '{}' in chunk {}: '{}' differs from '{}'",
                normalizedKey, record.sourceChunkIndex(), record.value(), variants.get(0).value());
        return MergeOutcome.CONFLICT;
    }

    public List<CanonicalRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public int conflictCount() {
        return conflicts;
    }

    private CanonicalRecord create(String normalizedKey, ExtractedRecord record, boolean conflict) {
        CanonicalRecord canonical = new CanonicalRecord(normalizedKey, record.key(), record.value(),
                record.sourceChunkIndex(), records.size(), conflict);
        canonical.mergeComment(record.comment());
        records.add(canonical);
        return canonical;
    }
}
