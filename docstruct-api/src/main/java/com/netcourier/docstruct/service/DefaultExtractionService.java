package com.netcourier.docstruct.service;

import com.netcourier.docstruct.config.ExtractionProperties;
import com.netcourier.docstruct.model.ChunkFailure;
import com.netcourier.docstruct.model.ExtractedRecord;
import com.netcourier.docstruct.model.ExtractionDocument;
import com.netcourier.docstruct.model.ExtractionResult;
import com.netcourier.docstruct.model.ExtractionSummary;
import com.netcourier.docstruct.model.OutputRow;
import com.netcourier.docstruct.model.ParseWarning;
import com.netcourier.docstruct.model.RawModelResponse;
import com.netcourier.docstruct.model.TextChunk;
import com.netcourier.docstruct.service.chunking.ChunkPlan;
import com.netcourier.docstruct.service.chunking.ChunkPlanner;
import com.netcourier.docstruct.service.dedup.Deduplicator;
import com.netcourier.docstruct.service.extraction.ExtractionClient;
import com.netcourier.docstruct.service.extraction.ExtractionFailedException;
import com.netcourier.docstruct.service.extraction.openai.ModelAuthenticationException;
import com.netcourier.docstruct.service.ingestion.DocumentTextExtractor;
import com.netcourier.docstruct.service.parsing.ParseResult;
import com.netcourier.docstruct.service.parsing.ResponseParser;
import com.netcourier.docstruct.service.prompt.PromptBuilder;
import com.netcourier.docstruct.service.sequencing.RecordSequencer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.ByteArrayInputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs one document through chunking, model extraction, parsing, deduplication and sequencing.
 * <p>
 * Chunks are dispatched with bounded concurrency but their responses are re-ordered by chunk index before
 * they reach the {@link Deduplicator}, which is only ever touched by the single subscriber of the run.
 */
@Service
public class DefaultExtractionService implements ExtractionService {

    private static final Logger log = LoggerFactory.getLogger(DefaultExtractionService.class);

    private final DocumentTextExtractor textExtractor;
    private final ChunkPlanner chunkPlanner;
    private final PromptBuilder promptBuilder;
    private final ExtractionClient extractionClient;
    private final ResponseParser responseParser;
    private final RecordSequencer recordSequencer;
    private final MeterRegistry meterRegistry;
    private final int concurrency;
    private final int failureThreshold;
    private final Counter chunkSuccessCounter;
    private final Counter chunkFailureCounter;
    private final Counter recordCounter;
    private final Timer extractionTimer;

    public DefaultExtractionService(DocumentTextExtractor textExtractor,
                                    ChunkPlanner chunkPlanner,
                                    PromptBuilder promptBuilder,
                                    ExtractionClient extractionClient,
                                    ResponseParser responseParser,
                                    RecordSequencer recordSequencer,
                                    ExtractionProperties properties,
                                    MeterRegistry meterRegistry) {
        this.textExtractor = textExtractor;
        this.chunkPlanner = chunkPlanner;
        this.promptBuilder = promptBuilder;
        this.extractionClient = extractionClient;
        this.responseParser = responseParser;
        this.recordSequencer = recordSequencer;
        this.meterRegistry = meterRegistry;
        this.concurrency = Math.max(1, properties.getConcurrency());
        this.failureThreshold = Math.max(0, properties.getFailureThreshold());
        this.chunkSuccessCounter = meterRegistry.counter("docstruct.extraction.chunks", "outcome", "success");
        this.chunkFailureCounter = meterRegistry.counter("docstruct.extraction.chunks", "outcome", "failed");
        this.recordCounter = meterRegistry.counter("docstruct.extraction.records");
        this.extractionTimer = meterRegistry.timer("docstruct.extraction.duration");
    }

    @Override
    public ExtractionResult extractPdf(String filename, byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new DocumentProcessingException(HttpStatus.BAD_REQUEST, "Uploaded file is empty");
        }
        DocumentTextExtractor.ExtractedText extracted = textExtractor.extract(filename, new ByteArrayInputStream(bytes));
        return extract(new ExtractionDocument(documentId(filename, extracted), extracted.text()));
    }

    @Override
    public ExtractionResult extractPdf(Path path) {
        DocumentTextExtractor.ExtractedText extracted = textExtractor.extractText(path);
        return extract(new ExtractionDocument(documentId(path.getFileName().toString(), extracted), extracted.text()));
    }

    @Override
    public ExtractionResult extract(ExtractionDocument document) {
        if (document == null || document.text().isBlank()) {
            throw new DocumentProcessingException(HttpStatus.BAD_REQUEST, "Document text must not be empty");
        }
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return run(document);
        } finally {
            sample.stop(extractionTimer);
        }
    }

    private ExtractionResult run(ExtractionDocument document) {
        ChunkPlan plan = chunkPlanner.plan(document.text());
        List<TextChunk> chunks = plan.chunks();
        RunState state = new RunState(document.documentId(), failureThreshold);
        log.info("Extracting document {}: {} chunks (budget {} tokens, concurrency {})",
                document.documentId(), chunks.size(), chunkPlanner.tokenBudget(), concurrency);

        try {
            Flux.fromIterable(chunks)
                    .flatMapSequential(chunk -> dispatch(chunk, state), concurrency)
                    .doOnNext(state::apply)
                    .takeUntil(outcome -> state.thresholdReached())
                    .blockLast();
        } catch (ModelAuthenticationException ex) {
            log.error("Aborting extraction of {}: model credential rejected", document.documentId());
            throw ex;
        }

        boolean aborted = state.processed < chunks.size();
        if (aborted) {
            log.warn("Aborting extraction of {} after {} consecutive chunk failures; {} chunks left unprocessed",
                    document.documentId(), state.consecutiveFailures, chunks.size() - state.processed);
            for (int index = state.processed; index < chunks.size(); index++) {
                int chunkIndex = chunks.get(index).index();
                state.skipped.add(state.dispatched.contains(chunkIndex)
                        ? ChunkFailure.cancelledInFlight(chunkIndex)
                        : ChunkFailure.notDispatched(chunkIndex));
            }
        }

        List<OutputRow> rows = recordSequencer.sequence(state.deduplicator.records());
        ExtractionSummary summary = new ExtractionSummary(
                document.documentId(),
                chunks.size(),
                state.processed - state.failed,
                state.extractedRecords,
                state.deduplicator.conflictCount(),
                aborted,
                state.skipped,
                plan.overflows(),
                state.warnings
        );
        log.info("Extraction of {} finished: {} rows from {} records, {}/{} chunks processed, {} skipped, {} overflowing units, {} parse warnings",
                document.documentId(), rows.size(), state.extractedRecords, summary.processedChunks(), chunks.size(),
                summary.skippedChunks().size(), summary.overflows().size(), summary.parseWarnings().size());
        return new ExtractionResult(document.documentId(), rows, summary);
    }

    private Mono<ChunkOutcome> dispatch(TextChunk chunk, RunState state) {
        return extractionClient.extract(promptBuilder.build(chunk))
                .doOnSubscribe(subscription -> state.dispatched.add(chunk.index()))
                .map(response -> new ChunkOutcome(chunk.index(), response, null))
                .onErrorResume(ExtractionFailedException.class,
                        ex -> Mono.just(new ChunkOutcome(chunk.index(), null, ex)));
    }

    private String documentId(String filename, DocumentTextExtractor.ExtractedText extracted) {
        if (filename != null && !filename.isBlank()) {
            return filename.strip();
        }
        return extracted.title();
    }

    private record ChunkOutcome(int chunkIndex, RawModelResponse response, ExtractionFailedException failure) {
    }

    /**
     * Mutable state of one run. Only the run's single subscriber touches it, except {@code dispatched}, which
     * is written from whichever thread subscribes to a chunk's request.
     */
    private final class RunState {

        private final String documentId;
        private final int failureThreshold;
        private final Deduplicator deduplicator = new Deduplicator();
        private final List<ChunkFailure> skipped = new ArrayList<>();
        private final List<ParseWarning> warnings = new ArrayList<>();
        private final Set<Integer> dispatched = ConcurrentHashMap.newKeySet();
        private int processed;
        private int failed;
        private int consecutiveFailures;
        private int extractedRecords;

        private RunState(String documentId, int failureThreshold) {
            this.documentId = documentId;
            this.failureThreshold = failureThreshold;
        }

        private void apply(ChunkOutcome outcome) {
            processed++;
            if (outcome.failure() != null) {
                failed++;
                consecutiveFailures++;
                chunkFailureCounter.increment();
                ExtractionFailedException failure = outcome.failure();
                log.warn("Skipping chunk {} of {}: {}", outcome.chunkIndex(), documentId, failure.getMessage());
                skipped.add(new ChunkFailure(outcome.chunkIndex(), failure.attempts(), failure.reason()));
                return;
            }
            consecutiveFailures = 0;
            chunkSuccessCounter.increment();
            ParseResult parsed = responseParser.parse(outcome.response());
            warnings.addAll(parsed.warnings());
            for (ExtractedRecord record : parsed.records()) {
                deduplicator.accept(record);
            }
            extractedRecords += parsed.records().size();
            recordCounter.increment(parsed.records().size());
            log.debug("Chunk {} of {} yielded {} records and {} warnings",
                    outcome.chunkIndex(), documentId, parsed.records().size(), parsed.warnings().size());
        }

        private boolean thresholdReached() {
            return failureThreshold > 0 && consecutiveFailures >= failureThreshold;
        }
    }
}
