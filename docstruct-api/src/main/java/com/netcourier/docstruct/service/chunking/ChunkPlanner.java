package com.netcourier.docstruct.service.chunking;

import com.netcourier.docstruct.config.ExtractionProperties;
import com.netcourier.docstruct.model.ChunkOverflow;
import com.netcourier.docstruct.model.TextChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits document text into chunks whose estimated size stays within the token budget. Paragraphs are
 * kept whole where they fit, oversized paragraphs are split on line boundaries and oversized lines on
 * whitespace. Table rows are never split.
 */
public class ChunkPlanner {

    private static final Logger log = LoggerFactory.getLogger(ChunkPlanner.class);
    private static final Pattern COLUMN_GAP = Pattern.compile("\\S {3,}(?=\\S)");
    private static final String PARAGRAPH_SEPARATOR = "\n\n";
    private static final String LINE_SEPARATOR = "\n";

    private final int tokenBudget;
    private final int overlapTokens;
    private final int slackWindowChars;

    public ChunkPlanner(int tokenBudget, int overlapTokens, int slackWindowChars) {
        if (tokenBudget < 1 || tokenBudget > ExtractionProperties.MAX_TOKEN_BUDGET) {
            throw new IllegalArgumentException("Token budget must be between 1 and "
                    + ExtractionProperties.MAX_TOKEN_BUDGET + " but was " + tokenBudget);
        }
        if (overlapTokens < 0 || overlapTokens >= tokenBudget) {
            throw new IllegalArgumentException("Chunk overlap must be non-negative and smaller than the token budget");
        }
        this.tokenBudget = tokenBudget;
        this.overlapTokens = overlapTokens;
        this.slackWindowChars = Math.max(0, slackWindowChars);
    }

    public int tokenBudget() {
        return tokenBudget;
    }

    public ChunkPlan plan(String text) {
        if (text == null || text.isBlank()) {
            return ChunkPlan.empty();
        }
        List<String> paragraphs = Arrays.stream(text.split("\r?\n\\s*\r?\n"))
                .map(String::trim)
                .filter(paragraph -> !paragraph.isBlank())
                .collect(Collectors.toList());

        List<Piece> pieces = new ArrayList<>();
        List<ChunkOverflow> overflows = new ArrayList<>();
        for (int unitIndex = 0; unitIndex < paragraphs.size(); unitIndex++) {
            String paragraph = paragraphs.get(unitIndex);
            if (fits(paragraph)) {
                pieces.add(new Piece(paragraph, true));
                continue;
            }
            splitParagraph(unitIndex, paragraph, pieces, overflows);
        }

        List<TextChunk> chunks = pack(pieces);
        log.debug("Planned {} chunks with budget {} ({} overflowing units)", chunks.size(), tokenBudget, overflows.size());
        return new ChunkPlan(chunks, overflows);
    }

    private void splitParagraph(int unitIndex, String paragraph, List<Piece> pieces, List<ChunkOverflow> overflows) {
        boolean first = true;
        for (String rawLine : paragraph.split("\r?\n")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            try {
                for (String part : splitLine(unitIndex, line)) {
                    pieces.add(new Piece(part, first));
                    first = false;
                }
            } catch (ChunkOverflowException ex) {
                log.warn("Skipping table row in unit {}: {}", unitIndex, ex.getMessage());
                overflows.add(ex.toOverflow());
            }
        }
    }

    private List<String> splitLine(int unitIndex, String line) {
        if (fits(line)) {
            return List.of(line);
        }
        if (isTableRow(line)) {
            throw new ChunkOverflowException(unitIndex, TokenEstimator.estimate(line), tokenBudget, line);
        }
        int maxChars = TokenEstimator.maxCharsFor(tokenBudget);
        List<String> parts = new ArrayList<>();
        String remaining = line;
        while (remaining.length() > maxChars) {
            int cut = findCut(remaining, maxChars);
            String head = remaining.substring(0, cut).strip();
            if (!head.isEmpty()) {
                parts.add(head);
            }
            remaining = remaining.substring(cut).strip();
        }
        if (!remaining.isEmpty()) {
            parts.add(remaining);
        }
        return parts;
    }

    private int findCut(String text, int maxChars) {
        int lowerBound = Math.max(1, maxChars - slackWindowChars);
        for (int index = maxChars; index >= lowerBound; index--) {
            if (Character.isWhitespace(text.charAt(index))) {
                return index;
            }
        }
        return maxChars;
    }

    private List<TextChunk> pack(List<Piece> pieces) {
        List<TextChunk> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (Piece piece : pieces) {
            if (current.length() == 0) {
                current.append(piece.text());
                continue;
            }
            String separator = piece.startsParagraph() ? PARAGRAPH_SEPARATOR : LINE_SEPARATOR;
            String candidate = current + separator + piece.text();
            if (fits(candidate)) {
                current.setLength(0);
                current.append(candidate);
                continue;
            }
            String completed = current.toString();
            chunks.add(toChunk(chunks.size(), completed));
            current.setLength(0);
            current.append(withOverlap(completed, piece.text()));
        }
        if (current.length() > 0) {
            chunks.add(toChunk(chunks.size(), current.toString()));
        }
        return chunks;
    }

    private String withOverlap(String previous, String next) {
        if (overlapTokens == 0) {
            return next;
        }
        String tail = tail(previous, TokenEstimator.maxCharsFor(overlapTokens));
        if (tail.isEmpty()) {
            return next;
        }
        String candidate = tail + LINE_SEPARATOR + next;
        return fits(candidate) ? candidate : next;
    }

    private String tail(String source, int maxLength) {
        if (source.length() <= maxLength) {
            return source;
        }
        String tail = source.substring(source.length() - maxLength);
        Matcher boundary = Pattern.compile("\\s").matcher(tail);
        return boundary.find() ? tail.substring(boundary.end()).strip() : tail.strip();
    }

    private TextChunk toChunk(int index, String text) {
        return new TextChunk(index, text, TokenEstimator.estimate(text));
    }

    private boolean fits(String text) {
        return TokenEstimator.estimate(text) <= tokenBudget;
    }

    static boolean isTableRow(String line) {
        if (line.indexOf('\t') >= 0 || line.indexOf('|') >= 0) {
            return true;
        }
        Matcher gaps = COLUMN_GAP.matcher(line);
        int count = 0;
        while (gaps.find()) {
            count++;
        }
        return count >= 2;
    }

    private record Piece(String text, boolean startsParagraph) {
    }
}
