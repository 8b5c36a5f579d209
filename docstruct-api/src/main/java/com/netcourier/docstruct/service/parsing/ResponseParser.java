package com.netcourier.docstruct.service.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netcourier.docstruct.model.ExtractedRecord;
import com.netcourier.docstruct.model.ParseWarning;
import com.netcourier.docstruct.model.RawModelResponse;
import com.netcourier.docstruct.service.prompt.PromptBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the model's free text into typed records. Best effort and line oriented: a malformed line is
 * reported as a warning and skipped, and no input makes {@link #parse(RawModelResponse)} throw.
 * <p>
 * Two shapes are understood: the {@code Key: .. | Value: .. | Comment: ..} lines requested by
 * {@link PromptBuilder}, and a JSON array of {@code {"key", "value", "comments"}} objects.
 */
@Component
public class ResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ResponseParser.class);
    private static final Pattern FIELD = Pattern.compile("^\\s*(key|value|comments?)\\s*[:=]\\s*(.*)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern LEADING_MARKER = Pattern.compile("^\\s*(?:[-*•]+|\\d+[.)])\\s*");
    private static final Pattern LABEL_ANYWHERE = Pattern.compile("(?i)\\b(key|value|comments?)\\s*[:=]");
    private static final Pattern RECORD_SPLIT = Pattern.compile(Pattern.quote(PromptBuilder.RECORD_SEPARATOR));
    private static final Pattern FIELD_SPLIT = Pattern.compile(Pattern.quote(PromptBuilder.FIELD_SEPARATOR));
    private static final Pattern FENCE = Pattern.compile("^\\s*```[a-zA-Z]*\\s*$");

    private final ObjectMapper objectMapper;

    public ResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ParseResult parse(RawModelResponse response) {
        if (response == null || response.text() == null || response.text().isBlank()) {
            return new ParseResult(List.of(), List.of());
        }
        int chunkIndex = response.chunkIndex();
        try {
            String body = stripFences(response.text());
            List<ExtractedRecord> records = new ArrayList<>();
            List<ParseWarning> warnings = new ArrayList<>();
            if (!parseJson(chunkIndex, body, records, warnings)) {
                parseLines(chunkIndex, body, records, warnings);
            }
            if (records.isEmpty()) {
                log.warn("No records parsed from non-empty response for chunk {}", chunkIndex);
                warnings.add(ParseWarning.noRecords(chunkIndex));
            }
            return new ParseResult(records, warnings);
        } catch (RuntimeException ex) {
            log.warn("Unexpected failure while parsing response for chunk {}", chunkIndex, ex);
            return new ParseResult(List.of(), List.of(ParseWarning.noRecords(chunkIndex)));
        }
    }

    private String stripFences(String text) {
        StringBuilder builder = new StringBuilder();
        for (String line : text.split("\r?\n")) {
            if (!FENCE.matcher(line).matches()) {
                builder.append(line).append('\n');
            }
        }
        return builder.toString().strip();
    }

    private boolean parseJson(int chunkIndex, String body, List<ExtractedRecord> records, List<ParseWarning> warnings) {
        if (!body.startsWith("[") || !body.endsWith("]")) {
            return false;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (Exception ex) {
            log.debug("Response for chunk {} is not a JSON array, falling back to line parsing", chunkIndex);
            return false;
        }
        if (root == null || !root.isArray() || !hasObjectElement(root)) {
            return false;
        }
        for (JsonNode element : root) {
            if (!element.isObject()) {
                warnings.add(ParseWarning.malformed(chunkIndex, element.toString(), "Array element is not an object"));
                continue;
            }
            Map<String, String> fields = new HashMap<>();
            Iterator<Map.Entry<String, JsonNode>> iterator = element.fields();
            while (iterator.hasNext()) {
                Map.Entry<String, JsonNode> field = iterator.next();
                fields.put(canonicalLabel(field.getKey()), field.getValue().isNull() ? "" : field.getValue().asText());
            }
            toRecord(chunkIndex, fields).ifPresentOrElse(records::add,
                    () -> warnings.add(ParseWarning.malformed(chunkIndex, element.toString(), "Object has no key")));
        }
        return true;
    }

    private boolean hasObjectElement(JsonNode array) {
        for (JsonNode element : array) {
            if (element.isObject()) {
                return true;
            }
        }
        return false;
    }

    private void parseLines(int chunkIndex, String body, List<ExtractedRecord> records, List<ParseWarning> warnings) {
        for (String line : body.split("\r?\n")) {
            if (line.isBlank() || !LABEL_ANYWHERE.matcher(line).find()) {
                continue;
            }
            for (String segment : RECORD_SPLIT.split(line)) {
                if (segment.isBlank()) {
                    continue;
                }
                Map<String, String> fields = readFields(segment);
                if (fields.isEmpty()) {
                    continue;
                }
                if (!fields.containsKey("value")) {
                    warnings.add(ParseWarning.malformed(chunkIndex, segment.strip(), "Record has no value field"));
                    continue;
                }
                toRecord(chunkIndex, fields).ifPresentOrElse(records::add,
                        () -> warnings.add(ParseWarning.malformed(chunkIndex, segment.strip(), "Record has no key")));
            }
        }
    }

    private Map<String, String> readFields(String segment) {
        Map<String, String> fields = new HashMap<>();
        String lastLabel = null;
        boolean first = true;
        for (String part : FIELD_SPLIT.split(segment, -1)) {
            String candidate = first ? LEADING_MARKER.matcher(part).replaceFirst("") : part;
            first = false;
            Matcher matcher = FIELD.matcher(candidate);
            if (matcher.matches()) {
                lastLabel = canonicalLabel(matcher.group(1));
                fields.putIfAbsent(lastLabel, matcher.group(2).strip());
            } else if (lastLabel != null && !part.isBlank()) {
                // unlabelled part: a stray "|" inside the previous field
                fields.put(lastLabel, fields.get(lastLabel) + " | " + part.strip());
            }
        }
        return fields;
    }

    private Optional<ExtractedRecord> toRecord(int chunkIndex, Map<String, String> fields) {
        String key = stripQuotes(fields.get("key"));
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new ExtractedRecord(key,
                stripQuotes(fields.getOrDefault("value", "")),
                stripQuotes(fields.getOrDefault("comment", "")),
                chunkIndex));
    }

    private String canonicalLabel(String label) {
        String normalized = label == null ? "" : label.strip().toLowerCase(Locale.ROOT);
        return normalized.startsWith("comment") ? "comment" : normalized;
    }

    private String stripQuotes(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1).strip();
        }
        return trimmed;
    }
}
