package com.netcourier.docstruct.service.parsing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netcourier.docstruct.model.ExtractedRecord;
import com.netcourier.docstruct.model.ParseWarning;
import com.netcourier.docstruct.model.RawModelResponse;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.tuple;

class ResponseParserTest {

    private final ResponseParser parser = new ResponseParser(new ObjectMapper());

    @Test
    void malformedLineIsSkippedWithOneWarning() {
        ParseResult result = parser.parse(response(3, """
                Here are the extracted records:
                Key: Invoice Number | Value: INV-42 | Comment: Printed in the header
                Key: Vendor | Comment: value went missing
                Let me know if you need anything else!
                """));

        assertThat(result.records()).containsExactly(
                new ExtractedRecord("Invoice Number", "INV-42", "Printed in the header", 3));
        assertThat(result.warnings()).hasSize(1);
        ParseWarning warning = result.warnings().get(0);
        assertThat(warning.type()).isEqualTo(ParseWarning.Type.MALFORMED_LINE);
        assertThat(warning.chunkIndex()).isEqualTo(3);
        assertThat(warning.line()).contains("Vendor");
    }

    @Test
    void toleratesLabelCasingWhitespaceAndSeveralRecordsPerLine() {
        ParseResult result = parser.parse(response(0,
                "KEY : First Name|value=Jane|  Comments:  ;;   key: Age | VALUE: 35 years | comment: as of 2024"));

        assertThat(result.records()).extracting(ExtractedRecord::key, ExtractedRecord::value, ExtractedRecord::comment)
                .containsExactly(
                        tuple("First Name", "Jane", ""),
                        tuple("Age", "35 years", "as of 2024"));
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void listMarkersAndMissingCommentAreAccepted() {
        ParseResult result = parser.parse(response(1, """
                - Key: City | Value: Jaipur
                2. Key: Country | Value: India | Comment: born in Jaipur, India
                """));

        assertThat(result.records()).extracting(ExtractedRecord::key).containsExactly("City", "Country");
        assertThat(result.records().get(0).comment()).isEmpty();
    }

    @Test
    void unlabelledPipeIsKeptInsideThePreviousField() {
        ParseResult result = parser.parse(response(0, "Key: Score | Value: 8.7 | 10 | Comment: on a 10-point scale"));

        assertThat(result.records()).singleElement()
                .satisfies(record -> {
                    assertThat(record.value()).isEqualTo("8.7 | 10");
                    assertThat(record.comment()).isEqualTo("on a 10-point scale");
                });
    }

    @Test
    void jsonArrayInsideCodeFenceIsUnderstood() {
        ParseResult result = parser.parse(response(4, """
                ```json
                [
                  {"key": "Current Salary", "value": 350000, "comments": "Paid by Acme Corp"},
                  {"value": "orphan"}
                ]
                ```
                """));

        assertThat(result.records()).containsExactly(
                new ExtractedRecord("Current Salary", "350000", "Paid by Acme Corp", 4));
        assertThat(result.warnings()).extracting(ParseWarning::type)
                .containsExactly(ParseWarning.Type.MALFORMED_LINE);
    }

    @Test
    void bracketsAndBracesInsideLineRecordsDoNotTriggerJsonParsing() {
        ParseResult result = parser.parse(response(2, """
                Key: Reference | Value: [1] | Comment: see appendix
                Key: Name | Value: Jane | Comment: uses {braces}
                """));

        assertThat(result.records()).extracting(ExtractedRecord::key, ExtractedRecord::value)
                .containsExactly(tuple("Reference", "[1]"), tuple("Name", "Jane"));
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void arrayWithoutObjectsIsNotTreatedAsRecords() {
        ParseResult result = parser.parse(response(0, "[1, 2, 3]"));

        assertThat(result.records()).isEmpty();
        assertThat(result.warnings()).extracting(ParseWarning::type)
                .containsExactly(ParseWarning.Type.NO_RECORDS_PARSED);
    }

    @Test
    void proseOnlyResponseSignalsNoRecordsParsed() {
        ParseResult result = parser.parse(response(5, "I could not find any structured data in this text."));

        assertThat(result.records()).isEmpty();
        assertThat(result.warnings()).extracting(ParseWarning::type)
                .containsExactly(ParseWarning.Type.NO_RECORDS_PARSED);
        assertThat(result.warnings().get(0).chunkIndex()).isEqualTo(5);
    }

    @Test
    void emptyResponseYieldsNothing() {
        ParseResult result = parser.parse(response(0, "   "));

        assertThat(result.records()).isEmpty();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void arbitraryInputNeverThrows() {
        String[] bodies = {
                "[{not json ;; Key: | Value: ;; |||",
                "Key:\nValue:\nComment:",
                "```",
                "]}[{",
                ";;;;||||;;",
                "key=value=comment=",
                "[1, 2, 3]",
                "\u0000\u0001 Key: \u0002 | Value: \u0003"
        };
        for (String body : bodies) {
            assertThatCode(() -> parser.parse(response(0, body))).doesNotThrowAnyException();
        }
        assertThatCode(() -> parser.parse(null)).doesNotThrowAnyException();
    }

    private static RawModelResponse response(int chunkIndex, String text) {
        return new RawModelResponse(chunkIndex, text, Instant.EPOCH);
    }
}
