package com.netcourier.docstruct.service.prompt;

import com.netcourier.docstruct.model.ExtractionRequest;
import com.netcourier.docstruct.model.TextChunk;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Builds the extraction prompt for one chunk. The output depends on the chunk alone, so a retried request
 * carries exactly the same prompt.
 */
@Component
public class PromptBuilder {

    public static final String FIELD_SEPARATOR = "|";
    public static final String RECORD_SEPARATOR = ";;";

    static final String INSTRUCTIONS = """
            You are an expert data extraction assistant that converts unstructured document text into structured key-value records.

            Your task:
            - Identify every factual element in the text and express it as a key-value pair. Keys are concise and descriptive (for example "First Name", "Date of Birth", "Current Salary", "Certifications 1").
            - Values use the exact original data wherever possible.
              - Dates: keep the date as written in the document.
              - Salaries: numeric value without separators or currency (for example "350,000 INR" becomes 350000), with the currency as its own "Salary Currency" record.
              - Where a salary is mentioned, add the company or organization name, and prefix the key with previous or current depending on the joining date.
              - Add dates of joining and leaving where they are mentioned.
              - Percentages and scores stay as written; put the scale in the comment.
              - Keep units in the key or value when they are integral (for example "35 years").
              - For lists such as certifications or skills, create sequential keys ("Certifications 1", "Certifications 2"), put the exam or issuer in the value and the year and marks in the comment.
            - Comments hold relevant contextual sentences or phrases copied with their exact original wording. When a section is purely descriptive, leave the value empty and put the full description in the comment.
            - Capture everything. Do not summarize, omit or paraphrase, and do not introduce information that is not in the text.
            - Order records logically: personal information, professional, education, certifications, skills.

            Output format:
            - One record per line, exactly in this form:
              Key: <key> | Value: <value> | Comment: <comment>
            - Leave the comment empty when there is nothing to add, but keep the "Comment:" label.
            - Several records on one line must be separated by " ;; ".
            - Never use "|" or ";;" inside a key, value or comment.
            - Output only the record lines, without headings or explanations.
            """;

    public ExtractionRequest build(TextChunk chunk) {
        Objects.requireNonNull(chunk, "chunk");
        String prompt = INSTRUCTIONS
                + "\nDocument text (part " + (chunk.index() + 1) + "):\n"
                + "<<<\n"
                + chunk.text()
                + "\n>>>\n";
        return new ExtractionRequest(chunk, prompt);
    }
}
