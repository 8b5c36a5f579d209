package com.netcourier.docstruct.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "docstruct.extraction")
public class ExtractionProperties {

    public static final int MAX_TOKEN_BUDGET = 7000;

    /**
     * Maximum estimated tokens of document text sent to the model per request.
     */
    @Min(1)
    @Max(MAX_TOKEN_BUDGET)
    private int tokenBudget = 3000;

    /**
     * Maximum number of attempts per chunk, the first call included.
     */
    @Min(1)
    private int maxRetries = 3;

    @DecimalMin("0.0")
    private double backoffBaseSeconds = 1;

    @DecimalMin("0.0")
    private double maxBackoffSeconds = 30;

    /**
     * Ceiling on the whole model call for one chunk, retries and backoff included.
     */
    @DecimalMin("0.001")
    private double totalTimeoutSeconds = 120;

    @Min(1)
    private int concurrency = 1;

    /**
     * Tokens of the previous chunk repeated at the start of the next one.
     */
    @Min(0)
    private int chunkOverlap = 0;

    /**
     * Consecutive chunk failures after which remaining chunks are not dispatched. Zero disables the check.
     */
    @Min(0)
    private int failureThreshold = 3;

    @Min(0)
    private int slackWindowChars = 400;

    private boolean pruneCrossRecordComments = false;

    public int getTokenBudget() {
        return tokenBudget;
    }

    public void setTokenBudget(int tokenBudget) {
        this.tokenBudget = tokenBudget;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public double getBackoffBaseSeconds() {
        return backoffBaseSeconds;
    }

    public void setBackoffBaseSeconds(double backoffBaseSeconds) {
        this.backoffBaseSeconds = backoffBaseSeconds;
    }

    public double getMaxBackoffSeconds() {
        return maxBackoffSeconds;
    }

    public void setMaxBackoffSeconds(double maxBackoffSeconds) {
        this.maxBackoffSeconds = maxBackoffSeconds;
    }

    public double getTotalTimeoutSeconds() {
        return totalTimeoutSeconds;
    }

    public void setTotalTimeoutSeconds(double totalTimeoutSeconds) {
        this.totalTimeoutSeconds = totalTimeoutSeconds;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public int getChunkOverlap() {
        return chunkOverlap;
    }

    public void setChunkOverlap(int chunkOverlap) {
        this.chunkOverlap = chunkOverlap;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = failureThreshold;
    }

    public int getSlackWindowChars() {
        return slackWindowChars;
    }

    public void setSlackWindowChars(int slackWindowChars) {
        this.slackWindowChars = slackWindowChars;
    }

    public boolean isPruneCrossRecordComments() {
        return pruneCrossRecordComments;
    }

    public void setPruneCrossRecordComments(boolean pruneCrossRecordComments) {
        this.pruneCrossRecordComments = pruneCrossRecordComments;
    }
}
