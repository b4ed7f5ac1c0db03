package com.engram.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "engram")
public class EngramProperties {

    private Analysis analysis = new Analysis();
    private History history = new History();

    // -- Analysis accessors (delegate to nested) --
    public int getMaxManifestBytes() { return analysis.maxManifestBytes; }
    public int getKeyFileMaxChars() { return analysis.keyFileMaxChars; }
    public int getReadmeExcerptChars() { return analysis.readmeExcerptChars; }
    public int getTopDirLimit() { return analysis.topDirLimit; }
    public int getTopExtensionLimit() { return analysis.topExtensionLimit; }
    public int getDeadlineSeconds() { return analysis.deadlineSeconds; }

    // -- History accessors (delegate to nested) --
    public int getRecentCommitLimit() { return history.recentCommitLimit; }
    public int getContributorLimit() { return history.contributorLimit; }
    public int getQueryTimeoutSeconds() { return history.queryTimeoutSeconds; }
    public int getMessageMaxLength() { return history.messageMaxLength; }

    public Analysis getAnalysis() { return analysis; }
    public void setAnalysis(Analysis analysis) { this.analysis = analysis; }
    public History getHistory() { return history; }
    public void setHistory(History history) { this.history = history; }

    public static class Analysis {
        private int maxManifestBytes = 50_000;
        private int keyFileMaxChars = 8_000;
        private int readmeExcerptChars = 2_000;
        private int topDirLimit = 20;
        private int topExtensionLimit = 20;
        /** Upper bound for a whole analysis; 0 disables the deadline. */
        private int deadlineSeconds = 0;

        public int getMaxManifestBytes() { return maxManifestBytes; }
        public void setMaxManifestBytes(int maxManifestBytes) { this.maxManifestBytes = maxManifestBytes; }
        public int getKeyFileMaxChars() { return keyFileMaxChars; }
        public void setKeyFileMaxChars(int keyFileMaxChars) { this.keyFileMaxChars = keyFileMaxChars; }
        public int getReadmeExcerptChars() { return readmeExcerptChars; }
        public void setReadmeExcerptChars(int readmeExcerptChars) { this.readmeExcerptChars = readmeExcerptChars; }
        public int getTopDirLimit() { return topDirLimit; }
        public void setTopDirLimit(int topDirLimit) { this.topDirLimit = topDirLimit; }
        public int getTopExtensionLimit() { return topExtensionLimit; }
        public void setTopExtensionLimit(int topExtensionLimit) { this.topExtensionLimit = topExtensionLimit; }
        public int getDeadlineSeconds() { return deadlineSeconds; }
        public void setDeadlineSeconds(int deadlineSeconds) { this.deadlineSeconds = deadlineSeconds; }
    }

    public static class History {
        private int recentCommitLimit = 30;
        private int contributorLimit = 10;
        private int queryTimeoutSeconds = 10;
        private int messageMaxLength = 120;

        public int getRecentCommitLimit() { return recentCommitLimit; }
        public void setRecentCommitLimit(int recentCommitLimit) { this.recentCommitLimit = recentCommitLimit; }
        public int getContributorLimit() { return contributorLimit; }
        public void setContributorLimit(int contributorLimit) { this.contributorLimit = contributorLimit; }
        public int getQueryTimeoutSeconds() { return queryTimeoutSeconds; }
        public void setQueryTimeoutSeconds(int queryTimeoutSeconds) { this.queryTimeoutSeconds = queryTimeoutSeconds; }
        public int getMessageMaxLength() { return messageMaxLength; }
        public void setMessageMaxLength(int messageMaxLength) { this.messageMaxLength = messageMaxLength; }
    }
}
