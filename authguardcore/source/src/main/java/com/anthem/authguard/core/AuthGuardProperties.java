package com.anthem.authguard.core;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration shared by authguard services.
 * Bound from the {@code authguard.*} namespace.
 */
@ConfigurationProperties(prefix = "authguard")
public class AuthGuardProperties {

    private Aws aws = new Aws();
    private Documents documents = new Documents();

    public Aws getAws() {
        return aws;
    }

    public void setAws(Aws aws) {
        this.aws = aws;
    }

    public Documents getDocuments() {
        return documents;
    }

    public void setDocuments(Documents documents) {
        this.documents = documents;
    }

    public static class Aws {
        private String region = "us-east-1";
        private String endpoint;

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }
    }

    /**
     * Where and how API definition documents are read.
     */
    public static class Documents {
        /** Directory that relative DefinitionUri paths resolve against. */
        private String baseDirectory = ".";
        private long maxDocumentBytes = 10L * 1024 * 1024;

        public String getBaseDirectory() {
            return baseDirectory;
        }

        public void setBaseDirectory(String baseDirectory) {
            this.baseDirectory = baseDirectory;
        }

        public long getMaxDocumentBytes() {
            return maxDocumentBytes;
        }

        public void setMaxDocumentBytes(long maxDocumentBytes) {
            this.maxDocumentBytes = maxDocumentBytes;
        }
    }
}
