package com.grantlens.search.opensearch;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "opensearch")
public class OpenSearchProperties {
    private String baseUrl;
    private String grantIndex = "grants";
    private String contactIndex = "grant_contacts";
    private int connectTimeoutMs = 500;
    private int readTimeoutMs = 5000;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getGrantIndex() {
        return grantIndex;
    }

    public void setGrantIndex(String grantIndex) {
        this.grantIndex = grantIndex;
    }

    public String getContactIndex() {
        return contactIndex;
    }

    public void setContactIndex(String contactIndex) {
        this.contactIndex = contactIndex;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }
}
