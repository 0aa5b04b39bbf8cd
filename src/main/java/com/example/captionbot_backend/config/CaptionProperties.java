package com.example.captionbot_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "captions")
public class CaptionProperties {

    /** Preferred caption languages, most wanted first. */
    private List<String> languages = new ArrayList<>(List.of("en", "en-GB", "en-US"));
    private String apiBaseUrl = "https://www.youtube.com";
    private String innertubeClientName = "WEB";
    private String innertubeClientVersion = "2.20240726.00.00";
    private Duration apiTimeout = Duration.ofSeconds(10);
    private Duration toolTimeout = Duration.ofMinutes(2);
    private Duration downloadTimeout = Duration.ofSeconds(15);

    public List<String> getLanguages() { return languages; }
    public void setLanguages(List<String> languages) { this.languages = languages; }

    public String getApiBaseUrl() { return apiBaseUrl; }
    public void setApiBaseUrl(String apiBaseUrl) { this.apiBaseUrl = apiBaseUrl; }

    public String getInnertubeClientName() { return innertubeClientName; }
    public void setInnertubeClientName(String innertubeClientName) { this.innertubeClientName = innertubeClientName; }

    public String getInnertubeClientVersion() { return innertubeClientVersion; }
    public void setInnertubeClientVersion(String innertubeClientVersion) { this.innertubeClientVersion = innertubeClientVersion; }

    public Duration getApiTimeout() { return apiTimeout; }
    public void setApiTimeout(Duration apiTimeout) { this.apiTimeout = apiTimeout; }

    public Duration getToolTimeout() { return toolTimeout; }
    public void setToolTimeout(Duration toolTimeout) { this.toolTimeout = toolTimeout; }

    public Duration getDownloadTimeout() { return downloadTimeout; }
    public void setDownloadTimeout(Duration downloadTimeout) { this.downloadTimeout = downloadTimeout; }
}
