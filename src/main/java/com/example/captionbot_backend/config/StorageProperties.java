package com.example.captionbot_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storage.local")
public class StorageProperties {
    private String baseDir = "./data";
    private String transcriptsPrefix = "transcripts";

    public String getBaseDir() { return baseDir; }
    public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

    public String getTranscriptsPrefix() { return transcriptsPrefix; }
    public void setTranscriptsPrefix(String transcriptsPrefix) { this.transcriptsPrefix = transcriptsPrefix; }
}
