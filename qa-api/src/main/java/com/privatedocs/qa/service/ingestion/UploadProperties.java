package com.privatedocs.qa.service.ingestion;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "docqa.upload")
public class UploadProperties {

    private long maxFileSizeBytes = 10L * 1024 * 1024;

    private List<String> allowedExtensions = new ArrayList<>(List.of("pdf", "docx", "txt", "md"));

    public long getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    public void setMaxFileSizeBytes(long maxFileSizeBytes) {
        this.maxFileSizeBytes = maxFileSizeBytes;
    }

    public List<String> getAllowedExtensions() {
        return allowedExtensions;
    }

    public void setAllowedExtensions(List<String> allowedExtensions) {
        this.allowedExtensions = allowedExtensions;
    }
}
