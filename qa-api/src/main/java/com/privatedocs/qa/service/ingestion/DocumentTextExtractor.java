package com.privatedocs.qa.service.ingestion;

import com.privatedocs.qa.model.DocumentFormat;

import java.io.InputStream;

public interface DocumentTextExtractor {

    String extract(String filename, DocumentFormat format, InputStream inputStream);
}
