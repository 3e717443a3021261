package com.privatedocs.qa.service.ingestion;

import com.privatedocs.qa.model.SubmitDocumentResponse;

public interface IngestionService {

    SubmitDocumentResponse submitDocument(SubmitDocumentCommand command);
}
