package com.privatedocs.qa.service.ingestion;

import com.privatedocs.qa.model.DocumentFormat;
import com.privatedocs.qa.service.DocQaException;
import com.privatedocs.qa.service.ErrorKind;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class UploadValidator {

    private static final List<String> FORBIDDEN_FILENAME_PARTS = List.of("..", "/", "\\", ":", "*", "?", "\"", "<", ">", "|");

    private final UploadProperties properties;

    public UploadValidator(UploadProperties properties) {
        this.properties = properties;
    }

    /**
     * Checks the upload and resolves its format. Nothing is recorded for an upload that fails here.
     */
    public DocumentFormat validate(SubmitDocumentCommand command) {
        if (command == null || command.bytes() == null || command.bytes().length == 0) {
            throw new DocQaException(ErrorKind.VALIDATION, "Uploaded file is empty");
        }
        if (command.ownerId() == null || command.ownerId().isBlank()) {
            throw new DocQaException(ErrorKind.VALIDATION, "Uploader identity is required");
        }
        if (command.bytes().length > properties.getMaxFileSizeBytes()) {
            throw new DocQaException(ErrorKind.VALIDATION, String.format(Locale.ROOT,
                    "File exceeds the maximum size of %d bytes", properties.getMaxFileSizeBytes()));
        }
        String filename = command.filename();
        if (filename == null || filename.isBlank()) {
            throw new DocQaException(ErrorKind.VALIDATION, "Filename is required");
        }
        for (String part : FORBIDDEN_FILENAME_PARTS) {
            if (filename.contains(part)) {
                throw new DocQaException(ErrorKind.VALIDATION, "Filename contains forbidden characters");
            }
        }
        String extension = FilenameUtils.getExtension(filename).toLowerCase(Locale.ROOT);
        boolean allowed = properties.getAllowedExtensions().stream()
                .anyMatch(candidate -> candidate.trim().equalsIgnoreCase(extension));
        if (extension.isEmpty() || !allowed) {
            throw new DocQaException(ErrorKind.VALIDATION, "File type not allowed: " + (extension.isEmpty() ? "(none)" : extension));
        }
        String declared = command.declaredFormat();
        if (declared != null && !declared.isBlank()) {
            return DocumentFormat.fromValue(declared)
                    .orElseThrow(() -> new DocQaException(ErrorKind.UNSUPPORTED_FORMAT, "Unsupported document format: " + declared));
        }
        return DocumentFormat.fromValue(extension)
                .orElseThrow(() -> new DocQaException(ErrorKind.UNSUPPORTED_FORMAT, "Unsupported document format: " + extension));
    }
}
