package com.legalreview.extraction.service;

import com.legalreview.extraction.config.ReviewProperties;
import com.legalreview.extraction.exception.DocumentUploadException;
import com.legalreview.extraction.model.DocumentFormat;
import com.legalreview.extraction.model.DocumentSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes uploaded PDF and HTML files into the upload directory, where the next
 * scan of {@link DirectoryDocumentSource} picks them up. A file with the same name
 * is replaced.
 */
@Service
@Slf4j
public class DocumentUploadService {

    private static final String DEFAULT_NAME = "uploaded_document";

    private final Path uploadDir;

    public DocumentUploadService(ReviewProperties properties) {
        this.uploadDir = Paths.get(properties.getUploadDir());
    }

    public DocumentSummary store(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new DocumentUploadException("uploaded file is empty");
        }
        String fileName = safeName(file.getOriginalFilename());
        DocumentFormat format = DocumentFormat.fromFileName(fileName)
                .orElseThrow(() -> new DocumentUploadException(
                        "unsupported file type: " + fileName + " (expected .pdf, .html or .htm)"));

        Path target = uploadDir.resolve(fileName);
        try {
            Files.createDirectories(uploadDir);
            Files.write(target, file.getBytes());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not store upload " + fileName, e);
        }

        log.info("Stored upload {} ({} bytes) in {}", fileName, file.getSize(), uploadDir);
        return DocumentSummary.builder()
                .id(DirectoryDocumentSource.documentId(target))
                .identifier(fileName)
                .format(format)
                .build();
    }

    // Browsers may send a full client path; only the last element is kept
    private static String safeName(String originalName) {
        if (originalName == null || originalName.isBlank()) {
            return DEFAULT_NAME;
        }
        String normalized = originalName.replace('\\', '/');
        String name = normalized.substring(normalized.lastIndexOf('/') + 1).trim();
        return name.isEmpty() || name.equals("..") || name.equals(".") ? DEFAULT_NAME : name;
    }
}
