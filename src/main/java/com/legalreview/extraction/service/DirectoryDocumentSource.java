package com.legalreview.extraction.service;

import com.legalreview.extraction.config.ReviewProperties;
import com.legalreview.extraction.model.DocumentFormat;
import com.legalreview.extraction.model.SourceDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Lists PDF and HTML files from the configured directories. Ingestion order is the
 * directory order from configuration, then file name.
 */
@Component
@Slf4j
public class DirectoryDocumentSource implements DocumentSource {

    private static final int ID_LENGTH = 16;

    private final List<Path> directories;

    public DirectoryDocumentSource(ReviewProperties properties) {
        this.directories = properties.getDocumentDirs().stream().map(Paths::get).toList();
    }

    @Override
    public List<SourceDocument> listDocuments() {
        List<SourceDocument> documents = new ArrayList<>();
        for (Path directory : directories) {
            if (!Files.isDirectory(directory)) {
                log.debug("Document directory {} does not exist, skipping", directory);
                continue;
            }
            try (Stream<Path> files = Files.list(directory)) {
                files.filter(Files::isRegularFile)
                        .sorted()
                        .forEach(file -> read(file).ifPresent(documents::add));
            } catch (IOException e) {
                log.warn("Could not list document directory {}: {}", directory, e.getMessage());
            }
        }
        log.info("Found {} documents in {}", documents.size(), directories);
        return documents;
    }

    private Optional<SourceDocument> read(Path file) {
        Optional<DocumentFormat> format = DocumentFormat.fromFileName(file.getFileName().toString());
        if (format.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(SourceDocument.builder()
                    .id(documentId(file))
                    .identifier(file.getFileName().toString())
                    .rawBytes(Files.readAllBytes(file))
                    .format(format.get())
                    .build());
        } catch (IOException e) {
            log.warn("Skipping unreadable document {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Stable id derived from the absolute path, so re-scans yield the same ids.
     */
    static String documentId(Path file) {
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            byte[] digest = sha1.digest(file.toAbsolutePath().normalize().toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, ID_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
