package com.legalreview.extraction.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "review")
public class ReviewProperties {

    /** Spring resource location of the extraction template. */
    private String templatePath = "classpath:templates/legal_review_template.json";

    /** Directories scanned for documents, in ingestion order. */
    private List<String> documentDirs = new ArrayList<>();

    /** Where uploaded documents are written; should also be listed in documentDirs. */
    private String uploadDir = "./artifacts/uploads";

    /** Characters of context kept on each side of a cited match. */
    private int snippetRadius = 80;

    /** jpa or memory */
    private String store = "jpa";

    private Quick quick = new Quick();

    private Executor executor = new Executor();

    @Data
    public static class Quick {
        private int maxDocuments = 1;
        private int maxFields = 5;
        private int maxPages = 3;
    }

    @Data
    public static class Executor {
        private int jobPoolSize = 2;
        private int documentPoolSize = 4;
        private int awaitTerminationSeconds = 30;
    }
}
