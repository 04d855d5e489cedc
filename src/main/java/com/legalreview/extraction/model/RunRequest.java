package com.legalreview.extraction.model;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class RunRequest {

    private JobMode mode = JobMode.QUICK;
    private boolean wait;       // block until the job is terminal

    // Spring resource location; review.template-path when absent
    private String templatePath;
}
