package com.rcassist.interfaces.api.dto;

import jakarta.validation.constraints.Size;

import java.util.List;

public record AnalysisRunRequest(
        @Size(max = 20000, message = "Issue description must not exceed 20000 characters")
        String issueDescription,

        @Size(max = 20, message = "At most 20 files per analysis")
        List<String> files,

        @Size(max = 20, message = "At most 20 URLs per analysis")
        List<String> urls,

        @Size(max = 20, message = "At most 20 tickets per analysis")
        List<String> tickets,

        String templateId,

        List<String> providers,

        String preferredProvider
) {}
