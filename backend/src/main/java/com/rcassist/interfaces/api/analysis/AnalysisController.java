package com.rcassist.interfaces.api.analysis;

import com.rcassist.application.analysis.AnalysisAppService;
import com.rcassist.domain.analysis.model.ErrorKind;
import com.rcassist.domain.analysis.model.OutcomeResult;
import com.rcassist.domain.analysis.model.ProviderName;
import com.rcassist.infrastructure.config.RcaProperties;
import com.rcassist.interfaces.api.dto.AnalysisOutcomeResponse;
import com.rcassist.interfaces.api.dto.AnalysisRunRequest;
import com.rcassist.interfaces.api.dto.CapabilitiesResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/analyses")
@RequiredArgsConstructor
public class AnalysisController {

    static final String REQUEST_ID_HEADER = "X-Request-Id";

    private final AnalysisAppService analysisAppService;
    private final RcaProperties properties;

    @PostMapping
    public ResponseEntity<AnalysisOutcomeResponse> analyze(
            @Valid @RequestBody AnalysisRunRequest request,
            @RequestHeader(value = REQUEST_ID_HEADER, required = false) String requestId) {
        OutcomeResult outcome = analysisAppService.analyze(
                request.issueDescription(),
                request.files(),
                request.urls(),
                request.tickets(),
                request.templateId(),
                request.providers(),
                request.preferredProvider(),
                requestId);

        return ResponseEntity.status(statusOf(outcome)).body(AnalysisOutcomeResponse.from(outcome));
    }

    @DeleteMapping("/{requestId}")
    public ResponseEntity<Void> cancel(@PathVariable String requestId) {
        return analysisAppService.cancel(requestId)
                ? ResponseEntity.accepted().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/templates")
    public ResponseEntity<CapabilitiesResponse> templates() {
        return ResponseEntity.ok(new CapabilitiesResponse(
                analysisAppService.availableTemplates(), properties.prompt().defaultTemplate()));
    }

    @GetMapping("/providers")
    public ResponseEntity<CapabilitiesResponse> providers() {
        List<String> providers = analysisAppService.availableProviders();
        String first = properties.llm().defaultProviderOrder().stream()
                .map(ProviderName::value)
                .filter(providers::contains)
                .findFirst()
                .orElse(null);
        return ResponseEntity.ok(new CapabilitiesResponse(providers, first));
    }

    static HttpStatus statusOf(OutcomeResult outcome) {
        if (!(outcome instanceof OutcomeResult.Failure failure)) {
            return HttpStatus.OK;
        }
        ErrorKind kind = failure.kind();
        if (kind == ErrorKind.INSUFFICIENT_INPUT) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (kind.isProviderError()) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
