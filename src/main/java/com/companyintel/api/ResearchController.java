package com.companyintel.api;

import com.companyintel.research.SupervisorService;
import com.companyintel.research.model.ResearchOutcome;
import com.companyintel.research.model.ResearchRequest;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/research")
@Slf4j
public class ResearchController {

    private final SupervisorService supervisorService;
    private final CompanyNameValidator companyNameValidator;

    public ResearchController(SupervisorService supervisorService, CompanyNameValidator companyNameValidator) {
        this.supervisorService = supervisorService;
        this.companyNameValidator = companyNameValidator;
    }

    @PostMapping
    public ResearchResponse research(@Valid @RequestBody ResearchApiRequest request) {
        log.info("Research requested for '{}' (jobTitle={}, jobDescription={} chars).", request.companyName(),
                request.jobTitle(), request.jobDescription() == null ? 0 : request.jobDescription().length());
        ResearchOutcome outcome = supervisorService.run(
                new ResearchRequest(request.companyName(), request.jobTitle(), request.jobDescription()));
        return ResearchResponse.from(outcome);
    }

    @GetMapping("/validate/{companyName}")
    public CompanyValidationResponse validate(@PathVariable String companyName) {
        return companyNameValidator.validate(companyName);
    }
}
