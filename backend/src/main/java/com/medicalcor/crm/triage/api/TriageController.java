package com.medicalcor.crm.triage.api;

import com.medicalcor.crm.common.api.ApiResponse;
import com.medicalcor.crm.triage.model.TriageRoutingConfig;
import com.medicalcor.crm.triage.model.TriageRoutingResult;
import com.medicalcor.crm.triage.service.TriageRoutingService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/triage")
public class TriageController {

    private final TriageRoutingService triageRoutingService;

    public TriageController(TriageRoutingService triageRoutingService) {
        this.triageRoutingService = triageRoutingService;
    }

    @PostMapping("/route")
    public ApiResponse<TriageRoutingResult> route(@Valid @RequestBody TriageRequest req) {
        return ApiResponse.ok(triageRoutingService.route(req.toInput()));
    }

    /**
     * Same derivation as {@code /route} without dispatching; agent load and queues are untouched.
     */
    @PostMapping("/preview")
    public ApiResponse<TriageRoutingResult> preview(@Valid @RequestBody TriageRequest req) {
        return ApiResponse.ok(triageRoutingService.triageOnly(req.toInput()));
    }

    @GetMapping("/config")
    public ApiResponse<TriageRoutingConfig> config() {
        return ApiResponse.ok(triageRoutingService.getConfig());
    }

    @PutMapping("/procedures/{procedure}")
    public ApiResponse<TriageRoutingConfig> updateProcedure(
            @PathVariable("procedure") String procedure,
            @Valid @RequestBody UpdateProcedureMappingRequest req
    ) {
        return ApiResponse.ok(triageRoutingService.updateProcedureMapping(procedure, req.skills()));
    }
}
