package com.medicalcor.crm.routing.api;

import com.medicalcor.crm.common.api.ApiResponse;
import com.medicalcor.crm.routing.model.RoutingContext;
import com.medicalcor.crm.routing.model.RoutingDecision;
import com.medicalcor.crm.routing.service.DispatchService;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/routing")
public class DispatchController {

    private final DispatchService dispatchService;

    public DispatchController(DispatchService dispatchService) {
        this.dispatchService = dispatchService;
    }

    @PostMapping("/route")
    public ApiResponse<RoutingDecision> route(@RequestBody RoutingContext context) {
        return ApiResponse.ok(dispatchService.route(context));
    }
}
