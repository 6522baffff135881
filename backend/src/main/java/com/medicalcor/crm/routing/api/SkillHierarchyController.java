package com.medicalcor.crm.routing.api;

import com.medicalcor.crm.common.api.ApiResponse;
import com.medicalcor.crm.routing.repo.SkillHierarchy;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/routing/skills")
public class SkillHierarchyController {

    private static final Logger log = LoggerFactory.getLogger(SkillHierarchyController.class);

    private final SkillHierarchy skillHierarchy;

    public SkillHierarchyController(SkillHierarchy skillHierarchy) {
        this.skillHierarchy = skillHierarchy;
    }

    @GetMapping("/hierarchy")
    public ApiResponse<Map<String, List<String>>> hierarchy() {
        return ApiResponse.ok(skillHierarchy.snapshot());
    }

    /**
     * Replaces the parents of a skill. An empty list removes the entry.
     */
    @PutMapping("/{skillId}/parents")
    public ApiResponse<Map<String, List<String>>> setParents(
            @PathVariable("skillId") String skillId,
            @Valid @RequestBody SetSkillParentsRequest req
    ) {
        skillHierarchy.register(skillId, req.parent_skill_ids());
        log.info("skill_hierarchy_updated skillId={} parents={}", skillId, skillHierarchy.parentsOf(skillId.trim()));
        return ApiResponse.ok(skillHierarchy.snapshot());
    }

    @DeleteMapping("/hierarchy")
    public ApiResponse<Void> clear() {
        skillHierarchy.clear();
        log.info("skill_hierarchy_cleared");
        return ApiResponse.ok(null);
    }
}
