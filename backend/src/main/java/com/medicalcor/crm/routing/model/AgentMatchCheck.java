package com.medicalcor.crm.routing.model;

import java.util.List;

public record AgentMatchCheck(boolean matches, List<String> missingSkills) {
}
