package com.medicalcor.crm.routing.model;

import java.util.List;

/**
 * A routing request. Only {@code priority} has a non-null default; every list is normalized to an immutable copy.
 */
public record RoutingContext(
        String taskId,
        Channel channel,
        UrgencyLevel urgencyLevel,
        String procedureType,
        List<SkillRequirement> requiredSkills,
        List<SkillRequirement> preferredSkills,
        List<String> preferAgentIds,
        List<String> excludeAgentIds,
        String teamId,
        String requiredLanguage,
        List<String> preferredLanguages,
        Integer slaDeadlineMinutes,
        boolean existingRelationship,
        boolean vip,
        LeadScore leadScore,
        Integer priority
) {
    public static final int DEFAULT_PRIORITY = 50;

    public RoutingContext {
        requiredSkills = requiredSkills == null ? List.of() : List.copyOf(requiredSkills);
        preferredSkills = preferredSkills == null ? List.of() : List.copyOf(preferredSkills);
        preferAgentIds = preferAgentIds == null ? List.of() : List.copyOf(preferAgentIds);
        excludeAgentIds = excludeAgentIds == null ? List.of() : List.copyOf(excludeAgentIds);
        preferredLanguages = preferredLanguages == null ? List.of() : List.copyOf(preferredLanguages);
        if (teamId != null && teamId.isBlank()) teamId = null;
        priority = priority == null ? DEFAULT_PRIORITY : Math.max(0, Math.min(priority, 100));
    }

    public RoutingContext withTaskId(String value) {
        return toBuilder().taskId(value).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .taskId(taskId)
                .channel(channel)
                .urgencyLevel(urgencyLevel)
                .procedureType(procedureType)
                .requiredSkills(requiredSkills)
                .preferredSkills(preferredSkills)
                .preferAgentIds(preferAgentIds)
                .excludeAgentIds(excludeAgentIds)
                .teamId(teamId)
                .requiredLanguage(requiredLanguage)
                .preferredLanguages(preferredLanguages)
                .slaDeadlineMinutes(slaDeadlineMinutes)
                .existingRelationship(existingRelationship)
                .vip(vip)
                .leadScore(leadScore)
                .priority(priority);
    }

    public static final class Builder {
        private String taskId;
        private Channel channel;
        private UrgencyLevel urgencyLevel;
        private String procedureType;
        private List<SkillRequirement> requiredSkills;
        private List<SkillRequirement> preferredSkills;
        private List<String> preferAgentIds;
        private List<String> excludeAgentIds;
        private String teamId;
        private String requiredLanguage;
        private List<String> preferredLanguages;
        private Integer slaDeadlineMinutes;
        private boolean existingRelationship;
        private boolean vip;
        private LeadScore leadScore;
        private Integer priority;

        private Builder() {
        }

        public Builder taskId(String value) {
            this.taskId = value;
            return this;
        }

        public Builder channel(Channel value) {
            this.channel = value;
            return this;
        }

        public Builder urgencyLevel(UrgencyLevel value) {
            this.urgencyLevel = value;
            return this;
        }

        public Builder procedureType(String value) {
            this.procedureType = value;
            return this;
        }

        public Builder requiredSkills(List<SkillRequirement> value) {
            this.requiredSkills = value;
            return this;
        }

        public Builder preferredSkills(List<SkillRequirement> value) {
            this.preferredSkills = value;
            return this;
        }

        public Builder preferAgentIds(List<String> value) {
            this.preferAgentIds = value;
            return this;
        }

        public Builder excludeAgentIds(List<String> value) {
            this.excludeAgentIds = value;
            return this;
        }

        public Builder teamId(String value) {
            this.teamId = value;
            return this;
        }

        public Builder requiredLanguage(String value) {
            this.requiredLanguage = value;
            return this;
        }

        public Builder preferredLanguages(List<String> value) {
            this.preferredLanguages = value;
            return this;
        }

        public Builder slaDeadlineMinutes(Integer value) {
            this.slaDeadlineMinutes = value;
            return this;
        }

        public Builder existingRelationship(boolean value) {
            this.existingRelationship = value;
            return this;
        }

        public Builder vip(boolean value) {
            this.vip = value;
            return this;
        }

        public Builder leadScore(LeadScore value) {
            this.leadScore = value;
            return this;
        }

        public Builder priority(Integer value) {
            this.priority = value;
            return this;
        }

        public RoutingContext build() {
            return new RoutingContext(
                    taskId,
                    channel,
                    urgencyLevel,
                    procedureType,
                    requiredSkills,
                    preferredSkills,
                    preferAgentIds,
                    excludeAgentIds,
                    teamId,
                    requiredLanguage,
                    preferredLanguages,
                    slaDeadlineMinutes,
                    existingRelationship,
                    vip,
                    leadScore,
                    priority
            );
        }
    }
}
