package com.mailflow.mailflow_backend.model.params;

import java.util.List;

public record RunSkillParams(String skillId) implements NodeParameters {

    @Override
    public List<String> validate() {
        return NodeParameters.isBlank(skillId) ? List.of("skillId is required") : List.of();
    }
}
