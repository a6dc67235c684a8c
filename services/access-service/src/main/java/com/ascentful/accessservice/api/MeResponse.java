package com.ascentful.accessservice.api;

import com.ascentful.access.EffectiveIdentity;

public record MeResponse(
        String subjectId, String role, String organizationId, String plan, boolean impersonating) {

    public static MeResponse from(EffectiveIdentity identity) {
        return new MeResponse(
                identity.subjectId(),
                identity.role().value(),
                identity.organizationId(),
                identity.planIfKnown().map(p -> p.value()).orElse(null),
                identity.impersonating());
    }
}
