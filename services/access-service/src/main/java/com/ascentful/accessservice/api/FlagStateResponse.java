package com.ascentful.accessservice.api;

import com.ascentful.access.flags.FlagState;

/**
 * Resolved state of a flag, for the platform ({@code tenantId} null) or one tenant.
 */
public record FlagStateResponse(String flag, String tenantId, FlagState state) {
}
