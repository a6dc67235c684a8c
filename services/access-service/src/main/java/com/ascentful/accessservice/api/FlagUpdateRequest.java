package com.ascentful.accessservice.api;

import jakarta.validation.constraints.NotNull;

public record FlagUpdateRequest(@NotNull Boolean enabled) {
}
