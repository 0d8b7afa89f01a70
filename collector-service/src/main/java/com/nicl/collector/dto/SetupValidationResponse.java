package com.nicl.collector.dto;

import java.time.LocalDateTime;

public record SetupValidationResponse(boolean valid, LocalDateTime checkedAt) {}
