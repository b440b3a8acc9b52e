package com.grokpm.backend.modules.leasing.presentation.dto;

import java.math.BigDecimal;

public record UnitSummary(Long id, String unitNumber, BigDecimal rentAmount, String status) {
}
