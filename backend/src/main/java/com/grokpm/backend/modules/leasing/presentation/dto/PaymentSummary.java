package com.grokpm.backend.modules.leasing.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record PaymentSummary(Long id, BigDecimal amount, LocalDate date, String status) {
}
