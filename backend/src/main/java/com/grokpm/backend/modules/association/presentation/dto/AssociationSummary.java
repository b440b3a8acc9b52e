package com.grokpm.backend.modules.association.presentation.dto;

import java.math.BigDecimal;

public record AssociationSummary(Long id, String name, BigDecimal fee) {
}
