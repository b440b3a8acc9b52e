package com.grokpm.backend.modules.portfolio.presentation.dto;

import com.grokpm.backend.modules.portfolio.domain.Portfolio;
import com.grokpm.backend.modules.portfolio.domain.PortfolioProperty;
import com.grokpm.backend.modules.property.presentation.dto.PropertyDtoMapper;

public final class PortfolioDtoMapper {

    private PortfolioDtoMapper() {
    }

    public static PortfolioResponse toResponse(Portfolio portfolio) {
        return new PortfolioResponse(
                portfolio.getId(),
                portfolio.getUserId(),
                portfolio.getName(),
                portfolio.getDescription(),
                portfolio.getLinks().stream().map(link -> PropertyDtoMapper.toSummary(link.getProperty())).toList(),
                portfolio.getCreatedAt(),
                portfolio.getUpdatedAt()
        );
    }

    public static PortfolioPropertyResponse toLinkResponse(PortfolioProperty link) {
        return new PortfolioPropertyResponse(
                link.getPortfolio().getId(),
                PropertyDtoMapper.toSummary(link.getProperty()),
                link.getCreatedAt()
        );
    }
}
