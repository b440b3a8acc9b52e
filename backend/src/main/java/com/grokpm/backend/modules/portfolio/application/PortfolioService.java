package com.grokpm.backend.modules.portfolio.application;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.grokpm.backend.global.error.ProblemException;
import com.grokpm.backend.modules.portfolio.domain.Portfolio;
import com.grokpm.backend.modules.portfolio.domain.PortfolioProperty;
import com.grokpm.backend.modules.portfolio.infrastructure.persistence.PortfolioRepository;
import com.grokpm.backend.modules.portfolio.presentation.dto.CreatePortfolioRequest;
import com.grokpm.backend.modules.portfolio.presentation.dto.PortfolioDtoMapper;
import com.grokpm.backend.modules.portfolio.presentation.dto.PortfolioPropertyResponse;
import com.grokpm.backend.modules.portfolio.presentation.dto.PortfolioResponse;
import com.grokpm.backend.modules.portfolio.presentation.dto.UpdatePortfolioRequest;
import com.grokpm.backend.modules.property.domain.Property;
import com.grokpm.backend.modules.property.infrastructure.persistence.PropertyRepository;

/**
 * User-defined groupings of properties. Deleting a portfolio removes its membership rows only.
 */
@Service
@Transactional
public class PortfolioService {

    private static final Logger log = LoggerFactory.getLogger(PortfolioService.class);

    private final PortfolioRepository portfolioRepository;
    private final PropertyRepository propertyRepository;

    public PortfolioService(PortfolioRepository portfolioRepository, PropertyRepository propertyRepository) {
        this.portfolioRepository = portfolioRepository;
        this.propertyRepository = propertyRepository;
    }

    @Transactional(readOnly = true)
    public List<PortfolioResponse> getPortfolios(String userId) {
        List<Portfolio> portfolios = StringUtils.hasText(userId)
                ? portfolioRepository.findByUserIdOrderByIdAsc(userId.trim())
                : portfolioRepository.findAllByOrderByIdAsc();
        return portfolios.stream().map(PortfolioDtoMapper::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public PortfolioResponse getPortfolio(Long portfolioId) {
        return PortfolioDtoMapper.toResponse(loadPortfolio(portfolioId));
    }

    public PortfolioResponse createPortfolio(CreatePortfolioRequest request) {
        Portfolio portfolio = new Portfolio();
        portfolio.setUserId(request.userId().trim());
        portfolio.setName(request.name().trim());
        portfolio.setDescription(request.description());
        if (request.propertyIds() != null) {
            for (Long propertyId : request.propertyIds()) {
                attach(portfolio, propertyId, "propertyIds");
            }
        }
        return PortfolioDtoMapper.toResponse(portfolioRepository.saveAndFlush(portfolio));
    }

    public PortfolioResponse updatePortfolio(Long portfolioId, UpdatePortfolioRequest request) {
        Portfolio portfolio = loadPortfolio(portfolioId);
        if (request.name() != null) {
            portfolio.setName(request.name().trim());
        }
        if (request.description() != null) {
            portfolio.setDescription(request.description());
        }
        return PortfolioDtoMapper.toResponse(portfolioRepository.saveAndFlush(portfolio));
    }

    public void deletePortfolio(Long portfolioId) {
        portfolioRepository.delete(loadPortfolio(portfolioId));
    }

    @Transactional(readOnly = true)
    public List<PortfolioPropertyResponse> getPortfolioProperties(Long portfolioId) {
        return loadPortfolio(portfolioId).getLinks().stream()
                .map(PortfolioDtoMapper::toLinkResponse)
                .toList();
    }

    public PortfolioPropertyResponse addProperty(Long portfolioId, Long propertyId) {
        Portfolio portfolio = loadPortfolio(portfolioId);
        PortfolioProperty link = attach(portfolio, propertyId, "propertyId");
        portfolioRepository.flush();
        log.info("Added property {} to portfolio {}", propertyId, portfolioId);
        return PortfolioDtoMapper.toLinkResponse(link);
    }

    public void removeProperty(Long portfolioId, Long propertyId) {
        Portfolio portfolio = loadPortfolio(portfolioId);
        PortfolioProperty link = portfolio.findLink(propertyId)
                .orElseThrow(() -> new ProblemException(
                        HttpStatus.NOT_FOUND,
                        "PROPERTY_NOT_IN_PORTFOLIO",
                        "Property " + propertyId + " is not in portfolio " + portfolioId
                ));
        portfolio.getLinks().remove(link);
        link.getProperty().getPortfolioLinks().remove(link);
    }

    private PortfolioProperty attach(Portfolio portfolio, Long propertyId, String field) {
        if (portfolio.findLink(propertyId).isPresent()) {
            throw ProblemException.conflict(
                    "PROPERTY_ALREADY_IN_PORTFOLIO",
                    "Property " + propertyId + " is already in this portfolio"
            );
        }
        Property property = propertyRepository.findById(propertyId)
                .orElseThrow(() -> ProblemException.invalidReference(field, propertyId));
        return portfolio.addProperty(property);
    }

    private Portfolio loadPortfolio(Long portfolioId) {
        return portfolioRepository.findById(portfolioId)
                .orElseThrow(() -> ProblemException.notFound("Portfolio", portfolioId));
    }
}
