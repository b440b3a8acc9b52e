package com.grokpm.backend.modules.portfolio.presentation;

import java.net.URI;
import java.util.List;

import com.grokpm.backend.modules.portfolio.application.PortfolioService;
import com.grokpm.backend.modules.portfolio.presentation.dto.AddPortfolioPropertyRequest;
import com.grokpm.backend.modules.portfolio.presentation.dto.CreatePortfolioRequest;
import com.grokpm.backend.modules.portfolio.presentation.dto.PortfolioPropertyResponse;
import com.grokpm.backend.modules.portfolio.presentation.dto.PortfolioResponse;
import com.grokpm.backend.modules.portfolio.presentation.dto.UpdatePortfolioRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/portfolios")
public class PortfolioController {

    private final PortfolioService portfolioService;

    public PortfolioController(PortfolioService portfolioService) {
        this.portfolioService = portfolioService;
    }

    @GetMapping
    public ResponseEntity<List<PortfolioResponse>> getPortfolios(
            @RequestParam(name = "userId", required = false) String userId
    ) {
        return ResponseEntity.ok(portfolioService.getPortfolios(userId));
    }

    @GetMapping("/{portfolioId}")
    public ResponseEntity<PortfolioResponse> getPortfolio(@PathVariable("portfolioId") Long portfolioId) {
        return ResponseEntity.ok(portfolioService.getPortfolio(portfolioId));
    }

    @PostMapping
    public ResponseEntity<PortfolioResponse> createPortfolio(@Valid @RequestBody CreatePortfolioRequest request) {
        PortfolioResponse response = portfolioService.createPortfolio(request);
        return ResponseEntity.created(URI.create("/api/portfolios/" + response.id())).body(response);
    }

    @PutMapping("/{portfolioId}")
    public ResponseEntity<PortfolioResponse> updatePortfolio(
            @PathVariable("portfolioId") Long portfolioId,
            @Valid @RequestBody UpdatePortfolioRequest request
    ) {
        return ResponseEntity.ok(portfolioService.updatePortfolio(portfolioId, request));
    }

    @DeleteMapping("/{portfolioId}")
    public ResponseEntity<Void> deletePortfolio(@PathVariable("portfolioId") Long portfolioId) {
        portfolioService.deletePortfolio(portfolioId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{portfolioId}/properties")
    public ResponseEntity<List<PortfolioPropertyResponse>> getPortfolioProperties(
            @PathVariable("portfolioId") Long portfolioId
    ) {
        return ResponseEntity.ok(portfolioService.getPortfolioProperties(portfolioId));
    }

    @Operation(summary = "Add a property to a portfolio")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Property added"),
            @ApiResponse(responseCode = "409", description = "Already a member (PROPERTY_ALREADY_IN_PORTFOLIO)")
    })
    @PostMapping("/{portfolioId}/properties")
    public ResponseEntity<PortfolioPropertyResponse> addProperty(
            @PathVariable("portfolioId") Long portfolioId,
            @Valid @RequestBody AddPortfolioPropertyRequest request
    ) {
        PortfolioPropertyResponse response = portfolioService.addProperty(portfolioId, request.propertyId());
        return ResponseEntity
                .created(URI.create("/api/portfolios/" + portfolioId + "/properties/" + request.propertyId()))
                .body(response);
    }

    @DeleteMapping("/{portfolioId}/properties/{propertyId}")
    public ResponseEntity<Void> removeProperty(
            @PathVariable("portfolioId") Long portfolioId,
            @PathVariable("propertyId") Long propertyId
    ) {
        portfolioService.removeProperty(portfolioId, propertyId);
        return ResponseEntity.noContent().build();
    }
}
