package com.grokpm.backend.modules.portfolio.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.grokpm.backend.modules.portfolio.domain.Portfolio;

public interface PortfolioRepository extends JpaRepository<Portfolio, Long> {

    List<Portfolio> findAllByOrderByIdAsc();

    List<Portfolio> findByUserIdOrderByIdAsc(String userId);
}
