package com.grokpm.backend.modules.portfolio.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.grokpm.backend.global.jpa.AbstractTimestampedEntity;
import com.grokpm.backend.modules.property.domain.Property;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;

/**
 * A user's named grouping of properties.
 */
@Entity
@Table(name = "portfolio")
public class Portfolio extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Column(name = "name", nullable = false, length = 150)
    private String name;

    @Column(name = "description", length = 500)
    private String description;

    @OneToMany(mappedBy = "portfolio", cascade = CascadeType.ALL, fetch = FetchType.LAZY, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<PortfolioProperty> links = new ArrayList<>();

    public Long getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<PortfolioProperty> getLinks() {
        return links;
    }

    public Optional<PortfolioProperty> findLink(Long propertyId) {
        return links.stream()
                .filter(link -> link.getProperty().getId().equals(propertyId))
                .findFirst();
    }

    public PortfolioProperty addProperty(Property property) {
        PortfolioProperty link = new PortfolioProperty();
        link.setPortfolio(this);
        link.setProperty(property);
        links.add(link);
        return link;
    }
}
