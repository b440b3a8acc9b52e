package com.grokpm.backend.modules.property.domain;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import com.grokpm.backend.global.jpa.AbstractTimestampedEntity;
import com.grokpm.backend.modules.association.domain.Association;
import com.grokpm.backend.modules.ledger.domain.LedgerTransaction;
import com.grokpm.backend.modules.portfolio.domain.PortfolioProperty;

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

@Entity
@Table(name = "property")
public class Property extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "name", nullable = false, length = 150)
    private String name;

    @Column(name = "property_type", length = 50)
    private String type;

    @Column(name = "status", length = 30)
    private String status;

    @Column(name = "market_value", precision = 14, scale = 2)
    private BigDecimal value;

    @OneToMany(mappedBy = "property", cascade = CascadeType.ALL, fetch = FetchType.LAZY, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<PropertyAddress> addresses = new ArrayList<>();

    @OneToMany(mappedBy = "property", cascade = CascadeType.REMOVE, fetch = FetchType.LAZY)
    @OrderBy("id ASC")
    private List<Owner> owners = new ArrayList<>();

    @OneToMany(mappedBy = "property", cascade = CascadeType.ALL, fetch = FetchType.LAZY, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<Photo> photos = new ArrayList<>();

    @OneToMany(mappedBy = "property", cascade = CascadeType.REMOVE, fetch = FetchType.LAZY)
    @OrderBy("id ASC")
    private List<Association> associations = new ArrayList<>();

    @OneToMany(mappedBy = "property", cascade = CascadeType.REMOVE, fetch = FetchType.LAZY)
    private List<LedgerTransaction> transactions = new ArrayList<>();

    @OneToMany(mappedBy = "property", cascade = CascadeType.REMOVE, fetch = FetchType.LAZY)
    private List<PortfolioProperty> portfolioLinks = new ArrayList<>();

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public BigDecimal getValue() {
        return value;
    }

    public void setValue(BigDecimal value) {
        this.value = value;
    }

    public List<PropertyAddress> getAddresses() {
        return addresses;
    }

    public List<Owner> getOwners() {
        return owners;
    }

    public List<Photo> getPhotos() {
        return photos;
    }

    public List<Association> getAssociations() {
        return associations;
    }

    public List<LedgerTransaction> getTransactions() {
        return transactions;
    }

    public List<PortfolioProperty> getPortfolioLinks() {
        return portfolioLinks;
    }

    public void addAddress(PropertyAddress address) {
        address.setProperty(this);
        addresses.add(address);
    }
}
