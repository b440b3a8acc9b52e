package com.grokpm.backend.modules.leasing.application;

import java.time.LocalDate;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.grokpm.backend.global.error.ProblemException;
import com.grokpm.backend.modules.leasing.domain.Tenant;
import com.grokpm.backend.modules.leasing.domain.Unit;
import com.grokpm.backend.modules.leasing.infrastructure.persistence.TenantRepository;
import com.grokpm.backend.modules.leasing.infrastructure.persistence.UnitRepository;
import com.grokpm.backend.modules.leasing.presentation.dto.CreateTenantRequest;
import com.grokpm.backend.modules.leasing.presentation.dto.LeasingDtoMapper;
import com.grokpm.backend.modules.leasing.presentation.dto.TenantResponse;
import com.grokpm.backend.modules.leasing.presentation.dto.UpdateTenantRequest;

@Service
@Transactional
public class TenantService {

    private final TenantRepository tenantRepository;
    private final UnitRepository unitRepository;

    public TenantService(TenantRepository tenantRepository, UnitRepository unitRepository) {
        this.tenantRepository = tenantRepository;
        this.unitRepository = unitRepository;
    }

    @Transactional(readOnly = true)
    public List<TenantResponse> getTenants(Long unitId) {
        List<Tenant> tenants = unitId != null
                ? tenantRepository.findByUnitIdOrderByIdAsc(unitId)
                : tenantRepository.findAllByOrderByIdAsc();
        return tenants.stream().map(LeasingDtoMapper::toTenantResponse).toList();
    }

    @Transactional(readOnly = true)
    public TenantResponse getTenant(Long tenantId) {
        return LeasingDtoMapper.toTenantResponse(loadTenant(tenantId));
    }

    public TenantResponse createTenant(CreateTenantRequest request) {
        validateLease(request.leaseStartDate(), request.leaseEndDate());
        Tenant tenant = new Tenant();
        tenant.setUnit(resolveUnit(request.unitId()));
        tenant.setName(request.name().trim());
        tenant.setEmail(request.email());
        tenant.setPhone(request.phone());
        tenant.setLeaseStartDate(request.leaseStartDate());
        tenant.setLeaseEndDate(request.leaseEndDate());
        tenant.setRent(request.rent());
        return LeasingDtoMapper.toTenantResponse(tenantRepository.saveAndFlush(tenant));
    }

    public TenantResponse updateTenant(Long tenantId, UpdateTenantRequest request) {
        Tenant tenant = loadTenant(tenantId);
        if (request.unitId() != null) {
            tenant.setUnit(resolveUnit(request.unitId()));
        }
        if (request.name() != null) {
            tenant.setName(request.name().trim());
        }
        if (request.email() != null) {
            tenant.setEmail(request.email());
        }
        if (request.phone() != null) {
            tenant.setPhone(request.phone());
        }
        if (request.leaseStartDate() != null) {
            tenant.setLeaseStartDate(request.leaseStartDate());
        }
        if (request.leaseEndDate() != null) {
            tenant.setLeaseEndDate(request.leaseEndDate());
        }
        if (request.rent() != null) {
            tenant.setRent(request.rent());
        }
        validateLease(tenant.getLeaseStartDate(), tenant.getLeaseEndDate());
        return LeasingDtoMapper.toTenantResponse(tenantRepository.saveAndFlush(tenant));
    }

    public void deleteTenant(Long tenantId) {
        Tenant tenant = loadTenant(tenantId);
        tenant.getUnit().getTenants().remove(tenant);
        tenantRepository.delete(tenant);
    }

    private void validateLease(LocalDate start, LocalDate end) {
        if (start != null && end != null && end.isBefore(start)) {
            throw ProblemException.badRequest("INVALID_LEASE_PERIOD", "leaseEndDate must not be before leaseStartDate");
        }
    }

    private Tenant loadTenant(Long tenantId) {
        return tenantRepository.findById(tenantId)
                .orElseThrow(() -> ProblemException.notFound("Tenant", tenantId));
    }

    private Unit resolveUnit(Long unitId) {
        return unitRepository.findById(unitId)
                .orElseThrow(() -> ProblemException.invalidReference("unitId", unitId));
    }
}
