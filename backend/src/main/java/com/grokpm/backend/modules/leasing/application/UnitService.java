package com.grokpm.backend.modules.leasing.application;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.grokpm.backend.global.error.ProblemException;
import com.grokpm.backend.modules.leasing.domain.Unit;
import com.grokpm.backend.modules.leasing.infrastructure.persistence.UnitRepository;
import com.grokpm.backend.modules.leasing.presentation.dto.CreateUnitRequest;
import com.grokpm.backend.modules.leasing.presentation.dto.LeasingDtoMapper;
import com.grokpm.backend.modules.leasing.presentation.dto.UnitResponse;
import com.grokpm.backend.modules.leasing.presentation.dto.UpdateUnitRequest;
import com.grokpm.backend.modules.property.domain.PropertyAddress;
import com.grokpm.backend.modules.property.infrastructure.persistence.PropertyAddressRepository;

@Service
@Transactional
public class UnitService {

    private static final Logger log = LoggerFactory.getLogger(UnitService.class);

    private final UnitRepository unitRepository;
    private final PropertyAddressRepository propertyAddressRepository;

    public UnitService(UnitRepository unitRepository, PropertyAddressRepository propertyAddressRepository) {
        this.unitRepository = unitRepository;
        this.propertyAddressRepository = propertyAddressRepository;
    }

    @Transactional(readOnly = true)
    public List<UnitResponse> getUnits(Long propertyId, Long addressId, String status) {
        String normalizedStatus = StringUtils.hasText(status) ? status.trim() : null;
        return unitRepository.search(propertyId, addressId, normalizedStatus).stream()
                .map(LeasingDtoMapper::toUnitResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public UnitResponse getUnit(Long unitId) {
        return LeasingDtoMapper.toUnitResponse(loadUnit(unitId));
    }

    public UnitResponse createUnit(CreateUnitRequest request) {
        Unit unit = new Unit();
        unit.setAddress(resolveAddress(request.addressId()));
        unit.setUnitNumber(request.unitNumber().trim());
        unit.setRentAmount(request.rentAmount());
        unit.setStatus(request.status());
        return LeasingDtoMapper.toUnitResponse(unitRepository.saveAndFlush(unit));
    }

    public UnitResponse updateUnit(Long unitId, UpdateUnitRequest request) {
        Unit unit = loadUnit(unitId);
        if (request.addressId() != null) {
            unit.setAddress(resolveAddress(request.addressId()));
        }
        if (request.unitNumber() != null) {
            unit.setUnitNumber(request.unitNumber().trim());
        }
        if (request.rentAmount() != null) {
            unit.setRentAmount(request.rentAmount());
        }
        if (request.status() != null) {
            unit.setStatus(request.status());
        }
        return LeasingDtoMapper.toUnitResponse(unitRepository.saveAndFlush(unit));
    }

    public void deleteUnit(Long unitId) {
        Unit unit = loadUnit(unitId);
        unit.getAddress().getUnits().remove(unit);
        unitRepository.delete(unit);
        log.info("Deleted unit {} with {} tenant(s)", unitId, unit.getTenants().size());
    }

    private Unit loadUnit(Long unitId) {
        return unitRepository.findById(unitId)
                .orElseThrow(() -> ProblemException.notFound("Unit", unitId));
    }

    private PropertyAddress resolveAddress(Long addressId) {
        return propertyAddressRepository.findById(addressId)
                .orElseThrow(() -> ProblemException.invalidReference("addressId", addressId));
    }
}
