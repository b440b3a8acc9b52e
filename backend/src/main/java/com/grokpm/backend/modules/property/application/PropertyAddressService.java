package com.grokpm.backend.modules.property.application;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.grokpm.backend.global.error.ProblemException;
import com.grokpm.backend.modules.property.domain.PrimaryDesignation;
import com.grokpm.backend.modules.property.domain.Property;
import com.grokpm.backend.modules.property.domain.PropertyAddress;
import com.grokpm.backend.modules.property.infrastructure.persistence.PropertyAddressRepository;
import com.grokpm.backend.modules.property.infrastructure.persistence.PropertyRepository;
import com.grokpm.backend.modules.property.presentation.dto.AddressResponse;
import com.grokpm.backend.modules.property.presentation.dto.CreateAddressRequest;
import com.grokpm.backend.modules.property.presentation.dto.PropertyDtoMapper;
import com.grokpm.backend.modules.property.presentation.dto.UpdateAddressRequest;

/**
 * Single-address operations. A property's first address is primary, flagging another one primary demotes the
 * rest, and removing the primary promotes the oldest remaining address.
 */
@Service
@Transactional
public class PropertyAddressService {

    private static final Logger log = LoggerFactory.getLogger(PropertyAddressService.class);

    private final PropertyRepository propertyRepository;
    private final PropertyAddressRepository propertyAddressRepository;

    public PropertyAddressService(
            PropertyRepository propertyRepository,
            PropertyAddressRepository propertyAddressRepository
    ) {
        this.propertyRepository = propertyRepository;
        this.propertyAddressRepository = propertyAddressRepository;
    }

    @Transactional(readOnly = true)
    public List<AddressResponse> getAddresses(Long propertyId) {
        if (!propertyRepository.existsById(propertyId)) {
            throw ProblemException.notFound("Property", propertyId);
        }
        return propertyAddressRepository.findByPropertyIdOrderByIdAsc(propertyId).stream()
                .map(PropertyDtoMapper::toAddressResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public AddressResponse getAddress(Long addressId) {
        return PropertyDtoMapper.toAddressResponse(loadAddress(addressId));
    }

    public AddressResponse addAddress(Long propertyId, CreateAddressRequest request) {
        Property property = propertyRepository.findById(propertyId)
                .orElseThrow(() -> ProblemException.notFound("Property", propertyId));

        PropertyAddress address = new PropertyAddress();
        address.setStreet(request.street());
        address.setCity(request.city());
        address.setState(request.state());
        address.setZip(request.zip());
        property.addAddress(address);

        boolean hasPrimary = property.getAddresses().stream().anyMatch(PropertyAddress::isPrimary);
        if (Boolean.TRUE.equals(request.primary()) || !hasPrimary) {
            PrimaryDesignation.designateAddress(property.getAddresses(), address);
        }
        PropertyAddress saved = propertyAddressRepository.saveAndFlush(address);
        return PropertyDtoMapper.toAddressResponse(saved);
    }

    public AddressResponse updateAddress(Long addressId, UpdateAddressRequest request) {
        PropertyAddress address = loadAddress(addressId);
        if (request.street() != null) {
            address.setStreet(request.street());
        }
        if (request.city() != null) {
            address.setCity(request.city());
        }
        if (request.state() != null) {
            address.setState(request.state());
        }
        if (request.zip() != null) {
            address.setZip(request.zip());
        }

        List<PropertyAddress> siblings = address.getProperty().getAddresses();
        if (Boolean.TRUE.equals(request.primary())) {
            PrimaryDesignation.designateAddress(siblings, address);
        } else if (Boolean.FALSE.equals(request.primary()) && address.isPrimary()) {
            siblings.stream()
                    .filter(other -> other != address)
                    .findFirst()
                    .ifPresent(next -> PrimaryDesignation.designateAddress(siblings, next));
        }
        PropertyAddress saved = propertyAddressRepository.saveAndFlush(address);
        return PropertyDtoMapper.toAddressResponse(saved);
    }

    public void deleteAddress(Long addressId) {
        PropertyAddress address = loadAddress(addressId);
        Property property = address.getProperty();
        boolean wasPrimary = address.isPrimary();

        property.getAddresses().remove(address);
        propertyAddressRepository.delete(address);
        if (wasPrimary) {
            PrimaryDesignation.normalizeAddresses(property.getAddresses());
        }
        log.info("Deleted address {} of property {} with {} unit(s)", addressId, property.getId(), address.getUnits().size());
    }

    private PropertyAddress loadAddress(Long addressId) {
        return propertyAddressRepository.findById(addressId)
                .orElseThrow(() -> ProblemException.notFound("Address", addressId));
    }
}
