package com.grokpm.backend.modules.property.application;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.grokpm.backend.global.error.ProblemException;
import com.grokpm.backend.global.jpa.ChildListReconciler;
import com.grokpm.backend.modules.property.domain.Photo;
import com.grokpm.backend.modules.property.domain.PrimaryDesignation;
import com.grokpm.backend.modules.property.domain.Property;
import com.grokpm.backend.modules.property.domain.PropertyAddress;
import com.grokpm.backend.modules.property.infrastructure.persistence.PropertyRepository;
import com.grokpm.backend.modules.property.presentation.dto.AddressInput;
import com.grokpm.backend.modules.property.presentation.dto.CreatePropertyRequest;
import com.grokpm.backend.modules.property.presentation.dto.PhotoInput;
import com.grokpm.backend.modules.property.presentation.dto.PropertyDtoMapper;
import com.grokpm.backend.modules.property.presentation.dto.PropertyResponse;
import com.grokpm.backend.modules.property.presentation.dto.UpdatePropertyRequest;

/**
 * Property CRUD including the composite write of a property with its address and photo lists.
 *
 * <p>Each public method is one transaction: a failure while reconciling children rolls back the property row as
 * well.</p>
 */
@Service
@Transactional
public class PropertyService {

    private static final Logger log = LoggerFactory.getLogger(PropertyService.class);

    private final PropertyRepository propertyRepository;

    public PropertyService(PropertyRepository propertyRepository) {
        this.propertyRepository = propertyRepository;
    }

    @Transactional(readOnly = true)
    public List<PropertyResponse> getProperties(String status) {
        List<Property> properties = StringUtils.hasText(status)
                ? propertyRepository.findByStatusIgnoreCaseOrderByIdAsc(status.trim())
                : propertyRepository.findAllByOrderByIdAsc();
        return properties.stream().map(PropertyDtoMapper::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public PropertyResponse getProperty(Long propertyId) {
        return PropertyDtoMapper.toResponse(loadProperty(propertyId));
    }

    public PropertyResponse createProperty(CreatePropertyRequest request) {
        Property property = new Property();
        property.setName(request.name().trim());
        property.setType(request.type());
        property.setStatus(request.status());
        property.setValue(request.value());
        if (request.addresses() != null) {
            replaceAddresses(property, request.addresses());
        }
        if (request.photos() != null) {
            replacePhotos(property, request.photos());
        }
        Property saved = propertyRepository.saveAndFlush(property);
        log.info("Created property {} with {} address(es)", saved.getId(), saved.getAddresses().size());
        return PropertyDtoMapper.toResponse(saved);
    }

    public PropertyResponse updateProperty(Long propertyId, UpdatePropertyRequest request) {
        Property property = loadProperty(propertyId);
        if (request.name() != null) {
            if (!StringUtils.hasText(request.name())) {
                throw ProblemException.badRequest("VALIDATION_ERROR", "name: must not be blank");
            }
            property.setName(request.name().trim());
        }
        if (request.type() != null) {
            property.setType(request.type());
        }
        if (request.status() != null) {
            property.setStatus(request.status());
        }
        if (request.value() != null) {
            property.setValue(request.value());
        }
        if (request.addresses() != null) {
            ChildListReconciler.Result<PropertyAddress> result = replaceAddresses(property, request.addresses());
            log.debug("Property {} addresses: {} inserted, {} updated, {} removed", propertyId,
                    result.inserted().size(), result.updated().size(), result.removed().size());
        }
        if (request.photos() != null) {
            replacePhotos(property, request.photos());
        }
        propertyRepository.flush();
        return PropertyDtoMapper.toResponse(property);
    }

    public void deleteProperty(Long propertyId) {
        Property property = loadProperty(propertyId);
        propertyRepository.delete(property);
        log.info("Deleted property {} with {} address(es)", propertyId, property.getAddresses().size());
    }

    /**
     * Reconciles the property's addresses with the submitted list by id. The first submitted address becomes the
     * primary address whatever flags were stored before.
     */
    ChildListReconciler.Result<PropertyAddress> replaceAddresses(Property property, List<AddressInput> submitted) {
        ChildListReconciler.Result<PropertyAddress> result = ChildListReconciler.reconcile(
                property.getAddresses(),
                submitted,
                PropertyAddress::getId,
                AddressInput::id,
                () -> {
                    PropertyAddress address = new PropertyAddress();
                    address.setProperty(property);
                    return address;
                },
                (address, input) -> {
                    address.setStreet(input.street());
                    address.setCity(input.city());
                    address.setState(input.state());
                    address.setZip(input.zip());
                }
        );
        List<PropertyAddress> ordered = result.ordered();
        if (!ordered.isEmpty()) {
            PrimaryDesignation.designateAddress(ordered, ordered.get(0));
        }
        return result;
    }

    /**
     * Reconciles property photos by id. The first photo the client flags primary wins, otherwise the first photo.
     */
    ChildListReconciler.Result<Photo> replacePhotos(Property property, List<PhotoInput> submitted) {
        ChildListReconciler.Result<Photo> result = ChildListReconciler.reconcile(
                property.getPhotos(),
                submitted,
                Photo::getId,
                PhotoInput::id,
                () -> {
                    Photo photo = new Photo();
                    photo.setProperty(property);
                    return photo;
                },
                (photo, input) -> {
                    photo.setUrl(input.url().trim());
                    photo.setName(input.name());
                    photo.setPrimary(Boolean.TRUE.equals(input.primary()));
                }
        );
        PrimaryDesignation.normalizePhotos(result.ordered());
        return result;
    }

    private Property loadProperty(Long propertyId) {
        return propertyRepository.findById(propertyId)
                .orElseThrow(() -> ProblemException.notFound("Property", propertyId));
    }
}
