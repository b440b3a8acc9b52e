package com.grokpm.backend.modules.property.presentation.dto;

import java.util.List;

import com.grokpm.backend.modules.association.presentation.dto.AssociationDtoMapper;
import com.grokpm.backend.modules.leasing.presentation.dto.LeasingDtoMapper;
import com.grokpm.backend.modules.property.domain.Owner;
import com.grokpm.backend.modules.property.domain.Photo;
import com.grokpm.backend.modules.property.domain.Property;
import com.grokpm.backend.modules.property.domain.PropertyAddress;

public final class PropertyDtoMapper {

    private PropertyDtoMapper() {
    }

    public static PropertyResponse toResponse(Property property) {
        return new PropertyResponse(
                property.getId(),
                property.getName(),
                property.getType(),
                property.getStatus(),
                property.getValue(),
                property.getAddresses().stream().map(PropertyDtoMapper::toAddressResponse).toList(),
                property.getOwners().stream().map(PropertyDtoMapper::toOwnerSummary).toList(),
                property.getPhotos().stream().map(PropertyDtoMapper::toPhotoResponse).toList(),
                property.getAssociations().stream().map(AssociationDtoMapper::toSummary).toList(),
                property.getPortfolioLinks().stream().map(link -> link.getPortfolio().getId()).toList(),
                property.getCreatedAt(),
                property.getUpdatedAt()
        );
    }

    public static PropertySummary toSummary(Property property) {
        if (property == null) {
            return null;
        }
        return new PropertySummary(property.getId(), property.getName(), property.getStatus());
    }

    public static AddressResponse toAddressResponse(PropertyAddress address) {
        return new AddressResponse(
                address.getId(),
                address.getProperty().getId(),
                address.getStreet(),
                address.getCity(),
                address.getState(),
                address.getZip(),
                address.isPrimary(),
                address.getUnits().stream().map(LeasingDtoMapper::toUnitSummary).toList(),
                address.getCreatedAt(),
                address.getUpdatedAt()
        );
    }

    public static AddressSummary toAddressSummary(PropertyAddress address) {
        return new AddressSummary(
                address.getId(),
                address.getProperty().getId(),
                address.getStreet(),
                address.getCity(),
                address.getState(),
                address.getZip(),
                address.isPrimary()
        );
    }

    public static OwnerSummary toOwnerSummary(Owner owner) {
        return new OwnerSummary(owner.getId(), owner.getName(), owner.getEmail(), owner.getPhone());
    }

    public static OwnerResponse toOwnerResponse(Owner owner) {
        return new OwnerResponse(
                owner.getId(),
                owner.getName(),
                owner.getEmail(),
                owner.getPhone(),
                toSummary(owner.getProperty()),
                owner.getCreatedAt(),
                owner.getUpdatedAt()
        );
    }

    public static PhotoResponse toPhotoResponse(Photo photo) {
        return new PhotoResponse(
                photo.getId(),
                photo.getUrl(),
                photo.getName(),
                photo.isPrimary(),
                photo.getProperty() != null ? photo.getProperty().getId() : null,
                photo.getUnit() != null ? photo.getUnit().getId() : null,
                photo.getCreatedAt(),
                photo.getUpdatedAt()
        );
    }

    public static List<PhotoResponse> toPhotoResponses(List<Photo> photos) {
        return photos.stream().map(PropertyDtoMapper::toPhotoResponse).toList();
    }
}
