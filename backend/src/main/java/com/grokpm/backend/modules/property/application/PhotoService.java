package com.grokpm.backend.modules.property.application;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.grokpm.backend.global.error.ProblemException;
import com.grokpm.backend.modules.leasing.domain.Unit;
import com.grokpm.backend.modules.leasing.infrastructure.persistence.UnitRepository;
import com.grokpm.backend.modules.property.domain.Photo;
import com.grokpm.backend.modules.property.domain.PrimaryDesignation;
import com.grokpm.backend.modules.property.domain.Property;
import com.grokpm.backend.modules.property.infrastructure.persistence.PhotoRepository;
import com.grokpm.backend.modules.property.infrastructure.persistence.PropertyRepository;
import com.grokpm.backend.modules.property.presentation.dto.CreatePhotoRequest;
import com.grokpm.backend.modules.property.presentation.dto.PhotoResponse;
import com.grokpm.backend.modules.property.presentation.dto.PropertyDtoMapper;
import com.grokpm.backend.modules.property.presentation.dto.UpdatePhotoRequest;

/**
 * Photos of a property or a unit. Within one parent at most one photo is primary and the first photo added becomes
 * primary.
 */
@Service
@Transactional
public class PhotoService {

    private final PhotoRepository photoRepository;
    private final PropertyRepository propertyRepository;
    private final UnitRepository unitRepository;

    public PhotoService(
            PhotoRepository photoRepository,
            PropertyRepository propertyRepository,
            UnitRepository unitRepository
    ) {
        this.photoRepository = photoRepository;
        this.propertyRepository = propertyRepository;
        this.unitRepository = unitRepository;
    }

    @Transactional(readOnly = true)
    public List<PhotoResponse> getPhotos(Long propertyId, Long unitId) {
        List<Photo> photos;
        if (propertyId != null) {
            photos = photoRepository.findByPropertyIdOrderByIdAsc(propertyId);
        } else if (unitId != null) {
            photos = photoRepository.findByUnitIdOrderByIdAsc(unitId);
        } else {
            photos = photoRepository.findAllByOrderByIdAsc();
        }
        return PropertyDtoMapper.toPhotoResponses(photos);
    }

    @Transactional(readOnly = true)
    public PhotoResponse getPhoto(Long photoId) {
        return PropertyDtoMapper.toPhotoResponse(loadPhoto(photoId));
    }

    public PhotoResponse createPhoto(CreatePhotoRequest request) {
        if ((request.propertyId() == null) == (request.unitId() == null)) {
            throw ProblemException.badRequest(
                    "PHOTO_PARENT_REQUIRED",
                    "Exactly one of propertyId or unitId must be provided"
            );
        }

        Photo photo = new Photo();
        photo.setUrl(request.url().trim());
        photo.setName(request.name());

        List<Photo> siblings;
        if (request.propertyId() != null) {
            Property property = propertyRepository.findById(request.propertyId())
                    .orElseThrow(() -> ProblemException.invalidReference("propertyId", request.propertyId()));
            photo.setProperty(property);
            siblings = property.getPhotos();
        } else {
            Unit unit = unitRepository.findById(request.unitId())
                    .orElseThrow(() -> ProblemException.invalidReference("unitId", request.unitId()));
            photo.setUnit(unit);
            siblings = unit.getPhotos();
        }

        boolean hasPrimary = siblings.stream().anyMatch(Photo::isPrimary);
        siblings.add(photo);
        if (Boolean.TRUE.equals(request.primary()) || !hasPrimary) {
            PrimaryDesignation.designatePhoto(siblings, photo);
        }
        return PropertyDtoMapper.toPhotoResponse(photoRepository.saveAndFlush(photo));
    }

    public PhotoResponse updatePhoto(Long photoId, UpdatePhotoRequest request) {
        Photo photo = loadPhoto(photoId);
        if (request.url() != null) {
            photo.setUrl(request.url().trim());
        }
        if (request.name() != null) {
            photo.setName(request.name());
        }
        if (Boolean.TRUE.equals(request.primary())) {
            PrimaryDesignation.designatePhoto(siblingsOf(photo), photo);
        }
        return PropertyDtoMapper.toPhotoResponse(photoRepository.saveAndFlush(photo));
    }

    public void deletePhoto(Long photoId) {
        Photo photo = loadPhoto(photoId);
        List<Photo> siblings = siblingsOf(photo);
        siblings.remove(photo);
        photoRepository.delete(photo);
        if (photo.isPrimary()) {
            PrimaryDesignation.normalizePhotos(siblings);
        }
    }

    private List<Photo> siblingsOf(Photo photo) {
        return photo.getProperty() != null ? photo.getProperty().getPhotos() : photo.getUnit().getPhotos();
    }

    private Photo loadPhoto(Long photoId) {
        return photoRepository.findById(photoId)
                .orElseThrow(() -> ProblemException.notFound("Photo", photoId));
    }
}
