package com.grokpm.backend.modules.property.application;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.grokpm.backend.global.error.ProblemException;
import com.grokpm.backend.modules.property.domain.Owner;
import com.grokpm.backend.modules.property.domain.Property;
import com.grokpm.backend.modules.property.infrastructure.persistence.OwnerRepository;
import com.grokpm.backend.modules.property.infrastructure.persistence.PropertyRepository;
import com.grokpm.backend.modules.property.presentation.dto.CreateOwnerRequest;
import com.grokpm.backend.modules.property.presentation.dto.OwnerResponse;
import com.grokpm.backend.modules.property.presentation.dto.PropertyDtoMapper;
import com.grokpm.backend.modules.property.presentation.dto.UpdateOwnerRequest;

@Service
@Transactional
public class OwnerService {

    private final OwnerRepository ownerRepository;
    private final PropertyRepository propertyRepository;

    public OwnerService(OwnerRepository ownerRepository, PropertyRepository propertyRepository) {
        this.ownerRepository = ownerRepository;
        this.propertyRepository = propertyRepository;
    }

    @Transactional(readOnly = true)
    public List<OwnerResponse> getOwners(Long propertyId) {
        List<Owner> owners = propertyId != null
                ? ownerRepository.findByPropertyIdOrderByIdAsc(propertyId)
                : ownerRepository.findAllByOrderByIdAsc();
        return owners.stream().map(PropertyDtoMapper::toOwnerResponse).toList();
    }

    @Transactional(readOnly = true)
    public OwnerResponse getOwner(Long ownerId) {
        return PropertyDtoMapper.toOwnerResponse(loadOwner(ownerId));
    }

    public OwnerResponse createOwner(CreateOwnerRequest request) {
        Owner owner = new Owner();
        owner.setName(request.name().trim());
        owner.setEmail(request.email());
        owner.setPhone(request.phone());
        if (request.propertyId() != null) {
            owner.setProperty(resolveProperty(request.propertyId()));
        }
        return PropertyDtoMapper.toOwnerResponse(ownerRepository.saveAndFlush(owner));
    }

    public OwnerResponse updateOwner(Long ownerId, UpdateOwnerRequest request) {
        Owner owner = loadOwner(ownerId);
        if (request.name() != null) {
            owner.setName(request.name().trim());
        }
        if (request.email() != null) {
            owner.setEmail(request.email());
        }
        if (request.phone() != null) {
            owner.setPhone(request.phone());
        }
        if (request.propertyId() != null) {
            owner.setProperty(resolveProperty(request.propertyId()));
        }
        return PropertyDtoMapper.toOwnerResponse(ownerRepository.saveAndFlush(owner));
    }

    public void deleteOwner(Long ownerId) {
        ownerRepository.delete(loadOwner(ownerId));
    }

    private Owner loadOwner(Long ownerId) {
        return ownerRepository.findById(ownerId)
                .orElseThrow(() -> ProblemException.notFound("Owner", ownerId));
    }

    private Property resolveProperty(Long propertyId) {
        return propertyRepository.findById(propertyId)
                .orElseThrow(() -> ProblemException.invalidReference("propertyId", propertyId));
    }
}
