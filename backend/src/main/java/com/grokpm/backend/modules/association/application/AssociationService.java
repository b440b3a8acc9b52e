package com.grokpm.backend.modules.association.application;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.grokpm.backend.global.error.ProblemException;
import com.grokpm.backend.modules.association.domain.Association;
import com.grokpm.backend.modules.association.infrastructure.persistence.AssociationRepository;
import com.grokpm.backend.modules.association.presentation.dto.AssociationDtoMapper;
import com.grokpm.backend.modules.association.presentation.dto.AssociationResponse;
import com.grokpm.backend.modules.association.presentation.dto.CreateAssociationRequest;
import com.grokpm.backend.modules.association.presentation.dto.UpdateAssociationRequest;
import com.grokpm.backend.modules.property.domain.Property;
import com.grokpm.backend.modules.property.infrastructure.persistence.PropertyRepository;

@Service
@Transactional
public class AssociationService {

    private final AssociationRepository associationRepository;
    private final PropertyRepository propertyRepository;

    public AssociationService(AssociationRepository associationRepository, PropertyRepository propertyRepository) {
        this.associationRepository = associationRepository;
        this.propertyRepository = propertyRepository;
    }

    @Transactional(readOnly = true)
    public List<AssociationResponse> getAssociations(Long propertyId) {
        List<Association> associations = propertyId != null
                ? associationRepository.findByPropertyIdOrderByIdAsc(propertyId)
                : associationRepository.findAllByOrderByIdAsc();
        return associations.stream().map(AssociationDtoMapper::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public AssociationResponse getAssociation(Long associationId) {
        return AssociationDtoMapper.toResponse(loadAssociation(associationId));
    }

    public AssociationResponse createAssociation(CreateAssociationRequest request) {
        Association association = new Association();
        association.setName(request.name().trim());
        association.setContactInfo(request.contactInfo());
        association.setFee(request.fee());
        association.setDueDate(request.dueDate());
        if (request.propertyId() != null) {
            association.setProperty(resolveProperty(request.propertyId()));
        }
        return AssociationDtoMapper.toResponse(associationRepository.saveAndFlush(association));
    }

    public AssociationResponse updateAssociation(Long associationId, UpdateAssociationRequest request) {
        Association association = loadAssociation(associationId);
        if (request.name() != null) {
            association.setName(request.name().trim());
        }
        if (request.contactInfo() != null) {
            association.setContactInfo(request.contactInfo());
        }
        if (request.fee() != null) {
            association.setFee(request.fee());
        }
        if (request.dueDate() != null) {
            association.setDueDate(request.dueDate());
        }
        if (request.propertyId() != null) {
            association.setProperty(resolveProperty(request.propertyId()));
        }
        return AssociationDtoMapper.toResponse(associationRepository.saveAndFlush(association));
    }

    public void deleteAssociation(Long associationId) {
        associationRepository.delete(loadAssociation(associationId));
    }

    private Association loadAssociation(Long associationId) {
        return associationRepository.findById(associationId)
                .orElseThrow(() -> ProblemException.notFound("Association", associationId));
    }

    private Property resolveProperty(Long propertyId) {
        return propertyRepository.findById(propertyId)
                .orElseThrow(() -> ProblemException.invalidReference("propertyId", propertyId));
    }
}
