package com.grokpm.backend.modules.property;

import static com.grokpm.backend.support.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;

import com.grokpm.backend.global.error.ProblemException;
import com.grokpm.backend.modules.property.application.PropertyAddressService;
import com.grokpm.backend.modules.property.domain.Property;
import com.grokpm.backend.modules.property.domain.PropertyAddress;
import com.grokpm.backend.modules.property.infrastructure.persistence.PropertyAddressRepository;
import com.grokpm.backend.modules.property.infrastructure.persistence.PropertyRepository;
import com.grokpm.backend.modules.property.presentation.dto.AddressResponse;
import com.grokpm.backend.modules.property.presentation.dto.CreateAddressRequest;
import com.grokpm.backend.modules.property.presentation.dto.UpdateAddressRequest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PropertyAddressServiceTest {

    @Mock
    private PropertyRepository propertyRepository;

    @Mock
    private PropertyAddressRepository propertyAddressRepository;

    private PropertyAddressService propertyAddressService;

    private Property property;
    private PropertyAddress first;
    private PropertyAddress second;

    @BeforeEach
    void setUp() {
        propertyAddressService = new PropertyAddressService(propertyRepository, propertyAddressRepository);
        property = withId(new Property(), 1L);
        first = address(10L, "1 Main St", true);
        second = address(11L, "2 Main St", false);
    }

    @Test
    void addingToPropertyWithPrimaryKeepsExistingPrimary() {
        when(propertyRepository.findById(1L)).thenReturn(Optional.of(property));
        when(propertyAddressRepository.saveAndFlush(any(PropertyAddress.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        AddressResponse response = propertyAddressService.addAddress(
                1L, new CreateAddressRequest("3 Main St", "Portland", "OR", "97201", null));

        assertThat(response.primary()).isFalse();
        assertThat(response.propertyId()).isEqualTo(1L);
        assertThat(first.isPrimary()).isTrue();
        assertThat(property.getAddresses()).hasSize(3);
    }

    @Test
    void firstAddressOfPropertyBecomesPrimary() {
        Property empty = withId(new Property(), 2L);
        when(propertyRepository.findById(2L)).thenReturn(Optional.of(empty));
        when(propertyAddressRepository.saveAndFlush(any(PropertyAddress.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        AddressResponse response = propertyAddressService.addAddress(
                2L, new CreateAddressRequest("9 Elm St", null, null, null, false));

        assertThat(response.primary()).isTrue();
    }

    @Test
    void markingAddressPrimaryDemotesSiblings() {
        when(propertyAddressRepository.findById(11L)).thenReturn(Optional.of(second));
        when(propertyAddressRepository.saveAndFlush(second)).thenReturn(second);

        propertyAddressService.updateAddress(11L, new UpdateAddressRequest(null, null, null, null, true));

        assertThat(second.isPrimary()).isTrue();
        assertThat(first.isPrimary()).isFalse();
    }

    @Test
    void unflaggingPrimaryPromotesAnotherSibling() {
        when(propertyAddressRepository.findById(10L)).thenReturn(Optional.of(first));
        when(propertyAddressRepository.saveAndFlush(first)).thenReturn(first);

        propertyAddressService.updateAddress(10L, new UpdateAddressRequest("1 Main Street", null, null, null, false));

        assertThat(first.getStreet()).isEqualTo("1 Main Street");
        assertThat(first.isPrimary()).isFalse();
        assertThat(second.isPrimary()).isTrue();
    }

    @Test
    void deletingPrimaryPromotesRemainingAddress() {
        when(propertyAddressRepository.findById(10L)).thenReturn(Optional.of(first));

        propertyAddressService.deleteAddress(10L);

        verify(propertyAddressRepository).delete(first);
        assertThat(property.getAddresses()).containsExactly(second);
        assertThat(second.isPrimary()).isTrue();
    }

    @Test
    void listingAddressesOfMissingPropertyIsNotFound() {
        when(propertyRepository.existsById(5L)).thenReturn(false);

        assertThatThrownBy(() -> propertyAddressService.getAddresses(5L))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("PROPERTY_NOT_FOUND"));
    }

    @Test
    void missingAddressIsNotFound() {
        when(propertyAddressRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> propertyAddressService.deleteAddress(99L))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("ADDRESS_NOT_FOUND"));
    }

    private PropertyAddress address(Long id, String street, boolean primary) {
        PropertyAddress address = withId(new PropertyAddress(), id);
        address.setStreet(street);
        address.setPrimary(primary);
        property.addAddress(address);
        return address;
    }
}
