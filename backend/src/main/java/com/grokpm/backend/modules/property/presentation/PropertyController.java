package com.grokpm.backend.modules.property.presentation;

import java.net.URI;
import java.util.List;

import com.grokpm.backend.modules.property.application.PropertyAddressService;
import com.grokpm.backend.modules.property.application.PropertyService;
import com.grokpm.backend.modules.property.presentation.dto.AddressResponse;
import com.grokpm.backend.modules.property.presentation.dto.CreateAddressRequest;
import com.grokpm.backend.modules.property.presentation.dto.CreatePropertyRequest;
import com.grokpm.backend.modules.property.presentation.dto.PropertyResponse;
import com.grokpm.backend.modules.property.presentation.dto.UpdateAddressRequest;
import com.grokpm.backend.modules.property.presentation.dto.UpdatePropertyRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/properties")
public class PropertyController {

    private final PropertyService propertyService;
    private final PropertyAddressService propertyAddressService;

    public PropertyController(PropertyService propertyService, PropertyAddressService propertyAddressService) {
        this.propertyService = propertyService;
        this.propertyAddressService = propertyAddressService;
    }

    @GetMapping
    public ResponseEntity<List<PropertyResponse>> getProperties(
            @RequestParam(name = "status", required = false) String status
    ) {
        return ResponseEntity.ok(propertyService.getProperties(status));
    }

    @GetMapping("/{propertyId}")
    public ResponseEntity<PropertyResponse> getProperty(@PathVariable("propertyId") Long propertyId) {
        return ResponseEntity.ok(propertyService.getProperty(propertyId));
    }

    @Operation(
            summary = "Create a property",
            description = """
                    Creates the property together with the optional `addresses` and `photos` arrays in one \
                    transaction. The first address becomes the primary address.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Property created"),
            @ApiResponse(responseCode = "400", description = "Validation failure or malformed JSON")
    })
    @PostMapping
    public ResponseEntity<PropertyResponse> createProperty(@Valid @RequestBody CreatePropertyRequest request) {
        PropertyResponse response = propertyService.createProperty(request);
        return ResponseEntity.created(URI.create("/api/properties/" + response.id())).body(response);
    }

    @Operation(
            summary = "Update a property",
            description = """
                    Patches the fields present in the body. When `addresses` is present it replaces the address \
                    list: entries with a known id are updated, entries without one are inserted and addresses \
                    missing from the list are deleted with their units. `photos` behaves the same way.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Property updated"),
            @ApiResponse(responseCode = "404", description = "PROPERTY_NOT_FOUND")
    })
    @PutMapping("/{propertyId}")
    public ResponseEntity<PropertyResponse> updateProperty(
            @PathVariable("propertyId") Long propertyId,
            @Valid @RequestBody UpdatePropertyRequest request
    ) {
        return ResponseEntity.ok(propertyService.updateProperty(propertyId, request));
    }

    @Operation(summary = "Delete a property and everything that belongs to it")
    @DeleteMapping("/{propertyId}")
    public ResponseEntity<Void> deleteProperty(@PathVariable("propertyId") Long propertyId) {
        propertyService.deleteProperty(propertyId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{propertyId}/addresses")
    public ResponseEntity<List<AddressResponse>> getAddresses(@PathVariable("propertyId") Long propertyId) {
        return ResponseEntity.ok(propertyAddressService.getAddresses(propertyId));
    }

    @PostMapping("/{propertyId}/addresses")
    public ResponseEntity<AddressResponse> addAddress(
            @PathVariable("propertyId") Long propertyId,
            @Valid @RequestBody CreateAddressRequest request
    ) {
        AddressResponse response = propertyAddressService.addAddress(propertyId, request);
        return ResponseEntity.created(URI.create("/api/properties/addresses/" + response.id())).body(response);
    }

    @GetMapping("/addresses/{addressId}")
    public ResponseEntity<AddressResponse> getAddress(@PathVariable("addressId") Long addressId) {
        return ResponseEntity.ok(propertyAddressService.getAddress(addressId));
    }

    @PutMapping("/addresses/{addressId}")
    public ResponseEntity<AddressResponse> updateAddress(
            @PathVariable("addressId") Long addressId,
            @Valid @RequestBody UpdateAddressRequest request
    ) {
        return ResponseEntity.ok(propertyAddressService.updateAddress(addressId, request));
    }

    @DeleteMapping("/addresses/{addressId}")
    public ResponseEntity<Void> deleteAddress(@PathVariable("addressId") Long addressId) {
        propertyAddressService.deleteAddress(addressId);
        return ResponseEntity.noContent().build();
    }
}
