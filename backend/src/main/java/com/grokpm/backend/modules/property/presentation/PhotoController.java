package com.grokpm.backend.modules.property.presentation;

import java.net.URI;
import java.util.List;

import com.grokpm.backend.modules.property.application.PhotoService;
import com.grokpm.backend.modules.property.presentation.dto.CreatePhotoRequest;
import com.grokpm.backend.modules.property.presentation.dto.PhotoResponse;
import com.grokpm.backend.modules.property.presentation.dto.UpdatePhotoRequest;

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
@RequestMapping("/api/photos")
public class PhotoController {

    private final PhotoService photoService;

    public PhotoController(PhotoService photoService) {
        this.photoService = photoService;
    }

    @GetMapping
    public ResponseEntity<List<PhotoResponse>> getPhotos(
            @RequestParam(name = "propertyId", required = false) Long propertyId,
            @RequestParam(name = "unitId", required = false) Long unitId
    ) {
        return ResponseEntity.ok(photoService.getPhotos(propertyId, unitId));
    }

    @GetMapping("/{photoId}")
    public ResponseEntity<PhotoResponse> getPhoto(@PathVariable("photoId") Long photoId) {
        return ResponseEntity.ok(photoService.getPhoto(photoId));
    }

    @Operation(summary = "Attach a photo to a property or a unit")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Photo created"),
            @ApiResponse(responseCode = "400", description = "Neither or both of propertyId and unitId given (PHOTO_PARENT_REQUIRED)")
    })
    @PostMapping
    public ResponseEntity<PhotoResponse> createPhoto(@Valid @RequestBody CreatePhotoRequest request) {
        PhotoResponse response = photoService.createPhoto(request);
        return ResponseEntity.created(URI.create("/api/photos/" + response.id())).body(response);
    }

    @PutMapping("/{photoId}")
    public ResponseEntity<PhotoResponse> updatePhoto(
            @PathVariable("photoId") Long photoId,
            @Valid @RequestBody UpdatePhotoRequest request
    ) {
        return ResponseEntity.ok(photoService.updatePhoto(photoId, request));
    }

    @DeleteMapping("/{photoId}")
    public ResponseEntity<Void> deletePhoto(@PathVariable("photoId") Long photoId) {
        photoService.deletePhoto(photoId);
        return ResponseEntity.noContent().build();
    }
}
