package quest.gekko.dataflag.web.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import quest.gekko.dataflag.service.core.CatalogService;
import quest.gekko.dataflag.web.dto.*;

import java.util.List;

/**
 * Revisions, flag/opinion/category types and users.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CatalogController {
    private final CatalogService catalogService;

    @GetMapping("/revisions")
    public List<RevisionDTO> listRevisions() {
        return catalogService.listRevisions().stream().map(RevisionDTO::from).toList();
    }

    @GetMapping("/revisions/{name}")
    public RevisionDTO showRevision(@PathVariable String name) {
        return RevisionDTO.from(catalogService.getRevision(name));
    }

    @PostMapping("/revisions")
    @ResponseStatus(HttpStatus.CREATED)
    @PreAuthorize("hasRole('ADMIN')")
    public RevisionDTO createRevision(@Valid @RequestBody RevisionRequest request) {
        return RevisionDTO.from(catalogService.createRevision(request.name(), request.description()));
    }

    @GetMapping("/flag-types")
    public List<SubsetTypeDTO> listFlagTypes() {
        return catalogService.listFlagTypes().stream().map(SubsetTypeDTO::from).toList();
    }

    @GetMapping("/flag-types/{name}")
    public SubsetTypeDTO showFlagType(@PathVariable String name) {
        return SubsetTypeDTO.from(catalogService.getFlagType(name));
    }

    @PostMapping("/flag-types")
    @ResponseStatus(HttpStatus.CREATED)
    @PreAuthorize("hasRole('ADMIN')")
    public SubsetTypeDTO createFlagType(@Valid @RequestBody SubsetTypeRequest request) {
        return SubsetTypeDTO.from(catalogService.createFlagType(request.name(), request.description(), request.metadata()));
    }

    @GetMapping("/opinion-types")
    public List<SubsetTypeDTO> listOpinionTypes() {
        return catalogService.listOpinionTypes().stream().map(SubsetTypeDTO::from).toList();
    }

    @GetMapping("/opinion-types/{name}")
    public SubsetTypeDTO showOpinionType(@PathVariable String name) {
        return SubsetTypeDTO.from(catalogService.getOpinionType(name));
    }

    @PostMapping("/opinion-types")
    @ResponseStatus(HttpStatus.CREATED)
    @PreAuthorize("hasRole('ADMIN')")
    public SubsetTypeDTO createOpinionType(@Valid @RequestBody SubsetTypeRequest request) {
        return SubsetTypeDTO.from(catalogService.createOpinionType(request.name(), request.description(), request.metadata()));
    }

    @GetMapping("/category-types")
    public List<SubsetTypeDTO> listCategoryTypes() {
        return catalogService.listCategoryTypes().stream().map(SubsetTypeDTO::from).toList();
    }

    @PostMapping("/category-types")
    @ResponseStatus(HttpStatus.CREATED)
    @PreAuthorize("hasRole('ADMIN')")
    public SubsetTypeDTO createCategoryType(@Valid @RequestBody SubsetTypeRequest request) {
        return SubsetTypeDTO.from(catalogService.createCategoryType(request.name(), request.description()));
    }

    @GetMapping("/users")
    public List<UserDTO> listUsers() {
        return catalogService.listUsers().stream().map(UserDTO::from).toList();
    }

    @PostMapping("/users")
    @ResponseStatus(HttpStatus.CREATED)
    @PreAuthorize("hasRole('ADMIN')")
    public UserDTO registerUser(@Valid @RequestBody UserRequest request) {
        return UserDTO.from(catalogService.registerUser(request.userName()));
    }
}
