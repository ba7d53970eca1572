package quest.gekko.dataflag.web.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import quest.gekko.dataflag.service.core.FlagService;
import quest.gekko.dataflag.web.dto.CreateFlagRequest;
import quest.gekko.dataflag.web.dto.FlagDTO;
import quest.gekko.dataflag.web.dto.FlagMaskDTO;
import quest.gekko.dataflag.web.dto.UpdateFlagRequest;

import java.security.Principal;
import java.util.List;

@RestController
@RequestMapping("/api/flags")
@RequiredArgsConstructor
public class FlagController {
    private final FlagService flagService;

    // start/finish select flags active in that window (UNIX seconds)
    @GetMapping
    public List<FlagDTO> list(@RequestParam(required = false) String type,
                              @RequestParam(required = false) Double start,
                              @RequestParam(required = false) Double finish) {
        return flagService.listFlags(type, start, finish).stream().map(FlagDTO::from).toList();
    }

    @GetMapping("/{id}")
    public FlagDTO show(@PathVariable Long id) {
        return FlagDTO.from(flagService.getFlag(id));
    }

    @GetMapping("/{id}/masks")
    public FlagMaskDTO masks(@PathVariable Long id) {
        return FlagMaskDTO.from(flagService.getFlag(id));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @PreAuthorize("hasRole('ADMIN')")
    public FlagDTO create(@Valid @RequestBody CreateFlagRequest request, Principal principal) {
        return FlagDTO.from(flagService.createFlag(request, principal.getName()));
    }

    @PatchMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public FlagDTO edit(@PathVariable Long id, @RequestBody UpdateFlagRequest request) {
        return FlagDTO.from(flagService.editFlag(id, request));
    }
}
