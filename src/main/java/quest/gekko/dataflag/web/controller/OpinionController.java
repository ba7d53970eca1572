package quest.gekko.dataflag.web.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import quest.gekko.dataflag.service.core.OpinionService;
import quest.gekko.dataflag.web.dto.CreateOpinionRequest;
import quest.gekko.dataflag.web.dto.EditOpinionRequest;
import quest.gekko.dataflag.web.dto.OpinionDTO;

import java.util.List;

@RestController
@RequestMapping("/api/opinions")
@RequiredArgsConstructor
public class OpinionController {
    private final OpinionService opinionService;

    @GetMapping
    public List<OpinionDTO> list(@RequestParam(required = false) String revision,
                                 @RequestParam(required = false) String user,
                                 @RequestParam(required = false) String type,
                                 @RequestParam(required = false) Integer lsd) {
        return opinionService.listOpinions(revision, user, type, lsd).stream().map(OpinionDTO::from).toList();
    }

    @GetMapping("/{id}")
    public OpinionDTO show(@PathVariable Long id) {
        return OpinionDTO.from(opinionService.getOpinion(id));
    }

    // Also used to change one's mind: an existing opinion on the same LSD is updated
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public OpinionDTO create(@Valid @RequestBody CreateOpinionRequest request) {
        return OpinionDTO.from(opinionService.createOpinion(request));
    }

    @PatchMapping("/{id}")
    public OpinionDTO edit(@PathVariable Long id, @RequestBody EditOpinionRequest request) {
        return OpinionDTO.from(opinionService.editOpinion(id, request));
    }
}
