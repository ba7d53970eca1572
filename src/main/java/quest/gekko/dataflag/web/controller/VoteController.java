package quest.gekko.dataflag.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import quest.gekko.dataflag.domain.DataFlag;
import quest.gekko.dataflag.service.voting.VoteHistoryService;
import quest.gekko.dataflag.service.voting.VotingJudge;
import quest.gekko.dataflag.service.voting.VotingMode;
import quest.gekko.dataflag.web.dto.FlagDTO;
import quest.gekko.dataflag.web.dto.VoteDTO;
import quest.gekko.dataflag.web.dto.VoteRunResponse;

import java.util.List;

@RestController
@RequestMapping("/api/votes")
@RequiredArgsConstructor
@Slf4j
public class VoteController {
    private final VotingJudge votingJudge;
    private final VoteHistoryService voteHistoryService;

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public VoteRunResponse vote(@RequestParam(defaultValue = "hypnotoad") String mode,
                                @RequestParam String revision,
                                @RequestParam(defaultValue = "false") boolean verbose) {
        log.info("Vote requested: mode={}, revision={}", mode, revision);
        List<DataFlag> flags = votingJudge.runVote(mode, revision);
        return new VoteRunResponse(mode, revision, flags.size(),
                verbose ? flags.stream().map(FlagDTO::from).toList() : null);
    }

    @GetMapping
    public List<VoteDTO> list(@RequestParam String revision, @RequestParam(required = false) String mode) {
        return voteHistoryService.listVotes(revision, mode);
    }

    @GetMapping("/modes")
    public List<String> modes() {
        return VotingMode.names();
    }
}
