package quest.gekko.dataflag.service.voting;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.dataflag.domain.DataFlagVote;
import quest.gekko.dataflag.domain.DataFlagVoteOpinion;
import quest.gekko.dataflag.domain.DataRevision;
import quest.gekko.dataflag.domain.VoteOpinionId;
import quest.gekko.dataflag.repository.DataFlagVoteOpinionRepository;
import quest.gekko.dataflag.repository.DataFlagVoteRepository;
import quest.gekko.dataflag.service.core.CatalogService;
import quest.gekko.dataflag.web.dto.VoteDTO;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Provenance of votes: which opinions each vote consumed and which flag it produced.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class VoteHistoryService {
    private final DataFlagVoteRepository voteRepository;
    private final DataFlagVoteOpinionRepository voteOpinionRepository;
    private final CatalogService catalogService;

    public List<VoteDTO> listVotes(String revisionName, String modeName) {
        DataRevision revision = catalogService.getRevision(revisionName);
        List<DataFlagVote> votes = modeName == null
                ? voteRepository.findByRevisionOrderByTimeAscIdAsc(revision)
                : voteRepository.findByRevisionAndModeOrderByTimeAscIdAsc(revision, VotingMode.fromName(modeName).modeName());
        if (votes.isEmpty()) {
            return List.of();
        }

        Map<Long, List<Long>> opinionIds = voteOpinionRepository
                .findByVoteIds(votes.stream().map(DataFlagVote::getId).toList()).stream()
                .map(DataFlagVoteOpinion::getId)
                .collect(Collectors.groupingBy(VoteOpinionId::getVoteId,
                        Collectors.mapping(VoteOpinionId::getOpinionId, Collectors.toList())));

        return votes.stream()
                .map(v -> new VoteDTO(
                        v.getId(),
                        v.getTime(),
                        v.getMode(),
                        v.getLsd(),
                        v.getRevision().getName(),
                        v.getFlag() == null ? null : v.getFlag().getId(),
                        v.getClient().getClientName() + " " + v.getClient().getClientVersion(),
                        opinionIds.getOrDefault(v.getId(), List.of())))
                .toList();
    }
}
