package quest.gekko.dataflag.service.voting;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import quest.gekko.dataflag.domain.DataFlag;
import quest.gekko.dataflag.domain.DataFlagOpinion;
import quest.gekko.dataflag.domain.Decision;
import quest.gekko.dataflag.domain.FlagMetadata;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Only unanimous decisions count: a single user can be the hypnotoad, but as soon as there is one
 * opposing opinion on the same LSD and revision, no flag is created.
 * <p>
 * Opposed opinions still get a vote so they are not looked at again until someone edits them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HypnotoadStrategy implements VotingStrategy {
    private final OpinionLedger ledger;
    private final SiderealCalendar calendar;

    @Override
    public VotingMode mode() {
        return VotingMode.HYPNOTOAD;
    }

    @Override
    public List<VoteOutcome> evaluate(VotingRound round) {
        List<DataFlagOpinion> candidates = ledger.listOpinions(round.revision(), round.lowWaterMark(), mode());
        log.debug("{} opinions on revision {} edited since {}", candidates.size(), round.revision().getName(),
                round.lowWaterMark());

        Map<Integer, List<DataFlagOpinion>> byLsd = candidates.stream()
                .collect(Collectors.groupingBy(DataFlagOpinion::getLsd, TreeMap::new, Collectors.toList()));

        List<VoteOutcome> outcomes = new ArrayList<>(byLsd.size());
        byLsd.forEach((lsd, opinions) -> outcomes.add(resolve(round, lsd, opinions)));
        return outcomes;
    }

    private VoteOutcome resolve(VotingRound round, int lsd, List<DataFlagOpinion> opinions) {
        Decision decision = opinions.get(0).getDecision();
        boolean contested = opinions.stream().anyMatch(o -> o.getDecision() != decision)
                || ledger.countConflicting(lsd, round.revision(), decision) > 0;

        if (contested) {
            log.debug("LSD {} of revision {} is contested, no flag", lsd, round.revision().getName());
            return VoteOutcome.noFlag(lsd, opinions);
        }
        if (decision != Decision.BAD) {
            return VoteOutcome.noFlag(lsd, opinions);
        }

        Map<String, Object> metadata = mergeMetadata(opinions);
        Optional<DataFlag> existing = ledger.findVotedFlag(mode(), round.revision(), lsd);
        if (existing.isPresent() && FlagMetadata.covers(existing.get().getMetadata(), metadata)) {
            log.debug("LSD {} of revision {} already flagged by flag {}", lsd, round.revision().getName(),
                    existing.get().getId());
            return VoteOutcome.existingFlag(lsd, opinions, existing.get());
        }
        // flags are never widened, a narrower earlier flag gets a new one next to it
        return VoteOutcome.newFlag(lsd, opinions,
                new FlagDraft(calendar.toUnix(lsd), calendar.toUnix(lsd + 1), metadata));
    }

    /**
     * Flag metadata covering all the given bad opinions. An opinion without a frequency (or input)
     * list means all of them, which then wins over any other list.
     */
    static Map<String, Object> mergeMetadata(List<DataFlagOpinion> opinions) {
        Map<String, Object> metadata = new LinkedHashMap<>();

        Set<String> instruments = opinions.stream()
                .map(DataFlagOpinion::getInstrument)
                .collect(Collectors.toCollection(HashSet::new));
        boolean sameInstrument = instruments.size() == 1;
        String instrument = sameInstrument ? instruments.iterator().next() : null;
        if (instrument != null) {
            metadata.put(FlagMetadata.INSTRUMENT, instrument);
        }

        union(opinions, DataFlagOpinion::getFreq).ifPresent(freq -> metadata.put(FlagMetadata.FREQ, freq));
        if (sameInstrument) {
            union(opinions, DataFlagOpinion::getInputs).ifPresent(inputs -> metadata.put(FlagMetadata.INPUTS, inputs));
        }
        return metadata;
    }

    private static Optional<List<Integer>> union(List<DataFlagOpinion> opinions,
                                                 Function<DataFlagOpinion, List<Integer>> indices) {
        SortedSet<Integer> union = new TreeSet<>();
        for (DataFlagOpinion opinion : opinions) {
            List<Integer> values = indices.apply(opinion);
            if (values == null) {
                return Optional.empty();
            }
            union.addAll(values);
        }
        return Optional.of(new ArrayList<>(union));
    }
}
