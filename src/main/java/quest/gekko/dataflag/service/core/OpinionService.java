package quest.gekko.dataflag.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.dataflag.domain.*;
import quest.gekko.dataflag.exception.NotFoundException;
import quest.gekko.dataflag.exception.ValidationException;
import quest.gekko.dataflag.repository.DataFlagOpinionRepository;
import quest.gekko.dataflag.web.dto.CreateOpinionRequest;
import quest.gekko.dataflag.web.dto.EditOpinionRequest;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The opinion ledger as seen by people: one opinion per (type, user, LSD, revision), edited in
 * place and never deleted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class OpinionService {
    public static final String DEFAULT_CLIENT_NAME = "data-flag-api";
    public static final String DEFAULT_CLIENT_VERSION = "0.1.0";

    private final DataFlagOpinionRepository opinionRepository;
    private final CatalogService catalogService;
    private final Clock clock;

    /**
     * Record an opinion. If the user already has an opinion of this type on the same LSD and
     * revision, that opinion is updated instead.
     */
    @Transactional
    public DataFlagOpinion createOpinion(CreateOpinionRequest request) {
        Decision decision = Decision.fromValue(request.decision());
        Map<String, Object> metadata = FlagMetadata.validate(FlagMetadata.compose(request.metadata(),
                request.instrument(), request.freq(), request.inputs()));

        DataFlagOpinionType type = catalogService.getOpinionType(request.type());
        DataRevision revision = catalogService.getRevision(request.revision());
        DataFlagUser user = catalogService.getUser(request.user());
        var categories = catalogService.getCategoryTypes(request.categories());
        DataFlagClient client = catalogService.resolveClient(
                request.clientName() != null ? request.clientName() : DEFAULT_CLIENT_NAME,
                request.clientVersion() != null ? request.clientVersion() : DEFAULT_CLIENT_VERSION);
        double now = now();

        Optional<DataFlagOpinion> existing = opinionRepository.findByTypeAndUserAndLsdAndRevision(type, user,
                request.lsd(), revision);
        if (existing.isPresent()) {
            DataFlagOpinion opinion = existing.get();
            opinion.setDecision(decision);
            opinion.setClient(client);
            if (request.notes() != null) {
                opinion.setNotes(request.notes());
            }
            if (metadata != null) {
                opinion.setMetadata(metadata);
            }
            if (request.categories() != null) {
                opinion.setCategories(categories);
            }
            opinion.touch(now);
            log.info("Updated opinion {} of {} on LSD {} ({}): {}", opinion.getId(), user.getUserName(),
                    opinion.getLsd(), revision.getName(), decision.value());
            return opinionRepository.save(opinion);
        }

        double creationTime = request.creationTime() != null ? request.creationTime() : now;
        DataFlagOpinion opinion = new DataFlagOpinion();
        opinion.setType(type);
        opinion.setUser(user);
        opinion.setDecision(decision);
        opinion.setLsd(request.lsd());
        opinion.setRevision(revision);
        opinion.setClient(client);
        opinion.setNotes(request.notes());
        opinion.setMetadata(metadata);
        opinion.setCategories(categories);
        opinion.setCreationTime(creationTime);
        opinion.setLastEdit(creationTime);
        opinion = opinionRepository.save(opinion);
        log.info("Created opinion {} of {} on LSD {} ({}): {}", opinion.getId(), user.getUserName(),
                opinion.getLsd(), revision.getName(), decision.value());
        return opinion;
    }

    /**
     * Change decision, type, LSD, notes or categories of an opinion. The author can't be changed.
     */
    @Transactional
    public DataFlagOpinion editOpinion(Long id, EditOpinionRequest request) {
        DataFlagOpinion opinion = getOpinion(id);

        if (request.user() != null
                && !DataFlagUser.normalize(request.user()).equals(opinion.getUser().getUserName())) {
            throw new ValidationException("The user of opinion " + id + " can't be changed (is "
                    + opinion.getUser().getUserName() + ").");
        }
        Decision decision = request.decision() != null ? Decision.fromValue(request.decision()) : opinion.getDecision();
        DataFlagOpinionType type = request.type() != null ? catalogService.getOpinionType(request.type()) : opinion.getType();
        int lsd = request.lsd() != null ? request.lsd() : opinion.getLsd();

        if (!type.getId().equals(opinion.getType().getId()) || lsd != opinion.getLsd()) {
            opinionRepository.findByTypeAndUserAndLsdAndRevision(type, opinion.getUser(), lsd, opinion.getRevision())
                    .filter(other -> !other.getId().equals(id))
                    .ifPresent(other -> {
                        throw new ValidationException("Opinion " + other.getId() + " already holds " + type.getName()
                                + " on LSD " + lsd + " for this user and revision.");
                    });
        }
        if (request.categories() != null) {
            opinion.setCategories(catalogService.getCategoryTypes(request.categories()));
        }
        if (request.notes() != null) {
            opinion.setNotes(request.notes());
        }
        opinion.setDecision(decision);
        opinion.setType(type);
        opinion.setLsd(lsd);
        opinion.touch(now());
        log.info("Edited opinion {}", id);
        return opinionRepository.save(opinion);
    }

    public List<DataFlagOpinion> listOpinions(String revision, String userName, String typeName, Integer lsd) {
        String user = userName == null ? null : DataFlagUser.normalize(userName);
        return opinionRepository.search(revision, user, typeName, lsd);
    }

    public DataFlagOpinion getOpinion(Long id) {
        return opinionRepository.findById(id)
                .orElseThrow(() -> NotFoundException.of("Opinion", id));
    }

    private double now() {
        return clock.millis() / 1000.0;
    }
}
