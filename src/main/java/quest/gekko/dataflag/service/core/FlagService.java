package quest.gekko.dataflag.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.dataflag.domain.DataFlag;
import quest.gekko.dataflag.domain.DataFlagType;
import quest.gekko.dataflag.domain.FlagMetadata;
import quest.gekko.dataflag.exception.NotFoundException;
import quest.gekko.dataflag.exception.ValidationException;
import quest.gekko.dataflag.repository.DataFlagRepository;
import quest.gekko.dataflag.web.dto.CreateFlagRequest;
import quest.gekko.dataflag.web.dto.UpdateFlagRequest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class FlagService {

    private final DataFlagRepository flagRepository;
    private final CatalogService catalogService;

    /**
     * Create a flag of the given type. The metadata is validated against {@link FlagMetadata}.
     */
    @Transactional
    public DataFlag createFlag(DataFlagType type, double startTime, Double finishTime, Map<String, Object> metadata) {
        checkTimes(startTime, finishTime);
        DataFlag flag = new DataFlag();
        flag.setType(type);
        flag.setStartTime(startTime);
        flag.setFinishTime(finishTime);
        flag.setMetadata(FlagMetadata.validate(metadata));
        flag = flagRepository.save(flag);
        log.debug("Created flag {} of type {} over [{}, {}]", flag.getId(), type.getName(), startTime, finishTime);
        return flag;
    }

    /**
     * Create a flag on behalf of {@code principal}, who is recorded as the flag's user unless the
     * request names one.
     */
    @Transactional
    public DataFlag createFlag(CreateFlagRequest request, String principal) {
        DataFlagType type = catalogService.getFlagType(request.type());
        Map<String, Object> metadata = FlagMetadata.compose(request.metadata(), request.instrument(),
                request.freq(), request.inputs());
        if (metadata == null) {
            metadata = new LinkedHashMap<>();
        }
        if (request.description() != null) {
            metadata.put(FlagMetadata.DESCRIPTION, request.description());
        }
        metadata.put(FlagMetadata.USER, request.user() != null ? request.user() : principal);
        return createFlag(type, request.startTime(), request.finishTime(), metadata);
    }

    @Transactional
    public DataFlag editFlag(Long id, UpdateFlagRequest request) {
        DataFlag flag = getFlag(id);

        if (request.type() != null) {
            flag.setType(catalogService.getFlagType(request.type()));
        }
        double startTime = request.startTime() != null ? request.startTime() : flag.getStartTime();
        Double finishTime = request.finishTime() != null ? request.finishTime() : flag.getFinishTime();
        checkTimes(startTime, finishTime);

        Map<String, Object> metadata = flag.getMetadata() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(flag.getMetadata());
        if (request.metadata() != null) {
            metadata.putAll(request.metadata());
        }
        metadata = FlagMetadata.compose(metadata, request.instrument(), request.freq(), request.inputs());
        if (request.description() != null) {
            metadata.put(FlagMetadata.DESCRIPTION, request.description());
        }
        if (request.user() != null) {
            metadata.put(FlagMetadata.USER, request.user());
        }

        flag.setStartTime(startTime);
        flag.setFinishTime(finishTime);
        flag.setMetadata(FlagMetadata.validate(metadata));
        log.info("Edited flag {}", id);
        return flagRepository.save(flag);
    }

    /**
     * Flags of an optional type that are active somewhere in the optional [start, finish] window.
     */
    public List<DataFlag> listFlags(String typeName, Double start, Double finish) {
        if (typeName != null) {
            catalogService.getFlagType(typeName);
        }
        return flagRepository.search(typeName, start, finish);
    }

    public DataFlag getFlag(Long id) {
        return flagRepository.findById(id)
                .orElseThrow(() -> NotFoundException.of("Flag", id));
    }

    private static void checkTimes(double startTime, Double finishTime) {
        if (finishTime != null && finishTime < startTime) {
            throw new ValidationException("Flag finish time (" + finishTime + ") is before its start time (" + startTime + ").");
        }
    }
}
