package quest.gekko.dataflag.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.dataflag.config.CacheConfig;
import quest.gekko.dataflag.domain.*;
import quest.gekko.dataflag.exception.NotFoundException;
import quest.gekko.dataflag.exception.ValidationException;
import quest.gekko.dataflag.repository.*;

import java.util.*;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Revisions, flag/opinion/category types, users and clients: the administrative catalogs every
 * flag and opinion refers to.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class CatalogService {

    private final DataRevisionRepository revisionRepository;
    private final DataFlagTypeRepository flagTypeRepository;
    private final DataFlagOpinionTypeRepository opinionTypeRepository;
    private final DataFlagCategoryTypeRepository categoryTypeRepository;
    private final DataFlagUserRepository userRepository;
    private final DataFlagClientRepository clientRepository;

    // Revisions

    @Transactional
    @CacheEvict(value = CacheConfig.REVISIONS, allEntries = true)
    public DataRevision createRevision(String name, String description) {
        requireName("revision", name, DataRevision.MAX_NAME_LENGTH);
        if (revisionRepository.findByName(name).isPresent()) {
            throw new ValidationException("Revision '" + name + "' already exists.");
        }
        DataRevision revision = new DataRevision();
        revision.setName(name);
        revision.setDescription(description);
        log.info("Creating revision {}", name);
        return revisionRepository.save(revision);
    }

    @Cacheable(CacheConfig.REVISIONS)
    public List<DataRevision> listRevisions() {
        return revisionRepository.findAllByOrderByIdAsc();
    }

    public DataRevision getRevision(String name) {
        return revisionRepository.findByName(name)
                .orElseThrow(() -> NotFoundException.of("Revision", name));
    }

    // Flag and opinion types

    @Transactional
    @CacheEvict(value = CacheConfig.FLAG_TYPES, allEntries = true)
    public DataFlagType createFlagType(String name, String description, Map<String, Object> metadata) {
        return createSubsetType("Flag type", flagTypeRepository, flagTypeRepository::findByName, DataFlagType::new,
                name, description, metadata);
    }

    @Cacheable(CacheConfig.FLAG_TYPES)
    public List<DataFlagType> listFlagTypes() {
        return flagTypeRepository.findAllByOrderByIdAsc();
    }

    public DataFlagType getFlagType(String name) {
        return flagTypeRepository.findByName(name)
                .orElseThrow(() -> NotFoundException.of("Flag type", name));
    }

    @Transactional
    @CacheEvict(value = CacheConfig.OPINION_TYPES, allEntries = true)
    public DataFlagOpinionType createOpinionType(String name, String description, Map<String, Object> metadata) {
        return createSubsetType("Opinion type", opinionTypeRepository, opinionTypeRepository::findByName,
                DataFlagOpinionType::new, name, description, metadata);
    }

    @Cacheable(CacheConfig.OPINION_TYPES)
    public List<DataFlagOpinionType> listOpinionTypes() {
        return opinionTypeRepository.findAllByOrderByIdAsc();
    }

    public DataFlagOpinionType getOpinionType(String name) {
        return opinionTypeRepository.findByName(name)
                .orElseThrow(() -> NotFoundException.of("Opinion type", name));
    }

    // Categories

    @Transactional
    @CacheEvict(value = CacheConfig.CATEGORY_TYPES, allEntries = true)
    public DataFlagCategoryType createCategoryType(String name, String description) {
        requireName("category", name, DataSubsetType.MAX_NAME_LENGTH);
        if (categoryTypeRepository.findByName(name).isPresent()) {
            throw new ValidationException("Category '" + name + "' already exists.");
        }
        DataFlagCategoryType category = new DataFlagCategoryType();
        category.setName(name);
        category.setDescription(description);
        return categoryTypeRepository.save(category);
    }

    @Cacheable(CacheConfig.CATEGORY_TYPES)
    public List<DataFlagCategoryType> listCategoryTypes() {
        return categoryTypeRepository.findAllByOrderByIdAsc();
    }

    /** Resolve category names, failing on the first unknown one. */
    public Set<DataFlagCategoryType> getCategoryTypes(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return new LinkedHashSet<>();
        }
        Map<String, DataFlagCategoryType> found = new HashMap<>();
        categoryTypeRepository.findByNameIn(names).forEach(c -> found.put(c.getName(), c));
        Set<DataFlagCategoryType> result = new LinkedHashSet<>();
        for (String name : names) {
            DataFlagCategoryType category = found.get(name);
            if (category == null) {
                throw NotFoundException.of("Category", name);
            }
            result.add(category);
        }
        return result;
    }

    // Users and clients

    @Transactional
    public DataFlagUser registerUser(String userName) {
        String normalized = DataFlagUser.normalize(userName);
        requireName("user", normalized, 255);
        if (userRepository.findByUserName(normalized).isPresent()) {
            throw new ValidationException("User '" + normalized + "' already exists.");
        }
        DataFlagUser user = new DataFlagUser();
        user.setUserName(normalized);
        return userRepository.save(user);
    }

    public List<DataFlagUser> listUsers() {
        return userRepository.findAllByOrderByUserNameAsc();
    }

    public DataFlagUser getUser(String userName) {
        String normalized = DataFlagUser.normalize(userName);
        return userRepository.findByUserName(normalized)
                .orElseThrow(() -> NotFoundException.of("User", normalized));
    }

    @Transactional
    public DataFlagClient resolveClient(String clientName, String clientVersion) {
        return clientRepository.findByClientNameAndClientVersion(clientName, clientVersion)
                .orElseGet(() -> {
                    DataFlagClient client = new DataFlagClient();
                    client.setClientName(clientName);
                    client.setClientVersion(clientVersion);
                    return clientRepository.save(client);
                });
    }

    private <T extends DataSubsetType> T createSubsetType(String kind, JpaRepository<T, Long> repository,
                                                          Function<String, Optional<T>> finder, Supplier<T> factory,
                                                          String name, String description, Map<String, Object> metadata) {
        requireName(kind.toLowerCase(Locale.ROOT), name, DataSubsetType.MAX_NAME_LENGTH);
        if (finder.apply(name).isPresent()) {
            throw new ValidationException(kind + " '" + name + "' already exists.");
        }
        T type = factory.get();
        type.setName(name);
        type.setDescription(description);
        type.setMetadata(metadata);
        log.info("Creating {} {}", kind.toLowerCase(Locale.ROOT), name);
        return repository.save(type);
    }

    private static void requireName(String kind, String name, int maxLength) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("A " + kind + " needs a name.");
        }
        if (name.length() > maxLength) {
            throw new ValidationException("The " + kind + " name '" + name + "' is longer than " + maxLength + " characters.");
        }
    }
}
