package quest.gekko.dataflag.service.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import quest.gekko.dataflag.IntegrationTest;
import quest.gekko.dataflag.IntegrationTestConfig.DatabaseCleaner;
import quest.gekko.dataflag.domain.DataFlagClient;
import quest.gekko.dataflag.domain.DataRevision;
import quest.gekko.dataflag.exception.NotFoundException;
import quest.gekko.dataflag.exception.ValidationException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@IntegrationTest
class CatalogServiceTest {

    @Autowired
    private CatalogService catalogService;
    @Autowired
    private DatabaseCleaner databaseCleaner;

    @BeforeEach
    void setUp() {
        databaseCleaner.clean();
    }

    @Test
    void revisionNamesAreUniqueAndBounded() {
        catalogService.createRevision("rev_00", "first pass");

        assertThatThrownBy(() -> catalogService.createRevision("rev_00", null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("already exists");
        assertThatThrownBy(() -> catalogService.createRevision("r".repeat(DataRevision.MAX_NAME_LENGTH + 1), null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> catalogService.createRevision(" ", null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> catalogService.getRevision("rev_01"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void cachedListingsSeeNewEntries() {
        catalogService.createFlagType("rain", null, Map.of("source", "weather station"));
        assertThat(catalogService.listFlagTypes()).extracting("name").containsExactly("rain");

        catalogService.createFlagType("maintenance", null, null);
        assertThat(catalogService.listFlagTypes()).extracting("name").containsExactly("rain", "maintenance");
        assertThat(catalogService.getFlagType("rain").getMetadata()).containsEntry("source", "weather station");

        catalogService.createRevision("rev_00", null);
        assertThat(catalogService.listRevisions()).extracting(DataRevision::getName).containsExactly("rev_00");
        catalogService.createRevision("rev_01", null);
        assertThat(catalogService.listRevisions()).extracting(DataRevision::getName).containsExactly("rev_00", "rev_01");
    }

    @Test
    void userNamesAreNormalised() {
        catalogService.registerUser("alice");

        assertThat(catalogService.getUser("alice").getUserName()).isEqualTo("Alice");
        assertThat(catalogService.getUser("Alice").getUserName()).isEqualTo("Alice");
        assertThatThrownBy(() -> catalogService.registerUser("Alice")).isInstanceOf(ValidationException.class);
    }

    @Test
    void categoriesResolveInRequestOrder() {
        catalogService.createCategoryType("weather", null);
        catalogService.createCategoryType("hardware", null);

        assertThat(catalogService.getCategoryTypes(List.of("hardware", "weather"))).extracting("name")
                .containsExactly("hardware", "weather");
        assertThat(catalogService.getCategoryTypes(null)).isEmpty();
        assertThatThrownBy(() -> catalogService.getCategoryTypes(List.of("weather", "volcano")))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("volcano");
    }

    @Test
    void clientsAreCreatedOnce() {
        DataFlagClient first = catalogService.resolveClient("bonsai", "2.0");
        DataFlagClient again = catalogService.resolveClient("bonsai", "2.0");
        DataFlagClient newer = catalogService.resolveClient("bonsai", "2.1");

        assertThat(again.getId()).isEqualTo(first.getId());
        assertThat(newer.getId()).isNotEqualTo(first.getId());
    }
}
