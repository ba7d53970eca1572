package quest.gekko.dataflag.web.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;
import quest.gekko.dataflag.IntegrationTest;
import quest.gekko.dataflag.IntegrationTestConfig.DatabaseCleaner;
import quest.gekko.dataflag.MutableClock;
import quest.gekko.dataflag.service.core.CatalogService;
import quest.gekko.dataflag.service.core.OpinionService;
import quest.gekko.dataflag.service.voting.SiderealCalendar;
import quest.gekko.dataflag.web.dto.CreateOpinionRequest;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@IntegrationTest
@AutoConfigureMockMvc
class VoteControllerTest {

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private CatalogService catalogService;
    @Autowired
    private OpinionService opinionService;
    @Autowired
    private SiderealCalendar calendar;
    @Autowired
    private MutableClock clock;
    @Autowired
    private DatabaseCleaner databaseCleaner;

    @BeforeEach
    void setUp() {
        databaseCleaner.clean();
        clock.set(1_700_000_000);
        catalogService.createRevision("rev_00", null);
        catalogService.createFlagType("vote", null, null);
        catalogService.createOpinionType("quality", null, null);
        catalogService.registerUser("alice");
        opinionService.createOpinion(new CreateOpinionRequest("quality", "alice", "bad", 2112, "rev_00", null,
                null, null, null, null, null, null, null, null));
    }

    @Test
    @WithMockUser(username = "admin", roles = "ADMIN")
    void verboseRunReturnsCreatedFlags() throws Exception {
        mockMvc.perform(post("/api/votes").param("revision", "rev_00").param("verbose", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("hypnotoad"))
                .andExpect(jsonPath("$.flagsCreated").value(1))
                .andExpect(jsonPath("$.flags", hasSize(1)))
                .andExpect(jsonPath("$.flags[0].type").value("vote"))
                .andExpect(jsonPath("$.flags[0].startTime").value(calendar.toUnix(2112)));

        mockMvc.perform(get("/api/votes").param("revision", "rev_00"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].lsd").value(2112))
                .andExpect(jsonPath("$[0].opinionIds", hasSize(1)));
    }

    @Test
    @WithMockUser(username = "admin", roles = "ADMIN")
    void quietRunOnlyCounts() throws Exception {
        mockMvc.perform(post("/api/votes").param("mode", "hypnotoad").param("revision", "rev_00"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.flagsCreated").value(1))
                .andExpect(jsonPath("$.flags").doesNotExist());
    }

    @Test
    @WithMockUser(username = "admin", roles = "ADMIN")
    void badModeOrRevisionIsReported() throws Exception {
        mockMvc.perform(post("/api/votes").param("mode", "majority").param("revision", "rev_00"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("majority")));
        mockMvc.perform(post("/api/votes").param("revision", "rev_99"))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/votes"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @WithMockUser(username = "alice")
    void onlyAdminsMayVote() throws Exception {
        mockMvc.perform(post("/api/votes").param("revision", "rev_00"))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/api/votes/modes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("hypnotoad"));
    }

    @Test
    void anonymousRequestsAreUnauthorized() throws Exception {
        mockMvc.perform(get("/api/votes/modes"))
                .andExpect(status().isUnauthorized());
    }
}
