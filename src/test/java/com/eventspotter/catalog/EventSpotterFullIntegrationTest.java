package com.eventspotter.catalog;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(classes = EventSpotterApplication.class)
@Testcontainers(disabledWithoutDocker = true)
@TestPropertySource(properties = {
        "eventspotter.cache.facets.ttl-minutes=1",
        "eventspotter.limits.max-events=50",
        "logging.level.com.eventspotter.catalog=DEBUG"
})
class EventSpotterFullIntegrationTest {

    private static final String CATEGORIES_KEY = "eventspotter:facets:categories";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("eventspotter_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379)
            .withCommand("redis-server", "--save", "", "--appendonly", "no");

    @Autowired
    private WebApplicationContext webApplicationContext;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private StringRedisTemplate redisTemplate;

    private MockMvc mockMvc;
    private UUID userId;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);

        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379));
        registry.add("eventspotter.rate-limit.enabled", () -> "false");
    }

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.webAppContextSetup(webApplicationContext).build();

        try (RedisConnection connection = redisTemplate.getRequiredConnectionFactory().getConnection()) {
            connection.serverCommands().flushDb();
        }
        jdbcTemplate.execute("DELETE FROM user_saved_events");
        jdbcTemplate.execute("DELETE FROM events");
        jdbcTemplate.execute("DELETE FROM users");

        userId = UUID.randomUUID();
        jdbcTemplate.update("INSERT INTO users (id, username, email) VALUES (?::uuid, ?, ?)", userId.toString(), "marta", "marta@example.com");
    }

    @Test
    void shouldCreateListAndFilterEvents() throws Exception {
        // Given
        createEvent("Harbour Jazz", "Music", "2025-06-14", "[\"jazz\", \"outdoor\"]");
        createEvent("Clay Workshop", "Art", "2025-06-20", "[\"hands-on\"]");
        createEvent("Rooftop Cinema", "Film", "2025-07-02", "[\"outdoor\"]");

        // When & Then
        mockMvc.perform(get("/api/events")
                        .param("tags", "outdoor")
                        .param("sortBy", "eventDate")
                        .param("sortOrder", "asc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalEvents", is(2)))
                .andExpect(jsonPath("$.totalPages", is(1)))
                .andExpect(jsonPath("$.events[0].title", is("Harbour Jazz")))
                .andExpect(jsonPath("$.events[0].organizerName", is("marta")))
                .andExpect(jsonPath("$.events[1].title", is("Rooftop Cinema")));

        mockMvc.perform(get("/api/events")
                        .param("startDate", "2025-06-15")
                        .param("endDate", "2025-06-30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.events[*].title", contains("Clay Workshop")));

        mockMvc.perform(get("/api/events").param("search", "CINEMA"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalEvents", is(1)));
    }

    @Test
    void shouldCacheFacetsAndInvalidateOnWrite() throws Exception {
        // Given
        createEvent("Harbour Jazz", "Music", "2025-06-14", "[\" jazz \", \"outdoor\"]");

        // When
        mockMvc.perform(get("/api/events/categories"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.categories", contains("Music")));

        mockMvc.perform(get("/api/events/tags"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tags", contains("jazz", "outdoor")));

        // Then
        assertThat(redisTemplate.hasKey(CATEGORIES_KEY)).isTrue();

        createEvent("Clay Workshop", "Art", "2025-06-20", "[]");
        assertThat(redisTemplate.hasKey(CATEGORIES_KEY)).isFalse();

        mockMvc.perform(get("/api/events/categories"))
                .andExpect(jsonPath("$.categories", contains("Art", "Music")));
    }

    @Test
    void shouldSaveListAndHideDeletedEvents() throws Exception {
        // Given
        String keptId = createEvent("Book Club", "Books", "2025-08-01", "[]");
        String removedId = createEvent("Canceled Talk", "Talks", "2025-08-02", "[]");

        // When
        mockMvc.perform(post("/api/events/{eventId}/save", keptId).header("X-User-Id", userId.toString()))
                .andExpect(status().isCreated());
        mockMvc.perform(post("/api/events/{eventId}/save", keptId).header("X-User-Id", userId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message", is("Event already saved.")));
        mockMvc.perform(post("/api/events/{eventId}/save", removedId).header("X-User-Id", userId.toString()))
                .andExpect(status().isCreated());

        mockMvc.perform(delete("/api/events/{eventId}", removedId).header("X-User-Id", userId.toString()))
                .andExpect(status().isNoContent());

        // Then
        mockMvc.perform(get("/api/users/me/saved-events").header("X-User-Id", userId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.events", hasSize(1)))
                .andExpect(jsonPath("$.events[0].id", is(keptId)));

        mockMvc.perform(post("/api/events/batch-get")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"eventIds\": [\"" + keptId + "\", \"" + removedId + "\", \"" + keptId + "\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.events", hasSize(1)));
    }

    @Test
    void shouldRejectChangesByNonOwner() throws Exception {
        // Given
        String eventId = createEvent("Private Party", "Social", "2025-09-09", "[]");
        UUID stranger = UUID.randomUUID();
        jdbcTemplate.update("INSERT INTO users (id, username, email) VALUES (?::uuid, ?, ?)", stranger.toString(), "stranger", "stranger@example.com");

        // When & Then
        mockMvc.perform(patch("/api/events/{eventId}", eventId)
                        .header("X-User-Id", stranger.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"Crashed Party\"}"))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/events/{eventId}", eventId))
                .andExpect(jsonPath("$.title", is("Private Party")));
    }

    @Test
    void shouldRegisterUserAndEnforceUniqueProfileFields() throws Exception {
        // Given
        String body = mockMvc.perform(post("/api/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"lena\", \"email\": \"lena@example.com\"}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        String lenaId = JsonPath.read(body, "$.id");

        // When & Then
        mockMvc.perform(post("/api/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"someone\", \"email\": \"lena@example.com\"}"))
                .andExpect(status().isConflict());

        mockMvc.perform(patch("/api/users/me")
                        .header("X-User-Id", lenaId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"marta\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message", is("User with this username already exists.")));

        mockMvc.perform(patch("/api/users/me")
                        .header("X-User-Id", lenaId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\": \"lena@events.example.org\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username", is("lena")));

        mockMvc.perform(get("/api/users/me").header("X-User-Id", lenaId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email", is("lena@events.example.org")));
    }

    @Test
    void shouldServeOpenApiDocument() throws Exception {
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.info.title", is("EventSpotter Catalog API")))
                .andExpect(jsonPath("$.paths['/api/users/me']").exists())
                .andExpect(jsonPath("$.paths['/api/events/tags']").exists());
    }

    @Test
    void shouldPickRandomEventOrReportEmptyCatalog() throws Exception {
        mockMvc.perform(get("/api/events/random"))
                .andExpect(status().isNotFound());

        String eventId = createEvent("Only Option", "Misc", "2025-10-10", "[]");

        mockMvc.perform(get("/api/events/random"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id", is(eventId)));
    }

    private String createEvent(String title, String category, String date, String tagsJson) throws Exception {
        String body = """
                {
                  "title": "%s",
                  "description": "Details about %s for everyone",
                  "eventDate": "%s",
                  "locationDescription": "City Centre",
                  "category": "%s",
                  "tags": %s
                }
                """.formatted(title, title, date, category, tagsJson);

        String response = mockMvc.perform(post("/api/events")
                        .header("X-User-Id", userId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn()
                .getResponse()
                .getContentAsString();

        return JsonPath.read(response, "$.id");
    }
}
