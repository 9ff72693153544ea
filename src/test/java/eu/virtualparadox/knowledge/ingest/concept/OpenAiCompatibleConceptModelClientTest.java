package eu.virtualparadox.knowledge.ingest.concept;

import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.knowledge.ingest.error.PermanentIngestionException;
import eu.virtualparadox.knowledge.ingest.error.TransientIngestionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAiCompatibleConceptModelClientTest {

    private MockServerRestTemplateCustomizer server;
    private OpenAiCompatibleConceptModelClient client;

    @BeforeEach
    void setUp() {
        server = new MockServerRestTemplateCustomizer();
        client = new OpenAiCompatibleConceptModelClient("http://model.local/v1/", "test-model", "secret",
                Duration.ofSeconds(5), new RestTemplateBuilder(server), new ObjectMapper());
    }

    @Test
    @DisplayName("Chat completion content is parsed into concepts and relationships")
    void extract_parsesMessageContent() {
        String response = """
                {"choices":[{"message":{"role":"assistant","content":
                "{\\"concepts\\":[\\"Lucene\\",\\"HNSW\\"],\\"relationships\\":[{\\"source_concept\\":\\"HNSW\\",\\"relation_type\\":\\"part_of\\",\\"target_concept\\":\\"Lucene\\",\\"confidence\\":0.9}]}"
                }}]}
                """;
        server.getServer()
                .expect(requestTo("http://model.local/v1/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer secret"))
                .andRespond(withSuccess(response, MediaType.APPLICATION_JSON));

        ConceptModelResult result = client.extract("Lucene uses HNSW graphs.");

        assertEquals(2, result.concepts().size());
        assertEquals("HNSW", result.relationships().get(0).sourceConcept());
        assertEquals(0.9, result.relationships().get(0).confidenceOrDefault(), 1e-9);
        server.getServer().verify();
    }

    @Test
    @DisplayName("Server errors are transient, client errors are permanent")
    void extract_classifiesHttpErrors() {
        server.getServer()
                .expect(requestTo("http://model.local/v1/chat/completions"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThrows(TransientIngestionException.class, () -> client.extract("text"));

        assertInstanceOf(TransientIngestionException.class,
                OpenAiCompatibleConceptModelClient.classify(new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS)));
        assertInstanceOf(TransientIngestionException.class,
                OpenAiCompatibleConceptModelClient.classify(new HttpServerErrorException(HttpStatus.BAD_GATEWAY)));
        assertInstanceOf(PermanentIngestionException.class,
                OpenAiCompatibleConceptModelClient.classify(new HttpClientErrorException(HttpStatus.BAD_REQUEST)));
    }

    @Test
    @DisplayName("Fenced JSON is unwrapped")
    void parseContent_fenced() {
        ConceptModelResult result = client.parseContent("```json\n{\"concepts\":[\"A\"]}\n```");

        assertEquals(1, result.concepts().size());
        assertTrue(result.relationships().isEmpty());
    }

    @Test
    @DisplayName("Malformed or missing output means no concepts")
    void parse_malformed() {
        assertTrue(client.parseContent("not json at all").concepts().isEmpty());
        assertTrue(client.parse(null).concepts().isEmpty());
        assertTrue(client.parse(new ObjectMapper().createObjectNode()).concepts().isEmpty());
    }

    @Test
    @DisplayName("Base URL is mandatory")
    void requiresBaseUrl() {
        assertThrows(IllegalArgumentException.class, () -> new OpenAiCompatibleConceptModelClient(" ", "m", null,
                Duration.ofSeconds(1), new RestTemplateBuilder(), new ObjectMapper()));
    }
}
