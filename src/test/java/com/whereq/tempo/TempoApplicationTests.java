package com.whereq.tempo;

import com.whereq.tempo.admission.IdentityResolver;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class TempoApplicationTests {

    @Autowired
    private WebTestClient client;

    @Test
    void healthIsUp() {
        client.get().uri("/api/v1/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("UP")
            .jsonPath("$.service").isEqualTo("whereq-tempo")
            .jsonPath("$.queue.status").isEqualTo("healthy")
            .jsonPath("$.processors[0]").isEqualTo("echo");

        client.get().uri("/actuator/health")
            .exchange()
            .expectStatus().isOk();
    }

    @Test
    void echoJobRunsToCompletion() {
        Map<?, ?> submitted = client.post().uri("/api/v1/jobs")
            .header(IdentityResolver.USER_ID_HEADER, "smoke")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("type", "echo", "payload", Map.of("n", 5)))
            .exchange()
            .expectStatus().isAccepted()
            .expectBody(Map.class)
            .returnResult()
            .getResponseBody();

        String jobId = (String) ((Map<?, ?>) submitted.get("job")).get("id");

        client.get().uri("/api/v1/jobs/{id}", jobId)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.job.status").isEqualTo("COMPLETED")
            .jsonPath("$.job.result.n").isEqualTo(5)
            .jsonPath("$.shouldPoll").isEqualTo(false);
    }
}
