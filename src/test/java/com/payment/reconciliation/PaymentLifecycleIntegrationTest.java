package com.payment.reconciliation;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Disabled;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.util.DigestUtils;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.nio.charset.StandardCharsets;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration test: config, payment creation and a signed Robokassa callback
 * through the full stack. Uses Embedded Kafka, Testcontainers Redis and H2.
 * Run with: mvn test -DincludeTags=integration (and ensure Docker is available).
 */
@Tag("integration")
@Disabled("Requires Docker; remove @Disabled or use -DincludeTags=integration with Docker")
@SpringBootTest(classes = PaymentReconciliationApplication.class)
@AutoConfigureMockMvc
@EmbeddedKafka(partitions = 1, topics = { "payment-events" },
        bootstrapServersProperty = "spring.kafka.bootstrap-servers")
@Testcontainers
class PaymentLifecycleIntegrationTest {

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @Autowired
    private MockMvc mockMvc;

    @DynamicPropertySource
    static void redisProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
    }

    @Test
    @DisplayName("Robokassa payment is created, paid by callback and acknowledged with OK<InvId>")
    void robokassaPaymentLifecycle() throws Exception {
        mockMvc.perform(put("/api/v1/payment-configs/shop/it-shop")
                        .header("X-User-Id", "owner-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "enabled": true,
                                  "testMode": true,
                                  "providers": ["robokassa"],
                                  "providerSettings": {
                                    "robokassa": {
                                      "merchantLogin": "demo-shop",
                                      "password1": "password-one",
                                      "password2": "password-two"
                                    }
                                  }
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.providerSettings.robokassa.password2", startsWith("pass")));

        String created = mockMvc.perform(post("/api/v1/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "entityType": "shop",
                                  "entityId": "it-shop",
                                  "targetType": "order",
                                  "targetId": "4242",
                                  "provider": "robokassa",
                                  "amount": 1500,
                                  "idempotencyKey": "it-robokassa-1"
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.externalId").value("4242"))
                .andReturn().getResponse().getContentAsString();
        String paymentId = JsonPath.read(created, "$.id");

        String signature = DigestUtils.md5DigestAsHex("1500.00:4242:password-two".getBytes(StandardCharsets.UTF_8));
        mockMvc.perform(post("/api/v1/payments/webhooks/shop/it-shop/robokassa")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("OutSum", "1500.00")
                        .param("InvId", "4242")
                        .param("SignatureValue", signature.toUpperCase()))
                .andExpect(status().isOk())
                .andExpect(content().string("OK4242"));

        mockMvc.perform(get("/api/v1/payments/" + paymentId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("succeeded"))
                .andExpect(jsonPath("$.statusHistory.length()").value(2));
    }
}
