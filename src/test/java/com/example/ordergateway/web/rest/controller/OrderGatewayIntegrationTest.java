package com.example.ordergateway.web.rest.controller;

import com.example.ordergateway.repository.CredentialStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.io.IOException;
import java.io.UncheckedIOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class OrderGatewayIntegrationTest {

  private static final String ORDER_JSON =
      "{\"id\":\"%s\",\"status\":\"pending\",\"item\":\"book\",\"amount\":2,\"user_id\":\"u1\"}";

  private static final MockWebServer ORDER_SERVICE = startOrderService();

  @Autowired
  private MockMvc mockMvc;

  @Autowired
  private ObjectMapper objectMapper;

  @Autowired
  private CredentialStore credentialStore;

  @DynamicPropertySource
  static void upstreamProperties(DynamicPropertyRegistry registry) {
    registry.add("app.upstream.base-url", () -> ORDER_SERVICE.url("/").toString());
  }

  @AfterAll
  static void stopOrderService() throws IOException {
    ORDER_SERVICE.shutdown();
  }

  @Test
  void healthIsPublic() throws Exception {
    mockMvc.perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"))
        .andExpect(jsonPath("$.order_service_url").value(ORDER_SERVICE.url("/").toString()));
  }

  @Test
  void loginIssuesBearerToken() throws Exception {
    mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("username", "testuser")
                        .param("password", "secret"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.token_type").value("bearer"))
        .andExpect(jsonPath("$.access_token").isNotEmpty());
  }

  @Test
  void badPasswordAndUnknownUserGetTheSameRejection() throws Exception {
    MvcResult wrongPassword = mockMvc.perform(post("/auth/login")
                                                  .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                                                  .param("username", "testuser")
                                                  .param("password", "wrong"))
        .andExpect(status().isUnauthorized())
        .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
        .andExpect(jsonPath("$.detail").value("Incorrect username or password"))
        .andReturn();

    MvcResult unknownUser = mockMvc.perform(post("/auth/login")
                                                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                                                .param("username", "nobody")
                                                .param("password", "secret"))
        .andExpect(status().isUnauthorized())
        .andReturn();

    assertEquals(wrongPassword.getResponse().getContentAsString(), unknownUser.getResponse().getContentAsString());
  }

  @Test
  void loginWithoutPasswordIsUnprocessable() throws Exception {
    mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("username", "testuser"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.detail").value("Missing required parameter: password"));
  }

  @Test
  void meReturnsCurrentUser() throws Exception {
    mockMvc.perform(get("/auth/me").header(HttpHeaders.AUTHORIZATION, bearer("admin", "admin123")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.user_id").value("u2"))
        .andExpect(jsonPath("$.username").value("admin"))
        .andExpect(jsonPath("$.disabled").value(false));
  }

  @Test
  void protectedRoutesRequireToken() throws Exception {
    mockMvc.perform(get("/auth/me"))
        .andExpect(status().isUnauthorized())
        .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
        .andExpect(jsonPath("$.detail").value("Could not validate credentials"));

    mockMvc.perform(get("/orders/o-200").header(HttpHeaders.AUTHORIZATION, "Bearer garbage"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.detail").value("Could not validate credentials"));
  }

  @Test
  void createdOrderIsServedWithoutCallingUpstreamAgain() throws Exception {
    String token = bearer("testuser", "secret");

    mockMvc.perform(post("/orders")
                        .header(HttpHeaders.AUTHORIZATION, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"u1\",\"item\":\"book\",\"amount\":2}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value("o-100"));
    int requestsAfterCreate = ORDER_SERVICE.getRequestCount();

    mockMvc.perform(get("/orders/o-100").header(HttpHeaders.AUTHORIZATION, token))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value("o-100"))
        .andExpect(jsonPath("$.status").value("pending"));

    assertEquals(requestsAfterCreate, ORDER_SERVICE.getRequestCount());
  }

  @Test
  void fetchedOrderIsCached() throws Exception {
    String token = bearer("testuser", "secret");

    mockMvc.perform(get("/orders/o-200").header(HttpHeaders.AUTHORIZATION, token))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.user_id").value("u1"));
    int requestsAfterFirstGet = ORDER_SERVICE.getRequestCount();

    mockMvc.perform(get("/orders/o-200").header(HttpHeaders.AUTHORIZATION, token))
        .andExpect(status().isOk());

    assertEquals(requestsAfterFirstGet, ORDER_SERVICE.getRequestCount());
  }

  @Test
  void unknownOrderIsNotFound() throws Exception {
    mockMvc.perform(get("/orders/missing").header(HttpHeaders.AUTHORIZATION, bearer("testuser", "secret")))
        .andExpect(status().isNotFound())
        .andExpect(content().json("{\"detail\":\"Order not found\"}", true));
  }

  @Test
  void upstreamRejectionIsPassedThrough() throws Exception {
    mockMvc.perform(post("/orders")
                        .header(HttpHeaders.AUTHORIZATION, bearer("testuser", "secret"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"u1\",\"item\":\"reject\",\"amount\":2}"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(content().json("{\"detail\":\"item out of stock\"}", true));
  }

  @Test
  void invalidOrderIsRejectedBeforeUpstream() throws Exception {
    int before = ORDER_SERVICE.getRequestCount();

    mockMvc.perform(post("/orders")
                        .header(HttpHeaders.AUTHORIZATION, bearer("testuser", "secret"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"u1\"}"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.detail").value("amount is required, item is required"));

    assertEquals(before, ORDER_SERVICE.getRequestCount());
  }

  @Test
  void fractionalAmountIsRejectedBeforeUpstream() throws Exception {
    int before = ORDER_SERVICE.getRequestCount();

    mockMvc.perform(post("/orders")
                        .header(HttpHeaders.AUTHORIZATION, bearer("testuser", "secret"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"u1\",\"item\":\"book\",\"amount\":2.7}"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.detail").value("Malformed request body"));

    assertEquals(before, ORDER_SERVICE.getRequestCount());
  }

  @Test
  void unmappedProtectedPathIsNotFound() throws Exception {
    mockMvc.perform(get("/orders/a/b").header(HttpHeaders.AUTHORIZATION, bearer("testuser", "secret")))
        .andExpect(status().isNotFound())
        .andExpect(content().json("{\"detail\":\"Not Found\"}", true));
  }

  @Test
  void fieldsMissingUpstreamStayMissing() throws Exception {
    mockMvc.perform(get("/orders/o-300").header(HttpHeaders.AUTHORIZATION, bearer("testuser", "secret")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value("o-300"))
        .andExpect(jsonPath("$.updated_at").doesNotExist());
  }

  @Test
  void disabledUserIsRejectedWithValidToken() throws Exception {
    String token = bearer("dormant", "dormant-pass");
    credentialStore.setDisabled("dormant", true);
    try {
      mockMvc.perform(get("/auth/me").header(HttpHeaders.AUTHORIZATION, token))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.detail").value("Inactive user"));
      mockMvc.perform(get("/orders/o-200").header(HttpHeaders.AUTHORIZATION, token))
          .andExpect(status().isBadRequest());
      mockMvc.perform(post("/orders")
                          .header(HttpHeaders.AUTHORIZATION, token)
                          .contentType(MediaType.APPLICATION_JSON)
                          .content("{\"user_id\":\"u3\",\"item\":\"book\",\"amount\":1}"))
          .andExpect(status().isBadRequest());
    } finally {
      credentialStore.setDisabled("dormant", false);
    }
  }

  private String bearer(String username, String password) throws Exception {
    MvcResult result = mockMvc.perform(post("/auth/login")
                                           .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                                           .param("username", username)
                                           .param("password", password))
        .andExpect(status().isOk())
        .andReturn();
    JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
    return "Bearer " + body.get("access_token").asText();
  }

  private static MockWebServer startOrderService() {
    MockWebServer server = new MockWebServer();
    server.setDispatcher(new Dispatcher() {
      @Override
      public MockResponse dispatch(RecordedRequest request) {
        String path = request.getPath();
        if ("POST".equals(request.getMethod()) && "/orders".equals(path)) {
          if (request.getBody().readUtf8().contains("\"reject\"")) {
            return json(422, "{\"detail\":\"item out of stock\"}");
          }
          return json(200, ORDER_JSON.formatted("o-100"));
        }
        if ("GET".equals(request.getMethod()) && path != null && path.startsWith("/orders/o-")) {
          return json(200, ORDER_JSON.formatted(path.substring("/orders/".length())));
        }
        if ("GET".equals(request.getMethod()) && "/orders/missing".equals(path)) {
          return json(404, "{\"detail\":\"no such order\"}");
        }
        return json(500, "{\"detail\":\"unexpected request\"}");
      }
    });
    try {
      server.start();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return server;
  }

  private static MockResponse json(int status, String body) {
    return new MockResponse()
        .setResponseCode(status)
        .setHeader("Content-Type", "application/json")
        .setBody(body);
  }
}
