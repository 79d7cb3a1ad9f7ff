package com.agrinova.backend.modules.device;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import com.agrinova.backend.support.AbstractPostgresIntegrationTest;
import com.agrinova.backend.support.TestAccountFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class AdminDeviceIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PASSWORD = "Tanjung#Rimba47Q";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestAccountFactory testAccountFactory;

    private String adminToken;

    @BeforeEach
    void setUp() throws Exception {
        testAccountFactory.ensureUser("it-device-admin", PASSWORD, "COMPANY_ADMIN");
        adminToken = login(webLoginBody("it-device-admin")).path("tokens").path("accessToken").asText();
    }

    @Test
    void revokedDeviceLosesAccessImmediately() throws Exception {
        UUID userId = testAccountFactory.ensureUser("it-device-revoke", PASSWORD, "MANDOR").getId();
        JsonNode tokens = login(mobileLoginBody("it-device-revoke", "ios-it-revoke", "fp-ios")).path("tokens");
        String accessToken = tokens.path("accessToken").asText();

        mockMvc.perform(get("/profile/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken))
                .andExpect(status().isOk());

        mockMvc.perform(get("/admin/users/{userId}/devices", userId)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(1))
                .andExpect(jsonPath("$.items[0].deviceId").value("ios-it-revoke"))
                .andExpect(jsonPath("$.items[0].platform").value("IOS"));

        mockMvc.perform(post("/admin/users/{userId}/devices/{deviceId}/revoke", userId, "ios-it-revoke")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("REVOKED"));

        mockMvc.perform(get("/profile/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("DEVICE_REVOKED"));
        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"refreshToken": "%s"}
                                """.formatted(tokens.path("refreshToken").asText())))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("DEVICE_REVOKED"));
        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(mobileLoginBody("it-device-revoke", "ios-it-revoke", "fp-ios")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("DEVICE_REVOKED"));
    }

    @Test
    void unbindAllowsTheDeviceToRegisterAgain() throws Exception {
        UUID userId = testAccountFactory.ensureUser("it-device-unbind", PASSWORD, "MANDOR").getId();
        String oldAccess = login(mobileLoginBody("it-device-unbind", "android-it-unbind", "fp-old"))
                .path("tokens").path("accessToken").asText();

        mockMvc.perform(delete("/admin/users/{userId}/devices/{deviceId}", userId, "android-it-unbind")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + adminToken))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/profile/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + oldAccess))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("REVOKED"));
        login(mobileLoginBody("it-device-unbind", "android-it-unbind", "fp-new"));
    }

    @Test
    void deviceAdministrationRequiresDeviceManagePermission() throws Exception {
        UUID userId = testAccountFactory.ensureUser("it-device-guard", PASSWORD, "SATPAM").getId();
        String guardToken = login(webLoginBody("it-device-guard")).path("tokens").path("accessToken").asText();

        mockMvc.perform(get("/admin/users/{userId}/devices", userId)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + guardToken))
                .andExpect(status().isForbidden());
        mockMvc.perform(post("/admin/users/{userId}/devices/{deviceId}/revoke", userId, "unknown-device")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + adminToken))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("DEVICE_NOT_FOUND"));
    }

    @Test
    void adminCanEndEverySessionOfAUser() throws Exception {
        UUID userId = testAccountFactory.ensureUser("it-device-sessions", PASSWORD, "MANDOR").getId();
        String userAccess = login(webLoginBody("it-device-sessions")).path("tokens").path("accessToken").asText();

        mockMvc.perform(post("/admin/users/{userId}/logout-all", userId)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.revokedSessions").value(1));
        mockMvc.perform(get("/profile/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + userAccess))
                .andExpect(status().isUnauthorized());
    }

    private JsonNode login(String body) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private static String webLoginBody(String username) {
        return """
                {"identifier": "%s", "password": "%s"}
                """.formatted(username, PASSWORD);
    }

    private static String mobileLoginBody(String username, String deviceId, String fingerprint) {
        String platform = deviceId.startsWith("ios") ? "IOS" : "ANDROID";
        return """
                {
                  "identifier": "%s",
                  "password": "%s",
                  "deviceId": "%s",
                  "deviceFingerprint": "%s",
                  "platform": "%s"
                }
                """.formatted(username, PASSWORD, deviceId, fingerprint, platform);
    }
}
