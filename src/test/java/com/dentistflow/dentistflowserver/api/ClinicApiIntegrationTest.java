package com.dentistflow.dentistflowserver.api;

import com.dentistflow.dentistflowserver.dto.RegisterRequest;
import com.dentistflow.dentistflowserver.repository.AppointmentRepository;
import com.dentistflow.dentistflowserver.repository.UserRepository;
import com.dentistflow.dentistflowserver.services.SmsSender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ClinicApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private ObjectMapper objectMapper;
    @Autowired
    private AppointmentRepository appointmentRepository;
    @Autowired
    private UserRepository userRepository;

    @MockBean
    private SmsSender smsSender;

    @AfterEach
    void cleanUp() {
        appointmentRepository.deleteAll();
        userRepository.deleteAll();
    }

    private long register(String name, String email, String role, String phone) throws Exception {
        String body = objectMapper.writeValueAsString(
                new RegisterRequest(name, email, "longenough1", role, phone));
        MvcResult result = mockMvc.perform(post("/auth/register").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.password").doesNotExist())
                .andReturn();
        return json(result).get("id").asLong();
    }

    private String login(String email) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"" + email + "\",\"password\":\"longenough1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.password").doesNotExist())
                .andReturn();
        return "Bearer " + json(result).get("token").asText();
    }

    private long book(String token, String start, String end) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/appointments").header("Authorization", token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"startTime\":\"" + start + "\",\"endTime\":\"" + end
                                + "\",\"service\":\"Cleaning\",\"patientId\":\"424242\"}"))
                .andExpect(status().isCreated())
                .andReturn();
        return json(result).get("id").asLong();
    }

    private JsonNode json(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    void appointmentLifecycle() throws Exception {
        long aliceId = register("Alice Martin", "alice@example.com", null, "+261340000000");
        register("Bob Rakoto", "bob@example.com", "client", null);
        register("Dr Rabe", "rabe@example.com", "dentist", null);
        String alice = login("alice@example.com");
        String bob = login("bob@example.com");
        String dentist = login("rabe@example.com");

        long aliceAppt = book(alice, "2024-07-01T08:00:00Z", "2024-07-01T09:00:00Z");
        book(bob, "2024-07-31T23:00:00Z", "2024-07-31T23:30:00Z");

        verify(smsSender, timeout(2000)).send(eq("+261340000000"), startsWith("Appointment Confirmed: Cleaning"));

        // clients are scoped to themselves, patientId is ignored
        mockMvc.perform(get("/api/appointments").header("Authorization", alice).param("patientId", "999"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].patientId").value(aliceId))
                .andExpect(jsonPath("$[0].patientName").value("Alice Martin"))
                .andExpect(jsonPath("$[0].status").value("Scheduled"));

        // staff view, both date bounds inclusive
        mockMvc.perform(get("/api/appointments").header("Authorization", dentist)
                        .param("startDate", "2024-07-01").param("endDate", "2024-07-31"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].id").value(aliceAppt));

        mockMvc.perform(get("/api/appointment/user/" + aliceId).header("Authorization", dentist))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[1].id").value(aliceAppt));

        mockMvc.perform(get("/api/appointments").header("Authorization", dentist).param("startDate", "2024-07-02"))
                .andExpect(jsonPath("$", hasSize(1)));

        // clients cannot modify
        mockMvc.perform(put("/api/appointments/" + aliceAppt).header("Authorization", alice)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"status\":\"Done\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.kind").value("PERMISSION_DENIED"));

        mockMvc.perform(put("/api/appointments/" + aliceAppt).header("Authorization", dentist)
                        .contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("No fields to update"));

        mockMvc.perform(put("/api/appointments/" + aliceAppt).header("Authorization", dentist)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"service\":\"X-Ray\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.service").value("X-Ray"))
                .andExpect(jsonPath("$.data.status").value("Scheduled"));

        mockMvc.perform(patch("/api/appointments/" + aliceAppt + "/cancel").header("Authorization", dentist))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("Cancelled"));

        verify(smsSender, timeout(2000)).send(eq("+261340000000"), startsWith("Appointment Cancelled: X-Ray"));

        mockMvc.perform(get("/api/appointments/" + aliceAppt).header("Authorization", alice))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("Cancelled"));

        mockMvc.perform(patch("/api/appointments/987654/cancel").header("Authorization", dentist))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"));
    }

    @Test
    void nonClientsCannotBook() throws Exception {
        register("Sam Staff", "sam@example.com", "staff", null);
        String staff = login("sam@example.com");

        mockMvc.perform(post("/api/appointments").header("Authorization", staff)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"startTime\":\"2024-07-01T08:00:00Z\",\"endTime\":\"2024-07-01T09:00:00Z\",\"service\":\"Cleaning\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("Only clients can book appointments."));

        assertThat(appointmentRepository.count()).isZero();
    }

    @Test
    void smsFailureDoesNotFailBooking() throws Exception {
        doThrow(new RuntimeException("provider down")).when(smsSender).send(anyString(), anyString());
        register("Alice Martin", "alice@example.com", null, "+261340000000");
        String alice = login("alice@example.com");

        book(alice, "2024-07-01T08:00:00Z", "2024-07-01T09:00:00Z");

        assertThat(appointmentRepository.count()).isEqualTo(1);
    }

    @Test
    void authenticationErrors() throws Exception {
        register("Alice Martin", "alice@example.com", null, null);

        mockMvc.perform(get("/api/appointments"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.kind").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.message").value("Authorization header required"));

        mockMvc.perform(get("/api/appointments").header("Authorization", "Bearer nonsense"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid token"));

        String wrongPassword = mockMvc.perform(post("/auth/login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"alice@example.com\",\"password\":\"not-the-one\"}"))
                .andExpect(status().isUnauthorized())
                .andReturn().getResponse().getContentAsString();
        String unknownEmail = mockMvc.perform(post("/auth/login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"ghost@example.com\",\"password\":\"longenough1\"}"))
                .andExpect(status().isUnauthorized())
                .andReturn().getResponse().getContentAsString();

        assertThat(objectMapper.readTree(wrongPassword).get("message"))
                .isEqualTo(objectMapper.readTree(unknownEmail).get("message"));
    }

    @Test
    void registrationValidationAndConflict() throws Exception {
        mockMvc.perform(post("/auth/register").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fullName\":\"A\",\"email\":\"not-an-email\",\"password\":\"short\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"));

        register("Alice Martin", "alice@example.com", null, null);

        mockMvc.perform(post("/auth/register").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fullName\":\"Alice Bis\",\"email\":\"alice@example.com\",\"password\":\"longenough1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("CONFLICT"));
    }

    @Test
    void profileActsOnSessionIdentity() throws Exception {
        long aliceId = register("Alice Martin", "alice@example.com", null, null);
        String alice = login("alice@example.com");

        mockMvc.perform(get("/api/user/12345").header("Authorization", alice))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(aliceId))
                .andExpect(jsonPath("$.role").value("client"))
                .andExpect(jsonPath("$.password").doesNotExist());

        mockMvc.perform(put("/api/user/" + aliceId).header("Authorization", alice)
                        .contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(put("/api/user/" + aliceId).header("Authorization", alice)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"fullName\":\"Alice Rasoa\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.fullName").value("Alice Rasoa"));
    }
}
