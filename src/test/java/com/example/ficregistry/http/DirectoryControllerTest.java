package com.example.ficregistry.http;

import static org.hamcrest.Matchers.equalTo;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.example.ficregistry.models.PersonRecord;
import com.example.ficregistry.service.PersonRegistryException;
import com.example.ficregistry.service.RemoteDirectoryClient;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;

@WebMvcTest(controllers = DirectoryController.class, properties = "registry.directory.enabled=true")
@Import({RequestIdFilter.class, ApiExceptionHandler.class})
class DirectoryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RemoteDirectoryClient client;

    @Test
    @DisplayName("remote record is returned masked")
    void fetch() throws Exception {
        when(client.fetchByIdentifier("1234567", "system")).thenReturn(Optional.of(PersonRecord.builder()
                .fullName("JOAO DA SILVA")
                .registrationNumber("1234567")
                .build()));

        mockMvc.perform(MockMvcRequestBuilders.get("/directory/persons/1234567"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.registration_number", equalTo("12****67")));
    }

    @Test
    void miss() throws Exception {
        when(client.fetchByIdentifier(eq("999"), anyString())).thenReturn(Optional.empty());

        mockMvc.perform(MockMvcRequestBuilders.get("/directory/persons/999"))
                .andExpect(MockMvcResultMatchers.status().isNotFound());
    }

    @Test
    @DisplayName("SECURITY_VIOLATION maps to 403 and FETCH_FAILED to 502")
    void errors() throws Exception {
        when(client.fetchByIdentifier(eq("bad-id"), anyString()))
                .thenThrow(PersonRegistryException.securityViolation("Identifier has an invalid format"));
        when(client.fetchByIdentifier(eq("down"), anyString()))
                .thenThrow(PersonRegistryException.fetchFailed(3, new RuntimeException("timeout")));

        mockMvc.perform(MockMvcRequestBuilders.get("/directory/persons/bad-id"))
                .andExpect(MockMvcResultMatchers.status().isForbidden())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("SECURITY_VIOLATION")));
        mockMvc.perform(MockMvcRequestBuilders.get("/directory/persons/down"))
                .andExpect(MockMvcResultMatchers.status().isBadGateway())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("FETCH_FAILED")));
    }
}
