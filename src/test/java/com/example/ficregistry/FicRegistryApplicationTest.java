package com.example.ficregistry;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;

/**
 * Boots the whole application against a temporary copy of the fixture table and checks
 * that an HTTP lookup flows through store, cipher and audit trail.
 */
@SpringBootTest
@AutoConfigureMockMvc
class FicRegistryApplicationTest {

    private static final Path DATA_DIR = createDataDir();

    @Autowired
    private MockMvc mockMvc;

    @DynamicPropertySource
    static void registryProperties(DynamicPropertyRegistry registry) {
        registry.add("registry.store.path", () -> DATA_DIR.resolve("efetivo.csv").toString());
        registry.add("registry.cipher.key-path", () -> DATA_DIR.resolve(".field.key").toString());
        registry.add("registry.audit.path", () -> DATA_DIR.resolve("audit.log").toString());
    }

    private static Path createDataDir() {
        try {
            Path dir = Files.createTempDirectory("fic-registry");
            try (InputStream in = FicRegistryApplicationTest.class.getResourceAsStream("/fixtures/efetivo.csv")) {
                Files.copy(in, dir.resolve("efetivo.csv"));
            }
            return dir;
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    @Test
    @DisplayName("FIC lookup over HTTP returns masked data and leaves a hash-only audit trail")
    void ficLookupEndToEnd() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/persons/source/encrypt").header("X-Actor", "admin"))
                .andExpect(MockMvcResultMatchers.status().isOk());

        mockMvc.perform(MockMvcRequestBuilders.get("/persons/fic")
                        .param("name", "JOAO DA SILVA")
                        .header("X-Actor", "clerk"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.person.national_id", equalTo("52****25")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.validation.results[0].status", equalTo("VALID")))
                .andExpect(MockMvcResultMatchers.content().string(not(containsString("529.982.247-25"))));

        mockMvc.perform(MockMvcRequestBuilders.get("/health"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.directory_enabled", equalTo(false)));

        assertFalse(Files.readString(DATA_DIR.resolve("efetivo.csv")).contains("529.982.247-25"));
        List<String> audit = Files.readAllLines(DATA_DIR.resolve("audit.log"), StandardCharsets.UTF_8);
        assertTrue(audit.stream().anyMatch(line -> line.contains("| source-encrypt | admin |")));
        assertTrue(audit.stream().anyMatch(line -> line.contains("| fic-projection | clerk |")));
        assertTrue(audit.stream().noneMatch(line -> line.contains("529.982.247-25") || line.contains("SILVA")));
    }
}
