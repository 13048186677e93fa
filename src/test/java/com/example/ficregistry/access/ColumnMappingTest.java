package com.example.ficregistry.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.ficregistry.models.PersonColumn;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ColumnMappingTest {

    @Test
    @DisplayName("first header naming a column wins and unknown headers are ignored")
    void resolve() {
        ColumnMapping mapping = ColumnMapping.resolve(List.of("Nome", "OBS", "Nome Completo", "cpf"));

        assertEquals(Optional.of(0), mapping.indexOf(PersonColumn.FULL_NAME));
        assertEquals(Optional.of(3), mapping.indexOf(PersonColumn.NATIONAL_ID));
        assertFalse(mapping.has(PersonColumn.PHONE));
        assertEquals(2, mapping.indexes().size());
    }

    @Test
    @DisplayName("short rows yield empty cells")
    void extractShortRow() {
        ColumnMapping mapping = ColumnMapping.resolve(List.of("NOME", "CPF", "TELEFONE"));

        Map<PersonColumn, String> values = mapping.extract(List.of("JOAO DA SILVA"));

        assertEquals("JOAO DA SILVA", values.get(PersonColumn.FULL_NAME));
        assertEquals("", values.get(PersonColumn.NATIONAL_ID));
        assertEquals("", values.get(PersonColumn.PHONE));
        assertTrue(values.containsKey(PersonColumn.PHONE));
    }
}
