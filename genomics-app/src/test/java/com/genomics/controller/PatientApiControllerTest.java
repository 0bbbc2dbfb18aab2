package com.genomics.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Sql("/genomics-fixture.sql")
class PatientApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Nested
    @DisplayName("reads")
    class Reads {

        @Test
        void returnsPatientWithRecords() throws Exception {
            mockMvc.perform(get("/api/patients/P002"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.patient.name").value("Ben Carter"))
                .andExpect(jsonPath("$.patient.geneIds", hasSize(2)))
                .andExpect(jsonPath("$.geneRecords", hasSize(2)))
                .andExpect(jsonPath("$.mutationRecords[1].notation").value("A5T"));
        }

        @Test
        void unknownPatientIsNotFound() throws Exception {
            mockMvc.perform(get("/api/patients/P404"))
                .andExpect(status().isNotFound());
        }

        @Test
        void filtersByDiagnosis() throws Exception {
            mockMvc.perform(get("/api/patients").param("diagnosis", "breast carcinoma"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].id").value("P001"))
                .andExpect(jsonPath("$[1].id").value("P003"));
        }
    }

    @Nested
    @DisplayName("writes")
    class Writes {

        @Test
        void createsPatient() throws Exception {
            mockMvc.perform(post("/api/patients")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("""
                        {"patient_id": "P010", "name": "Dora Evans", "sex": "F", "stage": "2"}
                        """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.patient.stage").value("STAGE_II"));
        }

        @Test
        void existingPatientIsConflict() throws Exception {
            mockMvc.perform(post("/api/patients")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"patient_id\": \"P001\"}"))
                .andExpect(status().isConflict());
        }

        @Test
        void updatesPatient() throws Exception {
            mockMvc.perform(put("/api/patients/P003")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"age\": 48}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.patient.age").value(48))
                .andExpect(jsonPath("$.patient.name").value("Cleo Diaz"));
        }

        @Test
        void deletesPatient() throws Exception {
            mockMvc.perform(delete("/api/patients/P002"))
                .andExpect(status().isNoContent());
            mockMvc.perform(get("/api/patients/P002"))
                .andExpect(status().isNotFound());
        }

        @Test
        void addsGeneRecord() throws Exception {
            mockMvc.perform(post("/api/patients/P004/genes")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"geneId\": \"EGFR\", \"expression\": \"9.0\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.classification").value("LIKELY_PATHOGENIC"))
                .andExpect(jsonPath("$.geneRecordId").value("P004:EGFR"));
        }
    }

    @Nested
    @DisplayName("error mapping")
    class ErrorMapping {

        @Test
        void validationErrorIsBadRequest() throws Exception {
            mockMvc.perform(put("/api/patients/P001")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"age\": 200}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION"))
                .andExpect(jsonPath("$.field").value("age"));
        }

        @Test
        void structuredNameIsBadRequest() throws Exception {
            mockMvc.perform(put("/api/patients/P001")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"name\": {\"first\": \"Ada\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION"))
                .andExpect(jsonPath("$.field").value("name"));
        }

        @Test
        void duplicateGeneIsConflict() throws Exception {
            mockMvc.perform(post("/api/patients/P001/genes")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"geneId\": \"TP53\", \"expression\": 2.0}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("DUPLICATE"));
        }

        @Test
        void geneForUnknownPatientIsNotFound() throws Exception {
            mockMvc.perform(post("/api/patients/P404/genes")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"geneId\": \"TP53\", \"expression\": 2.0}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
        }

        @Test
        void malformedBodyIsBadRequest() throws Exception {
            mockMvc.perform(post("/api/patients")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{not json"))
                .andExpect(status().isBadRequest());
        }
    }
}
