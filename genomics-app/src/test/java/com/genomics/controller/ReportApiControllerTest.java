package com.genomics.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Sql("/genomics-fixture.sql")
class ReportApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void reportsOverFilteredRows() throws Exception {
        mockMvc.perform(post("/api/reports/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"filter": {"diagnosis": "Breast carcinoma", "not": {"gene": "BRCA1"}}, "topN": 5}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.aggregations.classificationCounts[0].key").value("benign"))
            .andExpect(jsonPath("$.aggregations.classificationCounts[0].value").value(2))
            .andExpect(jsonPath("$.aggregations.expressionByGene", hasSize(2)))
            .andExpect(jsonPath("$.aggregations.topMutatedGenes[0].key").value("TP53"))
            .andExpect(jsonPath("$.aggregations.topMutatedGenes[0].value").value(1));
    }

    @Test
    void listsMatchingPatients() throws Exception {
        mockMvc.perform(post("/api/reports/patients")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"filter": {"anyOf": [{"classification": "pathogenic"}, {"gene": "BRCA1"}]}}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(2)))
            .andExpect(jsonPath("$[0].id").value("P002"))
            .andExpect(jsonPath("$[1].id").value("P003"));
    }

    @Test
    void unknownClassificationIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/reports/rows")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"filter\": {\"classification\": \"dangerous\"}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.field").value("classification"));
    }

    @Test
    void importsRowsAndReportsEachOne() throws Exception {
        mockMvc.perform(post("/api/import")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    [
                      {"patient_id": "P020", "name": "Finn Grey", "gene_id": "TP53", "expression": "0.2"},
                      {"patient_id": "P001", "gene_id": "TP53", "expression": "1.0"},
                      {"patient_id": "P021", "gene_id": "EGFR"}
                    ]
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.succeeded").value(1))
            .andExpect(jsonPath("$.failed").value(2))
            .andExpect(jsonPath("$.rows[0].classification").value("LIKELY_PATHOGENIC"))
            .andExpect(jsonPath("$.rows[1].status").value("DUPLICATE"))
            .andExpect(jsonPath("$.rows[2].status").value("INVALID"));
    }

    @Test
    void showsCurrentCatalog() throws Exception {
        mockMvc.perform(get("/api/catalog"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.version").value("catalog-test"))
            .andExpect(jsonPath("$.genes", hasSize(3)))
            .andExpect(jsonPath("$.staleRecords").value(0));
    }

    @Test
    void refusesCatalogReplacementUnderCurrentVersion() throws Exception {
        mockMvc.perform(put("/api/catalog")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"version": "catalog-test",
                     "genes": [{"geneId": "TP53", "expectedMin": 100, "expectedMax": 200, "oncogene": true}]}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION"))
            .andExpect(jsonPath("$.field").value("version"));

        mockMvc.perform(get("/api/catalog"))
            .andExpect(jsonPath("$.version").value("catalog-test"))
            .andExpect(jsonPath("$.genes", hasSize(3)));
    }

    @Test
    void reclassifiesStaleRecords() throws Exception {
        mockMvc.perform(post("/api/catalog/reclassify"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.reclassified").value(0));
    }
}
