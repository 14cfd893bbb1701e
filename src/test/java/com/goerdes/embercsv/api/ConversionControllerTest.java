package com.goerdes.embercsv.api;

import com.goerdes.embercsv.exception.ErrorKind;
import com.goerdes.embercsv.model.ConversionResult;
import com.goerdes.embercsv.model.ErrorMode;
import com.goerdes.embercsv.model.FeatureSchema;
import com.goerdes.embercsv.model.RecordFailure;
import com.goerdes.embercsv.services.JsonlConversionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Paths;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ConversionController.class)
class ConversionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JsonlConversionService conversionService;

    @Test
    void convertsWithRequestedSchemaAndMode() throws Exception {
        FeatureSchema expected = FeatureSchema.of(List.of("export_size", "label"));
        when(conversionService.convert(eq(Paths.get("/data/train.jsonl")), eq(expected), eq(ErrorMode.SKIP_AND_REPORT)))
                .thenReturn(new ConversionResult(true, Paths.get("/data/train.csv"), 3, 3, List.of(), "3 row(s) written"));

        mockMvc.perform(post("/api/convert")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\":\"/data/train.jsonl\",\"features\":[\"label\",\"export_size\"],\"errorMode\":\"SKIP_AND_REPORT\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.successful").value(true))
                .andExpect(jsonPath("$.rowsWritten").value(3));
    }

    @Test
    void usesDefaultsWhenOmitted() throws Exception {
        FeatureSchema defaults = FeatureSchema.of(List.of("machine", "label"));
        when(conversionService.defaultSchema()).thenReturn(defaults);
        when(conversionService.defaultErrorMode()).thenReturn(ErrorMode.ABORT_ON_FIRST_ERROR);
        when(conversionService.convert(any(), any(), any()))
                .thenReturn(new ConversionResult(false, Paths.get("/data/train.csv"), 1, 0,
                        List.of(new RecordFailure(1, "machine", ErrorKind.FEATURE_NOT_FOUND, "missing")),
                        "Conversion aborted: missing"));

        mockMvc.perform(post("/api/convert")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\":\"/data/train.jsonl\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.successful").value(false))
                .andExpect(jsonPath("$.failures[0].featureName").value("machine"))
                .andExpect(jsonPath("$.failures[0].kind").value("FEATURE_NOT_FOUND"));

        verify(conversionService).convert(Paths.get("/data/train.jsonl"), defaults, ErrorMode.ABORT_ON_FIRST_ERROR);
    }

    @Test
    void rejectsMissingSource() throws Exception {
        mockMvc.perform(post("/api/convert")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"features\":[\"label\"]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void rejectsBlankFeatureNames() throws Exception {
        mockMvc.perform(post("/api/convert")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\":\"/data/train.jsonl\",\"features\":[\"label\",\"\"]}"))
                .andExpect(status().isBadRequest());
    }
}
