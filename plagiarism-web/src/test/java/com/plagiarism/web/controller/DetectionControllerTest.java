package com.plagiarism.web.controller;

import com.plagiarism.common.dto.DetectionReport;
import com.plagiarism.common.dto.SourceUnit;
import com.plagiarism.common.dto.Submission;
import com.plagiarism.common.exception.ConfigurationException;
import com.plagiarism.common.exception.KeyPoolExhaustedException;
import com.plagiarism.common.exception.SubmissionIntakeException;
import com.plagiarism.engine.config.EngineProperties;
import com.plagiarism.engine.service.DetectionService;
import com.plagiarism.intake.service.SubmissionLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class DetectionControllerTest {

    @Mock
    private SubmissionLoader submissionLoader;
    @Mock
    private DetectionService detectionService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        DetectionController controller = new DetectionController(
                submissionLoader, detectionService, new EngineProperties());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static DetectionReport report(int total) {
        return DetectionReport.builder()
                .runId("run_test")
                .filterMode("THRESHOLD")
                .totalSubmissions(total)
                .verdicts(List.of())
                .invalidSubmissions(List.of())
                .anomalyWarnings(Map.of())
                .build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void detectAssemblesUploadedFiles() throws Exception {
        Submission s1 = mock(Submission.class);
        Submission s2 = mock(Submission.class);
        when(submissionLoader.assemble(eq("s1"), anyList(), eq(":00000001FF"))).thenReturn(s1);
        when(submissionLoader.assemble(eq("s2"), anyList(), isNull())).thenReturn(s2);
        when(detectionService.detect(List.of(s1, s2))).thenReturn(report(2));

        String body = """
                {"submissions": [
                  {"studentId": " s1 ", "files": [{"fileName": "main.a51", "content": "MOV A,#1"}],
                   "hexText": ":00000001FF"},
                  {"studentId": "s2", "files": [{"fileName": "main.c", "content": "void main(){}"}]}
                ]}
                """;

        mockMvc.perform(post("/api/detections").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("OK"))
                .andExpect(jsonPath("$.message").value("检测完成"))
                .andExpect(jsonPath("$.data.runId").value("run_test"))
                .andExpect(jsonPath("$.data.totalSubmissions").value(2));

        ArgumentCaptor<List<SourceUnit>> units = ArgumentCaptor.forClass(List.class);
        verify(submissionLoader).assemble(eq("s1"), units.capture(), eq(":00000001FF"));
        assertThat(units.getValue()).singleElement().satisfies(u -> {
            assertThat(u.getFileName()).isEqualTo("main.a51");
            assertThat(u.getRawText()).isEqualTo("MOV A,#1");
        });
    }

    @Test
    void emptyRequestIsRejected() throws Exception {
        mockMvc.perform(post("/api/detections").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"submissions\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INTAKE_ERROR"));

        verifyNoInteractions(detectionService);
    }

    @Test
    void missingStudentIdIsRejected() throws Exception {
        mockMvc.perform(post("/api/detections").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"submissions\": [{\"files\": []}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INTAKE_ERROR"));
    }

    @Test
    void nullFileEntryIsRejected() throws Exception {
        mockMvc.perform(post("/api/detections").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"submissions\": [{\"studentId\": \"s1\", \"files\": [null]}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INTAKE_ERROR"))
                .andExpect(jsonPath("$.message").value("学生 s1 的源文件缺少文件名"));

        verifyNoInteractions(submissionLoader, detectionService);
    }

    @Test
    void nullSubmissionEntryIsRejected() throws Exception {
        mockMvc.perform(post("/api/detections").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"submissions\": [null]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INTAKE_ERROR"));
    }

    @Test
    void configurationErrorMapsToBadRequest() throws Exception {
        when(submissionLoader.assemble(any(), anyList(), any())).thenReturn(mock(Submission.class));
        when(detectionService.detect(anyList())).thenThrow(new ConfigurationException("topPercent 必须在 (0, 1] 内"));

        mockMvc.perform(post("/api/detections").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"submissions\": [{\"studentId\": \"s1\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("CONFIG_ERROR"))
                .andExpect(jsonPath("$.message").value("topPercent 必须在 (0, 1] 内"));
    }

    @Test
    void exhaustedKeyPoolIsServiceUnavailable() throws Exception {
        when(submissionLoader.assemble(any(), anyList(), any())).thenReturn(mock(Submission.class));
        when(detectionService.detect(anyList())).thenThrow(new KeyPoolExhaustedException("等待 30 秒仍无可用 Key"));

        mockMvc.perform(post("/api/detections").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"submissions\": [{\"studentId\": \"s1\"}]}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("KEY_EXHAUSTED"));
    }

    @Test
    void scanLoadsDirectory() throws Exception {
        List<Submission> loaded = List.of(mock(Submission.class));
        when(submissionLoader.loadDirectory(Path.of("/data/lab3"))).thenReturn(loaded);
        when(detectionService.detect(loaded)).thenReturn(report(1));

        mockMvc.perform(post("/api/detections/scan").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"root\": \"/data/lab3\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.totalSubmissions").value(1));
    }

    @Test
    void scanOfMissingRootReportsIntakeError() throws Exception {
        when(submissionLoader.loadDirectory(any()))
                .thenThrow(new SubmissionIntakeException("作业根目录不存在: /nope"));

        mockMvc.perform(post("/api/detections/scan").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"root\": \"/nope\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INTAKE_ERROR"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/detections").contentType(MediaType.APPLICATION_JSON).content("{"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void configReturnsEngineSettings() throws Exception {
        mockMvc.perform(get("/api/detections/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.filterMode").value("THRESHOLD"))
                .andExpect(jsonPath("$.data.fallbackThreshold").value(0.85));
    }
}
