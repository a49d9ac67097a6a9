package com.flamingo.reporttable.api.rest;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.reporttable.api.dto.request.ExtractTableRequest;
import com.flamingo.reporttable.config.ExtractionConfig;
import com.flamingo.reporttable.exception.GlobalExceptionHandler;
import com.flamingo.reporttable.exception.InputTooLargeException;
import com.flamingo.reporttable.exception.MalformedHtmlException;
import com.flamingo.reporttable.service.extraction.model.ExtractedTable;
import com.flamingo.reporttable.service.report.ReportService;
import com.flamingo.reporttable.service.table.CsvTableWriter;
import com.flamingo.reporttable.service.table.TableShaper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("TableController Integration Tests")
class TableControllerIntegrationTest {

  private static final String HTML = "<table><tr><th>Name</th></tr><tr><td>Bob</td></tr></table>";

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;

  @Mock private ReportService reportService;

  @BeforeEach
  void setUp() {
    TableController tableController =
        new TableController(
            reportService, new CsvTableWriter(new TableShaper()), new ExtractionConfig());
    mockMvc =
        MockMvcBuilders.standaloneSetup(tableController)
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
    objectMapper = new ObjectMapper();
  }

  @Test
  @DisplayName("Should return the extracted table as JSON")
  void shouldReturnExtractedTable() throws Exception {
    when(reportService.extractTable(HTML, 1))
        .thenReturn(new ExtractedTable(List.of("Name"), List.of(List.of("Bob"))));

    mockMvc
        .perform(
            post("/api/tables/extract")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request(HTML, null))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.tableFound").value(true))
        .andExpect(jsonPath("$.headers[0]").value("Name"))
        .andExpect(jsonPath("$.rows[0][0]").value("Bob"))
        .andExpect(jsonPath("$.rowCount").value(1))
        .andExpect(jsonPath("$.columnCount").value(1));
  }

  @Test
  @DisplayName("Should pass the requested table index")
  void shouldPassRequestedTableIndex() throws Exception {
    when(reportService.extractTable(HTML, 3)).thenReturn(ExtractedTable.empty());

    mockMvc
        .perform(
            post("/api/tables/extract")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request(HTML, 3))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.tableFound").value(false))
        .andExpect(jsonPath("$.headers").isEmpty());

    verify(reportService).extractTable(HTML, 3);
  }

  @Test
  @DisplayName("Should reject a missing html field")
  void shouldRejectMissingHtml() throws Exception {
    mockMvc
        .perform(
            post("/api/tables/extract")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tableIndex\":1}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));

    verifyNoInteractions(reportService);
  }

  @Test
  @DisplayName("Should reject a table index below one")
  void shouldRejectInvalidTableIndex() throws Exception {
    mockMvc
        .perform(
            post("/api/tables/extract")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request(HTML, 0))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));
  }

  @Test
  @DisplayName("Should map malformed HTML to 422")
  void shouldMapMalformedHtml() throws Exception {
    when(reportService.extractTable(anyString(), anyInt()))
        .thenThrow(new MalformedHtmlException("Unterminated start tag <td>", 12));

    mockMvc
        .perform(
            post("/api/tables/extract")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request("<td", null))))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("TABLE_001"))
        .andExpect(jsonPath("$.path").value("/api/tables/extract"));
  }

  @Test
  @DisplayName("Should map oversized documents to 413")
  void shouldMapInputTooLarge() throws Exception {
    when(reportService.extractTable(anyString(), anyInt()))
        .thenThrow(new InputTooLargeException(20, 10));

    mockMvc
        .perform(
            post("/api/tables/extract")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request(HTML, null))))
        .andExpect(status().isPayloadTooLarge())
        .andExpect(jsonPath("$.code").value("VALIDATION_002"));
  }

  @Test
  @DisplayName("Should return the table as a CSV attachment")
  void shouldReturnCsvAttachment() throws Exception {
    when(reportService.extractTable(HTML, 1))
        .thenReturn(new ExtractedTable(List.of("Name"), List.of(List.of("Bob"))));

    mockMvc
        .perform(
            post("/api/tables/extract/csv")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request(HTML, null))))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith("text/csv"))
        .andExpect(
            header().string("Content-Disposition", "attachment; filename=\"extracted_table.csv\""))
        .andExpect(content().string("Name\r\nBob\r\n"));
  }

  @Test
  @DisplayName("Should return no content when there is no table to export")
  void shouldReturnNoContentForEmptyCsv() throws Exception {
    when(reportService.extractTable(HTML, 1)).thenReturn(ExtractedTable.empty());

    mockMvc
        .perform(
            post("/api/tables/extract/csv")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request(HTML, null))))
        .andExpect(status().isNoContent());
  }

  private static ExtractTableRequest request(String html, Integer tableIndex) {
    return ExtractTableRequest.builder().html(html).tableIndex(tableIndex).build();
  }
}
