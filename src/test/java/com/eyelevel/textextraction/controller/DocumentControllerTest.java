package com.eyelevel.textextraction.controller;

import com.eyelevel.textextraction.dto.document.DocumentStatusResponse;
import com.eyelevel.textextraction.exception.DocumentNotFoundException;
import com.eyelevel.textextraction.exception.RetryFailedException;
import com.eyelevel.textextraction.model.DocumentRecord;
import com.eyelevel.textextraction.model.DocumentStatus;
import com.eyelevel.textextraction.model.ErrorInfo;
import com.eyelevel.textextraction.model.ErrorKind;
import com.eyelevel.textextraction.service.ingestion.IngestionCommand;
import com.eyelevel.textextraction.service.ingestion.IngestionCoordinator;
import com.eyelevel.textextraction.service.retry.RetryService;
import com.eyelevel.textextraction.service.status.DocumentStatusService;
import com.eyelevel.textextraction.support.DocumentRecords;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DocumentController.class)
class DocumentControllerTest {

    private static final Instant T0 = Instant.parse("2024-05-02T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private IngestionCoordinator ingestionCoordinator;
    @MockBean
    private DocumentStatusService documentStatusService;
    @MockBean
    private RetryService retryService;

    @Test
    void uploadReturnsCreatedWithIdAndStatus() throws Exception {
        // Given
        DocumentRecord record = DocumentRecords.processing("doc-1", "J1", T0);
        when(ingestionCoordinator.ingest(any())).thenReturn(record);
        MockMultipartFile file = new MockMultipartFile("file", "scan.pdf", "application/pdf", new byte[]{1, 2});

        // When / Then
        mockMvc.perform(multipart("/documents").file(file).param("format", "pdf"))
               .andExpect(status().isCreated())
               .andExpect(jsonPath("$.statusCode").value(201))
               .andExpect(jsonPath("$.response.id").value("doc-1"))
               .andExpect(jsonPath("$.response.status").value("PROCESSING"))
               .andExpect(jsonPath("$.response.externalJobRef").doesNotExist());

        ArgumentCaptor<IngestionCommand> command = ArgumentCaptor.forClass(IngestionCommand.class);
        verify(ingestionCoordinator).ingest(command.capture());
        assertThat(command.getValue().fileName()).isEqualTo("scan.pdf");
        assertThat(command.getValue().declaredFormat()).isEqualTo("pdf");
        assertThat(command.getValue().content()).containsExactly(1, 2);
    }

    @Test
    void emptyUploadIsRejected() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "empty.txt", "text/plain", new byte[0]);

        mockMvc.perform(multipart("/documents").file(file))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.displayMessage").value("The uploaded file is empty."));
        verifyNoInteractions(ingestionCoordinator);
    }

    @Test
    void uploadWithoutFilePartIsRejected() throws Exception {
        mockMvc.perform(multipart("/documents").param("format", "pdf"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.displayMessage").value("A file must be uploaded."));
    }

    @Test
    void statusOfCompletedDocumentCarriesText() throws Exception {
        // Given
        when(documentStatusService.getStatus("doc-2"))
                .thenReturn(DocumentStatusResponse.from(DocumentRecords.completedSync("doc-2", "hello", T0)));

        // When / Then
        mockMvc.perform(get("/documents/doc-2/status"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response.status").value("COMPLETED"))
               .andExpect(jsonPath("$.response.extractedText").value("hello"))
               .andExpect(jsonPath("$.response.errorInfo").doesNotExist());
    }

    @Test
    void statusOfUnknownDocumentIsNotFound() throws Exception {
        when(documentStatusService.getStatus("nope")).thenThrow(new DocumentNotFoundException("nope"));

        mockMvc.perform(get("/documents/nope/status"))
               .andExpect(status().isNotFound())
               .andExpect(jsonPath("$.displayMessage").value("Document with ID nope not found."));
    }

    @Test
    void retryReturnsTheNewState() throws Exception {
        // Given
        DocumentRecord pending = DocumentRecords.pendingAsync("doc-3", T0);
        when(retryService.retry("doc-3")).thenReturn(pending);

        // When / Then
        mockMvc.perform(post("/documents/doc-3/retry"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.displayMessage").value("Retry initiated successfully."))
               .andExpect(jsonPath("$.response.status").value(DocumentStatus.PENDING.name()));
    }

    @Test
    void ineligibleRetryIsConflict() throws Exception {
        when(retryService.retry("doc-4")).thenThrow(new RetryFailedException("Cannot retry: not retryable."));

        mockMvc.perform(post("/documents/doc-4/retry"))
               .andExpect(status().isConflict())
               .andExpect(jsonPath("$.displayMessage").value("Cannot retry: not retryable."));
    }

    @Test
    void failedStatusCarriesStructuredError() throws Exception {
        when(documentStatusService.getStatus("doc-5")).thenReturn(DocumentStatusResponse.from(
                DocumentRecords.failedAsync("doc-5", ErrorInfo.of(ErrorKind.DOCUMENT_PROTECTED), T0)));

        mockMvc.perform(get("/documents/doc-5/status"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response.errorInfo.kind").value("DOCUMENT_PROTECTED"))
               .andExpect(jsonPath("$.response.errorInfo.retryable").value(false))
               .andExpect(jsonPath("$.response.extractedText").doesNotExist());
    }
}
