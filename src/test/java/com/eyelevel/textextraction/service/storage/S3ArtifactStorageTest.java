package com.eyelevel.textextraction.service.storage;

import com.eyelevel.textextraction.exception.ArtifactStorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

import java.net.URL;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class S3ArtifactStorageTest {

    @Mock
    private S3Client s3Client;
    @Mock
    private S3Presigner s3Presigner;

    private S3ArtifactStorage storage;

    @BeforeEach
    void setUp() {
        storage = new S3ArtifactStorage(s3Client, s3Presigner, "artifacts", 30);
    }

    @Test
    void artifactIsStoredUnderSanitisedKey() {
        // Given
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenReturn(PutObjectResponse.builder().build());

        // When
        String key = storage.store("doc-1", "Q3 report (final).pdf", "application/pdf", new byte[]{1, 2, 3});

        // Then
        assertThat(key).isEqualTo("documents/doc-1/Q3_report__final_.pdf");
        ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(request.capture(), any(RequestBody.class));
        assertThat(request.getValue().bucket()).isEqualTo("artifacts");
        assertThat(request.getValue().contentType()).isEqualTo("application/pdf");
        assertThat(request.getValue().contentLength()).isEqualTo(3L);
    }

    @Test
    void failedUploadIsReportedAsStorageError() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(SdkClientException.create("Unable to execute HTTP request"));

        assertThatThrownBy(() -> storage.store("doc-2", "a.pdf", "application/pdf", new byte[]{1}))
                .isInstanceOf(ArtifactStorageException.class)
                .hasMessageContaining("doc-2");
    }

    @Test
    void storedBytesAreLoadedByKey() {
        // Given
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), new byte[]{7, 8}));

        // When
        byte[] content = storage.load("documents/doc-3/a.txt");

        // Then
        assertThat(content).containsExactly(7, 8);
    }

    @Test
    void missingObjectIsReportedAsStorageError() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("The specified key does not exist.").build());

        assertThatThrownBy(() -> storage.load("documents/doc-4/a.txt")).isInstanceOf(ArtifactStorageException.class);
    }

    @Test
    void presignedUrlUsesConfiguredDuration() throws Exception {
        // Given
        PresignedGetObjectRequest presigned = mock(PresignedGetObjectRequest.class);
        when(presigned.url()).thenReturn(new URL("https://artifacts.s3.amazonaws.com/documents/doc-5/a.pdf?X-Amz=1"));
        when(s3Presigner.presignGetObject(any(GetObjectPresignRequest.class))).thenReturn(presigned);

        // When
        URL url = storage.presignedDownloadUrl("documents/doc-5/a.pdf");

        // Then
        assertThat(url.getPath()).isEqualTo("/documents/doc-5/a.pdf");
        ArgumentCaptor<GetObjectPresignRequest> request = ArgumentCaptor.forClass(GetObjectPresignRequest.class);
        verify(s3Presigner).presignGetObject(request.capture());
        assertThat(request.getValue().signatureDuration()).isEqualTo(Duration.ofMinutes(30));
        assertThat(request.getValue().getObjectRequest().key()).isEqualTo("documents/doc-5/a.pdf");
    }
}
