package com.eyelevel.textextraction.service.storage;

import com.eyelevel.textextraction.exception.ArtifactStorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.net.URL;
import java.time.Duration;

/**
 * {@link ArtifactStorage} on AWS S3. Objects are stored under {@code documents/{id}/{fileName}}.
 */
@Slf4j
@Service
public class S3ArtifactStorage implements ArtifactStorage {

    private final S3Client s3Client;
    private final S3Presigner s3Presigner;
    private final String bucketName;
    private final long presignedUrlDurationMinutes;

    public S3ArtifactStorage(final S3Client s3Client, final S3Presigner s3Presigner,
                             @Value("${aws.s3.bucket}") final String bucketName,
                             @Value("${aws.s3.presigned-url-duration-minutes}") final long presignedUrlDurationMinutes) {
        this.s3Client = s3Client;
        this.s3Presigner = s3Presigner;
        this.bucketName = bucketName;
        this.presignedUrlDurationMinutes = presignedUrlDurationMinutes;
        log.info("S3ArtifactStorage initialized for bucket '{}' with a pre-signed URL duration of {} minutes.",
                 bucketName, presignedUrlDurationMinutes);
    }

    @Override
    public String store(final String documentId, final String fileName, final String contentType,
                        final byte[] content) {
        final String key = constructKey(documentId, fileName);
        try {
            final PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucketName)
                    .key(key)
                    .contentType(contentType)
                    .contentLength((long) content.length)
                    .build();
            s3Client.putObject(request, RequestBody.fromBytes(content));
            log.info("Stored artifact for document {} at S3 key: {}", documentId, key);
            return key;
        } catch (final SdkException e) {
            log.error("Failed to store artifact for document {} at S3 key: {}", documentId, key, e);
            throw new ArtifactStorageException("Failed to store artifact for document " + documentId, e);
        }
    }

    @Override
    public byte[] load(final String storageKey) {
        log.debug("Downloading object from S3 key: {}", storageKey);
        try {
            final GetObjectRequest request = GetObjectRequest.builder().bucket(bucketName).key(storageKey).build();
            return s3Client.getObjectAsBytes(request).asByteArray();
        } catch (final SdkException e) {
            log.error("Failed to read artifact from S3 key: {}", storageKey, e);
            throw new ArtifactStorageException("Failed to read artifact " + storageKey, e);
        }
    }

    @Override
    public URL presignedDownloadUrl(final String storageKey) {
        log.debug("Generating pre-signed download URL for S3 key: {}", storageKey);
        final GetObjectRequest getObjectRequest = GetObjectRequest.builder().bucket(bucketName).key(storageKey)
                                                                  .build();
        final GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                .signatureDuration(Duration.ofMinutes(presignedUrlDurationMinutes))
                .getObjectRequest(getObjectRequest)
                .build();
        return s3Presigner.presignGetObject(presignRequest).url();
    }

    static String constructKey(final String documentId, final String fileName) {
        final String safeFileName = fileName.replaceAll("[^a-zA-Z0-9.\\-_]", "_");
        return String.format("documents/%s/%s", documentId, safeFileName);
    }
}
