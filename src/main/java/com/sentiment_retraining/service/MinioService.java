package com.sentiment_retraining.service;

import com.sentiment_retraining.config.BucketResolver;
import com.sentiment_retraining.enumeration.BucketTypeEnum;
import com.sentiment_retraining.exception.FileProcessingException;
import io.minio.GetObjectArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.InputStream;

/**
 * Stores run artifacts (serialized models and evaluation documents) in MinIO.
 * Artifact URIs have the form {@code bucket/objectKey}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MinioService {

    private final MinioClient minioClient;
    private final BucketResolver bucketResolver;

    public String uploadBytes(BucketTypeEnum bucketType, String objectKey, byte[] content, String contentType) {
        String bucketName = bucketResolver.resolve(bucketType);
        try (InputStream stream = new ByteArrayInputStream(content)) {
            minioClient.putObject(PutObjectArgs.builder()
                    .bucket(bucketName)
                    .object(objectKey)
                    .stream(stream, content.length, -1)
                    .contentType(contentType)
                    .build());
            log.info("📦 Uploaded {} bytes to {}/{}", content.length, bucketName, objectKey);
            return bucketName + "/" + objectKey;
        } catch (Exception e) {
            throw new FileProcessingException("Failed to upload artifact " + bucketName + "/" + objectKey, e);
        }
    }

    public byte[] downloadBytes(String artifactUri) {
        int separator = artifactUri == null ? -1 : artifactUri.indexOf('/');
        if (separator <= 0 || separator == artifactUri.length() - 1) {
            throw new IllegalArgumentException("Malformed artifact uri: " + artifactUri);
        }
        String bucketName = artifactUri.substring(0, separator);
        String objectKey = artifactUri.substring(separator + 1);
        if (!bucketResolver.isKnownBucket(bucketName)) {
            throw new IllegalArgumentException("Invalid bucket name: " + bucketName);
        }
        try (InputStream stream = minioClient.getObject(GetObjectArgs.builder()
                .bucket(bucketName)
                .object(objectKey)
                .build())) {
            return stream.readAllBytes();
        } catch (Exception e) {
            throw new FileProcessingException("Failed to download artifact " + artifactUri, e);
        }
    }
}
