package com.anthem.authguard.core.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Thin wrapper over the S3 client for reading template artifacts.
 */
@Service
public class S3Service {

    private static final Logger log = LoggerFactory.getLogger(S3Service.class);

    private final S3Client s3Client;

    public S3Service(S3Client s3Client) {
        this.s3Client = Objects.requireNonNull(s3Client, "s3Client");
    }

    /**
     * Read an object as UTF-8 text.
     *
     * @param bucket  bucket name
     * @param key     object key
     * @param version object version, or null for the latest
     * @return the object content
     */
    public String getObject(String bucket, String key, String version) {
        GetObjectRequest.Builder request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key);
        if (version != null && !version.isEmpty()) {
            request.versionId(version);
        }

        log.debug("Reading s3://{}/{} version={}", bucket, key, version);
        ResponseBytes<GetObjectResponse> bytes = s3Client.getObjectAsBytes(request.build());
        return bytes.asString(StandardCharsets.UTF_8);
    }

    /**
     * Size of an object in bytes, without downloading it.
     */
    public long getObjectSize(String bucket, String key, String version) {
        HeadObjectRequest.Builder request = HeadObjectRequest.builder()
                .bucket(bucket)
                .key(key);
        if (version != null && !version.isEmpty()) {
            request.versionId(version);
        }
        Long length = s3Client.headObject(request.build()).contentLength();
        return length == null ? 0L : length;
    }
}
