package com.anthem.authguard.checker.document;

import com.anthem.authguard.core.AuthGuardProperties;
import com.anthem.authguard.core.service.S3Service;
import com.anthem.authguard.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads Swagger / OpenAPI documents declared inline, included via {@code AWS::Include},
 * stored in S3, or stored on the local filesystem.
 */
@Component
public class SwaggerDocumentResolver implements DefinitionDocumentResolver {

    private static final Logger log = LoggerFactory.getLogger(SwaggerDocumentResolver.class);

    static final String S3_SCHEME = "s3://";
    static final String INCLUDE_TRANSFORM = "AWS::Include";

    private final S3Service s3Service;
    private final AuthGuardProperties properties;

    public SwaggerDocumentResolver(S3Service s3Service, AuthGuardProperties properties) {
        this.s3Service = s3Service;
        this.properties = properties;
    }

    @Override
    public JsonNode resolve(JsonNode definitionBody, JsonNode definitionUri) {
        try {
            if (JsonUtils.isTruthy(definitionBody)) {
                return fromBody(definitionBody);
            }
            if (JsonUtils.isTruthy(definitionUri)) {
                return fromLocation(definitionUri);
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Unable to read API definition document: location={}, error={}",
                    describe(definitionBody, definitionUri), e.getMessage());
        }
        return MissingNode.getInstance();
    }

    private JsonNode fromBody(JsonNode body) throws IOException {
        JsonNode transform = body.path("Fn::Transform");
        if (INCLUDE_TRANSFORM.equals(transform.path("Name").asText())) {
            return fromLocation(transform.path("Parameters").path("Location"));
        }
        return body;
    }

    private JsonNode fromLocation(JsonNode location) throws IOException {
        if (location.isObject()) {
            return fromS3(
                    location.path("Bucket").asText(),
                    location.path("Key").asText(),
                    location.path("Version").asText(null));
        }
        if (!location.isTextual()) {
            log.debug("Unsupported definition location: {}", location);
            return MissingNode.getInstance();
        }

        String uri = location.textValue();
        if (uri.startsWith(S3_SCHEME)) {
            return fromS3Uri(uri);
        }
        return fromFile(uri);
    }

    private JsonNode fromS3Uri(String uri) {
        String remainder = uri.substring(S3_SCHEME.length());
        String version = null;
        int query = remainder.indexOf('?');
        if (query >= 0) {
            String params = remainder.substring(query + 1);
            remainder = remainder.substring(0, query);
            for (String param : params.split("&")) {
                if (param.startsWith("versionId=")) {
                    version = param.substring("versionId=".length());
                }
            }
        }

        int slash = remainder.indexOf('/');
        if (slash <= 0 || slash == remainder.length() - 1) {
            throw new IllegalArgumentException("Malformed S3 location: " + uri);
        }
        return fromS3(remainder.substring(0, slash), remainder.substring(slash + 1), version);
    }

    private JsonNode fromS3(String bucket, String key, String version) {
        if (bucket.isEmpty() || key.isEmpty()) {
            throw new IllegalArgumentException("S3 location requires Bucket and Key");
        }
        long size = s3Service.getObjectSize(bucket, key, version);
        checkSize(size, S3_SCHEME + bucket + "/" + key);
        return JsonUtils.parseDocument(s3Service.getObject(bucket, key, version));
    }

    private JsonNode fromFile(String location) throws IOException {
        Path base = Paths.get(properties.getDocuments().getBaseDirectory()).toAbsolutePath().normalize();
        Path path = base.resolve(location).normalize();
        // locations come from request templates; nothing outside the base directory is readable
        if (!path.startsWith(base) || !path.toRealPath().startsWith(base.toRealPath())) {
            throw new IllegalArgumentException("Definition location escapes the documents directory: " + location);
        }
        checkSize(Files.size(path), path.toString());
        return JsonUtils.parseDocument(Files.readString(path, StandardCharsets.UTF_8));
    }

    private void checkSize(long size, String location) {
        long limit = properties.getDocuments().getMaxDocumentBytes();
        if (size > limit) {
            throw new IllegalArgumentException(String.format(
                    "Definition document %s is %d bytes, limit is %d", location, size, limit));
        }
    }

    private static String describe(JsonNode definitionBody, JsonNode definitionUri) {
        return JsonUtils.isTruthy(definitionBody) ? "DefinitionBody" : String.valueOf(definitionUri);
    }
}
