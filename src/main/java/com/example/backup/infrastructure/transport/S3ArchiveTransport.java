package com.example.backup.infrastructure.transport;

import com.example.backup.domain.exception.PolicyViolationException;
import com.example.backup.domain.exception.TransientIoException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.model.ServerSideEncryption;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * S3 (또는 S3 호환) 오브젝트 스토리지 아카이브
 */
@Slf4j
@RequiredArgsConstructor
public class S3ArchiveTransport implements ArchiveTransport {

    private final S3Client s3Client;
    private final String bucket;

    @Override
    public void put(String location, byte[] content) {
        PutObjectRequest putRequest = PutObjectRequest.builder()
                .bucket(bucket)
                .key(location)
                .contentLength((long) content.length)
                .serverSideEncryption(ServerSideEncryption.AES256)
                .build();
        call("put", location, () -> s3Client.putObject(putRequest, RequestBody.fromBytes(content)));
        log.debug("Uploaded object: s3://{}/{} ({} bytes)", bucket, location, content.length);
    }

    @Override
    public byte[] get(String location) {
        GetObjectRequest getRequest = GetObjectRequest.builder()
                .bucket(bucket)
                .key(location)
                .build();
        try {
            ResponseBytes<GetObjectResponse> responseBytes = call("get", location,
                    () -> s3Client.getObjectAsBytes(getRequest));
            return responseBytes.asByteArray();
        } catch (NotFound e) {
            throw new ArchiveObjectNotFoundException(location);
        }
    }

    @Override
    public Optional<ArchiveObject> stat(String location) {
        HeadObjectRequest headRequest = HeadObjectRequest.builder()
                .bucket(bucket)
                .key(location)
                .build();
        try {
            HeadObjectResponse head = call("head", location, () -> s3Client.headObject(headRequest));
            return Optional.of(new ArchiveObject(location, head.contentLength(), head.lastModified()));
        } catch (NotFound e) {
            return Optional.empty();
        }
    }

    @Override
    public void delete(String location) {
        DeleteObjectRequest deleteRequest = DeleteObjectRequest.builder()
                .bucket(bucket)
                .key(location)
                .build();
        call("delete", location, () -> s3Client.deleteObject(deleteRequest));
    }

    @Override
    public List<String> list(String prefix) {
        List<String> keys = new ArrayList<>();
        for (S3Object object : listObjects(prefix)) {
            keys.add(object.key());
        }
        keys.sort(String::compareTo);
        return keys;
    }

    @Override
    public StorageUsage usage() {
        long used = 0;
        long count = 0;
        for (S3Object object : listObjects("")) {
            used += object.size();
            count++;
        }
        return StorageUsage.unknownCapacity(used, count);
    }

    @Override
    public String describe() {
        return "s3://" + bucket;
    }

    private Iterable<S3Object> listObjects(String prefix) {
        ListObjectsV2Request listRequest = ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(prefix)
                .build();
        try {
            List<S3Object> objects = new ArrayList<>();
            s3Client.listObjectsV2Paginator(listRequest).contents().forEach(objects::add);
            return objects;
        } catch (NotFound e) {
            return List.of();
        }
    }

    /**
     * SDK 예외를 오류 분류로 변환
     * 5xx, 429, 네트워크 오류는 재시도 대상(TransientIO)
     */
    private <T> T call(String operation, String location, Supplier<T> action) {
        try {
            return action.get();
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                throw new NotFound();
            }
            if (e.statusCode() >= 500 || e.statusCode() == 429) {
                throw new TransientIoException("S3 " + operation + " failed for " + location,
                        Map.of("location", location, "status", e.statusCode()), e);
            }
            throw new PolicyViolationException("ARCHIVE_REJECTED",
                    "S3 rejected " + operation + " of " + location + ": " + e.getMessage(),
                    Map.of("location", location, "status", e.statusCode()));
        } catch (SdkClientException e) {
            throw new TransientIoException("S3 " + operation + " failed for " + location,
                    Map.of("location", location), e);
        }
    }

    private static final class NotFound extends RuntimeException {
        private NotFound() {
            super(null, null, false, false);
        }
    }
}
