package com.enterprise.sheetconvert.storage;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.PresignedPutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.model.PutObjectPresignRequest;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class S3BlobStoreTest {

    private final S3Client s3Client = mock(S3Client.class);
    private final S3Presigner presigner = mock(S3Presigner.class);
    private final S3BlobStore store = new S3BlobStore(s3Client, presigner, "documents");

    @Test
    void uploadUrlIsAContentTypeBoundPut() throws Exception {
        PresignedPutObjectRequest presigned = mock(PresignedPutObjectRequest.class);
        when(presigned.url()).thenReturn(URI.create("https://documents.s3.amazonaws.com/uploads/o/j/a.pdf?X-Amz-Signature=abc").toURL());
        when(presigned.signedHeaders()).thenReturn(Map.of(
                "host", List.of("documents.s3.amazonaws.com"),
                "content-type", List.of("application/pdf")));
        when(presigned.expiration()).thenReturn(Instant.parse("2026-01-01T00:15:00Z"));
        when(presigner.presignPutObject(any(PutObjectPresignRequest.class))).thenReturn(presigned);

        PresignedUrl url = store.issueUploadUrl("uploads/o/j/a.pdf", "application/pdf", Duration.ofMinutes(15));

        assertThat(url.getMethod()).isEqualTo("PUT");
        assertThat(url.getHeaders()).containsOnly(Map.entry("content-type", "application/pdf"));
        ArgumentCaptor<PutObjectPresignRequest> captor = ArgumentCaptor.forClass(PutObjectPresignRequest.class);
        verify(presigner).presignPutObject(captor.capture());
        assertThat(captor.getValue().signatureDuration()).isEqualTo(Duration.ofMinutes(15));
        assertThat(captor.getValue().putObjectRequest().contentType()).isEqualTo("application/pdf");
        assertThat(captor.getValue().putObjectRequest().bucket()).isEqualTo("documents");
    }

    @Test
    void sizeOfReportsMissingObjectsAsEmpty() {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
                .thenReturn(HeadObjectResponse.builder().contentLength(42L).build())
                .thenThrow(NoSuchKeyException.builder().message("missing").build())
                .thenThrow(S3Exception.builder().statusCode(404).message("Not Found").build());

        assertThat(store.sizeOf("k")).contains(42L);
        assertThat(store.sizeOf("k")).isEmpty();
        assertThat(store.sizeOf("k")).isEmpty();
    }

    @Test
    void sizeOfFailsOnOtherErrors() {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
                .thenThrow(S3Exception.builder().statusCode(403).message("Access Denied").build());

        assertThatThrownBy(() -> store.sizeOf("k")).isInstanceOf(BlobStoreException.class);
    }

    @Test
    void clientErrorsAreWrapped() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class))).thenThrow(SdkClientException.create("timeout"));
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(SdkClientException.create("timeout"));

        assertThatThrownBy(() -> store.get("k")).isInstanceOf(BlobStoreException.class).hasMessageContaining("s3://documents/k");
        assertThatThrownBy(() -> store.put("k", new byte[] { 1 }, "application/pdf")).isInstanceOf(BlobStoreException.class);
    }
}
