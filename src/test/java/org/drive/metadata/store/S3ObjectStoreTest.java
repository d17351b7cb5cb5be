package org.drive.metadata.store;

import org.drive.metadata.DriveException;
import org.drive.metadata.ErrorCode;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.model.S3Exception;

import static org.assertj.core.api.Assertions.assertThat;

class S3ObjectStoreTest {

    @Test
    void translate_timeoutsBecomeRetryableTimeout() {
        DriveException call = S3ObjectStore.translate("putObject", ApiCallTimeoutException.builder().message("slow").build());
        DriveException attempt = S3ObjectStore.translate("putObject", ApiCallAttemptTimeoutException.builder().message("slow").build());

        assertThat(call.getCode()).isEqualTo(ErrorCode.TIMEOUT);
        assertThat(call.isRetryable()).isTrue();
        assertThat(attempt.getCode()).isEqualTo(ErrorCode.TIMEOUT);
    }

    @Test
    void translate_missingObjectIsNotFound() {
        DriveException e = S3ObjectStore.translate("copyObject", s3Error(404));

        assertThat(e.getCode()).isEqualTo(ErrorCode.NOT_FOUND);
        assertThat(e.isRetryable()).isFalse();
    }

    @Test
    void translate_throttlingAndServerErrorsAreUnavailable() {
        assertThat(S3ObjectStore.translate("putObject", s3Error(503)).getCode()).isEqualTo(ErrorCode.UNAVAILABLE);
        assertThat(S3ObjectStore.translate("putObject", s3Error(500)).getCode()).isEqualTo(ErrorCode.UNAVAILABLE);
        assertThat(S3ObjectStore.translate("putObject", s3Error(429)).getCode()).isEqualTo(ErrorCode.UNAVAILABLE);
    }

    @Test
    void translate_rejectedRequestIsInternal() {
        assertThat(S3ObjectStore.translate("putObject", s3Error(403)).getCode()).isEqualTo(ErrorCode.INTERNAL);
    }

    @Test
    void translate_clientFailureIsUnavailableAndKeepsCause() {
        SdkClientException cause = SdkClientException.create("connection refused");

        DriveException e = S3ObjectStore.translate("deleteObject", cause);

        assertThat(e.getCode()).isEqualTo(ErrorCode.UNAVAILABLE);
        assertThat(e.getCause()).isSameAs(cause);
    }

    private static S3Exception s3Error(int status) {
        return (S3Exception) S3Exception.builder().statusCode(status).message("status " + status).build();
    }
}
