package com.minidrive.common.client.quota;

import com.minidrive.common.dto.ApiResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class QuotaOperationsTest {

    @Mock
    private QuotaClient quotaClient;

    @InjectMocks
    private QuotaOperations quotaOperations;

    private final UUID userId = UUID.randomUUID();

    @Test
    @DisplayName("canUpload - Quota 서비스 응답의 canUpload 값을 그대로 반환")
    void canUpload_ReturnsRemoteAnswer() {
        given(quotaClient.canUpload(userId, 1024L))
                .willReturn(ApiResponse.ok(new QuotaClient.CanUploadView(false)));

        assertThat(quotaOperations.canUpload(userId, 1024L)).isFalse();
    }

    @Test
    @DisplayName("increase / decrease - 바이트 수를 요청 본문으로 전달")
    void increaseAndDecrease() {
        quotaOperations.increase(userId, 500L);
        boolean decreased = quotaOperations.decrease(userId, 200L);

        verify(quotaClient).increase(userId, new QuotaClient.BytesRequest(500L));
        verify(quotaClient).decrease(userId, new QuotaClient.BytesRequest(200L));
        assertThat(decreased).isTrue();
    }

    @Test
    @DisplayName("getQuota - 쿼터 정보 반환")
    void getQuota() {
        QuotaClient.QuotaView view = new QuotaClient.QuotaView(userId, 10, 100, 90, 10.0);
        given(quotaClient.getQuota(userId)).willReturn(ApiResponse.ok(view));

        assertThat(quotaOperations.getQuota(userId)).contains(view);
    }
}
